/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.core;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Hands the {@code core.log} block to the Logback backend when it is on the classpath. */
final class LoggingConfigurator {
  private static final Logger LOG = LoggerFactory.getLogger("coincore");
  private static final String LOGBACK_CLASS = "dev.coincore.core.LogbackConfigurator";

  private LoggingConfigurator() {}

  /**
   * @return {@code true} when a backend accepted the configuration
   */
  static boolean configure(Config.Log logCfg) {
    if (logCfg == null) {
      return false;
    }
    try {
      Class<?> configurator = Class.forName(LOGBACK_CLASS);
      Method configure = configurator.getDeclaredMethod("configure", Config.Log.class);
      configure.setAccessible(true);
      configure.invoke(null, logCfg);
      return true;
    } catch (ClassNotFoundException | NoClassDefFoundError e) {
      LOG.debug("(coincore) logback backend not detected; leaving logging at defaults");
    } catch (InvocationTargetException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      LOG.warn("(coincore) failed to configure logging: {}", cause.getMessage(), cause);
    } catch (ReflectiveOperationException e) {
      LOG.warn("(coincore) failed to configure logging: {}", e.getMessage(), e);
    }
    return false;
  }
}
