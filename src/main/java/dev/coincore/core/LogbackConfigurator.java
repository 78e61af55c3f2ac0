/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.core;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import java.util.Locale;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/** Configures CoinCore console logging for Logback backends. */
final class LogbackConfigurator {
  private static final org.slf4j.Logger LOG = LoggerFactory.getLogger("coincore");
  static final String CONSOLE_APPENDER = "coincore-console";

  /** Pool and driver loggers; raised to WARN when the configured level is INFO. */
  static final String[] DEPENDENCY_LOGGERS = {"com.zaxxer.hikari", "org.mariadb.jdbc"};

  private LogbackConfigurator() {}

  static void configure(Config.Log logCfg) {
    if (logCfg == null) {
      return;
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      configure(context, logCfg);
    } else {
      LOG.debug(
          "(coincore) skipping logback configuration; factory is {}", factory.getClass().getName());
    }
  }

  static void configure(LoggerContext context, Config.Log logCfg) {
    if (context == null || logCfg == null) {
      return;
    }
    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    Level level = levelFrom(logCfg.level());
    if (level == null) {
      level = Level.INFO;
      LOG.warn("(coincore) invalid core.log.level {}; defaulting to INFO", logCfg.level());
    }
    root.setLevel(level);
    Level dependencies = level.toInt() == Level.INFO_INT ? Level.WARN : level;
    for (String name : DEPENDENCY_LOGGERS) {
      context.getLogger(name).setLevel(dependencies);
    }

    if (root.getAppender(CONSOLE_APPENDER) != null) {
      root.detachAppender(CONSOLE_APPENDER);
    }
    if (logCfg.json()) {
      attachJsonAppender(context, root);
    } else {
      attachPatternAppender(context, root);
    }
  }

  private static void attachPatternAppender(LoggerContext context, Logger root) {
    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern("%d{ISO8601} %-5level [%thread] %logger{36} - %msg%n");
    encoder.start();
    attach(context, root, encoder);
  }

  private static void attachJsonAppender(LoggerContext context, Logger root) {
    CoinCoreJsonLayout layout = new CoinCoreJsonLayout();
    layout.setContext(context);
    layout.start();

    LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
    encoder.setContext(context);
    encoder.setLayout(layout);
    encoder.start();
    attach(context, root, encoder);
  }

  private static void attach(
      LoggerContext context,
      Logger root,
      ch.qos.logback.core.encoder.Encoder<ILoggingEvent> encoder) {
    ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
    console.setName(CONSOLE_APPENDER);
    console.setContext(context);
    console.setEncoder(encoder);
    console.start();
    root.addAppender(console);
  }

  private static Level levelFrom(String level) {
    if (level == null) {
      return null;
    }
    String normalized = level.trim().toUpperCase(Locale.ROOT);
    Level parsed = Level.toLevel(normalized, null);
    return parsed != null && parsed.toString().equals(normalized) ? parsed : null;
  }
}
