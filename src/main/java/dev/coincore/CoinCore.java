/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore;

import dev.coincore.api.CoinCoreApi;
import dev.coincore.core.Config;
import dev.coincore.core.CoreServices;
import dev.coincore.core.Services;
import dev.coincore.modules.scheduler.SchedulerEngine;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CoinCore entrypoint.
 *
 * <p>Boot sequence:
 *
 * <ol>
 *   <li>Load config (writes default JSON5 if missing)
 *   <li>Start services (logging, Hikari pool, migrations, event bus, engines)
 *   <li>Expose services through {@link CoinCoreApi}
 *   <li>Start the scheduler (daily interest)
 * </ol>
 */
public final class CoinCore implements AutoCloseable {
  /** Logger name shared by every CoinCore component. */
  public static final String ID = "coincore";

  private static final Logger LOG = LoggerFactory.getLogger(ID);

  private final Config config;
  private final Services services;
  private final SchedulerEngine scheduler;
  private volatile boolean closed;

  private CoinCore(Config config, Services services, SchedulerEngine scheduler) {
    this.config = config;
    this.services = services;
    this.scheduler = scheduler;
  }

  /**
   * Boots the engine from a config file.
   *
   * @param configPath JSON5 config location; a default is written when missing
   * @return running instance, to be closed on shutdown
   */
  public static CoinCore start(Path configPath) {
    LOG.info("(coincore) booting CoinCore 1.0.0");
    Config cfg = Config.loadOrWriteDefault(configPath);
    Services services = CoreServices.start(cfg);
    try {
      CoinCoreApi.bootstrap(services);
      SchedulerEngine scheduler = new SchedulerEngine();
      scheduler.start(services, cfg);
      LOG.info("(coincore) initialized");
      return new CoinCore(cfg, services, scheduler);
    } catch (RuntimeException e) {
      CoinCoreApi.clear();
      try {
        services.shutdown();
      } catch (IOException closeError) {
        e.addSuppressed(closeError);
      }
      throw e;
    }
  }

  public Config config() {
    return config;
  }

  public Services services() {
    return services;
  }

  public SchedulerEngine scheduler() {
    return scheduler;
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    scheduler.stop();
    CoinCoreApi.clear();
    try {
      services.shutdown();
    } catch (IOException e) {
      throw new UncheckedIOException("CoinCore shutdown failed", e);
    }
    LOG.info("(coincore) stopped");
  }

  /**
   * Runs CoinCore standalone until the JVM is asked to stop.
   *
   * @param args optional config path, defaults to {@code config/coincore.json5}
   * @throws InterruptedException if the main thread is interrupted while waiting
   */
  public static void main(String[] args) throws InterruptedException {
    Path cfgPath = args.length > 0 ? Path.of(args[0]) : Path.of("config", "coincore.json5");
    CoinCore app = start(cfgPath);
    CountDownLatch stopped = new CountDownLatch(1);
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  try {
                    app.close();
                  } catch (RuntimeException e) {
                    LOG.warn("(coincore) shutdown error", e);
                  } finally {
                    stopped.countDown();
                  }
                },
                "coincore-shutdown"));
    stopped.await();
  }
}
