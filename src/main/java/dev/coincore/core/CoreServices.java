/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.core;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import dev.coincore.api.Accounts;
import dev.coincore.api.Bank;
import dev.coincore.api.Checkin;
import dev.coincore.api.Rankings;
import dev.coincore.api.Robbery;
import dev.coincore.api.Work;
import dev.coincore.api.events.EconomyEvents;
import dev.coincore.api.storage.LedgerStore;
import dev.coincore.util.RandomSource;
import java.io.Closeable;
import java.io.IOException;
import java.sql.SQLException;
import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires together all engine implementations and manages shared resources (Hikari pool, scheduler,
 * event bus, metrics).
 */
public final class CoreServices implements Services, Closeable {
  private static final Logger LOG = LoggerFactory.getLogger("coincore");

  private final HikariDataSource pool;
  private final EventBus events;
  private final Accounts accounts;
  private final Checkin checkin;
  private final Work work;
  private final Bank bank;
  private final Robbery robbery;
  private final Rankings rankings;
  private final ScheduledExecutorService scheduler;
  private final Metrics metrics;

  private CoreServices(
      HikariDataSource pool,
      EventBus events,
      EngineContext ctx,
      Config.Economy economy,
      ScheduledExecutorService scheduler,
      Metrics metrics) {
    this.pool = pool;
    this.events = events;
    this.accounts = new AccountsImpl(ctx);
    this.checkin = new CheckinImpl(ctx, economy.checkin());
    this.work = new WorkImpl(ctx, economy.work());
    this.bank = new BankImpl(ctx, economy.bank(), metrics);
    this.robbery = new RobberyImpl(ctx, economy.robbery());
    this.rankings = new RankingsImpl(ctx);
    this.scheduler = scheduler;
    this.metrics = metrics;
  }

  /**
   * Starts core services using the provided configuration: opens the pool (creating the database
   * when missing), applies migrations and builds the engines.
   *
   * @param cfg runtime configuration
   * @return service container
   */
  public static Services start(Config cfg) {
    LoggingConfigurator.configure(cfg.log());
    HikariDataSource ds = openPool(cfg);
    Migrations.apply(ds);

    ScheduledExecutorService scheduler =
        Executors.newScheduledThreadPool(
            2,
            r -> {
              Thread t = new Thread(r, "coincore-scheduler");
              t.setDaemon(true);
              return t;
            });
    Metrics metrics = new Metrics();
    DbHealth dbHealth =
        new DbHealth(ds, scheduler, cfg.runtime().reconnectEveryS(), cfg.db(), metrics);
    LedgerStore store = new JdbcLedgerStore(ds, dbHealth, metrics, cfg.store().maxRetries());
    EventBus events = new EventBus();
    EngineContext ctx =
        new EngineContext(
            store,
            Clock.systemUTC(),
            cfg.time().zone(),
            RandomSource.threadLocal(),
            events,
            metrics);
    LOG.info("(coincore) services started; day boundaries in {}", cfg.time().zone());
    return new CoreServices(ds, events, ctx, cfg.economy(), scheduler, metrics);
  }

  /**
   * Builds the engines over an arbitrary store. Used by embedders that manage their own pool.
   *
   * @param store ledger store
   * @param economy economy rules
   * @param clock clock defining "now"
   * @param zone zone defining calendar days
   * @param random randomness source
   * @return service container without a connection pool
   */
  public static Services over(
      LedgerStore store,
      Config.Economy economy,
      Clock clock,
      ZoneId zone,
      RandomSource random) {
    ScheduledExecutorService scheduler =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, "coincore-scheduler");
              t.setDaemon(true);
              return t;
            });
    Metrics metrics = new Metrics();
    EventBus events = new EventBus();
    EngineContext ctx = new EngineContext(store, clock, zone, random, events, metrics);
    return new CoreServices(null, events, ctx, economy, scheduler, metrics);
  }

  static HikariDataSource openPool(Config cfg) {
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(cfg.db().jdbcUrl());
    hc.setUsername(cfg.db().user());
    hc.setPassword(cfg.db().password());
    hc.setMaximumPoolSize(cfg.db().pool().maxPoolSize());
    hc.setMinimumIdle(Math.min(cfg.db().pool().minimumIdle(), cfg.db().pool().maxPoolSize()));
    hc.setConnectionTimeout(cfg.db().pool().connectionTimeoutMs());
    hc.setIdleTimeout(cfg.db().pool().idleTimeoutMs());
    hc.setMaxLifetime(cfg.db().pool().maxLifetimeMs());
    hc.setAutoCommit(true);
    hc.setPoolName("coincore-hikari");
    if (cfg.db().forceUtc()) {
      hc.setConnectionInitSql("SET time_zone = '+00:00'");
    }

    if (!cfg.db().tlsEnabled() && !isLocalHost(cfg.db().host())) {
      LOG.warn(
          "(coincore) code={} op={} message={}",
          "DB_TLS_DISABLED",
          "config",
          "TLS is disabled for a non-local database host; enable core.db.tls.enabled");
    }
    if ("change-me".equals(cfg.db().password())) {
      LOG.warn(
          "(coincore) code={} op={} message={}",
          "DB_PASSWORD_DEFAULT",
          "config",
          "Database password is still set to the default 'change-me'");
    }

    HikariDataSource ds = null;
    RuntimeException last = null;
    boolean bootstrapped = false;
    int attempts = Math.max(1, cfg.db().pool().startupAttempts());
    for (int attempt = 1; attempt <= attempts; attempt++) {
      try {
        ds = new HikariDataSource(hc);
        break;
      } catch (RuntimeException ex) {
        last = ex;
        SQLException sql = findSqlException(ex);
        if (!bootstrapped && DbBootstrap.isUnknownDatabase(sql)) {
          LOG.warn("(coincore) database missing; attempting bootstrap");
          try {
            DbBootstrap.ensureDatabaseExists(
                cfg.db().jdbcUrl(), cfg.db().user(), cfg.db().password());
            bootstrapped = true;
            continue;
          } catch (SQLException bootstrapEx) {
            LOG.warn("(coincore) database bootstrap failed: {}", bootstrapEx.getMessage());
          }
        }
        LOG.warn(
            "(coincore) failed to start Hikari (attempt {}/{}): {}",
            attempt,
            attempts,
            ex.getMessage());
        try {
          Thread.sleep(250L * attempt);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new RuntimeException("Interrupted while starting datasource", ex);
        }
      }
    }
    if (ds == null) {
      throw new RuntimeException("Unable to start datasource", last);
    }
    return ds;
  }

  @Override
  public Accounts accounts() {
    return accounts;
  }

  @Override
  public Checkin checkin() {
    return checkin;
  }

  @Override
  public Work work() {
    return work;
  }

  @Override
  public Bank bank() {
    return bank;
  }

  @Override
  public Robbery robbery() {
    return robbery;
  }

  @Override
  public Rankings rankings() {
    return rankings;
  }

  @Override
  public EconomyEvents events() {
    return events;
  }

  @Override
  public ScheduledExecutorService scheduler() {
    return scheduler;
  }

  @Override
  public Metrics metrics() {
    return metrics;
  }

  /** Pool backing the store, {@code null} when built with {@link #over}. */
  DataSource dataSource() {
    return pool;
  }

  /** Closes background resources and the connection pool. */
  @Override
  public void shutdown() throws IOException {
    events.close();
    metrics.close();
    scheduler.shutdownNow();
    if (pool != null) {
      pool.close();
    }
  }

  /** Alias for {@link #shutdown()}. */
  @Override
  public void close() throws IOException {
    shutdown();
  }

  private static boolean isLocalHost(String host) {
    if (host == null) {
      return false;
    }
    String normalized = host.trim();
    return normalized.equalsIgnoreCase("localhost")
        || normalized.equals("127.0.0.1")
        || normalized.equals("::1")
        || normalized.equalsIgnoreCase("[::1]");
  }

  private static SQLException findSqlException(Throwable error) {
    Throwable cursor = error;
    while (cursor != null) {
      if (cursor instanceof SQLException sql) {
        return sql;
      }
      cursor = cursor.getCause();
    }
    return null;
  }
}
