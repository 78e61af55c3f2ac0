/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.core;

import dev.coincore.api.ErrorCode;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Degraded-mode switch for the ledger store.
 *
 * <p>A lost connection flips the store into degraded mode: every ledger unit is refused with
 * {@link ErrorCode#DEGRADED_MODE} until a probe (one read, one no-op write against {@code
 * accounts}) succeeds or a unit completes again. A probe failing on a missing database triggers
 * {@link DbBootstrap} once per outage.
 */
class DbHealth {
  private static final Logger LOG = LoggerFactory.getLogger("coincore");
  private static final long REFUSAL_LOG_EVERY_NS = TimeUnit.SECONDS.toNanos(5);
  private static final String PROBE_READ = "SELECT 1";
  private static final String PROBE_WRITE =
      "UPDATE accounts SET updated_at_s = updated_at_s WHERE 1=0";

  /** {@code 0} while healthy, otherwise {@link System#nanoTime()} at the start of the outage. */
  private final AtomicLong degradedSinceNs = new AtomicLong(0L);

  private final AtomicLong refusedSinceLog = new AtomicLong(0L);
  private final AtomicLong lastRefusalLogNs = new AtomicLong(0L);
  private final AtomicLong probesThisOutage = new AtomicLong(0L);
  private final AtomicBoolean bootstrapPending = new AtomicBoolean(false);

  private final DataSource ds;
  private final ScheduledExecutorService scheduler;
  private final Config.Db dbConfig;
  private final Metrics metrics;

  DbHealth(
      DataSource ds,
      ScheduledExecutorService scheduler,
      int reconnectEveryS,
      Config.Db dbConfig,
      Metrics metrics) {
    this.ds = ds;
    this.scheduler = scheduler;
    this.dbConfig = dbConfig;
    this.metrics = metrics;
    long every = Math.max(1, reconnectEveryS);
    scheduler.scheduleWithFixedDelay(this::probe, every, every, TimeUnit.SECONDS);
  }

  /** Whether a ledger unit may run; refusals are logged at most every five seconds. */
  boolean allowWrite(String operation) {
    if (!isDegraded()) {
      return true;
    }
    long refused = refusedSinceLog.incrementAndGet();
    long now = System.nanoTime();
    long prev = lastRefusalLogNs.get();
    if (now - prev > REFUSAL_LOG_EVERY_NS && lastRefusalLogNs.compareAndSet(prev, now)) {
      refusedSinceLog.addAndGet(-refused);
      LOG.warn(
          "(coincore) code={} op={} message={}",
          ErrorCode.DEGRADED_MODE,
          operation,
          "database unavailable; refused " + refused + " unit(s) since last report");
    }
    return false;
  }

  void markFailure(Throwable cause) {
    long now = Math.max(1L, System.nanoTime());
    if (degradedSinceNs.compareAndSet(0L, now)) {
      probesThisOutage.set(0L);
      if (metrics != null) {
        metrics.onDegradedEntered();
      }
      LOG.warn(
          "(coincore) code={} op={} message={}",
          ErrorCode.CONNECTION_LOST,
          "db.health",
          cause != null ? cause.getMessage() : "database unavailable",
          cause);
    }
    bootstrapIfMissing(cause);
  }

  void markSuccess() {
    long since = degradedSinceNs.getAndSet(0L);
    if (since != 0L) {
      Duration outage = Duration.ofNanos(System.nanoTime() - since);
      LOG.info(
          "(coincore) code={} op={} message={}",
          ErrorCode.DEGRADED_MODE,
          "db.health",
          "database recovered after "
              + outage.toSeconds()
              + "s and "
              + probesThisOutage.get()
              + " probe(s)");
    }
    bootstrapPending.set(false);
  }

  boolean isDegraded() {
    return degradedSinceNs.get() != 0L;
  }

  /** Scheduled check; no-op while healthy. */
  void probe() {
    if (!isDegraded()) {
      return;
    }
    probesThisOutage.incrementAndGet();
    try (Connection c = ds.getConnection();
        PreparedStatement read = c.prepareStatement(PROBE_READ);
        PreparedStatement write = c.prepareStatement(PROBE_WRITE)) {
      try (ResultSet rs = read.executeQuery()) {
        rs.next();
      }
      write.executeUpdate();
      markSuccess();
    } catch (SQLException e) {
      LOG.debug(
          "(coincore) op=db.health probe {} failed: {}", probesThisOutage.get(), e.getMessage());
      bootstrapIfMissing(e);
    }
  }

  private void bootstrapIfMissing(Throwable cause) {
    if (dbConfig == null || !DbBootstrap.isUnknownDatabase(rootSql(cause))) {
      return;
    }
    if (!bootstrapPending.compareAndSet(false, true)) {
      return;
    }
    scheduler.execute(
        () -> {
          try {
            DbBootstrap.ensureDatabaseExists(
                dbConfig.jdbcUrl(), dbConfig.user(), dbConfig.password());
            LOG.info("(coincore) op=db.bootstrap created missing database {}", dbConfig.database());
          } catch (SQLException e) {
            bootstrapPending.set(false);
            LOG.warn(
                "(coincore) code={} op={} message={}",
                ErrorCode.CONNECTION_LOST,
                "db.bootstrap",
                e.getMessage(),
                e);
          }
        });
  }

  private static SQLException rootSql(Throwable cause) {
    for (Throwable t = cause; t != null; t = t.getCause()) {
      if (t instanceof SQLException sql) {
        return sql;
      }
    }
    return null;
  }
}
