/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.core;

import dev.coincore.api.Account;
import dev.coincore.api.ErrorCode;
import dev.coincore.api.InvariantViolationException;
import dev.coincore.api.StoreUnavailableException;
import dev.coincore.api.storage.LedgerStore;
import dev.coincore.api.storage.Mutation;
import dev.coincore.api.storage.UnitOfWork;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MariaDB-backed {@link LedgerStore}.
 *
 * <p>Mutating units run under READ COMMITTED with row locks taken through {@code SELECT ... FOR
 * UPDATE}. Units that hit a deadlock or lock wait timeout are replayed whole, up to {@code
 * maxRetries} times with linear backoff. Read units run in a REPEATABLE READ transaction so every
 * query in the unit sees one snapshot.
 */
public final class JdbcLedgerStore implements LedgerStore {
  private static final Logger LOG = LoggerFactory.getLogger("coincore");
  private static final long BACKOFF_STEP_MS = 25L;

  private final DataSource ds;
  private final DbHealth health;
  private final Metrics metrics;
  private final int maxRetries;

  JdbcLedgerStore(DataSource ds, DbHealth health, Metrics metrics, int maxRetries) {
    this.ds = ds;
    this.health = health;
    this.metrics = metrics;
    this.maxRetries = Math.max(0, maxRetries);
  }

  @Override
  public <T> Mutation<T> inTransaction(String op, UnitOfWork<Mutation<T>> work) {
    requireWritable(op);
    return withRetries(
        op,
        () -> {
          try (Connection c = ds.getConnection()) {
            c.setAutoCommit(false);
            c.setTransactionIsolation(Connection.TRANSACTION_READ_COMMITTED);
            try {
              Mutation<T> m = work.run(new JdbcLedgerSession(c));
              if (m.commit()) {
                c.commit();
              } else {
                c.rollback();
              }
              return m;
            } catch (SQLException | RuntimeException e) {
              rollbackQuietly(c, op);
              throw e;
            }
          }
        });
  }

  @Override
  public <T> T read(String op, UnitOfWork<T> work) {
    return withRetries(
        op,
        () -> {
          try (Connection c = ds.getConnection()) {
            c.setAutoCommit(false);
            c.setTransactionIsolation(Connection.TRANSACTION_REPEATABLE_READ);
            try {
              T value = work.run(new JdbcLedgerSession(c));
              c.commit();
              return value;
            } catch (SQLException | RuntimeException e) {
              rollbackQuietly(c, op);
              throw e;
            }
          }
        });
  }

  @Override
  public Account ensureAccount(String id, String displayName, long nowS) {
    String op = "accounts.ensure";
    requireWritable(op);
    String upsert =
        "INSERT INTO accounts(id, display_name, created_at_s, updated_at_s) VALUES(?,?,?,?) "
            + "ON DUPLICATE KEY UPDATE display_name=VALUES(display_name)";
    String select =
        "SELECT " + JdbcLedgerSession.accountColumns() + " FROM accounts WHERE id=?";
    return withRetries(
        op,
        () -> {
          try (Connection c = ds.getConnection()) {
            c.setAutoCommit(true);
            try (PreparedStatement ps = c.prepareStatement(upsert)) {
              ps.setString(1, id);
              ps.setString(2, displayName);
              ps.setLong(3, nowS);
              ps.setLong(4, nowS);
              ps.executeUpdate();
            }
            try (PreparedStatement ps = c.prepareStatement(select)) {
              ps.setString(1, id);
              try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                  throw new InvariantViolationException("account missing after upsert: " + id);
                }
                return JdbcLedgerSession.readAccount(rs);
              }
            }
          }
        });
  }

  private void requireWritable(String op) {
    if (health != null && !health.allowWrite(op)) {
      if (metrics != null) {
        metrics.recordStoreFailure(ErrorCode.DEGRADED_MODE);
      }
      throw new StoreUnavailableException(ErrorCode.DEGRADED_MODE, "database is in degraded mode");
    }
  }

  private <T> T withRetries(String op, Attempt<T> attempt) {
    int tries = 0;
    while (true) {
      try {
        T value = attempt.run();
        if (health != null) {
          health.markSuccess();
        }
        return value;
      } catch (SQLException e) {
        ErrorCode code = SqlErrorCodes.classify(e);
        if (SqlErrorCodes.isTransient(e) && tries < maxRetries) {
          tries++;
          if (metrics != null) {
            metrics.recordRetry();
          }
          LOG.debug("(coincore) op={} retry={} after {}", op, tries, e.getMessage());
          backoff(tries, op, e);
          continue;
        }
        if (code == ErrorCode.CONNECTION_LOST && health != null) {
          health.markFailure(e);
        }
        if (metrics != null) {
          metrics.recordStoreFailure(code);
        }
        LOG.warn(
            "(coincore) code={} op={} message={} sqlState={} vendor={}",
            code,
            op,
            e.getMessage(),
            e.getSQLState(),
            e.getErrorCode(),
            e);
        throw new StoreUnavailableException(code, op + " failed: " + e.getMessage(), e);
      } catch (InvariantViolationException e) {
        if (metrics != null) {
          metrics.recordInvariantViolation();
        }
        LOG.error("(coincore) op={} invariant violated, unit rolled back: {}", op, e.getMessage());
        throw e;
      }
    }
  }

  private static void backoff(int attempt, String op, SQLException cause) {
    try {
      Thread.sleep(BACKOFF_STEP_MS * attempt);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new StoreUnavailableException(
          ErrorCode.DEADLOCK_RETRY_EXHAUSTED, op + " interrupted while retrying", cause);
    }
  }

  private static void rollbackQuietly(Connection c, String op) {
    try {
      c.rollback();
    } catch (SQLException e) {
      LOG.debug("(coincore) op={} rollback failed: {}", op, e.getMessage());
    }
  }

  @FunctionalInterface
  private interface Attempt<T> {
    T run() throws SQLException;
  }
}
