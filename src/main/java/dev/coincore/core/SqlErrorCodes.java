/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.core;

import dev.coincore.api.ErrorCode;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientConnectionException;
import java.util.Locale;

/** Maps JDBC {@link SQLException} instances to CoinCore store {@link ErrorCode}s. */
public final class SqlErrorCodes {

  private SqlErrorCodes() {}

  /**
   * Classifies a SQL exception into one of the store {@link ErrorCode} values.
   *
   * <p>{@link ErrorCode#DEADLOCK_RETRY_EXHAUSTED} marks the retryable class (deadlock, lock wait
   * timeout, serialization failure); the store only reports it once its retries ran out. Only
   * {@link ErrorCode#CONNECTION_LOST} puts the store into degraded mode, so data and syntax errors
   * raised by a single statement map to {@link ErrorCode#STORE_UNAVAILABLE}.
   *
   * @param e SQL exception thrown by MariaDB or the pool
   * @return mapped code, defaulting to {@link ErrorCode#STORE_UNAVAILABLE}
   */
  public static ErrorCode classify(SQLException e) {
    if (e == null) {
      return ErrorCode.STORE_UNAVAILABLE;
    }
    if (e instanceof SQLTransientConnectionException
        || e instanceof SQLNonTransientConnectionException
        || e instanceof SQLRecoverableException) {
      return ErrorCode.CONNECTION_LOST;
    }

    int vendor = e.getErrorCode();
    switch (vendor) {
      case 1213:
      case 1205:
        return ErrorCode.DEADLOCK_RETRY_EXHAUSTED;
      case 1022:
      case 1062:
      case 1586:
        return ErrorCode.DUPLICATE_KEY;
      case 1049:
        // unknown database; the health probe bootstraps it
        return ErrorCode.CONNECTION_LOST;
      case 1406:
      case 4025:
        // data too long, CHECK constraint
        return ErrorCode.STORE_UNAVAILABLE;
      default:
        break;
    }

    String state = e.getSQLState();
    if (state != null && state.length() >= 2) {
      switch (state.substring(0, 2)) {
        case "40":
        case "41":
          return ErrorCode.DEADLOCK_RETRY_EXHAUSTED;
        case "55":
          return ErrorCode.MIGRATION_LOCKED;
        case "23":
          return ErrorCode.DUPLICATE_KEY;
        case "08":
        case "28":
          return ErrorCode.CONNECTION_LOST;
        case "22":
        case "42":
          return ErrorCode.STORE_UNAVAILABLE;
        default:
          break;
      }
    }

    String message = e.getMessage();
    if (message != null) {
      String lower = message.toLowerCase(Locale.ROOT);
      if (lower.contains("deadlock") || lower.contains("lock wait timeout")) {
        return ErrorCode.DEADLOCK_RETRY_EXHAUSTED;
      }
      if (lower.contains("metadata lock")) {
        return ErrorCode.MIGRATION_LOCKED;
      }
      if (lower.contains("duplicate")) {
        return ErrorCode.DUPLICATE_KEY;
      }
      if (lower.contains("communications link failure") || lower.contains("connection is closed")) {
        return ErrorCode.CONNECTION_LOST;
      }
    }
    return ErrorCode.STORE_UNAVAILABLE;
  }

  /** Whether the whole unit should be replayed after {@code e}. */
  static boolean isTransient(SQLException e) {
    return classify(e) == ErrorCode.DEADLOCK_RETRY_EXHAUSTED;
  }
}
