/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.core;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Idempotent schema migrations for the CoinCore ledger tables. */
public final class Migrations {
  private static final Logger LOG = LoggerFactory.getLogger("coincore");
  private static final int CURRENT_VERSION = 1;

  private static final String[] DDL = {
    """
    CREATE TABLE IF NOT EXISTS core_schema_version (
      version       INT              NOT NULL,
      applied_at_s  BIGINT UNSIGNED  NOT NULL,
      PRIMARY KEY (version)
    ) ENGINE=InnoDB DEFAULT CHARSET=utf8mb4 ROW_FORMAT=DYNAMIC
    """,

    // Account state; balances never go negative
    """
    CREATE TABLE IF NOT EXISTS accounts (
      id                  VARCHAR(64)     NOT NULL,
      display_name        VARCHAR(128)    NOT NULL,
      cash                BIGINT          NOT NULL DEFAULT 0,
      savings             BIGINT          NOT NULL DEFAULT 0,
      total_earned        BIGINT          NOT NULL DEFAULT 0,
      level               INT             NOT NULL DEFAULT 1,
      experience          BIGINT          NOT NULL DEFAULT 0,
      checkin_streak      INT             NOT NULL DEFAULT 0,
      total_checkins      BIGINT          NOT NULL DEFAULT 0,
      last_checkin_date   DATE            NULL,
      last_work_at_s      BIGINT UNSIGNED NULL,
      last_interest_date  DATE            NULL,
      created_at_s        BIGINT UNSIGNED NOT NULL,
      updated_at_s        BIGINT UNSIGNED NOT NULL,
      CONSTRAINT chk_accounts_cash_nonneg CHECK (cash >= 0),
      CONSTRAINT chk_accounts_savings_nonneg CHECK (savings >= 0),
      CONSTRAINT chk_accounts_level CHECK (level >= 1),
      PRIMARY KEY (id),
      KEY idx_accounts_cash (cash),
      KEY idx_accounts_savings (savings)
    ) ENGINE=InnoDB DEFAULT CHARSET=utf8mb4 ROW_FORMAT=DYNAMIC
    """,

    """
    CREATE TABLE IF NOT EXISTS bank_transactions (
      id              BIGINT UNSIGNED NOT NULL AUTO_INCREMENT,
      account_id      VARCHAR(64)     NOT NULL,
      type            VARCHAR(16)     NOT NULL,
      amount          BIGINT          NOT NULL,
      balance_before  BIGINT          NOT NULL,
      balance_after   BIGINT          NOT NULL,
      ts_s            BIGINT UNSIGNED NOT NULL,
      CONSTRAINT chk_bank_tx_amount CHECK (amount > 0),
      PRIMARY KEY (id),
      KEY idx_bank_tx_account_ts (account_id, ts_s),
      KEY idx_bank_tx_account_type_ts (account_id, type, ts_s),
      CONSTRAINT fk_bank_tx_account FOREIGN KEY (account_id) REFERENCES accounts(id)
    ) ENGINE=InnoDB DEFAULT CHARSET=utf8mb4 ROW_FORMAT=DYNAMIC
    """,

    """
    CREATE TABLE IF NOT EXISTS work_records (
      id            BIGINT UNSIGNED NOT NULL AUTO_INCREMENT,
      account_id    VARCHAR(64)     NOT NULL,
      job_name      VARCHAR(64)     NOT NULL,
      base_salary   BIGINT          NOT NULL,
      bonus         BIGINT          NOT NULL,
      total_earned  BIGINT          NOT NULL,
      ts_s          BIGINT UNSIGNED NOT NULL,
      PRIMARY KEY (id),
      KEY idx_work_account_ts (account_id, ts_s),
      KEY idx_work_account_job_ts (account_id, job_name, ts_s),
      CONSTRAINT fk_work_account FOREIGN KEY (account_id) REFERENCES accounts(id)
    ) ENGINE=InnoDB DEFAULT CHARSET=utf8mb4 ROW_FORMAT=DYNAMIC
    """,

    // One row per account per calendar day
    """
    CREATE TABLE IF NOT EXISTS checkin_records (
      id                BIGINT UNSIGNED NOT NULL AUTO_INCREMENT,
      account_id        VARCHAR(64)     NOT NULL,
      checkin_date      DATE            NOT NULL,
      reward_amount     BIGINT          NOT NULL,
      consecutive_days  INT             NOT NULL,
      ts_s              BIGINT UNSIGNED NOT NULL,
      PRIMARY KEY (id),
      UNIQUE KEY uk_checkin_account_day (account_id, checkin_date),
      CONSTRAINT fk_checkin_account FOREIGN KEY (account_id) REFERENCES accounts(id)
    ) ENGINE=InnoDB DEFAULT CHARSET=utf8mb4 ROW_FORMAT=DYNAMIC
    """,

    """
    CREATE TABLE IF NOT EXISTS robbery_records (
      id          BIGINT UNSIGNED NOT NULL AUTO_INCREMENT,
      robber_id   VARCHAR(64)     NOT NULL,
      victim_id   VARCHAR(64)     NOT NULL,
      amount      BIGINT          NOT NULL,
      success     TINYINT(1)      NOT NULL,
      ts_s        BIGINT UNSIGNED NOT NULL,
      PRIMARY KEY (id),
      KEY idx_robbery_robber_ts (robber_id, ts_s),
      KEY idx_robbery_victim_ts (victim_id, ts_s),
      CONSTRAINT fk_robbery_robber FOREIGN KEY (robber_id) REFERENCES accounts(id),
      CONSTRAINT fk_robbery_victim FOREIGN KEY (victim_id) REFERENCES accounts(id)
    ) ENGINE=InnoDB DEFAULT CHARSET=utf8mb4 ROW_FORMAT=DYNAMIC
    """
  };

  private Migrations() {}

  /**
   * Applies idempotent DDL. Each statement is executed independently; failures are logged and the
   * migrator proceeds with remaining statements. The schema version is only recorded when every
   * statement succeeded.
   *
   * @param ds data source for the target schema
   * @return {@code true} when every statement succeeded
   */
  public static boolean apply(DataSource ds) {
    boolean allSucceeded = true;
    try (Connection c = ds.getConnection();
        Statement st = c.createStatement()) {
      for (String sql : DDL) {
        try {
          st.execute(sql);
        } catch (SQLException e) {
          allSucceeded = false;
          LOG.warn(
              "(coincore) migration statement failed; continuing. cause={} sql=\n{}",
              e.getMessage(),
              sql);
        }
      }
    } catch (SQLException e) {
      throw new RuntimeException("Migration failed", e);
    }

    if (!allSucceeded) {
      LOG.warn("(coincore) migrations completed with errors; schema version unchanged");
      return false;
    }
    recordSchemaVersion(ds);
    return true;
  }

  /** Current schema version number. */
  public static int currentVersion() {
    return CURRENT_VERSION;
  }

  private static void recordSchemaVersion(DataSource ds) {
    try (Connection c = ds.getConnection();
        PreparedStatement ps =
            c.prepareStatement(
                "INSERT INTO core_schema_version(version, applied_at_s) VALUES(?, ?) "
                    + "ON DUPLICATE KEY UPDATE applied_at_s=VALUES(applied_at_s)")) {
      c.setAutoCommit(false);
      ps.setInt(1, CURRENT_VERSION);
      ps.setLong(2, Instant.now().getEpochSecond());
      ps.executeUpdate();
      c.commit();
      LOG.info("(coincore) schema version recorded: {}", CURRENT_VERSION);
    } catch (SQLException e) {
      throw new RuntimeException("Failed to record schema version", e);
    }
  }
}
