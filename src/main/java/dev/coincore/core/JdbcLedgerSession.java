/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.core;

import dev.coincore.api.Account;
import dev.coincore.api.InvariantViolationException;
import dev.coincore.api.Rankings.Metric;
import dev.coincore.api.records.CheckinRecord;
import dev.coincore.api.records.RobberyRecord;
import dev.coincore.api.records.TransactionRecord;
import dev.coincore.api.records.TransactionType;
import dev.coincore.api.records.WorkRecord;
import dev.coincore.api.storage.LedgerSession;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeSet;

/** {@link LedgerSession} bound to one JDBC connection inside an open transaction. */
final class JdbcLedgerSession implements LedgerSession {
  private static final String ACCOUNT_COLUMNS =
      "id, display_name, cash, savings, total_earned, level, experience, checkin_streak, "
          + "total_checkins, last_checkin_date, last_work_at_s, last_interest_date, "
          + "created_at_s, updated_at_s";

  private final Connection c;

  JdbcLedgerSession(Connection c) {
    this.c = c;
  }

  @Override
  public Optional<Account> findAccount(String id) throws SQLException {
    return selectAccount("SELECT " + ACCOUNT_COLUMNS + " FROM accounts WHERE id=?", id);
  }

  @Override
  public Optional<Account> lockAccount(String id) throws SQLException {
    return selectAccount(
        "SELECT " + ACCOUNT_COLUMNS + " FROM accounts WHERE id=? FOR UPDATE", id);
  }

  @Override
  public Map<String, Account> lockAccounts(List<String> ids) throws SQLException {
    Map<String, Account> locked = new LinkedHashMap<>();
    // ascending id order
    for (String id : new TreeSet<>(ids)) {
      lockAccount(id).ifPresent(a -> locked.put(a.id(), a));
    }
    return locked;
  }

  @Override
  public void updateAccount(Account a) throws SQLException {
    if (a.cash() < 0 || a.savings() < 0) {
      throw new InvariantViolationException(
          "negative balance for " + a.id() + ": cash=" + a.cash() + " savings=" + a.savings());
    }
    String sql =
        "UPDATE accounts SET display_name=?, cash=?, savings=?, total_earned=?, level=?, "
            + "experience=?, checkin_streak=?, total_checkins=?, last_checkin_date=?, "
            + "last_work_at_s=?, last_interest_date=?, updated_at_s=? WHERE id=?";
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, a.displayName());
      ps.setLong(2, a.cash());
      ps.setLong(3, a.savings());
      ps.setLong(4, a.totalEarned());
      ps.setInt(5, a.level());
      ps.setLong(6, a.experience());
      ps.setInt(7, a.checkinStreak());
      ps.setLong(8, a.totalCheckins());
      setDate(ps, 9, a.lastCheckinDate());
      if (a.lastWorkAtS() == null) {
        ps.setNull(10, Types.BIGINT);
      } else {
        ps.setLong(10, a.lastWorkAtS());
      }
      setDate(ps, 11, a.lastInterestDate());
      ps.setLong(12, a.updatedAtS());
      ps.setString(13, a.id());
      if (ps.executeUpdate() != 1) {
        throw new InvariantViolationException("account row missing on update: " + a.id());
      }
    }
  }

  @Override
  public void appendTransaction(TransactionRecord r) throws SQLException {
    String sql =
        "INSERT INTO bank_transactions(account_id, type, amount, balance_before, balance_after, "
            + "ts_s) VALUES(?,?,?,?,?,?)";
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, r.accountId());
      ps.setString(2, r.type().dbValue());
      ps.setLong(3, r.amount());
      ps.setLong(4, r.balanceBefore());
      ps.setLong(5, r.balanceAfter());
      ps.setLong(6, r.tsS());
      ps.executeUpdate();
    }
  }

  @Override
  public void appendWork(WorkRecord r) throws SQLException {
    String sql =
        "INSERT INTO work_records(account_id, job_name, base_salary, bonus, total_earned, ts_s) "
            + "VALUES(?,?,?,?,?,?)";
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, r.accountId());
      ps.setString(2, r.jobName());
      ps.setLong(3, r.baseSalary());
      ps.setLong(4, r.bonus());
      ps.setLong(5, r.totalEarned());
      ps.setLong(6, r.tsS());
      ps.executeUpdate();
    }
  }

  @Override
  public void appendCheckin(CheckinRecord r) throws SQLException {
    String sql =
        "INSERT INTO checkin_records(account_id, checkin_date, reward_amount, consecutive_days, "
            + "ts_s) VALUES(?,?,?,?,?)";
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, r.accountId());
      setDate(ps, 2, r.checkinDate());
      ps.setLong(3, r.rewardAmount());
      ps.setInt(4, r.consecutiveDays());
      ps.setLong(5, r.tsS());
      ps.executeUpdate();
    }
  }

  @Override
  public void appendRobbery(RobberyRecord r) throws SQLException {
    String sql =
        "INSERT INTO robbery_records(robber_id, victim_id, amount, success, ts_s) "
            + "VALUES(?,?,?,?,?)";
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, r.robberId());
      ps.setString(2, r.victimId());
      ps.setLong(3, r.amount());
      ps.setBoolean(4, r.success());
      ps.setLong(5, r.tsS());
      ps.executeUpdate();
    }
  }

  @Override
  public Optional<CheckinRecord> findCheckin(String accountId, LocalDate day)
      throws SQLException {
    String sql =
        "SELECT id, account_id, checkin_date, reward_amount, consecutive_days, ts_s "
            + "FROM checkin_records WHERE account_id=? AND checkin_date=?";
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, accountId);
      setDate(ps, 2, day);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(readCheckin(rs)) : Optional.empty();
      }
    }
  }

  @Override
  public List<CheckinRecord> recentCheckins(String accountId, int limit) throws SQLException {
    String sql =
        "SELECT id, account_id, checkin_date, reward_amount, consecutive_days, ts_s "
            + "FROM checkin_records WHERE account_id=? ORDER BY checkin_date DESC LIMIT ?";
    List<CheckinRecord> out = new ArrayList<>();
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, accountId);
      ps.setInt(2, limit);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          out.add(readCheckin(rs));
        }
      }
    }
    return out;
  }

  @Override
  public Tally transactionTally(String accountId, TransactionType type, long fromS, long toS)
      throws SQLException {
    String sql =
        "SELECT COUNT(*), COALESCE(SUM(amount),0) FROM bank_transactions "
            + "WHERE account_id=? AND type=? AND ts_s>=? AND ts_s<?";
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, accountId);
      ps.setString(2, type.dbValue());
      ps.setLong(3, fromS);
      ps.setLong(4, toS);
      return readTally(ps);
    }
  }

  @Override
  public List<TransactionRecord> recentTransactions(String accountId, int limit)
      throws SQLException {
    String sql =
        "SELECT id, account_id, type, amount, balance_before, balance_after, ts_s "
            + "FROM bank_transactions WHERE account_id=? ORDER BY ts_s DESC, id DESC LIMIT ?";
    List<TransactionRecord> out = new ArrayList<>();
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, accountId);
      ps.setInt(2, limit);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          out.add(
              new TransactionRecord(
                  rs.getLong(1),
                  rs.getString(2),
                  TransactionType.fromDb(rs.getString(3)),
                  rs.getLong(4),
                  rs.getLong(5),
                  rs.getLong(6),
                  rs.getLong(7)));
        }
      }
    }
    return out;
  }

  @Override
  public Tally workTally(String accountId, long fromS, long toS) throws SQLException {
    String sql =
        "SELECT COUNT(*), COALESCE(SUM(total_earned),0) FROM work_records "
            + "WHERE account_id=? AND ts_s>=? AND ts_s<?";
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, accountId);
      ps.setLong(2, fromS);
      ps.setLong(3, toS);
      return readTally(ps);
    }
  }

  @Override
  public Map<String, Tally> workTallyByJob(String accountId) throws SQLException {
    String sql =
        "SELECT job_name, COUNT(*), COALESCE(SUM(total_earned),0) FROM work_records "
            + "WHERE account_id=? GROUP BY job_name ORDER BY job_name";
    Map<String, Tally> out = new LinkedHashMap<>();
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, accountId);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          out.put(rs.getString(1), new Tally(rs.getLong(2), rs.getLong(3)));
        }
      }
    }
    return out;
  }

  @Override
  public Map<String, Long> lastWorkByJob(String accountId) throws SQLException {
    String sql =
        "SELECT job_name, MAX(ts_s) FROM work_records WHERE account_id=? GROUP BY job_name";
    Map<String, Long> out = new LinkedHashMap<>();
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, accountId);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          out.put(rs.getString(1), rs.getLong(2));
        }
      }
    }
    return out;
  }

  @Override
  public OptionalLong lastWorkAt(String accountId, String jobName) throws SQLException {
    String sql = "SELECT MAX(ts_s) FROM work_records WHERE account_id=? AND job_name=?";
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, accountId);
      ps.setString(2, jobName);
      return readOptionalLong(ps);
    }
  }

  @Override
  public List<WorkRecord> recentWork(String accountId, int limit) throws SQLException {
    String sql =
        "SELECT id, account_id, job_name, base_salary, bonus, total_earned, ts_s "
            + "FROM work_records WHERE account_id=? ORDER BY ts_s DESC, id DESC LIMIT ?";
    List<WorkRecord> out = new ArrayList<>();
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, accountId);
      ps.setInt(2, limit);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          out.add(
              new WorkRecord(
                  rs.getLong(1),
                  rs.getString(2),
                  rs.getString(3),
                  rs.getLong(4),
                  rs.getLong(5),
                  rs.getLong(6),
                  rs.getLong(7)));
        }
      }
    }
    return out;
  }

  @Override
  public OptionalLong lastRobberyAt(String robberId) throws SQLException {
    try (PreparedStatement ps =
        c.prepareStatement("SELECT MAX(ts_s) FROM robbery_records WHERE robber_id=?")) {
      ps.setString(1, robberId);
      return readOptionalLong(ps);
    }
  }

  @Override
  public RobberyTally robberyTally(String accountId, boolean asRobber, long fromS, long toS)
      throws SQLException {
    String sql =
        "SELECT COUNT(*), COALESCE(SUM(success),0), "
            + "COALESCE(SUM(CASE WHEN success=1 THEN amount ELSE 0 END),0), "
            + "COALESCE(SUM(CASE WHEN success=0 THEN amount ELSE 0 END),0) "
            + "FROM robbery_records WHERE "
            + (asRobber ? "robber_id" : "victim_id")
            + "=? AND ts_s>=? AND ts_s<?";
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, accountId);
      ps.setLong(2, fromS);
      ps.setLong(3, toS);
      try (ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) {
          return RobberyTally.EMPTY;
        }
        return new RobberyTally(rs.getLong(1), rs.getLong(2), rs.getLong(3), rs.getLong(4));
      }
    }
  }

  @Override
  public List<Account> accountsWithCashAtLeast(long minCash, String excludeId, int limit)
      throws SQLException {
    String sql =
        "SELECT "
            + ACCOUNT_COLUMNS
            + " FROM accounts WHERE cash>=? AND id<>? ORDER BY cash DESC, id ASC LIMIT ?";
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setLong(1, minCash);
      ps.setString(2, excludeId == null ? "" : excludeId);
      ps.setInt(3, limit);
      return readAccounts(ps);
    }
  }

  @Override
  public List<String> savingsHoldersAfter(String afterId, int limit) throws SQLException {
    String sql = "SELECT id FROM accounts WHERE savings>0 AND id>? ORDER BY id ASC LIMIT ?";
    List<String> out = new ArrayList<>();
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, afterId == null ? "" : afterId);
      ps.setInt(2, limit);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          out.add(rs.getString(1));
        }
      }
    }
    return out;
  }

  @Override
  public long countAhead(Metric metric, Account account) throws SQLException {
    String sql;
    if (metric == Metric.EXPERIENCE) {
      sql = "SELECT COUNT(*) FROM accounts WHERE level>? OR (level=? AND experience>?)";
    } else {
      sql = "SELECT COUNT(*) FROM accounts WHERE " + column(metric) + ">?";
    }
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      if (metric == Metric.EXPERIENCE) {
        ps.setInt(1, account.level());
        ps.setInt(2, account.level());
        ps.setLong(3, account.experience());
      } else {
        ps.setLong(1, metric.valueOf(account));
      }
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? rs.getLong(1) : 0L;
      }
    }
  }

  @Override
  public List<Account> top(Metric metric, int limit) throws SQLException {
    String order =
        metric == Metric.EXPERIENCE
            ? "level DESC, experience DESC, id ASC"
            : column(metric) + " DESC, id ASC";
    String sql =
        "SELECT "
            + ACCOUNT_COLUMNS
            + " FROM accounts WHERE "
            + column(metric)
            + ">0 ORDER BY "
            + order
            + " LIMIT ?";
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setInt(1, limit);
      return readAccounts(ps);
    }
  }

  @Override
  public long participantCount() throws SQLException {
    try (PreparedStatement ps =
            c.prepareStatement("SELECT COUNT(*) FROM accounts WHERE cash>0 OR total_checkins>0");
        ResultSet rs = ps.executeQuery()) {
      return rs.next() ? rs.getLong(1) : 0L;
    }
  }

  static Account readAccount(ResultSet rs) throws SQLException {
    long lastWork = rs.getLong("last_work_at_s");
    Long lastWorkAtS = rs.wasNull() ? null : lastWork;
    return new Account(
        rs.getString("id"),
        rs.getString("display_name"),
        rs.getLong("cash"),
        rs.getLong("savings"),
        rs.getLong("total_earned"),
        rs.getInt("level"),
        rs.getLong("experience"),
        rs.getInt("checkin_streak"),
        rs.getLong("total_checkins"),
        rs.getObject("last_checkin_date", LocalDate.class),
        lastWorkAtS,
        rs.getObject("last_interest_date", LocalDate.class),
        rs.getLong("created_at_s"),
        rs.getLong("updated_at_s"));
  }

  static String accountColumns() {
    return ACCOUNT_COLUMNS;
  }

  private static String column(Metric metric) {
    return switch (metric) {
      case CASH -> "cash";
      case TOTAL_ASSETS -> "(cash+savings)";
      case TOTAL_EARNED -> "total_earned";
      case EXPERIENCE -> "experience";
      case TOTAL_CHECKINS -> "total_checkins";
    };
  }

  private Optional<Account> selectAccount(String sql, String id) throws SQLException {
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, id);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(readAccount(rs)) : Optional.empty();
      }
    }
  }

  private static List<Account> readAccounts(PreparedStatement ps) throws SQLException {
    List<Account> out = new ArrayList<>();
    try (ResultSet rs = ps.executeQuery()) {
      while (rs.next()) {
        out.add(readAccount(rs));
      }
    }
    return out;
  }

  private static CheckinRecord readCheckin(ResultSet rs) throws SQLException {
    return new CheckinRecord(
        rs.getLong(1),
        rs.getString(2),
        rs.getObject(3, LocalDate.class),
        rs.getLong(4),
        rs.getInt(5),
        rs.getLong(6));
  }

  private static Tally readTally(PreparedStatement ps) throws SQLException {
    try (ResultSet rs = ps.executeQuery()) {
      return rs.next() ? new Tally(rs.getLong(1), rs.getLong(2)) : Tally.EMPTY;
    }
  }

  private static OptionalLong readOptionalLong(PreparedStatement ps) throws SQLException {
    try (ResultSet rs = ps.executeQuery()) {
      if (rs.next()) {
        long v = rs.getLong(1);
        if (!rs.wasNull()) {
          return OptionalLong.of(v);
        }
      }
    }
    return OptionalLong.empty();
  }

  private static void setDate(PreparedStatement ps, int idx, LocalDate day) throws SQLException {
    if (day == null) {
      ps.setNull(idx, Types.DATE);
    } else {
      ps.setObject(idx, day);
    }
  }
}
