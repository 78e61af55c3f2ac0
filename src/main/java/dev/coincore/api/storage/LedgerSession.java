/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.api.storage;

import dev.coincore.api.Account;
import dev.coincore.api.Rankings.Metric;
import dev.coincore.api.records.CheckinRecord;
import dev.coincore.api.records.RobberyRecord;
import dev.coincore.api.records.TransactionRecord;
import dev.coincore.api.records.TransactionType;
import dev.coincore.api.records.WorkRecord;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Operations available inside one atomic unit.
 *
 * <p>Time windows are half-open epoch-second ranges {@code [fromS, toS)}. Counts and sums read
 * inside a mutating unit see the unit's own writes.
 */
public interface LedgerSession {

  /** Reads an account without locking it. */
  Optional<Account> findAccount(String id) throws SQLException;

  /** Reads and locks an account for the rest of the unit. */
  Optional<Account> lockAccount(String id) throws SQLException;

  /**
   * Locks several accounts in ascending id order. Missing ids are absent from the result.
   *
   * @param ids account ids
   * @return locked accounts keyed by id
   */
  Map<String, Account> lockAccounts(List<String> ids) throws SQLException;

  /** Writes back a locked account. */
  void updateAccount(Account account) throws SQLException;

  void appendTransaction(TransactionRecord record) throws SQLException;

  void appendWork(WorkRecord record) throws SQLException;

  void appendCheckin(CheckinRecord record) throws SQLException;

  void appendRobbery(RobberyRecord record) throws SQLException;

  Optional<CheckinRecord> findCheckin(String accountId, LocalDate day) throws SQLException;

  List<CheckinRecord> recentCheckins(String accountId, int limit) throws SQLException;

  /** Count and sum of {@code type} transactions in the window. */
  Tally transactionTally(String accountId, TransactionType type, long fromS, long toS)
      throws SQLException;

  List<TransactionRecord> recentTransactions(String accountId, int limit) throws SQLException;

  /** Count and summed {@code totalEarned} of work records in the window. */
  Tally workTally(String accountId, long fromS, long toS) throws SQLException;

  /** Per-job count and income, all time. */
  Map<String, Tally> workTallyByJob(String accountId) throws SQLException;

  /** Most recent shift time per job. */
  Map<String, Long> lastWorkByJob(String accountId) throws SQLException;

  OptionalLong lastWorkAt(String accountId, String jobName) throws SQLException;

  List<WorkRecord> recentWork(String accountId, int limit) throws SQLException;

  OptionalLong lastRobberyAt(String robberId) throws SQLException;

  /**
   * Robbery tallies for an account in the window.
   *
   * @param accountId account id
   * @param asRobber {@code true} for robberies the account attempted, {@code false} for those
   *     it suffered
   */
  RobberyTally robberyTally(String accountId, boolean asRobber, long fromS, long toS)
      throws SQLException;

  /** Accounts other than {@code excludeId} holding at least {@code minCash}, highest cash first. */
  List<Account> accountsWithCashAtLeast(long minCash, String excludeId, int limit)
      throws SQLException;

  /** Up to {@code limit} ids with positive savings and id greater than {@code afterId}. */
  List<String> savingsHoldersAfter(String afterId, int limit) throws SQLException;

  /** Accounts strictly ahead of {@code account} on {@code metric}. */
  long countAhead(Metric metric, Account account) throws SQLException;

  /** Top accounts with a positive {@code metric}, ties broken by ascending id. */
  List<Account> top(Metric metric, int limit) throws SQLException;

  /** Accounts with cash or checkins. */
  long participantCount() throws SQLException;

  /**
   * Count and amount total.
   *
   * @param count number of rows
   * @param total summed amount
   */
  record Tally(long count, long total) {
    public static final Tally EMPTY = new Tally(0L, 0L);
  }

  /**
   * Robbery counters.
   *
   * @param attempts robberies
   * @param successes successful robberies
   * @param successAmount cash moved by successful robberies
   * @param failureAmount penalties moved by failed robberies
   */
  record RobberyTally(long attempts, long successes, long successAmount, long failureAmount) {
    public static final RobberyTally EMPTY = new RobberyTally(0L, 0L, 0L, 0L);
  }
}
