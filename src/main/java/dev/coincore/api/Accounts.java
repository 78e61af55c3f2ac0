/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.api;

import dev.coincore.api.storage.LedgerSession.RobberyTally;
import dev.coincore.api.storage.LedgerSession.Tally;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Account directory. */
public interface Accounts {

  /**
   * Creates the account with zero balances if it is missing, otherwise refreshes its display name.
   * Engine entry points call this once before their atomic unit.
   *
   * @param id stable external identity
   * @param displayName last seen display name
   * @return the account after the upsert
   * @throws IllegalArgumentException when {@code id} is blank
   */
  Account ensure(String id, String displayName);

  /**
   * Looks up an account without creating it.
   *
   * @param id account id
   * @return the account, if present
   */
  Optional<Account> find(String id);

  /**
   * Profile card: balances, level progress and headline ranks. Creates the account if missing.
   *
   * @param id account id
   * @param displayName last seen display name
   * @return profile or a decline for a malformed id
   */
  ActionResult<Profile> profile(String id, String displayName);

  /**
   * Lifetime activity totals across the bank, work, checkin and robbery logs.
   *
   * @param id account id
   * @return statistics, or {@link ErrorCode#ACCOUNT_NOT_FOUND}
   */
  ActionResult<Statistics> statistics(String id);

  /**
   * Checkins and bank transactions merged into one feed, newest first.
   *
   * @param id account id
   * @param limit entries wanted, 1 to {@value #MAX_ACTIVITY}
   * @return feed, or a decline for a missing account or an out-of-range limit
   */
  ActionResult<List<Activity>> recentActivity(String id, int limit);

  /** Largest {@link #recentActivity(String, int)} page. */
  int MAX_ACTIVITY = 50;

  /**
   * Profile snapshot.
   *
   * @param account account state
   * @param level level progress
   * @param totalAssets cash plus savings
   * @param cashRank rank by cash
   * @param assetsRank rank by total assets
   * @param participants accounts with cash or checkins
   */
  record Profile(
      Account account,
      LevelProgress level,
      long totalAssets,
      long cashRank,
      long assetsRank,
      long participants) {}

  /**
   * Lifetime statistics.
   *
   * @param transactions bank transactions of every type
   * @param totalDeposited deposited amount
   * @param totalWithdrawn withdrawn amount
   * @param shifts work shifts
   * @param workIncome income from all shifts
   * @param workByJob per-job shifts and income, by job name
   * @param checkins lifetime checkins
   * @param checkinStreak current consecutive-day streak
   * @param asRobber robberies attempted
   * @param asVictim robberies suffered
   */
  record Statistics(
      long transactions,
      long totalDeposited,
      long totalWithdrawn,
      long shifts,
      long workIncome,
      Map<String, Tally> workByJob,
      long checkins,
      int checkinStreak,
      RobberyTally asRobber,
      RobberyTally asVictim) {

    /** Mean income per shift of {@code job}, 0 when never worked. */
    public long averageIncome(String job) {
      Tally t = workByJob.get(job);
      return t == null || t.count() == 0 ? 0L : t.total() / t.count();
    }

    /** Successful robberies as a percentage of attempts, one decimal. */
    public double robberySuccessPercent() {
      if (asRobber.attempts() == 0) {
        return 0.0D;
      }
      return Math.round(asRobber.successes() * 1000.0D / asRobber.attempts()) / 10.0D;
    }
  }

  /** Where a feed entry came from. */
  enum ActivityKind {
    CHECKIN,
    BANK
  }

  /**
   * One feed entry.
   *
   * @param kind source log
   * @param action {@code checkin} or the transaction type column value
   * @param amount reward or transaction amount
   * @param streak consecutive days for a checkin, 0 for bank entries
   * @param tsS epoch seconds
   */
  record Activity(ActivityKind kind, String action, long amount, int streak, long tsS) {}
}
