/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.api;

import java.util.List;

/** Read-only leaderboards. */
public interface Rankings {

  /**
   * One plus the number of accounts strictly ahead on {@code metric}.
   *
   * @param id account id
   * @param metric ranking metric
   * @return standing or {@link ErrorCode#ACCOUNT_NOT_FOUND}
   */
  ActionResult<Standing> rank(String id, Metric metric);

  /**
   * Top accounts with a positive metric, ties broken by ascending id.
   *
   * @param metric ranking metric
   * @param n maximum entries, {@code > 0}
   * @return entries in rank order
   */
  ActionResult<List<Entry>> topN(Metric metric, int n);

  /**
   * Accounts with positive cash or at least one checkin.
   *
   * @return participant count
   */
  long participantCount();

  /** Ranking metrics. */
  enum Metric {
    /** Cash balance. */
    CASH,
    /** Cash plus savings. */
    TOTAL_ASSETS,
    /** Lifetime work income. */
    TOTAL_EARNED,
    /** Experience, compared by level first. */
    EXPERIENCE,
    /** Lifetime checkins. */
    TOTAL_CHECKINS;

    /** Metric value of {@code account}. */
    public long valueOf(Account account) {
      return switch (this) {
        case CASH -> account.cash();
        case TOTAL_ASSETS -> account.totalAssets();
        case TOTAL_EARNED -> account.totalEarned();
        case EXPERIENCE -> account.experience();
        case TOTAL_CHECKINS -> account.totalCheckins();
      };
    }
  }

  /**
   * Standing of one account.
   *
   * @param accountId account id
   * @param metric metric ranked on
   * @param value metric value
   * @param rank 1-based rank
   * @param participants accounts with cash or checkins
   */
  record Standing(String accountId, Metric metric, long value, long rank, long participants) {}

  /**
   * Leaderboard row.
   *
   * @param rank 1-based position
   * @param accountId account id
   * @param displayName display name
   * @param value metric value
   * @param level account level
   */
  record Entry(long rank, String accountId, String displayName, long value, int level) {}
}
