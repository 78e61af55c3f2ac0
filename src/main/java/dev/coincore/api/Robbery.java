/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.api;

import dev.coincore.api.storage.LedgerSession.RobberyTally;
import java.util.List;

/** Cash robbery between two accounts. */
public interface Robbery {

  /**
   * Attempts to rob {@code victimId}. Both accounts change in one atomic unit.
   *
   * @param robberId acting account
   * @param robberName acting account display name
   * @param victimId target account; must already exist
   * @return outcome (success or failure of the robbery itself) or a decline ({@link
   *     ErrorCode#SELF_TARGET}, {@link ErrorCode#LEVEL_TOO_LOW}, {@link ErrorCode#ON_COOLDOWN},
   *     {@link ErrorCode#VICTIM_PROTECTED}, {@link ErrorCode#ACCOUNT_NOT_FOUND})
   */
  ActionResult<RobberyOutcome> rob(String robberId, String robberName, String victimId);

  /**
   * Robbery history summary.
   *
   * @param id account id
   * @return stats, or {@link ErrorCode#ACCOUNT_NOT_FOUND}
   */
  ActionResult<RobberyStats> stats(String id);

  /**
   * Accounts that can currently be robbed, richest first.
   *
   * @param robberId caller, excluded from the list
   * @param limit maximum entries, {@code > 0}
   * @return targets
   */
  ActionResult<List<Target>> targets(String robberId, int limit);

  /**
   * Result of a robbery attempt.
   *
   * @param success whether the robbery succeeded
   * @param amount cash taken, or penalty paid to the victim on failure
   * @param robberCash robber cash after
   * @param victimCash victim cash after
   */
  record RobberyOutcome(boolean success, long amount, long robberCash, long victimCash) {}

  /**
   * Robbery history.
   *
   * @param asRobber all-time tallies as robber
   * @param asVictim all-time tallies as victim
   * @param successRate successes over attempts, 0 with no attempts
   * @param robberiesToday attempts today
   * @param robbedToday times robbed today
   * @param cooldownMinutes minutes until the next attempt is allowed
   */
  record RobberyStats(
      RobberyTally asRobber,
      RobberyTally asVictim,
      double successRate,
      long robberiesToday,
      long robbedToday,
      long cooldownMinutes) {}

  /**
   * Robbable account.
   *
   * @param id account id
   * @param displayName display name
   * @param cash cash balance
   * @param level level
   * @param totalAssets cash plus savings
   * @param minTake smallest possible take
   * @param maxTake largest possible take
   */
  record Target(
      String id,
      String displayName,
      long cash,
      int level,
      long totalAssets,
      long minTake,
      long maxTake) {}
}
