/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.api;

import dev.coincore.api.records.WorkRecord;
import dev.coincore.api.storage.LedgerSession.Tally;
import java.util.List;
import java.util.Map;

/** Job catalog and paid shifts. */
public interface Work {

  /**
   * Configured jobs in catalog order.
   *
   * @return immutable catalog
   */
  List<Job> catalog();

  /**
   * Works one shift of {@code jobName}.
   *
   * @param id account id
   * @param displayName last seen display name
   * @param jobName catalog job name
   * @return payslip or a decline ({@link ErrorCode#UNKNOWN_JOB}, {@link ErrorCode#LEVEL_TOO_LOW},
   *     {@link ErrorCode#DAILY_QUOTA_EXCEEDED}, {@link ErrorCode#ON_COOLDOWN})
   */
  ActionResult<Payslip> work(String id, String displayName, String jobName);

  /**
   * Per-job availability for the account.
   *
   * @param id account id
   * @param displayName last seen display name
   * @return job board
   */
  ActionResult<JobBoard> jobBoard(String id, String displayName);

  /**
   * Work history summary.
   *
   * @param id account id
   * @return stats, or {@link ErrorCode#ACCOUNT_NOT_FOUND}
   */
  ActionResult<WorkStats> stats(String id);

  /**
   * Catalog entry.
   *
   * @param name unique job name
   * @param baseSalary nominal salary the level bonus is computed from
   * @param minSalary lowest drawn salary
   * @param maxSalary highest drawn salary
   * @param levelRequired minimum level
   * @param cooldownHours hours between shifts of this job, before the multiplier
   * @param expReward experience per shift, before the multiplier
   */
  record Job(
      String name,
      long baseSalary,
      long minSalary,
      long maxSalary,
      int levelRequired,
      double cooldownHours,
      long expReward) {}

  /**
   * Paid shift.
   *
   * @param jobName job worked
   * @param salary drawn salary
   * @param levelBonus bonus for levels above 1
   * @param luckBonus lucky bonus, 0 when the draw missed
   * @param total cash paid
   * @param expGain experience gained
   * @param oldLevel level before
   * @param newLevel level after
   * @param cash cash after
   * @param experience experience after
   * @param shiftsToday shifts today including this one
   * @param remainingToday shifts left today
   */
  record Payslip(
      String jobName,
      long salary,
      long levelBonus,
      long luckBonus,
      long total,
      long expGain,
      int oldLevel,
      int newLevel,
      long cash,
      long experience,
      long shiftsToday,
      long remainingToday) {

    /** Whether this shift raised the level. */
    public boolean leveledUp() {
      return newLevel > oldLevel;
    }
  }

  /**
   * Availability of one job.
   *
   * @param job catalog entry
   * @param levelMet whether the level gate is met
   * @param cooldownEndsAtS epoch second the cooldown ends, 0 when not cooling down
   * @param cooldownMinutes minutes left, rounded up
   */
  record JobSlot(Job job, boolean levelMet, long cooldownEndsAtS, long cooldownMinutes) {
    /** Level met and not cooling down. */
    public boolean available() {
      return levelMet && cooldownMinutes == 0;
    }
  }

  /**
   * Job board.
   *
   * @param level account level
   * @param shiftsToday shifts worked today
   * @param remainingToday shifts left today
   * @param jobs per-job availability in catalog order
   */
  record JobBoard(int level, long shiftsToday, long remainingToday, List<JobSlot> jobs) {
    /** Whether any shift is still allowed today. */
    public boolean canWorkToday() {
      return remainingToday > 0;
    }
  }

  /**
   * Work history summary.
   *
   * @param totalShifts lifetime shifts
   * @param totalIncome lifetime work income
   * @param shiftsToday shifts today
   * @param incomeToday income today
   * @param remainingToday shifts left today
   * @param byJob per-job tallies
   * @param recent up to 5 most recent shifts, newest first
   */
  record WorkStats(
      long totalShifts,
      long totalIncome,
      long shiftsToday,
      long incomeToday,
      long remainingToday,
      Map<String, Tally> byJob,
      List<WorkRecord> recent) {}
}
