/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.modules.scheduler;

import java.time.Instant;
import java.util.List;

/** Operator surface over the cron jobs: inspection and manual triggering. */
public interface SchedulerService {

  /**
   * Current state of every registered job, ordered by name.
   *
   * @return job snapshots
   */
  List<JobStatus> jobs();

  /**
   * Queues the named job for immediate execution on the core scheduler.
   *
   * @param name job name, e.g. {@code bank.interest}
   * @return how the request was handled
   */
  RunResult runNow(String name);

  /**
   * Point-in-time view of one job.
   *
   * @param name job name
   * @param schedule 6-field cron expression
   * @param description what the job does
   * @param nextRun next scheduled firing, {@code null} before the first schedule
   * @param lastRun start of the latest run, {@code null} if it never ran
   * @param running whether a run is in progress
   * @param lastSummary summary reported by the latest successful run
   * @param lastError failure message of the latest run, {@code null} when it succeeded
   * @param successCount completed runs
   * @param failureCount failed runs
   */
  record JobStatus(
      String name,
      String schedule,
      String description,
      Instant nextRun,
      Instant lastRun,
      boolean running,
      String lastSummary,
      String lastError,
      long successCount,
      long failureCount)
      implements Comparable<JobStatus> {

    @Override
    public int compareTo(JobStatus o) {
      return name.compareToIgnoreCase(o.name);
    }
  }

  /** Outcome of {@link #runNow(String)}. */
  enum RunResult {
    /** Submitted to the executor. */
    QUEUED,
    /** Already queued or running; nothing submitted. */
    IN_PROGRESS,
    /** No such job, or the executor refused the submission. */
    UNKNOWN,
    /** The scheduler is stopped. */
    DISABLED
  }
}
