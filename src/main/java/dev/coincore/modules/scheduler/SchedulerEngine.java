/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.modules.scheduler;

import dev.coincore.api.Bank;
import dev.coincore.api.ErrorCode;
import dev.coincore.api.StoreUnavailableException;
import dev.coincore.core.Config;
import dev.coincore.core.Services;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cron-driven job runner on the core scheduler executor.
 *
 * <p>Owns the {@value #INTEREST_JOB} job, which credits one day of savings interest per firing.
 * Cron fields are evaluated in {@code core.time.zone}, the same zone that defines interest cycles.
 */
public final class SchedulerEngine implements SchedulerService {
  private static final Logger LOG = LoggerFactory.getLogger("coincore");

  /** Name of the daily interest job. */
  public static final String INTEREST_JOB = "bank.interest";

  private final Map<String, JobHandle> jobs = new ConcurrentHashMap<>();
  private volatile Services services;
  private volatile ZoneId zone = ZoneId.of("UTC");

  /**
   * Registers the jobs enabled in {@code cfg} and schedules their first firing.
   *
   * @param services running services; the job executor and the bank come from here
   * @param cfg runtime configuration
   */
  public synchronized void start(Services services, Config cfg) {
    this.services = Objects.requireNonNull(services, "services");
    Objects.requireNonNull(cfg, "cfg");
    this.zone = cfg.time().zone();
    jobs.clear();

    if (!cfg.modules().scheduler().enabled()) {
      LOG.info("(coincore) scheduler: disabled by config");
      return;
    }
    Config.Interest interest = cfg.jobs().interest();
    if (!interest.enabled()) {
      LOG.info("(coincore) scheduler: {} disabled by config", INTEREST_JOB);
      return;
    }
    register(
        new JobHandle(
            INTEREST_JOB,
            interest.schedule(),
            this::runInterest,
            "Credits one day of savings interest"));
  }

  /** Cancels pending firings and forgets every job. */
  public synchronized void stop() {
    jobs.values().forEach(JobHandle::cancel);
    jobs.clear();
    services = null;
  }

  @Override
  public List<JobStatus> jobs() {
    return jobs.values().stream().map(JobHandle::snapshot).sorted().collect(Collectors.toList());
  }

  @Override
  public RunResult runNow(String name) {
    Services svc = services;
    if (svc == null) {
      return RunResult.DISABLED;
    }
    JobHandle job = name == null ? null : jobs.get(name);
    if (job == null) {
      return RunResult.UNKNOWN;
    }
    if (!job.claimManualRun()) {
      return RunResult.IN_PROGRESS;
    }
    try {
      svc.scheduler().submit(() -> execute(job, false));
      return RunResult.QUEUED;
    } catch (RejectedExecutionException e) {
      job.releaseManualRun();
      LOG.warn("(coincore) scheduler: executor rejected {}", job.name, e);
      return RunResult.UNKNOWN;
    }
  }

  /**
   * First instant strictly after {@code after} matching {@code cronExpr} in {@code zone}.
   *
   * @param cronExpr 6-field cron expression (sec min hour day month dow)
   * @param after reference instant
   * @param zone zone the fields are evaluated in
   * @return next firing time
   * @throws IllegalArgumentException if the expression is malformed
   */
  public static Instant nextRun(String cronExpr, Instant after, ZoneId zone) {
    return Cron.parse(cronExpr).next(after.plusSeconds(1), zone);
  }

  private void register(JobHandle job) {
    jobs.put(job.name, job);
    scheduleNext(job);
    LOG.info("(coincore) scheduler: {} [{}] next at {}", job.name, job.schedule, job.nextRun);
  }

  private void scheduleNext(JobHandle job) {
    Services svc = services;
    if (svc == null) {
      return;
    }
    Instant now = Instant.now();
    Instant next = job.cron.next(now.plusSeconds(1), zone);
    long delayMs = Math.max(0L, Duration.between(now, next).toMillis());
    job.nextRun = next;
    job.replaceFuture(
        svc.scheduler().schedule(() -> execute(job, true), delayMs, TimeUnit.MILLISECONDS));
  }

  private void execute(JobHandle job, boolean fromSchedule) {
    job.releaseManualRun();
    job.running.set(true);
    job.lastRun = Instant.now();
    try {
      job.lastSummary = job.task.run();
      job.lastError = null;
      job.successes.incrementAndGet();
    } catch (RuntimeException e) {
      job.lastError = e.getMessage();
      job.failures.incrementAndGet();
      logFailure(job.name, e);
    } finally {
      job.running.set(false);
      if (fromSchedule) {
        scheduleNext(job);
      }
    }
  }

  private String runInterest() {
    Services svc = services;
    if (svc == null) {
      return "skipped: scheduler stopped";
    }
    Bank.InterestReport report = svc.bank().accrueDailyInterest();
    LocalDate cycle = report.cycle();
    if (report.failed() > 0) {
      throw new IllegalStateException(
          report.failed() + " account(s) failed interest for cycle " + cycle);
    }
    return "cycle="
        + cycle
        + " credited="
        + report.processed()
        + " skipped="
        + report.skipped()
        + " total="
        + report.totalInterest();
  }

  private static void logFailure(String jobName, RuntimeException error) {
    ErrorCode code =
        error instanceof StoreUnavailableException store && store.errorCode() != null
            ? store.errorCode()
            : ErrorCode.STORE_UNAVAILABLE;
    LOG.warn("(coincore) code={} op={} message={}", code, jobName, error.getMessage(), error);
  }

  @FunctionalInterface
  private interface JobTask {
    /** Runs once and returns a one-line summary for {@link JobStatus#lastSummary()}. */
    String run();
  }

  /** Mutable per-job state; {@link #snapshot()} freezes it for callers. */
  private static final class JobHandle {
    final String name;
    final String schedule;
    final String description;
    final Cron cron;
    final JobTask task;
    final AtomicBoolean running = new AtomicBoolean();
    final AtomicBoolean manualQueued = new AtomicBoolean();
    final AtomicLong successes = new AtomicLong();
    final AtomicLong failures = new AtomicLong();
    volatile Instant nextRun;
    volatile Instant lastRun;
    volatile String lastSummary;
    volatile String lastError;
    private ScheduledFuture<?> future;

    JobHandle(String name, String schedule, JobTask task, String description) {
      this.name = name;
      this.schedule = schedule;
      this.description = description;
      this.cron = Cron.parse(schedule);
      this.task = task;
    }

    /** Claims the single manual slot unless a run is queued or in progress. */
    synchronized boolean claimManualRun() {
      if (running.get()) {
        return false;
      }
      return manualQueued.compareAndSet(false, true);
    }

    void releaseManualRun() {
      manualQueued.set(false);
    }

    synchronized void replaceFuture(ScheduledFuture<?> next) {
      ScheduledFuture<?> prev = future;
      future = next;
      if (prev != null) {
        prev.cancel(false);
      }
    }

    synchronized void cancel() {
      if (future != null) {
        future.cancel(false);
        future = null;
      }
    }

    JobStatus snapshot() {
      return new JobStatus(
          name,
          schedule,
          description,
          nextRun,
          lastRun,
          running.get(),
          lastSummary,
          lastError,
          successes.get(),
          failures.get());
    }
  }

  /** 6-field cron expression: second, minute, hour, day of month, month, day of week. */
  private record Cron(
      Field seconds, Field minutes, Field hours, Field days, Field months, Field weekdays) {
    private static final int MAX_STEPS = 100_000;

    static Cron parse(String expression) {
      if (expression == null) {
        throw new IllegalArgumentException("cron expression is null");
      }
      String[] parts = expression.trim().split("\\s+");
      if (parts.length != 6) {
        throw new IllegalArgumentException(
            "cron needs 6 fields (sec min hour day month dow): " + expression);
      }
      return new Cron(
          Field.parse(parts[0], 0, 59),
          Field.parse(parts[1], 0, 59),
          Field.parse(parts[2], 0, 23),
          Field.parse(parts[3], 1, 31),
          Field.parse(parts[4], 1, 12),
          Field.parse(parts[5], 0, 7));
    }

    /** Earliest matching instant at or after {@code from}, skipping whole units on a miss. */
    Instant next(Instant from, ZoneId zone) {
      ZonedDateTime t = from.atZone(zone).truncatedTo(ChronoUnit.SECONDS);
      for (int step = 0; step < MAX_STEPS; step++) {
        if (!months.matches(t.getMonthValue())) {
          t = t.toLocalDate().withDayOfMonth(1).plusMonths(1).atStartOfDay(zone);
        } else if (!dayMatches(t)) {
          t = t.toLocalDate().plusDays(1).atStartOfDay(zone);
        } else if (!hours.matches(t.getHour())) {
          t = t.truncatedTo(ChronoUnit.HOURS).plusHours(1);
        } else if (!minutes.matches(t.getMinute())) {
          t = t.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        } else if (!seconds.matches(t.getSecond())) {
          t = t.plusSeconds(1);
        } else {
          return t.toInstant();
        }
      }
      throw new IllegalStateException("no firing time found for cron within search bound");
    }

    /** Both day fields restricted means either may match, as in classic cron. */
    private boolean dayMatches(ZonedDateTime t) {
      boolean dom = days.matches(t.getDayOfMonth());
      boolean dow = weekdays.matches(t.getDayOfWeek().getValue() % 7);
      if (days.any() && weekdays.any()) {
        return true;
      }
      if (days.any()) {
        return dow;
      }
      if (weekdays.any()) {
        return dom;
      }
      return dom || dow;
    }
  }

  /** One cron field as a set of allowed values; {@code any} for {@code *} or {@code ?}. */
  private record Field(boolean any, BitSet allowed) {

    static Field parse(String token, int min, int max) {
      if ("*".equals(token) || "?".equals(token)) {
        return new Field(true, new BitSet());
      }
      BitSet allowed = new BitSet(max + 1);
      for (String item : token.split(",")) {
        addItem(allowed, item, min, max);
      }
      // day of week: 7 and 0 are both Sunday
      if (max == 7 && allowed.get(7)) {
        allowed.clear(7);
        allowed.set(0);
      }
      return new Field(false, allowed);
    }

    private static void addItem(BitSet allowed, String item, int min, int max) {
      int slash = item.indexOf('/');
      String range = slash < 0 ? item : item.substring(0, slash);
      int step = slash < 0 ? 1 : parseInt(item.substring(slash + 1), item);
      if (step < 1) {
        throw new IllegalArgumentException("cron step must be positive: " + item);
      }
      int lo;
      int hi;
      if ("*".equals(range)) {
        lo = min;
        hi = max;
      } else {
        int dash = range.indexOf('-', 1);
        if (dash > 0) {
          lo = parseInt(range.substring(0, dash), item);
          hi = parseInt(range.substring(dash + 1), item);
        } else {
          lo = parseInt(range, item);
          hi = slash < 0 ? lo : max;
        }
      }
      if (lo < min || hi > max || lo > hi) {
        throw new IllegalArgumentException(
            "cron value out of range " + min + "-" + max + ": " + item);
      }
      for (int v = lo; v <= hi; v += step) {
        allowed.set(v);
      }
    }

    private static int parseInt(String raw, String item) {
      try {
        return Integer.parseInt(raw.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("invalid cron item: " + item, e);
      }
    }

    boolean matches(int value) {
      return any || allowed.get(value);
    }
  }
}
