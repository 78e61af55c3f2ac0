/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.core;

import dev.coincore.api.Account;
import dev.coincore.api.ActionResult;
import dev.coincore.api.ErrorCode;
import dev.coincore.api.Work;
import dev.coincore.api.events.EconomyEvents;
import dev.coincore.api.events.EconomyEvents.LevelUpEvent;
import dev.coincore.api.records.WorkRecord;
import dev.coincore.api.storage.LedgerSession.Tally;
import dev.coincore.api.storage.Mutation;
import dev.coincore.util.GameDays;
import dev.coincore.util.Levels;
import dev.coincore.util.Rates;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Shifts from the configured job catalog.
 *
 * <p>The daily quota and the per-job cooldown are read from the work log inside the same unit that
 * appends the new shift, after the account row is locked.
 */
public final class WorkImpl implements Work {
  private static final String OP = "work";
  private static final int RECENT_LIMIT = 5;

  private final EngineContext ctx;
  private final Config.WorkRules rules;

  WorkImpl(EngineContext ctx, Config.WorkRules rules) {
    this.ctx = ctx;
    this.rules = rules;
  }

  @Override
  public List<Job> catalog() {
    return rules.jobs();
  }

  @Override
  public ActionResult<Payslip> work(String id, String displayName, String jobName) {
    if (EngineContext.isInvalidId(id)) {
      return ctx.decline(OP, ErrorCode.INVALID_ARGUMENT, "account id is blank or too long");
    }
    Optional<Job> found = rules.job(jobName);
    if (found.isEmpty()) {
      return ctx.decline(OP, ErrorCode.UNKNOWN_JOB, "no such job: " + jobName);
    }
    Job job = found.get();
    ctx.ensure(id, displayName);
    GameDays.Window day = ctx.todayWindow();
    long now = ctx.nowS();

    Mutation<Payslip> m =
        ctx.store()
            .inTransaction(
                OP,
                s -> {
                  Account a = EngineContext.lockExisting(s, id);
                  if (a.level() < job.levelRequired()) {
                    return Mutation.declined(
                        ActionResult.declined(
                            ErrorCode.LEVEL_TOO_LOW,
                            job.name() + " requires level " + job.levelRequired(),
                            job.levelRequired() - a.level()));
                  }
                  Tally today = s.workTally(id, day.startS(), day.endS());
                  if (today.count() >= rules.dailyLimit()) {
                    return Mutation.declined(
                        ActionResult.declined(
                            ErrorCode.DAILY_QUOTA_EXCEEDED,
                            "daily limit of " + rules.dailyLimit() + " shifts reached"));
                  }
                  OptionalLong last = s.lastWorkAt(id, job.name());
                  if (last.isPresent()) {
                    long left = GameDays.cooldownRemaining(last.getAsLong(), cooldownS(job), now);
                    if (left > 0) {
                      long minutes = GameDays.ceilMinutes(left);
                      return Mutation.declined(
                          ActionResult.declined(
                              ErrorCode.ON_COOLDOWN,
                              job.name() + " available again in " + minutes + " min",
                              minutes));
                    }
                  }

                  long salary = ctx.random().nextLong(job.minSalary(), job.maxSalary());
                  long levelBonus =
                      Rates.levelBonus(job.baseSalary(), a.level(), rules.levelBonusRate());
                  long luckBonus =
                      ctx.random().nextDouble() < rules.luckChance()
                          ? Rates.floorMul(salary, rules.luckRatio())
                          : 0L;
                  long total = salary + levelBonus + luckBonus;
                  long expGain = Rates.floorMul(job.expReward(), rules.expMultiplier());
                  int newLevel = Levels.levelFor(a.experience() + expGain);

                  Account updated = a.withShift(total, expGain, newLevel, now);
                  s.updateAccount(updated);
                  s.appendWork(
                      new WorkRecord(
                          0L, id, job.name(), salary, levelBonus + luckBonus, total, now));

                  List<EconomyEvents.Event> events = new ArrayList<>(2);
                  events.add(EngineContext.balanceEvent(a, updated, OP));
                  if (newLevel > a.level()) {
                    events.add(
                        new LevelUpEvent(id, a.level(), newLevel, EngineContext.EVENT_VERSION));
                  }
                  long shifts = today.count() + 1;
                  return Mutation.applied(
                      new Payslip(
                          job.name(),
                          salary,
                          levelBonus,
                          luckBonus,
                          total,
                          expGain,
                          a.level(),
                          newLevel,
                          updated.cash(),
                          updated.experience(),
                          shifts,
                          Math.max(0L, rules.dailyLimit() - shifts)),
                      events);
                });
    return ctx.finish(OP, m);
  }

  @Override
  public ActionResult<JobBoard> jobBoard(String id, String displayName) {
    if (EngineContext.isInvalidId(id)) {
      return ctx.decline(
          "work.board", ErrorCode.INVALID_ARGUMENT, "account id is blank or too long");
    }
    ctx.ensure(id, displayName);
    GameDays.Window day = ctx.todayWindow();
    long now = ctx.nowS();
    JobBoard board =
        ctx.store()
            .read(
                "work.board",
                s -> {
                  Account a = s.findAccount(id).orElseThrow();
                  Tally today = s.workTally(id, day.startS(), day.endS());
                  Map<String, Long> lastByJob = s.lastWorkByJob(id);
                  List<JobSlot> slots = new ArrayList<>(rules.jobs().size());
                  for (Job job : rules.jobs()) {
                    Long last = lastByJob.get(job.name());
                    long endsAt = last == null ? 0L : last + cooldownS(job);
                    long left =
                        last == null ? 0L : GameDays.cooldownRemaining(last, cooldownS(job), now);
                    slots.add(
                        new JobSlot(
                            job,
                            a.level() >= job.levelRequired(),
                            endsAt,
                            GameDays.ceilMinutes(left)));
                  }
                  return new JobBoard(
                      a.level(),
                      today.count(),
                      Math.max(0L, rules.dailyLimit() - today.count()),
                      slots);
                });
    return ctx.record("work.board", ActionResult.success(board));
  }

  @Override
  public ActionResult<WorkStats> stats(String id) {
    if (EngineContext.isInvalidId(id)) {
      return ctx.decline(
          "work.stats", ErrorCode.INVALID_ARGUMENT, "account id is blank or too long");
    }
    GameDays.Window day = ctx.todayWindow();
    Optional<WorkStats> stats =
        ctx.store()
            .read(
                "work.stats",
                s -> {
                  if (s.findAccount(id).isEmpty()) {
                    return Optional.empty();
                  }
                  Tally all = s.workTally(id, 0L, Long.MAX_VALUE);
                  Tally today = s.workTally(id, day.startS(), day.endS());
                  return Optional.of(
                      new WorkStats(
                          all.count(),
                          all.total(),
                          today.count(),
                          today.total(),
                          Math.max(0L, rules.dailyLimit() - today.count()),
                          s.workTallyByJob(id),
                          s.recentWork(id, RECENT_LIMIT)));
                });
    if (stats.isEmpty()) {
      return ctx.decline("work.stats", ErrorCode.ACCOUNT_NOT_FOUND, "no account " + id);
    }
    return ctx.record("work.stats", ActionResult.success(stats.get()));
  }

  private long cooldownS(Job job) {
    return GameDays.hoursToSeconds(job.cooldownHours() * rules.cooldownMultiplier());
  }
}
