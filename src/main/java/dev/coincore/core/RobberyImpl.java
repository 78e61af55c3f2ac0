/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.core;

import dev.coincore.api.Account;
import dev.coincore.api.ActionResult;
import dev.coincore.api.ErrorCode;
import dev.coincore.api.InvariantViolationException;
import dev.coincore.api.Robbery;
import dev.coincore.api.events.EconomyEvents;
import dev.coincore.api.records.RobberyRecord;
import dev.coincore.api.storage.LedgerSession.RobberyTally;
import dev.coincore.api.storage.Mutation;
import dev.coincore.util.GameDays;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/** Cash robbery between two accounts, resolved by one draw against the success rate. */
public final class RobberyImpl implements Robbery {
  private static final String OP = "robbery";
  private static final int MAX_TARGETS = 50;

  private final EngineContext ctx;
  private final Config.RobberyRules rules;

  RobberyImpl(EngineContext ctx, Config.RobberyRules rules) {
    this.ctx = ctx;
    this.rules = rules;
  }

  @Override
  public ActionResult<RobberyOutcome> rob(String robberId, String robberName, String victimId) {
    if (EngineContext.isInvalidId(robberId) || EngineContext.isInvalidId(victimId)) {
      return ctx.decline(OP, ErrorCode.INVALID_ARGUMENT, "account id is blank or too long");
    }
    if (robberId.equals(victimId)) {
      return ctx.decline(OP, ErrorCode.SELF_TARGET, "cannot rob yourself");
    }
    ctx.ensure(robberId, robberName);
    long now = ctx.nowS();

    Mutation<RobberyOutcome> m =
        ctx.store()
            .inTransaction(
                OP,
                s -> {
                  Map<String, Account> locked = s.lockAccounts(List.of(robberId, victimId));
                  Account robber = locked.get(robberId);
                  if (robber == null) {
                    throw new InvariantViolationException(
                        "account missing after ensure: " + robberId);
                  }
                  Account victim = locked.get(victimId);
                  if (victim == null) {
                    return Mutation.declined(
                        ActionResult.declined(ErrorCode.ACCOUNT_NOT_FOUND, "no account " + victimId));
                  }
                  if (robber.level() < rules.levelRequirement()) {
                    return Mutation.declined(
                        ActionResult.declined(
                            ErrorCode.LEVEL_TOO_LOW,
                            "robbery requires level " + rules.levelRequirement(),
                            rules.levelRequirement() - robber.level()));
                  }
                  long left = cooldownLeft(s.lastRobberyAt(robberId), now);
                  if (left > 0) {
                    long minutes = GameDays.ceilMinutes(left);
                    return Mutation.declined(
                        ActionResult.declined(
                            ErrorCode.ON_COOLDOWN,
                            "next robbery in " + minutes + " min",
                            minutes));
                  }
                  if (victim.cash() < rules.protectionAmount()) {
                    return Mutation.declined(
                        ActionResult.declined(
                            ErrorCode.VICTIM_PROTECTED,
                            victimId + " holds less than " + rules.protectionAmount(),
                            rules.protectionAmount() - victim.cash()));
                  }

                  boolean success = ctx.random().nextDouble() < rules.successRate();
                  long amount;
                  Account robberAfter;
                  Account victimAfter;
                  if (success) {
                    long cap = maxTake(victim.cash());
                    amount =
                        cap < rules.minAmount()
                            ? cap
                            : ctx.random().nextLong(rules.minAmount(), cap);
                    robberAfter = robber.withCash(robber.cash() + amount, now);
                    victimAfter = victim.withCash(victim.cash() - amount, now);
                  } else {
                    amount = Math.min(rules.failurePenalty(), robber.cash());
                    robberAfter = robber.withCash(robber.cash() - amount, now);
                    victimAfter = victim.withCash(victim.cash() + amount, now);
                  }
                  s.updateAccount(robberAfter);
                  s.updateAccount(victimAfter);
                  s.appendRobbery(new RobberyRecord(0L, robberId, victimId, amount, success, now));

                  List<EconomyEvents.Event> events = new ArrayList<>(2);
                  if (amount > 0) {
                    events.add(EngineContext.balanceEvent(robber, robberAfter, OP));
                    events.add(EngineContext.balanceEvent(victim, victimAfter, OP));
                  }
                  return Mutation.applied(
                      new RobberyOutcome(success, amount, robberAfter.cash(), victimAfter.cash()),
                      events);
                });
    return ctx.finish(OP, m);
  }

  @Override
  public ActionResult<RobberyStats> stats(String id) {
    if (EngineContext.isInvalidId(id)) {
      return ctx.decline(
          "robbery.stats", ErrorCode.INVALID_ARGUMENT, "account id is blank or too long");
    }
    GameDays.Window day = ctx.todayWindow();
    long now = ctx.nowS();
    Optional<RobberyStats> stats =
        ctx.store()
            .read(
                "robbery.stats",
                s -> {
                  if (s.findAccount(id).isEmpty()) {
                    return Optional.empty();
                  }
                  RobberyTally asRobber = s.robberyTally(id, true, 0L, Long.MAX_VALUE);
                  RobberyTally asVictim = s.robberyTally(id, false, 0L, Long.MAX_VALUE);
                  double rate =
                      asRobber.attempts() == 0
                          ? 0.0D
                          : (double) asRobber.successes() / asRobber.attempts();
                  return Optional.of(
                      new RobberyStats(
                          asRobber,
                          asVictim,
                          rate,
                          s.robberyTally(id, true, day.startS(), day.endS()).attempts(),
                          s.robberyTally(id, false, day.startS(), day.endS()).attempts(),
                          GameDays.ceilMinutes(cooldownLeft(s.lastRobberyAt(id), now))));
                });
    if (stats.isEmpty()) {
      return ctx.decline("robbery.stats", ErrorCode.ACCOUNT_NOT_FOUND, "no account " + id);
    }
    return ctx.record("robbery.stats", ActionResult.success(stats.get()));
  }

  @Override
  public ActionResult<List<Target>> targets(String robberId, int limit) {
    if (EngineContext.isInvalidId(robberId)) {
      return ctx.decline(
          "robbery.targets", ErrorCode.INVALID_ARGUMENT, "account id is blank or too long");
    }
    if (limit < 1) {
      return ctx.decline("robbery.targets", ErrorCode.INVALID_ARGUMENT, "limit must be >= 1");
    }
    int capped = Math.min(limit, MAX_TARGETS);
    List<Target> targets =
        ctx.store()
            .read(
                "robbery.targets",
                s -> {
                  List<Target> out = new ArrayList<>();
                  for (Account a :
                      s.accountsWithCashAtLeast(rules.protectionAmount(), robberId, capped)) {
                    long max = maxTake(a.cash());
                    out.add(
                        new Target(
                            a.id(),
                            a.displayName(),
                            a.cash(),
                            a.level(),
                            a.totalAssets(),
                            Math.min(rules.minAmount(), max),
                            max));
                  }
                  return out;
                });
    return ctx.record("robbery.targets", ActionResult.success(targets));
  }

  private long maxTake(long victimCash) {
    return Math.max(0L, Math.min(rules.maxAmount(), victimCash - rules.protectionAmount()));
  }

  private long cooldownLeft(OptionalLong lastAt, long now) {
    if (lastAt.isEmpty()) {
      return 0L;
    }
    return GameDays.cooldownRemaining(
        lastAt.getAsLong(), GameDays.hoursToSeconds(rules.cooldownHours()), now);
  }
}
