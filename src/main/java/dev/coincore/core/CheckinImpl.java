/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.core;

import dev.coincore.api.Account;
import dev.coincore.api.ActionResult;
import dev.coincore.api.Checkin;
import dev.coincore.api.ErrorCode;
import dev.coincore.api.InvariantViolationException;
import dev.coincore.api.records.CheckinRecord;
import dev.coincore.api.storage.Mutation;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Daily checkin. One reward per account per calendar day in the configured zone; consecutive days
 * grow the streak and unlock the configured bonus tiers.
 */
public final class CheckinImpl implements Checkin {
  private static final String OP = "checkin";
  private static final int RECENT_LIMIT = 7;

  private final EngineContext ctx;
  private final Config.CheckinRules rules;

  CheckinImpl(EngineContext ctx, Config.CheckinRules rules) {
    this.ctx = ctx;
    this.rules = rules;
  }

  @Override
  public ActionResult<CheckinReceipt> checkin(String id, String displayName) {
    if (EngineContext.isInvalidId(id)) {
      return ctx.decline(OP, ErrorCode.INVALID_ARGUMENT, "account id is blank or too long");
    }
    ctx.ensure(id, displayName);
    LocalDate today = ctx.today();
    long now = ctx.nowS();

    Mutation<CheckinReceipt> m =
        ctx.store()
            .inTransaction(
                OP,
                s -> {
                  Account a = EngineContext.lockExisting(s, id);
                  if (s.findCheckin(id, today).isPresent()) {
                    return Mutation.declined(
                        ActionResult.declined(
                            ErrorCode.ALREADY_CHECKED_IN, "already checked in today"));
                  }
                  int streak = nextStreak(a, today);
                  long random = ctx.random().nextLong(rules.randomMin(), rules.randomMax());
                  long bonus = rules.streakBonus(streak);
                  long total = rules.baseReward() + random + bonus;
                  Reward reward = new Reward(rules.baseReward(), random, bonus, total);

                  Account updated = a.withCheckin(reward.total(), streak, today, now);
                  s.updateAccount(updated);
                  s.appendCheckin(new CheckinRecord(0L, id, today, reward.total(), streak, now));
                  return Mutation.applied(
                      new CheckinReceipt(
                          today,
                          reward,
                          streak,
                          updated.totalCheckins(),
                          updated.cash(),
                          updated.savings()),
                      List.of(EngineContext.balanceEvent(a, updated, OP)));
                });
    return ctx.finish(OP, m);
  }

  @Override
  public ActionResult<CheckinStatus> status(String id, String displayName) {
    if (EngineContext.isInvalidId(id)) {
      return ctx.decline(
          "checkin.status", ErrorCode.INVALID_ARGUMENT, "account id is blank or too long");
    }
    ctx.ensure(id, displayName);
    LocalDate today = ctx.today();
    CheckinStatus status =
        ctx.store()
            .read(
                "checkin.status",
                s -> {
                  Account a = s.findAccount(id).orElseThrow();
                  Optional<CheckinRecord> todays = s.findCheckin(id, today);
                  List<CheckinRecord> recent = s.recentCheckins(id, RECENT_LIMIT);
                  long nextStreak = previewStreak(a, today, todays.isPresent());
                  RewardPreview next =
                      new RewardPreview(
                          nextStreak,
                          rules.baseReward(),
                          rules.randomMin(),
                          rules.randomMax(),
                          rules.streakBonus(nextStreak));
                  return new CheckinStatus(
                      todays.isPresent(),
                      todays.map(CheckinRecord::rewardAmount).orElse(0L),
                      a.checkinStreak(),
                      a.totalCheckins(),
                      a.lastCheckinDate(),
                      recent,
                      next);
                });
    return ctx.record("checkin.status", ActionResult.success(status));
  }

  /**
   * Streak after checking in on {@code today}.
   *
   * @throws InvariantViolationException when the account claims a checkin today, or in the future,
   *     without a matching record
   */
  static int nextStreak(Account a, LocalDate today) {
    LocalDate last = a.lastCheckinDate();
    if (last == null) {
      return 1;
    }
    long gap = ChronoUnit.DAYS.between(last, today);
    if (gap <= 0) {
      throw new InvariantViolationException(
          "account " + a.id() + " last checked in " + last + " but has no record for " + today);
    }
    return gap == 1 ? a.checkinStreak() + 1 : 1;
  }

  /** Streak the next checkin will carry: tomorrow's if already checked in today. */
  static long previewStreak(Account a, LocalDate today, boolean checkedInToday) {
    if (checkedInToday) {
      return a.checkinStreak() + 1L;
    }
    LocalDate last = a.lastCheckinDate();
    if (last != null && last.plusDays(1).equals(today)) {
      return a.checkinStreak() + 1L;
    }
    return 1L;
  }
}
