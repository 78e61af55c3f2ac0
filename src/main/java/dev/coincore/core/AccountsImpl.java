/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.core;

import dev.coincore.api.Account;
import dev.coincore.api.Accounts;
import dev.coincore.api.ActionResult;
import dev.coincore.api.ErrorCode;
import dev.coincore.api.Rankings.Metric;
import dev.coincore.api.records.CheckinRecord;
import dev.coincore.api.records.TransactionRecord;
import dev.coincore.api.records.TransactionType;
import dev.coincore.api.storage.LedgerSession.Tally;
import dev.coincore.util.Levels;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Store-backed implementation of {@link Accounts}. */
public final class AccountsImpl implements Accounts {
  private final EngineContext ctx;

  AccountsImpl(EngineContext ctx) {
    this.ctx = ctx;
  }

  @Override
  public Account ensure(String id, String displayName) {
    if (EngineContext.isInvalidId(id)) {
      throw new IllegalArgumentException("account id is blank or too long");
    }
    return ctx.ensure(id, displayName);
  }

  @Override
  public Optional<Account> find(String id) {
    if (EngineContext.isInvalidId(id)) {
      return Optional.empty();
    }
    return ctx.store().read("accounts.find", s -> s.findAccount(id));
  }

  @Override
  public ActionResult<Profile> profile(String id, String displayName) {
    if (EngineContext.isInvalidId(id)) {
      return ctx.decline(
          "accounts.profile", ErrorCode.INVALID_ARGUMENT, "account id is blank or too long");
    }
    ctx.ensure(id, displayName);
    Profile profile =
        ctx.store()
            .read(
                "accounts.profile",
                s -> {
                  Account a = s.findAccount(id).orElseThrow();
                  return new Profile(
                      a,
                      Levels.progress(a.experience()),
                      a.totalAssets(),
                      s.countAhead(Metric.CASH, a) + 1,
                      s.countAhead(Metric.TOTAL_ASSETS, a) + 1,
                      s.participantCount());
                });
    return ctx.record("accounts.profile", ActionResult.success(profile));
  }

  @Override
  public ActionResult<Statistics> statistics(String id) {
    if (EngineContext.isInvalidId(id)) {
      return ctx.decline(
          "accounts.statistics", ErrorCode.INVALID_ARGUMENT, "account id is blank or too long");
    }
    Optional<Statistics> stats =
        ctx.store()
            .read(
                "accounts.statistics",
                s -> {
                  Optional<Account> found = s.findAccount(id);
                  if (found.isEmpty()) {
                    return Optional.empty();
                  }
                  Account a = found.get();
                  Map<TransactionType, Tally> bank = new EnumMap<>(TransactionType.class);
                  long transactions = 0L;
                  for (TransactionType type : TransactionType.values()) {
                    Tally t = s.transactionTally(id, type, 0L, Long.MAX_VALUE);
                    bank.put(type, t);
                    transactions += t.count();
                  }
                  Tally work = s.workTally(id, 0L, Long.MAX_VALUE);
                  return Optional.of(
                      new Statistics(
                          transactions,
                          bank.get(TransactionType.DEPOSIT).total(),
                          bank.get(TransactionType.WITHDRAW).total(),
                          work.count(),
                          work.total(),
                          s.workTallyByJob(id),
                          a.totalCheckins(),
                          a.checkinStreak(),
                          s.robberyTally(id, true, 0L, Long.MAX_VALUE),
                          s.robberyTally(id, false, 0L, Long.MAX_VALUE)));
                });
    if (stats.isEmpty()) {
      return ctx.decline("accounts.statistics", ErrorCode.ACCOUNT_NOT_FOUND, "no account " + id);
    }
    return ctx.record("accounts.statistics", ActionResult.success(stats.get()));
  }

  @Override
  public ActionResult<List<Activity>> recentActivity(String id, int limit) {
    String op = "accounts.activity";
    if (EngineContext.isInvalidId(id)) {
      return ctx.decline(op, ErrorCode.INVALID_ARGUMENT, "account id is blank or too long");
    }
    if (limit < 1 || limit > MAX_ACTIVITY) {
      return ctx.decline(
          op, ErrorCode.INVALID_ARGUMENT, "limit must be between 1 and " + MAX_ACTIVITY);
    }
    Optional<List<Activity>> feed =
        ctx.store()
            .read(
                op,
                s -> {
                  if (s.findAccount(id).isEmpty()) {
                    return Optional.empty();
                  }
                  List<Activity> merged = new ArrayList<>();
                  for (CheckinRecord r : s.recentCheckins(id, limit)) {
                    merged.add(
                        new Activity(
                            ActivityKind.CHECKIN,
                            "checkin",
                            r.rewardAmount(),
                            r.consecutiveDays(),
                            r.tsS()));
                  }
                  for (TransactionRecord r : s.recentTransactions(id, limit)) {
                    merged.add(
                        new Activity(
                            ActivityKind.BANK, r.type().dbValue(), r.amount(), 0, r.tsS()));
                  }
                  merged.sort(Comparator.comparingLong(Activity::tsS).reversed());
                  return Optional.of(
                      List.copyOf(merged.subList(0, Math.min(limit, merged.size()))));
                });
    if (feed.isEmpty()) {
      return ctx.decline(op, ErrorCode.ACCOUNT_NOT_FOUND, "no account " + id);
    }
    return ctx.record(op, ActionResult.success(feed.get()));
  }
}
