/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.core;

import dev.coincore.api.Account;
import dev.coincore.api.ActionResult;
import dev.coincore.api.Bank;
import dev.coincore.api.ErrorCode;
import dev.coincore.api.InvariantViolationException;
import dev.coincore.api.StoreUnavailableException;
import dev.coincore.api.records.TransactionRecord;
import dev.coincore.api.records.TransactionType;
import dev.coincore.api.storage.Mutation;
import dev.coincore.util.GameDays;
import dev.coincore.util.Rates;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Savings accounts: deposit, withdraw, savings-to-savings transfer and daily interest.
 *
 * <p>Every balance change appends exactly one {@link TransactionRecord} per affected account in the
 * same unit, so replaying an account's records from zero reproduces its savings.
 */
public final class BankImpl implements Bank {
  private static final Logger LOG = LoggerFactory.getLogger("coincore");
  private static final int RECENT_LIMIT = 5;
  private static final int INTEREST_BATCH = 200;

  private final EngineContext ctx;
  private final Config.BankRules rules;
  private final Metrics metrics;

  BankImpl(EngineContext ctx, Config.BankRules rules, Metrics metrics) {
    this.ctx = ctx;
    this.rules = rules;
    this.metrics = metrics;
  }

  @Override
  public ActionResult<BankReceipt> deposit(String id, String displayName, long amount) {
    String op = "bank.deposit";
    if (EngineContext.isInvalidId(id)) {
      return ctx.decline(op, ErrorCode.INVALID_ARGUMENT, "account id is blank or too long");
    }
    ActionResult<BankReceipt> bounds = checkBounds(amount, rules.minDeposit(), rules.maxDeposit());
    if (bounds != null) {
      return ctx.record(op, bounds);
    }
    ctx.ensure(id, displayName);
    GameDays.Window day = ctx.todayWindow();
    long now = ctx.nowS();

    Mutation<BankReceipt> m =
        ctx.store()
            .inTransaction(
                op,
                s -> {
                  Account a = EngineContext.lockExisting(s, id);
                  if (amount > a.cash()) {
                    return Mutation.declined(
                        ActionResult.declined(
                            ErrorCode.INSUFFICIENT_CASH,
                            "not enough cash to deposit " + amount,
                            amount - a.cash()));
                  }
                  Account updated = a.withBalances(a.cash() - amount, a.savings() + amount, now);
                  s.updateAccount(updated);
                  s.appendTransaction(
                      TransactionRecord.of(
                          id, TransactionType.DEPOSIT, amount, a.savings(), updated.savings(), now));
                  long withdrawn =
                      s.transactionTally(id, TransactionType.WITHDRAW, day.startS(), day.endS())
                          .total();
                  return Mutation.applied(
                      receipt(TransactionType.DEPOSIT, amount, updated, withdrawn),
                      List.of(EngineContext.balanceEvent(a, updated, op)));
                });
    return ctx.finish(op, m);
  }

  @Override
  public ActionResult<BankReceipt> withdraw(String id, String displayName, long amount) {
    String op = "bank.withdraw";
    if (EngineContext.isInvalidId(id)) {
      return ctx.decline(op, ErrorCode.INVALID_ARGUMENT, "account id is blank or too long");
    }
    ActionResult<BankReceipt> bounds =
        checkBounds(amount, rules.minWithdraw(), rules.maxWithdraw());
    if (bounds != null) {
      return ctx.record(op, bounds);
    }
    ctx.ensure(id, displayName);
    GameDays.Window day = ctx.todayWindow();
    long now = ctx.nowS();

    Mutation<BankReceipt> m =
        ctx.store()
            .inTransaction(
                op,
                s -> {
                  Account a = EngineContext.lockExisting(s, id);
                  long withdrawn =
                      s.transactionTally(id, TransactionType.WITHDRAW, day.startS(), day.endS())
                          .total();
                  if (withdrawn + amount > rules.dailyWithdrawLimit()) {
                    long allowance = Math.max(0L, rules.dailyWithdrawLimit() - withdrawn);
                    return Mutation.declined(
                        ActionResult.declined(
                            ErrorCode.DAILY_LIMIT_EXCEEDED,
                            "daily withdraw limit reached; " + allowance + " left today",
                            allowance));
                  }
                  if (amount > a.savings()) {
                    return Mutation.declined(
                        ActionResult.declined(
                            ErrorCode.INSUFFICIENT_SAVINGS,
                            "not enough savings to withdraw " + amount,
                            amount - a.savings()));
                  }
                  Account updated = a.withBalances(a.cash() + amount, a.savings() - amount, now);
                  s.updateAccount(updated);
                  s.appendTransaction(
                      TransactionRecord.of(
                          id,
                          TransactionType.WITHDRAW,
                          amount,
                          a.savings(),
                          updated.savings(),
                          now));
                  return Mutation.applied(
                      receipt(TransactionType.WITHDRAW, amount, updated, withdrawn + amount),
                      List.of(EngineContext.balanceEvent(a, updated, op)));
                });
    return ctx.finish(op, m);
  }

  @Override
  public ActionResult<TransferReceipt> transfer(
      String fromId, String fromName, String toId, long amount) {
    String op = "bank.transfer";
    if (EngineContext.isInvalidId(fromId) || EngineContext.isInvalidId(toId)) {
      return ctx.decline(op, ErrorCode.INVALID_ARGUMENT, "account id is blank or too long");
    }
    if (fromId.equals(toId)) {
      return ctx.decline(op, ErrorCode.SELF_TRANSFER, "cannot transfer to yourself");
    }
    ActionResult<TransferReceipt> bounds =
        checkBounds(amount, rules.minDeposit(), rules.maxDeposit());
    if (bounds != null) {
      return ctx.record(op, bounds);
    }
    ctx.ensure(fromId, fromName);
    long now = ctx.nowS();

    Mutation<TransferReceipt> m =
        ctx.store()
            .inTransaction(
                op,
                s -> {
                  Map<String, Account> locked = s.lockAccounts(List.of(fromId, toId));
                  Account from = locked.get(fromId);
                  if (from == null) {
                    throw new InvariantViolationException(
                        "account missing after ensure: " + fromId);
                  }
                  if (amount > from.savings()) {
                    return Mutation.declined(
                        ActionResult.declined(
                            ErrorCode.INSUFFICIENT_SAVINGS,
                            "not enough savings to transfer " + amount,
                            amount - from.savings()));
                  }
                  Account to = locked.get(toId);
                  if (to == null) {
                    return Mutation.declined(
                        ActionResult.declined(
                            ErrorCode.RECIPIENT_NOT_FOUND, "no account " + toId));
                  }
                  Account fromAfter = from.withBalances(from.cash(), from.savings() - amount, now);
                  Account toAfter = to.withBalances(to.cash(), to.savings() + amount, now);
                  s.updateAccount(fromAfter);
                  s.updateAccount(toAfter);
                  s.appendTransaction(
                      TransactionRecord.of(
                          fromId,
                          TransactionType.TRANSFER_OUT,
                          amount,
                          from.savings(),
                          fromAfter.savings(),
                          now));
                  s.appendTransaction(
                      TransactionRecord.of(
                          toId,
                          TransactionType.TRANSFER_IN,
                          amount,
                          to.savings(),
                          toAfter.savings(),
                          now));
                  return Mutation.applied(
                      new TransferReceipt(
                          fromId, toId, amount, fromAfter.savings(), toAfter.savings()),
                      List.of(
                          EngineContext.balanceEvent(from, fromAfter, op),
                          EngineContext.balanceEvent(to, toAfter, op)));
                });
    return ctx.finish(op, m);
  }

  /**
   * Credits one cycle of interest to every account holding savings.
   *
   * <p>Each account is its own unit, marked with the cycle date it was credited for; a rerun on the
   * same day skips accounts already marked. A failing account is counted and the pass continues.
   */
  @Override
  public InterestReport accrueDailyInterest() {
    String op = "bank.interest";
    LocalDate cycle = ctx.today();
    long now = ctx.nowS();
    int processed = 0;
    int skipped = 0;
    int failed = 0;
    long totalInterest = 0L;

    String after = "";
    while (true) {
      String cursor = after;
      List<String> batch =
          ctx.store().read(op + ".scan", s -> s.savingsHoldersAfter(cursor, INTEREST_BATCH));
      for (String id : batch) {
        try {
          Mutation<Long> m =
              ctx.store()
                  .inTransaction(
                      op,
                      s -> {
                        Account a = s.lockAccount(id).orElse(null);
                        if (a == null || a.savings() <= 0 || cycle.equals(a.lastInterestDate())) {
                          return Mutation.applied(0L, List.of());
                        }
                        long interest = Rates.floorMul(a.savings(), rules.rateFor(a.savings()));
                        Account updated = a.withInterest(a.savings() + interest, cycle, now);
                        s.updateAccount(updated);
                        if (interest == 0) {
                          return Mutation.applied(0L, List.of());
                        }
                        s.appendTransaction(
                            TransactionRecord.of(
                                id,
                                TransactionType.INTEREST,
                                interest,
                                a.savings(),
                                updated.savings(),
                                now));
                        return Mutation.applied(
                            interest, List.of(EngineContext.balanceEvent(a, updated, op)));
                      });
          ctx.finish(op, m);
          long interest = m.result().value();
          if (interest > 0) {
            processed++;
            totalInterest += interest;
          } else {
            skipped++;
          }
        } catch (StoreUnavailableException | InvariantViolationException e) {
          failed++;
          LOG.warn("(coincore) op={} account={} interest failed: {}", op, id, e.getMessage());
        }
      }
      if (batch.size() < INTEREST_BATCH) {
        break;
      }
      after = batch.get(batch.size() - 1);
    }

    InterestReport report = new InterestReport(cycle, processed, skipped, failed, totalInterest);
    if (metrics != null) {
      metrics.recordInterestRun(report);
    }
    LOG.info(
        "(coincore) op={} cycle={} processed={} skipped={} failed={} total={}",
        op,
        cycle,
        processed,
        skipped,
        failed,
        totalInterest);
    return report;
  }

  @Override
  public ActionResult<BankSummary> summary(String id, String displayName) {
    String op = "bank.summary";
    if (EngineContext.isInvalidId(id)) {
      return ctx.decline(op, ErrorCode.INVALID_ARGUMENT, "account id is blank or too long");
    }
    ctx.ensure(id, displayName);
    GameDays.Window day = ctx.todayWindow();
    BankSummary summary =
        ctx.store()
            .read(
                op,
                s -> {
                  Account a = s.findAccount(id).orElseThrow();
                  long withdrawn =
                      s.transactionTally(id, TransactionType.WITHDRAW, day.startS(), day.endS())
                          .total();
                  double rate = rules.rateFor(a.savings());
                  return new BankSummary(
                      a.cash(),
                      a.savings(),
                      rules.isVip(a.savings()),
                      rate,
                      Rates.floorMul(a.savings(), rate),
                      withdrawn,
                      Math.max(0L, rules.dailyWithdrawLimit() - withdrawn),
                      s.transactionTally(id, TransactionType.DEPOSIT, 0L, Long.MAX_VALUE).total(),
                      s.transactionTally(id, TransactionType.WITHDRAW, 0L, Long.MAX_VALUE).total(),
                      s.recentTransactions(id, RECENT_LIMIT));
                });
    return ctx.record(op, ActionResult.success(summary));
  }

  private BankReceipt receipt(
      TransactionType type, long amount, Account updated, long withdrawnToday) {
    return new BankReceipt(
        type,
        amount,
        updated.cash(),
        updated.savings(),
        withdrawnToday,
        Math.max(0L, rules.dailyWithdrawLimit() - withdrawnToday));
  }

  private static <T> ActionResult<T> checkBounds(long amount, long min, long max) {
    if (amount < min) {
      return ActionResult.declined(
          ErrorCode.BELOW_MINIMUM, "amount must be at least " + min, gap(min, amount));
    }
    if (amount > max) {
      return ActionResult.declined(
          ErrorCode.ABOVE_MAXIMUM, "amount must be at most " + max, gap(amount, max));
    }
    return null;
  }

  /** {@code hi - lo} for {@code hi > lo}, saturating at {@link Long#MAX_VALUE}. */
  private static long gap(long hi, long lo) {
    long d = hi - lo;
    return d < 0 ? Long.MAX_VALUE : d;
  }
}
