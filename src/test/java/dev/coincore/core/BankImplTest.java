/* CoinCore © 2025 — MIT */
package dev.coincore.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.coincore.api.ActionResult;
import dev.coincore.api.Bank;
import dev.coincore.api.ErrorCode;
import dev.coincore.api.events.EconomyEvents.BalanceChangedEvent;
import dev.coincore.api.records.TransactionRecord;
import dev.coincore.api.records.TransactionType;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BankImplTest {
  private EngineFixture fx;
  private Bank bank;

  @BeforeEach
  void setUp() {
    fx = new EngineFixture();
    bank = fx.services.bank();
  }

  @AfterEach
  void tearDown() throws Exception {
    fx.close();
  }

  @Test
  void depositMovesCashIntoSavings() throws Exception {
    BlockingQueue<BalanceChangedEvent> seen = new LinkedBlockingQueue<>();
    fx.services.events().onBalanceChanged(seen::add);
    fx.seed("alice", 1000, 0, 0);

    ActionResult<Bank.BankReceipt> r = bank.deposit("alice", "Alice", 400);

    assertTrue(r.ok());
    assertEquals(600, r.value().cash());
    assertEquals(400, r.value().savings());
    List<TransactionRecord> log = fx.store.transactions("alice");
    assertEquals(1, log.size());
    assertEquals(TransactionType.DEPOSIT, log.get(0).type());
    assertEquals(0, log.get(0).balanceBefore());
    assertEquals(400, log.get(0).balanceAfter());

    BalanceChangedEvent event = seen.poll(2, TimeUnit.SECONDS);
    assertNotNull(event);
    assertEquals("bank.deposit", event.cause());
    assertEquals(1000, event.oldCash());
    assertEquals(600, event.newCash());
    assertEquals(400, event.newSavings());
  }

  @Test
  void depositOutsideBoundsIsDeclined() {
    fx.seed("alice", 500_000, 0, 0);

    ActionResult<Bank.BankReceipt> low = bank.deposit("alice", "Alice", 5);
    assertEquals(ErrorCode.BELOW_MINIMUM, low.code());
    assertEquals(5, low.remaining());

    ActionResult<Bank.BankReceipt> high = bank.deposit("alice", "Alice", 100_001);
    assertEquals(ErrorCode.ABOVE_MAXIMUM, high.code());

    assertEquals(ErrorCode.BELOW_MINIMUM, bank.deposit("alice", "Alice", -50).code());
    assertTrue(fx.store.transactions("alice").isEmpty());
  }

  @Test
  void extremeAmountsReportSaturatedRemaining() {
    ActionResult<Bank.BankReceipt> low = bank.deposit("alice", "Alice", Long.MIN_VALUE);
    ActionResult<Bank.BankReceipt> high = bank.withdraw("alice", "Alice", Long.MAX_VALUE);

    assertEquals(ErrorCode.BELOW_MINIMUM, low.code());
    assertEquals(Long.MAX_VALUE, low.remaining());
    assertEquals(ErrorCode.ABOVE_MAXIMUM, high.code());
    assertEquals(Long.MAX_VALUE - 50_000, high.remaining());
  }

  @Test
  void depositBeyondCashIsDeclined() {
    fx.seed("bob", 50, 0, 0);

    ActionResult<Bank.BankReceipt> r = bank.deposit("bob", "Bob", 80);

    assertEquals(ErrorCode.INSUFFICIENT_CASH, r.code());
    assertEquals(50, fx.store.account("bob").cash());
    assertEquals(0, fx.store.account("bob").savings());
  }

  @Test
  void withdrawBeyondSavingsIsDeclined() {
    fx.seed("bob", 0, 100, 0);

    assertEquals(ErrorCode.INSUFFICIENT_SAVINGS, bank.withdraw("bob", "Bob", 101).code());
    assertEquals(100, fx.store.account("bob").savings());
  }

  @Test
  void dailyWithdrawLimitResetsNextDay() throws Exception {
    Config.BankRules d = Config.BankRules.defaults();
    Config.BankRules tight =
        new Config.BankRules(
            d.minDeposit(),
            d.maxDeposit(),
            d.minWithdraw(),
            d.maxWithdraw(),
            1000,
            d.baseRate(),
            d.vipRate(),
            d.vipThreshold());
    Config.Economy economy =
        new Config.Economy(
            Config.CheckinRules.defaults(),
            Config.WorkRules.defaults(),
            tight,
            Config.RobberyRules.defaults());
    try (EngineFixture t = new EngineFixture(economy)) {
      Bank engine = t.services.bank();
      t.seed("carol", 0, 5000, 0);

      Bank.BankReceipt first = engine.withdraw("carol", "Carol", 600).value();
      assertEquals(600, first.withdrawnToday());
      assertEquals(400, first.remainingAllowance());

      ActionResult<Bank.BankReceipt> over = engine.withdraw("carol", "Carol", 500);
      assertEquals(ErrorCode.DAILY_LIMIT_EXCEEDED, over.code());
      assertEquals(400, over.remaining());

      assertTrue(engine.withdraw("carol", "Carol", 400).ok());
      assertEquals(ErrorCode.DAILY_LIMIT_EXCEEDED, engine.withdraw("carol", "Carol", 10).code());

      t.nextDay();
      assertTrue(engine.withdraw("carol", "Carol", 600).ok());
      assertEquals(1600, t.store.account("carol").cash());
      assertEquals(3400, t.store.account("carol").savings());
    }
  }

  @Test
  void transferMovesSavingsBetweenAccounts() {
    fx.seed("dave", 0, 1000, 0);
    fx.seed("erin", 0, 50, 0);

    ActionResult<Bank.TransferReceipt> r = bank.transfer("dave", "Dave", "erin", 300);

    assertTrue(r.ok());
    assertEquals(700, r.value().fromSavings());
    assertEquals(350, r.value().toSavings());
    assertEquals(TransactionType.TRANSFER_OUT, fx.store.transactions("dave").get(0).type());
    TransactionRecord in = fx.store.transactions("erin").get(0);
    assertEquals(TransactionType.TRANSFER_IN, in.type());
    assertEquals(50, in.balanceBefore());
    assertEquals(350, in.balanceAfter());
  }

  @Test
  void transferToUnknownAccountChangesNothing() {
    fx.seed("dave", 0, 1000, 0);

    ActionResult<Bank.TransferReceipt> r = bank.transfer("dave", "Dave", "nobody", 300);

    assertEquals(ErrorCode.RECIPIENT_NOT_FOUND, r.code());
    assertEquals(1000, fx.store.account("dave").savings());
    assertNull(fx.store.account("nobody"));
    assertTrue(fx.store.transactions("dave").isEmpty());
  }

  @Test
  void transferValidation() {
    fx.seed("dave", 0, 100, 0);
    fx.seed("erin", 0, 0, 0);

    assertEquals(ErrorCode.SELF_TRANSFER, bank.transfer("dave", "Dave", "dave", 50).code());
    assertEquals(ErrorCode.BELOW_MINIMUM, bank.transfer("dave", "Dave", "erin", 1).code());
    assertEquals(ErrorCode.INSUFFICIENT_SAVINGS, bank.transfer("dave", "Dave", "erin", 500).code());
    assertEquals(ErrorCode.INVALID_ARGUMENT, bank.transfer("dave", "Dave", " ", 50).code());
  }

  @Test
  void interestAccruesOncePerDay() {
    fx.seed("a", 0, 5_000, 0);
    fx.seed("b", 0, 20_000, 0);
    fx.seed("c", 0, 500, 0);
    fx.seed("d", 100, 0, 0);

    Bank.InterestReport first = bank.accrueDailyInterest();

    assertEquals(fx.today(), first.cycle());
    assertEquals(2, first.processed());
    assertEquals(1, first.skipped());
    assertEquals(0, first.failed());
    // floor(5000 * 0.001) + floor(20000 * 0.0015)
    assertEquals(35, first.totalInterest());
    assertEquals(5_005, fx.store.account("a").savings());
    assertEquals(20_030, fx.store.account("b").savings());
    assertEquals(500, fx.store.account("c").savings());
    assertEquals(fx.today(), fx.store.account("c").lastInterestDate());
    assertTrue(fx.store.transactions("c").isEmpty());

    Bank.InterestReport rerun = bank.accrueDailyInterest();
    assertEquals(0, rerun.processed());
    assertEquals(3, rerun.skipped());
    assertEquals(0, rerun.totalInterest());
    assertEquals(5_005, fx.store.account("a").savings());

    fx.nextDay();
    Bank.InterestReport next = bank.accrueDailyInterest();
    assertEquals(2, next.processed());
    assertEquals(5_010, fx.store.account("a").savings());
  }

  @Test
  void interestFailureOnOneAccountDoesNotStopTheRun() {
    fx.seed("a", 0, 5_000, 0);
    fx.seed("b", 0, 5_000, 0);
    fx.seed("c", 0, 5_000, 0);
    fx.store.failOnAccount("b", new SQLException("link down", "08S01"));

    Bank.InterestReport report = bank.accrueDailyInterest();

    assertEquals(2, report.processed());
    assertEquals(1, report.failed());
    assertEquals(5_000, fx.store.account("b").savings());
    assertNull(fx.store.account("b").lastInterestDate());

    Bank.InterestReport retry = bank.accrueDailyInterest();
    assertEquals(1, retry.processed());
    assertEquals(5_005, fx.store.account("b").savings());
  }

  @Test
  void savingsReconcileWithTransactionLog() {
    fx.seed("erin", 10_000, 0, 0);
    fx.seed("frank", 0, 0, 0);

    bank.deposit("erin", "Erin", 8_000);
    bank.withdraw("erin", "Erin", 1_500);
    bank.transfer("erin", "Erin", "frank", 2_000);
    bank.accrueDailyInterest();
    fx.nextDay();
    bank.withdraw("frank", "Frank", 700);
    bank.accrueDailyInterest();

    for (String id : List.of("erin", "frank")) {
      long replayed =
          fx.store.transactions(id).stream()
              .mapToLong(t -> t.type().savingsDelta(t.amount()))
              .sum();
      assertEquals(fx.store.account(id).savings(), replayed, id);
    }
    assertEquals(
        10_000,
        fx.store.account("erin").cash()
            + fx.store.account("frank").cash()
            + fx.store.account("erin").savings()
            + fx.store.account("frank").savings()
            - interestPaid("erin")
            - interestPaid("frank"));
  }

  @Test
  void summaryReportsRateAndAllowance() {
    fx.seed("gina", 0, 12_000, 0);
    bank.withdraw("gina", "Gina", 2_000);

    Bank.BankSummary s = bank.summary("gina", "Gina").value();

    assertTrue(s.vip());
    assertEquals(0.0015D, s.dailyRate());
    assertEquals(15, s.dailyInterestEstimate());
    assertEquals(2_000, s.withdrawnToday());
    assertEquals(198_000, s.remainingAllowance());
    assertEquals(2_000, s.totalWithdrawn());
    assertEquals(0, s.totalDeposited());
    assertEquals(1, s.recent().size());
    assertFalse(bank.summary("hank", "Hank").value().vip());
  }

  @Test
  void summaryListsFiveNewestTransactions() {
    fx.seed("ivy", 0, 700, 0);
    for (int i = 0; i < 7; i++) {
      long before = i * 100L;
      fx.store.putTransaction(
          TransactionRecord.of(
              "ivy", TransactionType.DEPOSIT, 100, before, before + 100, fx.nowS() - 70 + i));
    }

    List<TransactionRecord> recent = bank.summary("ivy", "Ivy").value().recent();

    assertEquals(5, recent.size());
    assertEquals(700, recent.get(0).balanceAfter());
    assertEquals(300, recent.get(4).balanceAfter());
  }

  private long interestPaid(String id) {
    return fx.store.transactions(id).stream()
        .filter(t -> t.type() == TransactionType.INTEREST)
        .mapToLong(TransactionRecord::amount)
        .sum();
  }
}
