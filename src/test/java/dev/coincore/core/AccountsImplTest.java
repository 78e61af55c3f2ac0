/* CoinCore © 2025 — MIT */
package dev.coincore.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.coincore.api.Account;
import dev.coincore.api.Accounts;
import dev.coincore.api.ErrorCode;
import dev.coincore.api.records.CheckinRecord;
import dev.coincore.api.records.RobberyRecord;
import dev.coincore.api.records.TransactionRecord;
import dev.coincore.api.records.TransactionType;
import dev.coincore.api.records.WorkRecord;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AccountsImplTest {
  private EngineFixture fx;
  private Accounts accounts;

  @BeforeEach
  void setUp() {
    fx = new EngineFixture();
    accounts = fx.services.accounts();
  }

  @AfterEach
  void tearDown() throws Exception {
    fx.close();
  }

  @Test
  void ensureCreatesFreshAccountOnce() {
    Account created = accounts.ensure("u1", "First");
    fx.clock.advance(Duration.ofMinutes(5));
    Account again = accounts.ensure("u1", "Renamed");

    assertEquals(0, created.cash());
    assertEquals(1, created.level());
    assertEquals("Renamed", again.displayName());
    assertEquals(created.createdAtS(), again.createdAtS());
    assertEquals(fx.nowS(), again.updatedAtS());
  }

  @Test
  void blankNameFallsBackToId() {
    assertEquals("u2", accounts.ensure("u2", " ").displayName());
  }

  @Test
  void blankIdIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> accounts.ensure(" ", "x"));
    assertTrue(accounts.find(null).isEmpty());
    assertEquals(ErrorCode.INVALID_ARGUMENT, accounts.profile("", "x").code());
  }

  @Test
  void idWiderThanTheColumnIsDeclinedBeforeTheStore() {
    String longId = "u".repeat(65);

    assertThrows(IllegalArgumentException.class, () -> accounts.ensure(longId, "x"));
    assertEquals(ErrorCode.INVALID_ARGUMENT, accounts.profile(longId, "x").code());
    assertEquals(
        ErrorCode.INVALID_ARGUMENT, fx.services.checkin().checkin(longId, "x").code());
    assertNull(fx.store.account(longId));
    assertEquals("u".repeat(64), accounts.ensure("u".repeat(64), "ok").id());
  }

  @Test
  void longDisplayNameIsCutToColumnWidth() {
    String name = "名".repeat(200);

    Account a = accounts.ensure("u3", name);

    assertEquals(128, a.displayName().codePointCount(0, a.displayName().length()));
    assertEquals("名".repeat(128), a.displayName());
  }

  @Test
  void profileReportsLevelProgressAndRanks() {
    fx.seed("top", 900, 0, 0);
    fx.seed("me", 400, 700, 29);

    Accounts.Profile p = accounts.profile("me", "Me").value();

    assertEquals(1100, p.totalAssets());
    assertEquals(2, p.cashRank());
    assertEquals(1, p.assetsRank());
    assertEquals(2, p.participants());
    assertEquals(1, p.level().currentLevel());
    assertEquals(71, p.level().xpNeededForNext());
    assertEquals(28, p.level().percentComplete());
  }

  @Test
  void statisticsAggregateEveryLog() {
    fx.seed("stat", 1_000, 500, 0);
    long t = fx.nowS() - 3600;
    fx.store.putTransaction(
        TransactionRecord.of("stat", TransactionType.DEPOSIT, 600, 0, 600, t));
    fx.store.putTransaction(
        TransactionRecord.of("stat", TransactionType.WITHDRAW, 100, 600, 500, t + 1));
    fx.store.putTransaction(
        TransactionRecord.of("stat", TransactionType.INTEREST, 1, 500, 501, t + 2));
    fx.store.putWork(new WorkRecord(1L, "stat", "搬砖", 80, 0, 80, t));
    fx.store.putWork(new WorkRecord(2L, "stat", "搬砖", 80, 10, 90, t + 1));
    fx.store.putWork(new WorkRecord(3L, "stat", "送外卖", 120, 0, 120, t + 2));
    fx.store.putRobbery(new RobberyRecord(1L, "stat", "other", 50, true, t));
    fx.store.putRobbery(new RobberyRecord(2L, "stat", "other", 30, false, t + 1));
    fx.store.putRobbery(new RobberyRecord(3L, "stat", "other", 20, false, t + 2));
    fx.store.putRobbery(new RobberyRecord(4L, "other", "stat", 40, true, t + 3));

    Accounts.Statistics st = accounts.statistics("stat").value();

    assertEquals(3, st.transactions());
    assertEquals(600, st.totalDeposited());
    assertEquals(100, st.totalWithdrawn());
    assertEquals(3, st.shifts());
    assertEquals(290, st.workIncome());
    assertEquals(85, st.averageIncome("搬砖"));
    assertEquals(0, st.averageIncome("程序员"));
    assertEquals(3, st.asRobber().attempts());
    assertEquals(1, st.asVictim().successes());
    assertEquals(33.3D, st.robberySuccessPercent());
    assertEquals(
        ErrorCode.ACCOUNT_NOT_FOUND, accounts.statistics("ghost").code());
  }

  @Test
  void recentActivityMergesCheckinsAndBankNewestFirst() {
    fx.seed("feed", 0, 0, 0);
    long t = fx.nowS() - 86_400;
    fx.store.putCheckin(new CheckinRecord(1L, "feed", LocalDate.of(2025, 3, 9), 120, 1, t));
    fx.store.putTransaction(
        TransactionRecord.of("feed", TransactionType.DEPOSIT, 100, 0, 100, t + 10));
    fx.store.putCheckin(
        new CheckinRecord(2L, "feed", LocalDate.of(2025, 3, 10), 130, 2, t + 86_000));
    fx.store.putTransaction(
        TransactionRecord.of("feed", TransactionType.WITHDRAW, 40, 100, 60, t + 20));

    List<Accounts.Activity> feed = accounts.recentActivity("feed", 3).value();

    assertEquals(3, feed.size());
    assertEquals(Accounts.ActivityKind.CHECKIN, feed.get(0).kind());
    assertEquals(2, feed.get(0).streak());
    assertEquals("withdraw", feed.get(1).action());
    assertEquals(40, feed.get(1).amount());
    assertEquals("deposit", feed.get(2).action());
    assertEquals(ErrorCode.INVALID_ARGUMENT, accounts.recentActivity("feed", 0).code());
    assertEquals(
        ErrorCode.INVALID_ARGUMENT,
        accounts.recentActivity("feed", Accounts.MAX_ACTIVITY + 1).code());
    assertEquals(ErrorCode.ACCOUNT_NOT_FOUND, accounts.recentActivity("ghost", 5).code());
  }
}
