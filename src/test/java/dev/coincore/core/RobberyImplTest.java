/* CoinCore © 2025 — MIT */
package dev.coincore.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.coincore.api.ActionResult;
import dev.coincore.api.ErrorCode;
import dev.coincore.api.Robbery;
import dev.coincore.api.records.RobberyRecord;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RobberyImplTest {
  private static final long LEVEL_FIVE_EXP = 400;

  private EngineFixture fx;
  private Robbery robbery;

  @BeforeEach
  void setUp() {
    fx = new EngineFixture();
    robbery = fx.services.robbery();
  }

  @AfterEach
  void tearDown() throws Exception {
    fx.close();
  }

  @Test
  void successfulRobberyMovesDrawnAmount() {
    fx.seed("robber", 0, 0, LEVEL_FIVE_EXP);
    fx.seed("victim", 1000, 500, 0);
    fx.random.doubles(0.1).longs(200);

    ActionResult<Robbery.RobberyOutcome> r = robbery.rob("robber", "Robber", "victim");

    assertTrue(r.ok());
    assertTrue(r.value().success());
    assertEquals(200, r.value().amount());
    assertEquals(200, fx.store.account("robber").cash());
    assertEquals(800, fx.store.account("victim").cash());
    assertEquals(500, fx.store.account("victim").savings());
    RobberyRecord record = fx.store.robberies().get(0);
    assertTrue(record.success());
    assertEquals(200, record.amount());
  }

  @Test
  void takeIsCappedAboveProtectionAmount() {
    fx.seed("robber", 0, 0, LEVEL_FIVE_EXP);
    fx.seed("victim", 130, 0, 0);
    fx.random.doubles(0.1);

    Robbery.RobberyOutcome out = robbery.rob("robber", "Robber", "victim").value();

    assertEquals(30, out.amount());
    assertEquals(100, out.victimCash());
  }

  @Test
  void victimAtProtectionAmountLosesNothing() {
    fx.seed("robber", 0, 0, LEVEL_FIVE_EXP);
    fx.seed("victim", 100, 0, 0);
    fx.random.doubles(0.1);

    Robbery.RobberyOutcome out = robbery.rob("robber", "Robber", "victim").value();

    assertTrue(out.success());
    assertEquals(0, out.amount());
    assertEquals(100, fx.store.account("victim").cash());
    assertEquals(1, fx.store.robberies().size());
  }

  @Test
  void failedRobberyPaysPenaltyToVictim() {
    fx.seed("robber", 50, 0, LEVEL_FIVE_EXP);
    fx.seed("victim", 1000, 0, 0);
    fx.random.doubles(0.5);

    Robbery.RobberyOutcome out = robbery.rob("robber", "Robber", "victim").value();

    assertFalse(out.success());
    assertEquals(20, out.amount());
    assertEquals(30, fx.store.account("robber").cash());
    assertEquals(1020, fx.store.account("victim").cash());
  }

  @Test
  void penaltyNeverExceedsRobberCash() {
    fx.seed("robber", 5, 0, LEVEL_FIVE_EXP);
    fx.seed("victim", 1000, 0, 0);
    fx.random.doubles(0.9);

    Robbery.RobberyOutcome out = robbery.rob("robber", "Robber", "victim").value();

    assertEquals(5, out.amount());
    assertEquals(0, fx.store.account("robber").cash());
  }

  @Test
  void poorVictimIsProtected() {
    fx.seed("robber", 0, 0, LEVEL_FIVE_EXP);
    fx.seed("victim", 99, 5_000, 0);

    ActionResult<Robbery.RobberyOutcome> r = robbery.rob("robber", "Robber", "victim");

    assertEquals(ErrorCode.VICTIM_PROTECTED, r.code());
    assertEquals(1, r.remaining());
    assertTrue(fx.store.robberies().isEmpty());
  }

  @Test
  void lowLevelRobberIsDeclined() {
    fx.seed("victim", 1000, 0, 0);

    ActionResult<Robbery.RobberyOutcome> r = robbery.rob("newbie", "Newbie", "victim");

    assertEquals(ErrorCode.LEVEL_TOO_LOW, r.code());
    assertEquals(4, r.remaining());
  }

  @Test
  void cooldownAppliesAfterAnyAttempt() {
    fx.seed("robber", 100, 0, LEVEL_FIVE_EXP);
    fx.seed("victim", 1000, 0, 0);
    fx.random.doubles(0.9);
    robbery.rob("robber", "Robber", "victim");

    ActionResult<Robbery.RobberyOutcome> again = robbery.rob("robber", "Robber", "victim");
    assertEquals(ErrorCode.ON_COOLDOWN, again.code());
    assertEquals(360, again.remaining());

    fx.clock.advance(Duration.ofHours(6));
    assertTrue(robbery.rob("robber", "Robber", "victim").ok());
  }

  @Test
  void invalidTargets() {
    fx.seed("robber", 0, 0, LEVEL_FIVE_EXP);

    assertEquals(ErrorCode.SELF_TARGET, robbery.rob("robber", "Robber", "robber").code());
    assertEquals(ErrorCode.INVALID_ARGUMENT, robbery.rob("robber", "Robber", "").code());
    assertEquals(ErrorCode.ACCOUNT_NOT_FOUND, robbery.rob("robber", "Robber", "ghost").code());
    assertNull(fx.store.account("ghost"));
  }

  @Test
  void statsSplitRobberAndVictimSides() {
    fx.seed("robber", 100, 0, LEVEL_FIVE_EXP);
    fx.seed("victim", 1000, 0, 0);
    fx.random.doubles(0.1, 0.9).longs(100);
    robbery.rob("robber", "Robber", "victim");
    fx.clock.advance(Duration.ofHours(7));
    robbery.rob("robber", "Robber", "victim");

    Robbery.RobberyStats stats = robbery.stats("robber").value();
    assertEquals(2, stats.asRobber().attempts());
    assertEquals(1, stats.asRobber().successes());
    assertEquals(100, stats.asRobber().successAmount());
    assertEquals(20, stats.asRobber().failureAmount());
    assertEquals(0.5D, stats.successRate());
    assertEquals(360, stats.cooldownMinutes());

    Robbery.RobberyStats victimStats = robbery.stats("victim").value();
    assertEquals(2, victimStats.asVictim().attempts());
    assertEquals(0, victimStats.asRobber().attempts());
    assertEquals(0.0D, victimStats.successRate());
    assertEquals(ErrorCode.ACCOUNT_NOT_FOUND, robbery.stats("ghost").code());
  }

  @Test
  void targetsListRichestEligibleAccounts() {
    fx.seed("robber", 5_000, 0, LEVEL_FIVE_EXP);
    fx.seed("rich", 2_000, 0, 0);
    fx.seed("middle", 180, 0, 0);
    fx.seed("poor", 99, 0, 0);

    List<Robbery.Target> targets = robbery.targets("robber", 10).value();

    assertEquals(2, targets.size());
    assertEquals("rich", targets.get(0).id());
    assertEquals(50, targets.get(0).minTake());
    assertEquals(300, targets.get(0).maxTake());
    assertEquals("middle", targets.get(1).id());
    assertEquals(80, targets.get(1).maxTake());
    assertEquals(ErrorCode.INVALID_ARGUMENT, robbery.targets("robber", 0).code());
  }
}
