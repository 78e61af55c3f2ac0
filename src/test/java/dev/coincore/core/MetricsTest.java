/* CoinCore © 2025 — MIT */
package dev.coincore.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.coincore.api.ActionResult;
import dev.coincore.api.Bank;
import dev.coincore.api.ErrorCode;
import java.lang.management.ManagementFactory;
import java.time.LocalDate;
import javax.management.ObjectName;
import org.junit.jupiter.api.Test;

class MetricsTest {

  @Test
  void operationsAreCountedPerOutcome() {
    try (Metrics metrics = new Metrics()) {
      metrics.recordOperation("checkin", ActionResult.success("ok"));
      metrics.recordOperation("checkin", ActionResult.declined(ErrorCode.ALREADY_CHECKED_IN, "x"));
      metrics.recordOperation("bank.withdraw", ActionResult.declined(ErrorCode.DAILY_LIMIT_EXCEEDED, "x"));
      metrics.recordOperation("rankings.top", ActionResult.declined(ErrorCode.INVALID_ARGUMENT, "x"));
      metrics.recordOperation("robbery", ActionResult.success("ok"));

      Metrics.CoinCoreMetricsMBean view = metrics.view();
      assertEquals(1, view.getCheckinApplied());
      assertEquals(1, view.getCheckinDeclined());
      assertEquals(1, view.getWithdrawDeclined());
      assertEquals(1, view.getRobberyApplied());
      assertEquals("INVALID_ARGUMENT", view.getLastDeclineCode());
    }
  }

  @Test
  void storeAndInterestCounters() {
    try (Metrics metrics = new Metrics()) {
      metrics.recordRetry();
      metrics.recordStoreFailure(ErrorCode.CONNECTION_LOST);
      metrics.recordInvariantViolation();
      metrics.recordInterestRun(new Bank.InterestReport(LocalDate.of(2025, 1, 1), 3, 1, 0, 42));

      Metrics.CoinCoreMetricsMBean view = metrics.view();
      assertEquals(1, view.getStoreRetries());
      assertEquals(1, view.getStoreFailures());
      assertEquals("CONNECTION_LOST", view.getLastStoreErrorCode());
      assertEquals(1, view.getInvariantViolations());
      assertEquals(1, view.getInterestRuns());
      assertEquals(3, view.getInterestAccounts());
      assertEquals(42, view.getInterestPaid());
    }
  }

  @Test
  void registersJmxBean() throws Exception {
    ObjectName name = new ObjectName("dev.coincore:type=CoinCoreMetrics");
    try (Metrics metrics = new Metrics()) {
      metrics.recordOperation("work", ActionResult.success("ok"));
      assertTrue(ManagementFactory.getPlatformMBeanServer().isRegistered(name));
      assertEquals(
          1L, ManagementFactory.getPlatformMBeanServer().getAttribute(name, "WorkApplied"));
    }
  }
}
