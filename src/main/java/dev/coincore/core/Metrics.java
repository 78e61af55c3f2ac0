/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.core;

import dev.coincore.api.ActionResult;
import dev.coincore.api.Bank.InterestReport;
import dev.coincore.api.ErrorCode;
import java.lang.management.ManagementFactory;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import javax.management.InstanceAlreadyExistsException;
import javax.management.MBeanRegistrationException;
import javax.management.MBeanServer;
import javax.management.MalformedObjectNameException;
import javax.management.NotCompliantMBeanException;
import javax.management.ObjectName;
import javax.management.StandardMBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simple metrics registry that exposes economy counters via JMX.
 *
 * <p>Counts applied and declined outcomes per engine operation, store faults and retries, and the
 * last interest run. The last observed decline and store error codes are kept for quick
 * diagnostics.
 */
public final class Metrics implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger("coincore");
  static final String MBEAN_NAME = "dev.coincore:type=CoinCoreMetrics";

  private final AtomicLong checkinApplied = new AtomicLong();
  private final AtomicLong checkinDeclined = new AtomicLong();
  private final AtomicLong workApplied = new AtomicLong();
  private final AtomicLong workDeclined = new AtomicLong();
  private final AtomicLong depositApplied = new AtomicLong();
  private final AtomicLong depositDeclined = new AtomicLong();
  private final AtomicLong withdrawApplied = new AtomicLong();
  private final AtomicLong withdrawDeclined = new AtomicLong();
  private final AtomicLong transferApplied = new AtomicLong();
  private final AtomicLong transferDeclined = new AtomicLong();
  private final AtomicLong robberyApplied = new AtomicLong();
  private final AtomicLong robberyDeclined = new AtomicLong();
  private final AtomicLong storeFailures = new AtomicLong();
  private final AtomicLong storeRetries = new AtomicLong();
  private final AtomicLong degradedEntered = new AtomicLong();
  private final AtomicLong invariantViolations = new AtomicLong();
  private final AtomicLong interestRuns = new AtomicLong();
  private final AtomicLong interestAccounts = new AtomicLong();
  private final AtomicLong interestPaid = new AtomicLong();

  private final AtomicReference<String> lastDeclineCode = new AtomicReference<>("NONE");
  private final AtomicReference<String> lastStoreErrorCode = new AtomicReference<>("NONE");

  private final MBeanServer server;
  private final ObjectName objectName;

  /** Creates and registers the CoinCore metrics MBean. */
  public Metrics() {
    this.server = ManagementFactory.getPlatformMBeanServer();
    this.objectName = createObjectName();
    registerMBean();
  }

  /**
   * Records an engine outcome.
   *
   * @param op operation name ({@code checkin}, {@code work}, {@code bank.deposit}, ...)
   * @param result outcome to aggregate
   */
  public void recordOperation(String op, ActionResult<?> result) {
    if (result == null) {
      return;
    }
    boolean ok = result.ok();
    switch (op == null ? "" : op.toLowerCase(Locale.ROOT)) {
      case "checkin" -> increment(ok ? checkinApplied : checkinDeclined);
      case "work" -> increment(ok ? workApplied : workDeclined);
      case "bank.deposit" -> increment(ok ? depositApplied : depositDeclined);
      case "bank.withdraw" -> increment(ok ? withdrawApplied : withdrawDeclined);
      case "bank.transfer" -> increment(ok ? transferApplied : transferDeclined);
      case "robbery" -> increment(ok ? robberyApplied : robberyDeclined);
      default -> {
        // read-only operations only feed the last decline code
      }
    }
    if (!ok && result.code() != null) {
      lastDeclineCode.set(result.code().name());
    }
  }

  /** Records a unit that ended in a store fault. */
  public void recordStoreFailure(ErrorCode code) {
    storeFailures.incrementAndGet();
    if (code != null) {
      lastStoreErrorCode.set(code.name());
    }
  }

  /** Records one whole-unit replay after a transient conflict. */
  public void recordRetry() {
    storeRetries.incrementAndGet();
  }

  /** Records an aborted unit that would have broken a ledger invariant. */
  public void recordInvariantViolation() {
    invariantViolations.incrementAndGet();
  }

  void onDegradedEntered() {
    degradedEntered.incrementAndGet();
  }

  /** Records one interest accrual pass. */
  public void recordInterestRun(InterestReport report) {
    if (report == null) {
      return;
    }
    interestRuns.incrementAndGet();
    interestAccounts.addAndGet(report.processed());
    interestPaid.addAndGet(report.totalInterest());
  }

  /**
   * Read view over the counters, the same object JMX exposes.
   *
   * @return live counter view
   */
  public CoinCoreMetricsMBean view() {
    return new Bean();
  }

  private void increment(AtomicLong counter) {
    counter.incrementAndGet();
  }

  private ObjectName createObjectName() {
    try {
      return new ObjectName(MBEAN_NAME);
    } catch (MalformedObjectNameException e) {
      throw new IllegalStateException("Invalid metrics object name", e);
    }
  }

  private void registerMBean() {
    try {
      if (server.isRegistered(objectName)) {
        server.unregisterMBean(objectName);
      }
      server.registerMBean(
          new StandardMBean(new Bean(), CoinCoreMetricsMBean.class), objectName);
    } catch (InstanceAlreadyExistsException
        | MBeanRegistrationException
        | NotCompliantMBeanException e) {
      LOG.warn("(coincore) metrics registration failed", e);
    } catch (Exception e) {
      LOG.warn("(coincore) metrics registration unexpected failure", e);
    }
  }

  @Override
  public void close() {
    try {
      if (server.isRegistered(objectName)) {
        server.unregisterMBean(objectName);
      }
    } catch (Exception e) {
      LOG.debug("(coincore) metrics unregister failed", e);
    }
  }

  private final class Bean implements CoinCoreMetricsMBean {
    @Override
    public long getCheckinApplied() {
      return checkinApplied.get();
    }

    @Override
    public long getCheckinDeclined() {
      return checkinDeclined.get();
    }

    @Override
    public long getWorkApplied() {
      return workApplied.get();
    }

    @Override
    public long getWorkDeclined() {
      return workDeclined.get();
    }

    @Override
    public long getDepositApplied() {
      return depositApplied.get();
    }

    @Override
    public long getDepositDeclined() {
      return depositDeclined.get();
    }

    @Override
    public long getWithdrawApplied() {
      return withdrawApplied.get();
    }

    @Override
    public long getWithdrawDeclined() {
      return withdrawDeclined.get();
    }

    @Override
    public long getTransferApplied() {
      return transferApplied.get();
    }

    @Override
    public long getTransferDeclined() {
      return transferDeclined.get();
    }

    @Override
    public long getRobberyApplied() {
      return robberyApplied.get();
    }

    @Override
    public long getRobberyDeclined() {
      return robberyDeclined.get();
    }

    @Override
    public long getStoreFailures() {
      return storeFailures.get();
    }

    @Override
    public long getStoreRetries() {
      return storeRetries.get();
    }

    @Override
    public long getDegradedEntered() {
      return degradedEntered.get();
    }

    @Override
    public long getInvariantViolations() {
      return invariantViolations.get();
    }

    @Override
    public long getInterestRuns() {
      return interestRuns.get();
    }

    @Override
    public long getInterestAccounts() {
      return interestAccounts.get();
    }

    @Override
    public long getInterestPaid() {
      return interestPaid.get();
    }

    @Override
    public String getLastDeclineCode() {
      return lastDeclineCode.get();
    }

    @Override
    public String getLastStoreErrorCode() {
      return lastStoreErrorCode.get();
    }
  }

  /** JMX view of the metrics registry. */
  public interface CoinCoreMetricsMBean {
    /** Checkins applied. */
    long getCheckinApplied();

    /** Checkins declined. */
    long getCheckinDeclined();

    /** Shifts applied. */
    long getWorkApplied();

    /** Shifts declined. */
    long getWorkDeclined();

    /** Deposits applied. */
    long getDepositApplied();

    /** Deposits declined. */
    long getDepositDeclined();

    /** Withdrawals applied. */
    long getWithdrawApplied();

    /** Withdrawals declined. */
    long getWithdrawDeclined();

    /** Transfers applied. */
    long getTransferApplied();

    /** Transfers declined. */
    long getTransferDeclined();

    /** Robbery attempts resolved (success or failure). */
    long getRobberyApplied();

    /** Robbery attempts declined before resolution. */
    long getRobberyDeclined();

    /**
     * Returns units that ended in a store fault.
     *
     * @return units that ended in a store fault
     */
    long getStoreFailures();

    /**
     * Returns whole-unit replays after deadlocks or lock wait timeouts.
     *
     * @return whole-unit replays
     */
    long getStoreRetries();

    /** Transitions into degraded mode. */
    long getDegradedEntered();

    /** Units aborted because they would have broken a ledger invariant. */
    long getInvariantViolations();

    /** Interest accrual passes. */
    long getInterestRuns();

    /** Accounts credited with interest across all passes. */
    long getInterestAccounts();

    /** Interest credited across all passes. */
    long getInterestPaid();

    /** Last observed decline code. */
    String getLastDeclineCode();

    /** Last observed store error code. */
    String getLastStoreErrorCode();
  }
}
