/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.api;

import dev.coincore.api.records.TransactionRecord;
import dev.coincore.api.records.TransactionType;
import java.time.LocalDate;
import java.util.List;

/** Cash/savings movements, transfers between savings accounts, and daily interest. */
public interface Bank {

  /**
   * Moves cash into savings.
   *
   * @param id account id
   * @param displayName last seen display name
   * @param amount units to move
   * @return receipt or a decline ({@link ErrorCode#BELOW_MINIMUM}, {@link ErrorCode#ABOVE_MAXIMUM},
   *     {@link ErrorCode#INSUFFICIENT_CASH})
   */
  ActionResult<BankReceipt> deposit(String id, String displayName, long amount);

  /**
   * Moves savings into cash, subject to the daily withdraw allowance.
   *
   * @param id account id
   * @param displayName last seen display name
   * @param amount units to move
   * @return receipt or a decline ({@link ErrorCode#BELOW_MINIMUM}, {@link ErrorCode#ABOVE_MAXIMUM},
   *     {@link ErrorCode#DAILY_LIMIT_EXCEEDED}, {@link ErrorCode#INSUFFICIENT_SAVINGS})
   */
  ActionResult<BankReceipt> withdraw(String id, String displayName, long amount);

  /**
   * Moves savings from one account to another existing account.
   *
   * @param fromId sender id
   * @param fromName sender display name
   * @param toId recipient id; must already have an account
   * @param amount units to move
   * @return receipt or a decline ({@link ErrorCode#SELF_TRANSFER}, bound codes, {@link
   *     ErrorCode#INSUFFICIENT_SAVINGS}, {@link ErrorCode#RECIPIENT_NOT_FOUND})
   */
  ActionResult<TransferReceipt> transfer(String fromId, String fromName, String toId, long amount);

  /**
   * Credits one cycle of interest to every savings holder not yet credited for today's cycle.
   * Each account is its own atomic unit; a failed account does not undo the others.
   *
   * @return run report
   */
  InterestReport accrueDailyInterest();

  /**
   * Bank overview.
   *
   * @param id account id
   * @param displayName last seen display name
   * @return summary
   */
  ActionResult<BankSummary> summary(String id, String displayName);

  /**
   * Applied deposit or withdraw.
   *
   * @param type deposit or withdraw
   * @param amount units moved
   * @param cash cash after
   * @param savings savings after
   * @param withdrawnToday total withdrawn today after this call
   * @param remainingAllowance withdraw allowance left today
   */
  record BankReceipt(
      TransactionType type,
      long amount,
      long cash,
      long savings,
      long withdrawnToday,
      long remainingAllowance) {}

  /**
   * Applied transfer.
   *
   * @param fromId sender
   * @param toId recipient
   * @param amount units moved
   * @param fromSavings sender savings after
   * @param toSavings recipient savings after
   */
  record TransferReceipt(String fromId, String toId, long amount, long fromSavings, long toSavings) {}

  /**
   * Interest run report.
   *
   * @param cycle interest cycle (calendar day)
   * @param processed accounts credited
   * @param skipped accounts already credited this cycle or owed nothing
   * @param failed accounts whose unit failed
   * @param totalInterest units credited
   */
  record InterestReport(LocalDate cycle, int processed, int skipped, int failed, long totalInterest) {}

  /**
   * Bank overview.
   *
   * @param cash cash balance
   * @param savings savings balance
   * @param vip whether the VIP rate applies
   * @param dailyRate applicable daily rate
   * @param dailyInterestEstimate next cycle's interest at current savings
   * @param withdrawnToday total withdrawn today
   * @param remainingAllowance withdraw allowance left today
   * @param totalDeposited lifetime deposits
   * @param totalWithdrawn lifetime withdrawals
   * @param recent up to 5 most recent transactions, newest first
   */
  record BankSummary(
      long cash,
      long savings,
      boolean vip,
      double dailyRate,
      long dailyInterestEstimate,
      long withdrawnToday,
      long remainingAllowance,
      long totalDeposited,
      long totalWithdrawn,
      List<TransactionRecord> recent) {}
}
