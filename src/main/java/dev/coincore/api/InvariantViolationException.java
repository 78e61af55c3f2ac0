/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.api;

/**
 * A ledger invariant was observed broken (negative balance, zero-day checkin gap). This is a
 * defect, never a user-facing outcome; the enclosing unit is rolled back.
 */
public final class InvariantViolationException extends RuntimeException {

  public InvariantViolationException(String message) {
    super(message);
  }
}
