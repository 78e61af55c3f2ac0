/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.api;

/**
 * Canonical result codes produced by CoinCore engines.
 *
 * <p>Validation codes describe business-rule refusals and are returned inside declined results;
 * they are never thrown and never retried. Store codes describe infrastructure faults and travel
 * inside {@link StoreUnavailableException}.
 */
public enum ErrorCode {
  /** Amount is below the configured per-operation minimum. */
  BELOW_MINIMUM(Kind.VALIDATION),

  /** Amount is above the configured per-operation maximum. */
  ABOVE_MAXIMUM(Kind.VALIDATION),

  /** Cash balance does not cover the amount. */
  INSUFFICIENT_CASH(Kind.VALIDATION),

  /** Savings balance does not cover the amount. */
  INSUFFICIENT_SAVINGS(Kind.VALIDATION),

  /** Withdrawal would exceed today's withdraw allowance. */
  DAILY_LIMIT_EXCEEDED(Kind.VALIDATION),

  /** Today's work quota is used up. */
  DAILY_QUOTA_EXCEEDED(Kind.VALIDATION),

  /** The action is still cooling down. */
  ON_COOLDOWN(Kind.VALIDATION),

  /** Account level is below the requirement. */
  LEVEL_TOO_LOW(Kind.VALIDATION),

  /** Sender and recipient are the same account. */
  SELF_TRANSFER(Kind.VALIDATION),

  /** Robber and victim are the same account. */
  SELF_TARGET(Kind.VALIDATION),

  /** Victim's cash is below the protection floor. */
  VICTIM_PROTECTED(Kind.VALIDATION),

  /** Transfer recipient has no account. */
  RECIPIENT_NOT_FOUND(Kind.VALIDATION),

  /** Job name is not in the catalog. */
  UNKNOWN_JOB(Kind.VALIDATION),

  /** A checkin already exists for today. */
  ALREADY_CHECKED_IN(Kind.VALIDATION),

  /** Referenced account does not exist. */
  ACCOUNT_NOT_FOUND(Kind.VALIDATION),

  /** Identifier or argument is malformed (blank id, non-positive limit). */
  INVALID_ARGUMENT(Kind.VALIDATION),

  /** Store refused or failed the operation for an unclassified reason. */
  STORE_UNAVAILABLE(Kind.STORE),

  /** Exhausted retry budget on a deadlock/lock-wait protected unit. */
  DEADLOCK_RETRY_EXHAUSTED(Kind.STORE),

  /** Database connection pool lost connectivity to the server. */
  CONNECTION_LOST(Kind.STORE),

  /** Store is in degraded mode and refuses writes until recovery. */
  DEGRADED_MODE(Kind.STORE),

  /** A uniqueness constraint rejected the write. */
  DUPLICATE_KEY(Kind.STORE),

  /** Migrations are locked by another node. */
  MIGRATION_LOCKED(Kind.STORE);

  private final Kind kind;

  ErrorCode(Kind kind) {
    this.kind = kind;
  }

  /**
   * Whether this code is a business-rule refusal.
   *
   * @return {@code true} for validation codes
   */
  public boolean isValidation() {
    return kind == Kind.VALIDATION;
  }

  /**
   * Whether retrying the whole operation later may succeed.
   *
   * @return {@code true} for transient store faults
   */
  public boolean isRetryable() {
    return this == DEADLOCK_RETRY_EXHAUSTED
        || this == CONNECTION_LOST
        || this == DEGRADED_MODE
        || this == STORE_UNAVAILABLE;
  }

  private enum Kind {
    VALIDATION,
    STORE
  }
}
