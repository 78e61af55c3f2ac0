/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.api;

/** Indicates that the ledger store could not complete an atomic unit; nothing was committed. */
public final class StoreUnavailableException extends RuntimeException {
  private final ErrorCode errorCode;

  public StoreUnavailableException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  public StoreUnavailableException(ErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  public ErrorCode errorCode() {
    return errorCode;
  }

  /** Whether the caller may retry the whole operation. */
  public boolean retryable() {
    return errorCode != null && errorCode.isRetryable();
  }
}
