/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.api;

import java.util.Objects;

/**
 * Outcome of an engine call.
 *
 * <p>Either a success carrying {@code value}, or a decline carrying a validation {@link ErrorCode},
 * a human-readable message and, where the rule has one, the quantitative remaining constraint:
 * minutes until a cooldown ends, remaining daily quota or allowance, amount short, or the required
 * level.
 *
 * @param ok whether the action was applied
 * @param code decline reason, {@code null} on success
 * @param message human-readable decline message, {@code null} on success
 * @param remaining quantitative constraint for the decline, 0 when not applicable
 * @param value success payload, {@code null} when declined
 * @param <T> payload type
 */
public record ActionResult<T>(boolean ok, ErrorCode code, String message, long remaining, T value) {

  public ActionResult {
    if (ok) {
      Objects.requireNonNull(value, "value");
    } else {
      Objects.requireNonNull(code, "code");
    }
  }

  /**
   * Successful outcome.
   *
   * @param value payload
   * @param <T> payload type
   * @return success result
   */
  public static <T> ActionResult<T> success(T value) {
    return new ActionResult<>(true, null, null, 0L, value);
  }

  /**
   * Declined outcome without a quantitative constraint.
   *
   * @param code validation reason
   * @param message human-readable message
   * @param <T> payload type
   * @return declined result
   */
  public static <T> ActionResult<T> declined(ErrorCode code, String message) {
    return new ActionResult<>(false, code, message, 0L, null);
  }

  /**
   * Declined outcome with the remaining constraint.
   *
   * @param code validation reason
   * @param message human-readable message
   * @param remaining minutes, units or level relevant to {@code code}
   * @param <T> payload type
   * @return declined result
   */
  public static <T> ActionResult<T> declined(ErrorCode code, String message, long remaining) {
    return new ActionResult<>(false, code, message, remaining, null);
  }

  /**
   * Re-types a declined result.
   *
   * @param <U> target payload type
   * @return the same decline with a different payload type
   * @throws IllegalStateException when called on a success
   */
  public <U> ActionResult<U> asDeclined() {
    if (ok) {
      throw new IllegalStateException("not a declined result");
    }
    return new ActionResult<>(false, code, message, remaining, null);
  }
}
