/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Floor-rounded multiplication helpers.
 *
 * <p>All operations are pure functions over integer units.
 */
public final class Rates {

  /** Not instantiable. */
  private Rates() {}

  /**
   * Computes {@code floor(amount * rate)}.
   *
   * <p>The rate is taken at its shortest decimal representation, so {@code floor(1000 * 0.001)} is
   * 1 rather than 0.
   *
   * @param amount base amount in units, {@code >= 0}
   * @param rate multiplier; NaN or values {@code <= 0} yield 0
   * @return floored product
   */
  public static long floorMul(long amount, double rate) {
    if (amount <= 0 || Double.isNaN(rate) || rate <= 0.0D) {
      return 0L;
    }
    return BigDecimal.valueOf(amount)
        .multiply(BigDecimal.valueOf(rate))
        .setScale(0, RoundingMode.FLOOR)
        .longValueExact();
  }

  /**
   * Computes {@code floor(base * (level - 1) * perLevel)}; the salary bonus for levels above 1.
   *
   * @param base job base salary
   * @param level current level, {@code >= 1}
   * @param perLevel bonus fraction per level above 1
   * @return bonus in units
   */
  public static long levelBonus(long base, int level, double perLevel) {
    if (level <= 1) {
      return 0L;
    }
    return floorMul(base * (level - 1), perLevel);
  }
}
