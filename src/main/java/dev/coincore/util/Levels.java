/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.util;

import dev.coincore.api.LevelProgress;

/**
 * Experience to level mapping.
 *
 * <p>Levels are banded: 1-5 cost 100 XP each, 6-10 cost 200, 11-15 cost 500 and 16+ cost 1000.
 * Every function here is pure; job and robbery level gates depend on it returning the same value
 * for the same experience on every node.
 */
public final class Levels {

  /** Not instantiable. */
  private Levels() {}

  /**
   * Level reached with {@code exp} accumulated experience.
   *
   * @param exp experience, must be {@code >= 0}
   * @return level, at least 1
   */
  public static int levelFor(long exp) {
    requireNonNegative(exp);
    if (exp < 500) {
      return (int) (exp / 100 + 1);
    }
    if (exp < 1500) {
      return (int) (5 + (exp - 500) / 200 + 1);
    }
    if (exp < 4000) {
      return (int) (10 + (exp - 1500) / 500 + 1);
    }
    return (int) (15 + (exp - 4000) / 1000 + 1);
  }

  /**
   * Cumulative experience at which {@code level} starts.
   *
   * @param level level, must be {@code >= 1}
   * @return experience threshold
   */
  public static long thresholdFor(int level) {
    if (level < 1) {
      throw new IllegalArgumentException("level must be >= 1: " + level);
    }
    if (level <= 5) {
      return (level - 1) * 100L;
    }
    if (level <= 10) {
      return 500L + (level - 6) * 200L;
    }
    if (level <= 15) {
      return 1500L + (level - 11) * 500L;
    }
    return 4000L + (level - 16) * 1000L;
  }

  /**
   * Nominal XP span reported for a level. Level 5 reports 200 and levels 10 and 15 report the
   * next band's cost; progress percentages have always been computed against this table.
   */
  static long spanFor(int level) {
    if (level <= 4) {
      return 100L;
    }
    if (level <= 9) {
      return 200L;
    }
    if (level <= 14) {
      return 500L;
    }
    return 1000L;
  }

  /**
   * Progress of {@code exp} within its level.
   *
   * @param exp experience, must be {@code >= 0}
   * @return progress snapshot
   */
  public static LevelProgress progress(long exp) {
    int current = levelFor(exp);
    int next = current + 1;
    long progress = exp - thresholdFor(current);
    long needed = thresholdFor(next) - exp;
    long span = spanFor(current);
    int percent = (int) ((double) progress / span * 100);
    return new LevelProgress(current, next, exp, progress, needed, span, percent);
  }

  private static void requireNonNegative(long exp) {
    if (exp < 0) {
      throw new IllegalArgumentException("experience must be >= 0: " + exp);
    }
  }
}
