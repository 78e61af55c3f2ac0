/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.util;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;

/** Calendar-day helpers for daily quotas, limits and streaks. */
public final class GameDays {
  private static final long SECONDS_PER_MINUTE = 60L;

  private GameDays() {}

  /**
   * Calendar date of {@code clock}'s instant in {@code zone}.
   *
   * @param clock time source
   * @param zone zone defining day boundaries
   * @return current date
   */
  public static LocalDate today(Clock clock, ZoneId zone) {
    return LocalDate.ofInstant(clock.instant(), zone);
  }

  /**
   * Half-open epoch-second window {@code [start, end)} covering {@code day} in {@code zone}.
   *
   * @param day calendar day
   * @param zone zone defining day boundaries
   * @return day window
   */
  public static Window window(LocalDate day, ZoneId zone) {
    long start = day.atStartOfDay(zone).toEpochSecond();
    long end = day.plusDays(1).atStartOfDay(zone).toEpochSecond();
    return new Window(start, end);
  }

  /**
   * Seconds left on a cooldown that started at {@code lastAtS}.
   *
   * @param lastAtS epoch second of the previous action
   * @param cooldownS cooldown length in seconds
   * @param nowS current epoch second
   * @return remaining seconds, 0 when elapsed
   */
  public static long cooldownRemaining(long lastAtS, long cooldownS, long nowS) {
    long remaining = lastAtS + Math.max(0L, cooldownS) - nowS;
    return Math.max(0L, remaining);
  }

  /**
   * Rounds seconds up to whole minutes.
   *
   * @param seconds non-negative seconds
   * @return minutes, rounded up
   */
  public static long ceilMinutes(long seconds) {
    if (seconds <= 0) {
      return 0L;
    }
    return (seconds + SECONDS_PER_MINUTE - 1) / SECONDS_PER_MINUTE;
  }

  /**
   * Converts fractional hours to whole seconds, rounding to nearest.
   *
   * @param hours hours, may be fractional
   * @return seconds
   */
  public static long hoursToSeconds(double hours) {
    return Math.round(hours * 3600.0D);
  }

  /**
   * Epoch-second window.
   *
   * @param startS inclusive start
   * @param endS exclusive end
   */
  public record Window(long startS, long endS) {
    /**
     * Whether {@code tsS} falls inside the window.
     *
     * @param tsS epoch second
     * @return {@code true} when {@code startS <= tsS < endS}
     */
    public boolean contains(long tsS) {
      return tsS >= startS && tsS < endS;
    }
  }
}
