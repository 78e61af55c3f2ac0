/* CoinCore © 2025 — MIT */
package dev.coincore.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class GameDaysTest {

  @Test
  void todayDependsOnZone() {
    Clock clock = Clock.fixed(Instant.parse("2025-03-10T17:30:00Z"), ZoneOffset.UTC);

    assertEquals(LocalDate.of(2025, 3, 10), GameDays.today(clock, ZoneOffset.UTC));
    assertEquals(LocalDate.of(2025, 3, 11), GameDays.today(clock, ZoneId.of("Asia/Shanghai")));
  }

  @Test
  void windowIsHalfOpenLocalDay() {
    GameDays.Window w = GameDays.window(LocalDate.of(2025, 3, 10), ZoneId.of("Asia/Shanghai"));

    assertEquals(Instant.parse("2025-03-09T16:00:00Z").getEpochSecond(), w.startS());
    assertEquals(86_400, w.endS() - w.startS());
    assertTrue(w.contains(w.startS()));
    assertFalse(w.contains(w.endS()));
  }

  @Test
  void windowFollowsDaylightSavingShift() {
    GameDays.Window w = GameDays.window(LocalDate.of(2025, 3, 9), ZoneId.of("America/New_York"));

    assertEquals(23 * 3600, w.endS() - w.startS());
  }

  @Test
  void cooldownMathRoundsUp() {
    assertEquals(0, GameDays.ceilMinutes(0));
    assertEquals(1, GameDays.ceilMinutes(1));
    assertEquals(1, GameDays.ceilMinutes(60));
    assertEquals(2, GameDays.ceilMinutes(61));
    assertEquals(100, GameDays.cooldownRemaining(1_000, 3600, 4_500));
    assertEquals(0, GameDays.cooldownRemaining(1_000, 3600, 5_000));
    assertEquals(5400, GameDays.hoursToSeconds(1.5D));
  }
}
