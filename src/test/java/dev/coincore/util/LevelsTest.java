/* CoinCore © 2025 — MIT */
package dev.coincore.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import dev.coincore.api.LevelProgress;
import org.junit.jupiter.api.Test;

class LevelsTest {

  @Test
  void bandBoundaries() {
    assertEquals(1, Levels.levelFor(0));
    assertEquals(1, Levels.levelFor(99));
    assertEquals(2, Levels.levelFor(100));
    assertEquals(5, Levels.levelFor(499));
    assertEquals(6, Levels.levelFor(500));
    assertEquals(10, Levels.levelFor(1499));
    assertEquals(11, Levels.levelFor(1500));
    assertEquals(15, Levels.levelFor(3999));
    assertEquals(16, Levels.levelFor(4000));
    assertEquals(17, Levels.levelFor(5000));
  }

  @Test
  void thresholdsInvertLevelFor() {
    for (int level = 1; level <= 40; level++) {
      long threshold = Levels.thresholdFor(level);
      assertEquals(level, Levels.levelFor(threshold), "level " + level);
      if (level > 1) {
        assertEquals(level - 1, Levels.levelFor(threshold - 1), "below level " + level);
      }
    }
  }

  @Test
  void progressUsesNominalSpan() {
    LevelProgress early = Levels.progress(29);
    assertEquals(1, early.currentLevel());
    assertEquals(29, early.progressWithinLevel());
    assertEquals(71, early.xpNeededForNext());
    assertEquals(28, early.percentComplete());

    LevelProgress five = Levels.progress(450);
    assertEquals(5, five.currentLevel());
    assertEquals(200, five.xpSpanOfCurrentLevel());
    assertEquals(50, five.xpNeededForNext());
    assertEquals(25, five.percentComplete());
  }

  @Test
  void rejectsInvalidInput() {
    assertThrows(IllegalArgumentException.class, () -> Levels.levelFor(-1));
    assertThrows(IllegalArgumentException.class, () -> Levels.thresholdFor(0));
  }
}
