/* CoinCore © 2025 — MIT */
package dev.coincore.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class RatesTest {

  @Test
  void floorMulRoundsDown() {
    assertEquals(1, Rates.floorMul(1000, 0.001D));
    assertEquals(0, Rates.floorMul(999, 0.001D));
    assertEquals(7, Rates.floorMul(5000, 0.0015D));
    assertEquals(50, Rates.floorMul(100, 0.5D));
  }

  @Test
  void degenerateInputsYieldZero() {
    assertEquals(0, Rates.floorMul(0, 0.5D));
    assertEquals(0, Rates.floorMul(-10, 0.5D));
    assertEquals(0, Rates.floorMul(100, Double.NaN));
    assertEquals(0, Rates.floorMul(100, -0.1D));
  }

  @Test
  void levelBonusStartsAboveLevelOne() {
    assertEquals(0, Rates.levelBonus(80, 1, 0.02D));
    assertEquals(3, Rates.levelBonus(80, 3, 0.02D));
    assertEquals(90, Rates.levelBonus(500, 10, 0.02D));
  }
}
