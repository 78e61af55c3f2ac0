/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.api;

/**
 * Position of an experience total within the level bands.
 *
 * @param currentLevel level reached
 * @param nextLevel {@code currentLevel + 1}
 * @param experience experience the snapshot was computed from
 * @param progressWithinLevel experience earned since the current level started
 * @param xpNeededForNext experience still missing for the next level
 * @param xpSpanOfCurrentLevel nominal experience span of the current level
 * @param percentComplete {@code progressWithinLevel / xpSpanOfCurrentLevel} as a truncated percent
 */
public record LevelProgress(
    int currentLevel,
    int nextLevel,
    long experience,
    long progressWithinLevel,
    long xpNeededForNext,
    long xpSpanOfCurrentLevel,
    int percentComplete) {}
