/* CoinCore © 2025 — MIT */
package dev.coincore.core;

import dev.coincore.util.RandomSource;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Deterministic {@link RandomSource}. Queued values are returned in order; an empty queue falls back
 * to the lower bound for longs and {@code 0.99} for doubles.
 */
final class ScriptedRandom implements RandomSource {
  private final Deque<Long> longs = new ArrayDeque<>();
  private final Deque<Double> doubles = new ArrayDeque<>();

  ScriptedRandom longs(long... values) {
    for (long v : values) {
      longs.add(v);
    }
    return this;
  }

  ScriptedRandom doubles(double... values) {
    for (double v : values) {
      doubles.add(v);
    }
    return this;
  }

  @Override
  public long nextLong(long min, long max) {
    Long next = longs.poll();
    if (next == null) {
      return min;
    }
    if (next < min || next > max) {
      throw new IllegalStateException("scripted " + next + " outside " + min + ".." + max);
    }
    return next;
  }

  @Override
  public double nextDouble() {
    Double next = doubles.poll();
    return next == null ? 0.99D : next;
  }
}
