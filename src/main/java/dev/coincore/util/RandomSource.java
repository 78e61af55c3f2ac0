/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.util;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Single source of randomness for payouts and probabilistic draws.
 *
 * <p>Engines never touch {@link java.util.Random} directly; tests supply scripted sequences.
 */
public interface RandomSource {

  /**
   * Uniform integer in {@code [min, max]}, both ends inclusive.
   *
   * @param min lower bound
   * @param max upper bound, {@code >= min}
   * @return drawn value
   */
  long nextLong(long min, long max);

  /**
   * Uniform double in {@code [0, 1)}.
   *
   * @return drawn value
   */
  double nextDouble();

  /**
   * Default source backed by {@link ThreadLocalRandom}.
   *
   * @return shared thread-safe source
   */
  static RandomSource threadLocal() {
    return ThreadLocalSource.INSTANCE;
  }

  /** {@link ThreadLocalRandom}-backed implementation. */
  final class ThreadLocalSource implements RandomSource {
    static final ThreadLocalSource INSTANCE = new ThreadLocalSource();

    private ThreadLocalSource() {}

    @Override
    public long nextLong(long min, long max) {
      if (max < min) {
        throw new IllegalArgumentException("max < min: " + min + ".." + max);
      }
      if (max == min) {
        return min;
      }
      return ThreadLocalRandom.current().nextLong(min, max + 1);
    }

    @Override
    public double nextDouble() {
      return ThreadLocalRandom.current().nextDouble();
    }
  }
}
