/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.core;

/**
 * Service locator for the CoinCore engines and shared resources.
 *
 * <p>Implementations are created once at boot and exposed to command dispatchers through {@code
 * dev.coincore.api.CoinCoreApi}. Each accessor returns a singleton owned by the core. Call {@link
 * #shutdown()} on stop to release the connection pool, scheduler and event threads.
 */
public interface Services {

  /**
   * Account directory.
   *
   * @return the accounts service singleton
   */
  dev.coincore.api.Accounts accounts();

  /**
   * Daily checkin engine.
   *
   * @return the checkin engine singleton
   */
  dev.coincore.api.Checkin checkin();

  /**
   * Work engine and job catalog.
   *
   * @return the work engine singleton
   */
  dev.coincore.api.Work work();

  /**
   * Bank engine, including interest accrual.
   *
   * @return the bank engine singleton
   */
  dev.coincore.api.Bank bank();

  /**
   * Robbery engine.
   *
   * @return the robbery engine singleton
   */
  dev.coincore.api.Robbery robbery();

  /**
   * Rankings and standings.
   *
   * @return the rankings singleton
   */
  dev.coincore.api.Rankings rankings();

  /**
   * Event bus surface for economy events.
   *
   * @return the event bus facade singleton
   */
  dev.coincore.api.events.EconomyEvents events();

  /**
   * Background scheduler for maintenance tasks owned by the core (daemon threads).
   *
   * @return the scheduled executor service used by CoinCore
   */
  java.util.concurrent.ScheduledExecutorService scheduler();

  /**
   * Metrics registry.
   *
   * @return metrics registry or {@code null} when unavailable
   */
  default Metrics metrics() {
    return null;
  }

  /**
   * Shuts down background resources and closes the connection pool.
   *
   * @throws java.io.IOException if closing resources fails
   */
  void shutdown() throws java.io.IOException;
}
