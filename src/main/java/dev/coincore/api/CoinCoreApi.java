/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.api;

import dev.coincore.api.events.EconomyEvents;

/**
 * Static accessors for the CoinCore engines consumed by chat-command dispatchers.
 *
 * <p>The core builds its {@code Services} container and calls {@link
 * #bootstrap(dev.coincore.core.Services)} once at boot and {@link #clear()} at shutdown.
 * Dispatchers should treat the returned engines as read-only handles.
 */
public final class CoinCoreApi {
  private static volatile dev.coincore.core.Services services;

  private CoinCoreApi() {}

  /**
   * Wire core services into the static API.
   *
   * @param s service container
   * @throws IllegalStateException if already bootstrapped
   */
  public static synchronized void bootstrap(dev.coincore.core.Services s) {
    if (services != null) {
      throw new IllegalStateException("CoinCoreApi already bootstrapped");
    }
    services = s;
  }

  /** Drops the published services during shutdown. */
  public static synchronized void clear() {
    services = null;
  }

  public static Accounts accounts() {
    return require().accounts();
  }

  public static Checkin checkin() {
    return require().checkin();
  }

  public static Work work() {
    return require().work();
  }

  public static Bank bank() {
    return require().bank();
  }

  public static Robbery robbery() {
    return require().robbery();
  }

  public static Rankings rankings() {
    return require().rankings();
  }

  /**
   * Gets the economy event bus facade.
   *
   * @return event bus facade
   */
  public static EconomyEvents events() {
    return require().events();
  }

  private static dev.coincore.core.Services require() {
    dev.coincore.core.Services s = services;
    if (s == null) {
      throw new IllegalStateException("CoinCoreApi not bootstrapped");
    }
    return s;
  }
}
