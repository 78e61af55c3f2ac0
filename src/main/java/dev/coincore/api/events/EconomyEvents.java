/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.api.events;

import java.util.function.Consumer;

/**
 * Subscription surface for economy events.
 *
 * <p>Events fire only after the atomic unit that produced them committed. Delivery is asynchronous
 * and ordered per account; handlers should be short and must not call back into mutating engine
 * operations for the same account.
 */
public interface EconomyEvents {
  /**
   * Subscribes to balance changes.
   *
   * @param h handler
   * @return a handle to close and unsubscribe
   */
  AutoCloseable onBalanceChanged(Consumer<BalanceChangedEvent> h);

  /**
   * Subscribes to level ups.
   *
   * @param h handler
   * @return a handle to close and unsubscribe
   */
  AutoCloseable onLevelUp(Consumer<LevelUpEvent> h);

  /** Marker for events carried by the bus. */
  interface Event {
    /** Account whose queue orders this event. */
    String accountId();
  }

  /**
   * Emitted when an account's cash or savings changed.
   *
   * @param accountId account id
   * @param cause operation name, e.g. {@code bank.deposit}
   * @param oldCash cash before
   * @param newCash cash after
   * @param oldSavings savings before
   * @param newSavings savings after
   * @param version event schema version
   */
  record BalanceChangedEvent(
      String accountId,
      String cause,
      long oldCash,
      long newCash,
      long oldSavings,
      long newSavings,
      int version)
      implements Event {}

  /**
   * Emitted when work raised an account's level.
   *
   * @param accountId account id
   * @param oldLevel level before
   * @param newLevel level after
   * @param version event schema version
   */
  record LevelUpEvent(String accountId, int oldLevel, int newLevel, int version)
      implements Event {}
}
