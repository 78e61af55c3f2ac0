/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.api.storage;

import dev.coincore.api.ActionResult;
import dev.coincore.api.events.EconomyEvents;
import java.util.List;
import java.util.Objects;

/**
 * Result of a mutating unit plus the events to publish once it commits. Declined results roll the
 * unit back and carry no events.
 *
 * @param result engine outcome
 * @param events events to dispatch after commit
 * @param <T> payload type
 */
public record Mutation<T>(ActionResult<T> result, List<EconomyEvents.Event> events) {
  public Mutation {
    result = Objects.requireNonNull(result, "result");
    events = events == null ? List.of() : List.copyOf(events);
  }

  /** Applied outcome. */
  public static <T> Mutation<T> applied(T value, List<EconomyEvents.Event> events) {
    return new Mutation<>(ActionResult.success(value), events);
  }

  /** Declined outcome; the store rolls back. */
  public static <T> Mutation<T> declined(ActionResult<T> result) {
    return new Mutation<>(result, List.of());
  }

  /** Whether the store should commit. */
  public boolean commit() {
    return result.ok();
  }
}
