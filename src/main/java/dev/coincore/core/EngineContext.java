/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.core;

import dev.coincore.api.Account;
import dev.coincore.api.ActionResult;
import dev.coincore.api.ErrorCode;
import dev.coincore.api.InvariantViolationException;
import dev.coincore.api.events.EconomyEvents.BalanceChangedEvent;
import dev.coincore.api.storage.LedgerSession;
import dev.coincore.api.storage.LedgerStore;
import dev.coincore.api.storage.Mutation;
import dev.coincore.util.GameDays;
import dev.coincore.util.RandomSource;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Collaborators shared by the engine implementations. */
final class EngineContext {
  private static final Logger LOG = LoggerFactory.getLogger("coincore");
  static final int EVENT_VERSION = 1;

  /** Width of the id columns, in characters. */
  static final int MAX_ID_LENGTH = 64;

  /** Width of {@code accounts.display_name}, in characters. */
  static final int MAX_DISPLAY_NAME_LENGTH = 128;

  private final LedgerStore store;
  private final Clock clock;
  private final ZoneId zone;
  private final RandomSource random;
  private final EventBus events;
  private final Metrics metrics;

  EngineContext(
      LedgerStore store,
      Clock clock,
      ZoneId zone,
      RandomSource random,
      EventBus events,
      Metrics metrics) {
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.zone = Objects.requireNonNull(zone, "zone");
    this.random = Objects.requireNonNull(random, "random");
    this.events = events;
    this.metrics = metrics;
  }

  LedgerStore store() {
    return store;
  }

  RandomSource random() {
    return random;
  }

  ZoneId zone() {
    return zone;
  }

  long nowS() {
    return clock.instant().getEpochSecond();
  }

  LocalDate today() {
    return GameDays.today(clock, zone);
  }

  GameDays.Window todayWindow() {
    return GameDays.window(today(), zone);
  }

  /**
   * Creates or refreshes the caller's account; a blank name falls back to the id and a long one
   * is cut to the column width.
   */
  Account ensure(String id, String displayName) {
    String name = displayName == null || displayName.isBlank() ? id : displayName.trim();
    return store.ensureAccount(id, truncate(name, MAX_DISPLAY_NAME_LENGTH), nowS());
  }

  /** Publishes the events of a committed unit and records the outcome. */
  <T> ActionResult<T> finish(String op, Mutation<T> mutation) {
    if (mutation.commit() && events != null) {
      events.publishAll(mutation.events());
    }
    return record(op, mutation.result());
  }

  /** Records a read or early-declined outcome. */
  <T> ActionResult<T> record(String op, ActionResult<T> result) {
    if (metrics != null) {
      metrics.recordOperation(op, result);
    }
    if (!result.ok()) {
      LOG.debug("(coincore) code={} op={} message={}", result.code(), op, result.message());
    }
    return result;
  }

  <T> ActionResult<T> decline(String op, ErrorCode code, String message) {
    return record(op, ActionResult.declined(code, message));
  }

  /** Blank ids and ids wider than the id columns are rejected before they reach the store. */
  static boolean isInvalidId(String id) {
    return id == null
        || id.isBlank()
        || id.codePointCount(0, id.length()) > MAX_ID_LENGTH;
  }

  static String truncate(String value, int maxCodePoints) {
    if (value.codePointCount(0, value.length()) <= maxCodePoints) {
      return value;
    }
    return value.substring(0, value.offsetByCodePoints(0, maxCodePoints));
  }

  /** Locks an account that the caller created earlier in the same operation. */
  static Account lockExisting(LedgerSession s, String id) throws SQLException {
    return s.lockAccount(id)
        .orElseThrow(() -> new InvariantViolationException("account missing after ensure: " + id));
  }

  static BalanceChangedEvent balanceEvent(Account before, Account after, String cause) {
    return new BalanceChangedEvent(
        after.id(),
        cause,
        before.cash(),
        after.cash(),
        before.savings(),
        after.savings(),
        EVENT_VERSION);
  }
}
