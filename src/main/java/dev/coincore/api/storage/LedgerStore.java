/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.api.storage;

import dev.coincore.api.Account;

/**
 * Transactional ledger storage.
 *
 * <p>Implementations run each unit atomically: all writes a unit performed become visible together
 * or not at all. Infrastructure faults surface as {@link dev.coincore.api.StoreUnavailableException}
 * after any bounded internal retries; a failed unit leaves no partial state.
 */
public interface LedgerStore {

  /**
   * Runs a mutating unit. Commits when {@link Mutation#commit()} is true, rolls back otherwise or
   * when the unit throws.
   *
   * @param op operation name for logs and metrics
   * @param work unit body
   * @param <T> payload type
   * @return the unit's mutation
   */
  <T> Mutation<T> inTransaction(String op, UnitOfWork<Mutation<T>> work);

  /**
   * Runs a read-only unit against a consistent snapshot.
   *
   * @param op operation name for logs and metrics
   * @param work unit body
   * @param <T> value type
   * @return computed value
   */
  <T> T read(String op, UnitOfWork<T> work);

  /**
   * Creates the account if missing, otherwise refreshes its display name. Idempotent.
   *
   * @param id account id
   * @param displayName display name to store
   * @param nowS current epoch second
   * @return account after the upsert
   */
  Account ensureAccount(String id, String displayName, long nowS);
}
