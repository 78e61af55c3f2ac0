/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.api.storage;

import java.sql.SQLException;

/**
 * Work executed against one open {@link LedgerSession}.
 *
 * @param <T> produced value
 */
@FunctionalInterface
public interface UnitOfWork<T> {
  T run(LedgerSession session) throws SQLException;
}
