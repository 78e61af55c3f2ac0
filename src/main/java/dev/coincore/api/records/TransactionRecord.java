/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.api.records;

/**
 * Append-only bank log entry. Balances refer to savings.
 *
 * @param id row id, 0 before insertion
 * @param accountId owning account
 * @param type mutation kind
 * @param amount positive amount moved
 * @param balanceBefore savings before the mutation
 * @param balanceAfter savings after the mutation
 * @param tsS epoch second
 */
public record TransactionRecord(
    long id,
    String accountId,
    TransactionType type,
    long amount,
    long balanceBefore,
    long balanceAfter,
    long tsS) {

  public TransactionRecord {
    if (amount <= 0) {
      throw new IllegalArgumentException("transaction amount must be > 0: " + amount);
    }
    if (balanceAfter - balanceBefore != type.savingsDelta(amount)) {
      throw new IllegalArgumentException(
          "balances do not match " + type.dbValue() + " of " + amount);
    }
  }

  /** Unsaved record for {@code type}. */
  public static TransactionRecord of(
      String accountId, TransactionType type, long amount, long before, long after, long tsS) {
    return new TransactionRecord(0L, accountId, type, amount, before, after, tsS);
  }
}
