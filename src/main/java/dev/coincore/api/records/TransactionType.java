/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.api.records;

import java.util.Locale;

/** Kinds of bank mutations recorded in {@code bank_transactions}. */
public enum TransactionType {
  DEPOSIT,
  WITHDRAW,
  TRANSFER_IN,
  TRANSFER_OUT,
  INTEREST;

  /** Column value, e.g. {@code transfer_in}. */
  public String dbValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a column value.
   *
   * @param raw stored value
   * @return matching type
   * @throws IllegalArgumentException for unknown values
   */
  public static TransactionType fromDb(String raw) {
    return valueOf(raw.trim().toUpperCase(Locale.ROOT));
  }

  /** Signed effect of {@code amount} of this type on savings. */
  public long savingsDelta(long amount) {
    return switch (this) {
      case DEPOSIT, TRANSFER_IN, INTEREST -> amount;
      case WITHDRAW, TRANSFER_OUT -> -amount;
    };
  }
}
