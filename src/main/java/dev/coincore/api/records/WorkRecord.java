/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.api.records;

/**
 * Append-only work log entry.
 *
 * @param id row id, 0 before insertion
 * @param accountId worker
 * @param jobName catalog job name
 * @param baseSalary drawn salary before bonuses
 * @param bonus level bonus plus luck bonus
 * @param totalEarned {@code baseSalary + bonus}
 * @param tsS epoch second
 */
public record WorkRecord(
    long id, String accountId, String jobName, long baseSalary, long bonus, long totalEarned, long tsS) {}
