/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.api.records;

import java.time.LocalDate;

/**
 * Append-only checkin log entry; at most one per account and day.
 *
 * @param id row id, 0 before insertion
 * @param accountId account
 * @param checkinDate calendar day of the checkin
 * @param rewardAmount cash paid
 * @param consecutiveDays streak reached by this checkin
 * @param tsS epoch second
 */
public record CheckinRecord(
    long id,
    String accountId,
    LocalDate checkinDate,
    long rewardAmount,
    int consecutiveDays,
    long tsS) {}
