/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.api.records;

/**
 * Append-only robbery log entry. On failure {@code amount} is the penalty paid to the victim.
 *
 * @param id row id, 0 before insertion
 * @param robberId acting account
 * @param victimId targeted account
 * @param amount cash moved
 * @param success whether the robbery succeeded
 * @param tsS epoch second
 */
public record RobberyRecord(
    long id, String robberId, String victimId, long amount, boolean success, long tsS) {}
