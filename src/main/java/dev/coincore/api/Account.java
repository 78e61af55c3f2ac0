/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.api;

import java.time.LocalDate;

/**
 * Per-user economic state. Immutable snapshot; engines derive updated copies and write them back
 * inside the same atomic unit they were read in.
 *
 * @param id stable external identity
 * @param displayName last seen display name
 * @param cash liquid balance, {@code >= 0}
 * @param savings banked balance, {@code >= 0}
 * @param totalEarned lifetime work income, monotonic
 * @param level current level, {@code >= 1}
 * @param experience accumulated experience, monotonic
 * @param checkinStreak consecutive checkin days
 * @param totalCheckins lifetime checkins, monotonic
 * @param lastCheckinDate date of the most recent checkin, {@code null} if never
 * @param lastWorkAtS epoch second of the most recent shift, {@code null} if never (informational)
 * @param lastInterestDate interest cycle most recently accrued, {@code null} if never
 * @param createdAtS creation time (epoch seconds)
 * @param updatedAtS last update time (epoch seconds)
 */
public record Account(
    String id,
    String displayName,
    long cash,
    long savings,
    long totalEarned,
    int level,
    long experience,
    int checkinStreak,
    long totalCheckins,
    LocalDate lastCheckinDate,
    Long lastWorkAtS,
    LocalDate lastInterestDate,
    long createdAtS,
    long updatedAtS) {

  /**
   * Fresh account with zero balances at level 1.
   *
   * @param id account id
   * @param displayName display name
   * @param nowS creation time
   * @return new account
   */
  public static Account fresh(String id, String displayName, long nowS) {
    return new Account(id, displayName, 0L, 0L, 0L, 1, 0L, 0, 0L, null, null, null, nowS, nowS);
  }

  /** Cash plus savings. */
  public long totalAssets() {
    return cash + savings;
  }

  public Account withCash(long newCash, long nowS) {
    return new Account(
        id, displayName, newCash, savings, totalEarned, level, experience, checkinStreak,
        totalCheckins, lastCheckinDate, lastWorkAtS, lastInterestDate, createdAtS, nowS);
  }

  public Account withBalances(long newCash, long newSavings, long nowS) {
    return new Account(
        id, displayName, newCash, newSavings, totalEarned, level, experience, checkinStreak,
        totalCheckins, lastCheckinDate, lastWorkAtS, lastInterestDate, createdAtS, nowS);
  }

  /** Copy with a savings balance and the interest cycle marker set to {@code cycle}. */
  public Account withInterest(long newSavings, LocalDate cycle, long nowS) {
    return new Account(
        id, displayName, cash, newSavings, totalEarned, level, experience, checkinStreak,
        totalCheckins, lastCheckinDate, lastWorkAtS, cycle, createdAtS, nowS);
  }

  /** Copy after a paid shift: cash and lifetime income grow, experience and level follow. */
  public Account withShift(long payout, long expGain, int newLevel, long nowS) {
    return new Account(
        id, displayName, cash + payout, savings, totalEarned + payout, newLevel,
        experience + expGain, checkinStreak, totalCheckins, lastCheckinDate, nowS,
        lastInterestDate, createdAtS, nowS);
  }

  /** Copy after a checkin on {@code day}. */
  public Account withCheckin(long reward, int streak, LocalDate day, long nowS) {
    return new Account(
        id, displayName, cash + reward, savings, totalEarned, level, experience, streak,
        totalCheckins + 1, day, lastWorkAtS, lastInterestDate, createdAtS, nowS);
  }
}
