/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.api;

import dev.coincore.api.records.CheckinRecord;
import java.time.LocalDate;
import java.util.List;

/** Daily checkin with streak tracking. */
public interface Checkin {

  /**
   * Checks the account in for today.
   *
   * @param id account id
   * @param displayName last seen display name
   * @return receipt, or {@link ErrorCode#ALREADY_CHECKED_IN} when today's checkin exists
   */
  ActionResult<CheckinReceipt> checkin(String id, String displayName);

  /**
   * Checkin overview: today's state, recent history and what the next checkin pays.
   *
   * @param id account id
   * @param displayName last seen display name
   * @return status snapshot
   */
  ActionResult<CheckinStatus> status(String id, String displayName);

  /**
   * Reward components.
   *
   * @param base fixed part
   * @param random random part
   * @param streakBonus highest streak tier reached
   * @param total sum paid
   */
  record Reward(long base, long random, long streakBonus, long total) {}

  /**
   * Applied checkin.
   *
   * @param day calendar day credited
   * @param reward reward breakdown
   * @param streak streak after this checkin
   * @param totalCheckins lifetime checkins after this checkin
   * @param cash cash after the reward
   * @param savings savings (unchanged)
   */
  record CheckinReceipt(
      LocalDate day, Reward reward, int streak, long totalCheckins, long cash, long savings) {}

  /**
   * Preview of the next checkin's reward; the random part is reported as its range.
   *
   * @param streak streak that checkin would reach
   * @param base fixed part
   * @param randomMin lowest random part
   * @param randomMax highest random part
   * @param streakBonus tier bonus for {@code streak}
   */
  record RewardPreview(long streak, long base, long randomMin, long randomMax, long streakBonus) {}

  /**
   * Checkin overview.
   *
   * @param checkedInToday whether today's checkin exists
   * @param todayReward today's reward, 0 if none
   * @param streak current streak
   * @param totalCheckins lifetime checkins
   * @param lastCheckinDate most recent checkin day, {@code null} if never
   * @param recent up to 7 most recent checkins, newest first
   * @param next next checkin preview
   */
  record CheckinStatus(
      boolean checkedInToday,
      long todayReward,
      int streak,
      long totalCheckins,
      LocalDate lastCheckinDate,
      List<CheckinRecord> recent,
      RewardPreview next) {}
}
