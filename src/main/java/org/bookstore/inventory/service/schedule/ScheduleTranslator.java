package org.bookstore.inventory.service.schedule;

import java.time.DayOfWeek;
import java.util.Optional;

import org.springframework.stereotype.Component;

import org.bookstore.inventory.domain.NotificationFrequency;
import org.bookstore.inventory.domain.schedule.IntervalPeriod;

/**
 * Maps a notification frequency to the trigger that implements it.
 *
 * <table>
 *   <caption>Frequency to trigger</caption>
 *   <tr><td>every_15_sec</td><td>interval 15 seconds</td></tr>
 *   <tr><td>every_minute</td><td>interval 1 minute</td></tr>
 *   <tr><td>hourly</td><td>interval 1 hour</td></tr>
 *   <tr><td>daily</td><td>09:00 every day</td></tr>
 *   <tr><td>weekly</td><td>09:00 Monday</td></tr>
 *   <tr><td>disabled</td><td>none</td></tr>
 * </table>
 */
@Component
public class ScheduleTranslator {

  static final int ALERT_HOUR = 9;
  static final int ALERT_MINUTE = 0;

  /**
   * Translate a frequency.
   *
   * @param frequency the user's choice, may be null
   * @return the trigger, or empty for {@code disabled} and null
   */
  public Optional<ScheduleSpec> translate(NotificationFrequency frequency) {
    if (frequency == null) {
      return Optional.empty();
    }
    return switch (frequency) {
      case EVERY_15_SEC -> Optional.of(new ScheduleSpec.Interval(15, IntervalPeriod.SECONDS));
      case EVERY_MINUTE -> Optional.of(new ScheduleSpec.Interval(1, IntervalPeriod.MINUTES));
      case HOURLY -> Optional.of(new ScheduleSpec.Interval(1, IntervalPeriod.HOURS));
      case DAILY -> Optional.of(ScheduleSpec.Calendar.daily(ALERT_HOUR, ALERT_MINUTE));
      case WEEKLY ->
          Optional.of(new ScheduleSpec.Calendar(ALERT_HOUR, ALERT_MINUTE, DayOfWeek.MONDAY));
      case DISABLED -> Optional.empty();
    };
  }

  /**
   * Translate a raw wire value. Unknown values yield no schedule.
   *
   * @param value frequency wire value such as {@code hourly}
   * @return the trigger, or empty
   */
  public Optional<ScheduleSpec> translate(String value) {
    return NotificationFrequency.fromValue(value).flatMap(this::translate);
  }
}
