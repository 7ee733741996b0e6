package org.bookstore.inventory.service.schedule;

import java.time.DayOfWeek;
import java.util.Objects;

import org.bookstore.inventory.domain.schedule.IntervalPeriod;

/**
 * A recurring trigger: either a fixed interval or a wall-clock time.
 *
 * <p>"No schedule" is represented by an empty {@link java.util.Optional}, never by a spec.
 */
public interface ScheduleSpec {

  /**
   * Fires every {@code magnitude} {@code unit}s.
   *
   * @param magnitude positive number of units between firings
   * @param unit unit of the interval
   */
  record Interval(int magnitude, IntervalPeriod unit) implements ScheduleSpec {
    public Interval {
      if (magnitude <= 0) {
        throw new IllegalArgumentException("Interval magnitude must be positive: " + magnitude);
      }
      Objects.requireNonNull(unit, "unit");
    }
  }

  /**
   * Fires at {@code hour:minute}, on {@code dayOfWeek} or every day when it is null.
   *
   * @param hour hour of day, 0-23
   * @param minute minute of hour, 0-59
   * @param dayOfWeek day to fire on, or null for any day
   */
  record Calendar(int hour, int minute, DayOfWeek dayOfWeek) implements ScheduleSpec {
    public Calendar {
      if (hour < 0 || hour > 23) {
        throw new IllegalArgumentException("Hour out of range: " + hour);
      }
      if (minute < 0 || minute > 59) {
        throw new IllegalArgumentException("Minute out of range: " + minute);
      }
    }

    public static Calendar daily(int hour, int minute) {
      return new Calendar(hour, minute, null);
    }
  }
}
