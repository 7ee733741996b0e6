package org.bookstore.inventory.domain.schedule;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/**
 * Calendar trigger shared by every job firing at the same wall-clock time.
 *
 * <p>Each field holds either a number or {@value #ANY}. The day of week follows cron numbering, so
 * {@code 1} is Monday.
 */
@Entity
@Table(
    name = "crontab_schedule",
    uniqueConstraints =
        @UniqueConstraint(
            columnNames = {
              "minute_of_hour",
              "hour_of_day",
              "day_of_week",
              "day_of_month",
              "month_of_year",
              "timezone"
            }))
public class CrontabSchedule {

  public static final String ANY = "*";

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "minute_of_hour", nullable = false, length = 64)
  private String minute = ANY;

  @Column(name = "hour_of_day", nullable = false, length = 64)
  private String hour = ANY;

  @Column(name = "day_of_week", nullable = false, length = 64)
  private String dayOfWeek = ANY;

  @Column(name = "day_of_month", nullable = false, length = 64)
  private String dayOfMonth = ANY;

  @Column(name = "month_of_year", nullable = false, length = 64)
  private String monthOfYear = ANY;

  @Column(nullable = false, length = 64)
  private String timezone;

  protected CrontabSchedule() {}

  public CrontabSchedule(String minute, String hour, String dayOfWeek, String timezone) {
    this.minute = minute;
    this.hour = hour;
    this.dayOfWeek = dayOfWeek;
    this.timezone = timezone;
  }

  public Long getId() {
    return id;
  }

  public String getMinute() {
    return minute;
  }

  public String getHour() {
    return hour;
  }

  public String getDayOfWeek() {
    return dayOfWeek;
  }

  public String getDayOfMonth() {
    return dayOfMonth;
  }

  public String getMonthOfYear() {
    return monthOfYear;
  }

  public String getTimezone() {
    return timezone;
  }

  /**
   * Six-field Spring cron expression (seconds first) equivalent to this row.
   *
   * @return cron expression firing at second zero of every matching minute
   */
  public String toCronExpression() {
    return String.join(" ", "0", minute, hour, dayOfMonth, monthOfYear, dayOfWeek);
  }

  @Override
  public String toString() {
    return toCronExpression() + " (" + timezone + ")";
  }
}
