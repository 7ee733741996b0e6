package org.bookstore.inventory.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;

import org.bookstore.inventory.domain.schedule.CrontabSchedule;

/** Repository for calendar triggers. */
public interface CrontabScheduleRepository extends JpaRepository<CrontabSchedule, Long> {

  Optional<CrontabSchedule>
      findByMinuteAndHourAndDayOfWeekAndDayOfMonthAndMonthOfYearAndTimezone(
          String minute,
          String hour,
          String dayOfWeek,
          String dayOfMonth,
          String monthOfYear,
          String timezone);
}
