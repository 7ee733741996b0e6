package org.bookstore.inventory.service.schedule;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import org.bookstore.inventory.domain.schedule.CrontabSchedule;
import org.bookstore.inventory.domain.schedule.IntervalPeriod;
import org.bookstore.inventory.domain.schedule.IntervalSchedule;
import org.bookstore.inventory.repository.CrontabScheduleRepository;
import org.bookstore.inventory.repository.IntervalScheduleRepository;

/**
 * Inserts shared trigger rows, each in its own short transaction.
 *
 * <p>A new row is committed before the caller's reconciliation continues, so other users reaching
 * the same cadence see it at once instead of racing on the unique key until the first caller
 * commits. A concurrent insert of the same row surfaces as a {@link
 * org.springframework.dao.DataIntegrityViolationException}; the caller then reads the winner's
 * row.
 */
@Component
public class ScheduleTriggerStore {

  private final IntervalScheduleRepository intervalScheduleRepository;
  private final CrontabScheduleRepository crontabScheduleRepository;

  public ScheduleTriggerStore(
      IntervalScheduleRepository intervalScheduleRepository,
      CrontabScheduleRepository crontabScheduleRepository) {
    this.intervalScheduleRepository = intervalScheduleRepository;
    this.crontabScheduleRepository = crontabScheduleRepository;
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void insertInterval(int every, IntervalPeriod period) {
    intervalScheduleRepository.saveAndFlush(new IntervalSchedule(every, period));
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void insertCrontab(String minute, String hour, String dayOfWeek, String timezone) {
    crontabScheduleRepository.saveAndFlush(new CrontabSchedule(minute, hour, dayOfWeek, timezone));
  }
}
