package org.bookstore.inventory.service.schedule;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.bookstore.inventory.config.BookstoreServiceProperties;
import org.bookstore.inventory.domain.event.ScheduledJobChangedEvent;
import org.bookstore.inventory.domain.schedule.CrontabSchedule;
import org.bookstore.inventory.domain.schedule.IntervalSchedule;
import org.bookstore.inventory.domain.schedule.ScheduledJob;
import org.bookstore.inventory.repository.CrontabScheduleRepository;
import org.bookstore.inventory.repository.IntervalScheduleRepository;
import org.bookstore.inventory.repository.ScheduledJobRepository;

/**
 * Keeps each user's stock-alert registry entry in agreement with a {@link ScheduleSpec}.
 *
 * <p>This is the only writer of entries named {@code stock_alert:<userId>}.
 *
 * <p><b>Transactions:</b> {@link #reconcile} and {@link #remove} join the caller's transaction, so
 * a preference write and its reconciliation commit or roll back together. The job runner is told
 * about the change through a {@link ScheduledJobChangedEvent} that it handles only after commit.
 *
 * <p><b>Trigger rows:</b> interval and calendar rows are shared between users and looked up by
 * their parameters. A missing row is inserted through {@link ScheduleTriggerStore}, which commits
 * it separately, and then read back. Unset calendar fields are stored as {@code *}.
 */
@Service
public class StockAlertScheduleRegistry {

  private static final Logger log = LoggerFactory.getLogger(StockAlertScheduleRegistry.class);

  /** Prefix of per-user registry entry names. */
  public static final String JOB_NAME_PREFIX = "stock_alert:";

  /** Task identity of the per-user low-stock check. */
  public static final String CHECK_LOW_STOCK_FOR_USER_TASK = "stock_alert.check_low_stock_for_user";

  /** Argument key carrying the user id. */
  public static final String USER_ID_ARGUMENT = "user_id";

  private final ScheduledJobRepository scheduledJobRepository;
  private final IntervalScheduleRepository intervalScheduleRepository;
  private final CrontabScheduleRepository crontabScheduleRepository;
  private final ScheduleTriggerStore triggerStore;
  private final ApplicationEventPublisher eventPublisher;
  private final ObjectMapper objectMapper;
  private final BookstoreServiceProperties properties;

  public StockAlertScheduleRegistry(
      ScheduledJobRepository scheduledJobRepository,
      IntervalScheduleRepository intervalScheduleRepository,
      CrontabScheduleRepository crontabScheduleRepository,
      ScheduleTriggerStore triggerStore,
      ApplicationEventPublisher eventPublisher,
      ObjectMapper objectMapper,
      BookstoreServiceProperties properties) {
    this.scheduledJobRepository = scheduledJobRepository;
    this.intervalScheduleRepository = intervalScheduleRepository;
    this.crontabScheduleRepository = crontabScheduleRepository;
    this.triggerStore = triggerStore;
    this.eventPublisher = eventPublisher;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  /**
   * Name of the registry entry for a user.
   *
   * @param userId user id
   * @return {@code stock_alert:<userId>}
   */
  public static String jobName(Long userId) {
    return JOB_NAME_PREFIX + userId;
  }

  /**
   * Bring the user's registry entry in line with {@code spec}.
   *
   * <p>An empty spec removes the entry. Otherwise the entry is created or updated to point at the
   * matching trigger, with the other trigger kind cleared and the entry enabled. Calling this twice
   * with the same spec leaves the same single entry.
   *
   * @param userId user the entry belongs to
   * @param spec desired trigger, or empty for none
   */
  @Transactional
  public void reconcile(Long userId, Optional<ScheduleSpec> spec) {
    if (spec.isEmpty()) {
      remove(userId);
      return;
    }

    var name = jobName(userId);
    var job = scheduledJobRepository.findByName(name).orElseGet(() -> new ScheduledJob(name));

    var trigger = spec.get();
    if (trigger instanceof ScheduleSpec.Interval interval) {
      job.useInterval(resolveInterval(interval));
    } else if (trigger instanceof ScheduleSpec.Calendar calendar) {
      job.useCrontab(resolveCrontab(calendar));
    } else {
      throw new IllegalArgumentException("Unsupported schedule: " + trigger);
    }

    job.setTask(CHECK_LOW_STOCK_FOR_USER_TASK);
    job.setArguments(objectMapper.createObjectNode().put(USER_ID_ARGUMENT, userId).toString());
    job.setEnabled(true);
    scheduledJobRepository.save(job);

    log.info("Reconciled stock alert job name={} schedule={}", name, trigger);
    eventPublisher.publishEvent(new ScheduledJobChangedEvent(name));
  }

  /**
   * Remove the user's registry entry. Removing a missing entry is a no-op.
   *
   * @param userId user the entry belongs to
   */
  @Transactional
  public void remove(Long userId) {
    var name = jobName(userId);
    var removed = scheduledJobRepository.deleteByName(name);
    if (removed > 0) {
      log.info("Removed stock alert job name={}", name);
      eventPublisher.publishEvent(new ScheduledJobChangedEvent(name));
    } else {
      log.debug("No stock alert job to remove name={}", name);
    }
  }

  private IntervalSchedule resolveInterval(ScheduleSpec.Interval interval) {
    var every = interval.magnitude();
    var period = interval.unit();
    var existing = intervalScheduleRepository.findByEveryAndPeriod(every, period);
    if (existing.isPresent()) {
      return existing.get();
    }

    try {
      triggerStore.insertInterval(every, period);
    } catch (DataIntegrityViolationException e) {
      log.debug("Interval trigger every={} period={} created concurrently", every, period);
    }
    return intervalScheduleRepository
        .findByEveryAndPeriod(every, period)
        .orElseThrow(
            () -> new IllegalStateException("Interval trigger missing after insert: " + interval));
  }

  private CrontabSchedule resolveCrontab(ScheduleSpec.Calendar calendar) {
    var minute = String.valueOf(calendar.minute());
    var hour = String.valueOf(calendar.hour());
    var dayOfWeek =
        calendar.dayOfWeek() == null
            ? CrontabSchedule.ANY
            : String.valueOf(calendar.dayOfWeek().getValue());
    var zone = properties.getStockAlert().getZone();

    var existing = findCrontab(minute, hour, dayOfWeek, zone);
    if (existing.isPresent()) {
      return existing.get();
    }

    try {
      triggerStore.insertCrontab(minute, hour, dayOfWeek, zone);
    } catch (DataIntegrityViolationException e) {
      log.debug("Calendar trigger {} zone={} created concurrently", calendar, zone);
    }
    return findCrontab(minute, hour, dayOfWeek, zone)
        .orElseThrow(
            () -> new IllegalStateException("Calendar trigger missing after insert: " + calendar));
  }

  private Optional<CrontabSchedule> findCrontab(
      String minute, String hour, String dayOfWeek, String zone) {
    return crontabScheduleRepository
        .findByMinuteAndHourAndDayOfWeekAndDayOfMonthAndMonthOfYearAndTimezone(
            minute, hour, dayOfWeek, CrontabSchedule.ANY, CrontabSchedule.ANY, zone);
  }
}
