package org.bookstore.inventory.service.schedule;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.DayOfWeek;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import org.bookstore.inventory.base.AbstractRepositoryTest;
import org.bookstore.inventory.config.PersistenceTestConfig;
import org.bookstore.inventory.domain.schedule.CrontabSchedule;
import org.bookstore.inventory.domain.schedule.ScheduledJob;
import org.bookstore.inventory.repository.CrontabScheduleRepository;
import org.bookstore.inventory.repository.ScheduledJobRepository;

/**
 * Concurrent reconciliations of different users onto the same calendar cadence.
 *
 * <p>Runs without the test-managed transaction so each reconciliation commits on its own, the way
 * two request threads would.
 */
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({
  PersistenceTestConfig.class,
  StockAlertScheduleRegistry.class,
  ScheduleTriggerStore.class
})
@DisplayName("StockAlertScheduleRegistry Concurrency Tests")
class StockAlertScheduleRegistryConcurrencyTest extends AbstractRepositoryTest {

  private static final long FIRST_USER_ID = 101L;
  private static final long SECOND_USER_ID = 202L;

  // Cadence no other test uses, so the trigger row does not exist yet
  private static final ScheduleSpec SUNDAY_EARLY =
      new ScheduleSpec.Calendar(5, 45, DayOfWeek.SUNDAY);

  @Autowired private StockAlertScheduleRegistry registry;
  @Autowired private ScheduledJobRepository scheduledJobRepository;
  @Autowired private CrontabScheduleRepository crontabScheduleRepository;
  @Autowired private PlatformTransactionManager transactionManager;

  private TransactionTemplate transactionTemplate;
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    transactionTemplate = new TransactionTemplate(transactionManager);
    executor = Executors.newSingleThreadExecutor();
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
    transactionTemplate.executeWithoutResult(
        status -> {
          scheduledJobRepository.deleteByName(StockAlertScheduleRegistry.jobName(FIRST_USER_ID));
          scheduledJobRepository.deleteByName(StockAlertScheduleRegistry.jobName(SECOND_USER_ID));
        });
  }

  @Test
  @DisplayName("reconcile - new cadence while another user's transaction is open - both succeed")
  void reconcile_SameNewCadenceConcurrently_BothShareOneRow() throws Exception {
    // Arrange
    assertThat(findSundayEarly()).isEmpty();
    var firstReconciled = new CountDownLatch(1);
    var releaseFirst = new CountDownLatch(1);

    var first =
        executor.submit(
            () ->
                transactionTemplate.executeWithoutResult(
                    status -> {
                      registry.reconcile(FIRST_USER_ID, Optional.of(SUNDAY_EARLY));
                      firstReconciled.countDown();
                      await(releaseFirst);
                    }));
    assertThat(firstReconciled.await(5, TimeUnit.SECONDS)).isTrue();

    // Act: the first transaction is still open
    transactionTemplate.executeWithoutResult(
        status -> registry.reconcile(SECOND_USER_ID, Optional.of(SUNDAY_EARLY)));
    releaseFirst.countDown();
    first.get(5, TimeUnit.SECONDS);

    // Assert
    var row = findSundayEarly().orElseThrow();
    var firstJob =
        scheduledJobRepository.findByName(StockAlertScheduleRegistry.jobName(FIRST_USER_ID));
    var secondJob =
        scheduledJobRepository.findByName(StockAlertScheduleRegistry.jobName(SECOND_USER_ID));
    assertThat(firstJob)
        .hasValueSatisfying(job -> assertThat(crontabId(job)).isEqualTo(row.getId()));
    assertThat(secondJob)
        .hasValueSatisfying(job -> assertThat(crontabId(job)).isEqualTo(row.getId()));
  }

  private Optional<CrontabSchedule> findSundayEarly() {
    return crontabScheduleRepository
        .findByMinuteAndHourAndDayOfWeekAndDayOfMonthAndMonthOfYearAndTimezone(
            "45", "5", "7", "*", "*", "UTC");
  }

  private static Long crontabId(ScheduledJob job) {
    return job.getCrontab().getId();
  }

  private static void await(CountDownLatch latch) {
    try {
      if (!latch.await(5, TimeUnit.SECONDS)) {
        throw new IllegalStateException("Timed out waiting for release");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    }
  }
}
