package org.bookstore.inventory.scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.scheduling.support.PeriodicTrigger;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockingTaskExecutor;

import org.bookstore.inventory.config.BookstoreServiceProperties;
import org.bookstore.inventory.domain.event.ScheduledJobChangedEvent;
import org.bookstore.inventory.domain.schedule.ScheduledJob;
import org.bookstore.inventory.repository.ScheduledJobRepository;

/**
 * Runs registry jobs on the shared {@link TaskScheduler}.
 *
 * <p><b>Arming:</b> on startup every enabled entry gets a trigger. Afterwards the trigger for one
 * entry is rebuilt whenever a {@link ScheduledJobChangedEvent} arrives, which happens only after
 * the reconciling transaction has committed. Entries that are gone or disabled are disarmed.
 *
 * <p><b>Firing:</b> every instance arms the same triggers, so each firing first takes a ShedLock
 * lock named after the job. Only the instance holding it runs the handler. Exceptions are logged
 * and counted here and never reach the scheduler thread, so a failing job keeps its trigger.
 */
@Component
public class ScheduledJobRunner {

  private static final Logger log = LoggerFactory.getLogger(ScheduledJobRunner.class);

  static final String JOB_NAME_MDC_KEY = "jobName";

  private static final Duration CALENDAR_LOCK_AT_LEAST_FOR = Duration.ofSeconds(30);

  private final TaskScheduler taskScheduler;
  private final LockingTaskExecutor lockingTaskExecutor;
  private final ScheduledJobRepository scheduledJobRepository;
  private final Map<String, ScheduledJobHandler> handlers;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;
  private final BookstoreServiceProperties properties;
  private final Clock clock;
  private final Map<String, ScheduledFuture<?>> armed = new ConcurrentHashMap<>();

  public ScheduledJobRunner(
      TaskScheduler taskScheduler,
      LockingTaskExecutor lockingTaskExecutor,
      ScheduledJobRepository scheduledJobRepository,
      List<ScheduledJobHandler> handlers,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry,
      BookstoreServiceProperties properties,
      Clock clock) {
    this.taskScheduler = taskScheduler;
    this.lockingTaskExecutor = lockingTaskExecutor;
    this.scheduledJobRepository = scheduledJobRepository;
    this.handlers =
        handlers.stream().collect(Collectors.toMap(ScheduledJobHandler::task, Function.identity()));
    this.objectMapper = objectMapper;
    this.meterRegistry = meterRegistry;
    this.properties = properties;
    this.clock = clock;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void armAll() {
    var jobs = scheduledJobRepository.findByEnabledTrue();
    jobs.forEach(job -> refresh(job.getName()));
    log.info("Armed {} scheduled jobs from the registry", jobs.size());
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onScheduledJobChanged(ScheduledJobChangedEvent event) {
    refresh(event.jobName());
  }

  /**
   * Rebuild the trigger for one entry from its stored state. Calls are serialized so the last
   * committed state always wins.
   *
   * @param jobName registry entry name
   */
  public synchronized void refresh(String jobName) {
    var previous = armed.remove(jobName);
    if (previous != null) {
      previous.cancel(false);
    }

    var job = scheduledJobRepository.findByName(jobName).filter(ScheduledJob::isEnabled);
    if (job.isEmpty()) {
      if (previous != null) {
        log.info("Disarmed scheduled job name={}", jobName);
      }
      return;
    }
    armed.put(jobName, arm(job.get()));
  }

  /**
   * Names of entries that currently have a live trigger.
   *
   * @return armed job names
   */
  public Set<String> armedJobNames() {
    return Set.copyOf(armed.keySet());
  }

  private ScheduledFuture<?> arm(ScheduledJob job) {
    var trigger = toTrigger(job);
    var lockAtLeastFor = lockAtLeastFor(job);
    var name = job.getName();
    var task = job.getTask();
    var arguments = job.getArguments();

    log.info("Armed scheduled job name={} task={} trigger={}", name, task, describe(job));
    return taskScheduler.schedule(() -> fire(name, task, arguments, lockAtLeastFor), trigger);
  }

  void fire(String jobName, String task, String arguments, Duration lockAtLeastFor) {
    var sample = Timer.start(meterRegistry);
    MDC.put(JOB_NAME_MDC_KEY, jobName);
    try {
      var lockAtMostFor = max(properties.getStockAlert().getLockAtMostFor(), lockAtLeastFor);
      var lock = new LockConfiguration(clock.instant(), jobName, lockAtMostFor, lockAtLeastFor);
      var result =
          lockingTaskExecutor.executeWithLock(
              () -> {
                dispatch(task, arguments);
                return Boolean.TRUE;
              },
              lock);

      if (result.wasExecuted()) {
        scheduledJobRepository.recordRun(jobName, clock.instant());
        record(sample, task, "success");
      } else {
        log.debug("Skipped scheduled job name={}, locked by another instance", jobName);
        record(sample, task, "skipped");
      }
    } catch (Throwable e) {
      log.error("Scheduled job failed name={} task={}: {}", jobName, task, e.getMessage(), e);
      record(sample, task, "failure");
    } finally {
      MDC.remove(JOB_NAME_MDC_KEY);
    }
  }

  private void dispatch(String task, String arguments) throws JsonProcessingException {
    var handler = handlers.get(task);
    if (handler == null) {
      throw new IllegalStateException("No handler registered for task " + task);
    }
    handler.execute(objectMapper.readTree(arguments));
  }

  private Trigger toTrigger(ScheduledJob job) {
    if (job.getInterval() != null) {
      var trigger = new PeriodicTrigger(job.getInterval().toDuration());
      trigger.setFixedRate(true);
      trigger.setInitialDelay(job.getInterval().toDuration());
      return trigger;
    }
    if (job.getCrontab() != null) {
      var crontab = job.getCrontab();
      return new CronTrigger(crontab.toCronExpression(), ZoneId.of(crontab.getTimezone()));
    }
    throw new IllegalStateException("Scheduled job " + job.getName() + " has no trigger");
  }

  private Duration lockAtLeastFor(ScheduledJob job) {
    if (job.getInterval() != null) {
      return job.getInterval().toDuration().dividedBy(2);
    }
    return CALENDAR_LOCK_AT_LEAST_FOR;
  }

  private static String describe(ScheduledJob job) {
    return job.getInterval() != null
        ? String.valueOf(job.getInterval())
        : String.valueOf(job.getCrontab());
  }

  private static Duration max(Duration a, Duration b) {
    return a.compareTo(b) >= 0 ? a : b;
  }

  private void record(Timer.Sample sample, String task, String status) {
    sample.stop(
        Timer.builder("scheduled.job.duration")
            .tag("task", task)
            .tag("status", status)
            .register(meterRegistry));
    meterRegistry.counter("scheduled.job.executions", "task", task, "status", status).increment();
  }
}
