package org.bookstore.inventory.domain.schedule;

import java.time.Instant;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.bookstore.inventory.domain.AuditableEntity;

/**
 * Registry entry for a recurring job, looked up by its unique name.
 *
 * <p>An entry references either an {@link IntervalSchedule} or a {@link CrontabSchedule}, never
 * both. The job runner arms one trigger per enabled entry and dispatches each firing to the
 * handler registered for {@link #getTask()}.
 */
@Entity
@Table(name = "scheduled_job")
public class ScheduledJob extends AuditableEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false, unique = true, length = 200)
  private String name;

  /** Identity of the handler invoked on each firing. */
  @Column(nullable = false, length = 200)
  private String task;

  /** JSON object passed to the handler. */
  @Column(nullable = false, length = 1000)
  private String arguments = "{}";

  @ManyToOne(fetch = FetchType.EAGER)
  @JoinColumn(name = "interval_id")
  private IntervalSchedule interval;

  @ManyToOne(fetch = FetchType.EAGER)
  @JoinColumn(name = "crontab_id")
  private CrontabSchedule crontab;

  @Column(nullable = false)
  private boolean enabled = true;

  @Column(name = "last_run_at")
  private Instant lastRunAt;

  @Column(name = "total_run_count", nullable = false)
  private long totalRunCount;

  protected ScheduledJob() {}

  public ScheduledJob(String name) {
    this.name = name;
  }

  /** Points this job at an interval trigger and clears any calendar trigger. */
  public void useInterval(IntervalSchedule interval) {
    this.interval = interval;
    this.crontab = null;
  }

  /** Points this job at a calendar trigger and clears any interval trigger. */
  public void useCrontab(CrontabSchedule crontab) {
    this.crontab = crontab;
    this.interval = null;
  }

  public Long getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getTask() {
    return task;
  }

  public void setTask(String task) {
    this.task = task;
  }

  public String getArguments() {
    return arguments;
  }

  public void setArguments(String arguments) {
    this.arguments = arguments;
  }

  public IntervalSchedule getInterval() {
    return interval;
  }

  public CrontabSchedule getCrontab() {
    return crontab;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public Instant getLastRunAt() {
    return lastRunAt;
  }

  public long getTotalRunCount() {
    return totalRunCount;
  }
}
