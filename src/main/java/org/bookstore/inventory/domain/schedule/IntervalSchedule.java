package org.bookstore.inventory.domain.schedule;

import java.time.Duration;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/** Fixed-rate trigger shared by every job firing at the same cadence. */
@Entity
@Table(
    name = "interval_schedule",
    uniqueConstraints = @UniqueConstraint(columnNames = {"every", "period"}))
public class IntervalSchedule {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false)
  private int every;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 10)
  private IntervalPeriod period;

  protected IntervalSchedule() {}

  public IntervalSchedule(int every, IntervalPeriod period) {
    this.every = every;
    this.period = period;
  }

  public Long getId() {
    return id;
  }

  public int getEvery() {
    return every;
  }

  public IntervalPeriod getPeriod() {
    return period;
  }

  public Duration toDuration() {
    return Duration.of(every, period.toChronoUnit());
  }

  @Override
  public String toString() {
    return "every " + every + " " + period.name().toLowerCase();
  }
}
