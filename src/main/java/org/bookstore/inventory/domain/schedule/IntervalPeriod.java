package org.bookstore.inventory.domain.schedule;

import java.time.temporal.ChronoUnit;

/** Unit of an interval trigger. */
public enum IntervalPeriod {
  SECONDS(ChronoUnit.SECONDS),
  MINUTES(ChronoUnit.MINUTES),
  HOURS(ChronoUnit.HOURS);

  private final ChronoUnit unit;

  IntervalPeriod(ChronoUnit unit) {
    this.unit = unit;
  }

  public ChronoUnit toChronoUnit() {
    return unit;
  }
}
