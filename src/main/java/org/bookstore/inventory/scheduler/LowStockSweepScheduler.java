package org.bookstore.inventory.scheduler;

import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;

import org.bookstore.inventory.service.StockAlertService;

/** Global low-stock check broadcast to every connected client. */
@Component
public class LowStockSweepScheduler {

  private static final Logger log = LoggerFactory.getLogger(LowStockSweepScheduler.class);

  private final MeterRegistry meterRegistry;
  private final StockAlertService stockAlertService;
  private final AtomicLong lowStockBooks;

  public LowStockSweepScheduler(MeterRegistry meterRegistry, StockAlertService stockAlertService) {
    this.meterRegistry = meterRegistry;
    this.stockAlertService = stockAlertService;
    this.lowStockBooks = meterRegistry.gauge("stock.alert.low.stock.books", new AtomicLong());
  }

  @Scheduled(
      cron = "${bookstore.stock-alert.sweep-cron:0 0 * * * *}",
      zone = "${bookstore.stock-alert.zone:UTC}")
  @SchedulerLock(name = "lowStockSweep", lockAtMostFor = "5m", lockAtLeastFor = "30s")
  public void sweep() {
    log.info("Starting scheduled low-stock sweep");
    var sample = Timer.start(meterRegistry);

    try {
      var result = stockAlertService.evaluate();
      log.info("Completed low-stock sweep, {} books below threshold", result.lowStockCount());
      recordSuccess(sample, result.lowStockCount());
    } catch (Exception e) {
      log.error("Low-stock sweep failed: {}", e.getMessage(), e);
      recordFailure(sample, e);
    }
  }

  private void recordSuccess(Timer.Sample sample, long lowStockCount) {
    sample.stop(
        Timer.builder("stock.alert.sweep.duration")
            .tag("status", "success")
            .register(meterRegistry));
    meterRegistry.counter("stock.alert.sweep.executions", "status", "success").increment();
    lowStockBooks.set(lowStockCount);
  }

  private void recordFailure(Timer.Sample sample, Exception e) {
    sample.stop(
        Timer.builder("stock.alert.sweep.duration")
            .tag("status", "failure")
            .tag("error", e.getClass().getSimpleName())
            .register(meterRegistry));
    meterRegistry
        .counter(
            "stock.alert.sweep.executions",
            "status",
            "failure",
            "error",
            e.getClass().getSimpleName())
        .increment();
  }
}
