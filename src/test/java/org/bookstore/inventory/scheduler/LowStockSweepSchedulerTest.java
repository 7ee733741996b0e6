package org.bookstore.inventory.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import org.bookstore.inventory.service.StockAlertService;
import org.bookstore.inventory.service.dto.StockAlertResult;

/**
 * Unit tests for {@link LowStockSweepScheduler}.
 *
 * <p>ShedLock coordination is not exercised here. These tests cover delegation, metrics and
 * failure containment.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("LowStockSweepScheduler Unit Tests")
class LowStockSweepSchedulerTest {

  @Mock private StockAlertService stockAlertService;

  private MeterRegistry meterRegistry;
  private LowStockSweepScheduler scheduler;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    scheduler = new LowStockSweepScheduler(meterRegistry, stockAlertService);
  }

  @Test
  @DisplayName("sweep - successful evaluation - records success and the low-stock gauge")
  void sweep_Success_RecordsMetrics() {
    // Arrange
    when(stockAlertService.evaluate())
        .thenReturn(StockAlertResult.success(null, 3, "庫存警告：a, b, c 庫存不足！"));

    // Act
    scheduler.sweep();

    // Assert
    verify(stockAlertService).evaluate();
    var timer = meterRegistry.find("stock.alert.sweep.duration").tag("status", "success").timer();
    assertThat(timer).isNotNull();
    assertThat(timer.count()).isEqualTo(1);
    assertThat(
            meterRegistry
                .find("stock.alert.sweep.executions")
                .tag("status", "success")
                .counter()
                .count())
        .isEqualTo(1.0);
    assertThat(meterRegistry.find("stock.alert.low.stock.books").gauge().value()).isEqualTo(3.0);
  }

  @Test
  @DisplayName("sweep - evaluation throws - records failure without propagating")
  void sweep_Failure_RecordsFailure() {
    // Arrange
    when(stockAlertService.evaluate()).thenThrow(new IllegalStateException("database down"));

    // Act
    scheduler.sweep();

    // Assert
    var counter =
        meterRegistry
            .find("stock.alert.sweep.executions")
            .tag("status", "failure")
            .tag("error", "IllegalStateException")
            .counter();
    assertThat(counter).isNotNull();
    assertThat(counter.count()).isEqualTo(1.0);
  }
}
