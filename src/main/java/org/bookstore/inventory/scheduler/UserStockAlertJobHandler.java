package org.bookstore.inventory.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;

import org.bookstore.inventory.service.StockAlertService;
import org.bookstore.inventory.service.schedule.StockAlertScheduleRegistry;

/** Runs the per-user low-stock check for jobs registered by {@link StockAlertScheduleRegistry}. */
@Component
public class UserStockAlertJobHandler implements ScheduledJobHandler {

  private static final Logger log = LoggerFactory.getLogger(UserStockAlertJobHandler.class);

  private final StockAlertService stockAlertService;

  public UserStockAlertJobHandler(StockAlertService stockAlertService) {
    this.stockAlertService = stockAlertService;
  }

  @Override
  public String task() {
    return StockAlertScheduleRegistry.CHECK_LOW_STOCK_FOR_USER_TASK;
  }

  @Override
  public void execute(JsonNode arguments) {
    var userIdNode = arguments.get(StockAlertScheduleRegistry.USER_ID_ARGUMENT);
    if (userIdNode == null || !userIdNode.canConvertToLong()) {
      throw new IllegalArgumentException("Stock alert job arguments lack a user id: " + arguments);
    }

    var result = stockAlertService.evaluate(userIdNode.asLong());
    if (result.isSuccess()) {
      log.debug(
          "Stock alert job finished userId={} lowStockCount={}",
          result.userId(),
          result.lowStockCount());
    } else {
      log.warn("Stock alert job reported {} userId={}", result.status().getValue(), result.userId());
    }
  }
}
