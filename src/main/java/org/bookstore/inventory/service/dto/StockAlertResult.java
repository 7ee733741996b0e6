package org.bookstore.inventory.service.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of one low-stock evaluation.
 *
 * @param status success, or the reason the evaluation did not run
 * @param userId user the evaluation ran for, null for the global sweep
 * @param lowStockCount number of books below the threshold
 * @param message alert text that was published, null when nothing was published
 */
public record StockAlertResult(Status status, Long userId, long lowStockCount, String message) {

  public enum Status {
    SUCCESS("success"),
    USER_NOT_FOUND("user_not_found");

    private final String value;

    Status(String value) {
      this.value = value;
    }

    @JsonValue
    public String getValue() {
      return value;
    }
  }

  public static StockAlertResult success(Long userId, long lowStockCount, String message) {
    return new StockAlertResult(Status.SUCCESS, userId, lowStockCount, message);
  }

  public static StockAlertResult userNotFound(Long userId) {
    return new StockAlertResult(Status.USER_NOT_FOUND, userId, 0, null);
  }

  public boolean isSuccess() {
    return status == Status.SUCCESS;
  }
}
