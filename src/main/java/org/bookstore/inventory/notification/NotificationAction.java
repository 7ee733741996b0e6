package org.bookstore.inventory.notification;

import com.fasterxml.jackson.annotation.JsonValue;

/** What happened, as seen by connected clients. */
public enum NotificationAction {
  CREATE("create"),
  UPDATE("update"),
  DELETE("delete"),
  LOW_STOCK_WARNING("low_stock_warning"),
  EXPORT_COMPLETE("export_complete");

  private final String value;

  NotificationAction(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
