package org.bookstore.inventory.domain;

import java.util.Arrays;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

/** How often a user wants to be told about low-stock books. */
public enum NotificationFrequency {
  /** Test cadence, not meant for real users. */
  EVERY_15_SEC("every_15_sec", "每 15 秒（測試用）"),
  EVERY_MINUTE("every_minute", "每分鐘"),
  HOURLY("hourly", "每小時"),
  DAILY("daily", "每日"),
  WEEKLY("weekly", "每週"),
  DISABLED("disabled", "停用通知");

  private final String value;
  private final String label;

  NotificationFrequency(String value, String label) {
    this.value = value;
    this.label = label;
  }

  /**
   * Wire value, e.g. {@code every_minute}.
   *
   * @return the external representation of this frequency
   */
  @JsonValue
  public String getValue() {
    return value;
  }

  public String getLabel() {
    return label;
  }

  /**
   * Resolves a wire value.
   *
   * @param value the external representation, may be null
   * @return the matching frequency, or empty when the value is null or unknown
   */
  public static Optional<NotificationFrequency> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(f -> f.value.equals(value)).findFirst();
  }
}
