package org.bookstore.inventory.api.response;

import io.swagger.v3.oas.annotations.media.Schema;

import org.bookstore.inventory.domain.NotificationFrequency;

/** One selectable stock alert frequency. */
@Schema(description = "Frequency option")
public record FrequencyOptionResponse(
    @Schema(description = "Wire value", example = "daily") String value,
    @Schema(description = "Display label", example = "每日") String label) {

  public static FrequencyOptionResponse from(NotificationFrequency frequency) {
    return new FrequencyOptionResponse(frequency.getValue(), frequency.getLabel());
  }
}
