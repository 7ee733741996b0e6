package org.bookstore.inventory.api.request;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Request DTO for a partial preference update. Omitted fields stay unchanged and unknown fields
 * are ignored.
 *
 * <p>An explicit {@code null} frequency is read as an empty value, which no frequency matches, so
 * it is rejected rather than treated as omitted.
 */
@Schema(description = "Notification preference fields to change")
public record PreferenceUpdateRequest(
    @Schema(
            description = "Stock alert frequency",
            allowableValues = {
              "every_15_sec",
              "every_minute",
              "hourly",
              "daily",
              "weekly",
              "disabled"
            },
            example = "hourly")
        @JsonSetter(nulls = Nulls.AS_EMPTY)
        String stockAlertFrequency,
    @Schema(description = "Email notifications on or off", example = "true")
        Boolean emailNotification,
    @Schema(description = "Browser notifications on or off", example = "true")
        Boolean browserNotification) {}
