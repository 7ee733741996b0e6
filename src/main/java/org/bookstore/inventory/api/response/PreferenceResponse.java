package org.bookstore.inventory.api.response;

import io.swagger.v3.oas.annotations.media.Schema;

import org.bookstore.inventory.domain.NotificationFrequency;
import org.bookstore.inventory.domain.NotificationPreference;

/** Response DTO for a user's notification preference. */
@Schema(description = "Notification preference")
public record PreferenceResponse(
    @Schema(description = "Stock alert frequency", example = "daily")
        NotificationFrequency stockAlertFrequency,
    @Schema(description = "Email notifications on or off", example = "true")
        boolean emailNotification,
    @Schema(description = "Browser notifications on or off", example = "true")
        boolean browserNotification) {

  public static PreferenceResponse from(NotificationPreference preference) {
    return new PreferenceResponse(
        preference.getFrequency(), preference.isEmailEnabled(), preference.isBrowserEnabled());
  }
}
