package org.bookstore.inventory.api;

import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.bookstore.inventory.api.request.PreferenceUpdateRequest;
import org.bookstore.inventory.api.response.ApiErrorResponse;
import org.bookstore.inventory.api.response.ApiResult;
import org.bookstore.inventory.api.response.FrequencyOptionResponse;
import org.bookstore.inventory.api.response.PreferenceResponse;
import org.bookstore.inventory.domain.NotificationFrequency;
import org.bookstore.inventory.service.NotificationPreferenceService;
import org.bookstore.inventory.service.dto.PreferenceChanges;
import org.bookstore.inventory.service.exception.InvalidRequestException;

/** Endpoints for a user's notification preference. */
@Tag(name = "Notification Preference", description = "Stock alert frequency and channels")
@RestController
@RequestMapping(path = "/v1")
public class NotificationPreferenceController {

  private static final Logger log = LoggerFactory.getLogger(NotificationPreferenceController.class);

  static final String UPDATED_MESSAGE = "設定已更新";
  static final String INVALID_FREQUENCY_MESSAGE = "無效的通知頻率";

  private final NotificationPreferenceService preferenceService;

  public NotificationPreferenceController(NotificationPreferenceService preferenceService) {
    this.preferenceService = preferenceService;
  }

  @Operation(
      summary = "Get notification preference",
      description = "Created with defaults (daily, both channels on) on first access")
  @GetMapping(path = "/users/{userId}/preference", produces = "application/json")
  public ApiResult<PreferenceResponse> get(@PathVariable("userId") Long userId) {
    return ApiResult.of(PreferenceResponse.from(preferenceService.getOrCreate(userId)));
  }

  @Operation(
      summary = "Update notification preference",
      description =
          "Apply the supplied fields. Changing stock_alert_frequency reschedules the user's "
              + "stock alerts in the same transaction.")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Preference updated"),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid frequency or malformed body",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class),
                    examples = {
                      @ExampleObject(
                          name = "Invalid Frequency",
                          value =
                              """
                              {"success": false, "message": "無效的通知頻率"}
                              """),
                      @ExampleObject(
                          name = "Malformed Body",
                          value =
                              """
                              {"success": false, "message": "無效的請求格式"}
                              """)
                    })),
        @ApiResponse(responseCode = "404", description = "User not found"),
        @ApiResponse(responseCode = "500", description = "Unexpected failure")
      })
  @RequestMapping(
      path = "/users/{userId}/preference",
      method = {RequestMethod.PUT, RequestMethod.POST},
      produces = "application/json",
      consumes = "application/json")
  public ApiResult<PreferenceResponse> update(
      @PathVariable("userId") Long userId, @RequestBody PreferenceUpdateRequest request) {
    var frequency = parseFrequency(request.stockAlertFrequency());
    var changes =
        new PreferenceChanges(frequency, request.emailNotification(), request.browserNotification());

    log.info("Updating notification preference userId={}", userId);
    var updated = preferenceService.update(userId, changes);
    return ApiResult.of(UPDATED_MESSAGE, PreferenceResponse.from(updated));
  }

  @Operation(summary = "List selectable stock alert frequencies")
  @GetMapping(path = "/notification-frequencies", produces = "application/json")
  public ApiResult<List<FrequencyOptionResponse>> frequencies() {
    return ApiResult.of(
        Arrays.stream(NotificationFrequency.values()).map(FrequencyOptionResponse::from).toList());
  }

  private static NotificationFrequency parseFrequency(String value) {
    if (value == null) {
      return null;
    }
    return NotificationFrequency.fromValue(value)
        .orElseThrow(() -> new InvalidRequestException(INVALID_FREQUENCY_MESSAGE));
  }
}
