package org.bookstore.inventory.api;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import org.bookstore.inventory.domain.NotificationFrequency;
import org.bookstore.inventory.domain.NotificationPreference;
import org.bookstore.inventory.fixture.TestConstants;
import org.bookstore.inventory.fixture.TestEntities;
import org.bookstore.inventory.service.NotificationPreferenceService;
import org.bookstore.inventory.service.dto.PreferenceChanges;
import org.bookstore.inventory.service.exception.ResourceNotFoundException;

/**
 * Web layer tests for {@link NotificationPreferenceController}.
 *
 * <p>Covers request parsing, the success envelope and each error response the preference
 * endpoints produce.
 */
@WebMvcTest(NotificationPreferenceController.class)
@DisplayName("NotificationPreferenceController Tests")
class NotificationPreferenceControllerTest {

  private static final long USER_ID = 7L;
  private static final String PREFERENCE_URL = "/v1/users/{userId}/preference";

  @Autowired private MockMvc mockMvc;

  @MockitoBean private NotificationPreferenceService preferenceService;

  // ===========================================================================================
  // GET
  // ===========================================================================================

  @Test
  @DisplayName("GET preference - returns defaults in snake_case")
  void get_ReturnsPreference() throws Exception {
    when(preferenceService.getOrCreate(USER_ID)).thenReturn(preference(NotificationFrequency.DAILY));

    mockMvc
        .perform(get(PREFERENCE_URL, USER_ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.data.stock_alert_frequency").value("daily"))
        .andExpect(jsonPath("$.data.email_notification").value(true))
        .andExpect(jsonPath("$.data.browser_notification").value(true));
  }

  @Test
  @DisplayName("GET preference - unknown user - 404 envelope")
  void get_UnknownUser_NotFound() throws Exception {
    when(preferenceService.getOrCreate(USER_ID))
        .thenThrow(new ResourceNotFoundException("User not found with id: " + USER_ID));

    mockMvc
        .perform(get(PREFERENCE_URL, USER_ID))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.success").value(false))
        .andExpect(jsonPath("$.message").value("User not found with id: " + USER_ID));
  }

  // ===========================================================================================
  // PUT / POST
  // ===========================================================================================

  @Test
  @DisplayName("PUT preference - valid frequency - 200 with 設定已更新")
  void put_ValidFrequency_Updated() throws Exception {
    var changes = new PreferenceChanges(NotificationFrequency.HOURLY, null, false);
    when(preferenceService.update(USER_ID, changes))
        .thenReturn(preference(NotificationFrequency.HOURLY));

    mockMvc
        .perform(
            put(PREFERENCE_URL, USER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"stock_alert_frequency": "hourly", "browser_notification": false}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.message").value("設定已更新"))
        .andExpect(jsonPath("$.data.stock_alert_frequency").value("hourly"));

    verify(preferenceService).update(USER_ID, changes);
  }

  @Test
  @DisplayName("POST preference - accepted the same as PUT")
  void post_ValidFrequency_Updated() throws Exception {
    when(preferenceService.update(eq(USER_ID), any()))
        .thenReturn(preference(NotificationFrequency.WEEKLY));

    mockMvc
        .perform(
            post(PREFERENCE_URL, USER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"stock_alert_frequency\": \"weekly\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.stock_alert_frequency").value("weekly"));
  }

  @Test
  @DisplayName("PUT preference - unknown frequency - 400 無效的通知頻率, nothing written")
  void put_InvalidFrequency_BadRequest() throws Exception {
    mockMvc
        .perform(
            put(PREFERENCE_URL, USER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"stock_alert_frequency\": \"monthly\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.success").value(false))
        .andExpect(jsonPath("$.message").value("無效的通知頻率"));

    verify(preferenceService, never()).update(any(), any());
  }

  @Test
  @DisplayName("PUT preference - explicit null frequency - 400 無效的通知頻率, nothing written")
  void put_NullFrequency_BadRequest() throws Exception {
    mockMvc
        .perform(
            put(PREFERENCE_URL, USER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"stock_alert_frequency\": null, \"email_notification\": false}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.success").value(false))
        .andExpect(jsonPath("$.message").value("無效的通知頻率"));

    verify(preferenceService, never()).update(any(), any());
  }

  @Test
  @DisplayName("PUT preference - frequency omitted - only the channel flags change")
  void put_FrequencyOmitted_FlagsOnly() throws Exception {
    when(preferenceService.update(eq(USER_ID), any()))
        .thenReturn(preference(NotificationFrequency.DAILY));

    mockMvc
        .perform(
            put(PREFERENCE_URL, USER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"browser_notification\": false}"))
        .andExpect(status().isOk());

    verify(preferenceService).update(USER_ID, new PreferenceChanges(null, null, false));
  }

  @Test
  @DisplayName("PUT preference - malformed body - 400 無效的請求格式")
  void put_MalformedBody_BadRequest() throws Exception {
    mockMvc
        .perform(
            put(PREFERENCE_URL, USER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.success").value(false))
        .andExpect(jsonPath("$.message").value("無效的請求格式"));
  }

  @Test
  @DisplayName("PUT preference - unexpected failure - 500 with the error message")
  void put_UnexpectedFailure_ServerError() throws Exception {
    when(preferenceService.update(eq(USER_ID), any()))
        .thenThrow(new IllegalStateException("registry unavailable"));

    mockMvc
        .perform(
            put(PREFERENCE_URL, USER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"stock_alert_frequency\": \"daily\"}"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.success").value(false))
        .andExpect(jsonPath("$.message").value("registry unavailable"));
  }

  // ===========================================================================================
  // Frequencies
  // ===========================================================================================

  @Test
  @DisplayName("GET notification-frequencies - lists every option with its label")
  void frequencies_ListsAll() throws Exception {
    mockMvc
        .perform(get("/v1/notification-frequencies"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data", hasSize(NotificationFrequency.values().length)))
        .andExpect(jsonPath("$.data[0].value").value("every_15_sec"))
        .andExpect(jsonPath("$.data[5].value").value("disabled"))
        .andExpect(jsonPath("$.data[5].label").value("停用通知"));
  }

  private static NotificationPreference preference(NotificationFrequency frequency) {
    var preference =
        new NotificationPreference(TestEntities.user(USER_ID, TestConstants.USERNAME));
    preference.setFrequency(frequency);
    return preference;
  }
}
