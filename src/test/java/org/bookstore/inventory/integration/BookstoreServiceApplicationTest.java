package org.bookstore.inventory.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

import com.jayway.jsonpath.JsonPath;

import org.bookstore.inventory.config.TestContainersConfiguration;
import org.bookstore.inventory.repository.ScheduledJobRepository;
import org.bookstore.inventory.scheduler.ScheduledJobRunner;
import org.bookstore.inventory.service.schedule.StockAlertScheduleRegistry;

/**
 * Full-stack tests against PostgreSQL and Redis.
 *
 * <p>Verifies that the Flyway schema matches the entity mappings, that book writes are visible in
 * the next cached listing, and that a committed preference change re-arms the user's job. Skipped
 * when Docker is not available.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestContainersConfiguration.class)
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Bookstore Service Integration Tests")
class BookstoreServiceApplicationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private ScheduledJobRepository scheduledJobRepository;
  @Autowired private ScheduledJobRunner scheduledJobRunner;

  @Test
  @DisplayName("book write - next listing read reflects it despite the cache")
  void bookWrite_VisibleInNextListing() throws Exception {
    // Arrange: warm the cache
    var before = listingSize();

    var publisherId =
        createAndReadId(
            "/v1/publishers", "{\"name\": \"整合測試出版社\", \"city\": \"台北\"}");

    // Act
    createAndReadId(
        "/v1/books",
        "{\"title\": \"整合測試\", \"price\": 100, \"stock\": 2, \"publisher_id\": "
            + publisherId
            + "}");

    // Assert
    assertThat(listingSize()).isEqualTo(before + 1);
  }

  @Test
  @DisplayName("preference - default then weekly - registry entry follows and stays armed")
  void preference_ChangesFollowedByRegistryAndRunner() throws Exception {
    // Arrange
    var userId =
        createAndReadId(
            "/v1/users", "{\"username\": \"integration-reader\", \"email\": \"ir@example.com\"}");
    var jobName = StockAlertScheduleRegistry.jobName(userId);

    // Act: first access creates the daily default
    mockMvc
        .perform(get("/v1/users/{userId}/preference", userId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.stock_alert_frequency").value("daily"));

    // Assert
    assertThat(scheduledJobRepository.findByName(jobName)).isPresent();
    assertThat(scheduledJobRunner.armedJobNames()).contains(jobName);

    // Act: switch off
    mockMvc
        .perform(
            put("/v1/users/{userId}/preference", userId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"stock_alert_frequency\": \"disabled\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message").value("設定已更新"));

    // Assert
    assertThat(scheduledJobRepository.findByName(jobName)).isEmpty();
    assertThat(scheduledJobRunner.armedJobNames()).doesNotContain(jobName);
  }

  private int listingSize() throws Exception {
    var body =
        mockMvc
            .perform(get("/v1/books"))
            .andExpect(status().isOk())
            .andReturn()
            .getResponse()
            .getContentAsString();
    return JsonPath.<Integer>read(body, "$.data.books.length()");
  }

  private long createAndReadId(String path, String json) throws Exception {
    var body =
        mockMvc
            .perform(post(path).contentType(MediaType.APPLICATION_JSON).content(json))
            .andExpect(status().isCreated())
            .andReturn()
            .getResponse()
            .getContentAsString();
    return JsonPath.<Number>read(body, "$.id").longValue();
  }
}
