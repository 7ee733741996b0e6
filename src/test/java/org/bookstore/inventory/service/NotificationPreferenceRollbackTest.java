package org.bookstore.inventory.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import org.bookstore.inventory.base.AbstractRepositoryTest;
import org.bookstore.inventory.config.PersistenceTestConfig;
import org.bookstore.inventory.domain.NotificationFrequency;
import org.bookstore.inventory.domain.UserAccount;
import org.bookstore.inventory.fixture.TestConstants;
import org.bookstore.inventory.fixture.TestEntities;
import org.bookstore.inventory.repository.NotificationPreferenceRepository;
import org.bookstore.inventory.repository.UserAccountRepository;
import org.bookstore.inventory.service.dto.PreferenceChanges;
import org.bookstore.inventory.service.schedule.ScheduleTranslator;
import org.bookstore.inventory.service.schedule.StockAlertScheduleRegistry;

/**
 * A failing reconciliation must leave the stored preference as it was.
 *
 * <p>Runs without the test-managed transaction so the service's own transaction decides what is
 * committed.
 */
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({PersistenceTestConfig.class, NotificationPreferenceService.class, ScheduleTranslator.class})
@DisplayName("NotificationPreferenceService Rollback Tests")
class NotificationPreferenceRollbackTest extends AbstractRepositoryTest {

  @Autowired private NotificationPreferenceService service;
  @Autowired private UserAccountRepository userAccountRepository;
  @Autowired private NotificationPreferenceRepository preferenceRepository;

  @MockitoBean private StockAlertScheduleRegistry scheduleRegistry;

  private UserAccount user;

  @BeforeEach
  void setUp() {
    user = userAccountRepository.save(TestEntities.user(TestConstants.USERNAME));
    service.getOrCreate(user.getId());
  }

  @AfterEach
  void tearDown() {
    preferenceRepository.deleteAll();
    userAccountRepository.deleteAll();
  }

  @Test
  @DisplayName("update - reconciliation fails - frequency and flags stay as stored")
  void update_ReconcileFails_PreferenceUnchanged() {
    // Arrange
    doThrow(new IllegalStateException("registry unavailable"))
        .when(scheduleRegistry)
        .reconcile(eq(user.getId()), any());

    // Act
    assertThatThrownBy(
            () ->
                service.update(
                    user.getId(),
                    new PreferenceChanges(NotificationFrequency.HOURLY, false, null)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("registry unavailable");

    // Assert
    var stored = preferenceRepository.findByUserId(user.getId()).orElseThrow();
    assertThat(stored.getFrequency()).isEqualTo(NotificationFrequency.DAILY);
    assertThat(stored.isEmailEnabled()).isTrue();
  }

  @Test
  @DisplayName("getOrCreate - reconciliation fails - no preference is created")
  void getOrCreate_ReconcileFails_NothingCreated() {
    // Arrange
    var other = userAccountRepository.save(TestEntities.user("second-reader"));
    doThrow(new IllegalStateException("registry unavailable"))
        .when(scheduleRegistry)
        .reconcile(eq(other.getId()), any());

    // Act
    assertThatThrownBy(() -> service.getOrCreate(other.getId()))
        .isInstanceOf(IllegalStateException.class);

    // Assert
    assertThat(preferenceRepository.findByUserId(other.getId())).isEmpty();
  }
}
