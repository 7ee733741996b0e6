package org.bookstore.inventory.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import org.bookstore.inventory.domain.NotificationPreference;
import org.bookstore.inventory.domain.UserAccount;
import org.bookstore.inventory.repository.NotificationPreferenceRepository;
import org.bookstore.inventory.repository.UserAccountRepository;
import org.bookstore.inventory.service.dto.PreferenceChanges;
import org.bookstore.inventory.service.exception.ResourceNotFoundException;
import org.bookstore.inventory.service.schedule.ScheduleTranslator;
import org.bookstore.inventory.service.schedule.StockAlertScheduleRegistry;

/**
 * Owns each user's notification preference and keeps the stock-alert schedule in step with it.
 *
 * <p><b>Atomicity:</b> every operation runs in one transaction together with the schedule
 * reconciliation it triggers. If reconciliation fails, the preference write rolls back with it.
 *
 * <p><b>Per-user serialization:</b> operations start by taking a pessimistic lock on the user row.
 * Two concurrent updates for the same user therefore run one after the other, and the second one
 * sees the frequency the first one stored, so the registry always ends up matching the stored
 * value. Different users do not contend.
 */
@Service
public class NotificationPreferenceService {

  private static final Logger log = LoggerFactory.getLogger(NotificationPreferenceService.class);

  private final NotificationPreferenceRepository preferenceRepository;
  private final UserAccountRepository userAccountRepository;
  private final ScheduleTranslator scheduleTranslator;
  private final StockAlertScheduleRegistry scheduleRegistry;

  public NotificationPreferenceService(
      NotificationPreferenceRepository preferenceRepository,
      UserAccountRepository userAccountRepository,
      ScheduleTranslator scheduleTranslator,
      StockAlertScheduleRegistry scheduleRegistry) {
    this.preferenceRepository = preferenceRepository;
    this.userAccountRepository = userAccountRepository;
    this.scheduleTranslator = scheduleTranslator;
    this.scheduleRegistry = scheduleRegistry;
  }

  /**
   * Return the user's preference, creating it with defaults on first access.
   *
   * <p>A newly created preference ({@code daily}, both channels on) has its schedule registered
   * immediately.
   *
   * @param userId user id
   * @return the preference
   * @throws ResourceNotFoundException if the user does not exist
   */
  @Transactional
  public NotificationPreference getOrCreate(Long userId) {
    var user = lockUser(userId);
    return preferenceRepository.findByUserId(userId).orElseGet(() -> create(user));
  }

  /**
   * Apply the supplied fields and reschedule if the frequency changed.
   *
   * @param userId user id
   * @param changes fields to change; null components are left alone
   * @return the updated preference
   * @throws ResourceNotFoundException if the user does not exist
   */
  @Transactional
  public NotificationPreference update(Long userId, PreferenceChanges changes) {
    var user = lockUser(userId);
    var preference = preferenceRepository.findByUserId(userId).orElseGet(() -> create(user));

    var previousFrequency = preference.getFrequency();
    if (changes.frequency() != null) {
      preference.setFrequency(changes.frequency());
    }
    if (changes.emailEnabled() != null) {
      preference.setEmailEnabled(changes.emailEnabled());
    }
    if (changes.browserEnabled() != null) {
      preference.setBrowserEnabled(changes.browserEnabled());
    }
    var saved = preferenceRepository.save(preference);

    if (saved.getFrequency() != previousFrequency) {
      log.info(
          "Stock alert frequency changed userId={} from={} to={}",
          userId,
          previousFrequency.getValue(),
          saved.getFrequency().getValue());
      scheduleRegistry.reconcile(userId, scheduleTranslator.translate(saved.getFrequency()));
    }
    return saved;
  }

  /**
   * Remove the user's stock-alert schedule regardless of the stored preference.
   *
   * @param userId user id
   */
  @Transactional
  public void delete(Long userId) {
    scheduleRegistry.remove(userId);
  }

  private NotificationPreference create(UserAccount user) {
    var preference = preferenceRepository.save(new NotificationPreference(user));
    log.info(
        "Created notification preference userId={} frequency={}",
        user.getId(),
        preference.getFrequency().getValue());
    scheduleRegistry.reconcile(user.getId(), scheduleTranslator.translate(preference.getFrequency()));
    return preference;
  }

  private UserAccount lockUser(Long userId) {
    return userAccountRepository
        .findByIdForUpdate(userId)
        .orElseThrow(() -> new ResourceNotFoundException("User not found with id: " + userId));
  }
}
