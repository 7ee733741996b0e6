package org.bookstore.inventory.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import org.bookstore.inventory.domain.UserAccount;
import org.bookstore.inventory.repository.NotificationPreferenceRepository;
import org.bookstore.inventory.repository.ReadingListEntryRepository;
import org.bookstore.inventory.repository.UserAccountRepository;
import org.bookstore.inventory.service.exception.BusinessException;
import org.bookstore.inventory.service.exception.ResourceNotFoundException;

/** Service for managing user accounts. */
@Service
public class UserService {

  private static final Logger log = LoggerFactory.getLogger(UserService.class);

  private final UserAccountRepository userAccountRepository;
  private final ReadingListEntryRepository readingListEntryRepository;
  private final NotificationPreferenceRepository preferenceRepository;
  private final NotificationPreferenceService preferenceService;

  public UserService(
      UserAccountRepository userAccountRepository,
      ReadingListEntryRepository readingListEntryRepository,
      NotificationPreferenceRepository preferenceRepository,
      NotificationPreferenceService preferenceService) {
    this.userAccountRepository = userAccountRepository;
    this.readingListEntryRepository = readingListEntryRepository;
    this.preferenceRepository = preferenceRepository;
    this.preferenceService = preferenceService;
  }

  @Transactional
  public UserAccount create(String username, String email) {
    var trimmed = username.strip();
    if (userAccountRepository.existsByUsername(trimmed)) {
      throw new BusinessException(
          "Username '" + trimmed + "' already exists",
          BookstoreServiceError.DUPLICATE_USERNAME.name());
    }

    var user = new UserAccount();
    user.setUsername(trimmed);
    user.setEmail(email);
    var saved = userAccountRepository.save(user);
    log.info("Created user id={} username={}", saved.getId(), saved.getUsername());
    return saved;
  }

  @Transactional(readOnly = true)
  public UserAccount getById(Long id) {
    return userAccountRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("User not found with id: " + id));
  }

  /**
   * Delete a user together with their reading list, preference and stock-alert schedule.
   *
   * @param id The user ID
   * @throws ResourceNotFoundException if the user does not exist
   */
  @Transactional
  public void delete(Long id) {
    var user = getById(id);

    preferenceService.delete(id);
    readingListEntryRepository.deleteByUserId(id);
    preferenceRepository.deleteByUserId(id);
    userAccountRepository.delete(user);

    log.info("Deleted user id={} username={}", id, user.getUsername());
  }
}
