package org.bookstore.inventory.service;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import org.bookstore.inventory.domain.Publisher;
import org.bookstore.inventory.repository.BookRepository;
import org.bookstore.inventory.repository.PublisherRepository;
import org.bookstore.inventory.service.dto.PublisherWithBookCount;
import org.bookstore.inventory.service.exception.BusinessException;
import org.bookstore.inventory.service.exception.ResourceNotFoundException;

/** Service for managing publishers. Publisher names are unique. */
@Service
public class PublisherService {

  private static final Logger log = LoggerFactory.getLogger(PublisherService.class);

  private final PublisherRepository publisherRepository;
  private final BookRepository bookRepository;

  public PublisherService(PublisherRepository publisherRepository, BookRepository bookRepository) {
    this.publisherRepository = publisherRepository;
    this.bookRepository = bookRepository;
  }

  @Transactional(readOnly = true)
  public List<PublisherWithBookCount> getAllWithBookCount() {
    return publisherRepository.findAllWithBookCount().stream()
        .map(row -> new PublisherWithBookCount((Publisher) row[0], ((Number) row[1]).longValue()))
        .toList();
  }

  /**
   * Get a publisher by ID.
   *
   * @param id The publisher ID
   * @return The publisher
   * @throws ResourceNotFoundException if the publisher does not exist
   */
  @Transactional(readOnly = true)
  public Publisher getById(Long id) {
    return publisherRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Publisher not found with id: " + id));
  }

  /**
   * Create a publisher.
   *
   * @param name unique publisher name
   * @param city city the publisher is based in
   * @return the saved publisher
   * @throws BusinessException if the name is already taken
   */
  @Transactional
  public Publisher create(String name, String city) {
    var trimmedName = name.strip();
    if (publisherRepository.existsByName(trimmedName)) {
      throw duplicateName(trimmedName);
    }

    var publisher = new Publisher();
    publisher.setName(trimmedName);
    publisher.setCity(city.strip());
    var saved = publisherRepository.save(publisher);
    log.info("Created publisher id={} name={}", saved.getId(), saved.getName());
    return saved;
  }

  @Transactional
  public Publisher update(Long id, String name, String city) {
    var publisher = getById(id);
    var trimmedName = name.strip();
    if (publisherRepository.existsByNameAndIdNot(trimmedName, id)) {
      throw duplicateName(trimmedName);
    }

    publisher.setName(trimmedName);
    publisher.setCity(city.strip());
    log.info("Updated publisher id={} name={}", id, trimmedName);
    return publisherRepository.save(publisher);
  }

  /**
   * Delete a publisher that no book references.
   *
   * @param id The publisher ID
   * @throws ResourceNotFoundException if the publisher does not exist
   * @throws BusinessException if books still reference the publisher
   */
  @Transactional
  public void delete(Long id) {
    var publisher = getById(id);
    var bookCount = bookRepository.countByPublisher(publisher);
    if (bookCount > 0) {
      throw new BusinessException(
          "無法刪除！此出版社還有 " + bookCount + " 本書籍關聯，請先刪除或轉移這些書籍。",
          BookstoreServiceError.PUBLISHER_HAS_BOOKS.name());
    }

    publisherRepository.delete(publisher);
    log.info("Deleted publisher id={} name={}", id, publisher.getName());
  }

  private BusinessException duplicateName(String name) {
    return new BusinessException(
        "此出版社名稱已存在：" + name, BookstoreServiceError.DUPLICATE_PUBLISHER_NAME.name());
  }
}
