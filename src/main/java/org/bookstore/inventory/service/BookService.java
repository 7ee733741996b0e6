package org.bookstore.inventory.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import org.bookstore.inventory.domain.Book;
import org.bookstore.inventory.notification.NotificationAction;
import org.bookstore.inventory.notification.NotificationEvent;
import org.bookstore.inventory.notification.NotificationPublisher;
import org.bookstore.inventory.repository.BookRepository;
import org.bookstore.inventory.repository.PublisherRepository;
import org.bookstore.inventory.repository.ReadingListEntryRepository;
import org.bookstore.inventory.service.dto.BookDetails;
import org.bookstore.inventory.service.exception.ResourceNotFoundException;

/**
 * Service for book writes and lookups.
 *
 * <p><b>Write contract:</b> {@link #create}, {@link #update} and {@link #delete} each finish by
 * invalidating the cached listing and then broadcasting a change notification. Both effects are
 * applied once the transaction commits and before the method returns. A notification that fails
 * to go out is logged by the publisher and does not fail the write.
 *
 * <ul>
 *   <li>create: {@code 新書上架：<title>}
 *   <li>update: {@code 書籍已更新：<title>}
 *   <li>delete: {@code 書籍已下架：<title>}
 * </ul>
 */
@Service
public class BookService {

  private static final Logger log = LoggerFactory.getLogger(BookService.class);

  private final BookRepository bookRepository;
  private final PublisherRepository publisherRepository;
  private final ReadingListEntryRepository readingListEntryRepository;
  private final BookListingService bookListingService;
  private final NotificationPublisher notificationPublisher;

  public BookService(
      BookRepository bookRepository,
      PublisherRepository publisherRepository,
      ReadingListEntryRepository readingListEntryRepository,
      BookListingService bookListingService,
      NotificationPublisher notificationPublisher) {
    this.bookRepository = bookRepository;
    this.publisherRepository = publisherRepository;
    this.readingListEntryRepository = readingListEntryRepository;
    this.bookListingService = bookListingService;
    this.notificationPublisher = notificationPublisher;
  }

  /**
   * Get a book by ID.
   *
   * @param id The book ID
   * @return The book
   * @throws ResourceNotFoundException if the book does not exist
   */
  @Transactional(readOnly = true)
  public Book getById(Long id) {
    return bookRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Book not found with id: " + id));
  }

  @Transactional
  public Book create(BookDetails details) {
    var book = new Book();
    apply(book, details);
    var saved = bookRepository.save(book);

    log.info("Created book id={} title={}", saved.getId(), saved.getTitle());
    invalidateAndNotify(NotificationAction.CREATE, "新書上架：" + saved.getTitle());
    return saved;
  }

  @Transactional
  public Book update(Long id, BookDetails details) {
    var book = getById(id);
    apply(book, details);
    var saved = bookRepository.save(book);

    log.info("Updated book id={} title={} stock={}", id, saved.getTitle(), saved.getStock());
    invalidateAndNotify(NotificationAction.UPDATE, "書籍已更新：" + saved.getTitle());
    return saved;
  }

  /**
   * Delete a book along with every reading-list entry that references it.
   *
   * @param id The book ID
   * @throws ResourceNotFoundException if the book does not exist
   */
  @Transactional
  public void delete(Long id) {
    var book = getById(id);
    var title = book.getTitle();

    readingListEntryRepository.deleteByBookId(id);
    bookRepository.delete(book);

    log.info("Deleted book id={} title={}", id, title);
    invalidateAndNotify(NotificationAction.DELETE, "書籍已下架：" + title);
  }

  private void apply(Book book, BookDetails details) {
    var publisher =
        publisherRepository
            .findById(details.publisherId())
            .orElseThrow(
                () ->
                    new ResourceNotFoundException(
                        "Publisher not found with id: " + details.publisherId()));
    book.setTitle(details.title().strip());
    book.setPrice(details.price());
    book.setStock(details.stock());
    book.setPublisher(publisher);
  }

  private void invalidateAndNotify(NotificationAction action, String message) {
    bookListingService.invalidate();
    AfterCommit.run(() -> notificationPublisher.publish(NotificationEvent.broadcast(action, message)));
  }
}
