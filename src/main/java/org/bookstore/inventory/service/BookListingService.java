package org.bookstore.inventory.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import org.bookstore.inventory.config.CacheConfig;
import org.bookstore.inventory.repository.BookRepository;
import org.bookstore.inventory.service.dto.BookListing;
import org.bookstore.inventory.service.dto.BookListingEntry;

/**
 * Read path for the cached book listing.
 *
 * <p>{@link #getListing()} serves the single {@value CacheConfig#BOOK_LISTING_CACHE} entry while
 * it is present and unexpired, otherwise rebuilds it from the database. {@link #invalidate()} is
 * called by every book write before that write returns to its caller, so a read that starts after
 * a completed write never sees a listing built before it.
 */
@Service
public class BookListingService {

  private static final Logger log = LoggerFactory.getLogger(BookListingService.class);

  static final String LISTING_KEY = "'all'";

  private final BookRepository bookRepository;

  public BookListingService(BookRepository bookRepository) {
    this.bookRepository = bookRepository;
  }

  /**
   * Every book with its publisher summary, ordered by id.
   *
   * @return the listing
   */
  @Cacheable(cacheNames = CacheConfig.BOOK_LISTING_CACHE, key = LISTING_KEY)
  @Transactional(readOnly = true)
  public BookListing getListing() {
    var books = bookRepository.findAllWithPublisher().stream().map(BookListingEntry::from).toList();
    log.debug("Rebuilt book listing with {} books", books.size());
    return new BookListing(books);
  }

  /** Drop the cached listing. Inside a transaction the eviction is applied on commit. */
  @CacheEvict(cacheNames = CacheConfig.BOOK_LISTING_CACHE, key = LISTING_KEY)
  public void invalidate() {
    log.debug("Invalidated book listing cache");
  }
}
