package org.bookstore.inventory.service;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import org.bookstore.inventory.domain.Book;
import org.bookstore.inventory.domain.ReadingListEntry;
import org.bookstore.inventory.repository.BookRepository;
import org.bookstore.inventory.repository.ReadingListEntryRepository;
import org.bookstore.inventory.repository.UserAccountRepository;
import org.bookstore.inventory.service.exception.BusinessException;
import org.bookstore.inventory.service.exception.ResourceNotFoundException;

/** Service for users' reading lists. A book appears at most once on a user's list. */
@Service
public class ReadingListService {

  private static final Logger log = LoggerFactory.getLogger(ReadingListService.class);

  private final ReadingListEntryRepository readingListEntryRepository;
  private final UserAccountRepository userAccountRepository;
  private final BookRepository bookRepository;

  public ReadingListService(
      ReadingListEntryRepository readingListEntryRepository,
      UserAccountRepository userAccountRepository,
      BookRepository bookRepository) {
    this.readingListEntryRepository = readingListEntryRepository;
    this.userAccountRepository = userAccountRepository;
    this.bookRepository = bookRepository;
  }

  /**
   * The user's reading list, most recently added first.
   *
   * @param userId user id
   * @return entries with their books loaded
   * @throws ResourceNotFoundException if the user does not exist
   */
  @Transactional(readOnly = true)
  public List<ReadingListEntry> getEntries(Long userId) {
    requireUser(userId);
    return readingListEntryRepository.findByUserIdNewestFirst(userId);
  }

  /**
   * Ids of the books on the user's list. Unknown users simply have none.
   *
   * @param userId user id
   * @return book ids
   */
  @Transactional(readOnly = true)
  public List<Long> getBookIds(Long userId) {
    return readingListEntryRepository.findBookIdsByUserId(userId);
  }

  /**
   * Add a book to the user's list.
   *
   * @param userId user id
   * @param bookId book id
   * @return the added book
   * @throws BusinessException if the book is already on the list
   */
  @Transactional
  public Book add(Long userId, Long bookId) {
    var user =
        userAccountRepository
            .findById(userId)
            .orElseThrow(() -> new ResourceNotFoundException("User not found with id: " + userId));
    var book = getBook(bookId);

    if (readingListEntryRepository.existsByUserIdAndBookId(userId, bookId)) {
      throw new BusinessException(
          "《" + book.getTitle() + "》已經在你的最愛清單中了！",
          BookstoreServiceError.BOOK_ALREADY_IN_READING_LIST.name());
    }

    readingListEntryRepository.save(new ReadingListEntry(user, book));
    log.info("Added book to reading list userId={} bookId={}", userId, bookId);
    return book;
  }

  /**
   * Remove a book from the user's list.
   *
   * @param userId user id
   * @param bookId book id
   * @return the removed book
   * @throws BusinessException if the book is not on the list
   */
  @Transactional
  public Book remove(Long userId, Long bookId) {
    requireUser(userId);
    var book = getBook(bookId);

    var entry =
        readingListEntryRepository
            .findByUserIdAndBookId(userId, bookId)
            .orElseThrow(
                () ->
                    new BusinessException(
                        "《" + book.getTitle() + "》不在你的最愛清單中！",
                        BookstoreServiceError.BOOK_NOT_IN_READING_LIST.name()));

    readingListEntryRepository.delete(entry);
    log.info("Removed book from reading list userId={} bookId={}", userId, bookId);
    return book;
  }

  private Book getBook(Long bookId) {
    return bookRepository
        .findById(bookId)
        .orElseThrow(() -> new ResourceNotFoundException("Book not found with id: " + bookId));
  }

  private void requireUser(Long userId) {
    if (!userAccountRepository.existsById(userId)) {
      throw new ResourceNotFoundException("User not found with id: " + userId);
    }
  }
}
