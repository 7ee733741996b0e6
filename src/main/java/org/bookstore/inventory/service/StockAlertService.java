package org.bookstore.inventory.service;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import org.bookstore.inventory.config.BookstoreServiceProperties;
import org.bookstore.inventory.domain.Book;
import org.bookstore.inventory.notification.NotificationAction;
import org.bookstore.inventory.notification.NotificationEvent;
import org.bookstore.inventory.notification.NotificationPublisher;
import org.bookstore.inventory.repository.BookRepository;
import org.bookstore.inventory.repository.UserAccountRepository;
import org.bookstore.inventory.service.dto.StockAlertResult;

/**
 * Low-stock evaluation run by the global sweep and by each user's scheduled job.
 *
 * <p>Books with stock strictly below {@code bookstore.stock-alert.threshold} are reported. The
 * message names at most {@code bookstore.stock-alert.max-titles} books in id order and adds the
 * total count when more books are affected. Nothing is published when every book is stocked.
 *
 * <p>A per-user evaluation for a user that no longer exists returns a {@code user_not_found}
 * result rather than throwing.
 */
@Service
public class StockAlertService {

  private static final Logger log = LoggerFactory.getLogger(StockAlertService.class);

  private final BookRepository bookRepository;
  private final UserAccountRepository userAccountRepository;
  private final NotificationPublisher notificationPublisher;
  private final BookstoreServiceProperties properties;

  public StockAlertService(
      BookRepository bookRepository,
      UserAccountRepository userAccountRepository,
      NotificationPublisher notificationPublisher,
      BookstoreServiceProperties properties) {
    this.bookRepository = bookRepository;
    this.userAccountRepository = userAccountRepository;
    this.notificationPublisher = notificationPublisher;
    this.properties = properties;
  }

  /**
   * Evaluate stock and broadcast an alert to everyone.
   *
   * @return the evaluation result
   */
  @Transactional(readOnly = true)
  public StockAlertResult evaluate() {
    return evaluate(null);
  }

  /**
   * Evaluate stock and publish an alert tagged for one user.
   *
   * @param userId recipient hint, or null for the global variant
   * @return the evaluation result, {@code user_not_found} when the user does not exist
   */
  @Transactional(readOnly = true)
  public StockAlertResult evaluate(Long userId) {
    if (userId != null && !userAccountRepository.existsById(userId)) {
      log.warn("Stock alert skipped, user not found userId={}", userId);
      return StockAlertResult.userNotFound(userId);
    }

    var config = properties.getStockAlert();
    var count = bookRepository.countByStockLessThan(config.getThreshold());
    if (count == 0) {
      log.info("Stock check found no low-stock books userId={}", userId);
      return StockAlertResult.success(userId, 0, null);
    }

    var titles =
        bookRepository
            .findByStockLessThanOrderByIdAsc(
                config.getThreshold(), PageRequest.of(0, config.getMaxTitles()))
            .stream()
            .map(Book::getTitle)
            .toList();
    var message = formatMessage(titles, count, config.getMaxTitles());

    var event =
        userId == null
            ? NotificationEvent.broadcast(NotificationAction.LOW_STOCK_WARNING, message)
            : NotificationEvent.forUser(NotificationAction.LOW_STOCK_WARNING, message, userId);
    notificationPublisher.publish(event);

    log.info("Stock check found {} low-stock books userId={}", count, userId);
    return StockAlertResult.success(userId, count, message);
  }

  static String formatMessage(List<String> titles, long totalCount, int maxTitles) {
    var joined = String.join(", ", titles);
    if (totalCount > maxTitles) {
      return "庫存警告：" + joined + " 等 " + totalCount + " 本書籍庫存不足！";
    }
    return "庫存警告：" + joined + " 庫存不足！";
  }
}
