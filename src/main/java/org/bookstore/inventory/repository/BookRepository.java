package org.bookstore.inventory.repository;

import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import org.bookstore.inventory.domain.Book;
import org.bookstore.inventory.domain.Publisher;

/** Repository for managing Book entities. */
public interface BookRepository extends JpaRepository<Book, Long> {

  /**
   * Loads every book with its publisher in one query, ordered by id.
   *
   * @return all books
   */
  @Query("SELECT b FROM Book b LEFT JOIN FETCH b.publisher ORDER BY b.id")
  List<Book> findAllWithPublisher();

  /**
   * Count books whose stock is strictly below the given threshold.
   *
   * @param threshold exclusive upper bound on stock
   * @return number of low-stock books
   */
  long countByStockLessThan(int threshold);

  /**
   * Page through low-stock books in id order.
   *
   * @param threshold exclusive upper bound on stock
   * @param pageable page to return
   * @return low-stock books ordered by id ascending
   */
  List<Book> findByStockLessThanOrderByIdAsc(int threshold, Pageable pageable);

  long countByPublisher(Publisher publisher);
}
