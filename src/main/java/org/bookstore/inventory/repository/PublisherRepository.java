package org.bookstore.inventory.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import org.bookstore.inventory.domain.Publisher;

/** Repository for managing Publisher entities. */
public interface PublisherRepository extends JpaRepository<Publisher, Long> {

  boolean existsByName(String name);

  boolean existsByNameAndIdNot(String name, Long id);

  /**
   * Every publisher paired with the number of books referencing it, ordered by name.
   *
   * @return rows of {@code [Publisher, Long]}
   */
  @Query(
      "SELECT p, COUNT(b) FROM Publisher p LEFT JOIN Book b ON b.publisher = p"
          + " GROUP BY p ORDER BY p.name")
  List<Object[]> findAllWithBookCount();
}
