package org.bookstore.inventory.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import org.bookstore.inventory.domain.ReadingListEntry;

/** Repository for managing ReadingListEntry entities. */
public interface ReadingListEntryRepository extends JpaRepository<ReadingListEntry, Long> {

  @Query(
      "SELECT e FROM ReadingListEntry e JOIN FETCH e.book b LEFT JOIN FETCH b.publisher"
          + " WHERE e.user.id = :userId ORDER BY e.addedDate DESC, e.id DESC")
  List<ReadingListEntry> findByUserIdNewestFirst(@Param("userId") Long userId);

  Optional<ReadingListEntry> findByUserIdAndBookId(Long userId, Long bookId);

  boolean existsByUserIdAndBookId(Long userId, Long bookId);

  @Query("SELECT e.book.id FROM ReadingListEntry e WHERE e.user.id = :userId")
  List<Long> findBookIdsByUserId(@Param("userId") Long userId);

  @Modifying
  @Query("DELETE FROM ReadingListEntry e WHERE e.user.id = :userId")
  int deleteByUserId(@Param("userId") Long userId);

  @Modifying
  @Query("DELETE FROM ReadingListEntry e WHERE e.book.id = :bookId")
  int deleteByBookId(@Param("bookId") Long bookId);
}
