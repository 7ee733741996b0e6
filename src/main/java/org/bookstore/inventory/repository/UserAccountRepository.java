package org.bookstore.inventory.repository;

import java.util.Optional;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import org.bookstore.inventory.domain.UserAccount;

/** Repository for managing UserAccount entities. */
public interface UserAccountRepository extends JpaRepository<UserAccount, Long> {

  boolean existsByUsername(String username);

  /**
   * Loads a user and holds a row lock until the current transaction ends.
   *
   * <p>Preference writes for one user serialize on this lock.
   *
   * @param id user id
   * @return the locked user if present
   */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT u FROM UserAccount u WHERE u.id = :id")
  Optional<UserAccount> findByIdForUpdate(@Param("id") Long id);
}
