package org.bookstore.inventory.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import org.bookstore.inventory.domain.NotificationPreference;

/** Repository for managing NotificationPreference entities. */
public interface NotificationPreferenceRepository
    extends JpaRepository<NotificationPreference, Long> {

  Optional<NotificationPreference> findByUserId(Long userId);

  @Modifying
  @Query("DELETE FROM NotificationPreference p WHERE p.user.id = :userId")
  int deleteByUserId(@Param("userId") Long userId);
}
