package org.bookstore.inventory.repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import org.bookstore.inventory.domain.schedule.ScheduledJob;

/** Repository for recurring-job registry entries. */
public interface ScheduledJobRepository extends JpaRepository<ScheduledJob, Long> {

  Optional<ScheduledJob> findByName(String name);

  List<ScheduledJob> findByEnabledTrue();

  long deleteByName(String name);

  /**
   * Bump the run bookkeeping of an entry. Missing entries are ignored.
   *
   * @param name registry entry name
   * @param runAt time of the firing
   * @return number of updated rows
   */
  @Transactional
  @Modifying
  @Query(
      "UPDATE ScheduledJob j SET j.lastRunAt = :runAt, j.totalRunCount = j.totalRunCount + 1"
          + " WHERE j.name = :name")
  int recordRun(@Param("name") String name, @Param("runAt") Instant runAt);
}
