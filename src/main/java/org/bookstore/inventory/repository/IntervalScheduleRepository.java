package org.bookstore.inventory.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;

import org.bookstore.inventory.domain.schedule.IntervalPeriod;
import org.bookstore.inventory.domain.schedule.IntervalSchedule;

/** Repository for interval triggers. */
public interface IntervalScheduleRepository extends JpaRepository<IntervalSchedule, Long> {

  Optional<IntervalSchedule> findByEveryAndPeriod(int every, IntervalPeriod period);
}
