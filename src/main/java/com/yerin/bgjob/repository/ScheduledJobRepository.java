package com.yerin.bgjob.repository;

import com.yerin.bgjob.domain.ScheduledJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface ScheduledJobRepository extends JpaRepository<ScheduledJob, String> {

    List<ScheduledJob> findByActiveTrueAndEnabledTrueOrderByPriorityDesc();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update ScheduledJob j
          set j.lastRunAt = :lastRunAt,
              j.nextRunAt = :nextRunAt,
              j.executionCount = j.executionCount + 1,
              j.updatedAt = :lastRunAt
        where j.id = :id
          and j.executionCount = :expectedCount
       """)
    int recordFiring(@Param("id") String id,
                     @Param("expectedCount") int expectedCount,
                     @Param("lastRunAt") Instant lastRunAt,
                     @Param("nextRunAt") Instant nextRunAt);
}
