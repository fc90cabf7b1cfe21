package com.yerin.bgjob.repository;

import com.yerin.bgjob.domain.JobHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface JobHistoryRepository extends JpaRepository<JobHistory, String> {

    List<JobHistory> findByJobIdOrderByStartedAtAsc(String jobId);

    @Modifying
    @Query("delete from JobHistory h where h.startedAt < :cutoff")
    int deleteStartedBefore(@Param("cutoff") Instant cutoff);
}
