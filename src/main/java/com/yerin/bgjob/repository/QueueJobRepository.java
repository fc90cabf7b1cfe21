package com.yerin.bgjob.repository;

import com.yerin.bgjob.domain.QueueJob;
import com.yerin.bgjob.domain.QueueJobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface QueueJobRepository extends JpaRepository<QueueJob, String> {

    long countByStatus(QueueJobStatus status);

    List<QueueJob> findByStatusAndLeaseUntilLessThanEqualOrderByLeaseUntilAsc(
            QueueJobStatus status, Instant leaseUntil, Pageable pageable);

    @Query("""
       select j from QueueJob j
        where j.status = com.yerin.bgjob.domain.QueueJobStatus.PENDING
          and (j.scheduledAt is null or j.scheduledAt <= :now)
          and (j.leaseUntil is null or j.leaseUntil <= :now)
        order by j.priority desc, j.createdAt asc
       """)
    List<QueueJob> findClaimCandidates(@Param("now") Instant now, Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update QueueJob j
          set j.claimedBy = :workerId,
              j.leaseUntil = :leaseUntil
        where j.id = :id
          and j.status = com.yerin.bgjob.domain.QueueJobStatus.PENDING
          and (j.scheduledAt is null or j.scheduledAt <= :now)
          and (j.leaseUntil is null or j.leaseUntil <= :now)
       """)
    int claimIfPending(@Param("id") String id,
                       @Param("workerId") String workerId,
                       @Param("now") Instant now,
                       @Param("leaseUntil") Instant leaseUntil);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update QueueJob j
          set j.leaseUntil = :leaseUntil
        where j.id = :id
          and j.claimedBy = :workerId
          and j.status in (com.yerin.bgjob.domain.QueueJobStatus.PENDING,
                           com.yerin.bgjob.domain.QueueJobStatus.PROCESSING)
       """)
    int extendLeaseIfClaimed(@Param("id") String id,
                             @Param("workerId") String workerId,
                             @Param("leaseUntil") Instant leaseUntil);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update QueueJob j
          set j.status = com.yerin.bgjob.domain.QueueJobStatus.PENDING,
              j.retryCount = j.retryCount + 1,
              j.scheduledAt = :notBefore,
              j.leaseUntil = null,
              j.claimedBy = null,
              j.updatedAt = :now
        where j.id = :id
          and j.status = com.yerin.bgjob.domain.QueueJobStatus.PROCESSING
          and j.retryCount = :retryCount
          and j.leaseUntil <= :now
       """)
    int requeueIfLeaseExpired(@Param("id") String id,
                              @Param("retryCount") int retryCount,
                              @Param("now") Instant now,
                              @Param("notBefore") Instant notBefore);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update QueueJob j
          set j.status = com.yerin.bgjob.domain.QueueJobStatus.FAILED,
              j.lastError = :error,
              j.completedAt = :now,
              j.leaseUntil = null,
              j.claimedBy = null,
              j.updatedAt = :now
        where j.id = :id
          and j.status = com.yerin.bgjob.domain.QueueJobStatus.PROCESSING
          and j.retryCount = :retryCount
          and j.leaseUntil <= :now
       """)
    int failIfLeaseExpired(@Param("id") String id,
                           @Param("retryCount") int retryCount,
                           @Param("now") Instant now,
                           @Param("error") String error);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update QueueJob j set j.retryCount = j.retryCount + 1 where j.id = :id")
    int incrementRetryCount(@Param("id") String id);
}
