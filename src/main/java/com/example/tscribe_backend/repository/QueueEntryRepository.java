package com.example.tscribe_backend.repository;

import com.example.tscribe_backend.model.QueueEntry;
import jakarta.transaction.Transactional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface QueueEntryRepository extends JpaRepository<QueueEntry, UUID> {

    // row lock is held until the surrounding transaction commits the claim
    @Query(value = """
        SELECT job_id FROM job_queue
        WHERE claimed_at IS NULL
        ORDER BY enqueued_at
        LIMIT 1
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    Optional<UUID> selectOnePendingIdForUpdate();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update QueueEntry q
           set q.claimedAt = :now,
               q.claimedBy = :owner,
               q.deadlineAt = :deadline
         where q.jobId = :id
           and q.claimedAt is null
        """)
    int claim(@Param("id") UUID jobId,
              @Param("owner") String owner,
              @Param("now") Instant now,
              @Param("deadline") Instant deadline);

    @Modifying
    @Transactional
    @Query("delete from QueueEntry q where q.jobId = :id")
    int deleteByJobId(@Param("id") UUID jobId);

    long countByClaimedAtIsNull();
}
