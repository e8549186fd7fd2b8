package com.example.cronishe.domain.repository;

import com.example.cronishe.domain.entity.Job;
import com.example.cronishe.domain.enums.RunOutcome;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for Job entity
 */
@Repository
public interface JobRepository extends JpaRepository<Job, Long> {

    /**
     * Find all jobs eligible for scheduling
     */
    List<Job> findByActiveTrueOrderByIdAsc();

    /**
     * Record the terminal outcome of the latest run
     */
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE Job j
            SET j.lastRunAt = :lastRunAt,
                j.lastRunOutcome = :outcome
            WHERE j.id = :jobId
            """)
    int updateLastRun(@Param("jobId") Long jobId, @Param("lastRunAt") Instant lastRunAt, @Param("outcome") RunOutcome outcome);
}
