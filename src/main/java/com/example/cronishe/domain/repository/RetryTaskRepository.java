package com.example.cronishe.domain.repository;

import com.example.cronishe.domain.entity.RetryTask;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for RetryTask entity
 */
@Repository
public interface RetryTaskRepository extends JpaRepository<RetryTask, Long> {

    /**
     * Find retry tasks whose fire time has passed, oldest first
     */
    @Query("""
            SELECT t FROM RetryTask t
            WHERE t.fireAt <= :now
            ORDER BY t.fireAt ASC, t.id ASC
            """)
    List<RetryTask> findDue(@Param("now") Instant now);

    List<RetryTask> findByJobIdOrderByAttemptNumberAsc(Long jobId);

    boolean existsByJobId(Long jobId);

    @Modifying
    @Query("DELETE FROM RetryTask t WHERE t.id = :id")
    int deleteTask(@Param("id") Long id);

    @Modifying
    @Query("DELETE FROM RetryTask t WHERE t.jobId = :jobId")
    int deleteByJobId(@Param("jobId") Long jobId);
}
