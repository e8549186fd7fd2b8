package com.example.cronishe.domain.repository;

import com.example.cronishe.domain.entity.JobRun;
import com.example.cronishe.domain.enums.RunOutcome;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for JobRun entity.
 * <p>
 * Every closing update is guarded by {@code finishAt IS NULL} so a run is closed
 * exactly once, whichever of worker, stop or recovery gets there first.
 */
@Repository
public interface JobRunRepository extends JpaRepository<JobRun, Long> {

    /**
     * Check if the job has an open run
     */
    boolean existsByJobIdAndFinishAtIsNull(Long jobId);

    Optional<JobRun> findByIdAndFinishAtIsNull(Long id);

    List<JobRun> findByFinishAtIsNullOrderByIdAsc();

    long countByFinishAtIsNull();

    /**
     * Find the most recent runs of a job
     */
    List<JobRun> findTop50ByJobIdOrderByStartAtDesc(Long jobId);

    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE JobRun r
            SET r.processId = :processId
            WHERE r.id = :runId
              AND r.finishAt IS NULL
            """)
    int updateProcessId(@Param("runId") Long runId, @Param("processId") Long processId);

    /**
     * Close an open run
     *
     * @return number of rows updated (0 if the run was already closed)
     */
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE JobRun r
            SET r.finishAt = :finishAt,
                r.outcome = :outcome,
                r.durationSeconds = :durationSeconds,
                r.processId = NULL
            WHERE r.id = :runId
              AND r.finishAt IS NULL
            """)
    int closeRun(
            @Param("runId") Long runId,
            @Param("outcome") RunOutcome outcome,
            @Param("durationSeconds") Long durationSeconds,
            @Param("finishAt") Instant finishAt);
}
