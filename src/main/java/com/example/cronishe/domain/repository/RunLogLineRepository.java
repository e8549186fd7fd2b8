package com.example.cronishe.domain.repository;

import com.example.cronishe.domain.entity.RunLogLine;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for RunLogLine entity
 */
@Repository
public interface RunLogLineRepository extends JpaRepository<RunLogLine, Long> {

    /**
     * Find all lines of a run in arrival order
     */
    List<RunLogLine> findByRunIdOrderByIdAsc(Long runId);
}
