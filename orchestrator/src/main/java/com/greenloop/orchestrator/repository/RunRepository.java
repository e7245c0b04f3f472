package com.greenloop.orchestrator.repository;

import com.greenloop.orchestrator.model.Run;
import com.greenloop.orchestrator.model.RunState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + scheduler queries for the runs table.
 */
public interface RunRepository extends JpaRepository<Run, UUID> {

    /**
     * Lock and return the oldest PENDING run.
     *
     * Must run inside a transaction that flips the run to RUNNING before it
     * commits, otherwise the lock is released with the run still PENDING.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            SELECT r FROM Run r
            WHERE r.state = 'PENDING'
            ORDER BY r.createdAt ASC
            LIMIT 1
            """)
    Optional<Run> claimNextPendingRun();

    List<Run> findByState(RunState state);

    /** Used to refuse a second run on a workspace that already has one queued or active. */
    boolean existsByWorkspaceRefAndStateIn(String workspaceRef, List<RunState> states);

    // ------------------------------------------------------------------
    // Targeted updates
    //
    // The worker thread and the API write the same row concurrently, so
    // these touch only their own columns instead of saving the whole entity.
    // ------------------------------------------------------------------

    @Modifying
    @Query("UPDATE Run r SET r.passCount = :passCount, r.updatedAt = :now WHERE r.id = :id")
    int updatePassCount(@Param("id") UUID id, @Param("passCount") int passCount, @Param("now") Instant now);

    /**
     * Abort a run that is still queued. Matches nothing once the scheduler
     * has claimed it; the claim's row lock makes this wait for that commit.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Run r
            SET r.state = com.greenloop.orchestrator.model.RunState.ABORTED,
                r.cancelRequested = true,
                r.terminationCode = :code,
                r.diagnostic = :diagnostic,
                r.finishedAt = :now,
                r.updatedAt = :now
            WHERE r.id = :id AND r.state = com.greenloop.orchestrator.model.RunState.PENDING
            """)
    int abortIfPending(@Param("id") UUID id,
                       @Param("code") String code,
                       @Param("diagnostic") String diagnostic,
                       @Param("now") Instant now);

    /** Raise the cancel flag of an executing run; the loop reads it between passes. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Run r
            SET r.cancelRequested = true, r.updatedAt = :now
            WHERE r.id = :id AND r.state = com.greenloop.orchestrator.model.RunState.RUNNING
            """)
    int flagCancelIfRunning(@Param("id") UUID id, @Param("now") Instant now);
}
