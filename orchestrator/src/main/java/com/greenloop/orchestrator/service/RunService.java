package com.greenloop.orchestrator.service;

import com.greenloop.orchestrator.model.IterationRecord;
import com.greenloop.orchestrator.model.Pass;
import com.greenloop.orchestrator.model.Run;
import com.greenloop.orchestrator.model.RunState;
import com.greenloop.orchestrator.model.Termination;
import com.greenloop.orchestrator.repository.PassRepository;
import com.greenloop.orchestrator.repository.RunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Run lifecycle and the pass ledger.
 *
 * All methods that touch the DB are @Transactional so that claiming a run
 * (SELECT ... FOR UPDATE) and flipping it to RUNNING commit together.
 */
@Service
public class RunService {

    private static final Logger log = LoggerFactory.getLogger(RunService.class);

    static final String CANCELLED   = "CANCELLED";
    static final String INTERRUPTED = "INTERRUPTED";

    private static final List<RunState> ACTIVE = List.of(RunState.PENDING, RunState.RUNNING);

    private final RunRepository  runRepo;
    private final PassRepository passRepo;

    public RunService(RunRepository runRepo, PassRepository passRepo) {
        this.runRepo  = runRepo;
        this.passRepo = passRepo;
    }

    // ------------------------------------------------------------------
    // Submission and queries
    // ------------------------------------------------------------------

    /**
     * Queue a run for a workspace. The scheduler picks it up on a later tick.
     *
     * @throws IllegalStateException if the workspace already has a queued or active run
     */
    @Transactional
    public Run submit(String workspaceRef, String branch, String baseBranch) {
        if (runRepo.existsByWorkspaceRefAndStateIn(workspaceRef, ACTIVE)) {
            throw new IllegalStateException("Workspace " + workspaceRef + " already has an active run");
        }
        Run run;
        try {
            run = runRepo.saveAndFlush(new Run(workspaceRef, branch, baseBranch));
        } catch (DataIntegrityViolationException e) {
            // a concurrent submit for the same workspace got there first
            throw new IllegalStateException("Workspace " + workspaceRef + " already has an active run", e);
        }
        log.info("Run {} queued for workspace '{}' on branch {}", run.getId(), workspaceRef, branch);
        return run;
    }

    public Optional<Run> findById(UUID id) {
        return runRepo.findById(id);
    }

    @Transactional(readOnly = true)
    public List<Pass> getPasses(UUID runId) {
        return passRepo.findByRunIdOrderByPassNumberAsc(runId);
    }

    // ------------------------------------------------------------------
    // Scheduler side
    // ------------------------------------------------------------------

    @Transactional
    public Optional<Run> claimNextRun() {
        Optional<Run> opt = runRepo.claimNextPendingRun();
        opt.ifPresent(run -> {
            run.setState(RunState.RUNNING);
            run.setStartedAt(Instant.now());
            runRepo.save(run);
            log.info("Claimed run {} (workspace={})", run.getId(), run.getWorkspaceRef());
        });
        return opt;
    }

    /** Append one pass to the ledger. Called by the loop as each pass is recorded. */
    @Transactional
    public void recordPass(UUID runId, IterationRecord record) {
        if (runRepo.updatePassCount(runId, record.pass(), Instant.now()) == 0) {
            throw new IllegalStateException("Run not found: " + runId);
        }
        passRepo.save(new Pass(runRepo.getReferenceById(runId), record));
    }

    @Transactional
    public void finish(UUID runId, Termination termination) {
        Run run = runRepo.findById(runId).orElseThrow(() ->
                new IllegalStateException("Run not found: " + runId));
        run.setState(RunState.of(termination.status()));
        run.setPublished(termination.published());
        run.setTerminationCode(termination.code());
        run.setDiagnostic(termination.detail());
        run.setPassCount(termination.passes());
        run.setFinishedAt(Instant.now());
        runRepo.save(run);
    }

    @Transactional(readOnly = true)
    public boolean isCancelRequested(UUID runId) {
        return runRepo.findById(runId).map(Run::isCancelRequested).orElse(false);
    }

    /**
     * Ask a run to stop. A queued run is aborted immediately; an active one
     * stops at its next pass boundary.
     *
     * @return empty if the run does not exist
     * @throws IllegalStateException if the run has already finished
     */
    @Transactional
    public Optional<Run> requestCancel(UUID runId) {
        Instant now = Instant.now();
        boolean cancelled = runRepo.abortIfPending(runId, CANCELLED, "Cancelled before it started", now) > 0
                || runRepo.flagCancelIfRunning(runId, now) > 0;
        Optional<Run> opt = runRepo.findById(runId);
        opt.ifPresent(run -> {
            if (!cancelled) {
                throw new IllegalStateException("Run " + runId + " already finished as " + run.getState());
            }
            log.info("Cancellation requested for run {} (state={})", runId, run.getState());
        });
        return opt;
    }

    /**
     * Abort runs left RUNNING by a previous process. The loop keeps its
     * history in memory, so an interrupted run cannot be resumed.
     */
    @Transactional
    public int abortInterruptedRuns() {
        List<Run> stale = runRepo.findByState(RunState.RUNNING);
        for (Run run : stale) {
            log.warn("Run {} was RUNNING when the service stopped; marking it ABORTED", run.getId());
            run.setState(RunState.ABORTED);
            run.setTerminationCode(INTERRUPTED);
            run.setDiagnostic("Service restarted while the run was active");
            run.setFinishedAt(Instant.now());
            runRepo.save(run);
        }
        return stale.size();
    }
}
