package com.greenloop.orchestrator.service;

import com.greenloop.orchestrator.model.*;
import com.greenloop.orchestrator.repository.PassRepository;
import com.greenloop.orchestrator.repository.RunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RunService. Repositories are mocked; no Spring context.
 */
@ExtendWith(MockitoExtension.class)
class RunServiceTest {

    @Mock RunRepository  runRepo;
    @Mock PassRepository passRepo;

    RunService service;

    @BeforeEach
    void setUp() {
        service = new RunService(runRepo, passRepo);
    }

    // ------------------------------------------------------------------
    // submit()
    // ------------------------------------------------------------------

    @Test
    void submit_freeWorkspace_queuesPendingRun() {
        when(runRepo.existsByWorkspaceRefAndStateIn(any(), any())).thenReturn(false);
        when(runRepo.saveAndFlush(any())).thenAnswer(inv -> inv.getArgument(0));

        Run run = service.submit("ws-1", "greenloop/fix", "main");

        assertThat(run.getState()).isEqualTo(RunState.PENDING);
        assertThat(run.getWorkspaceRef()).isEqualTo("ws-1");
        assertThat(run.getBranch()).isEqualTo("greenloop/fix");
    }

    @Test
    void submit_workspaceAlreadyActive_isRefused() {
        when(runRepo.existsByWorkspaceRefAndStateIn(any(), any())).thenReturn(true);

        assertThatThrownBy(() -> service.submit("ws-1", "b", "main"))
                .isInstanceOf(IllegalStateException.class);
        verify(runRepo, never()).saveAndFlush(any());
    }

    @Test
    void submit_concurrentSubmitWinsUniqueIndex_isRefused() {
        when(runRepo.existsByWorkspaceRefAndStateIn(any(), any())).thenReturn(false);
        when(runRepo.saveAndFlush(any()))
                .thenThrow(new DataIntegrityViolationException("uq_runs_active_workspace"));

        assertThatThrownBy(() -> service.submit("ws-1", "b", "main"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already has an active run");
    }

    // ------------------------------------------------------------------
    // claimNextRun() / recordPass() / finish()
    // ------------------------------------------------------------------

    @Test
    void claimNextRun_marksRunRunning() {
        Run run = runWithId(RunState.PENDING);
        when(runRepo.claimNextPendingRun()).thenReturn(Optional.of(run));

        Optional<Run> claimed = service.claimNextRun();

        assertThat(claimed).contains(run);
        assertThat(run.getState()).isEqualTo(RunState.RUNNING);
        assertThat(run.getStartedAt()).isNotNull();
        verify(runRepo).save(run);
    }

    @Test
    void claimNextRun_emptyQueue_returnsEmpty() {
        when(runRepo.claimNextPendingRun()).thenReturn(Optional.empty());

        assertThat(service.claimNextRun()).isEmpty();
        verify(runRepo, never()).save(any());
    }

    @Test
    void recordPass_appendsLedgerRowAndUpdatesOnlyPassCount() {
        Run run = runWithId(RunState.RUNNING);
        when(runRepo.updatePassCount(eq(run.getId()), eq(3), any())).thenReturn(1);
        when(runRepo.getReferenceById(run.getId())).thenReturn(run);
        IterationRecord record = new IterationRecord(3, Workflow.IMPROVE_COVERAGE,
                RemediationTarget.coverageLine("com.acme.Calc", 12), Outcome.APPLIED,
                "Add test covering com.acme.Calc line 12", Instant.parse("2026-01-05T10:00:00Z"));

        service.recordPass(run.getId(), record);

        ArgumentCaptor<Pass> captor = ArgumentCaptor.forClass(Pass.class);
        verify(passRepo).save(captor.capture());
        Pass pass = captor.getValue();
        assertThat(pass.getPassNumber()).isEqualTo(3);
        assertThat(pass.getTargetKey()).isEqualTo("coverage:com.acme.Calc:12");
        assertThat(pass.getTargetLabel()).isEqualTo("com.acme.Calc line 12");
        assertThat(pass.getOutcome()).isEqualTo(Outcome.APPLIED);
        // the run row is never saved whole from the worker thread
        verify(runRepo, never()).save(any());
    }

    @Test
    void recordPass_unknownRun_throws() {
        when(runRepo.updatePassCount(any(), anyInt(), any())).thenReturn(0);
        IterationRecord record = new IterationRecord(1, Workflow.FIX_TEST_FAILURE, null, Outcome.SKIPPED, "",
                Instant.parse("2026-01-05T10:00:00Z"));

        assertThatThrownBy(() -> service.recordPass(UUID.randomUUID(), record))
                .isInstanceOf(IllegalStateException.class);
        verifyNoInteractions(passRepo);
    }

    @Test
    void finish_blockedTermination_storesCodeAndDiagnostic() {
        Run run = runWithId(RunState.RUNNING);
        when(runRepo.findById(run.getId())).thenReturn(Optional.of(run));

        service.finish(run.getId(), Termination.blocked("REGRESSION_DETECTED", "pass 1 ...", 4));

        assertThat(run.getState()).isEqualTo(RunState.BLOCKED);
        assertThat(run.getTerminationCode()).isEqualTo("REGRESSION_DETECTED");
        assertThat(run.getDiagnostic()).isEqualTo("pass 1 ...");
        assertThat(run.getPassCount()).isEqualTo(4);
        assertThat(run.isPublished()).isFalse();
        assertThat(run.getFinishedAt()).isNotNull();
    }

    @Test
    void finish_success_marksPublished() {
        Run run = runWithId(RunState.RUNNING);
        when(runRepo.findById(run.getId())).thenReturn(Optional.of(run));

        service.finish(run.getId(), Termination.success("pushed", 9));

        assertThat(run.getState()).isEqualTo(RunState.SUCCEEDED);
        assertThat(run.isPublished()).isTrue();
    }

    // ------------------------------------------------------------------
    // Cancellation and recovery
    // ------------------------------------------------------------------

    @Test
    void requestCancel_pendingRun_abortsOnlyWhileStillPending() {
        Run run = runWithId(RunState.ABORTED);
        when(runRepo.abortIfPending(eq(run.getId()), eq("CANCELLED"), any(), any())).thenReturn(1);
        when(runRepo.findById(run.getId())).thenReturn(Optional.of(run));

        assertThat(service.requestCancel(run.getId())).contains(run);

        verify(runRepo, never()).flagCancelIfRunning(any(), any());
        verify(runRepo, never()).save(any());
    }

    @Test
    void requestCancel_runClaimedMeanwhile_onlyRaisesFlag() {
        // the pending-only abort matches nothing once the scheduler owns the run
        Run run = runWithId(RunState.RUNNING);
        when(runRepo.abortIfPending(eq(run.getId()), any(), any(), any())).thenReturn(0);
        when(runRepo.flagCancelIfRunning(eq(run.getId()), any())).thenReturn(1);
        when(runRepo.findById(run.getId())).thenReturn(Optional.of(run));

        Optional<Run> result = service.requestCancel(run.getId());

        assertThat(result).contains(run);
        assertThat(run.getState()).isEqualTo(RunState.RUNNING);
        verify(runRepo, never()).save(any());
    }

    @Test
    void requestCancel_finishedRun_isRefused() {
        Run run = runWithId(RunState.SUCCEEDED);
        when(runRepo.abortIfPending(any(), any(), any(), any())).thenReturn(0);
        when(runRepo.flagCancelIfRunning(any(), any())).thenReturn(0);
        when(runRepo.findById(run.getId())).thenReturn(Optional.of(run));

        assertThatThrownBy(() -> service.requestCancel(run.getId()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("SUCCEEDED");
    }

    @Test
    void requestCancel_unknownRun_returnsEmpty() {
        when(runRepo.abortIfPending(any(), any(), any(), any())).thenReturn(0);
        when(runRepo.flagCancelIfRunning(any(), any())).thenReturn(0);
        when(runRepo.findById(any())).thenReturn(Optional.empty());

        assertThat(service.requestCancel(UUID.randomUUID())).isEmpty();
    }

    @Test
    void isCancelRequested_readsTheStoredFlag() {
        Run run = runWithId(RunState.RUNNING);
        run.setCancelRequested(true);
        when(runRepo.findById(run.getId())).thenReturn(Optional.of(run));

        assertThat(service.isCancelRequested(run.getId())).isTrue();
    }

    @Test
    void abortInterruptedRuns_abortsEveryRunningRun() {
        Run a = runWithId(RunState.RUNNING);
        Run b = runWithId(RunState.RUNNING);
        when(runRepo.findByState(RunState.RUNNING)).thenReturn(List.of(a, b));

        int count = service.abortInterruptedRuns();

        assertThat(count).isEqualTo(2);
        assertThat(a.getState()).isEqualTo(RunState.ABORTED);
        assertThat(b.getTerminationCode()).isEqualTo("INTERRUPTED");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static Run runWithId(RunState state) {
        Run run = new Run("ws-1", "greenloop/fix", "main");
        // id is normally assigned by JPA on persist
        try {
            var f = Run.class.getDeclaredField("id");
            f.setAccessible(true);
            f.set(run, UUID.randomUUID());
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        run.setState(state);
        return run;
    }
}
