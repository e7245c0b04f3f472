package com.greenloop.orchestrator.service;

import com.greenloop.orchestrator.loop.PassListener;
import com.greenloop.orchestrator.loop.RemediationLoop;
import com.greenloop.orchestrator.model.Run;
import com.greenloop.orchestrator.model.RunState;
import com.greenloop.orchestrator.model.Termination;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RunSchedulerTest {

    @Mock RunService             runService;
    @Mock RemediationLoopFactory loopFactory;
    @Mock RemediationLoop        loop;

    RunScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new RunScheduler(runService, loopFactory);
    }

    @Test
    void execute_storesLoopTermination() {
        Run run = RunServiceTest.runWithId(RunState.RUNNING);
        Termination done = Termination.success("pushed", 5);
        when(loopFactory.create(run)).thenReturn(loop);
        when(loop.run(eq(run.getId()), any(BooleanSupplier.class), any(PassListener.class))).thenReturn(done);

        scheduler.execute(run);

        verify(runService).finish(run.getId(), done);
    }

    @Test
    void execute_cancellationIsReadFromTheRunRow() {
        Run run = RunServiceTest.runWithId(RunState.RUNNING);
        when(loopFactory.create(run)).thenReturn(loop);
        when(loop.run(any(UUID.class), any(BooleanSupplier.class), any(PassListener.class)))
                .thenReturn(Termination.aborted("CANCELLED", "", 1));
        when(runService.isCancelRequested(run.getId())).thenReturn(true);

        scheduler.execute(run);

        ArgumentCaptor<BooleanSupplier> cancellation = ArgumentCaptor.forClass(BooleanSupplier.class);
        verify(loop).run(eq(run.getId()), cancellation.capture(), any(PassListener.class));
        assertThat(cancellation.getValue().getAsBoolean()).isTrue();
    }

    @Test
    void execute_unexpectedError_isStoredAsAborted() {
        Run run = RunServiceTest.runWithId(RunState.RUNNING);
        when(loopFactory.create(run)).thenThrow(new IllegalStateException("no toolbox"));

        scheduler.execute(run);

        ArgumentCaptor<Termination> captor = ArgumentCaptor.forClass(Termination.class);
        verify(runService).finish(eq(run.getId()), captor.capture());
        assertThat(captor.getValue().status()).isEqualTo(Termination.Status.ABORTED);
        assertThat(captor.getValue().code()).isEqualTo("UNHANDLED_ERROR");
    }

    @Test
    void tick_emptyQueue_staysIdle() {
        when(runService.claimNextRun()).thenReturn(Optional.empty());

        scheduler.tick();

        assertThat(scheduler.isBusy()).isFalse();
        verifyNoInteractions(loopFactory);
    }

    @Test
    void recoverInterruptedRuns_delegatesToService() {
        when(runService.abortInterruptedRuns()).thenReturn(1);

        scheduler.recoverInterruptedRuns();

        verify(runService).abortInterruptedRuns();
    }
}
