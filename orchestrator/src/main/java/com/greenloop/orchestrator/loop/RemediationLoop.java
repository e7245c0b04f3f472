package com.greenloop.orchestrator.loop;

import com.greenloop.orchestrator.collaborator.CollaboratorException;
import com.greenloop.orchestrator.collaborator.VersionControl;
import com.greenloop.orchestrator.loop.ProgressGuard.Halt;
import com.greenloop.orchestrator.loop.WorkflowExecutor.PassResult;
import com.greenloop.orchestrator.model.IterationRecord;
import com.greenloop.orchestrator.model.Outcome;
import com.greenloop.orchestrator.model.RepositoryState;
import com.greenloop.orchestrator.model.Termination;
import com.greenloop.orchestrator.model.Workflow;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * The remediation control loop.
 *
 * Each pass:
 *   1. probe the workspace (fresh snapshot, never reused)
 *   2. triage the snapshot into one workflow
 *   3. NONE → hand over to the completion gate and stop
 *   4. let the progress guard veto the pass (regression, oscillation,
 *      stagnation, iteration cap)
 *   5. execute the workflow on one target, record the pass
 *
 * Passes run strictly one after another on the calling thread. Cancellation
 * is only looked at between passes, so a pass always ends with a commit or a
 * recorded failure. Every pass appends exactly one IterationRecord, halted
 * and terminal passes included.
 */
public class RemediationLoop {

    private static final Logger log = LoggerFactory.getLogger(RemediationLoop.class);

    private final StateProbe       probe;
    private final TriageController triage;
    private final WorkflowExecutor executor;
    private final CompletionGate   gate;
    private final VersionControl   vcs;
    private final LoopSettings     settings;
    private final MeterRegistry    meterRegistry;
    private final Clock            clock;

    public RemediationLoop(StateProbe probe,
                           TriageController triage,
                           WorkflowExecutor executor,
                           CompletionGate gate,
                           VersionControl vcs,
                           LoopSettings settings,
                           MeterRegistry meterRegistry,
                           Clock clock) {
        this.probe         = probe;
        this.triage        = triage;
        this.executor      = executor;
        this.gate          = gate;
        this.vcs           = vcs;
        this.settings      = settings;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
    }

    /**
     * Drive the workspace until it is green and fully covered, or until a
     * guard or error stops the run. Blocks until the run terminates.
     */
    public Termination run(UUID runId, BooleanSupplier cancellation, PassListener listener) {
        MDC.put("runId", runId.toString());
        try {
            log.info("Starting remediation run {} (maxIterations={})", runId, settings.maxIterations());
            Termination termination = drive(runId, cancellation, listener);
            meterRegistry.counter("greenloop.runs",
                    "status", termination.status().name().toLowerCase()).increment();
            log.info("Run {} finished: {} {} after {} passes",
                    runId, termination.status(),
                    termination.code() != null ? termination.code() : "",
                    termination.passes());
            return termination;
        } finally {
            MDC.clear();
        }
    }

    private Termination drive(UUID runId, BooleanSupplier cancellation, PassListener listener) {
        // The loop is the tree's only writer from here on, so this is checked once.
        RepositoryState startup;
        try {
            startup = vcs.status();
        } catch (CollaboratorException e) {
            return Termination.aborted(RemediationException.Kind.PROBE_ERROR.name(),
                    "Could not read working-tree status: " + e.getMessage(), 0);
        }
        if (!startup.clean()) {
            return Termination.aborted(RemediationException.Kind.INCONSISTENT_STATE.name(),
                    "Working tree is dirty before the first pass: " + startup.changes(), 0);
        }

        ProgressGuard guard = new ProgressGuard(settings);
        RunContext ctx = new RunContext(runId, startup, guard, cancellation, listener);

        while (true) {
            if (ctx.cancelRequested()) {
                log.info("Cancellation requested, stopping before pass {}", guard.passes() + 1);
                return Termination.aborted("CANCELLED",
                        "Cancelled by operator\n" + guard.summary(), guard.passes());
            }

            int pass = guard.passes() + 1;
            MDC.put("pass", String.valueOf(pass));
            MDC.remove("workflow");

            Snapshot snapshot;
            try {
                snapshot = probe.probe();
            } catch (RemediationException e) {
                log.error("Probe failed before pass {}: {}", pass, e.getMessage());
                return Termination.aborted(e.getKind().name(), e.getMessage(), guard.passes());
            }

            Workflow workflow = triage.decide(snapshot);
            MDC.put("workflow", workflow.name());
            log.info("Pass {}: triage selected {}", pass, workflow);

            if (workflow == Workflow.NONE) {
                record(ctx, new IterationRecord(pass, workflow, null, Outcome.SKIPPED,
                        "all goals met, entering completion gate", Instant.now(clock)));
                return gate.complete(snapshot, guard.passes());
            }

            Optional<Halt> halt = guard.inspect(snapshot).or(guard::checkBudget);
            if (halt.isPresent()) {
                Halt h = halt.get();
                log.warn("Pass {}: halting run, {}: {}", pass, h.reason(), h.message());
                record(ctx, new IterationRecord(pass, workflow, null, Outcome.SKIPPED,
                        h.reason() + ": " + h.message(), Instant.now(clock)));
                return Termination.blocked(h.reason().name(),
                        h.message() + "\n" + guard.summary(), guard.passes());
            }

            Timer.Sample sample = Timer.start(meterRegistry);
            PassResult result;
            try {
                result = executor.execute(pass, workflow, snapshot, ctx);
            } finally {
                sample.stop(meterRegistry.timer("greenloop.pass.duration",
                        "workflow", workflow.name().toLowerCase()));
            }
            record(ctx, result.record());

            if (result.isFatal()) {
                RemediationException fatal = result.fatal();
                return Termination.aborted(fatal.getKind().name(),
                        fatal.getMessage() + "\n" + guard.summary(), guard.passes());
            }
        }
    }

    private void record(RunContext ctx, IterationRecord record) {
        ctx.guard().record(record);
        meterRegistry.counter("greenloop.passes",
                "workflow", record.workflow().name().toLowerCase(),
                "outcome", record.outcome().name().toLowerCase()).increment();
        try {
            ctx.listener().onPass(ctx.runId(), record);
        } catch (RuntimeException e) {
            // The in-memory history is authoritative; the ledger is best effort.
            log.warn("Could not hand pass {} to listener: {}", record.pass(), e.getMessage());
        }
    }
}
