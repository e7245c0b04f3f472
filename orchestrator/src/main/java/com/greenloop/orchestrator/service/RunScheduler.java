package com.greenloop.orchestrator.service;

import com.greenloop.orchestrator.loop.RemediationLoop;
import com.greenloop.orchestrator.model.Run;
import com.greenloop.orchestrator.model.Termination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background scheduler that drives remediation runs.
 *
 * The runs table is the queue. Each tick claims the oldest PENDING run,
 * but only while no run is active: runs touch shared remotes, so they
 * execute one at a time on a single worker thread.
 */
@Component
@EnableScheduling
public class RunScheduler {

    private static final Logger log = LoggerFactory.getLogger(RunScheduler.class);

    private final ExecutorService worker = Executors.newSingleThreadExecutor();
    private final AtomicBoolean   busy   = new AtomicBoolean(false);

    private final RunService             runService;
    private final RemediationLoopFactory loopFactory;

    public RunScheduler(RunService runService, RemediationLoopFactory loopFactory) {
        this.runService  = runService;
        this.loopFactory = loopFactory;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverInterruptedRuns() {
        int aborted = runService.abortInterruptedRuns();
        if (aborted > 0) {
            log.warn("Aborted {} run(s) interrupted by the last shutdown", aborted);
        }
    }

    @Scheduled(fixedDelayString = "${greenloop.scheduler.poll-interval-ms:2000}")
    public void tick() {
        if (!busy.compareAndSet(false, true)) {
            return;
        }
        Optional<Run> claimed;
        try {
            claimed = runService.claimNextRun();
        } catch (RuntimeException e) {
            busy.set(false);
            throw e;
        }
        if (claimed.isEmpty()) {
            busy.set(false);
            return;
        }
        Run run = claimed.get();
        worker.submit(() -> {
            try {
                execute(run);
            } finally {
                busy.set(false);
            }
        });
    }

    void execute(Run run) {
        UUID runId = run.getId();
        Termination termination;
        try {
            RemediationLoop loop = loopFactory.create(run);
            termination = loop.run(runId,
                    () -> runService.isCancelRequested(runId),
                    runService::recordPass);
        } catch (Exception e) {
            log.error("Unhandled error in remediation loop for run {}: {}", runId, e.getMessage(), e);
            termination = Termination.aborted("UNHANDLED_ERROR",
                    "Unhandled exception: " + e.getMessage(), run.getPassCount());
        }
        try {
            runService.finish(runId, termination);
        } catch (RuntimeException e) {
            log.error("Could not store termination {} for run {}: {}",
                    termination.status(), runId, e.getMessage(), e);
        }
    }

    boolean isBusy() {
        return busy.get();
    }
}
