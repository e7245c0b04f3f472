package com.greenloop.orchestrator.loop;

import com.greenloop.orchestrator.loop.Snapshot.Metrics;
import com.greenloop.orchestrator.model.IterationRecord;
import com.greenloop.orchestrator.model.Outcome;
import com.greenloop.orchestrator.model.RemediationTarget;
import com.greenloop.orchestrator.model.Workflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Owns the iteration history of a run and decides when the loop must stop
 * because it is no longer making progress.
 *
 * <p>{@link #inspect} is called once per probe, before a remediation pass:
 * <ul>
 *   <li><b>Regression</b>: the previous pass applied a change to a target
 *       that the new snapshot still reports.</li>
 *   <li><b>Oscillation</b>: a target went away and came back
 *       {@code oscillationCycles} times (the A-B-A pattern).</li>
 *   <li><b>Stagnation</b>: the last {@code stagnationThreshold} passes all
 *       applied a change, yet the metrics did not move.</li>
 * </ul>
 * {@link #checkBudget} enforces the iteration cap before each remediation pass.
 *
 * <p>Not thread-safe; a run is driven by a single thread.
 */
public class ProgressGuard {

    private static final Logger log = LoggerFactory.getLogger(ProgressGuard.class);

    private final LoopSettings settings;

    private final List<IterationRecord> history = new ArrayList<>();

    // metrics observed at each probe, in probe order
    private final List<Metrics> probeMetrics = new ArrayList<>();

    private final Map<String, Presence> presence = new LinkedHashMap<>();

    public ProgressGuard(LoopSettings settings) {
        this.settings = settings;
    }

    /** A halt decision and the human-readable reason for it. */
    public record Halt(HaltReason reason, String message) {}

    // ------------------------------------------------------------------
    // Evaluation
    // ------------------------------------------------------------------

    public Optional<Halt> inspect(Snapshot snapshot) {
        Set<String> outstanding = snapshot.outstandingKeys();
        probeMetrics.add(snapshot.metrics());
        Optional<String> oscillating = trackPresence(snapshot, outstanding);

        Optional<Halt> regression = checkRegression(snapshot, outstanding);
        if (regression.isPresent()) return regression;

        if (oscillating.isPresent()) {
            return Optional.of(new Halt(HaltReason.OSCILLATION_DETECTED,
                    "Target %s came back %d times after being fixed"
                            .formatted(oscillating.get(), settings.oscillationCycles())));
        }

        return checkStagnation();
    }

    /** Halts when one more remediation pass would exceed the iteration cap. */
    public Optional<Halt> checkBudget() {
        if (history.size() >= settings.maxIterations()) {
            return Optional.of(new Halt(HaltReason.ITERATION_CAP_EXCEEDED,
                    "Iteration cap of %d passes reached".formatted(settings.maxIterations())));
        }
        return Optional.empty();
    }

    private Optional<Halt> checkRegression(Snapshot snapshot, Set<String> outstanding) {
        if (history.isEmpty()) return Optional.empty();
        IterationRecord last = history.get(history.size() - 1);
        if (last.outcome() != Outcome.APPLIED || last.target() == null) return Optional.empty();

        RemediationTarget target = last.target();
        if (snapshot.observes(target.workflow()) && outstanding.contains(target.key())) {
            return Optional.of(new Halt(HaltReason.REGRESSION_DETECTED,
                    "Target %s is still reported after the change applied in pass %d"
                            .formatted(target.describe(), last.pass())));
        }
        return Optional.empty();
    }

    private Optional<Halt> checkStagnation() {
        int window = settings.stagnationThreshold();
        if (history.size() < window || probeMetrics.size() < window + 1) return Optional.empty();

        List<IterationRecord> recent = history.subList(history.size() - window, history.size());
        boolean allApplied = recent.stream().allMatch(r -> r.outcome() == Outcome.APPLIED);
        if (!allApplied) return Optional.empty();

        List<Metrics> span = probeMetrics.subList(probeMetrics.size() - window - 1, probeMetrics.size());
        Metrics first = span.get(0);
        if (span.stream().allMatch(first::equals)) {
            return Optional.of(new Halt(HaltReason.STAGNATION_DETECTED,
                    "Metrics unchanged (%s) across %d applied passes".formatted(first, window)));
        }
        return Optional.empty();
    }

    /**
     * Update the presence of every known target; returns a target that has
     * now reappeared often enough to count as oscillating.
     */
    private Optional<String> trackPresence(Snapshot snapshot, Set<String> outstanding) {
        for (String key : outstanding) {
            presence.computeIfAbsent(key, Presence::new);
        }
        String oscillating = null;
        for (Presence p : presence.values()) {
            if (!snapshot.observes(workflowOf(p.key))) continue;
            boolean present = outstanding.contains(p.key);
            if (present && Boolean.FALSE.equals(p.lastSeen)) {
                p.reappearances++;
                log.debug("Target {} reappeared ({} time(s))", p.key, p.reappearances);
            }
            p.lastSeen = present;
            if (p.reappearances >= settings.oscillationCycles() && oscillating == null) {
                oscillating = p.key;
            }
        }
        return Optional.ofNullable(oscillating);
    }

    private static Workflow workflowOf(String key) {
        if (key.startsWith("compile:")) return Workflow.FIX_COMPILE_ERROR;
        if (key.startsWith("test:"))    return Workflow.FIX_TEST_FAILURE;
        return Workflow.IMPROVE_COVERAGE;
    }

    // ------------------------------------------------------------------
    // History
    // ------------------------------------------------------------------

    public void record(IterationRecord record) {
        history.add(record);
    }

    public List<IterationRecord> history() {
        return Collections.unmodifiableList(history);
    }

    public int passes() {
        return history.size();
    }

    /** Number of passes on {@code targetKey} that ended in {@link Outcome#FAILED}. */
    public long failedAttempts(String targetKey) {
        return history.stream()
                .filter(r -> r.outcome() == Outcome.FAILED && targetKey.equals(r.targetKey()))
                .count();
    }

    /** One line per pass; surfaced to operators when the run halts. */
    public String summary() {
        if (history.isEmpty()) return "(no passes)";
        StringBuilder sb = new StringBuilder();
        for (IterationRecord r : history) {
            sb.append(r.summaryLine()).append('\n');
        }
        return sb.toString().stripTrailing();
    }

    private static final class Presence {
        final String key;
        Boolean lastSeen;
        int reappearances;

        Presence(String key) {
            this.key = key;
        }
    }
}
