package com.greenloop.orchestrator.loop;

import com.greenloop.orchestrator.collaborator.CollaboratorException;
import com.greenloop.orchestrator.collaborator.FileStore;
import com.greenloop.orchestrator.collaborator.GenerationException;
import com.greenloop.orchestrator.collaborator.PatchGenerator;
import com.greenloop.orchestrator.collaborator.PatchGenerator.PatchRequest;
import com.greenloop.orchestrator.collaborator.SourceLocator;
import com.greenloop.orchestrator.collaborator.VersionControl;
import com.greenloop.orchestrator.loop.RemediationException.Kind;
import com.greenloop.orchestrator.model.IterationRecord;
import com.greenloop.orchestrator.model.Outcome;
import com.greenloop.orchestrator.model.RemediationTarget;
import com.greenloop.orchestrator.model.Workflow;
import com.greenloop.orchestrator.policy.PatchPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Runs one remediation workflow on exactly one target.
 *
 * Every workflow follows the same fixed steps:
 *   1. Select   - first eligible target in report order
 *   2. Locate   - resolve the file to change and its companion
 *   3. Load     - read current contents
 *   4. Generate - ask the patch generator for the new full file
 *   5. Apply    - write the whole file back (after the policy check)
 *   6. Record   - stage everything and commit with a descriptive message
 *
 * At most one commit is produced per call. Locate, load, generation and
 * policy failures fail the pass only; a rejected write or a failed commit is
 * returned as fatal and stops the run.
 */
public class WorkflowExecutor {

    private static final Logger log = LoggerFactory.getLogger(WorkflowExecutor.class);

    private static final int MAX_SUBJECT_CHARS = 100;

    private final SourceLocator  locator;
    private final FileStore      files;
    private final PatchGenerator generator;
    private final VersionControl vcs;
    private final PatchPolicy    policy;
    private final LoopSettings   settings;
    private final Clock          clock;

    public WorkflowExecutor(SourceLocator locator,
                            FileStore files,
                            PatchGenerator generator,
                            VersionControl vcs,
                            PatchPolicy policy,
                            LoopSettings settings,
                            Clock clock) {
        this.locator   = locator;
        this.files     = files;
        this.generator = generator;
        this.vcs       = vcs;
        this.policy    = policy;
        this.settings  = settings;
        this.clock     = clock;
    }

    /**
     * Outcome of one pass.
     *
     * @param fatal the error that must stop the run, or null
     */
    public record PassResult(IterationRecord record, RemediationException fatal) {

        public boolean isFatal() { return fatal != null; }
    }

    /** Files a pass reads and writes. {@code isNew} means {@code path} does not exist yet. */
    private record FilePlan(String path, boolean isNew, String companionPath) {}

    public PassResult execute(int pass, Workflow workflow, Snapshot snapshot, RunContext ctx) {
        if (workflow == Workflow.NONE) {
            throw new IllegalArgumentException("NONE is handled by the completion gate");
        }

        // --- 1. Select ---
        Optional<RemediationTarget> selected = select(workflow, snapshot, ctx.guard());
        if (selected.isEmpty()) {
            log.warn("Pass {}: no selectable {} target in snapshot", pass, workflow);
            return new PassResult(record(pass, workflow, null, Outcome.SKIPPED,
                    "no selectable target reported"), null);
        }
        RemediationTarget target = selected.get();
        log.info("Pass {}: {} on {}", pass, workflow, target.describe());

        try {
            // --- 2. Locate ---
            FilePlan plan = locate(target);

            // --- 3. Load ---
            String current   = plan.isNew() ? "" : load(plan.path());
            String companion = plan.companionPath() != null ? load(plan.companionPath()) : null;

            // --- 4. Generate ---
            String patched = generate(new PatchRequest(
                    target, plan.path(), current, plan.companionPath(), companion,
                    diagnosticFor(target, snapshot)));
            if (patched.equals(current)) {
                log.info("Pass {}: generator left {} unchanged", pass, plan.path());
                return new PassResult(record(pass, workflow, target, Outcome.SKIPPED,
                        "generator returned the file unchanged"), null);
            }

            PatchPolicy.Report report = policy.check(current, patched);
            if (!report.approved()) {
                throw new RemediationException(Kind.POLICY_VIOLATION,
                        "Change to " + plan.path() + " rejected: " + String.join("; ", report.violations()));
            }

            // --- 5. Apply ---
            apply(plan.path(), patched);

            // --- 6. Record ---
            String message = commitMessage(target);
            commit(message);
            log.info("Pass {}: committed '{}' (+{} -{})",
                    pass, message, report.linesAdded(), report.linesRemoved());
            return new PassResult(record(pass, workflow, target, Outcome.APPLIED, message), null);

        } catch (RemediationException e) {
            if (e.isFatal()) {
                log.error("Pass {}: {} on {} stopped the run: {}",
                        pass, workflow, target.describe(), e.getMessage());
            } else {
                log.warn("Pass {}: {} on {} failed: {}",
                        pass, workflow, target.describe(), e.getMessage());
            }
            IterationRecord failed = record(pass, workflow, target, Outcome.FAILED,
                    "[" + e.getKind() + "] " + e.getMessage());
            return new PassResult(failed, e.isFatal() ? e : null);
        }
    }

    // ------------------------------------------------------------------
    // Steps
    // ------------------------------------------------------------------

    /** First target in report order that has not used up its failed attempts. */
    Optional<RemediationTarget> select(Workflow workflow, Snapshot snapshot, ProgressGuard guard) {
        return snapshot.targetsFor(workflow).stream()
                .filter(t -> guard.failedAttempts(t.key()) < settings.maxTargetAttempts())
                .findFirst();
    }

    private FilePlan locate(RemediationTarget target) {
        return switch (target.workflow()) {
            case FIX_COMPILE_ERROR -> {
                if (target.classFqn() == null) {
                    throw new RemediationException(Kind.LOCATE_ERROR,
                            "Compile diagnostic names no source file: " + target.detail());
                }
                yield new FilePlan(require(target.classFqn()), false, null);
            }
            case FIX_TEST_FAILURE -> {
                // Prefer fixing the class under test; the failing test is context.
                String testPath = require(target.classFqn());
                Optional<String> underTest = JavaPaths.classUnderTest(target.classFqn()).flatMap(this::find);
                yield underTest
                        .map(src -> new FilePlan(src, false, testPath))
                        .orElseGet(() -> new FilePlan(testPath, false, null));
            }
            case IMPROVE_COVERAGE -> {
                String sourcePath = require(target.classFqn());
                yield find(JavaPaths.testClassFor(target.classFqn()))
                        .map(test -> new FilePlan(test, false, sourcePath))
                        .orElseGet(() -> new FilePlan(JavaPaths.testPathFor(sourcePath), true, sourcePath));
            }
            case NONE -> throw new IllegalStateException("NONE has no target");
        };
    }

    private String require(String classFqn) {
        return find(classFqn).orElseThrow(() -> new RemediationException(Kind.LOCATE_ERROR,
                "No source file found for " + classFqn));
    }

    private Optional<String> find(String classFqn) {
        try {
            return locator.find(JavaPaths.topLevelClass(classFqn));
        } catch (CollaboratorException e) {
            throw new RemediationException(Kind.LOCATE_ERROR,
                    "Could not search for " + classFqn + ": " + e.getMessage(), e);
        }
    }

    private String load(String path) {
        try {
            String content = files.read(path);
            return content != null ? content : "";
        } catch (CollaboratorException e) {
            throw new RemediationException(Kind.LOAD_ERROR,
                    "Could not read " + path + ": " + e.getMessage(), e);
        }
    }

    private String generate(PatchRequest request) {
        String patched;
        try {
            patched = generator.generate(request);
        } catch (GenerationException | CollaboratorException e) {
            throw new RemediationException(Kind.GENERATION_ERROR,
                    "Patch generation failed for " + request.target().describe() + ": " + e.getMessage(), e);
        }
        if (patched == null || patched.isBlank()) {
            throw new RemediationException(Kind.GENERATION_ERROR,
                    "Patch generator returned no content for " + request.target().describe());
        }
        return patched;
    }

    private void apply(String path, String content) {
        try {
            files.write(path, content);
        } catch (CollaboratorException e) {
            throw new RemediationException(Kind.APPLY_ERROR,
                    "Write to " + path + " rejected: " + e.getMessage(), e);
        }
    }

    private void commit(String message) {
        try {
            vcs.stageAll();
            vcs.commit(message);
        } catch (CollaboratorException e) {
            throw new RemediationException(Kind.RECORD_ERROR,
                    "Commit failed after applying change: " + e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** The harness output a generator needs to understand the target. */
    static String diagnosticFor(RemediationTarget target, Snapshot snapshot) {
        return switch (target.workflow()) {
            case FIX_COMPILE_ERROR -> snapshot.build().diagnostic();
            case FIX_TEST_FAILURE  -> snapshot.failures().stream()
                    .filter(f -> RemediationTarget.testFailure(f).key().equals(target.key()))
                    .findFirst()
                    .map(f -> f.kind() + ": " + f.message() + "\n" + f.stackTrace())
                    .orElse("");
            case IMPROVE_COVERAGE  -> "Line " + target.line() + " of " + target.classFqn()
                    + " is not executed by any test.";
            case NONE              -> "";
        };
    }

    static String commitMessage(RemediationTarget target) {
        String subject = switch (target.workflow()) {
            case FIX_COMPILE_ERROR -> "Fix compile error at " + target.describe()
                    + (target.pathHint() != null && target.detail() != null && !target.detail().isBlank()
                            ? ": " + target.detail() : "");
            case FIX_TEST_FAILURE  -> "Fix failing test " + target.describe();
            case IMPROVE_COVERAGE  -> "Add test covering " + target.describe();
            case NONE              -> throw new IllegalStateException("NONE is never committed");
        };
        return subject.length() > MAX_SUBJECT_CHARS
                ? subject.substring(0, MAX_SUBJECT_CHARS - 3) + "..."
                : subject;
    }

    private IterationRecord record(int pass, Workflow workflow, RemediationTarget target,
                                   Outcome outcome, String detail) {
        return new IterationRecord(pass, workflow, target, outcome, detail, Instant.now(clock));
    }
}
