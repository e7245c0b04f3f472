package com.greenloop.orchestrator.loop;

import com.greenloop.orchestrator.collaborator.CollaboratorException;
import com.greenloop.orchestrator.collaborator.VersionControl;
import com.greenloop.orchestrator.model.QualityDashboard;
import com.greenloop.orchestrator.model.RepositoryState;
import com.greenloop.orchestrator.model.Termination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Last step of a run: re-validates the terminal conditions and publishes.
 *
 * Publishes only when the latest snapshot has no failures, no errors and
 * 100% line coverage, and the working tree is clean. Everything was already
 * committed pass by pass, so there is nothing to stage here. Push and
 * pull-request creation are retried with exponential backoff; both are safe
 * to repeat.
 *
 * A gate publishes at most once.
 */
public class CompletionGate {

    private static final Logger log = LoggerFactory.getLogger(CompletionGate.class);

    private final VersionControl vcs;
    private final LoopSettings   settings;
    private final Sleeper        sleeper;

    private boolean published = false;

    public CompletionGate(VersionControl vcs, LoopSettings settings, Sleeper sleeper) {
        this.vcs      = vcs;
        this.settings = settings;
        this.sleeper  = sleeper;
    }

    public Termination complete(Snapshot snapshot, int passes) {
        if (published) {
            throw new IllegalStateException("Completion gate already published");
        }

        String unmet = unmetCondition(snapshot);
        if (unmet != null) {
            log.warn("Completion preconditions not met: {}", unmet);
            return Termination.blocked("PRECONDITIONS_UNMET", unmet, passes);
        }

        RepositoryState state;
        try {
            state = vcs.status();
        } catch (CollaboratorException e) {
            return Termination.aborted(RemediationException.Kind.PUBLICATION_ERROR.name(),
                    "Could not read working-tree status: " + e.getMessage(), passes);
        }
        if (!state.clean()) {
            log.error("Working tree modified outside the loop, refusing to publish:\n{}", state.changes());
            return Termination.aborted(RemediationException.Kind.INCONSISTENT_STATE.name(),
                    "Working tree is dirty at completion: " + state.changes(), passes);
        }

        try {
            withRetry("push", () -> {
                vcs.push();
                return null;
            });
        } catch (RemediationException e) {
            return Termination.aborted(e.getKind().name(), e.getMessage(), passes);
        }
        published = true;
        log.info("Published remediation branch after {} passes", passes);

        String detail = "pushed";
        if (settings.openPullRequest()) {
            try {
                String url = withRetry("open pull request", () -> vcs.openRequest(settings.pullRequestTitle()));
                detail = "pushed; pull request " + url;
                log.info("Opened pull request {}", url);
            } catch (RemediationException e) {
                // The push already happened; the run still succeeded.
                log.warn("Pushed, but could not open pull request: {}", e.getMessage());
                detail = "pushed; pull request not opened: " + e.getMessage();
            }
        }
        return Termination.success(detail, passes);
    }

    public boolean hasPublished() {
        return published;
    }

    private static String unmetCondition(Snapshot snapshot) {
        QualityDashboard dashboard = snapshot.dashboard();
        if (dashboard == null) {
            return "no quality dashboard available";
        }
        if (dashboard.testSummary().failures() != 0) {
            return "failures=" + dashboard.testSummary().failures();
        }
        if (dashboard.testSummary().errors() != 0) {
            return "errors=" + dashboard.testSummary().errors();
        }
        if (dashboard.coverageSummary().linePercent() != 100.0) {
            return "linePercent=" + dashboard.coverageSummary().linePercent();
        }
        return null;
    }

    private <T> T withRetry(String operation, Supplier<T> call) {
        Duration delay = settings.publishBackoff();
        CollaboratorException lastError = null;
        for (int attempt = 1; attempt <= settings.publishAttempts(); attempt++) {
            try {
                return call.get();
            } catch (CollaboratorException e) {
                lastError = e;
                log.warn("{} failed (attempt {}/{}): {}",
                        operation, attempt, settings.publishAttempts(), e.getMessage());
            }
            if (attempt < settings.publishAttempts()) {
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new RemediationException(RemediationException.Kind.PUBLICATION_ERROR,
                            operation + " interrupted", ie);
                }
                delay = delay.multipliedBy(2);
            }
        }
        throw new RemediationException(RemediationException.Kind.PUBLICATION_ERROR,
                "%s failed after %d attempts: %s".formatted(
                        operation, settings.publishAttempts(), lastError.getMessage()),
                lastError);
    }
}
