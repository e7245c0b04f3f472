package com.greenloop.orchestrator.loop;

import java.time.Duration;

/**
 * Limits and thresholds for one remediation run.
 *
 * @param maxIterations       remediation passes allowed before the run is halted
 * @param stagnationThreshold consecutive applied passes with unchanged metrics that count as stagnation
 * @param oscillationCycles   times a fixed target may come back before the run is halted
 * @param maxTargetAttempts   failed passes on one target before selection skips it
 * @param publishAttempts     tries for each publication call (push, pull request)
 * @param publishBackoff      delay before the first retry; doubled on each further retry
 * @param openPullRequest     open a pull request after a successful push
 * @param pullRequestTitle    title used for that pull request
 */
public record LoopSettings(
        int      maxIterations,
        int      stagnationThreshold,
        int      oscillationCycles,
        int      maxTargetAttempts,
        int      publishAttempts,
        Duration publishBackoff,
        boolean  openPullRequest,
        String   pullRequestTitle) {

    public LoopSettings {
        if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be >= 1");
        if (stagnationThreshold < 1) throw new IllegalArgumentException("stagnationThreshold must be >= 1");
        if (oscillationCycles < 1) throw new IllegalArgumentException("oscillationCycles must be >= 1");
        if (maxTargetAttempts < 1) throw new IllegalArgumentException("maxTargetAttempts must be >= 1");
        if (publishAttempts < 1) throw new IllegalArgumentException("publishAttempts must be >= 1");
        if (publishBackoff == null || publishBackoff.isNegative()) publishBackoff = Duration.ZERO;
        if (pullRequestTitle == null || pullRequestTitle.isBlank()) pullRequestTitle = "Automated remediation";
    }

    public static LoopSettings defaults() {
        return new LoopSettings(50, 3, 2, 2, 3, Duration.ofSeconds(2), false, null);
    }
}
