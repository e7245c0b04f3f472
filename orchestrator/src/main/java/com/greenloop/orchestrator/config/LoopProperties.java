package com.greenloop.orchestrator.config;

import com.greenloop.orchestrator.loop.LoopSettings;
import com.greenloop.orchestrator.policy.PatchPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Loop limits, bound from {@code greenloop.loop.*}.
 * See {@link LoopSettings} for what each threshold means.
 */
@Component
@ConfigurationProperties(prefix = "greenloop.loop")
public class LoopProperties {

    private int maxIterations = 50;
    private int stagnationThreshold = 3;
    private int oscillationCycles = 2;
    private int maxTargetAttempts = 2;
    private int publishAttempts = 3;
    private Duration publishBackoff = Duration.ofSeconds(2);
    private boolean openPullRequest = false;
    private String pullRequestTitle = "Automated remediation: green build and full line coverage";
    private int maxChangedLines = PatchPolicy.DEFAULT_MAX_CHANGED_LINES;

    public LoopSettings toSettings() {
        return new LoopSettings(maxIterations, stagnationThreshold, oscillationCycles,
                maxTargetAttempts, publishAttempts, publishBackoff, openPullRequest, pullRequestTitle);
    }

    public int getMaxIterations() { return maxIterations; }
    public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
    public int getStagnationThreshold() { return stagnationThreshold; }
    public void setStagnationThreshold(int stagnationThreshold) { this.stagnationThreshold = stagnationThreshold; }
    public int getOscillationCycles() { return oscillationCycles; }
    public void setOscillationCycles(int oscillationCycles) { this.oscillationCycles = oscillationCycles; }
    public int getMaxTargetAttempts() { return maxTargetAttempts; }
    public void setMaxTargetAttempts(int maxTargetAttempts) { this.maxTargetAttempts = maxTargetAttempts; }
    public int getPublishAttempts() { return publishAttempts; }
    public void setPublishAttempts(int publishAttempts) { this.publishAttempts = publishAttempts; }
    public Duration getPublishBackoff() { return publishBackoff; }
    public void setPublishBackoff(Duration publishBackoff) { this.publishBackoff = publishBackoff; }
    public boolean isOpenPullRequest() { return openPullRequest; }
    public void setOpenPullRequest(boolean openPullRequest) { this.openPullRequest = openPullRequest; }
    public String getPullRequestTitle() { return pullRequestTitle; }
    public void setPullRequestTitle(String pullRequestTitle) { this.pullRequestTitle = pullRequestTitle; }
    public int getMaxChangedLines() { return maxChangedLines; }
    public void setMaxChangedLines(int maxChangedLines) { this.maxChangedLines = maxChangedLines; }
}
