package com.greenloop.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Connection settings for the toolbox service that hosts the workspaces
 * (build harness, report readers, file access, git).
 */
@Component
@ConfigurationProperties(prefix = "greenloop.toolbox")
public class ToolboxProperties {

    private String baseUrl = "http://localhost:8000";

    /** Deadline for every call except the build. */
    private Duration requestTimeout = Duration.ofSeconds(120);

    /** Deadline for a full build; compiling and running the suite can take a while. */
    private Duration buildTimeout = Duration.ofMinutes(30);

    private Duration connectTimeout = Duration.ofSeconds(10);

    /** Git remote changes are published to. */
    private String remote = "origin";

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    public Duration getBuildTimeout() { return buildTimeout; }
    public void setBuildTimeout(Duration buildTimeout) { this.buildTimeout = buildTimeout; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
    public String getRemote() { return remote; }
    public void setRemote(String remote) { this.remote = remote; }
}
