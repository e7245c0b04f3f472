package com.greenloop.orchestrator.toolbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.greenloop.orchestrator.config.ToolboxProperties;
import com.greenloop.orchestrator.toolbox.dto.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the toolbox service.
 *
 * The toolbox owns the workspaces: it runs {@code mvn clean verify}, parses
 * the Surefire and JaCoCo reports, reads and writes files and runs git/gh.
 * Every endpoint is a JSON POST keyed by {@code workspace_ref}.
 *
 * Called from the single run worker thread, so blocking I/O is fine here.
 */
@Component
public class ToolboxClient {

    private static final Logger log = LoggerFactory.getLogger(ToolboxClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     requestTimeout;
    private final Duration     buildTimeout;

    @Autowired
    public ToolboxClient(ToolboxProperties properties, ObjectMapper objectMapper) {
        this(HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_1_1)
                        .connectTimeout(properties.getConnectTimeout())
                        .build(),
             properties, objectMapper);
    }

    ToolboxClient(HttpClient http, ToolboxProperties properties, ObjectMapper objectMapper) {
        this.http           = http;
        this.json           = objectMapper;
        this.baseUrl        = stripTrailingSlash(properties.getBaseUrl());
        this.requestTimeout = properties.getRequestTimeout();
        this.buildTimeout   = properties.getBuildTimeout();
    }

    // ------------------------------------------------------------------
    // Build and reports
    // ------------------------------------------------------------------

    public BuildResponse build(String workspaceRef) {
        log.info("Building workspace '{}'", workspaceRef);
        String resp = post("/build", Map.of("workspace_ref", workspaceRef),
                "build for " + workspaceRef, buildTimeout);
        return parse(resp, BuildResponse.class, "build");
    }

    public DashboardResponse dashboard(String workspaceRef) {
        String resp = post("/reports/dashboard", Map.of("workspace_ref", workspaceRef),
                "dashboard for " + workspaceRef);
        return parse(resp, DashboardResponse.class, "dashboard");
    }

    public FailuresResponse failures(String workspaceRef) {
        String resp = post("/reports/failures", Map.of("workspace_ref", workspaceRef),
                "failures for " + workspaceRef);
        return parse(resp, FailuresResponse.class, "failures");
    }

    public CoverageResponse coverage(String workspaceRef) {
        String resp = post("/reports/coverage", Map.of("workspace_ref", workspaceRef),
                "coverage for " + workspaceRef);
        return parse(resp, CoverageResponse.class, "coverage");
    }

    // ------------------------------------------------------------------
    // Files
    // ------------------------------------------------------------------

    /** Lists the .java files under {@code root} (workspace-relative). */
    public List<String> listFiles(String workspaceRef, String root) {
        String resp = post("/files/list", Map.of("workspace_ref", workspaceRef,
                                                 "root",          root,
                                                 "suffix",        ".java"),
                "listFiles " + root + " in " + workspaceRef);
        FileListResponse parsed = parse(resp, FileListResponse.class, "listFiles");
        return parsed.files() != null ? parsed.files() : List.of();
    }

    public String readFile(String workspaceRef, String path) {
        String resp = post("/files/read", Map.of("workspace_ref", workspaceRef,
                                                 "path",          path),
                "readFile " + path + " in " + workspaceRef);
        FileContentResponse parsed = parse(resp, FileContentResponse.class, "readFile");
        return parsed.content() != null ? parsed.content() : "";
    }

    public void writeFile(String workspaceRef, String path, String content) {
        log.debug("Writing {} ({} chars) in '{}'", path, content.length(), workspaceRef);
        post("/files/write", Map.of("workspace_ref", workspaceRef,
                                    "path",          path,
                                    "content",       content),
                "writeFile " + path + " in " + workspaceRef);
    }

    // ------------------------------------------------------------------
    // Git
    // ------------------------------------------------------------------

    public GitStatusResponse gitStatus(String workspaceRef) {
        String resp = post("/git/status", Map.of("workspace_ref", workspaceRef),
                "gitStatus for " + workspaceRef);
        return parse(resp, GitStatusResponse.class, "gitStatus");
    }

    public void gitStage(String workspaceRef) {
        post("/git/stage", Map.of("workspace_ref", workspaceRef), "gitStage for " + workspaceRef);
    }

    public void gitCommit(String workspaceRef, String message) {
        log.info("Committing in '{}': {}", workspaceRef, message);
        post("/git/commit", Map.of("workspace_ref", workspaceRef,
                                   "message",       message),
                "gitCommit for " + workspaceRef);
    }

    public void gitPush(String workspaceRef, String remote, String branch) {
        log.info("Pushing '{}' to {}/{}", workspaceRef, remote, branch);
        post("/git/push", Map.of("workspace_ref", workspaceRef,
                                 "remote",        remote,
                                 "branch",        branch),
                "gitPush for " + workspaceRef);
    }

    public PullRequestResponse openPullRequest(String workspaceRef, String base, String title, String body) {
        log.info("Opening pull request for '{}' against {}", workspaceRef, base);
        String resp = post("/git/pull-request", Map.of("workspace_ref", workspaceRef,
                                                       "base",          base,
                                                       "title",         title,
                                                       "body",          body),
                "openPullRequest for " + workspaceRef);
        return parse(resp, PullRequestResponse.class, "openPullRequest");
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String post(String path, Object body, String opName) {
        return post(path, body, opName, requestTimeout);
    }

    private String post(String path, Object body, String opName, Duration timeout) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(toJson(body)))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ToolboxException(
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body(),
                        resp.statusCode());
            }
            return resp.body();
        } catch (ToolboxException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolboxException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new ToolboxException(opName + " failed", e);
        }
    }

    private <T> T parse(String body, Class<T> type, String opName) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ToolboxException("Failed to parse " + opName + " response", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ToolboxException("JSON serialization failed", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
