package com.greenloop.orchestrator.toolbox;

import com.greenloop.orchestrator.collaborator.BuildRunner;
import com.greenloop.orchestrator.collaborator.CoverageReporter;
import com.greenloop.orchestrator.collaborator.DashboardReader;
import com.greenloop.orchestrator.collaborator.FailureReporter;
import com.greenloop.orchestrator.collaborator.FileStore;
import com.greenloop.orchestrator.collaborator.SourceLocator;
import com.greenloop.orchestrator.collaborator.VersionControl;
import com.greenloop.orchestrator.model.BuildStatus;
import com.greenloop.orchestrator.model.QualityDashboard;
import com.greenloop.orchestrator.model.RepositoryState;
import com.greenloop.orchestrator.model.TestFailure;
import com.greenloop.orchestrator.toolbox.dto.PullRequestResponse;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Binds the toolbox client to one workspace and exposes it through the
 * collaborator interfaces the loop consumes.
 *
 * Not cached: the loop creates test files between passes, so every lookup
 * lists the tree again.
 */
public class ToolboxWorkspace implements BuildRunner, DashboardReader, FailureReporter,
        SourceLocator, FileStore, VersionControl {

    static final String MAIN_ROOT = "src/main/java";
    static final String TEST_ROOT = "src/test/java";

    private final ToolboxClient client;
    private final String        workspaceRef;
    private final String        remote;
    private final String        branch;
    private final String        baseBranch;

    /**
     * @param branch     branch the workspace has checked out; pushes go here
     * @param baseBranch target of the pull request
     */
    public ToolboxWorkspace(ToolboxClient client, String workspaceRef,
                            String remote, String branch, String baseBranch) {
        this.client       = client;
        this.workspaceRef = workspaceRef;
        this.remote       = remote;
        this.branch       = branch;
        this.baseBranch   = baseBranch;
    }

    public String workspaceRef() { return workspaceRef; }

    // ---- build and reports

    @Override
    public BuildStatus run() {
        return client.build(workspaceRef).toBuildStatus();
    }

    @Override
    public QualityDashboard read() {
        return client.dashboard(workspaceRef).toDashboard();
    }

    @Override
    public List<TestFailure> list() {
        return client.failures(workspaceRef).toTestFailures();
    }

    // CoverageReporter.list() has the same erasure as FailureReporter.list()
    public CoverageReporter coverageReporter() {
        return () -> client.coverage(workspaceRef).toCoverageGaps();
    }

    // ---- files

    /**
     * Finds the file declaring {@code classFqn}. Nested classes
     * ({@code Outer$Inner}) resolve to the outer file; production sources
     * win over test sources.
     */
    @Override
    public Optional<String> find(String classFqn) {
        String suffix = relativePath(classFqn);
        return Stream.of(MAIN_ROOT, TEST_ROOT)
                .flatMap(root -> client.listFiles(workspaceRef, root).stream().sorted())
                .filter(p -> p.equals(suffix) || p.endsWith("/" + suffix))
                .findFirst();
    }

    @Override
    public String read(String path) {
        return client.readFile(workspaceRef, path);
    }

    @Override
    public void write(String path, String content) {
        client.writeFile(workspaceRef, path, content);
    }

    // ---- git

    @Override
    public RepositoryState status() {
        return client.gitStatus(workspaceRef).toRepositoryState();
    }

    @Override
    public void stageAll() {
        client.gitStage(workspaceRef);
    }

    @Override
    public void commit(String message) {
        client.gitCommit(workspaceRef, message);
    }

    @Override
    public void push() {
        client.gitPush(workspaceRef, remote, branch);
    }

    @Override
    public String openRequest(String title) {
        PullRequestResponse resp = client.openPullRequest(workspaceRef, baseBranch, title,
                "Automated changes: the build is green and every line is covered.");
        return resp.url();
    }

    static String relativePath(String classFqn) {
        String outer = classFqn;
        int dollar = outer.indexOf('$');
        if (dollar >= 0) outer = outer.substring(0, dollar);
        return outer.replace('.', '/') + ".java";
    }
}
