package com.greenloop.orchestrator.loop;

import com.greenloop.orchestrator.collaborator.BuildRunner;
import com.greenloop.orchestrator.collaborator.CollaboratorException;
import com.greenloop.orchestrator.collaborator.CoverageReporter;
import com.greenloop.orchestrator.collaborator.DashboardReader;
import com.greenloop.orchestrator.collaborator.FailureReporter;
import com.greenloop.orchestrator.collaborator.FileStore;
import com.greenloop.orchestrator.collaborator.PatchGenerator;
import com.greenloop.orchestrator.collaborator.SourceLocator;
import com.greenloop.orchestrator.collaborator.VersionControl;
import com.greenloop.orchestrator.model.BuildStatus;
import com.greenloop.orchestrator.model.CoverageGap;
import com.greenloop.orchestrator.model.QualityDashboard;
import com.greenloop.orchestrator.model.RepositoryState;
import com.greenloop.orchestrator.model.TestFailure;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * In-memory workspace for loop tests.
 *
 * Each build consumes the next scripted {@link State}; the last one repeats.
 * Files live in a map, commits and pushes are counted.
 */
class FakeWorkspace implements BuildRunner, DashboardReader, SourceLocator, FileStore,
        VersionControl, PatchGenerator {

    record State(BuildStatus build, QualityDashboard dashboard,
                 List<TestFailure> failures, List<CoverageGap> gaps) {}

    static final String CALC      = "src/main/java/com/acme/Calc.java";
    static final String CALC_TEST = "src/test/java/com/acme/CalcTest.java";

    private final Deque<State> script = new ArrayDeque<>();
    private State current;

    final Map<String, String>      files    = new LinkedHashMap<>();
    final List<String>             commits  = new ArrayList<>();
    final List<PatchRequest>       requests = new ArrayList<>();

    int builds;
    int dashboardReads;
    int failureReads;
    int coverageReads;
    int stageCalls;
    int pushes;
    int pullRequests;

    boolean dirty;
    CollaboratorException writeFailure;
    CollaboratorException commitFailure;
    CollaboratorException buildFailure;
    int pushFailuresLeft;

    Function<PatchRequest, String> patcher =
            req -> req.currentContent() + "// addresses " + req.target().key() + "\n";

    // ------------------------------------------------------------------
    // Script helpers
    // ------------------------------------------------------------------

    FakeWorkspace then(State state) {
        script.add(state);
        return this;
    }

    FakeWorkspace withCalcSources() {
        files.put(CALC, "package com.acme;\n\npublic class Calc {\n}\n");
        files.put(CALC_TEST, "package com.acme;\n\nclass CalcTest {\n}\n");
        return this;
    }

    static State green() {
        return new State(BuildStatus.success(), QualityDashboard.of(12, 0, 0, 100.0), List.of(), List.of());
    }

    static State failingTests(double linePercent, String... methods) {
        List<TestFailure> failures = Arrays.stream(methods)
                .map(m -> new TestFailure("com.acme.CalcTest", m, "failure", "expected 2 but was 3", ""))
                .toList();
        return new State(BuildStatus.failed("There are test failures."),
                QualityDashboard.of(12, failures.size(), 0, linePercent), failures, List.of());
    }

    static State uncovered(double linePercent, Integer... lines) {
        return new State(BuildStatus.success(), QualityDashboard.of(12, 0, 0, linePercent),
                List.of(), List.of(new CoverageGap("com.acme.Calc", List.of(lines))));
    }

    static State compileError(String diagnostic, QualityDashboard staleDashboard) {
        return new State(BuildStatus.failed(diagnostic), staleDashboard, List.of(), List.of());
    }

    FailureReporter failureReporter() {
        return () -> {
            failureReads++;
            return current.failures();
        };
    }

    CoverageReporter coverageReporter() {
        return () -> {
            coverageReads++;
            return current.gaps();
        };
    }

    StateProbe probe() {
        return new StateProbe(this, this, failureReporter(), coverageReporter());
    }

    // ------------------------------------------------------------------
    // Collaborators
    // ------------------------------------------------------------------

    @Override
    public BuildStatus run() {
        if (buildFailure != null) throw buildFailure;
        builds++;
        current = script.size() > 1 ? script.poll() : script.peek();
        return current.build();
    }

    @Override
    public QualityDashboard read() {
        dashboardReads++;
        return current.dashboard();
    }

    @Override
    public Optional<String> find(String classFqn) {
        String suffix = classFqn.replace('.', '/') + ".java";
        return files.keySet().stream().filter(p -> p.endsWith("/" + suffix)).findFirst();
    }

    @Override
    public String read(String path) {
        String content = files.get(path);
        if (content == null) throw new CollaboratorException("No such file: " + path);
        return content;
    }

    @Override
    public void write(String path, String content) {
        if (writeFailure != null) throw writeFailure;
        files.put(path, content);
    }

    @Override
    public String generate(PatchRequest request) {
        requests.add(request);
        return patcher.apply(request);
    }

    @Override
    public RepositoryState status() {
        return dirty ? RepositoryState.dirty(" M README.md") : RepositoryState.cleanTree();
    }

    @Override
    public void stageAll() {
        stageCalls++;
    }

    @Override
    public void commit(String message) {
        if (commitFailure != null) throw commitFailure;
        commits.add(message);
    }

    @Override
    public void push() {
        if (pushFailuresLeft > 0) {
            pushFailuresLeft--;
            throw new CollaboratorException("remote hung up");
        }
        pushes++;
    }

    @Override
    public String openRequest(String title) {
        pullRequests++;
        return "https://git.example.com/acme/calc/pull/" + pullRequests;
    }
}
