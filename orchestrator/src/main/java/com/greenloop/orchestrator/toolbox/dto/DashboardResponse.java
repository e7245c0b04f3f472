package com.greenloop.orchestrator.toolbox.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.greenloop.orchestrator.model.QualityDashboard;

/**
 * Response from POST /reports/dashboard: Surefire totals plus JaCoCo
 * project-level counters, already aggregated by the toolbox.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DashboardResponse(
        TestRunSummary      test_run_summary,
        CodeCoverageSummary code_coverage_summary) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TestRunSummary(int total_tests, int passed, int failures, int errors, int skipped) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CodeCoverageSummary(
            double line_coverage_percent,
            double branch_coverage_percent,
            double method_coverage_percent) {}

    public QualityDashboard toDashboard() {
        TestRunSummary tests = test_run_summary != null
                ? test_run_summary : new TestRunSummary(0, 0, 0, 0, 0);
        CodeCoverageSummary coverage = code_coverage_summary != null
                ? code_coverage_summary : new CodeCoverageSummary(0.0, 0.0, 0.0);
        return new QualityDashboard(
                new QualityDashboard.TestSummary(
                        tests.total_tests(), tests.failures(), tests.errors(), tests.skipped()),
                new QualityDashboard.CoverageSummary(
                        coverage.line_coverage_percent(),
                        coverage.branch_coverage_percent(),
                        coverage.method_coverage_percent()));
    }
}
