package com.greenloop.orchestrator.model;

/**
 * Aggregated test and coverage metrics for the whole workspace.
 *
 * Only {@code total}, {@code failures}, {@code errors} and {@code linePercent}
 * drive triage; the remaining figures are reported as-is.
 */
public record QualityDashboard(TestSummary testSummary, CoverageSummary coverageSummary) {

    public record TestSummary(int total, int failures, int errors, int skipped) {

        public int passed() {
            return total - failures - errors - skipped;
        }

        public boolean hasProblems() {
            return failures > 0 || errors > 0;
        }
    }

    public record CoverageSummary(double linePercent, double branchPercent, double methodPercent) {

        public static CoverageSummary lines(double linePercent) {
            return new CoverageSummary(linePercent, 0.0, 0.0);
        }

        public boolean fullyCovered() {
            return linePercent >= 100.0;
        }
    }

    public static QualityDashboard of(int total, int failures, int errors, double linePercent) {
        return new QualityDashboard(
                new TestSummary(total, failures, errors, 0),
                CoverageSummary.lines(linePercent));
    }
}
