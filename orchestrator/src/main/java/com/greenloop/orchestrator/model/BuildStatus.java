package com.greenloop.orchestrator.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Result of one build-harness run.
 *
 * A failed build carries the harness diagnostic (the tail of the build log).
 * Whether the failure is a compile error is decided from that text alone,
 * never from the reports, which are stale once the tree stops compiling.
 */
public record BuildStatus(boolean ok, String diagnostic) {

    // "COMPILATION ERROR" is Maven's banner; the javac form is path:[line,col].
    private static final Pattern COMPILE_SIGNATURE = Pattern.compile(
            "COMPILATION ERROR|compil(?:e|er|ation) error|\\.java:\\[\\d+(?:,\\d+)?]",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern JAVAC_LOCATION = Pattern.compile(
            "([^\\s\\[\\]]+\\.java):\\[(\\d+)(?:,\\d+)?]\\s*(.*)");

    public BuildStatus {
        if (ok) diagnostic = null;
        else if (diagnostic == null) diagnostic = "";
    }

    public static BuildStatus success() {
        return new BuildStatus(true, null);
    }

    public static BuildStatus failed(String diagnostic) {
        return new BuildStatus(false, diagnostic);
    }

    public boolean failed() { return !ok; }

    /** True when the build failed and its diagnostic looks like a compiler failure. */
    public boolean hasCompileError() {
        return failed() && COMPILE_SIGNATURE.matcher(diagnostic).find();
    }

    /**
     * Distinct javac {@code File.java:[line,col] message} locations in the
     * order they appear in the diagnostic. Empty when the build compiled.
     */
    public List<CompileLocation> compileLocations() {
        if (!hasCompileError()) return List.of();
        Set<CompileLocation> found = new LinkedHashSet<>();
        Matcher m = JAVAC_LOCATION.matcher(diagnostic);
        while (m.find()) {
            found.add(new CompileLocation(
                    m.group(1).replace('\\', '/'),
                    Integer.parseInt(m.group(2)),
                    m.group(3).strip()));
        }
        return List.copyOf(found);
    }

    /** First non-blank line of the diagnostic; used in logs and commit messages. */
    public String headline() {
        if (ok) return "BUILD SUCCESS";
        return diagnostic.lines()
                .map(String::strip)
                .filter(l -> !l.isEmpty())
                .findFirst()
                .orElse("BUILD FAILURE");
    }

    /**
     * @param path    file path as printed by javac (absolute or workspace-relative)
     * @param line    1-based line number
     * @param message compiler message following the location, may be empty
     */
    public record CompileLocation(String path, int line, String message) {}
}
