package com.greenloop.orchestrator.policy;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Checks a generated file change for policy violations before it is written.
 *
 * Runs entirely in the orchestrator JVM. It enforces hard rules a generator
 * might break while chasing a green build:
 *   - No {@code @Ignore} or {@code @Disabled} annotations added (disabled tests)
 *   - No lines matching common secret patterns (API keys, passwords in code)
 *   - Change size within the configured line limit
 *
 * Added and removed lines are counted as a multiset difference between the
 * old and new file, which is enough for size limits without a full diff.
 */
public class PatchPolicy {

    public static final int DEFAULT_MAX_CHANGED_LINES = 300;

    private static final Pattern IGNORE_ANNOTATION = Pattern.compile(
            "@(Ignore|Disabled)\\b");
    private static final Pattern SECRET_PATTERN = Pattern.compile(
            "(password|api.?key|secret|token)\\s*=\\s*[\"'][^\"']{4,}[\"']",
            Pattern.CASE_INSENSITIVE);

    private final int maxChangedLines;

    public PatchPolicy(int maxChangedLines) {
        this.maxChangedLines = maxChangedLines;
    }

    public PatchPolicy() {
        this(DEFAULT_MAX_CHANGED_LINES);
    }

    public record Report(
            boolean approved,
            List<String> violations,
            int linesAdded,
            int linesRemoved) {}

    public Report check(String before, String after) {
        if (after == null || after.isBlank()) {
            return new Report(false, List.of("Empty or null content"), 0, 0);
        }

        Map<String, Integer> remaining = new HashMap<>();
        if (before != null) {
            before.lines().forEach(l -> remaining.merge(l, 1, Integer::sum));
        }

        List<String> violations = new ArrayList<>();
        int added = 0;
        for (String line : after.lines().toList()) {
            Integer left = remaining.get(line);
            if (left != null && left > 0) {
                remaining.put(line, left - 1);
                continue;
            }
            added++;
            if (IGNORE_ANNOTATION.matcher(line).find()) {
                violations.add("Disabled test annotation found: " + line.strip());
            }
            if (SECRET_PATTERN.matcher(line).find()) {
                violations.add("Potential secret in added code: " + line.strip());
            }
        }
        int removed = remaining.values().stream().mapToInt(Integer::intValue).sum();

        int totalLoc = added + removed;
        if (totalLoc > maxChangedLines) {
            violations.add("Change is %d LOC (limit: %d)".formatted(totalLoc, maxChangedLines));
        }

        return new Report(violations.isEmpty(), violations, added, removed);
    }
}
