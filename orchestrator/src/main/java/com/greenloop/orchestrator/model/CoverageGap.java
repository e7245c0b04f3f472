package com.greenloop.orchestrator.model;

import java.util.List;

/**
 * Lines of one class with missed instructions.
 *
 * @param sourceClass    fully-qualified class name, e.g. {@code com.acme.Parser}
 * @param uncoveredLines ascending line numbers as reported
 */
public record CoverageGap(String sourceClass, List<Integer> uncoveredLines) {

    public CoverageGap {
        uncoveredLines = uncoveredLines == null ? List.of() : List.copyOf(uncoveredLines);
    }
}
