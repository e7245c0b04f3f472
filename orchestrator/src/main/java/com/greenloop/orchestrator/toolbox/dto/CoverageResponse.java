package com.greenloop.orchestrator.toolbox.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.greenloop.orchestrator.model.CoverageGap;

import java.util.List;

/**
 * Response from POST /reports/coverage: classes with missed lines.
 * class_name is dotted ("com.acme.Parser"), lines ascending.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CoverageResponse(List<Gap> gaps) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Gap(String class_name, List<Integer> uncovered_lines) {}

    public List<CoverageGap> toCoverageGaps() {
        if (gaps == null) return List.of();
        return gaps.stream()
                .map(g -> new CoverageGap(g.class_name(), g.uncovered_lines()))
                .toList();
    }
}
