package com.greenloop.orchestrator.toolbox.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.greenloop.orchestrator.model.TestFailure;

import java.util.List;

/**
 * Response from POST /reports/failures: failing and erroring test cases in
 * report order. type is "failure" or "error".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FailuresResponse(List<Failure> failures) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Failure(String test_class, String test, String type, String message, String details) {}

    public List<TestFailure> toTestFailures() {
        if (failures == null) return List.of();
        return failures.stream()
                .map(f -> new TestFailure(f.test_class(), f.test(), f.type(), f.message(), f.details()))
                .toList();
    }
}
