package com.greenloop.orchestrator.toolbox.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.greenloop.orchestrator.model.BuildStatus;

/**
 * Response from POST /build.
 *
 * status is "SUCCESS" or "FAILURE"; output holds the tail of the build log.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BuildResponse(String status, String output) {

    public BuildStatus toBuildStatus() {
        if ("SUCCESS".equalsIgnoreCase(status)) {
            return BuildStatus.success();
        }
        return BuildStatus.failed(output != null ? output : "BUILD FAILURE");
    }
}
