package com.greenloop.orchestrator.api.dto;

/**
 * Request body for POST /runs.
 *
 * Required: workspaceRef (a workspace already cloned on the toolbox), branch
 * Optional: baseBranch, the pull-request target; defaults to "main"
 */
public record SubmitRunRequest(String workspaceRef, String branch, String baseBranch) {

    public SubmitRunRequest {
        if (baseBranch == null || baseBranch.isBlank()) baseBranch = "main";
    }
}
