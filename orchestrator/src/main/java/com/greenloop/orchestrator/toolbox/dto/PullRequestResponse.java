package com.greenloop.orchestrator.toolbox.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Response from POST /git/pull-request. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PullRequestResponse(String url) {}
