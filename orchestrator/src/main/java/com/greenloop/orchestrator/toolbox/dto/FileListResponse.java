package com.greenloop.orchestrator.toolbox.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/** Response from POST /files/list: workspace-relative paths. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileListResponse(List<String> files) {}
