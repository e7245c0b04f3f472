package com.greenloop.orchestrator.toolbox.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Response from POST /files/read. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileContentResponse(String path, String content) {}
