package com.greenloop.orchestrator.toolbox.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.greenloop.orchestrator.model.RepositoryState;

/** Response from POST /git/status; porcelain is the raw {@code git status --porcelain} text. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitStatusResponse(boolean clean, String porcelain) {

    public RepositoryState toRepositoryState() {
        return clean ? RepositoryState.cleanTree() : RepositoryState.dirty(porcelain);
    }
}
