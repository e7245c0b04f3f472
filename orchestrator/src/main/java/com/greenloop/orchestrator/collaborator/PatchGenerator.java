package com.greenloop.orchestrator.collaborator;

import com.greenloop.orchestrator.model.RemediationTarget;

/**
 * Produces the new full content of one file for a remediation target.
 *
 * The loop treats the result as opaque: it neither validates that the change
 * fixes the target nor computes it.
 */
public interface PatchGenerator {

    /**
     * @param target          the problem to address
     * @param path            file that will receive the returned content
     * @param currentContent  current content of {@code path}; empty for a new file
     * @param companionPath   related file given as context (class under test, failing test), or null
     * @param companionContent content of {@code companionPath}, or null
     * @param diagnostic      what the harness reported: compiler output, failure message and trace
     */
    record PatchRequest(
            RemediationTarget target,
            String path,
            String currentContent,
            String companionPath,
            String companionContent,
            String diagnostic) {}

    /** @throws GenerationException if no usable content could be produced */
    String generate(PatchRequest request);
}
