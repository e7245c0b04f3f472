package com.greenloop.orchestrator.generation;

import com.greenloop.orchestrator.collaborator.GenerationException;
import com.greenloop.orchestrator.collaborator.PatchGenerator;
import com.greenloop.orchestrator.config.GeneratorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * {@link PatchGenerator} backed by Claude.
 *
 * One request per pass; the first fenced block of the reply becomes the
 * full new file content.
 */
@Component
public class ClaudePatchGenerator implements PatchGenerator {

    private static final Logger log = LoggerFactory.getLogger(ClaudePatchGenerator.class);

    private final ClaudeClient claude;
    private final String       model;

    public ClaudePatchGenerator(ClaudeClient claude, GeneratorProperties properties) {
        this.claude = claude;
        this.model  = properties.getModel();
    }

    @Override
    public String generate(PatchRequest request) {
        String system = PatchPrompts.system(request.target().workflow());
        String user   = PatchPrompts.userMessage(request);

        String reply;
        try {
            reply = claude.complete(model, system, List.of(new ClaudeClient.Message("user", user)));
        } catch (RuntimeException e) {
            throw new GenerationException("Model call failed for " + request.path(), e);
        }

        if (ResponseParser.declinedChange(reply)) {
            log.info("Model declined to change {}", request.path());
            return request.currentContent();
        }
        String content = ResponseParser.extractCodeBlock(reply)
                .orElseThrow(() -> new GenerationException(
                        "Reply for " + request.path() + " contained no code block"));
        if (content.isBlank()) {
            throw new GenerationException("Reply for " + request.path() + " was an empty file");
        }
        return content.endsWith("\n") ? content : content + "\n";
    }
}
