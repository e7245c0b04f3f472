package com.greenloop.orchestrator.generation;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the new file content out of a model reply.
 *
 * The prompts ask for the complete file in a single ```java fence. Replies
 * that use an unlabelled fence are accepted too; anything outside the first
 * fence is commentary and dropped.
 */
public class ResponseParser {

    // ```java ... ``` or ``` ... ```
    private static final Pattern CODE_BLOCK = Pattern.compile(
            "```(?:java)?[ \\t]*\\r?\\n(.*?)\\r?\\n```",
            Pattern.DOTALL
    );

    private static final Pattern NO_CHANGE = Pattern.compile(
            "<no-change\\s*/?>",
            Pattern.CASE_INSENSITIVE
    );

    private ResponseParser() {}

    /** First fenced block, without its fence lines; empty when the reply has none. */
    public static Optional<String> extractCodeBlock(String response) {
        if (response == null) return Optional.empty();
        Matcher m = CODE_BLOCK.matcher(response);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    /** True when the model answered with the {@code <no-change/>} marker instead of a file. */
    public static boolean declinedChange(String response) {
        return response != null && NO_CHANGE.matcher(response).find();
    }
}
