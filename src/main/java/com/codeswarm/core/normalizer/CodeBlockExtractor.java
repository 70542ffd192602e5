package com.codeswarm.core.normalizer;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls fenced code out of a model response.
 */
public final class CodeBlockExtractor {

    // ```python ... ``` or ``` ... ``` with any language label
    private static final Pattern FENCED_BLOCK = Pattern.compile(
            "```[\\w+-]*[ \\t]*\\r?\\n(.*?)```",
            Pattern.DOTALL
    );

    private CodeBlockExtractor() {}

    /** First fenced block, stripped. Empty when the response has no fence. */
    public static Optional<String> firstBlock(String response) {
        if (response == null) return Optional.empty();
        Matcher m = FENCED_BLOCK.matcher(response);
        return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
    }

    /**
     * Fenced block when present, otherwise the whole response stripped.
     * Models asked for a bare file often skip the fence.
     */
    public static String codeOrWhole(String response) {
        if (response == null) return "";
        return firstBlock(response).orElse(response.strip());
    }
}
