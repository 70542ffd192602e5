package com.codeswarm.core.normalizer;

import java.util.Optional;

/**
 * Locates complete JSON objects inside free-form model output.
 *
 * The scan walks forward from an opening brace, counting depth, and tracks
 * JSON string literals (including backslash escapes) so that braces inside
 * descriptions such as "dict literal {a: 1} is never closed" do not shift
 * the depth count or end the object early.
 */
public final class BalancedJsonScanner {

    private BalancedJsonScanner() {}

    /**
     * First complete object starting at or after {@code from}.
     * The object begins at the first '{' found; if that brace is never
     * balanced the result is empty.
     */
    public static Optional<String> firstObject(String text, int from) {
        if (text == null || from < 0 || from >= text.length()) return Optional.empty();

        int start = text.indexOf('{', from);
        if (start < 0) return Optional.empty();

        int end = matchingBrace(text, start);
        return end < 0 ? Optional.empty() : Optional.of(text.substring(start, end + 1));
    }

    public static Optional<String> firstObject(String text) {
        return firstObject(text, 0);
    }

    /**
     * Index of the brace closing the object opened at {@code start}, or -1.
     */
    static int matchingBrace(String text, int start) {
        int     depth    = 0;
        boolean inString = false;
        boolean escaped  = false;

        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);

            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }

            switch (c) {
                case '"' -> inString = true;
                case '{' -> depth++;
                case '}' -> {
                    depth--;
                    if (depth == 0) return i;
                }
                default -> { }
            }
        }
        return -1;
    }
}
