package com.codeswarm.core.normalizer;

import com.codeswarm.core.plan.Issue;
import com.codeswarm.core.plan.IssueCategory;
import com.codeswarm.core.plan.Severity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * IssueNormalizer - converts loosely structured worker output into Issues.
 *
 * Extraction order:
 *   1. Structured: the first complete JSON object (balanced-brace scan) that
 *      carries an "issues" array. Entries may be objects, JSON-encoded
 *      strings, or plain strings.
 *   2. Fallback: lines starting with a list marker become UNKNOWN/LOW issues.
 *   3. Empty: nothing recoverable. Reported as partial, never thrown.
 *
 * The normalizer never throws on bad input.
 */
@Component
public class IssueNormalizer {

    private static final Logger log = LoggerFactory.getLogger(IssueNormalizer.class);

    // Candidate objects tried before giving up on the structured path
    private static final int MAX_JSON_CANDIDATES = 20;

    // Characters of the bad response echoed back in a reformat request
    private static final int REFORMAT_ECHO_LIMIT = 2000;

    private static final Pattern LIST_ITEM =
            Pattern.compile("^\\s*(?:[-*•]|\\d+[.)])\\s+(.+?)\\s*$");

    private final ObjectMapper mapper;

    public IssueNormalizer() {
        this.mapper = new ObjectMapper();
    }

    // =========================================================================
    // Public API
    // =========================================================================

    public NormalizationResult normalize(String raw, String resource) {
        if (raw == null || raw.isBlank()) {
            log.warn("[Normalizer] Blank response for {}", resource);
            return NormalizationResult.empty("blank response");
        }

        Optional<List<Issue>> structured = parseStructured(raw, resource);
        if (structured.isPresent()) {
            log.debug("[Normalizer] Structured parse for {}: {} issue(s)", resource, structured.get().size());
            return NormalizationResult.structured(structured.get());
        }

        List<Issue> listed = extractListItems(raw, resource);
        if (!listed.isEmpty()) {
            log.info("[Normalizer] No JSON issues for {}; recovered {} list item(s)", resource, listed.size());
            return NormalizationResult.fallback(listed);
        }

        log.warn("[Normalizer] Nothing recoverable for {} ({} chars)", resource, raw.length());
        return NormalizationResult.empty("no JSON object or list items");
    }

    /**
     * Normalize, asking once for a strict-JSON rewrite when the first response
     * failed to parse but evidently tried to be JSON (a literal '{' is present).
     *
     * The reformatter receives the reformat prompt and returns the new raw
     * response. It is called at most once. If the second response does not
     * parse either, the first response's fallback result is accepted.
     */
    public NormalizationResult normalizeWithRemediation(
            String                raw,
            String                resource,
            UnaryOperator<String> reformatter
    ) {
        NormalizationResult first = normalize(raw, resource);
        if (first.isStructured() || raw == null || raw.indexOf('{') < 0 || reformatter == null) {
            return first;
        }

        log.warn("[Normalizer] Malformed JSON for {} → requesting strict reformat", resource);

        String second;
        try {
            second = reformatter.apply(buildReformatPrompt(raw));
        } catch (RuntimeException e) {
            log.warn("[Normalizer] Reformat request failed for {}: {}", resource, e.getMessage());
            return first;
        }

        NormalizationResult retried = normalize(second, resource);
        if (retried.isStructured()) {
            log.info("[Normalizer] Reformat succeeded for {}: {} issue(s)", resource, retried.getIssues().size());
            return retried.markReformatted();
        }

        log.warn("[Normalizer] Reformat still unparsable for {}; keeping {} result", resource, first.getKind());
        return first;
    }

    /** Canonical JSON form of a resource's issues. Normalizing it yields the same issues. */
    public String toCanonicalJson(List<Issue> issues) {
        ObjectNode root  = mapper.createObjectNode();
        ArrayNode  array = root.putArray("issues");
        for (Issue issue : issues) {
            ObjectNode node = array.addObject();
            node.put("type", issue.getCategory().name());
            node.put("line", issue.getLine());
            node.put("severity", issue.getSeverity().name());
            node.put("description", issue.getDescription());
            if (issue.getFixInstruction() != null) {
                node.put("fix_instruction", issue.getFixInstruction());
            }
        }
        try {
            return mapper.writeValueAsString(root);
        } catch (Exception e) {
            throw new IllegalStateException("Could not serialise issues", e);
        }
    }

    public static String buildReformatPrompt(String badResponse) {
        String echoed = badResponse.length() > REFORMAT_ECHO_LIMIT
                ? badResponse.substring(0, REFORMAT_ECHO_LIMIT)
                : badResponse;
        return """
                The previous response was not valid JSON.
                Reformat the exact content of that reply as a single VALID JSON object matching:
                {"summary": "...", "issues": [{"line": 0, "type": "BUG", "severity": "HIGH", "description": "...", "fix_instruction": "..."}], "global_recommendation": "..."}
                Return ONLY the JSON object and nothing else.

                Previous response:
                %s
                """.formatted(echoed);
    }

    // =========================================================================
    // Structured path
    // =========================================================================

    private Optional<List<Issue>> parseStructured(String raw, String resource) {
        int from = 0;
        for (int attempt = 0; attempt < MAX_JSON_CANDIDATES; attempt++) {
            int start = raw.indexOf('{', from);
            if (start < 0) break;

            Optional<String> candidate = BalancedJsonScanner.firstObject(raw, start);
            if (candidate.isPresent()) {
                Optional<List<Issue>> issues = readIssuesObject(candidate.get(), resource);
                if (issues.isPresent()) return issues;
            }
            from = start + 1;
        }
        return Optional.empty();
    }

    private Optional<List<Issue>> readIssuesObject(String json, String resource) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (Exception e) {
            log.debug("[Normalizer] Candidate object rejected: {}", e.getMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject()) return Optional.empty();

        JsonNode issuesNode = root.get("issues");
        if (issuesNode == null || !issuesNode.isArray()) return Optional.empty();

        List<Issue> issues = new ArrayList<>();
        for (JsonNode entry : issuesNode) {
            toIssue(entry, resource).ifPresent(issues::add);
        }
        return Optional.of(issues);
    }

    private Optional<Issue> toIssue(JsonNode entry, String resource) {
        if (entry == null || entry.isNull()) return Optional.empty();

        if (entry.isTextual()) {
            String text = entry.asText().trim();
            if (text.startsWith("{")) {
                try {
                    JsonNode nested = mapper.readTree(text);
                    if (nested != null && nested.isObject()) return fromObject(nested, resource);
                } catch (Exception e) {
                    log.debug("[Normalizer] Issue string is not JSON, keeping as text");
                }
            }
            return text.isEmpty() ? Optional.empty() : Optional.of(Issue.freeText(resource, text));
        }

        return entry.isObject() ? fromObject(entry, resource) : Optional.empty();
    }

    private Optional<Issue> fromObject(JsonNode node, String resource) {
        String description = firstText(node, "description", "message");
        if (description == null || description.isBlank()) {
            log.debug("[Normalizer] Dropping issue without description in {}", resource);
            return Optional.empty();
        }
        return Optional.of(new Issue(
                resource,
                readLine(node.get("line")),
                IssueCategory.fromLabel(firstText(node, "type", "category")),
                Severity.fromLabel(firstText(node, "severity", "priority")),
                description,
                firstText(node, "fix_instruction", "fixInstruction", "suggestion")
        ));
    }

    private static String firstText(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && !value.isNull()) {
                String text = value.asText();
                if (!text.isBlank()) return text;
            }
        }
        return null;
    }

    private static int readLine(JsonNode node) {
        if (node == null || node.isNull()) return 0;
        if (node.canConvertToInt()) return Math.max(0, node.asInt());
        try {
            return Math.max(0, Integer.parseInt(node.asText().trim()));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    // =========================================================================
    // Fallback path
    // =========================================================================

    private List<Issue> extractListItems(String raw, String resource) {
        List<Issue> issues = new ArrayList<>();
        for (String line : raw.split("\\R")) {
            Matcher m = LIST_ITEM.matcher(line);
            if (m.matches()) {
                String text = m.group(1).trim();
                if (!text.isEmpty()) issues.add(Issue.freeText(resource, text));
            }
        }
        return issues;
    }
}
