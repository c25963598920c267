package com.resumeai.infrastructure.ai.parsing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.resumeai.domain.rewrite.model.EvidenceMapItem;
import com.resumeai.domain.rewrite.model.RewriteChanges;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw generation output into a structured rewrite.
 * Tolerates prose or markdown fences around the JSON object and the usual LLM JSON slips.
 */
@Slf4j
@Component
public class RewriteResponseParser {

    static final String DEFAULT_REASONING = "Changes applied as planned";

    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*\\}");
    private static final Pattern IMPROVED_FIELD = Pattern.compile("\"improved\"\\s*:\\s*\"([^\"]+)\"");
    private static final Pattern IMPROVED_PREFIX = Pattern.compile("(?i)(?:improved|rewritten|result)\\s*[:=]\\s*\"?([^\\n\"]+)");

    /**
     * Structured parse first, regex fallback second.
     *
     * @return empty when neither path finds improved text
     */
    public Optional<ParsedRewrite> parseOrFallback(String raw) {
        Optional<ParsedRewrite> parsed = parse(raw);
        if (parsed.isPresent()) {
            return parsed;
        }
        Optional<ParsedRewrite> fallback = extractImprovedTextFallback(raw)
                .map(text -> new ParsedRewrite(text, List.of(), DEFAULT_REASONING, RewriteChanges.none(), true));
        if (fallback.isPresent()) {
            log.warn("Structured parse failed, using fallback text without evidence map");
        }
        return fallback;
    }

    /**
     * Parse the first JSON object in the output. Requires a non-empty {@code improved} and an
     * {@code evidence_map} array; everything else defaults.
     */
    public Optional<ParsedRewrite> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        Matcher m = JSON_OBJECT.matcher(raw);
        if (!m.find()) {
            return Optional.empty();
        }
        try {
            JsonNode root = LENIENT_MAPPER.readTree(m.group());
            String improved = root.path("improved").asText("").trim();
            JsonNode map = root.path("evidence_map");
            if (improved.isEmpty() || !map.isArray()) {
                return Optional.empty();
            }
            String reasoning = root.path("reasoning").asText("").trim();
            return Optional.of(new ParsedRewrite(
                    improved,
                    parseEvidenceMap(map),
                    reasoning.isEmpty() ? DEFAULT_REASONING : reasoning,
                    parseChanges(root.path("changes")),
                    false));
        } catch (JsonProcessingException e) {
            log.debug("Rewrite response is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    public Optional<String> extractImprovedTextFallback(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        Matcher field = IMPROVED_FIELD.matcher(raw);
        if (field.find()) {
            return Optional.of(field.group(1).trim());
        }
        Matcher prefix = IMPROVED_PREFIX.matcher(raw);
        if (prefix.find()) {
            String text = prefix.group(1).trim();
            return text.isEmpty() ? Optional.empty() : Optional.of(text);
        }
        return Optional.empty();
    }

    private List<EvidenceMapItem> parseEvidenceMap(JsonNode map) {
        List<EvidenceMapItem> items = new ArrayList<>();
        for (JsonNode node : map) {
            List<String> ids = new ArrayList<>();
            JsonNode idsNode = node.path("evidence_ids");
            if (idsNode.isArray()) {
                idsNode.forEach(id -> ids.add(id.asText().trim()));
            } else if (idsNode.isTextual()) {
                ids.add(idsNode.asText().trim());
            }
            items.add(new EvidenceMapItem(node.path("improved_span").asText(""), ids));
        }
        return items;
    }

    private RewriteChanges parseChanges(JsonNode changes) {
        return new RewriteChanges(
                changes.path("stronger_verb").asBoolean(false),
                changes.path("added_metric").asBoolean(false),
                changes.path("more_specific").asBoolean(false),
                changes.path("removed_fluff").asBoolean(false),
                changes.path("tailored_to_role").asBoolean(false));
    }

    /**
     * @param fallback true when the text came from the regex fallback; the evidence map is then empty
     */
    public record ParsedRewrite(
            String improved,
            List<EvidenceMapItem> evidenceMap,
            String reasoning,
            RewriteChanges changes,
            boolean fallback
    ) {}
}
