package com.resumeai.infrastructure.ai.lexicon;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.resumeai.infrastructure.config.RewriteProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Loads the lexicon JSON tables into an immutable {@link RewriteLexicon}.
 * Loaded once per process; the result is safe for unsynchronized concurrent reads.
 */
@Slf4j
@Configuration
public class LexiconLoader {

    @Bean
    public RewriteLexicon rewriteLexicon(RewriteProperties properties) {
        return load(new ObjectMapper(), properties.lexicon());
    }

    /**
     * Load the bundled default lexicon without a Spring context.
     */
    public static RewriteLexicon loadDefault() {
        return load(new ObjectMapper(), RewriteProperties.defaults().lexicon());
    }

    public static RewriteLexicon load(ObjectMapper objectMapper, RewriteProperties.Lexicon locations) {
        JsonNode verbs = read(objectMapper, locations.verbMapping());
        JsonNode fluff = read(objectMapper, locations.fluffPhrases());
        JsonNode metrics = read(objectMapper, locations.metricPatterns());
        JsonNode tech = read(objectMapper, locations.techTerms());

        Map<String, RewriteLexicon.VerbMapping> weakVerbs = new LinkedHashMap<>();
        verbs.path("weak_verbs").fields().forEachRemaining(entry -> {
            Map<String, String> hints = new LinkedHashMap<>();
            entry.getValue().path("context_hints").fields()
                    .forEachRemaining(h -> hints.put(h.getKey().toLowerCase(Locale.ROOT), h.getValue().asText()));
            weakVerbs.put(entry.getKey().toLowerCase(Locale.ROOT), new RewriteLexicon.VerbMapping(
                    List.copyOf(strings(entry.getValue().path("upgrades"))),
                    Collections.unmodifiableMap(hints)));
        });

        Map<String, String> verbForms = new LinkedHashMap<>();
        verbs.path("verb_forms").fields()
                .forEachRemaining(e -> verbForms.put(e.getKey().toLowerCase(Locale.ROOT), e.getValue().asText().toLowerCase(Locale.ROOT)));

        List<Pattern> passivePatterns = strings(verbs.path("passive_patterns")).stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .toList();

        Map<FluffCategory, List<String>> fluffPhrases = new EnumMap<>(FluffCategory.class);
        Map<String, String> fluffReplacements = new LinkedHashMap<>();
        JsonNode categories = fluff.path("categories");
        for (FluffCategory category : FluffCategory.values()) {
            JsonNode node = categories.path(category.key());
            if (node.isObject()) {
                Map<String, String> replacements = new LinkedHashMap<>();
                node.fields().forEachRemaining(e -> replacements.put(e.getKey().toLowerCase(Locale.ROOT), e.getValue().asText()));
                fluffPhrases.put(category, List.copyOf(replacements.keySet()));
                fluffReplacements.putAll(replacements);
            } else {
                fluffPhrases.put(category, lowerCase(strings(node)));
            }
        }

        Map<String, Pattern> metricPatterns = new LinkedHashMap<>();
        metrics.path("patterns").fields()
                .forEachRemaining(e -> metricPatterns.put(e.getKey(), Pattern.compile(e.getValue().asText(), Pattern.CASE_INSENSITIVE)));

        Map<String, List<String>> toolRelevance = new LinkedHashMap<>();
        tech.path("tool_relevance").fields()
                .forEachRemaining(e -> toolRelevance.put(e.getKey().toLowerCase(Locale.ROOT), lowerCase(strings(e.getValue()))));

        RewriteLexicon lexicon = new RewriteLexicon(
                Collections.unmodifiableMap(weakVerbs),
                lowerCase(strings(verbs.path("weak_start_phrases"))),
                Collections.unmodifiableSet(new LinkedHashSet<>(lowerCase(strings(verbs.path("strong_verbs"))))),
                Collections.unmodifiableMap(verbForms),
                passivePatterns,
                Collections.unmodifiableMap(fluffPhrases),
                Collections.unmodifiableMap(fluffReplacements),
                Collections.unmodifiableMap(metricPatterns),
                lowerCase(strings(metrics.path("implied_metrics"))),
                lowerCase(strings(metrics.path("scale_claims"))),
                Collections.unmodifiableSet(new LinkedHashSet<>(lowerCase(strings(tech.path("tech_terms"))))),
                Collections.unmodifiableMap(toolRelevance),
                Collections.unmodifiableSet(new LinkedHashSet<>(lowerCase(strings(tech.path("company_stop_words"))))),
                Collections.unmodifiableSet(new LinkedHashSet<>(lowerCase(strings(tech.path("title_words")))))
        );

        log.info("Lexicon loaded - weak verbs: {}, fluff phrases: {}, metric patterns: {}, tech terms: {}",
                weakVerbs.size(),
                fluffPhrases.values().stream().mapToInt(List::size).sum(),
                metricPatterns.size(),
                lexicon.techTerms().size());
        return lexicon;
    }

    private static JsonNode read(ObjectMapper objectMapper, String location) {
        try (InputStream in = new ClassPathResource(location).getInputStream()) {
            return objectMapper.readTree(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load lexicon resource: " + location, e);
        }
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        array.forEach(node -> values.add(node.asText()));
        return values;
    }

    private static List<String> lowerCase(List<String> values) {
        return values.stream().map(v -> v.toLowerCase(Locale.ROOT).trim()).toList();
    }
}
