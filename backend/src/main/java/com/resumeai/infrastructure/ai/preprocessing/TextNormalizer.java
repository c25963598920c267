package com.resumeai.infrastructure.ai.preprocessing;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Normalizes resume text before evidence is built from it:
 * - Unicode NFC normalization
 * - Invisible/control character removal
 * - Whitespace normalization (non-breaking spaces, runs, trim)
 */
@Component
public class TextNormalizer {

    // Zero-width and invisible Unicode characters
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    // Control characters except common whitespace (\n, \r, \t)
    private static final Pattern CONTROL_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]"
    );

    private static final Pattern NBSP = Pattern.compile("[\\u00A0\\u2007\\u202F]");

    private static final Pattern MULTIPLE_SPACES = Pattern.compile("[ \\t]{2,}");

    private static final Pattern ANY_WHITESPACE_RUN = Pattern.compile("\\s+");

    private static final Pattern EXCESSIVE_NEWLINES = Pattern.compile("\\n{3,}");

    /**
     * Normalize multi-line text (summaries). Paragraph breaks are kept.
     *
     * @param text raw input
     * @return normalized text
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        String result = Normalizer.normalize(text, Normalizer.Form.NFC);
        result = INVISIBLE_CHARS.matcher(result).replaceAll("");
        result = CONTROL_CHARS.matcher(result).replaceAll("");
        result = NBSP.matcher(result).replaceAll(" ");
        result = result.replace("\r\n", "\n").replace("\r", "\n");
        result = MULTIPLE_SPACES.matcher(result).replaceAll(" ");
        result = EXCESSIVE_NEWLINES.matcher(result).replaceAll("\n\n");

        return result.strip();
    }

    /**
     * Normalize a single bullet: everything collapses onto one line.
     */
    public String normalizeBullet(String text) {
        String result = normalize(text);
        if (result == null || result.isEmpty()) {
            return result;
        }
        return ANY_WHITESPACE_RUN.matcher(result).replaceAll(" ");
    }

    public List<String> normalizeBullets(List<String> bullets) {
        return bullets.stream()
                .map(this::normalizeBullet)
                .toList();
    }
}
