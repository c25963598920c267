package com.resumeai.infrastructure.ai.coherence;

import com.resumeai.domain.rewrite.model.ConfidenceLevel;
import com.resumeai.domain.rewrite.model.Tense;
import com.resumeai.domain.rewrite.model.TenseDetection;
import com.resumeai.infrastructure.ai.lexicon.RewriteLexicon;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.IntStream;

/**
 * Tense detection and unification across a set of bullets. Only the leading verb is inspected or changed.
 */
@Component
public class TenseUnifier {

    private static final Pattern LEADING_WORD = Pattern.compile("^([^A-Za-z]*)([A-Za-z]+)");
    private static final double HIGH_RATIO = 0.8;
    private static final double MEDIUM_RATIO = 0.6;

    private final Set<String> strongVerbs;
    private final Map<String, String> baseToPast;
    private final Map<String, String> pastToBase;

    public TenseUnifier(RewriteLexicon lexicon) {
        this.strongVerbs = lexicon.strongVerbs();
        this.baseToPast = lexicon.verbForms();
        Map<String, String> inverse = new HashMap<>();
        lexicon.verbForms().forEach((base, past) -> inverse.putIfAbsent(past, base));
        this.pastToBase = Collections.unmodifiableMap(inverse);
    }

    public Tense detectBulletTense(String bullet) {
        Optional<String> word = leadingWord(bullet).map(w -> w.toLowerCase(Locale.ROOT));
        if (word.isEmpty()) {
            return Tense.OTHER;
        }
        String w = word.get();
        if (pastToBase.containsKey(w) || strongVerbs.contains(w)) {
            return Tense.PAST;
        }
        if (baseToPast.containsKey(w) || thirdPersonBase(w).isPresent()) {
            return Tense.PRESENT;
        }
        if (w.length() > 4 && w.endsWith("ed")) {
            return Tense.PAST;
        }
        return Tense.OTHER;
    }

    /**
     * Majority vote; ties go to past. High confidence at 80% agreement, medium at 60%.
     */
    public TenseDetection detectDominantTense(List<String> bullets) {
        int past = 0;
        int present = 0;
        for (String bullet : bullets) {
            Tense tense = detectBulletTense(bullet);
            if (tense == Tense.PAST) {
                past++;
            } else if (tense == Tense.PRESENT) {
                present++;
            }
        }
        int total = past + present;
        Tense dominant = past >= present ? Tense.PAST : Tense.PRESENT;
        ConfidenceLevel confidence = ConfidenceLevel.LOW;
        if (total > 0) {
            double ratio = (double) Math.max(past, present) / total;
            if (ratio >= HIGH_RATIO) {
                confidence = ConfidenceLevel.HIGH;
            } else if (ratio >= MEDIUM_RATIO) {
                confidence = ConfidenceLevel.MEDIUM;
            }
        }
        return new TenseDetection(dominant, confidence, past, present);
    }

    /**
     * Rewrite the leading verb into the target tense. Unknown words are left alone.
     */
    public String convertToTense(String bullet, Tense target) {
        if (bullet == null || target == Tense.OTHER) {
            return bullet;
        }
        Matcher m = LEADING_WORD.matcher(bullet);
        if (!m.find()) {
            return bullet;
        }
        String word = m.group(2);
        String lower = word.toLowerCase(Locale.ROOT);
        Optional<String> converted = target == Tense.PAST ? toPast(lower) : toPresent(lower);
        return converted
                .filter(c -> !c.equals(lower))
                .map(c -> m.group(1) + matchCase(word, c) + bullet.substring(m.end()))
                .orElse(bullet);
    }

    public List<String> unifyTense(List<String> bullets, Tense target) {
        return bullets.stream().map(b -> convertToTense(b, target)).toList();
    }

    public Unification unifyToDominant(List<String> bullets) {
        TenseDetection detection = detectDominantTense(bullets);
        List<String> unified = unifyTense(bullets, detection.tense());
        List<Integer> changed = IntStream.range(0, bullets.size())
                .filter(i -> !unified.get(i).equals(bullets.get(i)))
                .boxed()
                .toList();
        return new Unification(unified, detection, changed);
    }

    public boolean hasConsistentTense(List<String> bullets) {
        return bullets.stream()
                .map(this::detectBulletTense)
                .filter(t -> t != Tense.OTHER)
                .distinct()
                .count() <= 1;
    }

    /**
     * Indices of bullets whose detected tense disagrees with the dominant one.
     */
    public List<Integer> getInconsistentBullets(List<String> bullets) {
        Tense dominant = detectDominantTense(bullets).tense();
        return IntStream.range(0, bullets.size())
                .filter(i -> {
                    Tense tense = detectBulletTense(bullets.get(i));
                    return tense != Tense.OTHER && tense != dominant;
                })
                .boxed()
                .toList();
    }

    private Optional<String> toPast(String word) {
        if (pastToBase.containsKey(word) || strongVerbs.contains(word)) {
            return Optional.of(word);
        }
        if (baseToPast.containsKey(word)) {
            return Optional.of(baseToPast.get(word));
        }
        return thirdPersonBase(word).map(baseToPast::get);
    }

    private Optional<String> toPresent(String word) {
        if (pastToBase.containsKey(word)) {
            return Optional.of(pastToBase.get(word));
        }
        if (word.length() > 4 && word.endsWith("ed")) {
            return Optional.of(regularBase(word));
        }
        return Optional.empty();
    }

    // "manages" -> "manage", "deploys" -> "deploy", "fixes" -> "fix"
    private Optional<String> thirdPersonBase(String word) {
        if (word.length() < 4 || !word.endsWith("s")) {
            return Optional.empty();
        }
        List<String> candidates = new ArrayList<>();
        candidates.add(word.substring(0, word.length() - 1));
        if (word.endsWith("es")) {
            candidates.add(word.substring(0, word.length() - 2));
        }
        if (word.endsWith("ies")) {
            candidates.add(word.substring(0, word.length() - 3) + "y");
        }
        return candidates.stream().filter(baseToPast::containsKey).findFirst();
    }

    // Regular past to base: "unified" -> "unify", "shipped" -> "ship", "integrated" -> "integrate"
    static String regularBase(String past) {
        String stem = past.substring(0, past.length() - 2);
        if (stem.endsWith("i")) {
            return stem.substring(0, stem.length() - 1) + "y";
        }
        int n = stem.length();
        if (n >= 3 && stem.charAt(n - 1) == stem.charAt(n - 2) && "bdgmnprt".indexOf(stem.charAt(n - 1)) >= 0) {
            return stem.substring(0, n - 1);
        }
        if (stem.matches(".*(?:at|iz|ys|ur|ov|ag|ir|[cgvu])$")) {
            return stem + "e";
        }
        return stem;
    }

    private static String matchCase(String template, String word) {
        if (Character.isUpperCase(template.charAt(0))) {
            return Character.toUpperCase(word.charAt(0)) + word.substring(1);
        }
        return word;
    }

    private Optional<String> leadingWord(String bullet) {
        if (bullet == null) {
            return Optional.empty();
        }
        Matcher m = LEADING_WORD.matcher(bullet);
        return m.find() ? Optional.of(m.group(2)) : Optional.empty();
    }

    /**
     * @param changed indices of bullets whose text changed
     */
    public record Unification(List<String> bullets, TenseDetection detection, List<Integer> changed) {}
}
