package com.resumeai.domain.rewrite.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One planned atomic transformation.
 *
 * @param type        transformation kind
 * @param data        type-specific payload (e.g. from/to for a verb upgrade)
 * @param evidenceIds ledger ids backing the action, mandatory for surfacing actions
 */
public record MicroAction(
        MicroActionType type,
        Map<String, String> data,
        List<String> evidenceIds
) {
    public MicroAction {
        if (type == null) {
            throw new IllegalArgumentException("Micro-action type is required");
        }
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        evidenceIds = evidenceIds == null ? List.of() : List.copyOf(evidenceIds);
        if (type.requiresEvidence() && evidenceIds.isEmpty()) {
            throw new IllegalArgumentException(type.value() + " action requires at least one evidence id");
        }
    }

    public static MicroAction verbUpgrade(String from, List<String> upgrades) {
        Map<String, String> data = new LinkedHashMap<>();
        data.put("from", from);
        data.put("to", upgrades.get(0));
        if (upgrades.size() > 1) {
            data.put("alternatives", String.join(", ", upgrades.subList(1, upgrades.size())));
        }
        return new MicroAction(MicroActionType.VERB_UPGRADE, data, List.of());
    }

    public static MicroAction fluffRemoval(List<String> terms) {
        return new MicroAction(MicroActionType.FLUFF_REMOVAL, Map.of("terms", String.join(", ", terms)), List.of());
    }

    public static MicroAction toolSurfacing(String tool, String evidenceId) {
        return new MicroAction(MicroActionType.TOOL_SURFACING, Map.of("tool", tool), List.of(evidenceId));
    }

    public static MicroAction metricSurfacing(String metric, List<String> evidenceIds) {
        return new MicroAction(MicroActionType.METRIC_SURFACING, Map.of("metric", metric), evidenceIds);
    }

    public static MicroAction specificity(String specificityType, String hint) {
        return new MicroAction(MicroActionType.SPECIFICITY_INCREASE,
                Map.of("specificity_type", specificityType, "hint", hint), List.of());
    }

    public static MicroAction roleTailoring(String targetRole, List<String> evidenceIds) {
        return new MicroAction(MicroActionType.ROLE_TAILORING, Map.of("role", targetRole), evidenceIds);
    }

    public static MicroAction tenseAlign(Tense tense) {
        return new MicroAction(MicroActionType.TENSE_ALIGN, Map.of("tense", tense.value()), List.of());
    }

    public String get(String key) {
        return data.getOrDefault(key, "");
    }
}
