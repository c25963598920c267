package com.resumeai.domain.rewrite.model;

import java.util.ArrayList;
import java.util.List;

public record RewritePlan(
        RewriteGoal goal,
        List<String> issues,
        List<MicroAction> transformations,
        RewriteConstraints constraints,
        List<UserInputRequest> needsUserInput
) {
    public RewritePlan {
        issues = issues == null ? List.of() : List.copyOf(issues);
        transformations = transformations == null ? List.of() : List.copyOf(transformations);
        needsUserInput = needsUserInput == null ? List.of() : List.copyOf(needsUserInput);
    }

    public boolean hasAction(MicroActionType type) {
        return transformations.stream().anyMatch(t -> t.type() == type);
    }

    public List<MicroActionType> actionTypes() {
        return transformations.stream().map(MicroAction::type).toList();
    }

    public List<MicroAction> actionsOf(MicroActionType type) {
        return transformations.stream().filter(t -> t.type() == type).toList();
    }

    public RewritePlan withAction(MicroAction action) {
        List<MicroAction> actions = new ArrayList<>(transformations);
        actions.add(action);
        return new RewritePlan(goal, issues, actions, constraints, needsUserInput);
    }
}
