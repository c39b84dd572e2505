package com.devpipeline.orchestrator.policy;

import java.time.Instant;
import java.util.List;

/**
 * One recorded alignment verdict, read back from a workflow's alignment artifact.
 */
public record AlignmentDecision(
        String       workflowId,
        boolean      aligned,
        double       confidence,
        List<String> matchingGoals,
        List<String> violations,
        String       reasoning,
        Instant      decidedAt) {

    public AlignmentDecision {
        matchingGoals = List.copyOf(matchingGoals);
        violations    = List.copyOf(violations);
    }

    public boolean violatesConstraint() {
        return violations.stream().anyMatch(v -> v.startsWith(PolicyEvaluator.CONSTRAINT_PREFIX));
    }

    public boolean violatesScope() {
        return violations.stream().anyMatch(v -> v.startsWith(PolicyEvaluator.SCOPE_OUT_PREFIX));
    }
}
