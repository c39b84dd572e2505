package com.devpipeline.orchestrator.policy;

import java.util.List;
import java.util.Set;

/**
 * Parsed strategic policy document.
 *
 * @param goals           what the project is trying to achieve
 * @param scopeIn         explicitly included areas of work
 * @param scopeOut        explicitly excluded areas; a match blocks the request
 * @param constraints     rules the work must respect; prohibitive ones can block
 * @param skippableStages stages the policy allows the pipeline to skip
 */
public record Policy(
        List<String> goals,
        List<String> scopeIn,
        List<String> scopeOut,
        List<String> constraints,
        Set<String>  skippableStages) {

    public Policy {
        goals           = List.copyOf(goals);
        scopeIn         = List.copyOf(scopeIn);
        scopeOut        = List.copyOf(scopeOut);
        constraints     = List.copyOf(constraints);
        skippableStages = Set.copyOf(skippableStages);
    }

    public boolean isEmpty() {
        return goals.isEmpty() && scopeIn.isEmpty() && scopeOut.isEmpty() && constraints.isEmpty();
    }
}
