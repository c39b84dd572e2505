package com.devpipeline.orchestrator.policy;

import java.util.List;

/**
 * Verdict of the policy evaluator for one request.
 *
 * @param aligned       false only when a scope-out entry or prohibitive constraint matched
 * @param confidence    0..1; strength of the best match behind the verdict
 * @param matchingGoals goals the request clearly serves
 * @param violations    "scope-out: ..." / "constraint: ..." entries that blocked the request
 * @param reasoning     human-readable explanation, stored with the alignment artifact
 */
public record Alignment(
        boolean      aligned,
        double       confidence,
        List<String> matchingGoals,
        List<String> violations,
        String       reasoning) {

    public Alignment {
        matchingGoals = List.copyOf(matchingGoals);
        violations    = List.copyOf(violations);
    }

    /** Fail-open verdict used when no usable policy document exists. */
    public static Alignment noPolicy(String detail) {
        return new Alignment(true, 0.0, List.of(), List.of(),
                "no policy available (" + detail + "); request allowed by default");
    }
}
