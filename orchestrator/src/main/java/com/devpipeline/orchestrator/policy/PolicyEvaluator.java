package com.devpipeline.orchestrator.policy;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a request is aligned with the policy document.
 *
 * Default-deny only on an explicit exclusion: the request is rejected when a
 * scope-out entry, or a prohibitive constraint ("no ...", "never ...",
 * "must not ..."), matches with a score at or above the threshold. Anything
 * else, including requests that match no goal at all, is allowed.
 *
 * Pure function of its inputs; persisting the verdict is the coordinator's job.
 */
@Component
public class PolicyEvaluator {

    public static final double DEFAULT_THRESHOLD = 0.8;

    public static final String SCOPE_OUT_PREFIX  = "scope-out: ";
    public static final String CONSTRAINT_PREFIX = "constraint: ";

    // Goals scoring at least this much are reported as matching.
    private static final double GOAL_MATCH = 0.5;

    private static final Pattern PROHIBITION = Pattern.compile(
            "^(?:no|never|must not|mustn't|do not|don't|shall not|cannot|avoid)\\s+(.+)$",
            Pattern.CASE_INSENSITIVE);

    private final double threshold;

    public PolicyEvaluator(@Value("${devpipeline.policy.threshold:0.8}") double threshold) {
        if (threshold <= 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Policy threshold must be in (0, 1]: " + threshold);
        }
        this.threshold = threshold;
    }

    /**
     * @param request free-text description of the requested work
     * @param policy  parsed policy, or null when none is available (fails open)
     */
    public Alignment evaluate(String request, Policy policy) {
        if (policy == null) {
            return Alignment.noPolicy("policy document missing");
        }
        if (policy.isEmpty()) {
            return Alignment.noPolicy("policy document has no entries");
        }
        String text = request == null ? "" : request;

        List<String> violations = new ArrayList<>();
        double worst = 0.0;
        for (String excluded : policy.scopeOut()) {
            double score = TextMatcher.score(excluded, text);
            if (score >= threshold) {
                violations.add(SCOPE_OUT_PREFIX + excluded);
                worst = Math.max(worst, score);
            }
        }
        for (String constraint : policy.constraints()) {
            String prohibited = prohibitedPhrase(constraint);
            if (prohibited == null) {
                continue;
            }
            double score = TextMatcher.score(prohibited, text);
            if (score >= threshold) {
                violations.add(CONSTRAINT_PREFIX + constraint);
                worst = Math.max(worst, score);
            }
        }
        if (!violations.isEmpty()) {
            return new Alignment(false, round(worst), List.of(), violations,
                    "Request matches excluded scope or violates constraints: " + String.join("; ", violations));
        }

        List<String> matchingGoals = new ArrayList<>();
        double best = 0.0;
        for (String goal : policy.goals()) {
            double score = TextMatcher.score(goal, text);
            if (score >= GOAL_MATCH) {
                matchingGoals.add(goal);
            }
            best = Math.max(best, score);
        }
        for (String included : policy.scopeIn()) {
            best = Math.max(best, TextMatcher.score(included, text));
        }

        String reasoning = matchingGoals.isEmpty()
                ? "No scope-out or constraint match; allowed by default (best goal/scope match %.2f)".formatted(best)
                : "Request serves goals: " + String.join("; ", matchingGoals);
        return new Alignment(true, round(best), matchingGoals, List.of(), reasoning);
    }

    /** The phrase a prohibitive constraint forbids, or null if the constraint is not prohibitive. */
    static String prohibitedPhrase(String constraint) {
        String head = constraint.split("\\s+[-–(:]\\s*|\\s*\\(", 2)[0].trim();
        Matcher m = PROHIBITION.matcher(head.toLowerCase(Locale.ROOT));
        return m.matches() ? m.group(1).trim() : null;
    }

    private static double round(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
