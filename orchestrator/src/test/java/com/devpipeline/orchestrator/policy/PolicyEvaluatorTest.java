package com.devpipeline.orchestrator.policy;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolicyEvaluatorTest {

    private final PolicyEvaluator evaluator = new PolicyEvaluator(PolicyEvaluator.DEFAULT_THRESHOLD);

    private static Policy policy(List<String> goals, List<String> scopeOut, List<String> constraints) {
        return new Policy(goals, List.of("Workflow orchestration"), scopeOut, constraints, Set.of());
    }

    // ------------------------------------------------------------------
    // Rejections
    // ------------------------------------------------------------------

    @Test
    void evaluate_scopeOutMatchedThroughStems_rejects() {
        Policy policy = policy(List.of(), List.of("payment processing"), List.of());

        Alignment result = evaluator.evaluate("add a payment processor integration", policy);

        assertThat(result.aligned()).isFalse();
        assertThat(result.violations()).containsExactly("scope-out: payment processing");
        assertThat(result.confidence()).isEqualTo(1.0);
    }

    @Test
    void evaluate_scopeOutVerbatim_rejects() {
        Policy policy = policy(List.of(), List.of("Mobile applications"), List.of());

        Alignment result = evaluator.evaluate("Build mobile applications for the dashboard", policy);

        assertThat(result.aligned()).isFalse();
        assertThat(result.reasoning()).contains("scope-out: Mobile applications");
    }

    @Test
    void evaluate_prohibitiveConstraint_rejects() {
        Policy policy = policy(List.of(), List.of(), List.of("Never commit secrets or credentials"));

        Alignment result = evaluator.evaluate("commit the API secrets and credentials to the repo", policy);

        assertThat(result.aligned()).isFalse();
        assertThat(result.violations()).containsExactly("constraint: Never commit secrets or credentials");
    }

    // ------------------------------------------------------------------
    // Acceptances
    // ------------------------------------------------------------------

    @Test
    void evaluate_noScopeOutMatch_allowsByDefault() {
        Policy policy = policy(List.of("Reliable stage orchestration"), List.of("payment processing"), List.of());

        Alignment result = evaluator.evaluate("fix a typo in a comment", policy);

        assertThat(result.aligned()).isTrue();
        assertThat(result.violations()).isEmpty();
        assertThat(result.matchingGoals()).isEmpty();
    }

    @Test
    void evaluate_partialOverlapBelowThreshold_allows() {
        Policy policy = policy(List.of(), List.of("payment processing"), List.of());

        Alignment result = evaluator.evaluate("speed up data processing", policy);

        assertThat(result.aligned()).isTrue();
    }

    @Test
    void evaluate_nonProhibitiveConstraint_isNotAViolation() {
        Policy policy = policy(List.of(), List.of(), List.of("Use PostgreSQL for persistence"));

        Alignment result = evaluator.evaluate("use postgresql for persistence of sessions", policy);

        assertThat(result.aligned()).isTrue();
    }

    @Test
    void evaluate_goalMatch_reportedWithConfidence() {
        Policy policy = policy(List.of("Reliable stage orchestration", "Faster builds"), List.of(), List.of());

        Alignment result = evaluator.evaluate("improve reliable stage orchestration logging", policy);

        assertThat(result.aligned()).isTrue();
        assertThat(result.matchingGoals()).containsExactly("Reliable stage orchestration");
        assertThat(result.confidence()).isEqualTo(1.0);
        assertThat(result.reasoning()).startsWith("Request serves goals");
    }

    @Test
    void evaluate_nullPolicy_failsOpen() {
        Alignment result = evaluator.evaluate("anything at all", null);

        assertThat(result.aligned()).isTrue();
        assertThat(result.confidence()).isZero();
        assertThat(result.reasoning()).startsWith("no policy available");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    @Test
    void prohibitedPhrase_stripsQualifierAndPrefix() {
        assertThat(PolicyEvaluator.prohibitedPhrase("No external message brokers (the database is the queue)"))
                .isEqualTo("external message brokers");
        assertThat(PolicyEvaluator.prohibitedPhrase("Must not disable quality gates - ever"))
                .isEqualTo("disable quality gates");
        assertThat(PolicyEvaluator.prohibitedPhrase("Prefer small commits")).isNull();
    }

    @Test
    void constructor_thresholdOutOfRange_throws() {
        assertThatThrownBy(() -> new PolicyEvaluator(0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PolicyEvaluator(1.5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void stem_handlesCommonSuffixes() {
        assertThat(TextMatcher.stem("processing")).isEqualTo("process");
        assertThat(TextMatcher.stem("processor")).isEqualTo("process");
        assertThat(TextMatcher.stem("policies")).isEqualTo("policy");
        assertThat(TextMatcher.stem("gates")).isEqualTo("gate");
        assertThat(TextMatcher.stem("bus")).isEqualTo("bus");
    }
}
