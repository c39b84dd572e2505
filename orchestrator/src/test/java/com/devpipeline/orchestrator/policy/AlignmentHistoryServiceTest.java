package com.devpipeline.orchestrator.policy;

import com.devpipeline.orchestrator.model.Artifact;
import com.devpipeline.orchestrator.support.InMemoryArtifactStore;
import com.devpipeline.orchestrator.support.Payloads;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AlignmentHistoryServiceTest {

    private final InMemoryArtifactStore artifacts = new InMemoryArtifactStore();
    private AlignmentHistoryService history;

    private final Instant from = Instant.EPOCH;
    private final Instant to   = Instant.now().plus(1, ChronoUnit.HOURS);

    @BeforeEach
    void setUp() {
        history = new AlignmentHistoryService(artifacts, Payloads.JSON);
    }

    private void decision(String workflowId, String payload) {
        artifacts.put(workflowId, "alignment", Artifact.completed(workflowId, "alignment", "1.0", payload, 1));
    }

    @Test
    void decisions_readsVerdictsFromAlignmentArtifactsOnly() {
        decision("wf-1", """
                {"aligned":true,"confidence":0.9,"matching_goals":["reliability"],
                 "violations":[],"reasoning":"matches goals: reliability"}
                """);
        artifacts.put("wf-1", "research",
                Artifact.completed("wf-1", "research", "1.0", Payloads.passing("research").toString(), 1));

        List<AlignmentDecision> decisions = history.decisions(from, to);

        assertThat(decisions).hasSize(1);
        AlignmentDecision d = decisions.get(0);
        assertThat(d.workflowId()).isEqualTo("wf-1");
        assertThat(d.aligned()).isTrue();
        assertThat(d.confidence()).isEqualTo(0.9);
        assertThat(d.matchingGoals()).containsExactly("reliability");
        assertThat(d.violations()).isEmpty();
        assertThat(d.reasoning()).isEqualTo("matches goals: reliability");
        assertThat(d.decidedAt()).isNotNull();
    }

    @Test
    void stats_countsApprovalsAndViolationKinds() {
        decision("wf-1", """
                {"aligned":true,"confidence":0.8,"matching_goals":["reliability"],"violations":[]}
                """);
        decision("wf-2", """
                {"aligned":false,"confidence":0.4,"matching_goals":[],
                 "violations":["%sno new dependencies"]}
                """.formatted(PolicyEvaluator.CONSTRAINT_PREFIX));
        decision("wf-3", """
                {"aligned":false,"confidence":0.3,"matching_goals":[],
                 "violations":["%srewrite the ui","%sno new dependencies"]}
                """.formatted(PolicyEvaluator.SCOPE_OUT_PREFIX, PolicyEvaluator.CONSTRAINT_PREFIX));

        AlignmentStats stats = history.stats(from, to);

        assertThat(stats.totalDecisions()).isEqualTo(3);
        assertThat(stats.approvedCount()).isEqualTo(1);
        assertThat(stats.rejectedCount()).isEqualTo(2);
        assertThat(stats.approvalRate()).isCloseTo(1.0 / 3, within(1e-9));
        assertThat(stats.averageConfidence()).isCloseTo(0.5, within(1e-9));
        assertThat(stats.constraintViolationCount()).isEqualTo(2);
        assertThat(stats.scopeViolationCount()).isEqualTo(1);
    }

    @Test
    void stats_noDecisionsInRange_zeroRates() {
        decision("wf-1", """
                {"aligned":true,"confidence":0.8}
                """);
        Instant later = Instant.now().plus(2, ChronoUnit.HOURS);

        AlignmentStats stats = history.stats(later, later.plus(1, ChronoUnit.HOURS));

        assertThat(stats.totalDecisions()).isZero();
        assertThat(stats.approvalRate()).isZero();
        assertThat(stats.averageConfidence()).isZero();
    }

    @Test
    void decisions_unreadablePayload_skipped() {
        decision("wf-1", "not json {");
        decision("wf-2", """
                {"aligned":false,"confidence":0.2}
                """);

        assertThat(history.decisions(from, to))
                .extracting(AlignmentDecision::workflowId)
                .containsExactly("wf-2");
    }

    @Test
    void decisions_fromAfterTo_rejected() {
        assertThatThrownBy(() -> history.decisions(to, from))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
