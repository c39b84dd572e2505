package com.devpipeline.orchestrator.policy;

import java.util.List;

/**
 * Aggregate of alignment decisions over a time range.
 *
 * @param approvalRate      approved / total, 0 when there are no decisions
 * @param averageConfidence mean confidence of all decisions, 0 when there are none
 */
public record AlignmentStats(
        int    totalDecisions,
        int    approvedCount,
        int    rejectedCount,
        double approvalRate,
        double averageConfidence,
        int    constraintViolationCount,
        int    scopeViolationCount) {

    public static AlignmentStats of(List<AlignmentDecision> decisions) {
        int total    = decisions.size();
        int approved = (int) decisions.stream().filter(AlignmentDecision::aligned).count();
        double confidence = decisions.stream().mapToDouble(AlignmentDecision::confidence).average().orElse(0.0);
        return new AlignmentStats(
                total,
                approved,
                total - approved,
                total == 0 ? 0.0 : (double) approved / total,
                confidence,
                (int) decisions.stream().filter(AlignmentDecision::violatesConstraint).count(),
                (int) decisions.stream().filter(AlignmentDecision::violatesScope).count());
    }
}
