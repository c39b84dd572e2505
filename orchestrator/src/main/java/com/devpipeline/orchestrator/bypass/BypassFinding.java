package com.devpipeline.orchestrator.bypass;

import java.util.Comparator;
import java.util.List;

/**
 * One detected shortcut or anomaly in a workflow's execution. Derived on
 * demand from the execution log, never stored.
 *
 * @param stageName    stage the finding is about, or null for the whole workflow
 * @param evidence     excerpts from events and payloads that triggered the finding
 */
public record BypassFinding(
        String       patternId,
        Severity     severity,
        String       workflowId,
        String       stageName,
        List<String> evidence,
        String       suggestedFix) {

    /** Novel anomalies that match no catalogued pattern. */
    public static final String NEW_BYPASS = "NEW-BYPASS";

    public static final Comparator<BypassFinding> ORDER = Comparator
            .comparing(BypassFinding::workflowId)
            .thenComparing(BypassFinding::severity)
            .thenComparing(BypassFinding::patternId)
            .thenComparing(BypassFinding::stageName, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(f -> String.join("\n", f.evidence()));

    public BypassFinding {
        evidence = List.copyOf(evidence);
    }
}
