package com.devpipeline.orchestrator.bypass;

import com.devpipeline.orchestrator.model.Artifact;
import com.devpipeline.orchestrator.model.EventType;
import com.devpipeline.orchestrator.model.ExecutionEvent;
import com.devpipeline.orchestrator.model.WorkflowStatus;
import com.devpipeline.orchestrator.stage.StageDefinition;
import com.devpipeline.orchestrator.stage.StageRegistry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Compares an execution log against the known patterns, then looks for
 * structural anomalies none of them explains:
 * <ul>
 *   <li>a stage completed before one of its required inputs;</li>
 *   <li>a stage started but never finished in a terminal, non-cancelled workflow;</li>
 *   <li>a COMPLETED workflow missing the artifact of a stage it did not skip;</li>
 *   <li>a completed artifact with no STAGE_COMPLETED event.</li>
 * </ul>
 * Anomalies on a stage that already carries a known-pattern finding are
 * dropped; the rest become NEW-BYPASS warnings.
 */
@Component
public class BypassDetector {

    private static final String NEW_BYPASS_FIX =
            "Inspect the execution log; if this recurs, add a pattern for it to the bypass catalog";

    private final StageRegistry registry;

    public BypassDetector(StageRegistry registry) {
        this.registry = registry;
    }

    /** Findings sorted by {@link BypassFinding#ORDER}; identical input gives identical output. */
    public List<BypassFinding> analyze(ExecutionLog log, List<BypassPattern> patterns) {
        List<BypassFinding> findings = new ArrayList<>();
        for (BypassPattern pattern : patterns) {
            findings.addAll(pattern.match(log));
        }

        Set<String> explained = new HashSet<>();
        findings.forEach(f -> explained.add(f.stageName()));

        for (Map.Entry<String, List<String>> anomaly : anomalies(log).entrySet()) {
            if (!explained.contains(anomaly.getKey())) {
                findings.add(new BypassFinding(BypassFinding.NEW_BYPASS, Severity.WARNING, log.workflowId(),
                        anomaly.getKey(), anomaly.getValue(), NEW_BYPASS_FIX));
            }
        }
        findings.sort(BypassFinding.ORDER);
        return List.copyOf(findings);
    }

    // ------------------------------------------------------------------
    // Structural checks
    // ------------------------------------------------------------------

    /** Evidence lines per stage, in registry order. */
    private Map<String, List<String>> anomalies(ExecutionLog log) {
        Map<String, List<String>> byStage = new LinkedHashMap<>();
        List<ExecutionEvent> events = log.events();

        // completed before required inputs; last start without an end
        Set<String>          completed = new HashSet<>();
        Map<String, Integer> lastStart = new HashMap<>();
        Map<String, Integer> lastEnd   = new HashMap<>();
        for (int i = 0; i < events.size(); i++) {
            ExecutionEvent e = events.get(i);
            String stage = e.getStageName();
            if (e.getType() == EventType.STAGE_STARTED) {
                lastStart.put(stage, i);
            } else if (e.getType() == EventType.STAGE_COMPLETED || e.getType() == EventType.STAGE_FAILED) {
                lastEnd.put(stage, i);
            }
            if (e.getType() == EventType.STAGE_COMPLETED) {
                Optional<StageDefinition> def = registry.find(stage);
                if (def.isPresent()) {
                    for (String input : def.get().requiredInputs()) {
                        if (!completed.contains(input)) {
                            add(byStage, stage, "completed before required input '" + input + "'");
                        }
                    }
                }
                completed.add(stage);
            }
        }

        WorkflowStatus status = log.workflow().getStatus();
        boolean cancelled = "cancelled".equals(log.workflow().getReason());
        if (status.isTerminal() && !cancelled) {
            lastStart.forEach((stage, start) -> {
                if (lastEnd.getOrDefault(stage, -1) < start) {
                    add(byStage, stage, "started (event " + (start + 1) + ") but never finished; workflow " + status);
                }
            });
        }

        if (status == WorkflowStatus.COMPLETED) {
            Set<String> skipped = new HashSet<>();
            log.events(EventType.STAGE_SKIPPED).forEach(e -> skipped.add(e.getStageName()));
            for (StageDefinition stage : registry.stages()) {
                Optional<Artifact> artifact = log.artifact(stage.name());
                if (!skipped.contains(stage.name()) && (artifact.isEmpty() || !artifact.get().isCompleted())) {
                    add(byStage, stage.name(), "workflow COMPLETED without a completed artifact");
                }
            }
        }

        if (status.isTerminal()) {
            for (Artifact artifact : log.artifacts()) {
                if (artifact.isCompleted()
                        && registry.find(artifact.getStageName()).isPresent()
                        && !completed.contains(artifact.getStageName())) {
                    add(byStage, artifact.getStageName(), "completed artifact without a STAGE_COMPLETED event");
                }
            }
        }
        return byStage;
    }

    private static void add(Map<String, List<String>> byStage, String stage, String evidence) {
        byStage.computeIfAbsent(stage, s -> new ArrayList<>()).add(evidence);
    }
}
