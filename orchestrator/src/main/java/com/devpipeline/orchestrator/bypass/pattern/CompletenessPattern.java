package com.devpipeline.orchestrator.bypass.pattern;

import com.devpipeline.orchestrator.bypass.BypassFinding;
import com.devpipeline.orchestrator.bypass.BypassPattern;
import com.devpipeline.orchestrator.bypass.ExecutionLog;
import com.devpipeline.orchestrator.bypass.Severity;
import com.devpipeline.orchestrator.model.EventType;
import com.devpipeline.orchestrator.model.ExecutionEvent;
import com.devpipeline.orchestrator.model.WorkflowStatus;
import com.devpipeline.orchestrator.stage.StageRegistry;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A COMPLETED workflow of a given mode must have recorded every expected
 * terminal action (commit, push, pr-create, issue-close, ...).
 */
public class CompletenessPattern implements BypassPattern {

    private final String       id;
    private final Severity     severity;
    private final String       mode;
    private final List<String> expectedActions;
    private final String       suggestedFix;

    public CompletenessPattern(String id, Severity severity, String mode,
                               List<String> expectedActions, String suggestedFix) {
        this.id              = id;
        this.severity        = severity;
        this.mode            = mode;
        this.expectedActions = List.copyOf(expectedActions);
        this.suggestedFix    = suggestedFix;
    }

    @Override public String   id()       { return id; }
    @Override public Severity severity() { return severity; }

    @Override
    public List<BypassFinding> match(ExecutionLog log) {
        if (log.workflow().getStatus() != WorkflowStatus.COMPLETED
                || !mode.equalsIgnoreCase(log.workflow().getMode())) {
            return List.of();
        }
        Set<String> recorded = new LinkedHashSet<>();
        log.events(EventType.ACTION_RECORDED).forEach(e -> recorded.add(e.getDetail()));

        List<String> missing = expectedActions.stream().filter(a -> !recorded.contains(a)).toList();
        if (missing.isEmpty()) {
            return List.of();
        }
        List<String> evidence = new ArrayList<>();
        evidence.add("mode=" + mode + " expected actions " + expectedActions);
        evidence.add("recorded actions " + List.copyOf(recorded));
        evidence.add("missing " + missing);
        for (ExecutionEvent failure : log.events(EventType.PUBLISH_FAILED)) {
            evidence.add("publish failed: " + failure.getDetail());
        }
        return List.of(new BypassFinding(id, severity, log.workflowId(), StageRegistry.PUBLISH, evidence, suggestedFix));
    }
}
