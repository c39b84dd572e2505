package com.devpipeline.orchestrator.bypass.pattern;

import com.devpipeline.orchestrator.bypass.BypassFinding;
import com.devpipeline.orchestrator.bypass.BypassPattern;
import com.devpipeline.orchestrator.bypass.ExecutionLog;
import com.devpipeline.orchestrator.bypass.Severity;
import com.devpipeline.orchestrator.model.Artifact;

import java.util.ArrayList;
import java.util.List;

/**
 * A worker returned output without the required envelope or with the wrong
 * schema version. The stage is failed as "validation: ..."; this surfaces it.
 */
public class ContractViolationPattern implements BypassPattern {

    private static final String VALIDATION_PREFIX = "validation";

    private final String   id;
    private final Severity severity;
    private final String   suggestedFix;

    public ContractViolationPattern(String id, Severity severity, String suggestedFix) {
        this.id           = id;
        this.severity     = severity;
        this.suggestedFix = suggestedFix;
    }

    @Override public String   id()       { return id; }
    @Override public Severity severity() { return severity; }

    @Override
    public List<BypassFinding> match(ExecutionLog log) {
        List<BypassFinding> findings = new ArrayList<>();
        for (Artifact artifact : log.artifacts()) {
            String reason = artifact.getReason();
            if (!artifact.isCompleted() && reason != null && reason.startsWith(VALIDATION_PREFIX)) {
                findings.add(new BypassFinding(id, severity, log.workflowId(), artifact.getStageName(),
                        List.of("stage " + artifact.getStageName() + " failed: " + reason,
                                "schema_version expected " + artifact.getVersion()),
                        suggestedFix));
            }
        }
        return findings;
    }
}
