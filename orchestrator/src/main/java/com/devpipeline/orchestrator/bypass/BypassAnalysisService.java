package com.devpipeline.orchestrator.bypass;

import com.devpipeline.orchestrator.model.Workflow;
import com.devpipeline.orchestrator.store.ArtifactStore;
import com.devpipeline.orchestrator.store.StoreException;
import com.devpipeline.orchestrator.store.WorkflowStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the bypass detector over stored workflows, on request or as a
 * periodic sweep.
 *
 * The sweep covers workflows updated since the previous sweep. Every finding
 * is counted as {@code devpipeline.bypass.findings{pattern, severity}};
 * critical ones are also logged at ERROR so log-based alerting picks them up.
 */
@Service
public class BypassAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(BypassAnalysisService.class);

    private final WorkflowStore        workflows;
    private final ArtifactStore        artifacts;
    private final BypassDetector       detector;
    private final BypassPatternCatalog catalog;
    private final ObjectMapper         json;
    private final MeterRegistry        meterRegistry;
    private final boolean              sweepEnabled;
    private final Duration             initialLookback;

    private Instant lastSweepEnd;

    public BypassAnalysisService(WorkflowStore workflows,
                                 ArtifactStore artifacts,
                                 BypassDetector detector,
                                 BypassPatternCatalog catalog,
                                 ObjectMapper json,
                                 MeterRegistry meterRegistry,
                                 @Value("${devpipeline.bypass.sweep-enabled:true}") boolean sweepEnabled,
                                 @Value("${devpipeline.bypass.initial-lookback:PT24H}") Duration initialLookback) {
        this.workflows       = workflows;
        this.artifacts       = artifacts;
        this.detector        = detector;
        this.catalog         = catalog;
        this.json            = json;
        this.meterRegistry   = meterRegistry;
        this.sweepEnabled    = sweepEnabled;
        this.initialLookback = initialLookback;
    }

    /** @throws com.devpipeline.orchestrator.store.WorkflowNotFoundException if the workflow does not exist */
    public List<BypassFinding> analyze(String workflowId) {
        return analyze(workflows.get(workflowId));
    }

    /**
     * Findings for every workflow updated inside [from, to), oldest workflow first.
     *
     * @throws IllegalArgumentException if 'from' is not before 'to'
     */
    public List<BypassFinding> analyzeRange(Instant from, Instant to) {
        if (!from.isBefore(to)) {
            throw new IllegalArgumentException("'from' must be before 'to': " + from + " / " + to);
        }
        List<BypassFinding> findings = new ArrayList<>();
        for (Workflow workflow : workflows.findUpdatedBetween(from, to)) {
            findings.addAll(analyze(workflow));
        }
        return findings;
    }

    @Scheduled(fixedDelayString = "${devpipeline.bypass.sweep-interval-ms:3600000}",
               initialDelayString = "${devpipeline.bypass.sweep-initial-delay-ms:60000}")
    public void sweep() {
        if (!sweepEnabled) {
            return;
        }
        Instant to   = Instant.now();
        Instant from = lastSweepEnd != null ? lastSweepEnd : to.minus(initialLookback);
        try {
            List<BypassFinding> findings = analyzeRange(from, to);
            for (BypassFinding finding : findings) {
                report(finding);
            }
            lastSweepEnd = to;
            log.info("Bypass sweep [{}, {}): {} finding(s)", from, to, findings.size());
        } catch (StoreException e) {
            log.error("Bypass sweep failed: {}", e.getMessage());
        }
    }

    private List<BypassFinding> analyze(Workflow workflow) {
        String id = workflow.getId();
        ExecutionLog executionLog = new ExecutionLog(workflow, workflows.events(id), () -> artifacts.list(id), json);
        return detector.analyze(executionLog, catalog.patterns());
    }

    private void report(BypassFinding finding) {
        meterRegistry.counter("devpipeline.bypass.findings",
                "pattern",  finding.patternId(),
                "severity", finding.severity().name()).increment();
        if (finding.severity() == Severity.CRITICAL) {
            log.error("Bypass {} in workflow {} stage {}: {}",
                    finding.patternId(), finding.workflowId(), finding.stageName(), finding.evidence());
        } else {
            log.warn("Bypass {} in workflow {} stage {}: {}",
                    finding.patternId(), finding.workflowId(), finding.stageName(), finding.evidence());
        }
    }
}
