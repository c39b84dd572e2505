package com.devpipeline.orchestrator.bypass.pattern;

import com.devpipeline.orchestrator.bypass.BypassFinding;
import com.devpipeline.orchestrator.bypass.BypassPattern;
import com.devpipeline.orchestrator.bypass.ExecutionLog;
import com.devpipeline.orchestrator.bypass.Severity;
import com.devpipeline.orchestrator.model.Artifact;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Placeholder markers (stubs, "not implemented", ...) in the completed
 * payloads of selected stages. One finding per offending stage.
 */
public class ContentPattern implements BypassPattern {

    private static final int EXCERPT_RADIUS = 40;

    private final String        id;
    private final Severity      severity;
    private final Set<String>   stages;
    private final List<Pattern> markers;
    private final String        suggestedFix;

    public ContentPattern(String id, Severity severity, Set<String> stages,
                          List<String> markers, String suggestedFix) {
        this.id           = id;
        this.severity     = severity;
        this.stages       = Set.copyOf(stages);
        this.markers      = markers.stream().map(Pattern::compile).toList();
        this.suggestedFix = suggestedFix;
    }

    @Override public String   id()       { return id; }
    @Override public Severity severity() { return severity; }

    @Override
    public List<BypassFinding> match(ExecutionLog log) {
        List<BypassFinding> findings = new ArrayList<>();
        for (Artifact artifact : log.artifacts()) {
            if (!artifact.isCompleted() || !stages.contains(artifact.getStageName())) {
                continue;
            }
            String text = artifact.getPayload();
            List<String> evidence = new ArrayList<>();
            for (Pattern marker : markers) {
                Matcher m = marker.matcher(text);
                if (m.find()) {
                    evidence.add("marker /" + marker.pattern() + "/ in " + artifact.getStageName()
                            + ": ..." + excerpt(text, m.start(), m.end()) + "...");
                }
            }
            if (!evidence.isEmpty()) {
                findings.add(new BypassFinding(id, severity, log.workflowId(), artifact.getStageName(),
                        evidence, suggestedFix));
            }
        }
        return findings;
    }

    private static String excerpt(String text, int start, int end) {
        return text.substring(Math.max(0, start - EXCERPT_RADIUS), Math.min(text.length(), end + EXCERPT_RADIUS));
    }
}
