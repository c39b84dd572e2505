package com.devpipeline.orchestrator.bypass.pattern;

import com.devpipeline.orchestrator.bypass.BypassFinding;
import com.devpipeline.orchestrator.bypass.BypassPattern;
import com.devpipeline.orchestrator.bypass.ExecutionLog;
import com.devpipeline.orchestrator.bypass.Severity;

import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Two groups of files that must change together, e.g. a schema and its
 * validator. Flags a workflow that touched one side only.
 *
 * Globs follow {@link java.nio.file.FileSystem#getPathMatcher}; a leading
 * {@code **}{@code /} also matches files at the repository root.
 */
public class CongruencePattern implements BypassPattern {

    private final String      id;
    private final Severity    severity;
    private final String      leftGlob;
    private final String      rightGlob;
    private final PathMatcher left;
    private final PathMatcher right;
    private final String      suggestedFix;

    public CongruencePattern(String id, Severity severity, String leftGlob, String rightGlob, String suggestedFix) {
        this.id           = id;
        this.severity     = severity;
        this.leftGlob     = leftGlob;
        this.rightGlob    = rightGlob;
        this.left         = matcher(leftGlob);
        this.right        = matcher(rightGlob);
        this.suggestedFix = suggestedFix;
    }

    @Override public String   id()       { return id; }
    @Override public Severity severity() { return severity; }

    @Override
    public List<BypassFinding> match(ExecutionLog log) {
        Set<String> changed = log.changedPaths();
        List<String> leftHits  = changed.stream().filter(p -> matches(left, p)).toList();
        List<String> rightHits = changed.stream().filter(p -> matches(right, p)).toList();
        if (leftHits.isEmpty() == rightHits.isEmpty()) {
            return List.of();
        }
        List<String> evidence = new ArrayList<>();
        if (rightHits.isEmpty()) {
            evidence.add("changed " + leftGlob + ": " + leftHits);
            evidence.add("unchanged " + rightGlob);
        } else {
            evidence.add("changed " + rightGlob + ": " + rightHits);
            evidence.add("unchanged " + leftGlob);
        }
        return List.of(new BypassFinding(id, severity, log.workflowId(), null, evidence, suggestedFix));
    }

    private static PathMatcher matcher(String glob) {
        PathMatcher full = FileSystems.getDefault().getPathMatcher("glob:" + glob);
        if (!glob.startsWith("**/")) {
            return full;
        }
        PathMatcher rooted = FileSystems.getDefault().getPathMatcher("glob:" + glob.substring(3));
        return p -> full.matches(p) || rooted.matches(p);
    }

    private static boolean matches(PathMatcher matcher, String path) {
        try {
            return matcher.matches(Path.of(path));
        } catch (InvalidPathException e) {
            return false;
        }
    }
}
