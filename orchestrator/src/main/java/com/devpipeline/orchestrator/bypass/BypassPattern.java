package com.devpipeline.orchestrator.bypass;

import java.util.List;

/**
 * A known signature of a skipped or faked pipeline step.
 *
 * Implementations are pure functions of the log: the same log always yields
 * the same findings.
 */
public interface BypassPattern {

    String id();

    Severity severity();

    List<BypassFinding> match(ExecutionLog log);
}
