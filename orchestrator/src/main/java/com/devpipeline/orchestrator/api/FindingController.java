package com.devpipeline.orchestrator.api;

import com.devpipeline.orchestrator.bypass.BypassAnalysisService;
import com.devpipeline.orchestrator.bypass.BypassFinding;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * GET /findings?from=2024-05-01T00:00:00Z&amp;to=2024-05-02T00:00:00Z
 *
 * Bypass analysis of every workflow updated inside [from, to).
 */
@RestController
@RequestMapping("/findings")
public class FindingController {

    private final BypassAnalysisService bypassAnalysis;

    public FindingController(BypassAnalysisService bypassAnalysis) {
        this.bypassAnalysis = bypassAnalysis;
    }

    @GetMapping
    public List<BypassFinding> analyze(
            @RequestParam Instant from,
            @RequestParam Instant to) {
        return bypassAnalysis.analyzeRange(from, to);
    }
}
