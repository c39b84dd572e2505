package com.devpipeline.orchestrator.api;

import com.devpipeline.orchestrator.policy.AlignmentDecision;
import com.devpipeline.orchestrator.policy.AlignmentHistoryService;
import com.devpipeline.orchestrator.policy.AlignmentStats;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * GET /alignment/decisions?from=&amp;to=   recorded policy verdicts, oldest first
 * GET /alignment/stats?from=&amp;to=       approval rate and violation counts
 *
 * Both bounds are optional; the default range is everything up to now.
 */
@RestController
@RequestMapping("/alignment")
public class AlignmentController {

    private final AlignmentHistoryService history;

    public AlignmentController(AlignmentHistoryService history) {
        this.history = history;
    }

    @GetMapping("/decisions")
    public List<AlignmentDecision> decisions(
            @RequestParam(required = false) Instant from,
            @RequestParam(required = false) Instant to) {
        return history.decisions(orEpoch(from), orNow(to));
    }

    @GetMapping("/stats")
    public AlignmentStats stats(
            @RequestParam(required = false) Instant from,
            @RequestParam(required = false) Instant to) {
        return history.stats(orEpoch(from), orNow(to));
    }

    private static Instant orEpoch(Instant from) {
        return from == null ? Instant.EPOCH : from;
    }

    private static Instant orNow(Instant to) {
        return to == null ? Instant.now() : to;
    }
}
