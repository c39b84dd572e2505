package com.devpipeline.orchestrator.service;

import java.security.SecureRandom;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Workflow ids: UTC creation time plus 8 random hex digits, e.g.
 * {@code 20240501-120000-3fa9c21b}. Sortable by creation time.
 */
final class WorkflowIds {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");
    private static final SecureRandom      RANDOM = new SecureRandom();

    private WorkflowIds() {}

    static String next() {
        return LocalDateTime.now(ZoneOffset.UTC).format(FORMAT) + "-" + String.format("%08x", RANDOM.nextInt());
    }
}
