package com.devpipeline.orchestrator.gate.impl;

import org.springframework.stereotype.Component;

@Component
public class TestsWrittenGate extends RequiredArrayGate {

    public TestsWrittenGate() {
        super("test_files");
    }

    @Override
    public String name() {
        return "tests_written";
    }
}
