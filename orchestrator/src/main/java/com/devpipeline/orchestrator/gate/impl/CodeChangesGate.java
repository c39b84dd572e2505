package com.devpipeline.orchestrator.gate.impl;

import org.springframework.stereotype.Component;

@Component
public class CodeChangesGate extends RequiredArrayGate {

    public CodeChangesGate() {
        super("files_changed");
    }

    @Override
    public String name() {
        return "code_changes";
    }
}
