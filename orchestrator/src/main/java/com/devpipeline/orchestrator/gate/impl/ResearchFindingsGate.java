package com.devpipeline.orchestrator.gate.impl;

import org.springframework.stereotype.Component;

@Component
public class ResearchFindingsGate extends RequiredArrayGate {

    public ResearchFindingsGate() {
        super("findings");
    }

    @Override
    public String name() {
        return "research_findings";
    }
}
