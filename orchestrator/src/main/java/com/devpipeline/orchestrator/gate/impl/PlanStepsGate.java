package com.devpipeline.orchestrator.gate.impl;

import org.springframework.stereotype.Component;

@Component
public class PlanStepsGate extends RequiredArrayGate {

    public PlanStepsGate() {
        super("steps");
    }

    @Override
    public String name() {
        return "plan_steps";
    }
}
