package com.devpipeline.orchestrator.worker.impl;

import com.devpipeline.orchestrator.worker.RemoteStageDelegate;
import com.devpipeline.orchestrator.worker.StageInput;
import com.devpipeline.orchestrator.worker.StageOutput;
import com.devpipeline.orchestrator.worker.StageWorker;
import org.springframework.stereotype.Component;

@Component
public class PlanningWorker implements StageWorker {

    static final String OBJECTIVE =
            "Turn the research findings into an ordered implementation plan in a non-empty 'steps' array.";

    private final RemoteStageDelegate remote;

    public PlanningWorker(RemoteStageDelegate remote) {
        this.remote = remote;
    }

    @Override
    public String stageName() {
        return "planning";
    }

    @Override
    public StageOutput invoke(StageInput input) throws InterruptedException {
        return remote.invoke(input, OBJECTIVE);
    }
}
