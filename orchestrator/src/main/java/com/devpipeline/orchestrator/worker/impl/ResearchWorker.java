package com.devpipeline.orchestrator.worker.impl;

import com.devpipeline.orchestrator.worker.RemoteStageDelegate;
import com.devpipeline.orchestrator.worker.StageInput;
import com.devpipeline.orchestrator.worker.StageOutput;
import com.devpipeline.orchestrator.worker.StageWorker;
import org.springframework.stereotype.Component;

@Component
public class ResearchWorker implements StageWorker {

    static final String OBJECTIVE =
            "Investigate the codebase and prior art relevant to the request. Report findings as a non-empty 'findings' array.";

    private final RemoteStageDelegate remote;

    public ResearchWorker(RemoteStageDelegate remote) {
        this.remote = remote;
    }

    @Override
    public String stageName() {
        return "research";
    }

    @Override
    public StageOutput invoke(StageInput input) throws InterruptedException {
        return remote.invoke(input, OBJECTIVE);
    }
}
