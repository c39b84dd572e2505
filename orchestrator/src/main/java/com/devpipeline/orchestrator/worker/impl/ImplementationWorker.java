package com.devpipeline.orchestrator.worker.impl;

import com.devpipeline.orchestrator.worker.RemoteStageDelegate;
import com.devpipeline.orchestrator.worker.StageInput;
import com.devpipeline.orchestrator.worker.StageOutput;
import com.devpipeline.orchestrator.worker.StageWorker;
import org.springframework.stereotype.Component;

@Component
public class ImplementationWorker implements StageWorker {

    static final String OBJECTIVE =
            "Implement the plan until the generated tests pass. List every modified path in 'files_changed'.";

    private final RemoteStageDelegate remote;

    public ImplementationWorker(RemoteStageDelegate remote) {
        this.remote = remote;
    }

    @Override
    public String stageName() {
        return "implementation";
    }

    @Override
    public StageOutput invoke(StageInput input) throws InterruptedException {
        return remote.invoke(input, OBJECTIVE);
    }
}
