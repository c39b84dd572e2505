package com.devpipeline.orchestrator.worker.impl;

import com.devpipeline.orchestrator.worker.RemoteStageDelegate;
import com.devpipeline.orchestrator.worker.StageInput;
import com.devpipeline.orchestrator.worker.StageOutput;
import com.devpipeline.orchestrator.worker.StageWorker;
import org.springframework.stereotype.Component;

@Component
public class ReviewWorker implements StageWorker {

    static final String OBJECTIVE =
            "Review the implementation against the plan. Set 'approved' and give a 'summary'.";

    private final RemoteStageDelegate remote;

    public ReviewWorker(RemoteStageDelegate remote) {
        this.remote = remote;
    }

    @Override
    public String stageName() {
        return "review";
    }

    @Override
    public StageOutput invoke(StageInput input) throws InterruptedException {
        return remote.invoke(input, OBJECTIVE);
    }
}
