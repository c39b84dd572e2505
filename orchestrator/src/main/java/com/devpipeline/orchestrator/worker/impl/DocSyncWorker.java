package com.devpipeline.orchestrator.worker.impl;

import com.devpipeline.orchestrator.worker.RemoteStageDelegate;
import com.devpipeline.orchestrator.worker.StageInput;
import com.devpipeline.orchestrator.worker.StageOutput;
import com.devpipeline.orchestrator.worker.StageWorker;
import org.springframework.stereotype.Component;

@Component
public class DocSyncWorker implements StageWorker {

    static final String OBJECTIVE =
            "Bring documentation in line with the changes. Set 'docs_updated' or 'no_changes_needed'.";

    private final RemoteStageDelegate remote;

    public DocSyncWorker(RemoteStageDelegate remote) {
        this.remote = remote;
    }

    @Override
    public String stageName() {
        return "doc-sync";
    }

    @Override
    public StageOutput invoke(StageInput input) throws InterruptedException {
        return remote.invoke(input, OBJECTIVE);
    }
}
