package com.devpipeline.orchestrator.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * All {@link StageWorker} beans, indexed by the stage they serve.
 */
@Component
public class StageWorkerRegistry {

    private static final Logger log = LoggerFactory.getLogger(StageWorkerRegistry.class);

    private final Map<String, StageWorker> workers = new ConcurrentHashMap<>();

    public StageWorkerRegistry(List<StageWorker> allWorkers) {
        for (StageWorker worker : allWorkers) {
            if (workers.putIfAbsent(worker.stageName(), worker) != null) {
                throw new IllegalStateException("Two workers registered for stage '" + worker.stageName() + "'");
            }
            log.info("Registered worker for stage '{}' ({})", worker.stageName(), worker.getClass().getSimpleName());
        }
    }

    public boolean contains(String stageName) {
        return workers.containsKey(stageName);
    }

    /** @throws IllegalArgumentException if no worker serves the stage */
    public StageWorker get(String stageName) {
        StageWorker worker = workers.get(stageName);
        if (worker == null) {
            throw new IllegalArgumentException("No worker for stage: " + stageName);
        }
        return worker;
    }
}
