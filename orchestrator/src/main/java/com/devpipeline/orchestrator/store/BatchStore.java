package com.devpipeline.orchestrator.store;

import com.devpipeline.orchestrator.model.Batch;
import com.devpipeline.orchestrator.model.BatchItem;

import java.util.List;
import java.util.Optional;

/**
 * Durable batch records and their items, so a batch can continue after a restart.
 */
public interface BatchStore {

    /** Persist a new RUNNING batch with one item per request, in order. */
    Batch create(String batchId, String mode, List<String> requests);

    Optional<Batch> find(String batchId);

    /** @throws BatchNotFoundException if no batch has this id */
    default Batch get(String batchId) {
        return find(batchId).orElseThrow(() -> new BatchNotFoundException(batchId));
    }

    Batch save(Batch batch);

    /** Items in submission order. */
    List<BatchItem> items(String batchId);

    BatchItem saveItem(BatchItem item);
}
