package com.devpipeline.orchestrator.support;

import com.devpipeline.orchestrator.model.Batch;
import com.devpipeline.orchestrator.model.BatchItem;
import com.devpipeline.orchestrator.store.BatchStore;
import com.devpipeline.orchestrator.store.StoreException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class InMemoryBatchStore implements BatchStore {

    private final Map<String, Batch> batches = new LinkedHashMap<>();
    private final List<BatchItem>    items   = new ArrayList<>();
    private long nextItemId = 1;

    @Override
    public synchronized Batch create(String batchId, String mode, List<String> requests) {
        if (batches.containsKey(batchId)) {
            throw new StoreException("duplicate batch " + batchId);
        }
        Batch batch = new Batch(batchId, mode, requests.size());
        batches.put(batchId, batch);
        for (int i = 0; i < requests.size(); i++) {
            BatchItem item = new BatchItem(batchId, i, requests.get(i));
            TestEntities.setId(item, nextItemId++);
            items.add(item);
        }
        return batch;
    }

    @Override
    public synchronized Optional<Batch> find(String batchId) {
        return Optional.ofNullable(batches.get(batchId));
    }

    @Override
    public synchronized Batch save(Batch batch) {
        batches.put(batch.getId(), batch);
        return batch;
    }

    @Override
    public synchronized List<BatchItem> items(String batchId) {
        return items.stream()
                .filter(i -> i.getBatchId().equals(batchId))
                .sorted(Comparator.comparingInt(BatchItem::getPosition))
                .toList();
    }

    @Override
    public synchronized BatchItem saveItem(BatchItem item) {
        return item;
    }
}
