package com.devpipeline.orchestrator.store;

import com.devpipeline.orchestrator.model.Batch;
import com.devpipeline.orchestrator.model.BatchItem;
import com.devpipeline.orchestrator.repository.BatchItemRepository;
import com.devpipeline.orchestrator.repository.BatchRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed batch records. Same contract as {@link JpaWorkflowStore}:
 * one short transaction per call, committed when the call returns.
 */
@Component
public class JpaBatchStore implements BatchStore {

    private final BatchRepository     batchRepo;
    private final BatchItemRepository itemRepo;

    public JpaBatchStore(BatchRepository batchRepo, BatchItemRepository itemRepo) {
        this.batchRepo = batchRepo;
        this.itemRepo  = itemRepo;
    }

    @Override
    @Transactional
    public Batch create(String batchId, String mode, List<String> requests) {
        try {
            Batch batch = batchRepo.saveAndFlush(new Batch(batchId, mode, requests.size()));
            List<BatchItem> items = new ArrayList<>();
            for (int i = 0; i < requests.size(); i++) {
                items.add(new BatchItem(batchId, i, requests.get(i)));
            }
            itemRepo.saveAllAndFlush(items);
            return batch;
        } catch (DataAccessException e) {
            throw new StoreException("Could not create batch " + batchId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Batch> find(String batchId) {
        try {
            return batchRepo.findById(batchId);
        } catch (DataAccessException e) {
            throw new StoreException("Could not load batch " + batchId, e);
        }
    }

    @Override
    @Transactional
    public Batch save(Batch batch) {
        try {
            return batchRepo.saveAndFlush(batch);
        } catch (DataAccessException e) {
            throw new StoreException("Could not save batch " + batch.getId(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<BatchItem> items(String batchId) {
        try {
            return itemRepo.findByBatchIdOrderByPositionAsc(batchId);
        } catch (DataAccessException e) {
            throw new StoreException("Could not read items of batch " + batchId, e);
        }
    }

    @Override
    @Transactional
    public BatchItem saveItem(BatchItem item) {
        try {
            return itemRepo.saveAndFlush(item);
        } catch (DataAccessException e) {
            throw new StoreException("Could not save item " + item.getPosition() + " of batch " + item.getBatchId(), e);
        }
    }
}
