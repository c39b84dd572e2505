package com.devpipeline.orchestrator.repository;

import com.devpipeline.orchestrator.model.BatchItem;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface BatchItemRepository extends JpaRepository<BatchItem, Long> {

    /** Items of a batch in submission order. */
    List<BatchItem> findByBatchIdOrderByPositionAsc(String batchId);
}
