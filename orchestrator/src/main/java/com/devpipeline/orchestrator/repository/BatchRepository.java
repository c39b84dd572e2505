package com.devpipeline.orchestrator.repository;

import com.devpipeline.orchestrator.model.Batch;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BatchRepository extends JpaRepository<Batch, String> {
}
