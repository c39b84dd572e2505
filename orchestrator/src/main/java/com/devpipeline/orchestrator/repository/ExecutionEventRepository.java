package com.devpipeline.orchestrator.repository;

import com.devpipeline.orchestrator.model.ExecutionEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ExecutionEventRepository extends JpaRepository<ExecutionEvent, Long> {

    /** The execution log of one workflow, in append order. */
    List<ExecutionEvent> findByWorkflowIdOrderByIdAsc(String workflowId);
}
