package com.devpipeline.orchestrator.config;

import com.devpipeline.orchestrator.gate.QualityGateRegistry;
import com.devpipeline.orchestrator.stage.PipelineProperties;
import com.devpipeline.orchestrator.stage.StageRegistry;
import com.devpipeline.orchestrator.worker.StageWorkerRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PipelineConfig {

    /** Fails startup with StageRegistryException if the configured stages are not a valid pipeline. */
    @Bean
    public StageRegistry stageRegistry(PipelineProperties properties,
                                       QualityGateRegistry gates,
                                       StageWorkerRegistry workers) {
        return new StageRegistry(properties.toDefinitions(), gates::contains, workers::contains);
    }
}
