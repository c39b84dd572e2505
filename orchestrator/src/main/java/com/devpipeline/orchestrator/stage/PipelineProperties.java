package com.devpipeline.orchestrator.stage;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Stage list bound from {@code devpipeline.pipeline.stages} in application.yml.
 */
@ConfigurationProperties(prefix = "devpipeline.pipeline")
public class PipelineProperties {

    private List<Stage> stages = new ArrayList<>();

    public List<Stage> getStages()            { return stages; }
    public void setStages(List<Stage> stages) { this.stages = stages; }

    public List<StageDefinition> toDefinitions() {
        return stages.stream().map(Stage::toDefinition).toList();
    }

    public static class Stage {

        private String      name;
        private int         order;
        private Set<String> requires = Set.of();
        private String      schemaVersion = "1.0";
        private Duration    timeout = Duration.ofMinutes(10);
        private String      group;
        private String      gate;

        public String      getName()          { return name; }
        public int         getOrder()         { return order; }
        public Set<String> getRequires()      { return requires; }
        public String      getSchemaVersion() { return schemaVersion; }
        public Duration    getTimeout()       { return timeout; }
        public String      getGroup()         { return group; }
        public String      getGate()          { return gate; }

        public void setName(String name)                   { this.name = name; }
        public void setOrder(int order)                    { this.order = order; }
        public void setRequires(Set<String> requires)      { this.requires = requires; }
        public void setSchemaVersion(String schemaVersion) { this.schemaVersion = schemaVersion; }
        public void setTimeout(Duration timeout)           { this.timeout = timeout; }
        public void setGroup(String group)                 { this.group = group; }
        public void setGate(String gate)                   { this.gate = gate; }

        StageDefinition toDefinition() {
            return new StageDefinition(name, order, requires, schemaVersion, timeout, group, gate);
        }
    }
}
