package com.devpipeline.orchestrator.stage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Validated, immutable set of stage definitions.
 *
 * Construction rejects any configuration that is not a DAG ordered by
 * {@code order}: every required input must name a stage with a strictly
 * smaller order, stages sharing an order must share a parallel group, every
 * referenced quality gate must exist and every stage must have a worker.
 */
public class StageRegistry {

    private static final Logger log = LoggerFactory.getLogger(StageRegistry.class);

    /** Pseudo-stages owned by the coordinator; their names cannot be configured. */
    public static final String ALIGNMENT = "alignment";
    public static final String PUBLISH   = "publish";

    private static final Set<String> RESERVED = Set.of(ALIGNMENT, PUBLISH);

    private final List<StageDefinition>        stages;
    private final Map<String, StageDefinition> byName;
    private final List<PipelineStep>           steps;

    public StageRegistry(List<StageDefinition> definitions,
                         Predicate<String> gateExists,
                         Predicate<String> workerExists) {
        if (definitions == null || definitions.isEmpty()) {
            throw new StageRegistryException("No stages configured");
        }
        Map<String, StageDefinition> index = new LinkedHashMap<>();
        for (StageDefinition def : definitions) {
            validateShape(def, gateExists, workerExists);
            if (index.putIfAbsent(def.name(), def) != null) {
                throw new StageRegistryException("Duplicate stage name '" + def.name() + "'");
            }
        }

        List<StageDefinition> sorted = new ArrayList<>(definitions);
        sorted.sort(Comparator.comparingInt(StageDefinition::order));

        for (StageDefinition def : sorted) {
            for (String input : def.requiredInputs()) {
                StageDefinition dep = index.get(input);
                if (dep == null) {
                    throw new StageRegistryException(
                            "Stage '" + def.name() + "' requires unknown stage '" + input + "'");
                }
                if (dep.order() >= def.order()) {
                    throw new StageRegistryException("Stage '" + def.name() + "' (order " + def.order()
                            + ") requires '" + input + "' (order " + dep.order() + ") which does not run earlier");
                }
            }
        }

        this.stages = List.copyOf(sorted);
        this.byName = Map.copyOf(index);
        this.steps  = buildSteps(sorted);

        for (PipelineStep step : steps) {
            log.info("Pipeline step {}: {}{}", step.order(),
                    step.stages().stream().map(StageDefinition::name).toList(),
                    step.isParallel() ? " (parallel group '" + step.parallelGroup() + "')" : "");
        }
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /** All stages in execution order. */
    public List<StageDefinition> stages() {
        return stages;
    }

    public Optional<StageDefinition> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    /** Execution plan: one step per distinct order. */
    public List<PipelineStep> steps() {
        return steps;
    }

    /** True if any stage lists 'name' among its required inputs. */
    public boolean hasDependents(String name) {
        return stages.stream().anyMatch(s -> s.requiredInputs().contains(name));
    }

    // ------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------

    private static void validateShape(StageDefinition def,
                                      Predicate<String> gateExists,
                                      Predicate<String> workerExists) {
        if (def.name() == null || def.name().isBlank()) {
            throw new StageRegistryException("Stage with blank name at order " + def.order());
        }
        if (RESERVED.contains(def.name())) {
            throw new StageRegistryException("Stage name '" + def.name() + "' is reserved");
        }
        if (def.order() < 1) {
            throw new StageRegistryException("Stage '" + def.name() + "' has order " + def.order() + "; must be >= 1");
        }
        if (def.outputSchemaVersion() == null || def.outputSchemaVersion().isBlank()) {
            throw new StageRegistryException("Stage '" + def.name() + "' has no output schema version");
        }
        if (def.timeout() == null || def.timeout().isZero() || def.timeout().isNegative()) {
            throw new StageRegistryException("Stage '" + def.name() + "' must have a positive timeout");
        }
        if (def.qualityGate() != null && !gateExists.test(def.qualityGate())) {
            throw new StageRegistryException(
                    "Stage '" + def.name() + "' references unknown quality gate '" + def.qualityGate() + "'");
        }
        if (!workerExists.test(def.name())) {
            throw new StageRegistryException("No worker registered for stage '" + def.name() + "'");
        }
    }

    private static List<PipelineStep> buildSteps(List<StageDefinition> sorted) {
        Map<Integer, List<StageDefinition>> byOrder = new LinkedHashMap<>();
        for (StageDefinition def : sorted) {
            byOrder.computeIfAbsent(def.order(), o -> new ArrayList<>()).add(def);
        }
        List<PipelineStep> result = new ArrayList<>();
        Map<String, Integer> groupOrder = new HashMap<>();
        for (Map.Entry<Integer, List<StageDefinition>> entry : byOrder.entrySet()) {
            List<StageDefinition> members = entry.getValue();
            String group = members.get(0).parallelGroup();
            if (members.size() > 1) {
                for (StageDefinition m : members) {
                    if (m.parallelGroup() == null || !m.parallelGroup().equals(group)) {
                        throw new StageRegistryException("Stages " + members.stream().map(StageDefinition::name).toList()
                                + " share order " + entry.getKey() + " but are not in one parallel group");
                    }
                }
            }
            if (group != null) {
                Integer previous = groupOrder.putIfAbsent(group, entry.getKey());
                if (previous != null) {
                    throw new StageRegistryException("Parallel group '" + group
                            + "' spans orders " + previous + " and " + entry.getKey());
                }
            }
            result.add(new PipelineStep(entry.getKey(), group, members));
        }
        return List.copyOf(result);
    }
}
