package com.devpipeline.orchestrator.gate;

import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Collects every {@link QualityGate} bean and evaluates them by name.
 *
 * Every evaluation is counted:
 * <pre>
 *   devpipeline.gate.evaluations{gate, outcome="pass|fail"}
 * </pre>
 */
@Component
public class QualityGateRegistry {

    private static final Logger log = LoggerFactory.getLogger(QualityGateRegistry.class);

    private final Map<String, QualityGate> gates = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;

    public QualityGateRegistry(List<QualityGate> allGates, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (QualityGate gate : allGates) {
            if (gates.putIfAbsent(gate.name(), gate) != null) {
                throw new IllegalStateException("Duplicate quality gate '" + gate.name() + "'");
            }
            log.info("Registered quality gate '{}'", gate.name());
        }
    }

    public boolean contains(String name) {
        return gates.containsKey(name);
    }

    /**
     * Evaluate the named gate. A gate that throws counts as a failure.
     *
     * @throws IllegalArgumentException if no gate has this name
     */
    public GateResult evaluate(String name, JsonNode payload) {
        QualityGate gate = gates.get(name);
        if (gate == null) {
            throw new IllegalArgumentException("Unknown quality gate: " + name);
        }
        GateResult result;
        try {
            result = gate.evaluate(payload);
        } catch (RuntimeException e) {
            log.warn("Quality gate '{}' threw: {}", name, e.getMessage());
            result = GateResult.fail("gate error: " + e.getMessage());
        }
        meterRegistry.counter("devpipeline.gate.evaluations",
                "gate", name,
                "outcome", result.passed() ? "pass" : "fail").increment();
        return result;
    }
}
