package com.extractionplatform.orchestrator.phase;

import com.extractionplatform.common.exception.InvalidConfigurationException;

import java.time.Duration;
import java.util.List;

/**
 * One declared phase of the execution graph.
 *
 * @param name      unique phase name, referenced by {@code dependsOn}
 * @param mode      parallel or sequential dispatch
 * @param timeout   phase budget, measured from the moment the phase starts
 * @param workerIds workers in declaration order; commit order at the barrier follows it
 * @param dependsOn phases that must have run before this one
 */
public record PhaseDefinition(
    String       name,
    PhaseMode    mode,
    Duration     timeout,
    List<String> workerIds,
    List<String> dependsOn
) {

    public PhaseDefinition {
        if (name == null || name.isBlank()) {
            throw new InvalidConfigurationException("phase name must not be blank");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new InvalidConfigurationException("phase '" + name + "' timeout must be positive");
        }
        mode = mode == null ? PhaseMode.PARALLEL : mode;
        workerIds = workerIds == null ? List.of() : List.copyOf(workerIds);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }
}
