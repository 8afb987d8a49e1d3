package com.extractionplatform.orchestrator.phase;

import com.extractionplatform.common.exception.InvalidConfigurationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orders phases so every phase runs after the phases it depends on. Among phases whose
 * dependencies are satisfied, declaration order wins, so a graph without dependencies runs
 * exactly as declared.
 */
public final class PhasePlanner {

    private PhasePlanner() {}

    /**
     * @throws InvalidConfigurationException on duplicate names, unknown dependencies,
     *         cycles, unknown worker ids or a worker assigned to more than one phase
     */
    public static List<PhaseDefinition> plan(List<PhaseDefinition> phases, Set<String> knownWorkers) {
        Map<String, PhaseDefinition> byName = new LinkedHashMap<>();
        Set<String> assigned = new HashSet<>();
        for (PhaseDefinition phase : phases) {
            if (byName.putIfAbsent(phase.name(), phase) != null) {
                throw new InvalidConfigurationException("duplicate phase name '" + phase.name() + "'");
            }
            for (String workerId : phase.workerIds()) {
                if (!knownWorkers.contains(workerId)) {
                    throw new InvalidConfigurationException(
                        "phase '" + phase.name() + "' references unknown worker '" + workerId + "'");
                }
                // a worker owns exactly one partition per run
                if (!assigned.add(workerId)) {
                    throw new InvalidConfigurationException("worker '" + workerId + "' is assigned to more than one phase");
                }
            }
        }
        for (PhaseDefinition phase : phases) {
            for (String dep : phase.dependsOn()) {
                if (!byName.containsKey(dep)) {
                    throw new InvalidConfigurationException(
                        "phase '" + phase.name() + "' depends on unknown phase '" + dep + "'");
                }
            }
        }

        List<PhaseDefinition> ordered = new ArrayList<>(phases.size());
        Set<String> placed = new HashSet<>();
        while (ordered.size() < phases.size()) {
            PhaseDefinition next = null;
            for (PhaseDefinition candidate : byName.values()) {
                if (!placed.contains(candidate.name()) && placed.containsAll(candidate.dependsOn())) {
                    next = candidate;
                    break;
                }
            }
            if (next == null) {
                List<String> stuck = byName.keySet().stream().filter(n -> !placed.contains(n)).toList();
                throw new InvalidConfigurationException("phase dependency cycle among " + stuck);
            }
            ordered.add(next);
            placed.add(next.name());
        }
        return List.copyOf(ordered);
    }
}
