package com.example.servicereconciler.registry;

import com.example.servicereconciler.domain.ServiceSpec;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Topological layering of services by their {@code dependsOn} edges.
 * Wave {@code n} holds every service whose longest dependency chain has length {@code n};
 * services inside one wave never depend on each other.
 */
public final class DependencyGraph {

    private final List<List<ServiceSpec>> waves;
    private final List<ServiceSpec> ordered;

    private DependencyGraph(List<List<ServiceSpec>> waves) {
        this.waves = waves;
        List<ServiceSpec> flat = new ArrayList<>();
        waves.forEach(flat::addAll);
        this.ordered = List.copyOf(flat);
    }

    /**
     * Builds the layering. Declaration order is preserved inside each wave.
     *
     * @throws ConfigException on unknown or self references and on cycles
     */
    public static DependencyGraph build(List<ServiceSpec> specs) {
        Map<String, ServiceSpec> byId = new LinkedHashMap<>();
        for (ServiceSpec spec : specs) {
            byId.put(spec.id(), spec);
        }

        Map<String, Integer> pending = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (ServiceSpec spec : specs) {
            Set<String> predecessors = new LinkedHashSet<>(spec.dependsOn());
            for (String dep : predecessors) {
                if (dep.equals(spec.id())) {
                    throw new ConfigException("Service '" + spec.id() + "' depends on itself");
                }
                if (!byId.containsKey(dep)) {
                    throw new ConfigException("Service '" + spec.id() + "' depends on unknown service '" + dep + "'");
                }
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(spec.id());
            }
            pending.put(spec.id(), predecessors.size());
        }

        // Kahn's algorithm, one layer at a time
        List<List<ServiceSpec>> waves = new ArrayList<>();
        List<String> frontier = new ArrayList<>();
        for (ServiceSpec spec : specs) {
            if (pending.get(spec.id()) == 0) frontier.add(spec.id());
        }
        int placed = 0;
        while (!frontier.isEmpty()) {
            Set<String> next = new LinkedHashSet<>();
            for (String id : frontier) {
                for (String dependent : dependents.getOrDefault(id, List.of())) {
                    if (pending.merge(dependent, -1, Integer::sum) == 0) {
                        next.add(dependent);
                    }
                }
            }
            Set<String> inWave = new LinkedHashSet<>(frontier);
            List<ServiceSpec> wave = specs.stream().filter(s -> inWave.contains(s.id())).toList();
            waves.add(wave);
            placed += wave.size();
            frontier = specs.stream().map(ServiceSpec::id).filter(next::contains).toList();
        }

        if (placed < specs.size()) {
            List<String> cyclic = specs.stream()
                    .map(ServiceSpec::id)
                    .filter(id -> pending.get(id) > 0)
                    .toList();
            throw new ConfigException("Dependency cycle among services " + cyclic);
        }
        return new DependencyGraph(List.copyOf(waves));
    }

    public List<List<ServiceSpec>> waves() {
        return waves;
    }

    /** Predecessors before dependents. */
    public List<ServiceSpec> ordered() {
        return ordered;
    }
}
