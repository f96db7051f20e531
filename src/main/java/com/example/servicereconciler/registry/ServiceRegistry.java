package com.example.servicereconciler.registry;

import com.example.servicereconciler.config.ReconcilerProperties;
import com.example.servicereconciler.domain.ActionSpec;
import com.example.servicereconciler.domain.ConnectivitySpec;
import com.example.servicereconciler.domain.HealthCheckSpec;
import com.example.servicereconciler.domain.HealthCheckSpec.DeepCheck;
import com.example.servicereconciler.domain.HealthCheckSpec.LivenessCheck;
import com.example.servicereconciler.domain.HealthCheckSpec.ShallowCheck;
import com.example.servicereconciler.domain.RestartBudget;
import com.example.servicereconciler.domain.ServiceKind;
import com.example.servicereconciler.domain.ServiceSpec;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Loads the declarative service registry and exposes it in dependency order.
 * The registry is read once at startup and again only on an explicit {@link #reload()}.
 */
@Slf4j
@Component
public class ServiceRegistry {

    private final ReconcilerProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper registryMapper;

    private volatile Snapshot snapshot = new Snapshot(List.of(), List.of(), Map.of());

    public ServiceRegistry(ReconcilerProperties properties,
                           ResourceLoader resourceLoader,
                           @Qualifier("registryMapper") ObjectMapper registryMapper) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
        this.registryMapper = registryMapper;
    }

    @PostConstruct
    public void init() {
        List<ServiceSpec> loaded = load();
        log.info("Service registry loaded from {}: {} services in {} waves",
                properties.getRegistryFile(), loaded.size(), snapshot.waves().size());
    }

    /**
     * Reads and validates the registry file, then makes it current.
     *
     * @return services in topological order
     * @throws ConfigException if the file cannot be read or the dependency graph is invalid;
     *                         the previous registry stays current
     */
    public synchronized List<ServiceSpec> load() {
        List<ServiceSpec> raw = read(properties.getRegistryFile());
        snapshot = validate(raw);
        return snapshot.ordered();
    }

    /** Explicit reload; identical to {@link #load()} but logged as such. */
    public List<ServiceSpec> reload() {
        List<ServiceSpec> loaded = load();
        log.info("Service registry reloaded: {} services", loaded.size());
        return loaded;
    }

    /**
     * Validates an in-memory list of specs and makes it current. Used by tests and by callers
     * that assemble specs programmatically.
     */
    public synchronized List<ServiceSpec> load(List<ServiceSpec> specs) {
        snapshot = validate(specs);
        return snapshot.ordered();
    }

    public List<ServiceSpec> ordered() {
        return snapshot.ordered();
    }

    public List<List<ServiceSpec>> waves() {
        return snapshot.waves();
    }

    public Optional<ServiceSpec> find(String id) {
        return Optional.ofNullable(snapshot.byId().get(id));
    }

    private List<ServiceSpec> read(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ConfigException("Service registry not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            RegistryDocument document = registryMapper.readValue(in, RegistryDocument.class);
            if (document == null || document.services() == null) {
                throw new ConfigException("Service registry " + location + " has no 'services' list");
            }
            return document.services();
        } catch (IOException e) {
            throw new ConfigException("Failed to read service registry " + location + ": " + e.getMessage(), e);
        }
    }

    private Snapshot validate(List<ServiceSpec> raw) {
        Set<String> seen = new HashSet<>();
        List<ServiceSpec> resolved = new ArrayList<>();
        for (ServiceSpec spec : raw) {
            if (spec == null || spec.id() == null || spec.id().isBlank()) {
                throw new ConfigException("Every service needs a non-blank id");
            }
            if (!seen.add(spec.id())) {
                throw new ConfigException("Duplicate service id '" + spec.id() + "'");
            }
            resolved.add(resolve(spec));
        }
        DependencyGraph graph = DependencyGraph.build(resolved);
        Map<String, ServiceSpec> byId = graph.ordered().stream()
                .collect(Collectors.toUnmodifiableMap(ServiceSpec::id, Function.identity()));
        return new Snapshot(graph.ordered(), graph.waves(), byId);
    }

    /**
     * Applies configured defaults and checks the fields each kind needs.
     */
    ServiceSpec resolve(ServiceSpec spec) {
        String id = spec.id();
        if (spec.kind() == null) {
            throw new ConfigException("Service '" + id + "' has no kind");
        }

        HealthCheckSpec hc = spec.healthCheck() != null
                ? spec.healthCheck() : new HealthCheckSpec(null, null, null, null);
        Duration tierTimeout = positiveOr(hc.timeout(), properties.getProbe().getDefaultTimeout());

        LivenessCheck liveness = hc.liveness() != null ? hc.liveness() : new LivenessCheck(null, null, null);
        switch (spec.kind()) {
            case PROCESS, NETWORK_TUNNEL -> {
                if (isBlank(liveness.processPattern()) && liveness.command().isEmpty()) {
                    throw new ConfigException("Service '" + id + "' (" + spec.kind().wireName()
                            + ") needs health-check.liveness.process-pattern or command");
                }
            }
            case CONTAINER -> {
                if (isBlank(liveness.containerName())) {
                    liveness = new LivenessCheck(liveness.processPattern(), id, liveness.command());
                }
            }
            case CONNECTIVITY -> {
                if (spec.connectivity() == null || spec.connectivity().linkCheck().isEmpty()) {
                    throw new ConfigException("Service '" + id + "' (connectivity) needs connectivity.link-check");
                }
            }
        }

        ShallowCheck shallow = hc.shallow();
        if (shallow != null) {
            if (!shallow.isHttp() && (isBlank(shallow.host()) || shallow.port() == null)) {
                throw new ConfigException("Service '" + id + "' shallow check needs url or host and port");
            }
            shallow = new ShallowCheck(shallow.url(), shallow.host(), shallow.port(),
                    positiveOr(shallow.timeout(), tierTimeout));
        }
        DeepCheck deep = hc.deep();
        if (deep != null) {
            if (isBlank(deep.url())) {
                throw new ConfigException("Service '" + id + "' deep check needs url");
            }
            deep = new DeepCheck(deep.url(), deep.flagsPath(), deep.requiredFlags(),
                    positiveOr(deep.timeout(), tierTimeout));
        }

        ActionSpec actions = spec.actions() != null ? spec.actions() : new ActionSpec(null, null, null, null, null);
        if (spec.kind() == ServiceKind.PROCESS && actions.start().isEmpty()) {
            throw new ConfigException("Service '" + id + "' (process) needs actions.start");
        }
        if (spec.kind() == ServiceKind.NETWORK_TUNNEL) {
            if (actions.start().isEmpty()) {
                throw new ConfigException("Service '" + id + "' (network-tunnel) needs actions.start");
            }
            if (spec.remoteEndpoint() == null && shallow == null) {
                throw new ConfigException("Service '" + id + "' (network-tunnel) needs remote-endpoint or a shallow check");
            }
            if (spec.remoteEndpoint() != null && isBlank(spec.remoteEndpoint().sshHost())) {
                throw new ConfigException("Service '" + id + "' remote-endpoint needs ssh-host");
            }
        }
        if ((spec.kind() == ServiceKind.PROCESS || spec.kind() == ServiceKind.NETWORK_TUNNEL)
                && isBlank(liveness.processPattern()) && actions.stop().isEmpty()) {
            throw new ConfigException("Service '" + id + "' needs actions.stop when no process-pattern is given");
        }
        actions = new ActionSpec(actions.start(), actions.stop(), actions.restart(),
                nonNegativeOr(actions.maxWait(), properties.getAction().getMaxWait()),
                positiveOr(actions.pollInterval(), properties.getAction().getPollInterval()));

        RestartBudget budget = spec.restartBudget();
        int maxActions = budget != null && budget.maxActions() != 0
                ? budget.maxActions() : properties.getBudget().getMaxActions();
        if (maxActions < 1) {
            throw new ConfigException("Service '" + id + "' restart-budget.max-actions must be at least 1");
        }
        Duration window = positiveOr(budget != null ? budget.window() : null, properties.getBudget().getWindow());

        int escalateAfter = spec.escalateAfter() > 0
                ? spec.escalateAfter() : properties.getEscalation().getEscalateAfter();

        ConnectivitySpec connectivity = spec.connectivity();
        if (connectivity != null) {
            connectivity = new ConnectivitySpec(connectivity.linkCheck(), connectivity.associatedPattern(),
                    connectivity.disable(), connectivity.enable(), connectivity.reachabilityTargets(),
                    connectivity.reachabilityUrl(),
                    nonNegativeOr(connectivity.bounceDelay(), Duration.ofSeconds(3)),
                    nonNegativeOr(connectivity.maxWait(), properties.getAction().getMaxWait()),
                    positiveOr(connectivity.pollInterval(), properties.getAction().getPollInterval()));
        }

        return new ServiceSpec(id, spec.kind(), spec.description(), spec.dependsOn(),
                spec.requiresNetwork(),
                new HealthCheckSpec(liveness, shallow, deep, tierTimeout),
                actions,
                new RestartBudget(maxActions, window),
                escalateAfter,
                spec.remoteEndpoint(),
                connectivity);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value != null && !value.isNegative() && !value.isZero() ? value : fallback;
    }

    private static Duration nonNegativeOr(Duration value, Duration fallback) {
        return value != null && !value.isNegative() ? value : fallback;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /** Root of the registry YAML. */
    public record RegistryDocument(List<ServiceSpec> services) {
    }

    private record Snapshot(List<ServiceSpec> ordered, List<List<ServiceSpec>> waves, Map<String, ServiceSpec> byId) {
    }
}
