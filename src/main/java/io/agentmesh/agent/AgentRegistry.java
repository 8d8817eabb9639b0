package io.agentmesh.agent;

import io.agentmesh.bus.EmitOptions;
import io.agentmesh.bus.EventBus;
import io.agentmesh.bus.Subscription;
import io.agentmesh.model.AgentStatus;
import io.agentmesh.model.AgentTier;
import io.agentmesh.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Catalog of agents with tier indexing and dependency-ordered start/stop.
 *
 * <p>An agent may only depend on agents already registered, and an agent cannot be
 * unregistered while others depend on it. Registry changes are announced on the bus
 * with source {@value #REGISTRY_SOURCE}.
 */
public final class AgentRegistry implements AutoCloseable {
    public static final String REGISTERED_EVENT = "registry:agent_registered";
    public static final String UNREGISTERED_EVENT = "registry:agent_unregistered";
    public static final String ALL_STARTED_EVENT = "registry:all_started";
    public static final String ALL_STOPPED_EVENT = "registry:all_stopped";
    public static final String REGISTRY_SOURCE = "registry";

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final EventBus bus;
    private final Map<String, AgentRecord> agents = new LinkedHashMap<>();
    private final Map<AgentTier, Set<String>> tierIndex = new EnumMap<>(AgentTier.class);
    private final Map<String, Set<String>> dependencyGraph = new LinkedHashMap<>();
    private final Map<String, AtomicLong> errorTally = new ConcurrentHashMap<>();
    private final Subscription errorWatch;

    public AgentRegistry(EventBus bus) {
        if (bus == null) {
            throw new IllegalArgumentException("agent registry requires an event bus");
        }
        this.bus = bus;
        for (AgentTier tier : AgentTier.values()) {
            tierIndex.put(tier, new LinkedHashSet<>());
        }
        this.errorWatch = bus.subscribe(AbstractAgent.ERROR_EVENT, this::tallyError);
    }

    public void register(Agent agent) {
        if (agent == null) {
            throw new IllegalArgumentException("agent cannot be null");
        }
        AgentConfig config = agent.config();
        String agentId = config.id();
        synchronized (this) {
            if (agents.containsKey(agentId)) {
                throw new IllegalArgumentException("Agent " + agentId + " already registered");
            }
            for (String dependency : config.dependencies()) {
                if (!agents.containsKey(dependency)) {
                    throw new IllegalArgumentException(
                            "Agent " + agentId + " depends on " + dependency + ", which is not registered");
                }
            }
            agents.put(agentId, new AgentRecord(config, agent, Instant.now().toEpochMilli()));
            tierIndex.get(config.tier()).add(agentId);
            dependencyGraph.put(agentId, new LinkedHashSet<>(config.dependencies()));
        }
        log.info("Registered agent {} (tier={}, dependencies={})", agentId, config.tier().wireName(), config.dependencies());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("agentId", agentId);
        payload.put("name", config.name());
        payload.put("tier", config.tier().wireName());
        announce(REGISTERED_EVENT, payload);
    }

    /**
     * Stops and removes an agent.
     *
     * @return false if no agent has this id
     * @throws IllegalStateException if registered agents still depend on it
     */
    public boolean unregister(String agentId) {
        AgentRecord record;
        synchronized (this) {
            record = agents.get(agentId);
            if (record == null) {
                return false;
            }
            List<String> dependents = getDependents(agentId);
            if (!dependents.isEmpty()) {
                throw new IllegalStateException(
                        "Cannot unregister " + agentId + ": required by " + String.join(", ", dependents));
            }
            try {
                record.instance().stop();
            } catch (Throwable t) {
                log.warn("Agent {} failed to stop while unregistering: {}", agentId, t.getMessage(), t);
            }
            agents.remove(agentId);
            tierIndex.get(record.config().tier()).remove(agentId);
            dependencyGraph.remove(agentId);
        }
        errorTally.remove(agentId);
        log.info("Unregistered agent {}", agentId);
        announce(UNREGISTERED_EVENT, Map.of("agentId", agentId));
        return true;
    }

    public synchronized Optional<Agent> get(String agentId) {
        AgentRecord record = agents.get(agentId);
        return record == null ? Optional.empty() : Optional.of(record.instance());
    }

    public synchronized Optional<AgentRecord> getRecord(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public synchronized Optional<AgentConfig> getConfig(String agentId) {
        AgentRecord record = agents.get(agentId);
        return record == null ? Optional.empty() : Optional.of(record.config());
    }

    public synchronized boolean has(String agentId) {
        return agents.containsKey(agentId);
    }

    public synchronized int count() {
        return agents.size();
    }

    public synchronized List<Agent> getAll() {
        List<Agent> out = new ArrayList<>(agents.size());
        for (AgentRecord record : agents.values()) {
            out.add(record.instance());
        }
        return out;
    }

    public synchronized List<Agent> getByTier(AgentTier tier) {
        List<Agent> out = new ArrayList<>();
        for (String agentId : tierIndex.get(tier)) {
            out.add(agents.get(agentId).instance());
        }
        return out;
    }

    public List<Agent> find(AgentCriteria criteria) {
        AgentCriteria safe = criteria == null ? AgentCriteria.any() : criteria;
        Pattern name = safe.compiledName();
        List<Agent> out = new ArrayList<>();
        for (AgentRecord record : snapshot()) {
            if (safe.tier() != null && record.config().tier() != safe.tier()) {
                continue;
            }
            if (safe.status() != null && record.instance().status() != safe.status()) {
                continue;
            }
            if (name != null && !name.matcher(record.config().name()).find()) {
                continue;
            }
            out.add(record.instance());
        }
        return out;
    }

    public synchronized List<String> getDependencies(String agentId) {
        Set<String> deps = dependencyGraph.get(agentId);
        return deps == null ? List.of() : List.copyOf(deps);
    }

    public synchronized List<String> getDependents(String agentId) {
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, Set<String>> entry : dependencyGraph.entrySet()) {
            if (entry.getValue().contains(agentId)) {
                out.add(entry.getKey());
            }
        }
        return out;
    }

    /** Registered ids ordered so every agent follows all of its dependencies. */
    public synchronized List<String> startOrder() {
        return resolveStartOrder(agents.keySet(), dependencyGraph);
    }

    /**
     * Starts enabled agents in dependency order. A failing agent is logged and left in
     * {@code ERROR}; the remaining agents still start.
     */
    public void startAll() {
        List<String> order = startOrder();
        int started = 0;
        for (String agentId : order) {
            AgentRecord record = getRecord(agentId).orElse(null);
            if (record == null) {
                continue;
            }
            if (!record.config().enabled()) {
                log.info("Skipping disabled agent {}", agentId);
                continue;
            }
            try {
                record.instance().start();
            } catch (Throwable t) {
                log.warn("Agent {} failed to start: {}", agentId, t.getMessage(), t);
            }
            if (record.instance().status() == AgentStatus.RUNNING) {
                started++;
            }
        }
        log.info("Started {}/{} agents in order {}", started, order.size(), order);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("count", order.size());
        payload.put("running", started);
        payload.put("order", order);
        announce(ALL_STARTED_EVENT, payload);
    }

    /** Stops every agent in reverse dependency order, continuing past failures. */
    public void stopAll() {
        List<String> order = new ArrayList<>(startOrder());
        Collections.reverse(order);
        for (String agentId : order) {
            AgentRecord record = getRecord(agentId).orElse(null);
            if (record == null) {
                continue;
            }
            try {
                record.instance().stop();
            } catch (Throwable t) {
                log.warn("Agent {} failed to stop: {}", agentId, t.getMessage(), t);
            }
        }
        log.info("Stopped {} agents", order.size());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("count", order.size());
        payload.put("order", order);
        announce(ALL_STOPPED_EVENT, payload);
    }

    public void startAgent(String agentId) {
        require(agentId).instance().start();
    }

    public void stopAgent(String agentId) {
        require(agentId).instance().stop();
    }

    public RegistryStats getStats() {
        Map<AgentTier, Integer> byTier = new EnumMap<>(AgentTier.class);
        Map<AgentStatus, Integer> byStatus = new EnumMap<>(AgentStatus.class);
        for (AgentTier tier : AgentTier.values()) {
            byTier.put(tier, 0);
        }
        for (AgentStatus status : AgentStatus.values()) {
            byStatus.put(status, 0);
        }
        List<AgentRecord> records = snapshot();
        for (AgentRecord record : records) {
            byTier.merge(record.config().tier(), 1, Integer::sum);
            byStatus.merge(record.instance().status(), 1, Integer::sum);
        }
        Map<String, Long> errors = new TreeMap<>();
        for (Map.Entry<String, AtomicLong> entry : errorTally.entrySet()) {
            errors.put(entry.getKey(), entry.getValue().get());
        }
        return new RegistryStats(records.size(), byTier, byStatus, errors);
    }

    /** Detaches the registry from the bus. Agents are left as they are. */
    @Override
    public void close() {
        errorWatch.cancel();
    }

    /**
     * Depth-first topological order over {@code ids}, visiting them and their
     * dependencies in iteration order.
     *
     * @throws IllegalStateException naming the cycle, e.g. {@code a -> b -> a}
     */
    static List<String> resolveStartOrder(Collection<String> ids, Map<String, ? extends Collection<String>> graph) {
        List<String> order = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        LinkedHashSet<String> visiting = new LinkedHashSet<>();
        for (String agentId : ids) {
            visit(agentId, graph, visiting, visited, order);
        }
        return order;
    }

    private static void visit(
            String agentId,
            Map<String, ? extends Collection<String>> graph,
            LinkedHashSet<String> visiting,
            Set<String> visited,
            List<String> order
    ) {
        if (visited.contains(agentId)) {
            return;
        }
        if (!visiting.add(agentId)) {
            List<String> path = new ArrayList<>(visiting);
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(agentId), path.size()));
            cycle.add(agentId);
            throw new IllegalStateException("Dependency cycle detected: " + String.join(" -> ", cycle));
        }
        Collection<String> deps = graph.get(agentId);
        if (deps != null) {
            for (String dependency : deps) {
                visit(dependency, graph, visiting, visited, order);
            }
        }
        visiting.remove(agentId);
        visited.add(agentId);
        order.add(agentId);
    }

    private synchronized List<AgentRecord> snapshot() {
        return new ArrayList<>(agents.values());
    }

    private AgentRecord require(String agentId) {
        return getRecord(agentId).orElseThrow(() -> new IllegalArgumentException("Agent not found: " + agentId));
    }

    @SuppressWarnings("unchecked")
    private void tallyError(Event event) {
        if (!(event.payload() instanceof Map)) {
            return;
        }
        Object agentId = ((Map<String, Object>) event.payload()).get("agentId");
        if (agentId != null && has(agentId.toString())) {
            errorTally.computeIfAbsent(agentId.toString(), ignored -> new AtomicLong()).incrementAndGet();
        }
    }

    private void announce(String type, Map<String, Object> payload) {
        if (bus.isClosed()) {
            log.debug("Skipped {}: bus closed", type);
            return;
        }
        bus.emit(type, payload, EmitOptions.from(REGISTRY_SOURCE));
    }
}
