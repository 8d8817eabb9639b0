package io.agentmesh.runtime;

import io.agentmesh.agent.Agent;
import io.agentmesh.agent.AgentContext;
import io.agentmesh.agent.AgentMetrics;
import io.agentmesh.agent.AgentRegistry;
import io.agentmesh.bus.EventBus;
import io.agentmesh.config.AgentMeshConfig;
import io.agentmesh.config.RuntimeSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

public final class AgentMeshRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AgentMeshRuntime.class);

    private final AgentMeshConfig config;
    private final RuntimeSettings settings;
    private final EventBus bus;
    private final ScheduledExecutorService ticker;
    private final AgentRegistry registry;
    private final AgentContext context;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public AgentMeshRuntime(AgentMeshConfig config) {
        this(config, RuntimeSettings.load(config.settingsFile()));
    }

    public AgentMeshRuntime(AgentMeshConfig config, RuntimeSettings settings) {
        this.config = config;
        this.settings = settings;
        this.bus = new EventBus(settings);
        this.ticker = Executors.newScheduledThreadPool(settings.tickThreads(), tickThreadFactory());
        this.registry = new AgentRegistry(bus);
        this.context = new AgentContext(bus, ticker);
        log.info("Runtime ready (root={}, settings={})", config.rootDir(), settings);
    }

    public AgentMeshConfig config() {
        return config;
    }

    public RuntimeSettings settings() {
        return settings;
    }

    public EventBus bus() {
        return bus;
    }

    public AgentRegistry registry() {
        return registry;
    }

    /** Context to construct agents with; they share this runtime's bus and scheduler. */
    public AgentContext context() {
        return context;
    }

    public void register(Agent agent) {
        registry.register(agent);
    }

    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Runtime is closed");
        }
        stopped.set(false);
        registry.startAll();
    }

    /**
     * Stops every agent in reverse dependency order and waits for the bus to deliver
     * what they emitted while stopping. The runtime can be started again.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        registry.stopAll();
        try {
            if (!bus.awaitIdle(Duration.ofMillis(settings.shutdownGraceMs()))) {
                log.warn("Event bus still busy after {}ms; continuing shutdown", settings.shutdownGraceMs());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the event bus to drain");
        }
    }

    public RuntimeStats stats() {
        List<AgentMetrics> agents = new ArrayList<>();
        for (Agent agent : registry.getAll()) {
            agents.add(agent.metrics());
        }
        return new RuntimeStats(bus.getStats(), registry.getStats(), agents);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        stop();
        registry.close();
        ticker.shutdown();
        try {
            if (!ticker.awaitTermination(settings.shutdownGraceMs(), TimeUnit.MILLISECONDS)) {
                ticker.shutdownNow();
                log.warn("Tick scheduler did not stop within {}ms", settings.shutdownGraceMs());
            }
        } catch (InterruptedException e) {
            ticker.shutdownNow();
            Thread.currentThread().interrupt();
        }
        bus.close();
        log.info("Runtime closed");
    }

    private static ThreadFactory tickThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "agentmesh-tick-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
