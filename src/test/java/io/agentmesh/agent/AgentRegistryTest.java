package io.agentmesh.agent;

import io.agentmesh.bus.EventBus;
import io.agentmesh.bus.HistoryFilter;
import io.agentmesh.model.AgentStatus;
import io.agentmesh.model.AgentTier;
import io.agentmesh.model.Event;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

final class AgentRegistryTest {
    private static final Duration IDLE = Duration.ofSeconds(5);

    private EventBus bus;
    private ScheduledExecutorService ticker;
    private AgentRegistry registry;
    private List<String> journal;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
        ticker = Executors.newSingleThreadScheduledExecutor();
        registry = new AgentRegistry(bus);
        journal = Collections.synchronizedList(new ArrayList<>());
    }

    @AfterEach
    void tearDown() {
        registry.close();
        ticker.shutdownNow();
        bus.close();
    }

    @Test
    void dependencyStartsCompletelyBeforeDependent() {
        registry.register(new RecordingAgent(AgentConfig.of("base", "Base", AgentTier.FOUNDATION), journal));
        registry.register(new RecordingAgent(
                AgentConfig.of("derived", "Derived", AgentTier.DECISION).withDependencies("base"), journal));

        registry.startAll();

        Assertions.assertEquals(
                List.of("begin-start:base", "end-start:base", "begin-start:derived", "end-start:derived"),
                journal
        );
    }

    @Test
    void startOrderFollowsDependenciesNotRegistrationOrder() {
        registry.register(new RecordingAgent(AgentConfig.of("storage", "Storage", AgentTier.FOUNDATION), journal));
        registry.register(new RecordingAgent(AgentConfig.of("clock", "Clock", AgentTier.FOUNDATION), journal));
        registry.register(new RecordingAgent(
                AgentConfig.of("planner", "Planner", AgentTier.DECISION).withDependencies("clock", "storage"), journal));
        registry.register(new RecordingAgent(
                AgentConfig.of("sensor", "Sensor", AgentTier.SENSING).withDependencies("clock"), journal));

        List<String> order = registry.startOrder();

        Assertions.assertTrue(order.indexOf("clock") < order.indexOf("planner"));
        Assertions.assertTrue(order.indexOf("storage") < order.indexOf("planner"));
        Assertions.assertTrue(order.indexOf("clock") < order.indexOf("sensor"));
        Assertions.assertEquals(4, order.size());
    }

    @Test
    void stopAllRunsInReverseDependencyOrder() {
        registry.register(new RecordingAgent(AgentConfig.of("base", "Base", AgentTier.FOUNDATION), journal));
        registry.register(new RecordingAgent(
                AgentConfig.of("mid", "Mid", AgentTier.SENSING).withDependencies("base"), journal));
        registry.register(new RecordingAgent(
                AgentConfig.of("top", "Top", AgentTier.ORCHESTRATION).withDependencies("mid"), journal));
        registry.startAll();
        journal.clear();

        registry.stopAll();

        Assertions.assertEquals(List.of("stop:top", "stop:mid", "stop:base"), journal);
    }

    @Test
    void registrationRejectsDuplicatesAndUnknownDependencies() {
        registry.register(new RecordingAgent(AgentConfig.of("a", "A", AgentTier.FOUNDATION), journal));

        IllegalArgumentException duplicate = Assertions.assertThrows(
                IllegalArgumentException.class,
                () -> registry.register(new RecordingAgent(AgentConfig.of("a", "Again", AgentTier.FOUNDATION), journal))
        );
        Assertions.assertTrue(duplicate.getMessage().contains("already registered"));

        IllegalArgumentException missing = Assertions.assertThrows(
                IllegalArgumentException.class,
                () -> registry.register(new RecordingAgent(
                        AgentConfig.of("b", "B", AgentTier.DECISION).withDependencies("ghost"), journal))
        );
        Assertions.assertTrue(missing.getMessage().contains("ghost"));
        Assertions.assertFalse(registry.has("b"));
        Assertions.assertEquals(1, registry.count());
    }

    @Test
    void unregisterIsBlockedByDependentsAndStopsTheAgent() throws Exception {
        registry.register(new RecordingAgent(AgentConfig.of("base", "Base", AgentTier.FOUNDATION), journal));
        registry.register(new RecordingAgent(
                AgentConfig.of("derived", "Derived", AgentTier.DECISION).withDependencies("base"), journal));

        IllegalStateException blocked = Assertions.assertThrows(IllegalStateException.class,
                () -> registry.unregister("base"));
        Assertions.assertTrue(blocked.getMessage().contains("derived"));
        Assertions.assertTrue(registry.has("base"));

        Assertions.assertFalse(registry.unregister("nobody"));
        Assertions.assertTrue(registry.unregister("derived"));
        Assertions.assertTrue(journal.contains("stop:derived"));
        Assertions.assertTrue(registry.unregister("base"));
        Assertions.assertEquals(0, registry.count());

        Assertions.assertTrue(bus.awaitIdle(IDLE));
        Assertions.assertEquals(2, bus.getHistory(HistoryFilter.ofType(AgentRegistry.UNREGISTERED_EVENT)).size());
        Assertions.assertEquals(2, bus.getHistory(HistoryFilter.ofType(AgentRegistry.REGISTERED_EVENT)).size());
    }

    @Test
    void unregisterStopsAgentWhileItIsStillRegistered() {
        List<Boolean> registeredDuringStop = new ArrayList<>();
        registry.register(new RecordingAgent(AgentConfig.of("leaving", "Leaving", AgentTier.EXECUTION), journal) {
            @Override
            public void stop() {
                registeredDuringStop.add(registry.has(id()));
                super.stop();
            }
        });

        Assertions.assertTrue(registry.unregister("leaving"));

        Assertions.assertEquals(List.of(true), registeredDuringStop);
        Assertions.assertFalse(registry.has("leaving"));
        Assertions.assertTrue(registry.getByTier(AgentTier.EXECUTION).isEmpty());
    }

    @Test
    void startAllStartsRemainingAgentsAfterAnAgentErrors() {
        AgentContext context = new AgentContext(bus, ticker);
        registry.register(new FailingStartAgent(AgentConfig.of("first", "First", AgentTier.EXECUTION), context) {
            @Override
            protected void onStart() {
                throw new ExceptionInInitializerError("static init failed");
            }
        });
        registry.register(new RecordingAgent(AgentConfig.of("second", "Second", AgentTier.EXECUTION), journal) {
            @Override
            public void start() {
                throw new OutOfMemoryError("no room for buffers");
            }
        });
        registry.register(new RecordingAgent(AgentConfig.of("third", "Third", AgentTier.EXECUTION), journal));

        registry.startAll();

        Assertions.assertEquals(AgentStatus.ERROR, registry.get("first").orElseThrow().status());
        Assertions.assertEquals(AgentStatus.IDLE, registry.get("second").orElseThrow().status());
        Assertions.assertEquals(AgentStatus.RUNNING, registry.get("third").orElseThrow().status());
        Assertions.assertEquals(List.of("begin-start:third", "end-start:third"), journal);
    }

    @Test
    void cycleInDependencyGraphIsReported() {
        Map<String, Set<String>> graph = new LinkedHashMap<>();
        graph.put("a", Set.of("b"));
        graph.put("b", Set.of("a"));

        IllegalStateException cycle = Assertions.assertThrows(IllegalStateException.class,
                () -> AgentRegistry.resolveStartOrder(graph.keySet(), graph));

        Assertions.assertEquals("Dependency cycle detected: a -> b -> a", cycle.getMessage());
    }

    @Test
    void resolveStartOrderPlacesSharedDependencyOnce() {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        graph.put("left", List.of("root"));
        graph.put("right", List.of("root"));
        graph.put("root", List.of());

        Assertions.assertEquals(List.of("root", "left", "right"),
                AgentRegistry.resolveStartOrder(graph.keySet(), graph));
    }

    @Test
    void startAllContinuesPastFailuresAndSkipsDisabledAgents() throws Exception {
        AgentContext context = new AgentContext(bus, ticker);
        registry.register(new FailingStartAgent(AgentConfig.of("bad", "Bad", AgentTier.EXECUTION), context));
        registry.register(new RecordingAgent(AgentConfig.of("good", "Good", AgentTier.EXECUTION), journal));
        registry.register(new RecordingAgent(
                AgentConfig.of("off", "Off", AgentTier.LEARNING).withEnabled(false), journal));

        registry.startAll();

        Assertions.assertEquals(AgentStatus.ERROR, registry.get("bad").orElseThrow().status());
        Assertions.assertEquals(AgentStatus.RUNNING, registry.get("good").orElseThrow().status());
        Assertions.assertEquals(AgentStatus.IDLE, registry.get("off").orElseThrow().status());

        Assertions.assertTrue(bus.awaitIdle(IDLE));
        RegistryStats stats = registry.getStats();
        Assertions.assertEquals(3, stats.total());
        Assertions.assertEquals(2, stats.byTier().get(AgentTier.EXECUTION));
        Assertions.assertEquals(0, stats.byTier().get(AgentTier.SENSING));
        Assertions.assertEquals(1, stats.byStatus().get(AgentStatus.ERROR));
        Assertions.assertEquals(Map.of("bad", 1L), stats.errorsByAgent());

        Event started = bus.getHistory(HistoryFilter.ofType(AgentRegistry.ALL_STARTED_EVENT)).get(0);
        Assertions.assertEquals(AgentRegistry.REGISTRY_SOURCE, started.source());
        Assertions.assertEquals(1, started.payloadAs(Map.class).get("running"));
    }

    @Test
    void findCombinesTierStatusAndCaseInsensitiveName() {
        registry.register(new RecordingAgent(AgentConfig.of("p1", "Price Watcher", AgentTier.SENSING), journal));
        registry.register(new RecordingAgent(AgentConfig.of("p2", "price router", AgentTier.EXECUTION), journal));
        registry.register(new RecordingAgent(AgentConfig.of("v1", "Volume Watcher", AgentTier.SENSING), journal));
        registry.startAgent("p1");

        Assertions.assertEquals(List.of("p1", "p2"), ids(registry.find(AgentCriteria.any().withName("^price"))));
        Assertions.assertEquals(List.of("p1", "v1"), ids(registry.find(AgentCriteria.any().withTier(AgentTier.SENSING))));
        Assertions.assertEquals(List.of("p1"), ids(registry.find(
                AgentCriteria.any().withTier(AgentTier.SENSING).withStatus(AgentStatus.RUNNING))));
        Assertions.assertEquals(List.of("p1", "v1"), ids(registry.getByTier(AgentTier.SENSING)));
        Assertions.assertEquals(List.of("p1", "p2", "v1"), ids(registry.find(null)));
    }

    @Test
    void lookupsAndSingleAgentControl() {
        AgentConfig config = AgentConfig.of("solo", "Solo", AgentTier.SPECIALIZED)
                .withDescription("standalone")
                .withSettings(Map.of("threshold", 3));
        registry.register(new RecordingAgent(config, journal));

        Assertions.assertEquals(config, registry.getConfig("solo").orElseThrow());
        Assertions.assertTrue(registry.getRecord("solo").orElseThrow().registeredAtMs() > 0L);
        Assertions.assertTrue(registry.getDependencies("solo").isEmpty());
        Assertions.assertTrue(registry.get("missing").isEmpty());

        registry.startAgent("solo");
        registry.stopAgent("solo");
        Assertions.assertEquals(List.of("begin-start:solo", "end-start:solo", "stop:solo"), journal);
        Assertions.assertThrows(IllegalArgumentException.class, () -> registry.startAgent("missing"));
    }

    private static List<String> ids(List<Agent> agents) {
        List<String> out = new ArrayList<>();
        for (Agent agent : agents) {
            out.add(agent.id());
        }
        return out;
    }

    private static class RecordingAgent implements Agent {
        private final AgentConfig config;
        private final List<String> journal;
        private volatile AgentStatus status = AgentStatus.IDLE;

        RecordingAgent(AgentConfig config, List<String> journal) {
            this.config = config;
            this.journal = journal;
        }

        @Override
        public AgentConfig config() {
            return config;
        }

        @Override
        public void start() {
            journal.add("begin-start:" + id());
            status = AgentStatus.RUNNING;
            journal.add("end-start:" + id());
        }

        @Override
        public void stop() {
            journal.add("stop:" + id());
            status = AgentStatus.STOPPED;
        }

        @Override
        public void pause() {
            status = AgentStatus.PAUSED;
        }

        @Override
        public void resume() {
            status = AgentStatus.RUNNING;
        }

        @Override
        public AgentStatus status() {
            return status;
        }
    }

    private static class FailingStartAgent extends AbstractAgent {
        FailingStartAgent(AgentConfig config, AgentContext context) {
            super(config, context);
        }

        @Override
        protected void onStart() {
            throw new IllegalStateException("dependency unavailable");
        }
    }
}
