package io.agentmesh.agent;

import io.agentmesh.bus.EmitOptions;
import io.agentmesh.bus.EventBus;
import io.agentmesh.bus.EventHandler;
import io.agentmesh.bus.SubscribeOptions;
import io.agentmesh.bus.Subscription;
import io.agentmesh.model.AgentStatus;
import io.agentmesh.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lifecycle skeleton for agents.
 *
 * <p>Concrete agents implement {@link #onStart()} and may override {@link #onTick()} and
 * {@link #onStop()}. With a positive tick rate, {@link #onTick()} runs on the shared
 * scheduler from {@link AgentContext} while the agent is {@code RUNNING}; a tick that is
 * still executing when the next one fires causes that next one to be skipped.
 *
 * <p>A failure in {@code onStart} or {@code onTick} moves the agent to {@code ERROR},
 * cancels its ticks and emits {@value #ERROR_EVENT}. Subscriptions made through
 * {@link #subscribe} stay registered but deliver nothing until a later {@link #start()}
 * replaces them.
 */
public abstract class AbstractAgent implements Agent {
    public static final String STARTED_EVENT = "agent:started";
    public static final String STOPPED_EVENT = "agent:stopped";
    public static final String PAUSED_EVENT = "agent:paused";
    public static final String RESUMED_EVENT = "agent:resumed";
    public static final String ERROR_EVENT = "agent:error";

    private static final Logger log = LoggerFactory.getLogger(AbstractAgent.class);

    private final AgentConfig config;
    private final AgentContext context;
    private final long tickRateMs;

    private final Object lifecycleLock = new Object();
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicBoolean ticking = new AtomicBoolean(false);
    private volatile AgentStatus status = AgentStatus.IDLE;
    private ScheduledFuture<?> tickTask;

    private final AtomicLong tickCount = new AtomicLong();
    private final AtomicLong eventsEmitted = new AtomicLong();
    private final AtomicLong eventsProcessed = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();
    private volatile String lastError;
    private volatile long startedAtMs;

    protected AbstractAgent(AgentConfig config, AgentContext context) {
        this(config, context, 0L);
    }

    protected AbstractAgent(AgentConfig config, AgentContext context, long tickRateMs) {
        if (config == null) {
            throw new IllegalArgumentException("agent config cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("agent context cannot be null: " + config.id());
        }
        if (tickRateMs < 0) {
            throw new IllegalArgumentException("tick rate must be >= 0: " + tickRateMs);
        }
        this.config = config;
        this.context = context;
        this.tickRateMs = tickRateMs;
    }

    protected abstract void onStart() throws Exception;

    protected void onStop() throws Exception {
    }

    protected void onTick() throws Exception {
    }

    @Override
    public final AgentConfig config() {
        return config;
    }

    @Override
    public final AgentStatus status() {
        return status;
    }

    public final long tickRateMs() {
        return tickRateMs;
    }

    protected final AgentContext context() {
        return context;
    }

    protected final EventBus bus() {
        return context.bus();
    }

    @Override
    public final void start() {
        synchronized (lifecycleLock) {
            if (status == AgentStatus.RUNNING || status == AgentStatus.PAUSED) {
                return;
            }
            releaseSubscriptions();
            status = AgentStatus.RUNNING;
            startedAtMs = Instant.now().toEpochMilli();
            try {
                onStart();
                scheduleTicks();
            } catch (Throwable t) {
                releaseSubscriptions();
                fail("start", t);
                return;
            }
        }
        log.info("Agent {} started (tier={}, tickRateMs={})", id(), config.tier().wireName(), tickRateMs);
        announce(STARTED_EVENT, lifecyclePayload());
    }

    @Override
    public final void stop() {
        AgentStatus previous;
        synchronized (lifecycleLock) {
            previous = status;
            if (previous == AgentStatus.STOPPED) {
                return;
            }
            status = AgentStatus.STOPPED;
            cancelTicks();
            releaseSubscriptions();
            if (previous != AgentStatus.IDLE) {
                try {
                    onStop();
                } catch (Throwable t) {
                    recordError(t);
                    log.warn("Agent {} failed while stopping: {}", id(), describe(t), t);
                }
            }
        }
        log.info("Agent {} stopped (was {})", id(), previous);
        announce(STOPPED_EVENT, lifecyclePayload());
    }

    @Override
    public final void pause() {
        synchronized (lifecycleLock) {
            if (status != AgentStatus.RUNNING) {
                return;
            }
            status = AgentStatus.PAUSED;
        }
        log.info("Agent {} paused", id());
        announce(PAUSED_EVENT, lifecyclePayload());
    }

    @Override
    public final void resume() {
        synchronized (lifecycleLock) {
            if (status != AgentStatus.PAUSED) {
                return;
            }
            status = AgentStatus.RUNNING;
        }
        log.info("Agent {} resumed", id());
        announce(RESUMED_EVENT, lifecyclePayload());
    }

    @Override
    public AgentMetrics metrics() {
        return new AgentMetrics(
                id(),
                status,
                tickCount.get(),
                eventsEmitted.get(),
                eventsProcessed.get(),
                errorCount.get(),
                lastError,
                startedAtMs
        );
    }

    protected final String emit(String type, Object payload) {
        return emit(type, payload, EmitOptions.defaults());
    }

    /** Emits with this agent's id as source, whatever source {@code options} carries. */
    protected final String emit(String type, Object payload, EmitOptions options) {
        EmitOptions opts = options == null ? EmitOptions.defaults() : options;
        String eventId = bus().emit(type, payload, opts.withSource(id()));
        eventsEmitted.incrementAndGet();
        return eventId;
    }

    protected final Subscription subscribe(String pattern, EventHandler handler) {
        return subscribe(pattern, handler, SubscribeOptions.defaults());
    }

    protected final Subscription once(String pattern, EventHandler handler) {
        return subscribe(pattern, handler, SubscribeOptions.onceOnly());
    }

    /**
     * Subscribes on behalf of this agent. The subscription is cancelled on {@link #stop()}
     * and only delivers while the agent is running or paused.
     */
    protected final Subscription subscribe(String pattern, EventHandler handler, SubscribeOptions options) {
        Subscription subscription = bus().subscribe(pattern, event -> {
            AgentStatus current = status;
            if (current != AgentStatus.RUNNING && current != AgentStatus.PAUSED) {
                return;
            }
            eventsProcessed.incrementAndGet();
            handler.handle(event);
        }, options);
        subscriptions.add(subscription);
        return subscription;
    }

    protected final <R> CompletableFuture<R> request(String type, Object payload, long timeoutMs) {
        eventsEmitted.incrementAndGet();
        return bus().request(type, payload, timeoutMs, EmitOptions.from(id()));
    }

    /** Answers a request event on its reply topic, keeping its correlation id. */
    protected final String reply(Event request, Object payload) {
        if (!request.isRequest()) {
            throw new IllegalArgumentException("Event " + request.id() + " (" + request.type() + ") expects no reply");
        }
        EmitOptions options = EmitOptions.defaults()
                .withTarget(request.source())
                .withPriority(request.priority())
                .withCorrelation(request.correlationId(), null);
        return emit(request.replyTo(), payload, options);
    }

    private void scheduleTicks() {
        if (tickRateMs <= 0) {
            return;
        }
        tickTask = context.ticker().scheduleAtFixedRate(this::tick, tickRateMs, tickRateMs, TimeUnit.MILLISECONDS);
    }

    private void cancelTicks() {
        if (tickTask != null) {
            tickTask.cancel(false);
            tickTask = null;
        }
    }

    private void tick() {
        if (status != AgentStatus.RUNNING) {
            return;
        }
        if (!ticking.compareAndSet(false, true)) {
            log.debug("Agent {} skipped a tick: previous tick still running", id());
            return;
        }
        try {
            onTick();
            tickCount.incrementAndGet();
        } catch (Throwable t) {
            synchronized (lifecycleLock) {
                if (status == AgentStatus.STOPPED) {
                    recordError(t);
                    return;
                }
                fail("tick", t);
            }
        } finally {
            ticking.set(false);
        }
    }

    // Caller holds lifecycleLock.
    private void fail(String phase, Throwable error) {
        status = AgentStatus.ERROR;
        cancelTicks();
        recordError(error);
        log.warn("Agent {} entered ERROR during {}: {}", id(), phase, describe(error), error);
        Map<String, Object> payload = lifecyclePayload();
        payload.put("phase", phase);
        payload.put("error", describe(error));
        announce(ERROR_EVENT, payload);
    }

    private void recordError(Throwable error) {
        errorCount.incrementAndGet();
        lastError = describe(error);
    }

    private void releaseSubscriptions() {
        List<Subscription> current = new ArrayList<>(subscriptions);
        subscriptions.clear();
        for (Subscription subscription : current) {
            subscription.cancel();
        }
    }

    private Map<String, Object> lifecyclePayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("agentId", id());
        payload.put("name", config.name());
        payload.put("tier", config.tier().wireName());
        return payload;
    }

    private void announce(String type, Map<String, Object> payload) {
        if (bus().isClosed()) {
            log.debug("Skipped {} for agent {}: bus closed", type, id());
            return;
        }
        try {
            emit(type, payload);
        } catch (IllegalStateException closing) {
            log.debug("Skipped {} for agent {}: bus closing", type, id());
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id() + ", " + status + "]";
    }
}
