package io.agentmesh.agent;

import io.agentmesh.model.AgentTier;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/** Emits {@value #TICK_EVENT} on every tick. */
public final class ClockAgent extends AbstractAgent {
    public static final String AGENT_ID = "clock";
    public static final String TICK_EVENT = "clock:tick";

    private final AtomicLong sequence = new AtomicLong();

    public ClockAgent(AgentContext context, long tickRateMs) {
        this(AgentConfig.of(AGENT_ID, "Clock", AgentTier.FOUNDATION)
                .withDescription("Publishes a heartbeat on every tick"), context, tickRateMs);
    }

    public ClockAgent(AgentConfig config, AgentContext context, long tickRateMs) {
        super(config, context, tickRateMs);
        if (tickRateMs <= 0) {
            throw new IllegalArgumentException("clock tick rate must be > 0: " + tickRateMs);
        }
    }

    @Override
    protected void onStart() {
        sequence.set(0L);
    }

    @Override
    protected void onTick() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sequence", sequence.incrementAndGet());
        payload.put("timestamp", Instant.now().toEpochMilli());
        emit(TICK_EVENT, payload);
    }
}
