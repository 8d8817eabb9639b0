package io.agentmesh.agent;

import io.agentmesh.model.AgentTier;
import io.agentmesh.model.Event;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** Answers {@value #REQUEST_EVENT} requests with the payload it received. */
public final class EchoAgent extends AbstractAgent {
    public static final String AGENT_ID = "echo";
    public static final String REQUEST_EVENT = "echo:request";

    public EchoAgent(AgentContext context) {
        this(AgentConfig.of(AGENT_ID, "Echo", AgentTier.FOUNDATION)
                .withDescription("Replies to echo:request with the received payload"), context);
    }

    public EchoAgent(AgentConfig config, AgentContext context) {
        super(config, context);
    }

    @Override
    protected void onStart() {
        subscribe(REQUEST_EVENT, this::answer);
    }

    private void answer(Event request) {
        if (!request.isRequest()) {
            return;
        }
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("agent", id());
        output.put("timestamp", Instant.now().toString());
        output.put("correlationId", request.correlationId());
        output.put("received", request.payload());
        reply(request, output);
    }
}
