package io.agentmesh.model;

import java.util.Map;

/**
 * Immutable bus message. {@code target}, {@code correlationId} and {@code replyTo}
 * are null when not set; {@code metadata} is never null.
 */
public record Event(
        String id,
        String type,
        Object payload,
        String source,
        String target,
        Priority priority,
        long timestamp,
        String correlationId,
        String replyTo,
        Map<String, Object> metadata
) {
    public Event {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("event id cannot be empty");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("event type cannot be empty");
        }
        source = source == null || source.isBlank() ? "system" : source;
        priority = priority == null ? Priority.NORMAL : priority;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean isRequest() {
        return replyTo != null && !replyTo.isBlank();
    }

    @SuppressWarnings("unchecked")
    public <T> T payloadAs(Class<T> type) {
        if (payload == null) {
            return null;
        }
        if (!type.isInstance(payload)) {
            throw new ClassCastException("Event " + id + " payload is " + payload.getClass().getName()
                    + ", not " + type.getName());
        }
        return (T) payload;
    }
}
