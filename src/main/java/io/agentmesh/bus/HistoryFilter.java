package io.agentmesh.bus;

import io.agentmesh.model.Event;

/**
 * All fields optional. {@code typePattern} uses subscription pattern syntax;
 * {@code limit} keeps the newest matching events.
 */
public record HistoryFilter(String typePattern, String source, Long since, Integer limit) {
    public static HistoryFilter all() {
        return new HistoryFilter(null, null, null, null);
    }

    public static HistoryFilter ofType(String typePattern) {
        return new HistoryFilter(typePattern, null, null, null);
    }

    public HistoryFilter withSource(String value) {
        return new HistoryFilter(typePattern, value, since, limit);
    }

    public HistoryFilter withSince(long epochMs) {
        return new HistoryFilter(typePattern, source, epochMs, limit);
    }

    public HistoryFilter withLimit(int value) {
        return new HistoryFilter(typePattern, source, since, value);
    }

    boolean accepts(Event event, SubscriptionPattern compiledType) {
        if (compiledType != null && !compiledType.matches(event.type())) {
            return false;
        }
        if (source != null && !source.equals(event.source())) {
            return false;
        }
        return since == null || event.timestamp() >= since;
    }
}
