package io.agentmesh.bus;

import io.agentmesh.model.Event;

import java.util.function.Predicate;

/**
 * @param priority higher values are invoked first among the handlers matched for one event
 * @param filter   events rejected by the filter skip this handler; null accepts all
 * @param once     remove the subscription after its first successful delivery
 */
public record SubscribeOptions(int priority, Predicate<Event> filter, boolean once) {
    public static SubscribeOptions defaults() {
        return new SubscribeOptions(0, null, false);
    }

    public static SubscribeOptions onceOnly() {
        return new SubscribeOptions(0, null, true);
    }

    public SubscribeOptions withPriority(int value) {
        return new SubscribeOptions(value, filter, once);
    }

    public SubscribeOptions withFilter(Predicate<Event> value) {
        return new SubscribeOptions(priority, value, once);
    }

    public SubscribeOptions withOnce(boolean value) {
        return new SubscribeOptions(priority, filter, value);
    }
}
