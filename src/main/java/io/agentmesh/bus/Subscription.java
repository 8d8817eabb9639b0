package io.agentmesh.bus;

import io.agentmesh.model.Event;

/**
 * Handle returned by {@link EventBus#subscribe}. {@link #cancel()} is the symmetric
 * cleanup for the registration that produced it.
 */
public final class Subscription {
    private final String id;
    private final SubscriptionPattern pattern;
    private final EventHandler handler;
    private final SubscribeOptions options;
    private final EventBus bus;

    Subscription(String id, SubscriptionPattern pattern, EventHandler handler, SubscribeOptions options, EventBus bus) {
        this.id = id;
        this.pattern = pattern;
        this.handler = handler;
        this.options = options;
        this.bus = bus;
    }

    public String id() {
        return id;
    }

    public String pattern() {
        return pattern.raw();
    }

    public boolean once() {
        return options.once();
    }

    public int priority() {
        return options.priority();
    }

    public boolean cancel() {
        return bus.unsubscribe(id);
    }

    EventHandler handler() {
        return handler;
    }

    boolean accepts(Event event) {
        return options.filter() == null || options.filter().test(event);
    }

    @Override
    public String toString() {
        return "Subscription[" + id + " " + pattern.raw() + (options.once() ? " once" : "") + "]";
    }
}
