package io.agentmesh.bus;

import io.agentmesh.model.Event;
import io.agentmesh.model.Priority;

import java.util.ArrayDeque;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * One FIFO lane per {@link Priority}; dequeue scans lanes from CRITICAL down.
 */
public final class PriorityEventQueue {
    private static final Priority[] DRAIN_ORDER = Priority.values();

    private final EnumMap<Priority, ArrayDeque<Event>> lanes;
    private int size;

    public PriorityEventQueue() {
        this.lanes = new EnumMap<>(Priority.class);
        for (Priority priority : DRAIN_ORDER) {
            lanes.put(priority, new ArrayDeque<>());
        }
    }

    public synchronized void enqueue(Event event, Priority priority) {
        Priority lane = priority == null ? Priority.NORMAL : priority;
        lanes.get(lane).addLast(event);
        size++;
    }

    public synchronized Optional<Event> dequeue() {
        for (Priority priority : DRAIN_ORDER) {
            Event next = lanes.get(priority).pollFirst();
            if (next != null) {
                size--;
                return Optional.of(next);
            }
        }
        return Optional.empty();
    }

    public synchronized Optional<Event> peek() {
        for (Priority priority : DRAIN_ORDER) {
            Event next = lanes.get(priority).peekFirst();
            if (next != null) {
                return Optional.of(next);
            }
        }
        return Optional.empty();
    }

    public synchronized int size() {
        return size;
    }

    public synchronized boolean isEmpty() {
        return size == 0;
    }

    public synchronized Map<Priority, Integer> sizeByPriority() {
        Map<Priority, Integer> out = new EnumMap<>(Priority.class);
        for (Priority priority : DRAIN_ORDER) {
            out.put(priority, lanes.get(priority).size());
        }
        return out;
    }

    public synchronized void clear() {
        for (ArrayDeque<Event> lane : lanes.values()) {
            lane.clear();
        }
        size = 0;
    }
}
