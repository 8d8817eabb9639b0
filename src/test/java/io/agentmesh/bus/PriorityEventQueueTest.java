package io.agentmesh.bus;

import io.agentmesh.model.Event;
import io.agentmesh.model.Priority;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

final class PriorityEventQueueTest {

    @Test
    void drainsHigherLanesFirstAndKeepsFifoWithinLane() {
        PriorityEventQueue queue = new PriorityEventQueue();
        queue.enqueue(event("low-1"), Priority.LOW);
        queue.enqueue(event("normal-1"), Priority.NORMAL);
        queue.enqueue(event("critical-1"), Priority.CRITICAL);
        queue.enqueue(event("normal-2"), Priority.NORMAL);
        queue.enqueue(event("high-1"), Priority.HIGH);
        queue.enqueue(event("critical-2"), Priority.CRITICAL);

        List<String> drained = new ArrayList<>();
        Optional<Event> next;
        while ((next = queue.dequeue()).isPresent()) {
            drained.add(next.get().id());
        }

        Assertions.assertEquals(
                List.of("critical-1", "critical-2", "high-1", "normal-1", "normal-2", "low-1"),
                drained
        );
        Assertions.assertTrue(queue.isEmpty());
    }

    @Test
    void nullPriorityLandsInNormalLane() {
        PriorityEventQueue queue = new PriorityEventQueue();
        queue.enqueue(event("a"), null);

        Map<Priority, Integer> sizes = queue.sizeByPriority();
        Assertions.assertEquals(1, sizes.get(Priority.NORMAL));
        Assertions.assertEquals(0, sizes.get(Priority.CRITICAL));
        Assertions.assertEquals(1, queue.size());
    }

    @Test
    void peekDoesNotRemoveAndClearEmptiesAllLanes() {
        PriorityEventQueue queue = new PriorityEventQueue();
        Assertions.assertTrue(queue.peek().isEmpty());
        Assertions.assertTrue(queue.dequeue().isEmpty());

        queue.enqueue(event("low"), Priority.LOW);
        queue.enqueue(event("high"), Priority.HIGH);

        Assertions.assertEquals("high", queue.peek().orElseThrow().id());
        Assertions.assertEquals(2, queue.size());

        queue.clear();
        Assertions.assertEquals(0, queue.size());
        Assertions.assertTrue(queue.peek().isEmpty());
    }

    private static Event event(String id) {
        return new Event(id, "test:event", null, "test", null, Priority.NORMAL, 0L, null, null, null);
    }
}
