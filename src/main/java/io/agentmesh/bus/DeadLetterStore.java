package io.agentmesh.bus;

import io.agentmesh.model.DeadLetter;
import io.agentmesh.model.Event;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Bounded map of event id to failure record. A repeated failure of the same event
 * bumps its retry counter instead of adding a second entry.
 */
public final class DeadLetterStore {
    private final Map<String, DeadLetter> letters = new LinkedHashMap<>();
    private final int maxSize;
    private final int maxRetries;

    public DeadLetterStore(int maxSize, int maxRetries) {
        this.maxSize = Math.max(1, maxSize);
        this.maxRetries = Math.max(0, maxRetries);
    }

    public synchronized DeadLetter add(Event event, Throwable error) {
        long now = Instant.now().toEpochMilli();
        DeadLetter existing = letters.get(event.id());
        DeadLetter next = existing == null
                ? DeadLetter.firstFailure(event, error, now)
                : existing.failedAgain(error, now);
        letters.put(event.id(), next);
        prune();
        return next;
    }

    /**
     * Hands the stored event to {@code requeue} when it still has retries left.
     * The entry stays in place so a second failure increments rather than duplicates.
     */
    public boolean retry(String eventId, Consumer<Event> requeue) {
        Event event;
        synchronized (this) {
            DeadLetter letter = letters.get(eventId);
            if (letter == null || letter.retryCount() >= maxRetries) {
                return false;
            }
            event = letter.event();
        }
        requeue.accept(event);
        return true;
    }

    public synchronized boolean remove(String eventId) {
        return letters.remove(eventId) != null;
    }

    public synchronized Optional<DeadLetter> get(String eventId) {
        return Optional.ofNullable(letters.get(eventId));
    }

    public synchronized List<DeadLetter> getAll() {
        return List.copyOf(letters.values());
    }

    public synchronized List<DeadLetter> getRetriable() {
        List<DeadLetter> out = new ArrayList<>();
        for (DeadLetter letter : letters.values()) {
            if (letter.retryCount() < maxRetries) {
                out.add(letter);
            }
        }
        return out;
    }

    public synchronized int size() {
        return letters.size();
    }

    public synchronized void clear() {
        letters.clear();
    }

    private void prune() {
        if (letters.size() <= maxSize) {
            return;
        }
        List<DeadLetter> oldestFirst = new ArrayList<>(letters.values());
        oldestFirst.sort(Comparator.comparingLong(DeadLetter::failedAt));
        int excess = letters.size() - maxSize;
        for (int i = 0; i < excess; i++) {
            letters.remove(oldestFirst.get(i).event().id());
        }
    }
}
