package io.agentmesh.bus;

import io.agentmesh.config.RuntimeSettings;
import io.agentmesh.model.DeadLetter;
import io.agentmesh.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process publish/subscribe bus.
 *
 * <p>{@link #emit} only enqueues; delivery happens on a single dispatcher thread
 * owned by this bus, so handlers of one bus never run concurrently. Events drain
 * CRITICAL first and FIFO within a priority. A handler exception is recorded in
 * the dead-letter store and never reaches the emitter or the other handlers.
 *
 * <p>Handlers run on the dispatcher thread. Blocking there on a
 * {@link #request} future waits for a reply that can only be delivered by the
 * same thread.
 */
public final class EventBus implements AutoCloseable {
    public static final String DEAD_LETTER_EVENT = "system:dead_letter";
    public static final String BUS_SOURCE = "event_bus";

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);
    private static final AtomicInteger BUS_IDS = new AtomicInteger();

    private final PriorityEventQueue queue = new PriorityEventQueue();
    private final DeadLetterStore deadLetters;
    private final Map<String, PatternGroup> subscriptions = new LinkedHashMap<>();
    private final Object subscriptionLock = new Object();
    private final List<Event> history = new ArrayList<>();
    private final int maxHistory;
    private final long defaultRequestTimeoutMs;
    private final long shutdownGraceMs;
    private final boolean deadLetterEvents;

    private final ExecutorService dispatcher;
    private final AtomicBoolean dispatching = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Object idleMonitor = new Object();
    private volatile Thread dispatcherThread;

    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong emittedTotal = new AtomicLong();
    private final AtomicLong dispatchedTotal = new AtomicLong();
    private final AtomicLong handlerFailuresTotal = new AtomicLong();

    public EventBus() {
        this(RuntimeSettings.defaults());
    }

    public EventBus(RuntimeSettings settings) {
        this.deadLetters = new DeadLetterStore(settings.deadLetterCapacity(), settings.maxDeadLetterRetries());
        this.maxHistory = Math.max(2, settings.maxHistory());
        this.defaultRequestTimeoutMs = settings.requestTimeoutMs();
        this.shutdownGraceMs = settings.shutdownGraceMs();
        this.deadLetterEvents = settings.deadLetterEvents();
        String threadName = "agentmesh-dispatch-" + BUS_IDS.incrementAndGet();
        this.dispatcher = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            dispatcherThread = thread;
            return thread;
        });
    }

    public String emit(String type, Object payload) {
        return emit(type, payload, EmitOptions.defaults());
    }

    public String emit(String type, Object payload, EmitOptions options) {
        ensureOpen();
        EmitOptions opts = options == null ? EmitOptions.defaults() : options;
        Event event = new Event(
                nextId("evt"),
                type,
                payload,
                opts.source(),
                opts.target(),
                opts.priority(),
                Instant.now().toEpochMilli(),
                opts.correlationId(),
                opts.replyTo(),
                opts.metadata()
        );
        queue.enqueue(event, event.priority());
        recordHistory(event);
        emittedTotal.incrementAndGet();
        scheduleDrain();
        return event.id();
    }

    public <R> CompletableFuture<R> request(String type, Object payload) {
        return request(type, payload, defaultRequestTimeoutMs, EmitOptions.defaults());
    }

    public <R> CompletableFuture<R> request(String type, Object payload, long timeoutMs) {
        return request(type, payload, timeoutMs, EmitOptions.defaults());
    }

    /**
     * Emits {@code type} with a fresh correlation id and a private reply topic
     * ({@code <type>:reply:<correlationId>}). A responder answers by emitting to the
     * event's {@code replyTo}. On timeout the future fails with
     * {@link TimeoutException} and the reply subscription is removed; the request
     * event itself is not retracted.
     */
    @SuppressWarnings("unchecked")
    public <R> CompletableFuture<R> request(String type, Object payload, long timeoutMs, EmitOptions options) {
        ensureOpen();
        String correlationId = nextId("cor");
        String replyTopic = type + ":reply:" + correlationId;
        CompletableFuture<R> future = new CompletableFuture<>();
        Subscription pending = subscribe(
                replyTopic,
                reply -> future.complete((R) reply.payload()),
                SubscribeOptions.onceOnly()
        );
        long safeTimeout = Math.max(1L, timeoutMs);
        CompletableFuture.delayedExecutor(safeTimeout, TimeUnit.MILLISECONDS).execute(() -> {
            if (future.completeExceptionally(new TimeoutException("Request timeout: " + type))) {
                pending.cancel();
                log.debug("Request {} timed out after {}ms (correlation {})", type, safeTimeout, correlationId);
            }
        });
        EmitOptions opts = options == null ? EmitOptions.defaults() : options;
        try {
            emit(type, payload, opts.withCorrelation(correlationId, replyTopic));
        } catch (RuntimeException e) {
            pending.cancel();
            future.completeExceptionally(e);
        }
        return future;
    }

    public Subscription subscribe(String pattern, EventHandler handler) {
        return subscribe(pattern, handler, SubscribeOptions.defaults());
    }

    public Subscription once(String pattern, EventHandler handler) {
        return subscribe(pattern, handler, SubscribeOptions.onceOnly());
    }

    public Subscription subscribe(String pattern, EventHandler handler, SubscribeOptions options) {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        SubscriptionPattern compiled = SubscriptionPattern.compile(pattern);
        SubscribeOptions opts = options == null ? SubscribeOptions.defaults() : options;
        Subscription subscription = new Subscription(nextId("sub"), compiled, handler, opts, this);
        synchronized (subscriptionLock) {
            subscriptions.computeIfAbsent(pattern, key -> new PatternGroup(compiled)).members.add(subscription);
        }
        log.debug("Subscribed {} to {}", subscription.id(), pattern);
        return subscription;
    }

    public boolean unsubscribe(String subscriptionId) {
        if (subscriptionId == null) {
            return false;
        }
        synchronized (subscriptionLock) {
            Iterator<PatternGroup> groups = subscriptions.values().iterator();
            while (groups.hasNext()) {
                PatternGroup group = groups.next();
                if (group.members.removeIf(sub -> sub.id().equals(subscriptionId))) {
                    if (group.members.isEmpty()) {
                        groups.remove();
                    }
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Removes the first subscription under exactly {@code pattern} whose handler is
     * {@code handler}.
     */
    public boolean off(String pattern, EventHandler handler) {
        synchronized (subscriptionLock) {
            PatternGroup group = subscriptions.get(pattern);
            if (group == null) {
                return false;
            }
            for (Iterator<Subscription> it = group.members.iterator(); it.hasNext(); ) {
                if (it.next().handler() == handler) {
                    it.remove();
                    if (group.members.isEmpty()) {
                        subscriptions.remove(pattern);
                    }
                    return true;
                }
            }
            return false;
        }
    }

    /** Removes every subscription registered under exactly {@code pattern}. */
    public int off(String pattern) {
        synchronized (subscriptionLock) {
            PatternGroup removed = subscriptions.remove(pattern);
            return removed == null ? 0 : removed.members.size();
        }
    }

    private void scheduleDrain() {
        if (!dispatching.compareAndSet(false, true)) {
            return;
        }
        try {
            dispatcher.execute(this::drain);
        } catch (RejectedExecutionException e) {
            dispatching.set(false);
            signalIdle();
            throw new IllegalStateException("Event bus is closed", e);
        }
    }

    private void drain() {
        boolean clean = false;
        try {
            do {
                Optional<Event> next;
                while ((next = queue.dequeue()).isPresent()) {
                    dispatch(next.get());
                }
                dispatching.set(false);
                signalIdle();
                // An emit that lost the race for the flag left its event in the queue.
            } while (!queue.isEmpty() && dispatching.compareAndSet(false, true));
            clean = true;
        } catch (Throwable t) {
            log.error("Dispatch loop aborted", t);
            throw t;
        } finally {
            if (!clean) {
                dispatching.set(false);
                signalIdle();
            }
        }
    }

    private void dispatch(Event event) {
        List<Subscription> matched = matchingSubscriptions(event.type());
        dispatchedTotal.incrementAndGet();
        if (matched.isEmpty()) {
            log.debug("No subscribers for {} ({})", event.type(), event.id());
            return;
        }
        for (Subscription subscription : matched) {
            try {
                if (!subscription.accepts(event)) {
                    continue;
                }
                subscription.handler().handle(event);
                if (subscription.once()) {
                    unsubscribe(subscription.id());
                }
            } catch (Throwable t) {
                handlerFailed(event, subscription, t);
            }
        }
    }

    private List<Subscription> matchingSubscriptions(String eventType) {
        List<Subscription> matched = new ArrayList<>();
        synchronized (subscriptionLock) {
            for (PatternGroup group : subscriptions.values()) {
                if (group.pattern.matches(eventType)) {
                    matched.addAll(group.members);
                }
            }
        }
        // List.sort is stable: equal priorities keep pattern-registration order.
        matched.sort(Comparator.comparingInt(Subscription::priority).reversed());
        return matched;
    }

    private void handlerFailed(Event event, Subscription subscription, Throwable error) {
        handlerFailuresTotal.incrementAndGet();
        DeadLetter letter = deadLetters.add(event, error);
        log.warn("Handler {} failed on {} ({}), retryCount={}",
                subscription.id(), event.type(), event.id(), letter.retryCount(), error);
        if (!deadLetterEvents || DEAD_LETTER_EVENT.equals(event.type()) || closed.get()) {
            return;
        }
        Map<String, Object> diagnostic = new LinkedHashMap<>();
        diagnostic.put("eventId", event.id());
        diagnostic.put("type", event.type());
        diagnostic.put("subscriptionId", subscription.id());
        diagnostic.put("error", letter.errorMessage());
        diagnostic.put("retryCount", letter.retryCount());
        try {
            emit(DEAD_LETTER_EVENT, diagnostic, EmitOptions.from(BUS_SOURCE));
        } catch (IllegalStateException closing) {
            log.debug("Skipped {} for {}: bus closing", DEAD_LETTER_EVENT, event.id());
        }
    }

    /**
     * Blocks until the queue is empty and no dispatch pass is running.
     *
     * @return false if {@code timeout} elapsed first
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        if (Thread.currentThread() == dispatcherThread) {
            throw new IllegalStateException("awaitIdle cannot be called from an event handler");
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (dispatching.get() || !queue.isEmpty()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0L) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(idleMonitor, remaining);
            }
            return true;
        }
    }

    private void signalIdle() {
        synchronized (idleMonitor) {
            idleMonitor.notifyAll();
        }
    }

    private void recordHistory(Event event) {
        synchronized (history) {
            history.add(event);
            if (history.size() > maxHistory) {
                List<Event> newest = new ArrayList<>(history.subList(history.size() - maxHistory / 2, history.size()));
                history.clear();
                history.addAll(newest);
            }
        }
    }

    public List<Event> getHistory() {
        return getHistory(HistoryFilter.all());
    }

    public List<Event> getHistory(HistoryFilter filter) {
        HistoryFilter safe = filter == null ? HistoryFilter.all() : filter;
        SubscriptionPattern typePattern = safe.typePattern() == null
                ? null
                : SubscriptionPattern.compile(safe.typePattern());
        List<Event> out = new ArrayList<>();
        synchronized (history) {
            for (Event event : history) {
                if (safe.accepts(event, typePattern)) {
                    out.add(event);
                }
            }
        }
        if (safe.limit() != null && safe.limit() >= 0 && out.size() > safe.limit()) {
            return List.copyOf(out.subList(out.size() - safe.limit(), out.size()));
        }
        return List.copyOf(out);
    }

    public List<DeadLetter> getDeadLetters() {
        return deadLetters.getAll();
    }

    public List<DeadLetter> getRetriableDeadLetters() {
        return deadLetters.getRetriable();
    }

    public Optional<DeadLetter> getDeadLetter(String eventId) {
        return deadLetters.get(eventId);
    }

    /**
     * Requeues a dead-lettered event under its original id and priority.
     *
     * @return false when the id is unknown or its retries are exhausted
     */
    public boolean retryDeadLetter(String eventId) {
        ensureOpen();
        boolean requeued = deadLetters.retry(eventId, event -> {
            queue.enqueue(event, event.priority());
            scheduleDrain();
        });
        if (requeued) {
            log.info("Requeued dead letter {}", eventId);
        }
        return requeued;
    }

    public boolean removeDeadLetter(String eventId) {
        return deadLetters.remove(eventId);
    }

    public void clearDeadLetters() {
        deadLetters.clear();
    }

    public BusStats getStats() {
        int subscriptionCount = 0;
        synchronized (subscriptionLock) {
            for (PatternGroup group : subscriptions.values()) {
                subscriptionCount += group.members.size();
            }
        }
        int historySize;
        synchronized (history) {
            historySize = history.size();
        }
        return new BusStats(
                subscriptionCount,
                queue.size(),
                queue.sizeByPriority(),
                deadLetters.size(),
                historySize,
                emittedTotal.get(),
                dispatchedTotal.get(),
                handlerFailuresTotal.get(),
                dispatching.get()
        );
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Rejects further emits and lets the current dispatch pass drain what is
     * already queued, waiting up to the configured shutdown grace.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        dispatcher.shutdown();
        if (Thread.currentThread() == dispatcherThread) {
            return;
        }
        try {
            if (!dispatcher.awaitTermination(shutdownGraceMs, TimeUnit.MILLISECONDS)) {
                List<Runnable> dropped = dispatcher.shutdownNow();
                log.warn("Event bus dispatcher did not stop within {}ms; {} pending task(s) dropped, {} event(s) left queued",
                        shutdownGraceMs, dropped.size(), queue.size());
            }
        } catch (InterruptedException e) {
            dispatcher.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Event bus closed");
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Event bus is closed");
        }
    }

    private String nextId(String prefix) {
        return prefix + "_" + Long.toString(System.currentTimeMillis(), 36) + "_" + sequence.incrementAndGet();
    }

    private static final class PatternGroup {
        private final SubscriptionPattern pattern;
        private final List<Subscription> members = new ArrayList<>();

        private PatternGroup(SubscriptionPattern pattern) {
            this.pattern = pattern;
        }
    }
}
