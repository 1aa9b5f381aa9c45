package me.golemcore.deploy.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.deploy.domain.model.AuditEvent;
import me.golemcore.deploy.domain.model.AuditStatus;
import me.golemcore.deploy.domain.model.ToolInvocation;
import me.golemcore.deploy.infrastructure.config.DeployProperties;
import me.golemcore.deploy.port.outbound.AuditStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Ordered, buffered audit log.
 *
 * <p>
 * Every event gets a per-session sequence number that is gapless and strictly
 * increasing, assigned under the session's counter lock together with the
 * enqueue so that buffer order matches sequence order. A background flusher
 * writes the buffer to {@link AuditStorePort}; on store failure the batch goes
 * back to the head of the buffer and is retried after
 * {@code deploy.audit.retry-interval}. When the buffer stays full past the
 * enqueue timeout the entry is dropped and counted, never silently.
 *
 * <p>
 * Subscribers receive events synchronously at emit time, filtered by their
 * predicate. A failing subscriber never affects the caller.
 */
@Service
@Slf4j
public class AuditSink implements SessionScopedState {

    /**
     * Events that page a human: failures, escalations and compliance vetoes.
     */
    public static final Predicate<AuditEvent> ALERT_FILTER = event -> event.status() == AuditStatus.FAILURE
            || event.status() == AuditStatus.ESCALATED
            || event.isVeto();

    private static final String UNSCOPED = "unscoped";
    private static final int FLUSH_BATCH = 256;

    private final AuditStorePort store;
    private final DeployProperties properties;
    private final Clock clock;

    private final LinkedBlockingDeque<PendingEntry> buffer;
    private final Map<String, AtomicLong> sequences = new ConcurrentHashMap<>();
    private final Map<String, Deque<AuditEvent>> recentEvents = new ConcurrentHashMap<>();
    private final List<Subscription> subscribers = new CopyOnWriteArrayList<>();
    private final AtomicLong dropped = new AtomicLong();
    private final Object flushLock = new Object();

    private volatile Instant nextAttemptAfter = Instant.EPOCH;
    private ScheduledExecutorService flusher;

    public AuditSink(AuditStorePort store, DeployProperties properties, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
        this.buffer = new LinkedBlockingDeque<>(Math.max(1, properties.getAudit().getBufferCapacity()));
    }

    @PostConstruct
    public void start() {
        long intervalMs = Math.max(10, properties.getAudit().getFlushInterval().toMillis());
        flusher = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "audit-flusher");
            thread.setDaemon(true);
            return thread;
        });
        flusher.scheduleWithFixedDelay(this::flushSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[Audit] Flusher started (interval={}ms, capacity={})", intervalMs,
                properties.getAudit().getBufferCapacity());
    }

    @PreDestroy
    public void stop() {
        if (flusher != null) {
            flusher.shutdown();
        }
        nextAttemptAfter = Instant.EPOCH;
        flushSafely();
        if (!buffer.isEmpty()) {
            log.warn("[Audit] Shutting down with {} unflushed entries", buffer.size());
        }
    }

    /**
     * Stamp {@code draft} with the next sequence number of its session and the
     * current time, then buffer it for persistence.
     */
    public AuditEvent emit(AuditEvent draft) {
        String sessionId = draft.sessionId() != null ? draft.sessionId() : UNSCOPED;
        AtomicLong counter = sequences.computeIfAbsent(sessionId, key -> new AtomicLong());
        AuditEvent event;
        synchronized (counter) {
            event = draft.toBuilder()
                    .sessionId(sessionId)
                    .sequence(counter.incrementAndGet())
                    .timestamp(clock.instant())
                    .build();
            remember(event);
            enqueue(new PendingEntry(event, null));
        }
        notifySubscribers(event);
        return event;
    }

    /**
     * Buffer the immutable record of one gateway call.
     */
    public void record(ToolInvocation invocation) {
        enqueue(new PendingEntry(null, invocation));
    }

    public Subscription subscribe(Predicate<AuditEvent> filter, Consumer<AuditEvent> listener) {
        Subscription subscription = new Subscription(filter, listener);
        subscribers.add(subscription);
        return subscription;
    }

    public void unsubscribe(Subscription subscription) {
        subscribers.remove(subscription);
    }

    /**
     * Recent events of a session in sequence order.
     */
    public List<AuditEvent> events(String sessionId) {
        Deque<AuditEvent> events = recentEvents.get(sessionId);
        if (events == null) {
            return List.of();
        }
        synchronized (events) {
            return new ArrayList<>(events);
        }
    }

    /**
     * Drop the in-memory event window of a closed session. The sequence counter
     * stays, so a reopened session continues without a gap.
     */
    @Override
    public void evictSession(String sessionId) {
        recentEvents.remove(sessionId);
    }

    public long droppedCount() {
        return dropped.get();
    }

    public int pendingCount() {
        return buffer.size();
    }

    /**
     * Write buffered entries to the store. Returns false when the store failed
     * and the entries were put back for a later retry.
     */
    public boolean flush() {
        synchronized (flushLock) {
            if (clock.instant().isBefore(nextAttemptAfter)) {
                return false;
            }
            while (!buffer.isEmpty()) {
                List<PendingEntry> batch = new ArrayList<>(FLUSH_BATCH);
                buffer.drainTo(batch, FLUSH_BATCH);
                int written = writeBatch(batch);
                if (written < batch.size()) {
                    requeue(batch.subList(written, batch.size()));
                    nextAttemptAfter = clock.instant().plus(properties.getAudit().getRetryInterval());
                    return false;
                }
            }
            return true;
        }
    }

    private void flushSafely() {
        try {
            flush();
        } catch (RuntimeException e) { // NOSONAR - keep the flusher thread alive
            log.error("[Audit] Unexpected flush error", e);
        }
    }

    private int writeBatch(List<PendingEntry> batch) {
        int index = 0;
        try {
            while (index < batch.size()) {
                PendingEntry entry = batch.get(index);
                if (entry.event() != null) {
                    int end = index;
                    List<AuditEvent> events = new ArrayList<>();
                    while (end < batch.size() && batch.get(end).event() != null) {
                        events.add(batch.get(end).event());
                        end++;
                    }
                    store.appendEvents(events);
                    index = end;
                } else {
                    store.appendInvocation(entry.invocation());
                    index++;
                }
            }
        } catch (RuntimeException e) {
            log.warn("[Audit] Store write failed, {} entries will be retried: {}", batch.size() - index,
                    e.getMessage());
        }
        return index;
    }

    private void requeue(List<PendingEntry> entries) {
        for (int i = entries.size() - 1; i >= 0; i--) {
            if (!buffer.offerFirst(entries.get(i))) {
                dropped.incrementAndGet();
                log.error("[Audit] Buffer full while re-queueing, dropped entry {}", describe(entries.get(i)));
            }
        }
    }

    private void enqueue(PendingEntry entry) {
        long timeoutMs = properties.getAudit().getEnqueueTimeout().toMillis();
        try {
            if (!buffer.offer(entry, timeoutMs, TimeUnit.MILLISECONDS)) {
                dropped.incrementAndGet();
                log.error("[Audit] Buffer full, dropped entry {} (dropped total={})", describe(entry), dropped.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            dropped.incrementAndGet();
            log.error("[Audit] Interrupted while buffering, dropped entry {}", describe(entry));
        }
    }

    private void remember(AuditEvent event) {
        int window = Math.max(1, properties.getAudit().getMemoryWindow());
        Deque<AuditEvent> events = recentEvents.computeIfAbsent(event.sessionId(), key -> new ArrayDeque<>());
        synchronized (events) {
            events.addLast(event);
            while (events.size() > window) {
                events.removeFirst();
            }
        }
    }

    private void notifySubscribers(AuditEvent event) {
        for (Subscription subscription : subscribers) {
            try {
                if (subscription.filter().test(event)) {
                    subscription.listener().accept(event);
                }
            } catch (RuntimeException e) { // NOSONAR - subscribers are best effort
                log.warn("[Audit] Subscriber failed for event {}#{}: {}", event.sessionId(), event.sequence(),
                        e.getMessage());
            }
        }
    }

    private static String describe(PendingEntry entry) {
        if (entry.event() != null) {
            return entry.event().sessionId() + "#" + entry.event().sequence();
        }
        return "invocation " + entry.invocation().id();
    }

    private record PendingEntry(AuditEvent event, ToolInvocation invocation) {
    }

    public record Subscription(Predicate<AuditEvent> filter, Consumer<AuditEvent> listener) {
    }
}
