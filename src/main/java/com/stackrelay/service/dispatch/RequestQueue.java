package com.stackrelay.service.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.stackrelay.config.StackRelayProperties;
import com.stackrelay.config.StackRelayProperties.AbandonedPolicy;
import com.stackrelay.exception.QueueSaturatedException;
import com.stackrelay.model.ApiRequest;
import com.stackrelay.model.RequestPriority;
import com.stackrelay.model.dto.DispatchStatus;
import com.stackrelay.service.cache.ResultCache;
import com.stackrelay.service.canonicalization.RequestFingerprinter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Priority-ordered, deduplicating work queue.
 *
 * <p>Every live request (pending, in flight or backing off) is indexed by fingerprint,
 * so a second caller for the same fingerprint only gets a new waiter. Cache lookups,
 * dedup checks, cache stores and index removal all happen under one lock: a request
 * completing concurrently with a new enqueue is seen either as a live entry or as a
 * cache hit, never as neither.
 *
 * <p>Lock order is queue lock, then cache monitor.
 */
@Slf4j
@Service
public class RequestQueue {

    private final ResultCache cache;
    private final RequestFingerprinter fingerprinter;
    private final Clock clock;
    private final int maxPending;
    private final AbandonedPolicy abandonedPolicy;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private final PriorityQueue<QueuedRequest> ready = new PriorityQueue<>(QueuedRequest.DISPATCH_ORDER);
    private final Map<String, QueuedRequest> live = new HashMap<>();

    // guarded by lock
    private long nextSequence;
    private int inFlight;
    private int backingOff;
    private long cacheHits;
    private long cacheMisses;
    private long deduplicated;
    private long completed;
    private long failed;
    private long skipped;
    private long rejected;

    @Autowired
    public RequestQueue(ResultCache cache,
                        RequestFingerprinter fingerprinter,
                        StackRelayProperties properties,
                        Clock clock) {
        this(cache, fingerprinter, properties.getQueue().getMaxPending(),
                properties.getQueue().getAbandonedPolicy(), clock);
    }

    public RequestQueue(ResultCache cache,
                        RequestFingerprinter fingerprinter,
                        int maxPending,
                        AbandonedPolicy abandonedPolicy,
                        Clock clock) {
        if (maxPending < 0) {
            throw new IllegalArgumentException("maxPending must be >= 0, got: " + maxPending);
        }
        this.cache = cache;
        this.fingerprinter = fingerprinter;
        this.maxPending = maxPending;
        this.abandonedPolicy = Objects.requireNonNull(abandonedPolicy, "abandonedPolicy");
        this.clock = clock;
    }

    /**
     * Enqueue a logical request.
     *
     * @return a future for this caller only; completed immediately on a cache hit,
     *         failed immediately with {@link QueueSaturatedException} when the queue is full
     */
    public CompletableFuture<JsonNode> enqueue(ApiRequest request, RequestPriority priority) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(priority, "priority");
        String fingerprint = fingerprinter.fingerprint(request);

        lock.lock();
        try {
            Optional<JsonNode> cached = cache.lookup(fingerprint);
            if (cached.isPresent()) {
                cacheHits++;
                log.debug("Cache HIT for {} {}", request.getOperation(), fingerprint);
                return CompletableFuture.completedFuture(cached.get());
            }
            cacheMisses++;

            QueuedRequest existing = live.get(fingerprint);
            if (existing != null) {
                deduplicated++;
                log.debug("Attaching waiter to live request {} ({} waiters)", existing, existing.waiterCount() + 1);
                return existing.addWaiter();
            }

            if (maxPending > 0 && ready.size() + backingOff >= maxPending) {
                rejected++;
                log.warn("Rejecting {} request: queue full ({} pending)", request.getOperation(), maxPending);
                return CompletableFuture.failedFuture(new QueueSaturatedException(maxPending));
            }

            QueuedRequest queued = new QueuedRequest(fingerprint, request, priority, clock.instant(), nextSequence++);
            CompletableFuture<JsonNode> waiter = queued.addWaiter();
            live.put(fingerprint, queued);
            ready.add(queued);
            available.signal();
            log.debug("Queued {} ({} pending)", queued, ready.size());
            return waiter;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take the next request to dispatch and mark it in flight.
     * Pending requests nobody waits for any more are dropped on the way.
     *
     * @return the request, or null if none became ready within the timeout
     */
    QueuedRequest take(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (true) {
                QueuedRequest next = ready.poll();
                if (next == null) {
                    if (nanos <= 0L) {
                        return null;
                    }
                    nanos = available.awaitNanos(nanos);
                    continue;
                }

                if (isAbandoned(next)) {
                    live.remove(next.getFingerprint(), next);
                    next.drainWaiters();
                    skipped++;
                    log.debug("Skipping {}: every caller stopped waiting", next);
                    continue;
                }

                next.markInFlight();
                inFlight++;
                return next;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cache the payload and resolve every waiter with it, in arrival order.
     */
    void complete(QueuedRequest request, JsonNode payload) {
        List<CompletableFuture<JsonNode>> waiters;
        lock.lock();
        try {
            cache.store(request.getFingerprint(), payload);
            waiters = finish(request);
            completed++;
        } finally {
            lock.unlock();
        }
        waiters.forEach(waiter -> waiter.complete(payload));
    }

    /**
     * Resolve every waiter with a terminal error.
     */
    void fail(QueuedRequest request, Throwable error) {
        List<CompletableFuture<JsonNode>> waiters;
        lock.lock();
        try {
            waiters = finish(request);
            failed++;
        } finally {
            lock.unlock();
        }
        waiters.forEach(waiter -> waiter.completeExceptionally(error));
    }

    /**
     * Park an in-flight request for a retry; it stays attachable by fingerprint.
     */
    void backoff(QueuedRequest request) {
        lock.lock();
        try {
            if (live.get(request.getFingerprint()) != request) {
                return;
            }
            request.markBackoff();
            inFlight--;
            backingOff++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Return a request to the queue after its backoff delay, behind requests already waiting in its band.
     */
    void requeue(QueuedRequest request) {
        lock.lock();
        try {
            if (request.getState() != QueuedRequest.State.BACKOFF || live.get(request.getFingerprint()) != request) {
                return;
            }
            backingOff--;
            request.requeue(nextSequence++);
            ready.add(request);
            available.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Return an in-flight request to the queue immediately, keeping its place in its band.
     */
    void switchMode(QueuedRequest request) {
        lock.lock();
        try {
            if (live.get(request.getFingerprint()) != request) {
                return;
            }
            request.markModeSwitched();
            inFlight--;
            request.requeue(request.getSequence());
            ready.add(request);
            available.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fail every live request; used on shutdown.
     *
     * @return number of requests failed
     */
    int drain(Throwable error) {
        List<CompletableFuture<JsonNode>> waiters = new ArrayList<>();
        int drained;
        lock.lock();
        try {
            drained = live.size();
            for (QueuedRequest request : live.values()) {
                waiters.addAll(request.drainWaiters());
            }
            live.clear();
            ready.clear();
            inFlight = 0;
            backingOff = 0;
            failed += drained;
        } finally {
            lock.unlock();
        }
        waiters.forEach(waiter -> waiter.completeExceptionally(error));
        return drained;
    }

    /**
     * Fill the queue part of a status snapshot under one lock acquisition.
     */
    void describe(DispatchStatus.DispatchStatusBuilder status) {
        lock.lock();
        try {
            Map<RequestPriority, Integer> pendingByPriority = new EnumMap<>(RequestPriority.class);
            for (RequestPriority priority : RequestPriority.values()) {
                pendingByPriority.put(priority, 0);
            }
            ready.forEach(request -> pendingByPriority.merge(request.getPriority(), 1, Integer::sum));

            Instant now = clock.instant();
            long oldestPendingAgeMs = live.values().stream()
                    .map(QueuedRequest::getEnqueuedAt)
                    .min(Comparator.naturalOrder())
                    .map(enqueuedAt -> Math.max(0, Duration.between(enqueuedAt, now).toMillis()))
                    .orElse(0L);

            long lookups = cacheHits + cacheMisses;
            status.pendingByPriority(pendingByPriority)
                    .pending(ready.size())
                    .inFlight(inFlight)
                    .backingOff(backingOff)
                    .completed(completed)
                    .failed(failed)
                    .deduplicated(deduplicated)
                    .skipped(skipped)
                    .rejected(rejected)
                    .cacheHits(cacheHits)
                    .cacheMisses(cacheMisses)
                    .cacheHitRate(lookups == 0 ? 0.0 : (double) cacheHits / lookups)
                    .oldestPendingAgeMs(oldestPendingAgeMs)
                    .maxPending(maxPending);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return live.size();
        } finally {
            lock.unlock();
        }
    }

    private boolean isAbandoned(QueuedRequest request) {
        if (request.hasLiveWaiters()) {
            return false;
        }
        // Under COMPLETE a request that already reached the API keeps going to warm the cache
        return abandonedPolicy == AbandonedPolicy.DROP || !request.wasDispatched();
    }

    private List<CompletableFuture<JsonNode>> finish(QueuedRequest request) {
        if (live.remove(request.getFingerprint(), request)) {
            switch (request.getState()) {
                case IN_FLIGHT:
                    inFlight--;
                    break;
                case BACKOFF:
                    backingOff--;
                    break;
                case PENDING:
                default:
                    ready.remove(request);
            }
        }
        return request.drainWaiters();
    }
}
