package com.stackrelay.service.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.stackrelay.model.ApiRequest;
import com.stackrelay.model.RequestPriority;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * One logical call awaiting dispatch, shared by every caller that asked for the same fingerprint.
 *
 * <p>Mutable state is only touched by {@link RequestQueue} while it holds its lock;
 * workers receive the instance but go through the queue for every change.
 */
public final class QueuedRequest {

    /**
     * Strict priority across bands, enqueue order within a band.
     */
    static final Comparator<QueuedRequest> DISPATCH_ORDER = Comparator
            .comparing(QueuedRequest::getPriority, Comparator.reverseOrder())
            .thenComparingLong(QueuedRequest::getSequence);

    enum State {
        PENDING,
        IN_FLIGHT,
        BACKOFF
    }

    private final String fingerprint;
    private final ApiRequest request;
    private final RequestPriority priority;
    private final Instant enqueuedAt;
    private final List<CompletableFuture<JsonNode>> waiters = new ArrayList<>();

    private long sequence;
    private int attempt;
    private boolean modeSwitched;
    private State state = State.PENDING;

    QueuedRequest(String fingerprint, ApiRequest request, RequestPriority priority, Instant enqueuedAt, long sequence) {
        this.fingerprint = fingerprint;
        this.request = request;
        this.priority = priority;
        this.enqueuedAt = enqueuedAt;
        this.sequence = sequence;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public ApiRequest getRequest() {
        return request;
    }

    public RequestPriority getPriority() {
        return priority;
    }

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    public long getSequence() {
        return sequence;
    }

    /**
     * Retries made so far; mode switches are not counted.
     */
    public int getAttempt() {
        return attempt;
    }

    public boolean isModeSwitched() {
        return modeSwitched;
    }

    /**
     * True once the request has reached the transport at least once.
     */
    boolean wasDispatched() {
        return attempt > 0 || modeSwitched;
    }

    State getState() {
        return state;
    }

    CompletableFuture<JsonNode> addWaiter() {
        CompletableFuture<JsonNode> waiter = new CompletableFuture<>();
        waiters.add(waiter);
        return waiter;
    }

    /**
     * Waiters that have not timed out or been cancelled.
     */
    boolean hasLiveWaiters() {
        return waiters.stream().anyMatch(waiter -> !waiter.isDone());
    }

    int waiterCount() {
        return waiters.size();
    }

    List<CompletableFuture<JsonNode>> drainWaiters() {
        List<CompletableFuture<JsonNode>> drained = new ArrayList<>(waiters);
        waiters.clear();
        return drained;
    }

    void markInFlight() {
        state = State.IN_FLIGHT;
    }

    void markBackoff() {
        attempt++;
        state = State.BACKOFF;
    }

    void markModeSwitched() {
        modeSwitched = true;
    }

    void requeue(long newSequence) {
        sequence = newSequence;
        state = State.PENDING;
    }

    @Override
    public String toString() {
        return request.getOperation() + "[" + fingerprint.substring(0, Math.min(12, fingerprint.length()))
                + ", " + priority + ", attempt=" + attempt + "]";
    }
}
