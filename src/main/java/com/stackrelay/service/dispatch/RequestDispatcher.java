package com.stackrelay.service.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.stackrelay.config.StackRelayProperties;
import com.stackrelay.exception.RateLimitException;
import com.stackrelay.exception.UpstreamServerException;
import com.stackrelay.model.AccessMode;
import com.stackrelay.model.ApiOperation;
import com.stackrelay.model.ApiRequest;
import com.stackrelay.model.RateLimitSnapshot;
import com.stackrelay.model.RequestPriority;
import com.stackrelay.model.RetryDecision;
import com.stackrelay.model.UpstreamResponse;
import com.stackrelay.model.dto.DispatchStatus;
import com.stackrelay.service.cache.ResultCache;
import com.stackrelay.service.ratelimit.AccessModeSelector;
import com.stackrelay.service.ratelimit.RateLimitTracker;
import com.stackrelay.service.ratelimit.RequestThrottle;
import com.stackrelay.service.retry.RetryPolicy;
import com.stackrelay.service.transport.StackExchangeTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Worker pool that drains the {@link RequestQueue} under a fixed concurrency cap.
 *
 * <p>Each worker takes the highest-priority request, asks the {@link AccessModeSelector}
 * for a transport, waits for a {@link RequestThrottle} slot and issues the call. Success
 * updates the quota tracker, fills the cache and resolves every waiter. Failures go
 * through the {@link RetryPolicy}: retries are parked on a scheduler for their backoff
 * delay, an authenticated rate limit re-enqueues the request once for the anonymous
 * transport, anything else resolves all waiters with the terminal error.
 *
 * <p>Started and stopped by the Spring context; tests drive {@link #start()} and
 * {@link #stop()} directly.
 */
@Slf4j
@Service
public class RequestDispatcher implements SmartLifecycle {

    private static final long QUEUE_POLL_TIMEOUT_MS = 100;
    private static final long DRAIN_TIMEOUT_MS = 5_000;

    private final RequestQueue queue;
    private final StackExchangeTransport transport;
    private final AccessModeSelector selector;
    private final RateLimitTracker tracker;
    private final RequestThrottle throttle;
    private final RetryPolicy retryPolicy;
    private final ResultCache cache;
    private final AccessMode configuredMode;
    private final int workerCount;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private ExecutorService workers;
    private ScheduledExecutorService retryScheduler;

    public RequestDispatcher(RequestQueue queue,
                             StackExchangeTransport transport,
                             AccessModeSelector selector,
                             RateLimitTracker tracker,
                             RequestThrottle throttle,
                             RetryPolicy retryPolicy,
                             ResultCache cache,
                             StackRelayProperties properties) {
        this.queue = queue;
        this.transport = transport;
        this.selector = selector;
        this.tracker = tracker;
        this.throttle = throttle;
        this.retryPolicy = retryPolicy;
        this.cache = cache;
        this.configuredMode = properties.getApi().getAccessMode();
        this.workerCount = properties.getQueue().getMaxConcurrent();

        if (workerCount < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1, got: " + workerCount);
        }
    }

    /**
     * Enqueue a logical request.
     *
     * @return future resolved with the response payload or the terminal error
     */
    public CompletableFuture<JsonNode> enqueue(ApiRequest request, RequestPriority priority) {
        return queue.enqueue(request, priority);
    }

    public CompletableFuture<JsonNode> enqueue(ApiOperation operation,
                                               Map<String, String> parameters,
                                               RequestPriority priority) {
        return enqueue(ApiRequest.of(operation, parameters), priority);
    }

    /**
     * Enqueue with a caller-side timeout. When it fires only this caller stops waiting;
     * the shared request keeps running for other waiters and the cache.
     */
    public CompletableFuture<JsonNode> enqueue(ApiRequest request, RequestPriority priority, Duration timeout) {
        return enqueue(request, priority).orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }

        CustomizableThreadFactory workerFactory = new CustomizableThreadFactory("stackrelay-worker-");
        workerFactory.setDaemon(true);
        CustomizableThreadFactory retryFactory = new CustomizableThreadFactory("stackrelay-retry-");
        retryFactory.setDaemon(true);

        retryScheduler = Executors.newSingleThreadScheduledExecutor(retryFactory);
        workers = Executors.newFixedThreadPool(workerCount, workerFactory);
        for (int i = 0; i < workerCount; i++) {
            workers.submit(this::workerLoop);
        }

        log.info("Started request dispatcher with {} workers (access mode: {})", workerCount, configuredMode);
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }

        workers.shutdown();
        try {
            if (!workers.awaitTermination(DRAIN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        retryScheduler.shutdownNow();

        int drained = queue.drain(new IllegalStateException("Request dispatcher stopped"));
        log.info("Stopped request dispatcher ({} unfinished requests failed)", drained);
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Status snapshot for the status endpoint.
     */
    public DispatchStatus statusSnapshot() {
        DispatchStatus.DispatchStatusBuilder status = DispatchStatus.builder();
        queue.describe(status);

        AccessMode current = selector.preview(configuredMode);
        RateLimitSnapshot authenticated = tracker.snapshot(AccessMode.AUTHENTICATED);
        RateLimitSnapshot unauthenticated = tracker.snapshot(AccessMode.UNAUTHENTICATED);

        return status
                .cache(cache.statistics())
                .configuredAccessMode(configuredMode)
                .currentAccessMode(current)
                .quotaRemaining(current == AccessMode.AUTHENTICATED
                        ? authenticated.getRemainingQuota()
                        : unauthenticated.getRemainingQuota())
                .authenticatedQuota(authenticated)
                .unauthenticatedQuota(unauthenticated)
                .apiKeyConfigured(tracker.isApiKeyConfigured())
                .apiKeyValid(tracker.getCredentialsValid())
                .maxConcurrent(workerCount)
                .workersRunning(running.get())
                .throttleEnabled(throttle.isEnabled())
                .build();
    }

    private void workerLoop() {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                QueuedRequest request = queue.take(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (request != null) {
                    dispatch(request);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                log.error("Dispatcher loop error", e);
            }
        }
    }

    void dispatch(QueuedRequest request) throws InterruptedException {
        try {
            call(request);
        } catch (RuntimeException e) {
            // The request is in flight and indexed by fingerprint; leaving it there would strand its callers
            log.error("Unexpected error dispatching {}", request, e);
            queue.fail(request, e);
        }
    }

    private void call(QueuedRequest request) throws InterruptedException {
        // A request that already fell back stays on anonymous access whatever the configured mode
        AccessMode mode = request.isModeSwitched() ? AccessMode.UNAUTHENTICATED : selector.choose(configuredMode);

        Duration wait = throttle.reserve(mode);
        if (!wait.isZero()) {
            try {
                Thread.sleep(wait.toMillis());
            } catch (InterruptedException e) {
                queue.fail(request, new IllegalStateException("Request dispatcher stopped before the call was issued"));
                throw e;
            }
        }

        UpstreamResponse response;
        try {
            response = transport.execute(request.getRequest(), mode).block();
        } catch (RuntimeException e) {
            onFailure(request, mode, Exceptions.unwrap(e));
            return;
        }

        if (response == null) {
            onFailure(request, mode, new UpstreamServerException("Empty response from upstream", 0));
            return;
        }

        tracker.record(mode, response.getQuota());
        queue.complete(request, response.getPayload());
        log.debug("Completed {} as {}", request, mode);
    }

    private void onFailure(QueuedRequest request, AccessMode mode, Throwable error) {
        if (error instanceof RateLimitException) {
            tracker.markRateLimited(mode, ((RateLimitException) error).getRetryAfter());
        }

        RetryDecision decision = retryPolicy.decide(error, request.getAttempt(), mode);
        switch (decision.getAction()) {
            case SWITCH_MODE:
                if (!request.isModeSwitched()) {
                    log.warn("{} rate limited on {} access, re-queueing for fallback", request, mode);
                    queue.switchMode(request);
                    return;
                }
                log.error("{} rate limited again after falling back: {}", request, error.getMessage());
                queue.fail(request, error);
                return;

            case RETRY:
                log.warn("{} failed ({}), retrying in {}ms", request, error.getMessage(), decision.getDelay().toMillis());
                queue.backoff(request);
                scheduleRetry(request, decision.getDelay());
                return;

            case FAIL:
            default:
                log.error("{} failed after {} attempt(s): {}", request, request.getAttempt() + 1,
                        decision.getFailure().getMessage());
                queue.fail(request, decision.getFailure());
        }
    }

    private void scheduleRetry(QueuedRequest request, Duration delay) {
        try {
            retryScheduler.schedule(() -> queue.requeue(request), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            queue.fail(request, new IllegalStateException("Request dispatcher stopped during backoff", e));
        }
    }
}
