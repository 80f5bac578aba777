package com.stackrelay.service.retry;

import com.stackrelay.config.StackRelayProperties;
import com.stackrelay.exception.ExhaustedRetriesException;
import com.stackrelay.exception.RateLimitException;
import com.stackrelay.exception.TransientNetworkException;
import com.stackrelay.exception.UpstreamServerException;
import com.stackrelay.model.AccessMode;
import com.stackrelay.model.RetryDecision;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Decides what happens to a failed upstream call. Free of I/O and state.
 *
 * <p>Delay formula: {@code min(baseDelay * 2^attempt, maxDelay)} plus uniform jitter
 * in {@code [0, baseDelay)}.
 *
 * <ul>
 *   <li>Network errors and 5xx: retried while {@code attempt < maxAttempts}.</li>
 *   <li>Rate limit on the authenticated transport: switch to anonymous access.</li>
 *   <li>Rate limit on the anonymous transport, validation errors, anything else: fail.</li>
 * </ul>
 */
@Service
public class RetryPolicy {

    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;

    @Autowired
    public RetryPolicy(StackRelayProperties properties) {
        this(properties.getRetry().getMaxAttempts(),
                properties.getRetry().getBaseDelay(),
                properties.getRetry().getMaxDelay());
    }

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0, got: " + maxAttempts);
        }
        if (baseDelay.toMillis() < 1) {
            throw new IllegalArgumentException("baseDelay must be at least 1ms, got: " + baseDelay);
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay, got: " + maxDelay);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = baseDelay.toMillis();
        this.maxDelayMs = maxDelay.toMillis();
    }

    /**
     * @param error   failure of the latest call
     * @param attempt retries already made for this request (0 on the first failure)
     * @param mode    transport the failed call used
     */
    public RetryDecision decide(Throwable error, int attempt, AccessMode mode) {
        if (error instanceof RateLimitException) {
            return mode == AccessMode.AUTHENTICATED
                    ? RetryDecision.switchMode()
                    : RetryDecision.fail(error);
        }

        if (error instanceof TransientNetworkException || error instanceof UpstreamServerException) {
            if (attempt >= maxAttempts) {
                return RetryDecision.fail(new ExhaustedRetriesException(attempt + 1, error));
            }
            return RetryDecision.retry(Duration.ofMillis(computeDelayMs(attempt)));
        }

        return RetryDecision.fail(error);
    }

    long computeDelayMs(int attempt) {
        long expDelay;
        if (attempt >= 31) {
            expDelay = Long.MAX_VALUE;
        } else {
            long shift = 1L << attempt;
            // Guard against overflow: if shift exceeds maxDelayMs/baseDelayMs, cap directly
            expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
        }
        return Math.min(maxDelayMs, expDelay) + jitterMs(baseDelayMs);
    }

    /**
     * Uniform jitter in {@code [0, bound)}.
     */
    protected long jitterMs(long bound) {
        return ThreadLocalRandom.current().nextLong(bound);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
