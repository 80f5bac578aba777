package com.stackrelay.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Duration;

/**
 * Outcome of {@code RetryPolicy.decide}: what the dispatcher does with a failed call.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RetryDecision {

    public enum Action {
        /**
         * Re-enqueue at the same priority after {@link #getDelay()}, counting an attempt.
         */
        RETRY,

        /**
         * Re-enqueue immediately under the anonymous transport; not counted as an attempt.
         */
        SWITCH_MODE,

        /**
         * Resolve every waiter with {@link #getFailure()}.
         */
        FAIL
    }

    Action action;
    Duration delay;
    Throwable failure;

    public static RetryDecision retry(Duration delay) {
        return new RetryDecision(Action.RETRY, delay, null);
    }

    public static RetryDecision switchMode() {
        return new RetryDecision(Action.SWITCH_MODE, Duration.ZERO, null);
    }

    public static RetryDecision fail(Throwable failure) {
        return new RetryDecision(Action.FAIL, Duration.ZERO, failure);
    }
}
