package org.javai.faults.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * The advice a {@link RetryPolicy} gives after evaluating a fault.
 * Acting on it (waiting, re-running the operation) is up to the caller.
 */
public sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.GiveUp {

    /**
     * Retry the operation after waiting for the specified delay.
     */
    record Retry(Duration delay) implements RetryDecision {
        public Retry {
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
        }

        public static Retry after(Duration delay) {
            return new Retry(delay);
        }

        @Override
        public boolean shouldRetry() {
            return true;
        }
    }

    /**
     * Do not retry; accept the fault.
     */
    record GiveUp(String reason) implements RetryDecision {
        public GiveUp {
            Objects.requireNonNull(reason, "reason must not be null");
        }

        public static GiveUp because(String reason) {
            return new GiveUp(reason);
        }

        @Override
        public boolean shouldRetry() {
            return false;
        }
    }

    boolean shouldRetry();
}
