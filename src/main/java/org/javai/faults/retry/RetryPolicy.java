package org.javai.faults.retry;

import org.javai.faults.Fault;

import java.time.Duration;
import java.util.Objects;

/**
 * Decides whether and when a caller should retry after a fault.
 *
 * <p>Policies are pure: they never sleep or re-run anything. A caller's loop looks like</p>
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.standard();
 * for (int attempt = 0; ; attempt++) {
 *     Outcome<Order> outcome = fetchOrder(id);
 *     if (outcome.isOk()) {
 *         return outcome;
 *     }
 *     RetryDecision decision = policy.decide(outcome.fault().orElseThrow(), attempt);
 *     if (decision instanceof RetryDecision.Retry retry) {
 *         Thread.sleep(retry.delay().toMillis());
 *     } else {
 *         return outcome;
 *     }
 * }
 * }</pre>
 */
public interface RetryPolicy {

    /**
     * The number of retries {@link #standard()} allows.
     */
    int DEFAULT_MAX_RETRIES = 3;

    /**
     * A unique identifier for this policy, used in reporting.
     */
    String id();

    /**
     * Evaluates a fault and decides whether to retry.
     *
     * @param fault The fault that occurred
     * @param attempt 0-based index of the failed attempt (0 after the first failure)
     * @return Retry with a delay, or GiveUp
     */
    RetryDecision decide(Fault fault, int attempt);

    /**
     * Creates a policy that never retries.
     */
    static RetryPolicy never() {
        return new RetryPolicy() {
            @Override
            public String id() {
                return "never";
            }

            @Override
            public RetryDecision decide(Fault fault, int attempt) {
                return RetryDecision.GiveUp.because("never-retry policy");
            }
        };
    }

    /**
     * {@link #classified(String, int)} with {@value #DEFAULT_MAX_RETRIES} retries.
     */
    static RetryPolicy standard() {
        return classified("standard", DEFAULT_MAX_RETRIES);
    }

    /**
     * Three retries, delays capped at one second. For cheap, latency-sensitive calls.
     */
    static RetryPolicy fast() {
        return classified("fast", 3, Duration.ofSeconds(1));
    }

    /**
     * Five retries, delays capped at one minute. For expensive operations.
     */
    static RetryPolicy slow() {
        return classified("slow", 5, Duration.ofMinutes(1));
    }

    /**
     * Four retries, delays capped at thirty seconds.
     */
    static RetryPolicy network() {
        return classified("network", 4, Duration.ofSeconds(30));
    }

    /**
     * Three retries, delays capped at ten seconds.
     */
    static RetryPolicy database() {
        return classified("database", 3, Duration.ofSeconds(10));
    }

    /**
     * Creates a policy that follows the fault's classification for up to {@code maxRetries} retries.
     */
    static RetryPolicy classified(String id, int maxRetries) {
        return classified(id, maxRetries, null);
    }

    /**
     * Like {@link #classified(String, int)}, with every delay capped at {@code maxDelay}.
     *
     * @param maxDelay upper bound on the advised delay, or null for none
     */
    static RetryPolicy classified(String id, int maxRetries, Duration maxDelay) {
        Objects.requireNonNull(id);
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (maxDelay != null && maxDelay.isNegative()) {
            throw new IllegalArgumentException("maxDelay must not be negative");
        }

        return new RetryPolicy() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public RetryDecision decide(Fault fault, int attempt) {
                Objects.requireNonNull(fault, "fault must not be null");
                if (attempt < 0) {
                    throw new IllegalArgumentException("attempt must be >= 0");
                }
                if (!fault.isRetriable()) {
                    return RetryDecision.GiveUp.because(
                            "fault is not retriable: " + fault.category().categoryName());
                }
                if (attempt >= maxRetries) {
                    return RetryDecision.GiveUp.because("max retries reached");
                }

                Duration delay = fault.retryDelay(attempt);
                if (maxDelay != null && delay.compareTo(maxDelay) > 0) {
                    delay = maxDelay;
                }
                return RetryDecision.Retry.after(delay);
            }
        };
    }
}
