package org.javai.faults;

import java.time.Duration;

/**
 * Decides how a category of fault should be treated by a caller's retry loop.
 *
 * <p>Built-in kinds resolve to a {@link BuiltinClassification}; {@link ErrorKind#CUSTOM}
 * faults carry their own implementation. Implementations must be side-effect free:
 * the same attempt always yields the same delay.</p>
 *
 * <p>Example of a domain-specific category:</p>
 * <pre>{@code
 * Classification payments = new BackoffClassification(
 *         "PaymentProcessing", true, Backoff.exponential(Duration.ofSeconds(1), 2, Duration.ofMinutes(1)));
 *
 * Fault fault = Fault.custom("card issuer unavailable", payments);
 * }</pre>
 *
 * <p>This is advice only. Nothing in this library sleeps or loops; callers should
 * check {@link #isRetriable()} before acting on {@link #retryDelay(int)}.</p>
 */
public interface Classification {

    /**
     * Whether a retry has a chance of succeeding.
     */
    boolean isRetriable();

    /**
     * The suggested delay before the next attempt.
     *
     * @param attempt the number of attempts that have already failed (0-based)
     * @return the delay, never null
     * @throws IllegalArgumentException if {@code attempt} is negative
     */
    Duration retryDelay(int attempt);

    /**
     * A display name for logs and dashboards. Uniqueness is not enforced.
     */
    String categoryName();

    /**
     * Returns a copy that shares no mutable state with this instance.
     * Stateless implementations may return themselves.
     */
    Classification duplicate();
}
