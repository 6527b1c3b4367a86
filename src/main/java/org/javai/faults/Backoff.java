package org.javai.faults;

import java.time.Duration;
import java.util.Objects;

/**
 * An exponential backoff schedule: {@code min(base * factor^attempt, cap)}.
 *
 * <p>The computation saturates at {@code cap}, so arbitrarily large attempt counts are safe.</p>
 *
 * @param base delay for attempt 0
 * @param factor growth per attempt (at least 1)
 * @param cap upper bound for every delay
 */
public record Backoff(Duration base, int factor, Duration cap) {

    /**
     * A schedule that always answers zero. Used by non-retriable categories.
     */
    public static final Backoff NONE = new Backoff(Duration.ZERO, 1, Duration.ZERO);

    public Backoff {
        Objects.requireNonNull(base, "base must not be null");
        Objects.requireNonNull(cap, "cap must not be null");
        if (base.isNegative()) {
            throw new IllegalArgumentException("base must not be negative");
        }
        if (cap.isNegative()) {
            throw new IllegalArgumentException("cap must not be negative");
        }
        if (factor < 1) {
            throw new IllegalArgumentException("factor must be >= 1");
        }
    }

    public static Backoff exponential(Duration base, int factor, Duration cap) {
        return new Backoff(base, factor, cap);
    }

    /**
     * Computes the delay for the given attempt.
     *
     * @param attempt the number of attempts that have already failed (0-based)
     * @return the delay, never greater than {@link #cap()}
     */
    public Duration delay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }
        if (base.isZero() || factor == 1) {
            return min(base, cap);
        }
        Duration delay = base;
        try {
            for (int i = 0; i < attempt && delay.compareTo(cap) < 0; i++) {
                delay = delay.multipliedBy(factor);
            }
        } catch (ArithmeticException overflow) {
            return cap;
        }
        return min(delay, cap);
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
