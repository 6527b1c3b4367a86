package org.javai.faults;

import java.time.Duration;
import java.util.Objects;

/**
 * A ready-made custom classification backed by a {@link Backoff} schedule.
 *
 * @param categoryName display name
 * @param retriable whether retries are worthwhile
 * @param backoff delay schedule, consulted only when retriable
 */
public record BackoffClassification(String categoryName, boolean retriable, Backoff backoff)
        implements Classification {

    public BackoffClassification {
        Objects.requireNonNull(categoryName, "categoryName must not be null");
        Objects.requireNonNull(backoff, "backoff must not be null");
        if (categoryName.isBlank()) {
            throw new IllegalArgumentException("categoryName must not be blank");
        }
    }

    /**
     * A non-retriable category (business rule violations and the like).
     */
    public static BackoffClassification permanent(String categoryName) {
        return new BackoffClassification(categoryName, false, Backoff.NONE);
    }

    @Override
    public boolean isRetriable() {
        return retriable;
    }

    @Override
    public Duration retryDelay(int attempt) {
        return retriable ? backoff.delay(attempt) : Backoff.NONE.delay(attempt);
    }

    @Override
    public Classification duplicate() {
        return new BackoffClassification(categoryName, retriable, backoff);
    }
}
