package org.javai.faults;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Classifications for the built-in fault kinds.
 *
 * <p>These are process-wide constants. A built-in fault never stores one of these;
 * it is looked up by kind through {@link #forKind(ErrorKind)}.</p>
 *
 * <table>
 *   <caption>Retry behavior</caption>
 *   <tr><th>Kind</th><th>Retriable</th><th>Base</th><th>Factor</th><th>Cap</th></tr>
 *   <tr><td>Database</td><td>yes</td><td>50 ms</td><td>2</td><td>5 s</td></tr>
 *   <tr><td>Network</td><td>yes</td><td>100 ms</td><td>2</td><td>10 s</td></tr>
 *   <tr><td>Validation, NotFound, Internal</td><td>no</td><td colspan="3">zero delay</td></tr>
 * </table>
 */
public enum BuiltinClassification implements Classification {

    DATABASE("Database", true,
            Backoff.exponential(Duration.ofMillis(50), 2, Duration.ofSeconds(5))),

    NETWORK("Network", true,
            Backoff.exponential(Duration.ofMillis(100), 2, Duration.ofSeconds(10))),

    VALIDATION("Validation", false, Backoff.NONE),

    NOT_FOUND("NotFound", false, Backoff.NONE),

    INTERNAL("Internal", false, Backoff.NONE),

    /**
     * Fallback for {@link ErrorKind#CUSTOM} faults whose own classification is unavailable,
     * typically because they were deserialized. Behaves like {@link #INTERNAL}.
     */
    UNCLASSIFIED("Unclassified", false, Backoff.NONE);

    private static final Map<ErrorKind, BuiltinClassification> BY_KIND = new EnumMap<>(ErrorKind.class);

    static {
        BY_KIND.put(ErrorKind.DATABASE, DATABASE);
        BY_KIND.put(ErrorKind.NETWORK, NETWORK);
        BY_KIND.put(ErrorKind.VALIDATION, VALIDATION);
        BY_KIND.put(ErrorKind.NOT_FOUND, NOT_FOUND);
        BY_KIND.put(ErrorKind.INTERNAL, INTERNAL);
        BY_KIND.put(ErrorKind.CUSTOM, UNCLASSIFIED);
    }

    private final String categoryName;
    private final boolean retriable;
    private final Backoff backoff;

    BuiltinClassification(String categoryName, boolean retriable, Backoff backoff) {
        this.categoryName = categoryName;
        this.retriable = retriable;
        this.backoff = backoff;
    }

    /**
     * Looks up the classification of a kind.
     * {@link ErrorKind#CUSTOM} has no table entry of its own and resolves to {@link #UNCLASSIFIED}.
     */
    public static BuiltinClassification forKind(ErrorKind kind) {
        Objects.requireNonNull(kind, "kind must not be null");
        return BY_KIND.get(kind);
    }

    public Backoff backoff() {
        return backoff;
    }

    @Override
    public boolean isRetriable() {
        return retriable;
    }

    @Override
    public Duration retryDelay(int attempt) {
        return backoff.delay(attempt);
    }

    @Override
    public String categoryName() {
        return categoryName;
    }

    @Override
    public Classification duplicate() {
        return this;
    }
}
