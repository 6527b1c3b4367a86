package org.javai.faults;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Diagnostic metadata attached to a {@link Fault}.
 *
 * <p>Contexts are immutable. {@link #withMetadata(String, String)} returns a new context,
 * so a context captured earlier never changes underneath its holder. A context may name the
 * context of an earlier failure as its cause; since a cause must exist before the context that
 * refers to it, the chain can never loop back on itself.</p>
 *
 * @param id unique identifier of this occurrence
 * @param timestamp wall-clock creation time
 * @param metadata key/value annotations in insertion order
 * @param cause the context of the failure that led to this one
 */
public record ErrorContext(
        UUID id,
        Instant timestamp,
        Map<String, String> metadata,
        Optional<ErrorContext> cause
) {

    public static final String EXCEPTION_KEY = "exception";
    public static final String MESSAGE_KEY = "message";
    public static final String FINGERPRINT_KEY = "fingerprint";

    public ErrorContext {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(cause, "cause must not be null, use Optional.empty()");
        metadata = metadata == null ? Map.of() : copyOrdered(metadata);
    }

    /**
     * Creates an empty context with a random id and the current time.
     */
    public static ErrorContext create() {
        return new ErrorContext(UUID.randomUUID(), Instant.now(), Map.of(), Optional.empty());
    }

    /**
     * Creates an empty context whose cause is the given context.
     */
    public static ErrorContext causedBy(ErrorContext cause) {
        Objects.requireNonNull(cause, "cause must not be null");
        return new ErrorContext(UUID.randomUUID(), Instant.now(), Map.of(), Optional.of(cause));
    }

    /**
     * Describes a throwable as a context chain.
     *
     * <p>The returned context records the exception type, its message (when present) and a
     * stack fingerprint. The throwable's own causes become the cause chain, innermost first.
     * A cause graph that revisits a throwable is cut at the repeat.</p>
     */
    public static ErrorContext describing(Throwable throwable) {
        Objects.requireNonNull(throwable, "throwable must not be null");

        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Throwable> chain = new ArrayDeque<>();
        for (Throwable t = throwable; t != null && seen.add(t); t = t.getCause()) {
            chain.push(t);
        }

        ErrorContext context = null;
        while (!chain.isEmpty()) {
            Throwable t = chain.pop();
            ErrorContext next = context == null ? create() : causedBy(context);
            next = next.withMetadata(EXCEPTION_KEY, t.getClass().getName());
            if (t.getMessage() != null) {
                next = next.withMetadata(MESSAGE_KEY, t.getMessage());
            }
            context = next.withMetadata(FINGERPRINT_KEY, fingerprint(t));
        }
        return context;
    }

    /**
     * Returns a copy with the entry added.
     * An existing key keeps its position and takes the new value; a new key goes last.
     */
    public ErrorContext withMetadata(String key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Map<String, String> updated = new LinkedHashMap<>(metadata);
        updated.put(key, value);
        return new ErrorContext(id, timestamp, updated, cause);
    }

    public Optional<String> metadata(String key) {
        return Optional.ofNullable(metadata.get(key));
    }

    public boolean hasMetadata(String key) {
        return metadata.containsKey(key);
    }

    public int metadataCount() {
        return metadata.size();
    }

    /**
     * The cause chain ending with this context, oldest first.
     */
    public List<ErrorContext> history() {
        Deque<ErrorContext> history = new ArrayDeque<>();
        for (ErrorContext c = this; c != null; c = c.cause.orElse(null)) {
            history.push(c);
        }
        return List.copyOf(history);
    }

    /**
     * The oldest context in the chain; this context when there is no cause.
     */
    public ErrorContext root() {
        ErrorContext c = this;
        while (c.cause.isPresent()) {
            c = c.cause.get();
        }
        return c;
    }

    private static Map<String, String> copyOrdered(Map<String, String> metadata) {
        Map<String, String> copy = new LinkedHashMap<>();
        metadata.forEach((k, v) -> copy.put(
                Objects.requireNonNull(k, "metadata keys must not be null"),
                Objects.requireNonNull(v, "metadata values must not be null")));
        return Collections.unmodifiableMap(copy);
    }

    private static String fingerprint(Throwable t) {
        StackTraceElement[] stack = t.getStackTrace();
        if (stack.length == 0) {
            return t.getClass().getName();
        }
        StackTraceElement top = stack[0];
        return t.getClass().getSimpleName() + "@" + top.getClassName() + ":" + top.getLineNumber();
    }
}
