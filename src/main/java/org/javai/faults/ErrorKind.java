package org.javai.faults;

import java.util.Objects;

/**
 * The closed set of fault kinds.
 * {@link #CUSTOM} is the only extension point: its behavior comes from a caller-supplied
 * {@link Classification} rather than from the built-in table.
 */
public enum ErrorKind {
    /**
     * A storage operation failed (timeouts, lost connections, deadlocks).
     */
    DATABASE("Database"),

    /**
     * A remote call failed in transit.
     */
    NETWORK("Network"),

    /**
     * Input was rejected. Retrying the same input will not help.
     */
    VALIDATION("Validation"),

    /**
     * A requested resource does not exist.
     */
    NOT_FOUND("NotFound"),

    /**
     * Something broke inside the system itself.
     */
    INTERNAL("Internal"),

    /**
     * A caller-defined category carrying its own classification.
     */
    CUSTOM("Custom");

    private final String tag;

    ErrorKind(String tag) {
        this.tag = tag;
    }

    /**
     * The stable tag used in serialized faults (e.g. {@code "NotFound"}).
     */
    public String tag() {
        return tag;
    }

    public boolean isBuiltin() {
        return this != CUSTOM;
    }

    /**
     * Resolves a serialized tag back to its kind.
     *
     * @param tag the tag, as produced by {@link #tag()}
     * @return the matching kind
     * @throws IllegalArgumentException if no kind carries the tag
     */
    public static ErrorKind fromTag(String tag) {
        Objects.requireNonNull(tag, "tag must not be null");
        for (ErrorKind kind : values()) {
            if (kind.tag.equals(tag)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("unknown error kind: " + tag);
    }
}
