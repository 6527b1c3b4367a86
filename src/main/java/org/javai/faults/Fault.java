package org.javai.faults;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * A failure, classified by kind.
 *
 * <p>Faults are plain immutable values. They are created once at the failure site, optionally
 * enriched with an {@link ErrorContext}, and passed up the stack inside an
 * {@link Outcome.Fail}. Callers inspect them by pattern:</p>
 * <pre>{@code
 * if (fault instanceof Fault.NotFound notFound) {
 *     return Outcome.ok(defaultFor(notFound.resource()));
 * }
 * if (fault.isRetriable()) {
 *     scheduleRetry(fault.retryDelay(attempt));
 * }
 * }</pre>
 *
 * <p>Only {@link Custom} stores a {@link Classification}. Every other kind resolves its
 * classification from {@link BuiltinClassification} by kind.</p>
 */
public sealed interface Fault
        permits Fault.Database, Fault.Network, Fault.Validation, Fault.NotFound, Fault.Internal, Fault.Custom {

    /**
     * A failed storage operation.
     *
     * @param operation what was being done (e.g. "insert_user")
     * @param detail what went wrong
     * @param context optional diagnostics
     */
    record Database(String operation, String detail, Optional<ErrorContext> context) implements Fault {

        public Database {
            Objects.requireNonNull(operation, "operation must not be null");
            Objects.requireNonNull(detail, "detail must not be null");
            Objects.requireNonNull(context, "context must not be null, use Optional.empty()");
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.DATABASE;
        }

        @Override
        public String message() {
            return "Database error during " + operation + ": " + detail;
        }

        @Override
        public Fault withContext(ErrorContext context) {
            return new Database(operation, detail, Optional.of(context));
        }
    }

    /**
     * A remote call that failed in transit.
     */
    record Network(String detail, Optional<ErrorContext> context) implements Fault {

        public Network {
            Objects.requireNonNull(detail, "detail must not be null");
            Objects.requireNonNull(context, "context must not be null, use Optional.empty()");
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.NETWORK;
        }

        @Override
        public String message() {
            return "Network error: " + detail;
        }

        @Override
        public Fault withContext(ErrorContext context) {
            return new Network(detail, Optional.of(context));
        }
    }

    /**
     * Rejected input.
     *
     * @param field the offending field
     * @param detail why it was rejected
     * @param context optional diagnostics
     */
    record Validation(String field, String detail, Optional<ErrorContext> context) implements Fault {

        public Validation {
            Objects.requireNonNull(field, "field must not be null");
            Objects.requireNonNull(detail, "detail must not be null");
            Objects.requireNonNull(context, "context must not be null, use Optional.empty()");
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.VALIDATION;
        }

        @Override
        public String message() {
            return "Validation error: " + field + ": " + detail;
        }

        @Override
        public Fault withContext(ErrorContext context) {
            return new Validation(field, detail, Optional.of(context));
        }
    }

    /**
     * A missing resource.
     */
    record NotFound(String resource, String identifier, Optional<ErrorContext> context) implements Fault {

        public NotFound {
            Objects.requireNonNull(resource, "resource must not be null");
            Objects.requireNonNull(identifier, "identifier must not be null");
            Objects.requireNonNull(context, "context must not be null, use Optional.empty()");
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.NOT_FOUND;
        }

        @Override
        public String message() {
            return "Not found: " + resource + " with id " + identifier;
        }

        @Override
        public Fault withContext(ErrorContext context) {
            return new NotFound(resource, identifier, Optional.of(context));
        }
    }

    record Internal(String detail, Optional<ErrorContext> context) implements Fault {

        public Internal {
            Objects.requireNonNull(detail, "detail must not be null");
            Objects.requireNonNull(context, "context must not be null, use Optional.empty()");
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.INTERNAL;
        }

        @Override
        public String message() {
            return "Internal error: " + detail;
        }

        @Override
        public Fault withContext(ErrorContext context) {
            return new Internal(detail, Optional.of(context));
        }
    }

    /**
     * A caller-defined category.
     *
     * <p>The constructor stores a {@link Classification#duplicate() duplicate} of the given
     * classification, so no two faults share a classification instance.</p>
     *
     * @param detail what went wrong
     * @param classification the owned classification
     * @param context optional diagnostics
     */
    record Custom(String detail, Classification classification, Optional<ErrorContext> context) implements Fault {

        public Custom {
            Objects.requireNonNull(detail, "detail must not be null");
            Objects.requireNonNull(classification, "classification must not be null");
            Objects.requireNonNull(context, "context must not be null, use Optional.empty()");
            classification = Objects.requireNonNull(classification.duplicate(),
                    "classification.duplicate() must not return null");
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.CUSTOM;
        }

        @Override
        public String message() {
            return detail;
        }

        @Override
        public Classification category() {
            return classification;
        }

        @Override
        public Fault withContext(ErrorContext context) {
            return new Custom(detail, classification, Optional.of(context));
        }

        @Override
        public Fault duplicate() {
            return new Custom(detail, classification, context);
        }
    }

    // Accessors
    ErrorKind kind();

    /**
     * Human-readable description, formatted per kind.
     */
    String message();

    Optional<ErrorContext> context();

    /**
     * Returns a copy carrying the given context in place of any existing one.
     */
    Fault withContext(ErrorContext context);

    // Classification

    /**
     * The classification governing this fault.
     * Built-in kinds answer the shared table entry; {@link Custom} answers its own instance.
     */
    default Classification category() {
        return BuiltinClassification.forKind(kind());
    }

    default boolean isRetriable() {
        return category().isRetriable();
    }

    default Duration retryDelay(int attempt) {
        return category().retryDelay(attempt);
    }

    /**
     * Returns a copy whose context (created if absent) carries the extra entry.
     */
    default Fault annotate(String key, String value) {
        return withContext(context().orElseGet(ErrorContext::create).withMetadata(key, value));
    }

    /**
     * Returns an independent copy. Built-in faults are immutable and share nothing mutable,
     * so they return themselves; {@link Custom} duplicates its classification.
     */
    default Fault duplicate() {
        return this;
    }

    // Factories

    static Fault validation(String field, String message) {
        return new Validation(field, message, Optional.empty());
    }

    static Fault database(String operation, String message) {
        return new Database(operation, message, Optional.empty());
    }

    static Fault network(String message) {
        return new Network(message, Optional.empty());
    }

    static Fault notFound(String resource, String identifier) {
        return new NotFound(resource, identifier, Optional.empty());
    }

    static Fault internal(String message) {
        return new Internal(message, Optional.empty());
    }

    /**
     * Creates a fault in a caller-defined category.
     *
     * @param message what went wrong
     * @param classification the category's behavior; the fault keeps its own duplicate
     */
    static Fault custom(String message, Classification classification) {
        return new Custom(message, classification, Optional.empty());
    }

    /**
     * Unparseable input: a {@link Validation} fault on the {@code parsing} field.
     */
    static Fault parsing(String message) {
        return validation("parsing", message);
    }

    static Fault serialization(String message) {
        return internal("Serialization error: " + message);
    }

    static Fault connection(String message) {
        return network("Connection error: " + message);
    }

    static Fault initialization(String message) {
        return internal("Initialization error: " + message);
    }
}
