package org.javai.faults;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The result of an operation that may fail.
 * Either {@link Ok} containing a value, or {@link Fail} containing a {@link Fault}.
 *
 * <p>Fallible code returns an {@code Outcome} instead of throwing:</p>
 * <pre>{@code
 * Outcome<User> findUser(String id) {
 *     User user = users.get(id);
 *     return user == null ? Outcome.fail(Fault.notFound("user", id)) : Outcome.ok(user);
 * }
 * }</pre>
 *
 * @param <T> The type of the successful value
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Fail {

    /**
     * A successful outcome containing a value.
     *
     * @param value the successful value (may be null for {@code Outcome<Void>})
     */
    record Ok<T>(T value) implements Outcome<T> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public boolean isFail() {
            return false;
        }

        @Override
        public Optional<Fault> fault() {
            return Optional.empty();
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            return value;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public Outcome<T> mapFault(Function<? super Fault, ? extends Fault> mapper) {
            return this;
        }

        @Override
        public Outcome<T> recover(Function<? super Fault, ? extends T> recovery) {
            return this;
        }

        @Override
        public Outcome<T> recoverWith(Function<? super Fault, ? extends Outcome<T>> recovery) {
            return this;
        }
    }

    /**
     * A failed outcome.
     *
     * @param failure the fault that ended the operation
     */
    record Fail<T>(Fault failure) implements Outcome<T> {

        public Fail {
            Objects.requireNonNull(failure, "failure must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public boolean isFail() {
            return true;
        }

        @Override
        public Optional<Fault> fault() {
            return Optional.of(failure);
        }

        @Override
        public T getOrThrow() {
            throw new FaultException(failure);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            Objects.requireNonNull(supplier);
            return supplier.get();
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Fail<>(failure);
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            return new Fail<>(failure);
        }

        @Override
        public Outcome<T> mapFault(Function<? super Fault, ? extends Fault> mapper) {
            Objects.requireNonNull(mapper);
            return new Fail<>(mapper.apply(failure));
        }

        @Override
        public Outcome<T> recover(Function<? super Fault, ? extends T> recovery) {
            Objects.requireNonNull(recovery);
            return new Ok<>(recovery.apply(failure));
        }

        @Override
        public Outcome<T> recoverWith(Function<? super Fault, ? extends Outcome<T>> recovery) {
            Objects.requireNonNull(recovery);
            return recovery.apply(failure);
        }
    }

    // Query methods
    boolean isOk();
    boolean isFail();

    /**
     * The fault of a failed outcome; empty for {@link Ok}.
     */
    Optional<Fault> fault();

    // Value extraction
    T getOrThrow();
    T getOrElse(T defaultValue);
    T getOrElseGet(Supplier<? extends T> supplier);

    // Transformations
    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);
    <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper);

    /**
     * Rewrites the fault of a failed outcome, e.g. to annotate it on the way up:
     * {@code outcome.mapFault(f -> f.annotate("order", orderId))}.
     */
    Outcome<T> mapFault(Function<? super Fault, ? extends Fault> mapper);

    // Recovery
    Outcome<T> recover(Function<? super Fault, ? extends T> recovery);
    Outcome<T> recoverWith(Function<? super Fault, ? extends Outcome<T>> recovery);

    // Static factories
    static Outcome<Void> ok() {
        return new Ok<>(null);
    }

    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> fail(Fault fault) {
        return new Fail<>(fault);
    }
}
