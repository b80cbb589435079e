package io.clinic;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Result of a surface operation: either a success payload or a typed {@link ClinicError}.
 *
 * <ul>
 *   <li>{@link Success}: the operation completed and, if it wrote anything, committed.</li>
 *   <li>{@link Failure}: nothing was written; {@link Failure#error()} says why.</li>
 * </ul>
 *
 * <p>Returned by a {@link io.clinic.spi.TransactionCallback}, a failure also tells the
 * {@link io.clinic.spi.TransactionRunner} to roll the unit of work back.
 *
 * @param <T> the success payload type
 */
public sealed interface Outcome<T> permits Outcome.Success, Outcome.Failure {

    static <T> Success<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Failure<T> failure(ClinicError error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    /**
     * Returns the success payload.
     *
     * @throws NoSuchElementException if this is a failure
     */
    T value();

    /**
     * Returns the error.
     *
     * @throws NoSuchElementException if this is a success
     */
    ClinicError error();

    /**
     * Operation completed.
     *
     * @param value the payload, may be {@code null} for operations without one
     */
    record Success<T>(T value) implements Outcome<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public ClinicError error() {
            throw new NoSuchElementException("Success has no error");
        }
    }

    /**
     * Operation rejected or rolled back.
     *
     * @param error why; never {@code null}
     */
    record Failure<T>(ClinicError error) implements Outcome<T> {
        public Failure {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T value() {
            throw new NoSuchElementException("Failure has no value: " + error.message());
        }
    }
}
