package uk.gegc.copilotexport.shared.result;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Outcome of an operation that fails with a known error kind instead of an exception.
 *
 * @param <T> success value
 * @param <E> error kind, usually an enum
 */
public final class Result<T, E> {

    private final T value;
    private final E error;
    private final String message;

    private Result(T value, E error, String message) {
        this.value = value;
        this.error = error;
        this.message = message;
    }

    public static <T, E> Result<T, E> ok(T value) {
        return new Result<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T, E> Result<T, E> failure(E error, String message) {
        return new Result<>(null, Objects.requireNonNull(error, "error"), message);
    }

    public boolean isOk() {
        return error == null;
    }

    public T value() {
        if (!isOk()) {
            throw new IllegalStateException("Result is a failure: " + error);
        }
        return value;
    }

    public E error() {
        if (isOk()) {
            throw new IllegalStateException("Result is a success");
        }
        return error;
    }

    public String message() {
        return message;
    }

    /**
     * Runs {@code secondary} only when this result failed with exactly {@code kind}.
     * Any other failure and every success are returned unchanged.
     */
    public Result<T, E> recoverOn(E kind, Supplier<Result<T, E>> secondary) {
        if (!isOk() && error.equals(kind)) {
            return secondary.get();
        }
        return this;
    }

    public <X extends RuntimeException> T orElseThrow(Function<Result<T, E>, X> exceptionFactory) {
        if (isOk()) {
            return value;
        }
        throw exceptionFactory.apply(this);
    }

    @Override
    public String toString() {
        return isOk() ? "Ok[" + value + "]" : "Failure[" + error + ": " + message + "]";
    }
}
