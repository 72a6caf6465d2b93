package io.github.chirino.speakercache.cache;

import java.util.Objects;

/**
 * Outcome of a durable store call: either a value or a {@link BackendError}. Stores return this
 * instead of throwing so that the tier manager alone decides how to react to a failure.
 */
public final class BackendResult<T> {

    private final T value;
    private final BackendError error;

    private BackendResult(T value, BackendError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> BackendResult<T> ok(T value) {
        return new BackendResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> BackendResult<T> failed(BackendError error) {
        return new BackendResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isFailed() {
        return error != null;
    }

    public T value() {
        if (error != null) {
            throw new IllegalStateException("No value, backend call failed with " + error);
        }
        return value;
    }

    public T orElse(T fallback) {
        return error == null ? value : fallback;
    }

    public BackendError error() {
        return error;
    }

    @Override
    public String toString() {
        return error == null ? "BackendResult[ok=" + value + "]" : "BackendResult[" + error + "]";
    }
}
