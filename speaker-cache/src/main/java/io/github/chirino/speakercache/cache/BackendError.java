package io.github.chirino.speakercache.cache;

/** Why a durable store call did not produce a usable result. */
public enum BackendError {
    /** The backend could not be reached or rejected the operation. */
    UNREACHABLE,
    /** The call did not complete within the configured operation timeout. */
    TIMEOUT,
    /** A stored payload could not be decoded. The store has already removed it. */
    CORRUPT;

    /** Errors that mean the backend itself should no longer be trusted. */
    public boolean isConnectivityFailure() {
        return this == UNREACHABLE || this == TIMEOUT;
    }
}
