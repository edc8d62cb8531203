package com.letably.database;

/**
 * Base type of every failure surfaced by the execution gateway.
 *
 * <p>Subtypes propagate unchanged through report generators; only {@link
 * ConnectionPoolExhaustedException} is a candidate for a bounded caller-side retry.
 */
public abstract class GatewayException extends RuntimeException {

    protected GatewayException(String message) {
        super(message);
    }

    protected GatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short, stable name of the failure kind, used as a metric tag and in logs.
     */
    public abstract String kind();

    /**
     * Whether repeating the same call later may succeed.
     */
    public boolean isRetryable() {
        return false;
    }
}
