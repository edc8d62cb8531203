package com.letably.database;

import java.time.Duration;

/**
 * No connection could be obtained from the pool within the configured wait, or the connection
 * broke before the query ran. The gateway never retries this itself.
 */
public class ConnectionPoolExhaustedException extends GatewayException {

    private final Duration backoffHint;

    public ConnectionPoolExhaustedException(String message, Duration backoffHint, Throwable cause) {
        super(message, cause);
        this.backoffHint = backoffHint == null ? Duration.ZERO : backoffHint;
    }

    @Override
    public String kind() {
        return "pool_exhausted";
    }

    @Override
    public boolean isRetryable() {
        return true;
    }

    /**
     * How long a caller should wait before trying again.
     */
    public Duration backoffHint() {
        return backoffHint;
    }
}
