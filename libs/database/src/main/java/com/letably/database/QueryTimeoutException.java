package com.letably.database;

/**
 * The statement ran longer than the configured statement timeout and was cancelled.
 */
public class QueryTimeoutException extends GatewayException {

    private final String sqlState;

    public QueryTimeoutException(String message, String sqlState, Throwable cause) {
        super(message, cause);
        this.sqlState = sqlState;
    }

    @Override
    public String kind() {
        return "timeout";
    }

    /** SQLState reported by the driver, may be {@code null}. */
    public String sqlState() {
        return sqlState;
    }
}
