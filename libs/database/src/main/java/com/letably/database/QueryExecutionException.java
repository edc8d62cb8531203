package com.letably.database;

/**
 * The database rejected or failed a statement (syntax, constraint, type errors and the like).
 *
 * <p>The driver's message and SQLState are carried verbatim and the original exception is kept as
 * the cause.
 */
public class QueryExecutionException extends GatewayException {

    private final String sqlState;

    public QueryExecutionException(String message, String sqlState, Throwable cause) {
        super(message, cause);
        this.sqlState = sqlState;
    }

    @Override
    public String kind() {
        return "execution";
    }

    /** SQLState reported by the driver, may be {@code null}. */
    public String sqlState() {
        return sqlState;
    }
}
