package com.letably.database;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;

/**
 * Maps JDBC failures onto the gateway's error kinds.
 *
 * <ul>
 *   <li>pool wait expired or connection-class SQLState ({@code 08xxx}): {@link ConnectionPoolExhaustedException}
 *   <li>{@link SQLTimeoutException} or PostgreSQL {@code 57014} (query_canceled): {@link QueryTimeoutException}
 *   <li>anything else: {@link QueryExecutionException} with message and SQLState unchanged
 * </ul>
 */
public final class SqlErrorTranslator {

    static final String CONNECTION_EXCEPTION_CLASS = "08";
    static final String QUERY_CANCELED = "57014";

    private final Duration backoffHint;

    public SqlErrorTranslator(Duration backoffHint) {
        this.backoffHint = backoffHint == null ? Duration.ZERO : backoffHint;
    }

    /**
     * Translates a failure to obtain a connection from the pool.
     */
    public GatewayException translateAcquire(SQLException e) {
        return new ConnectionPoolExhaustedException(
                "Could not obtain a database connection: " + e.getMessage(), backoffHint, e);
    }

    /**
     * Translates a failure raised while preparing or running a statement.
     */
    public GatewayException translate(SQLException e) {
        String sqlState = e.getSQLState();
        if (e instanceof SQLTransientConnectionException
                || (sqlState != null && sqlState.startsWith(CONNECTION_EXCEPTION_CLASS))) {
            return new ConnectionPoolExhaustedException(e.getMessage(), backoffHint, e);
        }
        if (e instanceof SQLTimeoutException || QUERY_CANCELED.equals(sqlState)) {
            return new QueryTimeoutException(e.getMessage(), sqlState, e);
        }
        return new QueryExecutionException(e.getMessage(), sqlState, e);
    }

    /**
     * Backoff hint attached to retryable failures.
     */
    public Duration backoffHint() {
        return backoffHint;
    }
}
