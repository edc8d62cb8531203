package com.letably.database.query;

/**
 * Thrown when a query cannot be assembled consistently, most importantly when the number of
 * positional placeholders in the text differs from the number of bound values.
 *
 * <p>WHY a RuntimeException: this is a programming defect in the code composing the query, caught
 * by tests before any statement reaches the database. It is never shown to end users.
 */
public class QueryBuildException extends RuntimeException {

    public QueryBuildException(String message) {
        super(message);
    }
}
