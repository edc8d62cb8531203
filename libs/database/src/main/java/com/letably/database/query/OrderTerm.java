package com.letably.database.query;

/**
 * One ORDER BY term.
 *
 * @param column    column, alias or simple aggregate
 * @param direction sort direction
 */
public record OrderTerm(String column, SortDirection direction) {

    String render() {
        return column + " " + direction.name();
    }
}
