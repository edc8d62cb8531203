package com.letably.database.query;

/**
 * A named common table expression registered on a query.
 *
 * @param name CTE name referenced by the main query
 * @param body CTE body with its own bound values
 */
public record CommonTableExpression(String name, SqlFragment body) {

    String render() {
        return name + " AS (" + body.text().strip() + ")";
    }
}
