package com.letably.database.query;

/**
 * One join of a query.
 *
 * @param kind      inner or left
 * @param table     joined table or CTE name
 * @param alias     alias used in the rest of the query
 * @param condition ON condition with its own bound values
 */
public record Join(JoinKind kind, String table, String alias, SqlFragment condition) {

    String render() {
        return kind.keyword() + " " + table + " " + alias + " ON " + condition.text();
    }
}
