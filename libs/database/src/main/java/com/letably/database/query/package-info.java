/**
 * Immutable query representation and the fluent {@link com.letably.database.query.QueryBuilder}.
 *
 * <p>Each clause is a {@link com.letably.database.query.SqlFragment} that owns the values bound to
 * its placeholders, so parameter order follows text order by construction.
 */
package com.letably.database.query;
