package com.letably.database.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A piece of SQL text together with the values bound to its placeholders.
 *
 * <p>Every clause of a {@link QueryBuilder} (CTE body, select expression, join condition,
 * predicate) is a fragment, so a value can only enter a query next to the placeholder it fills.
 * The placeholder count is checked on construction.
 *
 * @param text   SQL text using {@code ?} placeholders
 * @param params bound values in placeholder order (may contain {@code null})
 */
public record SqlFragment(String text, List<Object> params) {

    public SqlFragment {
        if (text == null || text.isBlank()) {
            throw new QueryBuildException("SQL fragment text must not be blank");
        }
        params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
        int placeholders = Placeholders.count(text);
        if (placeholders != params.size()) {
            throw new QueryBuildException("Fragment has %d placeholder(s) but %d bound value(s): %s"
                    .formatted(placeholders, params.size(), text.strip()));
        }
    }

    /**
     * Creates a fragment from text and values.
     */
    public static SqlFragment of(String text, Object... values) {
        return new SqlFragment(text, values == null ? Arrays.asList((Object) null) : Arrays.asList(values));
    }
}
