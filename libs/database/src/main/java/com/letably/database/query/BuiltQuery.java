package com.letably.database.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Final query text and the flat parameter list backing its placeholders, in order.
 *
 * @param text   SQL text with {@code ?} placeholders
 * @param params bound values, index {@code i} fills the {@code i}-th placeholder
 */
public record BuiltQuery(String text, List<Object> params) {

    public BuiltQuery {
        if (text == null || text.isBlank()) {
            throw new QueryBuildException("query text must not be blank");
        }
        params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
    }

    /**
     * Wraps hand-written SQL, checking the placeholder count against the values.
     *
     * @throws QueryBuildException if the counts differ
     */
    public static BuiltQuery of(String text, Object... values) {
        SqlFragment fragment = SqlFragment.of(text, values);
        return new BuiltQuery(fragment.text(), fragment.params());
    }

    /** Number of placeholders in the text. */
    public int placeholderCount() {
        return Placeholders.count(text);
    }
}
