package com.letably.database.query;

import java.util.Collections;

/**
 * Counts JDBC positional placeholders ({@code ?}) in SQL text and renders placeholder lists.
 *
 * <p>Question marks inside single-quoted literals, double-quoted identifiers, line comments and
 * block comments are not placeholders and are skipped. So are those inside PostgreSQL escape
 * strings ({@code E'it\'s?'}) and dollar-quoted bodies ({@code $$...$$}, {@code $fn$...$fn$}),
 * matching how the PostgreSQL JDBC driver reads the same text.
 */
public final class Placeholders {

    private Placeholders() {
        // utility class
    }

    /**
     * Returns {@code n} comma-separated placeholders, e.g. {@code ?, ?, ?} for an IN list.
     *
     * @throws IllegalArgumentException if {@code n} is not positive
     */
    public static String list(int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("placeholder list needs at least one entry, was " + n);
        }
        return String.join(", ", Collections.nCopies(n, "?"));
    }

    /**
     * Returns the number of positional placeholders in {@code sql}.
     *
     * @param sql SQL text (may be a fragment)
     * @return placeholder count
     */
    public static int count(String sql) {
        int count = 0;
        int i = 0;
        int length = sql.length();
        while (i < length) {
            char c = sql.charAt(i);
            boolean wordStart = i == 0 || !isIdentifierPart(sql.charAt(i - 1));
            int tagEnd = c == '$' && wordStart ? dollarTagEnd(sql, i) : -1;
            if (c == '\'' || c == '"') {
                i = skipQuoted(sql, i, c);
            } else if ((c == 'E' || c == 'e') && wordStart && i + 1 < length && sql.charAt(i + 1) == '\'') {
                i = skipEscapeString(sql, i + 1);
            } else if (tagEnd > 0) {
                String tag = sql.substring(i, tagEnd);
                int end = sql.indexOf(tag, tagEnd);
                i = end < 0 ? length : end + tag.length();
            } else if (c == '-' && i + 1 < length && sql.charAt(i + 1) == '-') {
                int newline = sql.indexOf('\n', i);
                i = newline < 0 ? length : newline + 1;
            } else if (c == '/' && i + 1 < length && sql.charAt(i + 1) == '*') {
                int end = sql.indexOf("*/", i + 2);
                i = end < 0 ? length : end + 2;
            } else {
                if (c == '?') {
                    count++;
                }
                i++;
            }
        }
        return count;
    }

    // backslash escapes the next character; a doubled quote is also an escape
    private static int skipEscapeString(String sql, int quoteAt) {
        int i = quoteAt + 1;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == '\'') {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
                    i += 2;
                    continue;
                }
                return i + 1;
            } else {
                i++;
            }
        }
        return sql.length();
    }

    /**
     * Returns the index just past the opening dollar-quote tag starting at {@code start}, or -1 when
     * the dollar sign does not open one ({@code $1} style parameters, for instance).
     */
    private static int dollarTagEnd(String sql, int start) {
        int i = start + 1;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (c == '$') {
                return i + 1;
            }
            boolean valid = i == start + 1 ? Character.isLetter(c) || c == '_' : isIdentifierPart(c) && c != '$';
            if (!valid) {
                return -1;
            }
            i++;
        }
        return -1;
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    // doubled quote characters are escapes and stay inside the quoted section
    private static int skipQuoted(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }
}
