package com.letably.database.query;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Immutable fluent builder for parameterized report queries.
 *
 * <p>Every operation returns a new builder; the receiver is never modified. A builder can therefore
 * be shared as a base and extended along different branches without one branch's predicates or
 * parameters leaking into another.
 *
 * <p>Values supplied by callers (filter values, dates, ids) only ever enter a query through the
 * fragment that holds their placeholder. Identifiers (tables, aliases, CTE names) must be plain SQL
 * identifiers and come from code.
 *
 * <p>{@link #build()} emits clauses in this order, which is also the order parameters are collected:
 * CTE bodies, select list, joins, WHERE predicates, HAVING predicates, LIMIT.
 *
 * <pre>{@code
 * BuiltQuery query = QueryBuilder.create(clock)
 *         .select("p.id", "p.address_line1")
 *         .from("properties", "p")
 *         .whereLandlord(landlordId)
 *         .orderBy("p.address_line1")
 *         .build();
 * }</pre>
 */
public final class QueryBuilder {

    /** Default alias of the properties table used by the scoping helpers. */
    public static final String PROPERTY_ALIAS = "p";

    /** Default alias of the tenancies table used by the status helper. */
    public static final String TENANCY_ALIAS = "t";

    private static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");
    private static final Pattern ORDER_COLUMN =
            Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*(\\.[a-zA-Z_][a-zA-Z0-9_]*)?$");
    private static final Pattern ORDER_AGGREGATE =
            Pattern.compile("^(COUNT|SUM|AVG|MIN|MAX|COALESCE)\\s*\\([^)]+\\)$", Pattern.CASE_INSENSITIVE);

    private final Parts parts;
    private final Clock clock;

    private QueryBuilder(Parts parts, Clock clock) {
        this.parts = parts;
        this.clock = clock;
    }

    /** Creates an empty builder whose date helpers use the UTC system clock. */
    public static QueryBuilder create() {
        return create(Clock.systemUTC());
    }

    /**
     * Creates an empty builder whose date helpers ({@link #whereDaysAhead}) read "today" from the
     * given clock.
     */
    public static QueryBuilder create(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        return new QueryBuilder(new Parts(), clock);
    }

    /** The date the date helpers treat as today. */
    public LocalDate today() {
        return LocalDate.now(clock);
    }

    // ── CTEs ──

    /**
     * Registers a named common table expression. Placeholders in the body are bound to
     * {@code values}; those values precede every value registered by later clauses.
     *
     * @throws QueryBuildException if a CTE with the same name is already registered
     */
    public QueryBuilder withCte(String name, String body, Object... values) {
        requireIdentifier(name, "CTE name");
        SqlFragment fragment = SqlFragment.of(body, values);
        if (parts.ctes.stream().anyMatch(cte -> cte.name().equalsIgnoreCase(name))) {
            throw new QueryBuildException("CTE '" + name + "' is already registered");
        }
        return derive(p -> p.ctes.add(new CommonTableExpression(name, fragment)));
    }

    // ── SELECT / FROM ──

    /** Appends select expressions. Repeated calls accumulate; nothing is de-duplicated. */
    public QueryBuilder select(String... columns) {
        List<SqlFragment> fragments = new ArrayList<>(columns.length);
        for (String column : columns) {
            fragments.add(SqlFragment.of(column));
        }
        return derive(p -> p.selects.addAll(fragments));
    }

    /** Appends select expressions given as a list. */
    public QueryBuilder select(List<String> columns) {
        return select(columns.toArray(String[]::new));
    }

    /**
     * Appends one select expression that needs bound values (e.g. a scalar sub-query filtered by
     * landlord).
     */
    public QueryBuilder selectBound(String expression, Object... values) {
        SqlFragment fragment = SqlFragment.of(expression, values);
        return derive(p -> p.selects.add(fragment));
    }

    /** Sets the source table. A later call replaces an earlier one. */
    public QueryBuilder from(String table, String alias) {
        requireIdentifier(table, "table");
        if (alias != null) {
            requireIdentifier(alias, "alias");
        }
        return derive(p -> {
            p.fromTable = table;
            p.fromAlias = alias;
        });
    }

    /** Sets the source table without an alias. */
    public QueryBuilder from(String table) {
        return from(table, null);
    }

    // ── JOINs ──

    /**
     * Adds an INNER JOIN. Any literal the condition needs must be a placeholder bound through
     * {@code values}.
     */
    public QueryBuilder join(String table, String alias, String condition, Object... values) {
        return join(JoinKind.INNER, table, alias, condition, values);
    }

    /** Adds a LEFT JOIN. */
    public QueryBuilder leftJoin(String table, String alias, String condition, Object... values) {
        return join(JoinKind.LEFT, table, alias, condition, values);
    }

    /** Adds a join of the given kind. */
    public QueryBuilder join(JoinKind kind, String table, String alias, String condition, Object... values) {
        requireIdentifier(table, "table");
        requireIdentifier(alias, "alias");
        Join join = new Join(kind, table, alias, SqlFragment.of(condition, values));
        return derive(p -> p.joins.add(join));
    }

    // ── WHERE ──

    /** Adds a predicate; all predicates are combined with AND. */
    public QueryBuilder where(String condition, Object... values) {
        SqlFragment fragment = SqlFragment.of(condition, values);
        return derive(p -> p.predicates.add(fragment));
    }

    /** Adds a predicate only when {@code apply} is true. */
    public QueryBuilder whereIf(boolean apply, String condition, Object... values) {
        return apply ? where(condition, values) : this;
    }

    /**
     * Membership predicate {@code column IN (?, ...)}, one placeholder per value.
     *
     * @throws IllegalArgumentException if {@code values} is empty
     */
    public QueryBuilder whereIn(String column, List<?> values) {
        requireText(column, "column");
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("IN list for " + column + " must not be empty");
        }
        return where(column + " IN (" + Placeholders.list(values.size()) + ")", values.toArray());
    }

    /**
     * Restricts to one landlord's properties. A {@code null} landlord adds nothing, which means
     * every landlord of the current agency.
     */
    public QueryBuilder whereLandlord(Long landlordId) {
        return whereLandlord(landlordId, PROPERTY_ALIAS);
    }

    /** Landlord restriction against a properties table with a custom alias. */
    public QueryBuilder whereLandlord(Long landlordId, String propertyAlias) {
        if (landlordId == null) {
            return this;
        }
        requireIdentifier(propertyAlias, "alias");
        return where(propertyAlias + ".landlord_id = ?", landlordId);
    }

    /**
     * Restricts to one property. A {@code null} property adds nothing (all properties of the
     * agency, subject to other predicates).
     */
    public QueryBuilder whereProperty(Long propertyId) {
        return whereProperty(propertyId, PROPERTY_ALIAS);
    }

    /** Property restriction against a properties table with a custom alias. */
    public QueryBuilder whereProperty(Long propertyId, String propertyAlias) {
        if (propertyId == null) {
            return this;
        }
        requireIdentifier(propertyAlias, "alias");
        return where(propertyAlias + ".id = ?", propertyId);
    }

    /** Restricts tenancy status unless the status is {@code null} or {@code "all"}. */
    public QueryBuilder whereTenancyStatus(String status) {
        if (status == null || status.isBlank() || "all".equalsIgnoreCase(status)) {
            return this;
        }
        return where(TENANCY_ALIAS + ".status = ?", status);
    }

    /**
     * Half-open window {@code (today, today + days]} on a date column. A {@code null} number of
     * days adds nothing.
     */
    public QueryBuilder whereDaysAhead(String dateColumn, Integer days) {
        if (days == null) {
            return this;
        }
        if (days < 0) {
            throw new IllegalArgumentException("days ahead must not be negative, was " + days);
        }
        LocalDate today = today();
        return where(dateColumn + " > ? AND " + dateColumn + " <= ?", today, today.plusDays(days));
    }

    /**
     * Equality on the year and month parts of a date column. Each part is only constrained when
     * its argument is non-null.
     */
    public QueryBuilder whereYearMonth(String dateColumn, Integer year, Integer month) {
        QueryBuilder next = this;
        if (year != null) {
            next = next.where("EXTRACT(YEAR FROM " + dateColumn + ") = ?", year);
        }
        if (month != null) {
            if (month < 1 || month > 12) {
                throw new IllegalArgumentException("month must be between 1 and 12, was " + month);
            }
            next = next.where("EXTRACT(MONTH FROM " + dateColumn + ") = ?", month);
        }
        return next;
    }

    /** Inclusive date range; either bound may be {@code null}. */
    public QueryBuilder whereDateRange(String dateColumn, LocalDate from, LocalDate to) {
        QueryBuilder next = this;
        if (from != null) {
            next = next.where(dateColumn + " >= ?", from);
        }
        if (to != null) {
            next = next.where(dateColumn + " <= ?", to);
        }
        return next;
    }

    // ── GROUP BY / HAVING / ORDER BY / LIMIT ──

    /** Appends group-by expressions, order preserved. */
    public QueryBuilder groupBy(String... columns) {
        List<String> copy = List.of(columns);
        copy.forEach(column -> requireText(column, "group by column"));
        return derive(p -> p.groupBy.addAll(copy));
    }

    /** Adds a HAVING predicate; multiple are combined with AND. */
    public QueryBuilder having(String condition, Object... values) {
        SqlFragment fragment = SqlFragment.of(condition, values);
        return derive(p -> p.having.add(fragment));
    }

    /** Appends an ascending order-by term. */
    public QueryBuilder orderBy(String column) {
        return orderBy(column, SortDirection.ASC);
    }

    /**
     * Appends an order-by term.
     *
     * @throws IllegalArgumentException if the column is not an identifier, a qualified identifier
     *                                  or a simple aggregate
     */
    public QueryBuilder orderBy(String column, SortDirection direction) {
        if (column == null
                || (!ORDER_COLUMN.matcher(column).matches() && !ORDER_AGGREGATE.matcher(column).matches())) {
            throw new IllegalArgumentException(
                    "Invalid ORDER BY column: " + column + ". Must be a valid column identifier.");
        }
        if (direction == null) {
            throw new IllegalArgumentException("direction must not be null");
        }
        OrderTerm term = new OrderTerm(column, direction);
        return derive(p -> p.orderBy.add(term));
    }

    /** Appends an order-by term with a textual direction ({@code ASC} / {@code DESC}). */
    public QueryBuilder orderBy(String column, String direction) {
        return orderBy(column, SortDirection.parse(direction));
    }

    /** Limits the number of rows; the limit is a bound value. */
    public QueryBuilder limit(int rows) {
        if (rows <= 0) {
            throw new IllegalArgumentException("limit must be positive, was " + rows);
        }
        return derive(p -> p.limit = rows);
    }

    // ── Build ──

    /**
     * Assembles the query text and the flat parameter list.
     *
     * @return the text and its parameters
     * @throws QueryBuildException if no select list or source is set, or if the placeholder
     *                             count of the assembled text differs from the parameter count
     */
    public BuiltQuery build() {
        if (parts.selects.isEmpty()) {
            throw new QueryBuildException("query has no select columns");
        }
        if (parts.fromTable == null) {
            throw new QueryBuildException("query has no source table");
        }

        StringBuilder sql = new StringBuilder();
        List<Object> params = new ArrayList<>();

        if (!parts.ctes.isEmpty()) {
            List<String> rendered = new ArrayList<>();
            for (CommonTableExpression cte : parts.ctes) {
                rendered.add(cte.render());
                params.addAll(cte.body().params());
            }
            sql.append("WITH ").append(String.join(",\n", rendered)).append('\n');
        }

        List<String> selects = new ArrayList<>();
        for (SqlFragment select : parts.selects) {
            selects.add(select.text());
            params.addAll(select.params());
        }
        sql.append("SELECT\n  ").append(String.join(",\n  ", selects)).append('\n');

        sql.append("FROM ").append(parts.fromTable);
        if (parts.fromAlias != null) {
            sql.append(' ').append(parts.fromAlias);
        }
        sql.append('\n');

        for (Join join : parts.joins) {
            sql.append(join.render()).append('\n');
            params.addAll(join.condition().params());
        }

        appendPredicates(sql, params, "WHERE ", parts.predicates);

        if (!parts.groupBy.isEmpty()) {
            sql.append("GROUP BY ").append(String.join(", ", parts.groupBy)).append('\n');
        }

        appendPredicates(sql, params, "HAVING ", parts.having);

        if (!parts.orderBy.isEmpty()) {
            List<String> terms = new ArrayList<>();
            for (OrderTerm term : parts.orderBy) {
                terms.add(term.render());
            }
            sql.append("ORDER BY ").append(String.join(", ", terms)).append('\n');
        }

        if (parts.limit != null) {
            sql.append("LIMIT ?\n");
            params.add(parts.limit);
        }

        String text = sql.toString();
        int placeholders = Placeholders.count(text);
        if (placeholders != params.size()) {
            throw new QueryBuildException("Assembled query has %d placeholder(s) but %d parameter(s)"
                    .formatted(placeholders, params.size()));
        }
        return new BuiltQuery(text, params);
    }

    private static void appendPredicates(StringBuilder sql, List<Object> params, String keyword,
                                         List<SqlFragment> predicates) {
        if (predicates.isEmpty()) {
            return;
        }
        List<String> rendered = new ArrayList<>();
        for (SqlFragment predicate : predicates) {
            rendered.add(predicates.size() == 1 ? predicate.text() : "(" + predicate.text() + ")");
            params.addAll(predicate.params());
        }
        sql.append(keyword).append(String.join("\n  AND ", rendered)).append('\n');
    }

    private QueryBuilder derive(Consumer<Parts> change) {
        Parts next = parts.copy();
        change.accept(next);
        return new QueryBuilder(next, clock);
    }

    private static void requireIdentifier(String value, String what) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid " + what + ": " + value);
        }
    }

    private static void requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " must not be blank");
        }
    }

    /** Mutable clause lists; only ever mutated on a fresh copy inside {@link #derive}. */
    private static final class Parts {
        private final List<CommonTableExpression> ctes = new ArrayList<>();
        private final List<SqlFragment> selects = new ArrayList<>();
        private String fromTable;
        private String fromAlias;
        private final List<Join> joins = new ArrayList<>();
        private final List<SqlFragment> predicates = new ArrayList<>();
        private final List<String> groupBy = new ArrayList<>();
        private final List<SqlFragment> having = new ArrayList<>();
        private final List<OrderTerm> orderBy = new ArrayList<>();
        private Integer limit;

        private Parts copy() {
            Parts copy = new Parts();
            copy.ctes.addAll(ctes);
            copy.selects.addAll(selects);
            copy.fromTable = fromTable;
            copy.fromAlias = fromAlias;
            copy.joins.addAll(joins);
            copy.predicates.addAll(predicates);
            copy.groupBy.addAll(groupBy);
            copy.having.addAll(having);
            copy.orderBy.addAll(orderBy);
            copy.limit = limit;
            return copy;
        }
    }
}
