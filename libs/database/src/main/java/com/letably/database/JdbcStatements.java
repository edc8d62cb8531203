package com.letably.database;

import com.letably.database.query.BuiltQuery;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a {@link BuiltQuery} on a connection the caller already owns.
 *
 * <p>Values are bound positionally with {@link PreparedStatement#setObject}, index {@code i + 1}
 * for {@code params[i]}. Nothing here acquires, scopes or releases connections.
 */
public final class JdbcStatements {

    private JdbcStatements() {
        // utility class
    }

    /**
     * Executes a query and materializes all rows.
     *
     * @param timeout statement timeout, rounded up to whole seconds; zero or {@code null} disables it
     */
    public static List<ResultRow> query(Connection connection, BuiltQuery query, Duration timeout)
            throws SQLException {
        try (PreparedStatement statement = prepare(connection, query, timeout);
             ResultSet resultSet = statement.executeQuery()) {
            ResultSetMetaData meta = resultSet.getMetaData();
            int columns = meta.getColumnCount();
            List<ResultRow> rows = new ArrayList<>();
            while (resultSet.next()) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 1; i <= columns; i++) {
                    row.put(meta.getColumnLabel(i), resultSet.getObject(i));
                }
                rows.add(new ResultRow(row));
            }
            return rows;
        }
    }

    /**
     * Executes an insert, update or delete and returns the affected row count.
     */
    public static int update(Connection connection, BuiltQuery query, Duration timeout) throws SQLException {
        try (PreparedStatement statement = prepare(connection, query, timeout)) {
            return statement.executeUpdate();
        }
    }

    private static PreparedStatement prepare(Connection connection, BuiltQuery query, Duration timeout)
            throws SQLException {
        PreparedStatement statement = connection.prepareStatement(query.text());
        try {
            if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
                long seconds = Math.max(1, (timeout.toMillis() + 999) / 1000);
                statement.setQueryTimeout((int) Math.min(Integer.MAX_VALUE, seconds));
            }
            List<Object> params = query.params();
            for (int i = 0; i < params.size(); i++) {
                statement.setObject(i + 1, params.get(i));
            }
            return statement;
        } catch (SQLException e) {
            statement.close();
            throw e;
        }
    }
}
