package com.letably.database.tenant;

import com.letably.security.AgencyId;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.OptionalLong;

/**
 * H2 binder for embedded development databases and tests.
 *
 * <p>The agency is held in the session variable {@code @agency_id}. The H2 schema exposes each
 * tenant table as a view filtered on that variable, which stands in for PostgreSQL row-level
 * security. H2 variables are session scoped only, so {@link #bindTransactionLocal} relies on the
 * enforcer clearing the variable when the transaction ends.
 */
public class H2TenantSessionBinder implements TenantSessionBinder {

    /** Session variable read by the filtering views. */
    public static final String VARIABLE = "@agency_id";

    /** Session variable that lets platform-staff sessions past the filtering views. */
    public static final String SYSTEM_VARIABLE = "@system_scope";

    @Override
    public void bind(Connection connection, AgencyId agencyId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SET " + VARIABLE + " = ?")) {
            statement.setLong(1, agencyId.value());
            statement.execute();
        }
    }

    @Override
    public void bindTransactionLocal(Connection connection, AgencyId agencyId) throws SQLException {
        bind(connection, agencyId);
    }

    @Override
    public void bindSystem(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("SET " + SYSTEM_VARIABLE + " = TRUE");
        }
    }

    @Override
    public void clear(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("SET " + VARIABLE + " = NULL");
            statement.execute("SET " + SYSTEM_VARIABLE + " = NULL");
        }
    }

    @Override
    public OptionalLong current(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("SELECT CAST(" + VARIABLE + " AS BIGINT)")) {
            if (resultSet.next()) {
                long value = resultSet.getLong(1);
                if (!resultSet.wasNull()) {
                    return OptionalLong.of(value);
                }
            }
            return OptionalLong.empty();
        }
    }
}
