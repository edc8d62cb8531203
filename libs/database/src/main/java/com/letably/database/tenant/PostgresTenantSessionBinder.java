package com.letably.database.tenant;

import com.letably.security.AgencyId;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.OptionalLong;

/**
 * PostgreSQL binder based on the {@code app.agency_id} custom setting that the row-level security
 * policies read with {@code current_setting('app.agency_id', true)}.
 *
 * <p>The value goes through {@code set_config} as a bound parameter, never spliced into SQL text.
 */
public class PostgresTenantSessionBinder implements TenantSessionBinder {

    /** Name of the session setting the RLS policies read. */
    public static final String SETTING = "app.agency_id";

    /** Session setting that lets platform-staff sessions past the RLS policies. */
    public static final String SYSTEM_SETTING = "app.system_scope";

    private static final String SET_CONFIG = "SELECT set_config(?, ?, ?)";
    private static final String RESET = "RESET " + SETTING;
    private static final String RESET_SYSTEM = "RESET " + SYSTEM_SETTING;
    private static final String CURRENT = "SELECT NULLIF(current_setting('" + SETTING + "', true), '')";

    @Override
    public void bind(Connection connection, AgencyId agencyId) throws SQLException {
        setConfig(connection, agencyId, false);
    }

    @Override
    public void bindTransactionLocal(Connection connection, AgencyId agencyId) throws SQLException {
        setConfig(connection, agencyId, true);
    }

    @Override
    public void bindSystem(Connection connection) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(SET_CONFIG)) {
            statement.setString(1, SYSTEM_SETTING);
            statement.setString(2, "on");
            statement.setBoolean(3, false);
            statement.execute();
        }
    }

    @Override
    public void clear(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute(RESET);
            statement.execute(RESET_SYSTEM);
        }
    }

    @Override
    public OptionalLong current(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery(CURRENT)) {
            if (resultSet.next()) {
                String value = resultSet.getString(1);
                if (value != null) {
                    return OptionalLong.of(Long.parseLong(value));
                }
            }
            return OptionalLong.empty();
        }
    }

    private static void setConfig(Connection connection, AgencyId agencyId, boolean local) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(SET_CONFIG)) {
            statement.setString(1, SETTING);
            statement.setString(2, agencyId.asSetting());
            statement.setBoolean(3, local);
            statement.execute();
        }
    }
}
