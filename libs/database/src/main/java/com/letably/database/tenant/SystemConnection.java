package com.letably.database.tenant;

import com.letably.database.JdbcStatements;
import com.letably.database.ResultRow;
import com.letably.database.query.BuiltQuery;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

/**
 * A pooled connection with no agency context, handed to platform-staff work by
 * {@link TenantContextEnforcer#withSystemConnection}. Invalid once that callback returns.
 */
public final class SystemConnection {

    private final Connection connection;
    private final Duration statementTimeout;
    private volatile boolean valid = true;

    SystemConnection(Connection connection, Duration statementTimeout) {
        this.connection = connection;
        this.statementTimeout = statementTimeout;
    }

    public List<ResultRow> query(BuiltQuery query) throws SQLException {
        checkValid();
        return JdbcStatements.query(connection, query, statementTimeout);
    }

    public int update(BuiltQuery query) throws SQLException {
        checkValid();
        return JdbcStatements.update(connection, query, statementTimeout);
    }

    void invalidate() {
        valid = false;
    }

    private void checkValid() {
        if (!valid) {
            throw new IllegalStateException("System connection used after its scope ended");
        }
    }
}
