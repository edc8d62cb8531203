package com.letably.database.tenant;

import com.letably.database.JdbcStatements;
import com.letably.database.ResultRow;
import com.letably.database.query.BuiltQuery;
import com.letably.security.AgencyId;
import com.letably.security.TenantIsolationEnforcer;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

/**
 * A pooled connection whose session is scoped to one agency.
 *
 * <p>Instances are only created by {@link TenantContextEnforcer} after the agency context has been
 * set, and stop working once the callback they were handed to returns. Holding one is therefore
 * proof that SQL run through it is scoped.
 *
 * <p>Rows that carry an {@code agency_id} column are checked against the scoped agency.
 */
public final class TenantScopedConnection {

    static final String AGENCY_COLUMN = "agency_id";

    private final Connection connection;
    private final AgencyId agencyId;
    private final Duration statementTimeout;
    private volatile boolean valid = true;

    TenantScopedConnection(Connection connection, AgencyId agencyId, Duration statementTimeout) {
        this.connection = connection;
        this.agencyId = agencyId;
        this.statementTimeout = statementTimeout;
    }

    /** Agency the session is scoped to. */
    public AgencyId agencyId() {
        return agencyId;
    }

    /**
     * Runs a query in the scoped session.
     *
     * @throws com.letably.security.TenantMismatchException if a returned row belongs to another agency
     */
    public List<ResultRow> query(BuiltQuery query) throws SQLException {
        checkValid();
        List<ResultRow> rows = JdbcStatements.query(connection, query, statementTimeout);
        for (ResultRow row : rows) {
            if (row.has(AGENCY_COLUMN)) {
                Long rowAgency = row.getLong(AGENCY_COLUMN);
                if (rowAgency != null) {
                    TenantIsolationEnforcer.enforce(agencyId, rowAgency);
                }
            }
        }
        return rows;
    }

    /** Runs an insert, update or delete in the scoped session. */
    public int update(BuiltQuery query) throws SQLException {
        checkValid();
        return JdbcStatements.update(connection, query, statementTimeout);
    }

    /** Whether the owning callback is still running. */
    public boolean isValid() {
        return valid;
    }

    void invalidate() {
        valid = false;
    }

    private void checkValid() {
        if (!valid) {
            throw new IllegalStateException("Connection scoped to " + agencyId + " used after its scope ended");
        }
    }
}
