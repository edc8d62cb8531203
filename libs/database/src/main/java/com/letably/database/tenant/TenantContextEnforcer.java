package com.letably.database.tenant;

import com.letably.database.GatewayException;
import com.letably.database.SqlErrorTranslator;
import com.letably.security.AgencyId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import javax.sql.DataSource;

/**
 * Runs work on a pooled connection whose session is scoped to exactly one agency.
 *
 * <p>Every scoped call follows the same sequence on a single connection:
 *
 * <pre>
 * ACQUIRE -> SET_CONTEXT(agency) -> EXECUTE -> CLEAR -> RELEASE
 * </pre>
 *
 * <p>RELEASE happens on every exit path. A connection whose context could not be set or cleared is
 * evicted from the pool rather than returned, so a stale agency setting can never reach the next
 * borrower. If SET_CONTEXT fails the work is not run at all; there is no unscoped fallback.
 *
 * <p>JDBC failures inside the work are translated by {@link SqlErrorTranslator}; the enforcer
 * itself never retries.
 */
public class TenantContextEnforcer {

    private static final Logger log = LoggerFactory.getLogger(TenantContextEnforcer.class);

    /** Work run on a connection scoped to one agency. */
    @FunctionalInterface
    public interface ScopedWork<T> {
        T run(TenantScopedConnection connection) throws SQLException;
    }

    /** Work run on a connection with no agency context. */
    @FunctionalInterface
    public interface SystemWork<T> {
        T run(SystemConnection connection) throws SQLException;
    }

    private final DataSource dataSource;
    private final TenantSessionBinder binder;
    private final ConnectionEvictor evictor;
    private final SqlErrorTranslator translator;
    private final Duration statementTimeout;

    public TenantContextEnforcer(DataSource dataSource, TenantSessionBinder binder, ConnectionEvictor evictor,
                                 SqlErrorTranslator translator, Duration statementTimeout) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.binder = Objects.requireNonNull(binder, "binder");
        this.evictor = Objects.requireNonNull(evictor, "evictor");
        this.translator = Objects.requireNonNull(translator, "translator");
        this.statementTimeout = statementTimeout;
    }

    /**
     * Runs {@code work} on a connection scoped to {@code agencyId}.
     *
     * @throws TenantContextException if the context cannot be set; {@code work} is not run
     * @throws GatewayException       for pool, timeout and execution failures
     */
    public <T> T withAgency(AgencyId agencyId, ScopedWork<T> work) {
        Objects.requireNonNull(agencyId, "agencyId");
        Objects.requireNonNull(work, "work");

        Connection connection = acquire();
        boolean reusable = true;
        TenantScopedConnection scoped = null;
        try {
            bind(connection, agencyId, false);
            scoped = new TenantScopedConnection(connection, agencyId, statementTimeout);
            return work.run(scoped);
        } catch (TenantContextException e) {
            reusable = false;
            throw e;
        } catch (SQLException e) {
            throw translator.translate(e);
        } finally {
            if (scoped != null) {
                scoped.invalidate();
                reusable = clear(connection, agencyId);
            }
            release(connection, reusable);
        }
    }

    /**
     * Runs {@code work} inside a transaction whose agency setting is transaction local. The
     * transaction commits when the work returns and rolls back on any other exit, errors included,
     * before auto-commit is restored.
     */
    public <T> T withAgencyTransaction(AgencyId agencyId, ScopedWork<T> work) {
        Objects.requireNonNull(agencyId, "agencyId");
        Objects.requireNonNull(work, "work");

        Connection connection = acquire();
        boolean reusable = true;
        boolean committed = false;
        TenantScopedConnection scoped = null;
        try {
            connection.setAutoCommit(false);
            bind(connection, agencyId, true);
            scoped = new TenantScopedConnection(connection, agencyId, statementTimeout);
            T result = work.run(scoped);
            connection.commit();
            committed = true;
            return result;
        } catch (TenantContextException e) {
            reusable = false;
            throw e;
        } catch (SQLException e) {
            throw translator.translate(e);
        } finally {
            if (scoped != null) {
                scoped.invalidate();
            }
            if (!committed) {
                reusable = rollback(connection) && reusable;
            }
            if (reusable) {
                reusable = restoreAutoCommit(connection) && clear(connection, agencyId);
            }
            release(connection, reusable);
        }
    }

    /**
     * Runs platform-staff work on a connection with no agency context. Any context left on the
     * connection is cleared first so it can neither narrow nor widen the call; the session is then
     * marked as a system session and cleared again before release.
     *
     * @throws TenantContextException if the connection cannot be prepared; {@code work} is not run
     */
    public <T> T withSystemConnection(SystemWork<T> work) {
        Objects.requireNonNull(work, "work");

        Connection connection = acquire();
        boolean reusable = true;
        SystemConnection system = null;
        try {
            try {
                binder.clear(connection);
                binder.bindSystem(connection);
            } catch (SQLException e) {
                reusable = false;
                throw new TenantContextException("Failed to prepare connection for system call: " + e.getMessage(),
                        null, e);
            }
            system = new SystemConnection(connection, statementTimeout);
            return work.run(system);
        } catch (SQLException e) {
            throw translator.translate(e);
        } finally {
            if (system != null) {
                system.invalidate();
                reusable = clear(connection, null);
            }
            release(connection, reusable);
        }
    }

    /** Binder in use, exposed for diagnostics and tests. */
    public TenantSessionBinder binder() {
        return binder;
    }

    // ── Private Helpers ──

    private Connection acquire() {
        try {
            return dataSource.getConnection();
        } catch (SQLException e) {
            throw translator.translateAcquire(e);
        }
    }

    private void bind(Connection connection, AgencyId agencyId, boolean transactionLocal) {
        try {
            if (transactionLocal) {
                binder.bindTransactionLocal(connection, agencyId);
            } else {
                binder.bind(connection, agencyId);
            }
            log.debug("Agency context set to {}", agencyId.value());
        } catch (SQLException e) {
            throw new TenantContextException("Failed to set agency context for " + agencyId + ": " + e.getMessage(),
                    agencyId, e);
        }
    }

    /** Returns false when the connection must not go back to the pool. */
    private boolean clear(Connection connection, AgencyId agencyId) {
        try {
            binder.clear(connection);
            return true;
        } catch (SQLException e) {
            log.warn("Failed to clear session context ({}); evicting connection",
                    agencyId == null ? "system" : agencyId, e);
            return false;
        }
    }

    private boolean rollback(Connection connection) {
        try {
            connection.rollback();
            return true;
        } catch (SQLException e) {
            log.warn("Rollback failed; evicting connection", e);
            return false;
        }
    }

    private boolean restoreAutoCommit(Connection connection) {
        try {
            connection.setAutoCommit(true);
            return true;
        } catch (SQLException e) {
            log.warn("Could not restore auto-commit; evicting connection", e);
            return false;
        }
    }

    private void release(Connection connection, boolean reusable) {
        if (!reusable) {
            evictor.evict(connection);
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to return connection to the pool", e);
        }
    }
}
