package com.letably.database.tenant;

import com.letably.security.AgencyId;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.OptionalLong;

/**
 * Sets and clears the agency a pooled connection's session is scoped to.
 *
 * <p>Implementations are dialect specific. They operate on one connection instance only and
 * must never touch a shared or global handle.
 */
public interface TenantSessionBinder {

    /**
     * Scopes the session of {@code connection} to {@code agencyId} until {@link #clear} is called.
     */
    void bind(Connection connection, AgencyId agencyId) throws SQLException;

    /**
     * Scopes the current transaction of {@code connection} to {@code agencyId}. Auto-commit must be
     * off. Where the dialect has no transaction-local setting this behaves like {@link #bind}.
     */
    void bindTransactionLocal(Connection connection, AgencyId agencyId) throws SQLException;

    /**
     * Marks the session of {@code connection} as a platform-staff session that row filtering lets
     * through. Only called on a cleared connection, and cleared again by {@link #clear}.
     */
    void bindSystem(Connection connection) throws SQLException;

    /**
     * Removes any agency or system setting from the session of {@code connection}.
     */
    void clear(Connection connection) throws SQLException;

    /**
     * Reads the agency the session is currently scoped to, empty when unscoped.
     */
    OptionalLong current(Connection connection) throws SQLException;
}
