/**
 * Tenant-isolated query composition and execution.
 *
 * <p>{@link com.letably.database.query} builds parameterized SQL, {@link com.letably.database.tenant}
 * scopes pooled connections to one agency, and {@link com.letably.database.gateway} exposes the
 * scoped and system execution surfaces. All gateway failures extend
 * {@link com.letably.database.GatewayException}.
 */
package com.letably.database;
