/**
 * Caller identity and tenant isolation primitives.
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>{@link com.letably.security.AgencyId} — typed agency (tenant) identifier
 *   <li>{@link com.letably.security.CallerContext} — who is asking, as supplied by authentication
 *   <li>{@link com.letably.security.TenantIsolationEnforcer} — row/caller agency checks
 * </ul>
 */
package com.letably.security;
