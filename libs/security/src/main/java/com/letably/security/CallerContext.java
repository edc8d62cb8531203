package com.letably.security;

/**
 * Identity of the authenticated caller of a report request.
 *
 * <p>WHY a record: immutable value supplied by the authentication layer once per request. The
 * agency id carried here is the only source of tenant scope for the queries the request runs.
 *
 * @param role       the caller's role
 * @param userId     the authenticated user id
 * @param landlordId landlord the caller represents (required for {@link UserRole#LANDLORD}, else nullable)
 * @param agencyId   agency the caller belongs to (nullable only for unauthenticated requests)
 */
public record CallerContext(UserRole role, long userId, Long landlordId, AgencyId agencyId) {

    public CallerContext {
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
    }

    /** Whether this caller is a landlord. */
    public boolean isLandlord() {
        return role == UserRole.LANDLORD;
    }

    /** Whether this caller is an agency administrator. */
    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }
}
