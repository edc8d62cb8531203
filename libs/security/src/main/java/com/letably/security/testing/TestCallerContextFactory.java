package com.letably.security.testing;

import com.letably.security.AgencyId;
import com.letably.security.CallerContext;
import com.letably.security.UserRole;

/**
 * Factory for {@link CallerContext} instances in tests.
 * <p>
 * WHY in src/main: other modules import it in their test scope through a regular Maven
 * dependency instead of a test-jar.
 */
public final class TestCallerContextFactory {

    private static final long TEST_USER_ID = 1001L;

    private TestCallerContextFactory() {
        // utility class
    }

    /** An agency administrator of the given agency. */
    public static CallerContext adminOf(long agencyId) {
        return new CallerContext(UserRole.ADMIN, TEST_USER_ID, null, AgencyId.of(agencyId));
    }

    /** A landlord user of the given agency representing {@code landlordId}. */
    public static CallerContext landlordOf(long agencyId, long landlordId) {
        return new CallerContext(UserRole.LANDLORD, TEST_USER_ID, landlordId, AgencyId.of(agencyId));
    }

    /** A tenant (resident) user of the given agency. */
    public static CallerContext tenantOf(long agencyId) {
        return new CallerContext(UserRole.TENANT, TEST_USER_ID, null, AgencyId.of(agencyId));
    }
}
