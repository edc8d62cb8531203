package com.letably.database.tenant;

import com.letably.database.GatewayException;
import com.letably.security.AgencyId;

/**
 * The agency context could not be set on (or cleared from) a connection.
 *
 * <p>The request is aborted; the query is never run without a context.
 */
public class TenantContextException extends GatewayException {

    private final transient AgencyId agencyId;

    public TenantContextException(String message, AgencyId agencyId, Throwable cause) {
        super(message, cause);
        this.agencyId = agencyId;
    }

    @Override
    public String kind() {
        return "tenant_context";
    }

    /** Agency that was being bound, {@code null} when clearing for a system call. */
    public AgencyId agencyId() {
        return agencyId;
    }
}
