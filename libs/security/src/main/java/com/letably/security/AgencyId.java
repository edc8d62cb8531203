package com.letably.security;

/**
 * Identifier of an agency (tenant) sharing the platform database.
 *
 * <p>WHY a record: the agency identifier is the single piece of state threaded from the
 * authenticated caller down to every scoped query. Wrapping the raw integer means a landlord or
 * property id can never be passed where an agency id is expected.
 *
 * <p>Agency ids come from the authenticated session only, never from request filters.
 *
 * @param value positive database identifier of the agency
 */
public record AgencyId(long value) {

    public AgencyId {
        if (value <= 0) {
            throw new IllegalArgumentException("agency id must be a positive integer, was " + value);
        }
    }

    /** Creates an agency id from a raw value. */
    public static AgencyId of(long value) {
        return new AgencyId(value);
    }

    /**
     * Parses an agency id from its textual form (e.g. a session attribute).
     *
     * @throws IllegalArgumentException if the text is not a positive integer
     */
    public static AgencyId parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("agency id must not be null or blank");
        }
        try {
            return new AgencyId(Long.parseLong(text.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("agency id must be a positive integer, was '" + text + "'", e);
        }
    }

    /** The value as the session setting string ({@code app.agency_id}). */
    public String asSetting() {
        return Long.toString(value);
    }

    @Override
    public String toString() {
        return "agency-" + value;
    }
}
