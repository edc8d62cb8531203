package com.letably.security;

import java.util.Optional;

/**
 * Roles of users that can request reports.
 * <p>
 * WHY an enum: the report registry lists allowed roles per report type, and the landlord
 * scoping rule depends on the role. An exhaustive switch keeps both in one place.
 */
public enum UserRole {

    ADMIN("admin"),
    LANDLORD("landlord"),
    TENANT("tenant");

    private final String value;

    UserRole(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g., "landlord"). */
    public String value() {
        return value;
    }

    /**
     * Looks up a role by its canonical string value, ignoring case.
     *
     * @param value the string to match
     * @return the matching role, or empty if not found
     */
    public static Optional<UserRole> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (UserRole role : values()) {
            if (role.value.equalsIgnoreCase(value.trim())) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
