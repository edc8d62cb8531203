package com.letably.reporting.domain;

import com.letably.security.UserRole;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of the available reports.
 *
 * <p>WHY an enum: the set of reports is closed, and each carries its display name, description,
 * default filters and options, and the roles allowed to run it. Request validation and the
 * "available reports" listing both read from here.
 */
public enum ReportType {

    PORTFOLIO("portfolio", "Portfolio Overview",
            "Summary of properties, bedrooms, occupancy and tenants",
            ReportFilters.none(),
            ReportOptions.defaults()),

    OCCUPANCY("occupancy", "Occupancy Report",
            "Room-by-room occupancy with current and upcoming tenants",
            ReportFilters.none().withTenancyStatus("active"),
            ReportOptions.defaults()),

    FINANCIAL("financial", "Financial Report",
            "Rent due, collected and outstanding by month and property",
            ReportFilters.none(),
            ReportOptions.defaults()),

    ARREARS("arrears", "Arrears Report",
            "Tenants with overdue or partially paid rent",
            ReportFilters.none().withPaymentStatus("overdue"),
            ReportOptions.defaults()),

    UPCOMING_ENDINGS("upcoming_endings", "Upcoming Tenancy Endings",
            "Active tenancies ending within the coming days",
            ReportFilters.none().withDaysAhead(90).withTenancyStatus("active"),
            ReportOptions.defaults());

    private static final Set<UserRole> REPORTING_ROLES = EnumSet.of(UserRole.ADMIN, UserRole.LANDLORD);

    private final String code;
    private final String displayName;
    private final String description;
    private final ReportFilters defaultFilters;
    private final ReportOptions defaultOptions;

    ReportType(String code, String displayName, String description,
               ReportFilters defaultFilters, ReportOptions defaultOptions) {
        this.code = code;
        this.displayName = displayName;
        this.description = description;
        this.defaultFilters = defaultFilters;
        this.defaultOptions = defaultOptions;
    }

    /** Identifier used by callers, e.g. {@code upcoming_endings}. */
    public String code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }

    public ReportFilters defaultFilters() {
        return defaultFilters;
    }

    public ReportOptions defaultOptions() {
        return defaultOptions;
    }

    /** Roles allowed to run this report. */
    public Set<UserRole> allowedRoles() {
        return EnumSet.copyOf(REPORTING_ROLES);
    }

    public boolean isAllowedFor(UserRole role) {
        return role != null && REPORTING_ROLES.contains(role);
    }

    /**
     * Looks up a report by its code, ignoring case.
     *
     * @return the matching report, or empty if there is none
     */
    public static Optional<ReportType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String trimmed = code.trim();
        return Arrays.stream(values())
                .filter(type -> type.code.equalsIgnoreCase(trimmed))
                .findFirst();
    }

    /** Reports the given role may run, in registry order. */
    public static List<ReportType> availableFor(UserRole role) {
        return Arrays.stream(values())
                .filter(type -> type.isAllowedFor(role))
                .toList();
    }
}
