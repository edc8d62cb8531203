package com.letably.reporting.generator;

import com.letably.database.query.Placeholders;
import com.letably.database.query.QueryBuilder;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Query shapes shared by several reports.
 *
 * <p>The occupant CTEs rank the tenancy members of each bedroom with {@code ROW_NUMBER()} so that
 * joining on {@code rn = 1} picks exactly one member per room: the latest start for the current
 * occupant, the earliest upcoming start for the next one. Ties on the start date are broken by
 * tenancy id.
 */
public final class ReportQueries {

    /** Current occupant per bedroom. Columns: bedroom_id, first_name, surname, rent_pppw, start_date, end_date, rn. */
    public static final String CURRENT_OCCUPANT = "current_occupant";

    /** Next occupant per bedroom, same columns as {@link #CURRENT_OCCUPANT}. */
    public static final String NEXT_OCCUPANT = "next_occupant";

    /** Current whole-house tenancy per property. Columns: id, property_id, start_date, end_date, rn. */
    public static final String CURRENT_HOUSE = "current_house";

    /** Next whole-house tenancy per property, same columns as {@link #CURRENT_HOUSE}. */
    public static final String NEXT_HOUSE = "next_house";

    /** Amount paid per payment schedule. Columns: payment_schedule_id, amount_paid. */
    public static final String PAY_SUM = "pay_sum";

    public static final String ACTIVE = "active";
    public static final String WHOLE_HOUSE = "whole_house";

    /** Tenancy statuses that count as an upcoming move-in. */
    public static final List<String> UPCOMING_STATUSES = List.of("active", "signed", "awaiting_signatures", "pending");

    // a whole-house tenancy without members neither occupies nor is about to occupy a house
    private static final String HAS_MEMBERS =
            " AND EXISTS (SELECT 1 FROM tenancy_members hm WHERE hm.tenancy_id = t.id)";

    private static final String OCCUPANT_COLUMNS =
            "SELECT tm.bedroom_id, tm.first_name, tm.surname, tm.rent_pppw, t.start_date, t.end_date, ";

    private static final String HOUSE_COLUMNS = "SELECT t.id, t.property_id, t.start_date, t.end_date, ";

    private ReportQueries() {
        // utility class
    }

    /**
     * Registers {@link #CURRENT_OCCUPANT}: members of tenancies that have started, latest first.
     *
     * @param tenancyStatus status the tenancy must have; {@code null} means active, {@code all}
     *                      means any status
     */
    public static QueryBuilder withCurrentOccupant(QueryBuilder query, String tenancyStatus) {
        List<Object> values = new ArrayList<>();
        values.add(query.today());
        String statusClause = statusClause(tenancyStatus, values);
        return query.withCte(CURRENT_OCCUPANT, OCCUPANT_COLUMNS
                + "ROW_NUMBER() OVER (PARTITION BY tm.bedroom_id ORDER BY t.start_date DESC, t.id DESC) AS rn "
                + "FROM tenancy_members tm INNER JOIN tenancies t ON tm.tenancy_id = t.id "
                + "WHERE tm.bedroom_id IS NOT NULL AND t.start_date <= ?" + statusClause, values.toArray());
    }

    /** Registers {@link #NEXT_OCCUPANT}: members of upcoming tenancies, earliest first. */
    public static QueryBuilder withNextOccupant(QueryBuilder query) {
        List<Object> values = new ArrayList<>(UPCOMING_STATUSES);
        values.add(query.today());
        return query.withCte(NEXT_OCCUPANT, OCCUPANT_COLUMNS
                + "ROW_NUMBER() OVER (PARTITION BY tm.bedroom_id ORDER BY t.start_date ASC, t.id ASC) AS rn "
                + "FROM tenancy_members tm INNER JOIN tenancies t ON tm.tenancy_id = t.id "
                + "WHERE tm.bedroom_id IS NOT NULL AND t.status IN (" + Placeholders.list(UPCOMING_STATUSES.size())
                + ") AND t.start_date > ?", values.toArray());
    }

    /** Registers {@link #CURRENT_HOUSE}, with the same status rule as the current occupant. */
    public static QueryBuilder withCurrentWholeHouse(QueryBuilder query, String tenancyStatus) {
        List<Object> values = new ArrayList<>();
        values.add(WHOLE_HOUSE);
        values.add(query.today());
        String statusClause = statusClause(tenancyStatus, values);
        return query.withCte(CURRENT_HOUSE, HOUSE_COLUMNS
                + "ROW_NUMBER() OVER (PARTITION BY t.property_id ORDER BY t.start_date DESC, t.id DESC) AS rn "
                + "FROM tenancies t WHERE t.tenancy_type = ? AND t.start_date <= ?" + statusClause
                + HAS_MEMBERS, values.toArray());
    }

    /** Registers {@link #NEXT_HOUSE}. */
    public static QueryBuilder withNextWholeHouse(QueryBuilder query) {
        List<Object> values = new ArrayList<>();
        values.add(WHOLE_HOUSE);
        values.addAll(UPCOMING_STATUSES);
        values.add(query.today());
        return query.withCte(NEXT_HOUSE, HOUSE_COLUMNS
                + "ROW_NUMBER() OVER (PARTITION BY t.property_id ORDER BY t.start_date ASC, t.id ASC) AS rn "
                + "FROM tenancies t WHERE t.tenancy_type = ? AND t.status IN ("
                + Placeholders.list(UPCOMING_STATUSES.size()) + ") AND t.start_date > ?" + HAS_MEMBERS,
                values.toArray());
    }

    /** Registers {@link #PAY_SUM}. */
    public static QueryBuilder withPaySum(QueryBuilder query) {
        return query.withCte(PAY_SUM, "SELECT pay.payment_schedule_id, SUM(pay.amount) AS amount_paid "
                + "FROM payments pay GROUP BY pay.payment_schedule_id");
    }

    /** Property address as shown in reports: line 1, then line 2 when present. */
    public static String address(String line1, String line2) {
        if (line2 == null || line2.isBlank()) {
            return line1;
        }
        return line1 + ", " + line2;
    }

    /** First name and surname separated by a space; {@code null} when both are missing. */
    public static String fullName(String firstName, String surname) {
        if (firstName == null && surname == null) {
            return null;
        }
        if (surname == null) {
            return firstName;
        }
        return firstName == null ? surname : firstName + " " + surname;
    }

    /** Landlord name as shown in reports. */
    public static String landlordName(String name) {
        return name == null ? "Unassigned" : name;
    }

    private static String statusClause(String tenancyStatus, List<Object> values) {
        if (tenancyStatus != null && "all".equalsIgnoreCase(tenancyStatus.trim())) {
            return "";
        }
        values.add(tenancyStatus == null || tenancyStatus.isBlank() ? ACTIVE : tenancyStatus);
        return " AND t.status = ?";
    }
}
