package com.letably.reporting.generator;

import com.letably.database.ResultRow;
import com.letably.database.gateway.ExecutionGateway;
import com.letably.database.query.QueryBuilder;
import com.letably.database.query.SortDirection;
import com.letably.reporting.domain.ReportFilters;
import com.letably.reporting.domain.ReportRequest;
import com.letably.reporting.domain.ReportType;
import com.letably.reporting.payload.ArrearsReport;
import com.letably.reporting.payload.ArrearsReport.Summary;
import com.letably.reporting.payload.ArrearsReport.TenantArrears;
import com.letably.security.AgencyId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Tenants of active tenancies with unpaid rent due before today.
 *
 * <p>A schedule counts when its status matches the payment status filter: {@code overdue} (the
 * default) takes overdue and partially paid schedules, {@code all} takes every unpaid status, any
 * other value takes that status only. Members whose balance over those schedules is zero or
 * negative are dropped by the HAVING clause.
 */
@Component
public class ArrearsReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(ArrearsReportGenerator.class);

    static final String BALANCE = "SUM(ps.amount_due - COALESCE(pay.amount_paid, 0))";

    private final ExecutionGateway gateway;
    private final Clock clock;

    public ArrearsReportGenerator(ExecutionGateway gateway, Clock clock) {
        this.gateway = gateway;
        this.clock = clock;
    }

    @Override
    public ReportType type() {
        return ReportType.ARREARS;
    }

    @Override
    public ArrearsReport generate(ReportRequest request, AgencyId agencyId) {
        LocalDate today = LocalDate.now(clock);
        boolean landlordInfo = request.options().landlordInfo();

        List<TenantArrears> tenants = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        long overduePayments = 0;
        for (ResultRow row : gateway.scopedQuery(arrearsQuery(request.filters()), agencyId)) {
            LocalDate oldest = row.getLocalDate("oldest_due_date");
            BigDecimal arrears = Money.amount(row.getBigDecimal("total_arrears"));
            long payments = row.getLongOrZero("overdue_payments");
            tenants.add(new TenantArrears(
                    row.getLong("member_id"),
                    ReportQueries.fullName(row.getString("first_name"), row.getString("surname")),
                    row.getString("email"),
                    row.getString("phone"),
                    ReportQueries.address(row.getString("address_line1"), row.getString("address_line2")),
                    row.getString("bedroom_name"),
                    row.getLong("tenancy_id"),
                    payments,
                    arrears,
                    oldest,
                    oldest == null ? 0 : ChronoUnit.DAYS.between(oldest, today),
                    landlordInfo ? row.getLong("landlord_id") : null,
                    landlordInfo ? ReportQueries.landlordName(row.getString("landlord_name")) : null));
            total = total.add(arrears);
            overduePayments += payments;
        }

        log.debug("Arrears for {}: {} tenants owing {}", agencyId, tenants.size(), total);
        return new ArrearsReport(tenants, new Summary(tenants.size(), Money.amount(total), overduePayments),
                Instant.now(clock));
    }

    QueryBuilder arrearsQuery(ReportFilters filters) {
        String tenancyStatus = filters.tenancyStatus() != null ? filters.tenancyStatus() : ReportQueries.ACTIVE;
        return ReportQueries.withPaySum(QueryBuilder.create(clock))
                .select("tm.id AS member_id", "tm.first_name", "tm.surname", "u.email", "u.phone",
                        "p.address_line1", "p.address_line2", "b.bedroom_name", "t.id AS tenancy_id",
                        "p.landlord_id", "l.name AS landlord_name",
                        "COUNT(ps.id) AS overdue_payments",
                        BALANCE + " AS total_arrears",
                        "MIN(ps.due_date) AS oldest_due_date")
                .from("tenancy_members", "tm")
                .join("tenancies", "t", "tm.tenancy_id = t.id")
                .join("properties", "p", "t.property_id = p.id")
                .join("payment_schedules", "ps", "ps.tenancy_member_id = tm.id")
                .leftJoin("users", "u", "tm.user_id = u.id")
                .leftJoin("bedrooms", "b", "tm.bedroom_id = b.id")
                .leftJoin("landlords", "l", "p.landlord_id = l.id")
                .leftJoin(ReportQueries.PAY_SUM, "pay", "pay.payment_schedule_id = ps.id")
                .whereTenancyStatus(tenancyStatus)
                .whereIn("ps.status", scheduleStatuses(filters.paymentStatus()))
                .where("ps.due_date < ?", LocalDate.now(clock))
                .whereLandlord(filters.landlordId())
                .whereProperty(filters.propertyId())
                .groupBy("tm.id", "tm.first_name", "tm.surname", "u.email", "u.phone",
                        "p.address_line1", "p.address_line2", "b.bedroom_name", "t.id", "p.landlord_id", "l.name")
                .having(BALANCE + " > ?", BigDecimal.ZERO)
                .orderBy("total_arrears", SortDirection.DESC)
                .orderBy("tm.id");
    }

    static List<String> scheduleStatuses(String paymentStatus) {
        if (paymentStatus == null || paymentStatus.isBlank() || "overdue".equalsIgnoreCase(paymentStatus)) {
            return List.of("overdue", "partial");
        }
        if ("all".equalsIgnoreCase(paymentStatus)) {
            return List.of("pending", "partial", "overdue");
        }
        return List.of(paymentStatus);
    }
}
