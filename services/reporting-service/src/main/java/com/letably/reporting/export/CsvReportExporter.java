package com.letably.reporting.export;

import com.letably.reporting.domain.ReportType;
import com.letably.reporting.payload.ArrearsReport;
import com.letably.reporting.payload.FinancialReport;
import com.letably.reporting.payload.OccupancyReport;
import com.letably.reporting.payload.OccupancyReport.PropertyOccupancy;
import com.letably.reporting.payload.OccupancyReport.Room;
import com.letably.reporting.payload.OccupancyReport.WholeHouseTenancy;
import com.letably.reporting.payload.PortfolioReport;
import com.letably.reporting.payload.ReportPayload;
import com.letably.reporting.payload.UpcomingEndingsReport;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Renders report payloads as CSV.
 *
 * <p>Quoting follows RFC 4180: a field containing a comma, quote or line break is wrapped in
 * double quotes, with embedded quotes doubled. Rows end with CRLF. Amounts are written as
 * {@code £1234.50}, dates as {@code dd/MM/yyyy}, missing values as empty fields. With landlord info
 * a leading {@code Landlord} column is added.
 */
@Component
public class CsvReportExporter {

    static final String BOM = "\uFEFF";
    static final String LINE_END = "\r\n";

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");
    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    private final Clock clock;

    public CsvReportExporter(Clock clock) {
        this.clock = clock;
    }

    /**
     * Renders a payload. Financial payloads render the monthly table; see
     * {@link #exportFinancialByProperty} for the per-property table.
     */
    public CsvExport export(ReportPayload payload, boolean includeLandlordInfo) {
        ReportType type = payload.reportType();
        Table table = switch (type) {
            case PORTFOLIO -> portfolio((PortfolioReport) payload, includeLandlordInfo);
            case OCCUPANCY -> occupancy((OccupancyReport) payload, includeLandlordInfo);
            case FINANCIAL -> financial((FinancialReport) payload);
            case ARREARS -> arrears((ArrearsReport) payload, includeLandlordInfo);
            case UPCOMING_ENDINGS -> endings((UpcomingEndingsReport) payload, includeLandlordInfo);
        };
        return new CsvExport(filename(type.code()), table.render());
    }

    /** Renders the per-property breakdown of a financial report. */
    public CsvExport exportFinancialByProperty(FinancialReport report, boolean includeLandlordInfo) {
        Table table = new Table(includeLandlordInfo,
                "Property", "Tenants", "Total Due", "Total Paid", "Outstanding");
        if (report.byProperty() != null) {
            for (FinancialReport.PropertyTotals property : report.byProperty()) {
                table.row(property.landlordName(),
                        property.address(),
                        Long.toString(property.tenantCount()),
                        money(property.totalDue()),
                        money(property.totalPaid()),
                        money(property.outstanding()));
            }
        }
        return new CsvExport(filename("financial_by_property"), table.render());
    }

    private static Table portfolio(PortfolioReport report, boolean landlordInfo) {
        Table table = new Table(landlordInfo, "Property", "Bedroom", "Status", "Tenant", "Tenancy End");
        if (report.bedroomDetails() != null) {
            for (PortfolioReport.BedroomDetail room : report.bedroomDetails()) {
                table.row(room.landlordName(),
                        room.addressLine1(),
                        room.bedroomName(),
                        room.occupied() ? "Occupied" : "Vacant",
                        room.tenantName(),
                        date(room.tenancyEndDate()));
            }
        }
        return table;
    }

    /** A property with a current whole-house tenancy is one "Whole House" row instead of its rooms. */
    private static Table occupancy(OccupancyReport report, boolean landlordInfo) {
        Table table = new Table(landlordInfo, "Property", "Location", "Bedroom", "Base Rent", "Status",
                "Tenant", "Rent PPPW", "Tenancy Start", "Tenancy End", "Next Tenant", "Next Start");
        for (PropertyOccupancy property : report.properties()) {
            WholeHouseTenancy house = property.wholeHouseTenancy();
            if (house != null) {
                WholeHouseTenancy next = property.nextWholeHouseTenancy();
                table.row(property.landlordName(),
                        property.address(),
                        property.location(),
                        "Whole House",
                        null,
                        "Occupied",
                        house.tenants(),
                        money(house.totalRent()),
                        date(house.startDate()),
                        date(house.endDate()),
                        next == null ? null : next.tenants(),
                        next == null ? null : date(next.startDate()));
                continue;
            }
            for (Room room : property.bedrooms()) {
                table.row(property.landlordName(),
                        property.address(),
                        property.location(),
                        room.name(),
                        money(room.baseRent()),
                        room.occupied() ? "Occupied" : "Vacant",
                        room.tenant() == null ? null : room.tenant().name(),
                        room.tenant() == null ? null : money(room.tenant().rentPppw()),
                        room.tenant() == null ? null : date(room.tenant().tenancyStart()),
                        room.tenant() == null ? null : date(room.tenant().tenancyEnd()),
                        room.nextTenant() == null ? null : room.nextTenant().name(),
                        room.nextTenant() == null ? null : date(room.nextTenant().tenancyStart()));
            }
        }
        return table;
    }

    private static Table financial(FinancialReport report) {
        Table table = new Table(false, "Month", "Total Due", "Total Paid", "Outstanding",
                "Payments", "Paid", "Overdue", "Collection Rate");
        if (report.month() != null) {
            financialRow(table, report.data().monthName() + " " + report.year(), report.data());
        } else {
            for (FinancialReport.Totals month : report.monthly()) {
                financialRow(table, month.monthName(), month);
            }
            financialRow(table, "ANNUAL TOTAL", report.annual());
        }
        return table;
    }

    private static void financialRow(Table table, String label, FinancialReport.Totals totals) {
        table.row(null,
                label,
                money(totals.totalDue()),
                money(totals.totalPaid()),
                money(totals.outstanding()),
                Long.toString(totals.paymentCount()),
                Long.toString(totals.paidCount()),
                Long.toString(totals.overdueCount()),
                totals.collectionRate() + "%");
    }

    private static Table arrears(ArrearsReport report, boolean landlordInfo) {
        Table table = new Table(landlordInfo, "Tenant", "Email", "Phone", "Property", "Bedroom",
                "Overdue Payments", "Total Arrears", "Days Overdue");
        for (ArrearsReport.TenantArrears tenant : report.tenants()) {
            table.row(tenant.landlordName(),
                    tenant.tenantName(),
                    tenant.tenantEmail(),
                    tenant.tenantPhone(),
                    tenant.propertyAddress(),
                    tenant.bedroomName(),
                    Long.toString(tenant.overduePayments()),
                    money(tenant.totalArrears()),
                    Long.toString(tenant.daysOverdue()));
        }
        return table;
    }

    private static Table endings(UpcomingEndingsReport report, boolean landlordInfo) {
        Table table = new Table(landlordInfo, "Property", "Tenants", "End Date", "Days Until End",
                "Weekly Rent", "Status", "Rolling Monthly");
        for (UpcomingEndingsReport.EndingTenancy tenancy : report.tenancies()) {
            table.row(tenancy.landlordName(),
                    tenancy.propertyAddress(),
                    tenancy.tenants(),
                    date(tenancy.endDate()),
                    Long.toString(tenancy.daysUntilEnd()),
                    money(tenancy.totalWeeklyRent()),
                    tenancy.status(),
                    tenancy.rollingMonthly() ? "Yes" : "No");
        }
        return table;
    }

    private String filename(String code) {
        return code.replace('_', '-') + "-" + LocalDate.now(clock).format(FILE_DATE) + ".csv";
    }

    static String money(BigDecimal amount) {
        return amount == null ? null : "£" + amount.toPlainString();
    }

    static String date(LocalDate date) {
        return date == null ? null : date.format(DATE);
    }

    /** RFC 4180 field escaping. */
    static String escape(String field) {
        if (field == null) {
            return "";
        }
        if (field.indexOf(',') >= 0 || field.indexOf('"') >= 0 || field.indexOf('\n') >= 0
                || field.indexOf('\r') >= 0) {
            return '"' + field.replace("\"", "\"\"") + '"';
        }
        return field;
    }

    /**
     * Rows of one CSV file. Every row is given its landlord cell first; it is dropped when the
     * table has no landlord column.
     */
    private static final class Table {

        private final boolean landlordColumn;
        private final List<String> lines = new ArrayList<>();

        Table(boolean landlordColumn, String... headers) {
            this.landlordColumn = landlordColumn;
            List<String> cells = new ArrayList<>();
            if (landlordColumn) {
                cells.add("Landlord");
            }
            cells.addAll(List.of(headers));
            lines.add(join(cells));
        }

        void row(String landlord, String... values) {
            List<String> cells = new ArrayList<>(values.length + 1);
            if (landlordColumn) {
                cells.add(landlord);
            }
            cells.addAll(Arrays.asList(values));
            lines.add(join(cells));
        }

        String render() {
            return BOM + String.join(LINE_END, lines) + LINE_END;
        }

        private static String join(List<String> cells) {
            StringBuilder line = new StringBuilder();
            for (int i = 0; i < cells.size(); i++) {
                if (i > 0) {
                    line.append(',');
                }
                line.append(escape(cells.get(i)));
            }
            return line.toString();
        }
    }
}
