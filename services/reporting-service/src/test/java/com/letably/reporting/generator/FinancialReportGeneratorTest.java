package com.letably.reporting.generator;

import static com.letably.reporting.ReportingDatabase.CLOCK;
import static com.letably.reporting.ReportingDatabase.NORTH;
import static org.assertj.core.api.Assertions.assertThat;

import com.letably.reporting.ReportingDatabase;
import com.letably.reporting.domain.ReportFilters;
import com.letably.reporting.domain.ReportOptions;
import com.letably.reporting.domain.ReportType;
import com.letably.reporting.payload.FinancialReport;
import com.letably.reporting.payload.FinancialReport.PropertyTotals;
import com.letably.reporting.payload.FinancialReport.Totals;
import com.letably.security.testing.TestCallerContextFactory;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("FinancialReportGenerator")
class FinancialReportGeneratorTest {

    private static ReportingDatabase db;
    private static FinancialReportGenerator generator;

    @BeforeAll
    static void setUp() {
        db = ReportingDatabase.withLettings();
        generator = new FinancialReportGenerator(db.gateway(), CLOCK);
    }

    @AfterAll
    static void tearDown() {
        db.close();
    }

    @Nested
    @DisplayName("for a whole year")
    class WholeYear {

        private final FinancialReport report = generator.generate(
                Requests.of(ReportType.FINANCIAL, TestCallerContextFactory.adminOf(1),
                        ReportFilters.none().withYear(2024),
                        ReportOptions.none().withIncludeLandlordInfo(true)),
                NORTH);

        @Test
        @DisplayName("has twelve months, zero-filled")
        void twelveMonths() {
            assertThat(report.year()).isEqualTo(2024);
            assertThat(report.month()).isNull();
            assertThat(report.data()).isNull();
            assertThat(report.monthly()).extracting(Totals::month)
                    .containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12);
            assertThat(report.monthly().get(0).totalDue()).isEqualByComparingTo("0.00");
            assertThat(report.monthly().get(0).monthName()).isEqualTo("Jan");
            assertThat(report.monthly().get(0).collectionRate()).isZero();
        }

        @Test
        @DisplayName("totals a fully paid month")
        void paidMonth() {
            Totals july = report.monthly().get(6);

            assertThat(july.monthName()).isEqualTo("Jul");
            assertThat(july.totalDue()).isEqualByComparingTo("480.00");
            assertThat(july.totalPaid()).isEqualByComparingTo("480.00");
            assertThat(july.outstanding()).isEqualByComparingTo("0.00");
            assertThat(july.paidCount()).isEqualTo(1);
            assertThat(july.overdueCount()).isZero();
            assertThat(july.collectionRate()).isEqualTo(100);
        }

        @Test
        @DisplayName("counts partial payments toward the amount paid")
        void partialMonth() {
            Totals august = report.monthly().get(7);

            assertThat(august.totalDue()).isEqualByComparingTo("980.00");
            assertThat(august.totalPaid()).isEqualByComparingTo("700.00");
            assertThat(august.outstanding()).isEqualByComparingTo("280.00");
            assertThat(august.paymentCount()).isEqualTo(2);
            assertThat(august.paidCount()).isEqualTo(1);
            assertThat(august.overdueCount()).isEqualTo(1);
            assertThat(august.collectionRate()).isEqualTo(71);
        }

        @Test
        @DisplayName("treats unpaid schedules past their due date as overdue")
        void overdueMonth() {
            Totals september = report.monthly().get(8);

            assertThat(september.totalDue()).isEqualByComparingTo("1420.00");
            assertThat(september.totalPaid()).isEqualByComparingTo("500.00");
            assertThat(september.paymentCount()).isEqualTo(3);
            assertThat(september.overdueCount()).isEqualTo(3);
            assertThat(september.collectionRate()).isEqualTo(35);
        }

        @Test
        @DisplayName("does not count future schedules as overdue")
        void futureMonth() {
            Totals october = report.monthly().get(9);

            assertThat(october.totalDue()).isEqualByComparingTo("440.00");
            assertThat(october.overdueCount()).isZero();
        }

        @Test
        @DisplayName("sums the months into the annual row")
        void annual() {
            Totals annual = report.annual();

            assertThat(annual.month()).isNull();
            assertThat(annual.monthName()).isNull();
            assertThat(annual.totalDue()).isEqualByComparingTo("3320.00");
            assertThat(annual.totalPaid()).isEqualByComparingTo("1680.00");
            assertThat(annual.outstanding()).isEqualByComparingTo("1640.00");
            assertThat(annual.paymentCount()).isEqualTo(7);
            assertThat(annual.paidCount()).isEqualTo(2);
            assertThat(annual.overdueCount()).isEqualTo(4);
            assertThat(annual.collectionRate()).isEqualTo(51);
        }

        @Test
        @DisplayName("breaks totals down by property, largest first")
        void byProperty() {
            assertThat(report.byProperty()).extracting(PropertyTotals::id).containsExactly(10L, 11L, 12L);

            PropertyTotals oak = report.byProperty().get(0);
            assertThat(oak.address()).isEqualTo("1 Oak Road, Flat A");
            assertThat(oak.totalDue()).isEqualByComparingTo("2440.00");
            assertThat(oak.totalPaid()).isEqualByComparingTo("1680.00");
            assertThat(oak.outstanding()).isEqualByComparingTo("760.00");
            assertThat(oak.tenantCount()).isEqualTo(2);
            assertThat(oak.landlordName()).isEqualTo("Ada");

            PropertyTotals birch = report.byProperty().get(2);
            assertThat(birch.totalDue()).isEqualByComparingTo("0.00");
            assertThat(birch.tenantCount()).isZero();
            assertThat(birch.landlordName()).isEqualTo("Unassigned");
        }
    }

    @Test
    @DisplayName("reports a single month when one is given")
    void singleMonth() {
        FinancialReport report = generator.generate(
                Requests.of(ReportType.FINANCIAL, TestCallerContextFactory.adminOf(1),
                        ReportFilters.none().withYear(2024).withMonth(8)),
                NORTH);

        assertThat(report.month()).isEqualTo(8);
        assertThat(report.monthly()).isNull();
        assertThat(report.annual()).isNull();
        assertThat(report.data().totalDue()).isEqualByComparingTo("980.00");
        assertThat(report.data().totalPaid()).isEqualByComparingTo("700.00");
        assertThat(report.byProperty().get(0).totalDue()).isEqualByComparingTo("980.00");
    }

    @Test
    @DisplayName("returns zeros for a month with nothing due")
    void emptyMonth() {
        FinancialReport report = generator.generate(
                Requests.of(ReportType.FINANCIAL, TestCallerContextFactory.adminOf(1),
                        ReportFilters.none().withYear(2024).withMonth(3)),
                NORTH);

        assertThat(report.data().month()).isEqualTo(3);
        assertThat(report.data().totalDue()).isEqualByComparingTo("0.00");
        assertThat(report.data().collectionRate()).isZero();
    }

    @Test
    @DisplayName("defaults to the current year")
    void defaultYear() {
        FinancialReport report = generator.generate(
                Requests.of(ReportType.FINANCIAL, TestCallerContextFactory.adminOf(1), ReportFilters.none()),
                NORTH);

        assertThat(report.year()).isEqualTo(2024);
        assertThat(report.annual().totalDue()).isEqualByComparingTo("3320.00");
    }

    @Test
    @DisplayName("restricts totals to the landlord's properties")
    void landlordFilter() {
        FinancialReport report = generator.generate(
                Requests.of(ReportType.FINANCIAL, TestCallerContextFactory.landlordOf(1, 6),
                        ReportFilters.none().withLandlordId(6L).withYear(2024)),
                NORTH);

        assertThat(report.annual().totalDue()).isEqualByComparingTo("880.00");
        assertThat(report.annual().paymentCount()).isEqualTo(2);
        assertThat(report.byProperty()).extracting(PropertyTotals::id).containsExactly(11L);
        assertThat(report.byProperty().get(0).landlordName()).isNull();
    }

    @Test
    @DisplayName("leaves out the property breakdown when switched off")
    void withoutByProperty() {
        FinancialReport report = generator.generate(
                Requests.of(ReportType.FINANCIAL, TestCallerContextFactory.adminOf(1),
                        ReportFilters.none().withYear(2024),
                        ReportOptions.none().withGroupByProperty(false)),
                NORTH);

        assertThat(report.byProperty()).isNull();
    }

    @Nested
    @DisplayName("totals")
    class TotalsArithmetic {

        @Test
        @DisplayName("derives outstanding and collection rate")
        void derived() {
            Totals totals = FinancialReportGenerator.totals(5, new BigDecimal("300"), new BigDecimal("100.005"), 3, 1, 1);

            assertThat(totals.monthName()).isEqualTo("May");
            assertThat(totals.totalDue()).isEqualTo(new BigDecimal("300.00"));
            assertThat(totals.totalPaid()).isEqualTo(new BigDecimal("100.01"));
            assertThat(totals.outstanding()).isEqualTo(new BigDecimal("199.99"));
            assertThat(totals.collectionRate()).isEqualTo(33);
        }

        @Test
        @DisplayName("sums counts and amounts")
        void sum() {
            Totals sum = FinancialReportGenerator.sum(List.of(
                    FinancialReportGenerator.totals(1, new BigDecimal("100"), new BigDecimal("50"), 1, 0, 1),
                    FinancialReportGenerator.totals(2, new BigDecimal("100"), new BigDecimal("100"), 2, 2, 0)));

            assertThat(sum.totalDue()).isEqualTo(new BigDecimal("200.00"));
            assertThat(sum.totalPaid()).isEqualTo(new BigDecimal("150.00"));
            assertThat(sum.paymentCount()).isEqualTo(3);
            assertThat(sum.paidCount()).isEqualTo(2);
            assertThat(sum.overdueCount()).isEqualTo(1);
            assertThat(sum.collectionRate()).isEqualTo(75);
        }
    }
}
