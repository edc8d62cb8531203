package com.letably.reporting.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.letably.database.ConnectionPoolExhaustedException;
import com.letably.database.QueryExecutionException;
import com.letably.observability.ReportTracer;
import com.letably.observability.RequestContext;
import com.letably.observability.RequestContextHolder;
import com.letably.reporting.domain.ReportErrorCode;
import com.letably.reporting.domain.ReportException;
import com.letably.reporting.domain.ReportFilters;
import com.letably.reporting.domain.ReportOptions;
import com.letably.reporting.domain.ReportRequest;
import com.letably.reporting.domain.ReportType;
import com.letably.reporting.export.CsvExport;
import com.letably.reporting.export.CsvReportExporter;
import com.letably.reporting.generator.ReportGenerator;
import com.letably.reporting.payload.ArrearsReport;
import com.letably.reporting.payload.ReportPayload;
import com.letably.security.AgencyId;
import com.letably.security.CallerContext;
import com.letably.security.UserRole;
import com.letably.security.testing.TestCallerContextFactory;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ReportService")
class ReportServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-09-15T10:00:00Z"), ZoneOffset.UTC);
    private static final AgencyId AGENCY = AgencyId.of(1);

    private InMemorySpanExporter spans;
    private ReportTracer tracer;
    private ReportGenerator arrears;
    private final List<Long> sleeps = new ArrayList<>();
    private ReportService service;

    @BeforeEach
    void setUp() {
        spans = InMemorySpanExporter.create();
        OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                .setTracerProvider(SdkTracerProvider.builder()
                        .addSpanProcessor(SimpleSpanProcessor.create(spans))
                        .build())
                .build();
        tracer = new ReportTracer(sdk.getTracer("test"));
        arrears = generatorFor(ReportType.ARREARS);
        service = new ReportService(List.of(arrears), tracer, new CsvReportExporter(CLOCK), 3, sleeps::add);
    }

    @AfterEach
    void tearDown() {
        RequestContextHolder.clear();
        spans.reset();
    }

    private static ReportGenerator generatorFor(ReportType type) {
        ReportGenerator generator = mock(ReportGenerator.class);
        when(generator.type()).thenReturn(type);
        return generator;
    }

    private static ArrearsReport emptyArrears() {
        return new ArrearsReport(List.of(), new ArrearsReport.Summary(0, new BigDecimal("0.00"), 0), CLOCK.instant());
    }

    private static ConnectionPoolExhaustedException poolExhausted() {
        return new ConnectionPoolExhaustedException("pool exhausted", Duration.ofMillis(250), null);
    }

    @Nested
    @DisplayName("createRequest")
    class CreateRequest {

        @Test
        @DisplayName("rejects an unknown report code")
        void unknownReport() {
            assertThatThrownBy(() -> service.createRequest("tax_return", TestCallerContextFactory.adminOf(1),
                    null, null))
                    .isInstanceOf(ReportException.class)
                    .extracting(e -> ((ReportException) e).code())
                    .isEqualTo(ReportErrorCode.INVALID_REPORT_TYPE);
        }

        @Test
        @DisplayName("rejects a missing report type")
        void missingType() {
            assertThatThrownBy(() -> service.createRequest((ReportType) null, TestCallerContextFactory.adminOf(1),
                    null, null))
                    .extracting(e -> ((ReportException) e).code())
                    .isEqualTo(ReportErrorCode.INVALID_REPORT_TYPE);
        }

        @Test
        @DisplayName("denies tenants")
        void tenantDenied() {
            assertThatThrownBy(() -> service.createRequest("arrears", TestCallerContextFactory.tenantOf(1),
                    null, null))
                    .extracting(e -> ((ReportException) e).code())
                    .isEqualTo(ReportErrorCode.ACCESS_DENIED);
        }

        @Test
        @DisplayName("denies a request without a caller")
        void noCaller() {
            assertThatThrownBy(() -> service.createRequest("arrears", null, null, null))
                    .extracting(e -> ((ReportException) e).code())
                    .isEqualTo(ReportErrorCode.ACCESS_DENIED);
        }

        @Test
        @DisplayName("checks the report code before the role")
        void codeBeforeRole() {
            assertThatThrownBy(() -> service.createRequest("nope", TestCallerContextFactory.tenantOf(1),
                    null, null))
                    .extracting(e -> ((ReportException) e).code())
                    .isEqualTo(ReportErrorCode.INVALID_REPORT_TYPE);
        }

        @Test
        @DisplayName("requires a landlord id from landlord callers")
        void landlordWithoutId() {
            CallerContext caller = new CallerContext(UserRole.LANDLORD, 7, null, AGENCY);

            assertThatThrownBy(() -> service.createRequest("portfolio", caller, null, null))
                    .extracting(e -> ((ReportException) e).code())
                    .isEqualTo(ReportErrorCode.MISSING_LANDLORD_ID);
        }

        @Test
        @DisplayName("forces landlord callers onto their own landlord id")
        void landlordForced() {
            ReportRequest request = service.createRequest("portfolio", TestCallerContextFactory.landlordOf(1, 5),
                    ReportFilters.none().withLandlordId(6L), null);

            assertThat(request.filters().landlordId()).isEqualTo(5L);
            assertThat(request.options().landlordInfo()).isFalse();
            assertThat(request.isAgencyWide()).isFalse();
        }

        @Test
        @DisplayName("switches landlord info on for an agency-wide admin report")
        void adminAgencyWide() {
            ReportRequest request = service.createRequest("occupancy", TestCallerContextFactory.adminOf(1),
                    null, ReportOptions.none().withIncludeLandlordInfo(false));

            assertThat(request.options().landlordInfo()).isTrue();
            assertThat(request.isAgencyWide()).isTrue();
        }

        @Test
        @DisplayName("leaves landlord info alone for an admin filtering by landlord")
        void adminFiltered() {
            ReportRequest request = service.createRequest("occupancy", TestCallerContextFactory.adminOf(1),
                    ReportFilters.none().withLandlordId(5L), null);

            assertThat(request.options().landlordInfo()).isFalse();
            assertThat(request.filters().landlordId()).isEqualTo(5L);
        }

        @Test
        @DisplayName("requires an agency on the caller")
        void missingAgency() {
            CallerContext caller = new CallerContext(UserRole.ADMIN, 1, null, null);

            assertThatThrownBy(() -> service.createRequest("arrears", caller, null, null))
                    .extracting(e -> ((ReportException) e).code())
                    .isEqualTo(ReportErrorCode.MISSING_AGENCY_ID);
        }

        @Test
        @DisplayName("fills in the report's default filters")
        void defaults() {
            ReportRequest request = service.createRequest("upcoming_endings", TestCallerContextFactory.adminOf(1),
                    ReportFilters.none().withLandlordId(5L), null);

            assertThat(request.filters().daysAhead()).isEqualTo(90);
            assertThat(request.filters().tenancyStatus()).isEqualTo("active");
        }

        @Test
        @DisplayName("keeps caller filters over defaults")
        void callerWins() {
            ReportRequest request = service.createRequest("upcoming_endings", TestCallerContextFactory.adminOf(1),
                    ReportFilters.none().withDaysAhead(30), null);

            assertThat(request.filters().daysAhead()).isEqualTo(30);
        }
    }

    @Nested
    @DisplayName("generate")
    class Generate {

        @Test
        @DisplayName("runs the matching generator under the caller's agency")
        void delegates() {
            ArrearsReport payload = emptyArrears();
            when(arrears.generate(any(), eq(AGENCY))).thenReturn(payload);

            ReportPayload result = service.generate("arrears", TestCallerContextFactory.adminOf(1), null, null);

            assertThat(result).isSameAs(payload);
        }

        @Test
        @DisplayName("wraps generation in a report span")
        void span() {
            when(arrears.generate(any(), any())).thenReturn(emptyArrears());

            service.generate("arrears", TestCallerContextFactory.adminOf(1), null, null);

            List<SpanData> finished = spans.getFinishedSpanItems();
            assertThat(finished).hasSize(1);
            assertThat(finished.get(0).getName()).isEqualTo("report.arrears");
            assertThat(finished.get(0).getAttributes().get(AttributeKey.longKey(ReportTracer.ATTR_AGENCY_ID)))
                    .isEqualTo(1L);
            assertThat(finished.get(0).getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
        }

        @Test
        @DisplayName("sets the request context while generating and clears it afterwards")
        void requestContext() {
            AtomicReference<RequestContext> seen = new AtomicReference<>();
            when(arrears.generate(any(), any())).thenAnswer(invocation -> {
                seen.set(RequestContextHolder.get().orElseThrow());
                return emptyArrears();
            });

            service.generate("arrears", TestCallerContextFactory.adminOf(1), null, null);

            assertThat(seen.get().agencyId()).isEqualTo("1");
            assertThat(seen.get().userId()).isEqualTo("1001");
            assertThat(seen.get().correlationId()).isNotBlank();
            assertThat(RequestContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("keeps an existing correlation id")
        void existingContext() {
            AtomicReference<RequestContext> seen = new AtomicReference<>();
            when(arrears.generate(any(), any())).thenAnswer(invocation -> {
                seen.set(RequestContextHolder.get().orElseThrow());
                return emptyArrears();
            });
            RequestContextHolder.set(new RequestContext("corr-1", null, "42", "req-1"));

            service.generate("arrears", TestCallerContextFactory.adminOf(1), null, null);

            assertThat(seen.get().correlationId()).isEqualTo("corr-1");
            assertThat(seen.get().agencyId()).isEqualTo("1");
            assertThat(RequestContextHolder.get().orElseThrow().agencyId()).isNull();
        }

        @Test
        @DisplayName("fails when no generator is registered for the report")
        void noGenerator() {
            assertThatThrownBy(() -> service.generate("portfolio", TestCallerContextFactory.adminOf(1), null, null))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("portfolio");
        }

        @Test
        @DisplayName("does not call the generator for a rejected request")
        void rejected() {
            assertThatThrownBy(() -> service.generate("arrears", TestCallerContextFactory.tenantOf(1), null, null))
                    .isInstanceOf(ReportException.class);

            verify(arrears, never()).generate(any(), any());
        }
    }

    @Nested
    @DisplayName("retry")
    class Retry {

        @Test
        @DisplayName("retries an exhausted pool after the backoff hint")
        void recovers() {
            ArrearsReport payload = emptyArrears();
            when(arrears.generate(any(), any())).thenThrow(poolExhausted()).thenReturn(payload);

            ReportPayload result = service.generate("arrears", TestCallerContextFactory.adminOf(1), null, null);

            assertThat(result).isSameAs(payload);
            assertThat(sleeps).containsExactly(250L);
            verify(arrears, times(2)).generate(any(), any());
        }

        @Test
        @DisplayName("gives up after the configured number of attempts")
        void givesUp() {
            when(arrears.generate(any(), any())).thenThrow(poolExhausted());

            assertThatThrownBy(() -> service.generate("arrears", TestCallerContextFactory.adminOf(1), null, null))
                    .isInstanceOf(ConnectionPoolExhaustedException.class);

            verify(arrears, times(3)).generate(any(), any());
            assertThat(sleeps).hasSize(2);
            assertThat(spans.getFinishedSpanItems().get(0).getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
        }

        @Test
        @DisplayName("does not retry query failures")
        void noRetryForQueryErrors() {
            when(arrears.generate(any(), any()))
                    .thenThrow(new QueryExecutionException("syntax error", "42601", null));

            assertThatThrownBy(() -> service.generate("arrears", TestCallerContextFactory.adminOf(1), null, null))
                    .isInstanceOf(QueryExecutionException.class);

            verify(arrears, times(1)).generate(any(), any());
            assertThat(sleeps).isEmpty();
        }

        @Test
        @DisplayName("stops retrying when interrupted while waiting")
        void interrupted() {
            service = new ReportService(List.of(arrears), tracer, new CsvReportExporter(CLOCK), 3, millis -> {
                throw new InterruptedException("shutdown");
            });
            when(arrears.generate(any(), any())).thenThrow(poolExhausted());

            try {
                assertThatThrownBy(() -> service.generate("arrears", TestCallerContextFactory.adminOf(1), null, null))
                        .isInstanceOf(ConnectionPoolExhaustedException.class)
                        .satisfies(e -> assertThat(e.getSuppressed()).hasAtLeastOneElementOfType(InterruptedException.class));
                assertThat(Thread.currentThread().isInterrupted()).isTrue();
                verify(arrears, times(1)).generate(any(), any());
            } finally {
                Thread.interrupted();
            }
        }
    }

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("rejects two generators for the same report")
        void duplicateGenerators() {
            List<ReportGenerator> generators = List.of(arrears, generatorFor(ReportType.ARREARS));

            assertThatThrownBy(() -> new ReportService(generators, tracer, new CsvReportExporter(CLOCK), 3, sleeps::add))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("arrears");
        }

        @Test
        @DisplayName("rejects fewer than one attempt")
        void zeroAttempts() {
            assertThatThrownBy(() -> new ReportService(List.of(arrears), tracer, new CsvReportExporter(CLOCK), 0,
                    sleeps::add))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("lists the reports a role may run")
    void availableReports() {
        assertThat(service.availableReports(UserRole.LANDLORD)).hasSize(5);
        assertThat(service.availableReports(UserRole.TENANT)).isEmpty();
    }

    @Test
    @DisplayName("exports a generated report as CSV")
    void exportCsv() {
        when(arrears.generate(any(), any())).thenReturn(emptyArrears());
        ReportRequest request = service.createRequest("arrears", TestCallerContextFactory.landlordOf(1, 5), null, null);

        CsvExport export = service.exportCsv(request);

        assertThat(export.filename()).isEqualTo("arrears-2024-09-15.csv");
        assertThat(export.content()).contains("Tenant,Email,Phone").doesNotContain("Landlord");
    }
}
