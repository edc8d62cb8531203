package com.letably.reporting.service;

import com.letably.database.ConnectionPoolExhaustedException;
import com.letably.observability.ReportTracer;
import com.letably.observability.RequestContext;
import com.letably.observability.RequestContextHolder;
import com.letably.reporting.config.ReportingProperties;
import com.letably.reporting.domain.ReportErrorCode;
import com.letably.reporting.domain.ReportException;
import com.letably.reporting.domain.ReportFilters;
import com.letably.reporting.domain.ReportOptions;
import com.letably.reporting.domain.ReportRequest;
import com.letably.reporting.domain.ReportType;
import com.letably.reporting.export.CsvExport;
import com.letably.reporting.export.CsvReportExporter;
import com.letably.reporting.generator.ReportGenerator;
import com.letably.reporting.payload.ReportPayload;
import com.letably.security.AgencyId;
import com.letably.security.CallerContext;
import com.letably.security.UserRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Validates report requests and runs the matching generator.
 *
 * <p>Validation, in order:
 *
 * <ol>
 *   <li>unknown report code: {@link ReportErrorCode#INVALID_REPORT_TYPE}
 *   <li>role not allowed: {@link ReportErrorCode#ACCESS_DENIED}
 *   <li>landlord callers are forced onto their own landlord id, whatever the filter says; a
 *       landlord without one is {@link ReportErrorCode#MISSING_LANDLORD_ID}
 *   <li>an admin without a landlord filter gets landlord info switched on
 *   <li>no agency on the caller: {@link ReportErrorCode#MISSING_AGENCY_ID}
 * </ol>
 *
 * <p>A generator failing with {@link ConnectionPoolExhaustedException} is retried up to
 * {@code letably.reporting.max-attempts} times in total, waiting the exception's backoff hint
 * between attempts. Every other failure propagates on the first attempt.
 */
@Service
public class ReportService {

    private static final Logger log = LoggerFactory.getLogger(ReportService.class);

    /** Pause between attempts; replaced in tests. */
    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final Map<ReportType, ReportGenerator> generators = new EnumMap<>(ReportType.class);
    private final ReportTracer tracer;
    private final CsvReportExporter csvExporter;
    private final int maxAttempts;
    private final Sleeper sleeper;

    @Autowired
    public ReportService(List<ReportGenerator> generators, ReportTracer tracer, CsvReportExporter csvExporter,
                         ReportingProperties properties) {
        this(generators, tracer, csvExporter, properties.maxAttempts(), Thread::sleep);
    }

    ReportService(List<ReportGenerator> generators, ReportTracer tracer, CsvReportExporter csvExporter,
                  int maxAttempts, Sleeper sleeper) {
        for (ReportGenerator generator : generators) {
            ReportGenerator previous = this.generators.put(generator.type(), generator);
            if (previous != null) {
                throw new IllegalStateException("Two generators registered for " + generator.type().code()
                        + ": " + previous.getClass().getSimpleName() + " and " + generator.getClass().getSimpleName());
            }
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        this.tracer = tracer;
        this.csvExporter = csvExporter;
        this.maxAttempts = maxAttempts;
        this.sleeper = sleeper;
    }

    /** Reports the given role may run. */
    public List<ReportType> availableReports(UserRole role) {
        return ReportType.availableFor(role);
    }

    /**
     * Validates a request for the report with the given code and applies the report's defaults.
     *
     * @throws ReportException if the request is rejected
     */
    public ReportRequest createRequest(String reportCode, CallerContext caller,
                                       ReportFilters filters, ReportOptions options) {
        ReportType type = ReportType.fromCode(reportCode)
                .orElseThrow(() -> new ReportException(ReportErrorCode.INVALID_REPORT_TYPE,
                        "Unknown report type: " + reportCode));
        return createRequest(type, caller, filters, options);
    }

    /**
     * Validates a request for the given report and applies its defaults.
     *
     * @throws ReportException if the request is rejected
     */
    public ReportRequest createRequest(ReportType type, CallerContext caller,
                                       ReportFilters filters, ReportOptions options) {
        if (type == null) {
            throw new ReportException(ReportErrorCode.INVALID_REPORT_TYPE, "Report type is required");
        }
        if (caller == null || !type.isAllowedFor(caller.role())) {
            throw new ReportException(ReportErrorCode.ACCESS_DENIED,
                    "Role " + (caller == null ? "none" : caller.role().value()) + " may not run " + type.code());
        }

        ReportFilters effectiveFilters = (filters == null ? ReportFilters.none() : filters)
                .withDefaults(type.defaultFilters());
        ReportOptions effectiveOptions = (options == null ? ReportOptions.none() : options)
                .withDefaults(type.defaultOptions());

        if (caller.isLandlord()) {
            if (caller.landlordId() == null) {
                throw new ReportException(ReportErrorCode.MISSING_LANDLORD_ID,
                        "Landlord user " + caller.userId() + " has no landlord id");
            }
            effectiveFilters = effectiveFilters.withLandlordId(caller.landlordId());
        } else if (caller.isAdmin() && effectiveFilters.landlordId() == null) {
            effectiveOptions = effectiveOptions.withIncludeLandlordInfo(true);
        }

        if (caller.agencyId() == null) {
            throw new ReportException(ReportErrorCode.MISSING_AGENCY_ID,
                    "User " + caller.userId() + " has no agency");
        }
        return new ReportRequest(type, caller, effectiveFilters, effectiveOptions);
    }

    /** Validates and generates the report with the given code. */
    public ReportPayload generate(String reportCode, CallerContext caller, ReportFilters filters, ReportOptions options) {
        return generate(createRequest(reportCode, caller, filters, options));
    }

    /** Validates and generates the given report. */
    public ReportPayload generate(ReportType type, CallerContext caller, ReportFilters filters, ReportOptions options) {
        return generate(createRequest(type, caller, filters, options));
    }

    /**
     * Generates a validated report under the caller's agency, inside a {@code report.<type>} span
     * and with the request context in MDC.
     */
    public ReportPayload generate(ReportRequest request) {
        ReportGenerator generator = generators.get(request.type());
        if (generator == null) {
            throw new IllegalStateException("No generator registered for " + request.type().code());
        }
        AgencyId agencyId = request.agencyId();
        RequestContext context = RequestContextHolder.get()
                .map(current -> current.withAgency(agencyId.asSetting()))
                .orElseGet(() -> new RequestContext(UUID.randomUUID().toString(), agencyId.asSetting(),
                        Long.toString(request.caller().userId()), null));

        return RequestContextHolder.callWithContext(context, () ->
                tracer.trace(request.type().code(), agencyId.value(), () -> runWithRetry(generator, request, agencyId)));
    }

    /** Generates the report and renders it as CSV. */
    public CsvExport exportCsv(ReportRequest request) {
        return csvExporter.export(generate(request), request.options().landlordInfo());
    }

    private ReportPayload runWithRetry(ReportGenerator generator, ReportRequest request, AgencyId agencyId) {
        if (request.isAgencyWide()) {
            log.debug("Admin user {} running {} across every landlord of {}",
                    request.caller().userId(), request.type().code(), agencyId);
        }
        long start = System.nanoTime();
        int attempt = 1;
        while (true) {
            try {
                ReportPayload payload = generator.generate(request, agencyId);
                log.info("Generated {} report for {} in {} ms (attempt {})", request.type().code(), agencyId,
                        Duration.ofNanos(System.nanoTime() - start).toMillis(), attempt);
                return payload;
            } catch (ConnectionPoolExhaustedException e) {
                if (attempt >= maxAttempts) {
                    log.warn("Giving up on {} report for {} after {} attempts: {}",
                            request.type().code(), agencyId, attempt, e.getMessage());
                    throw e;
                }
                Duration backoff = e.backoffHint();
                log.warn("Pool exhausted generating {} report (attempt {}/{}); retrying in {} ms",
                        request.type().code(), attempt, maxAttempts, backoff.toMillis());
                pause(backoff, e);
                attempt++;
            }
        }
    }

    private void pause(Duration backoff, ConnectionPoolExhaustedException cause) {
        try {
            sleeper.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cause.addSuppressed(e);
            throw cause;
        }
    }
}
