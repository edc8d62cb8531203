/**
 * Observability primitives shared by the database and reporting modules: request context
 * propagation into SLF4J MDC, Micrometer query metrics and OpenTelemetry report spans.
 */
package com.letably.observability;
