/**
 * Report registry and request values.
 *
 * <ul>
 *   <li>{@link com.letably.reporting.domain.ReportType} lists the reports, their defaults and the
 *       roles that may run them
 *   <li>{@link com.letably.reporting.domain.ReportRequest} is a request after validation; only
 *       {@link com.letably.reporting.service.ReportService} builds one from caller input
 * </ul>
 *
 * <p>Nothing here touches the database.
 */
package com.letably.reporting.domain;
