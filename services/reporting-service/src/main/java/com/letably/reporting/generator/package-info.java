/**
 * One {@link com.letably.reporting.generator.ReportGenerator} per report type.
 *
 * <p>Generators build their queries with {@link com.letably.database.query.QueryBuilder} and run
 * them through the tenant-scoped surface of the execution gateway only. Landlord and property
 * filters narrow a query; the agency is never a filter.
 */
package com.letably.reporting.generator;
