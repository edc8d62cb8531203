/**
 * Flyway migrations for the reporting schema, one location per dialect.
 */
package com.letably.database.migration;
