/**
 * Agency context enforcement on pooled connections.
 */
package com.letably.database.tenant;
