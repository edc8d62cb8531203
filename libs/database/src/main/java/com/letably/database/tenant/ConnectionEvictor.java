package com.letably.database.tenant;

import java.sql.Connection;

/**
 * Removes a connection from its pool instead of returning it, used when the connection's session
 * state can no longer be trusted. With HikariCP this is {@code HikariDataSource::evictConnection}.
 */
@FunctionalInterface
public interface ConnectionEvictor {

    void evict(Connection connection);
}
