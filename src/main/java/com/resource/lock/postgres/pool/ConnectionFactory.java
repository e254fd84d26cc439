package com.resource.lock.postgres.pool;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opens new physical connections for {@link SimpleConnectionPool}.
 */
@FunctionalInterface
public interface ConnectionFactory {

    Connection create() throws SQLException;

    static ConnectionFactory fromDataSource(DataSource dataSource) {
        return dataSource::getConnection;
    }

    static ConnectionFactory fromConfig(PoolConfig config) {
        return () -> DriverManager.getConnection(config.getJdbcUrl(), config.getUsername(), config.getPassword());
    }
}
