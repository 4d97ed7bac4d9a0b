package com.arbor.store.jdbc;

import com.arbor.config.ArborConfig;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Single responsibility: provide JDBC connections to the tree database described by {@link ArborConfig}.
 */
public final class JdbcConnectionProvider implements ConnectionProvider {

    private final ArborConfig config;

    public JdbcConnectionProvider(ArborConfig config) {
        this.config = config != null ? config : throwNPE();
    }

    private static ArborConfig throwNPE() {
        throw new NullPointerException("ArborConfig");
    }

    @Override
    public Connection getConnection() throws SQLException {
        return DriverManager.getConnection(config.getJdbcUrl(), config.getDbUser(),
                config.getDbPassword() != null ? config.getDbPassword() : "");
    }
}
