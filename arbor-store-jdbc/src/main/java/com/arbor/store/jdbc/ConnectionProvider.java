package com.arbor.store.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/** Abstraction for obtaining a connection to the tree database. */
@FunctionalInterface
public interface ConnectionProvider {
    Connection getConnection() throws SQLException;
}
