package com.arbor.tree.store;

/**
 * Thrown when the durable tier fails (connection, statement or transaction error). Not retried at this layer.
 */
public final class TreeStoreException extends RuntimeException {

    private final String sqlState;

    public TreeStoreException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public TreeStoreException(String message, String sqlState, Throwable cause) {
        super(sqlState != null ? message + " (SQLState " + sqlState + ")" : message, cause);
        this.sqlState = sqlState;
    }

    /** SQLState reported by the driver, or {@code null} for non-SQL failures. */
    public String getSqlState() {
        return sqlState;
    }
}
