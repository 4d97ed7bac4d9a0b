package com.arbor.store.jdbc;

import com.arbor.tree.TreeNode;
import com.arbor.tree.store.NodeIdentity;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * Maps a payload type onto the tree table. The store owns the {@code id}, {@code lft} and {@code rgt}
 * columns; the mapper owns every other column.
 */
public interface TreeRowMapper<T extends TreeNode> extends NodeIdentity<T> {

    /** Payload column names, in binding order. */
    List<String> payloadColumns();

    /**
     * Payload column definitions for schema creation, e.g. {@code "name VARCHAR(255) NOT NULL"}.
     * One entry per {@link #payloadColumns()} column.
     */
    List<String> payloadColumnDefinitions();

    /** Creates a node from the current row, reading payload columns only. */
    T newNode(ResultSet rs) throws SQLException;

    /**
     * Binds the payload columns of {@code node} starting at parameter {@code startIndex}.
     *
     * @return next free parameter index
     */
    int bindPayload(PreparedStatement ps, int startIndex, T node) throws SQLException;
}
