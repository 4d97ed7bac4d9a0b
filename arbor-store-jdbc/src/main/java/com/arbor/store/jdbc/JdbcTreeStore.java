package com.arbor.store.jdbc;

import com.arbor.config.ArborConfig;
import com.arbor.tree.IntervalField;
import com.arbor.tree.IntervalRange;
import com.arbor.tree.TreeNode;
import com.arbor.tree.store.TreeStore;
import com.arbor.tree.store.TreeStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * JDBC implementation of {@link TreeStore}. Persists nodes to one table (ARBOR_TREE_TABLE) with columns
 * {@code id}, {@code lft}, {@code rgt} plus the payload columns of a {@link TreeRowMapper}.
 * <p>
 * Shifts are single {@code UPDATE ... SET lft = lft + ? WHERE lft >= ? AND lft < ?} statements. Direct
 * children are resolved with a {@code WITH RECURSIVE} query over the sibling chain unless
 * {@link ArborConfig#isRecursiveChildrenQuery()} is false. Schema (CREATE TABLE IF NOT EXISTS) is executed
 * on demand via {@link #ensureSchema()}.
 * <p>
 * Inside {@link #inTransaction} every statement runs on one connection with auto-commit off; outside it,
 * each statement uses its own connection. Not thread-safe.
 */
public final class JdbcTreeStore<T extends TreeNode> implements TreeStore<T> {

    private static final Logger log = LoggerFactory.getLogger(JdbcTreeStore.class);
    private static final Pattern COLUMN_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final String COLUMN_ID = "id";
    private static final String COLUMN_LEFT = "lft";
    private static final String COLUMN_RIGHT = "rgt";

    private final TreeRowMapper<T> mapper;
    private final ConnectionProvider connectionProvider;
    private final String table;
    private final boolean recursiveChildrenQuery;
    private final TreeSchemaBootstrapper schemaBootstrapper;
    private Connection transaction;

    public JdbcTreeStore(ArborConfig config, TreeRowMapper<T> mapper) {
        this(config, mapper, new JdbcConnectionProvider(config));
    }

    public JdbcTreeStore(ArborConfig config, TreeRowMapper<T> mapper, ConnectionProvider connectionProvider) {
        Objects.requireNonNull(config, "config");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.table = config.getTreeTable();
        this.recursiveChildrenQuery = config.isRecursiveChildrenQuery();
        for (String column : mapper.payloadColumns()) {
            if (!COLUMN_NAME.matcher(column).matches()) {
                throw new IllegalArgumentException("Invalid payload column name: " + column);
            }
        }
        if (mapper.payloadColumns().size() != mapper.payloadColumnDefinitions().size()) {
            throw new IllegalArgumentException("Payload columns and column definitions differ in size");
        }
        this.schemaBootstrapper = new TreeSchemaBootstrapper(table, mapper.payloadColumnDefinitions());
    }

    /**
     * Creates the tree table and indexes if they do not exist. Idempotent; safe to call at bootstrap.
     */
    public void ensureSchema() {
        schemaBootstrapper.ensureSchema(connectionProvider);
    }

    public String getTable() {
        return table;
    }

    @Override
    public List<T> readAll() {
        String sql = "SELECT " + columns("") + " FROM " + table + " ORDER BY " + COLUMN_LEFT;
        return query("readAll", sql);
    }

    @Override
    public Optional<T> findByLeft(long left) {
        String sql = "SELECT " + columns("") + " FROM " + table + " WHERE " + COLUMN_LEFT + " = ?";
        List<T> rows = query("findByLeft", sql, left);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<T> findContainedIn(long left, long right) {
        String sql = "SELECT " + columns("") + " FROM " + table
                + " WHERE " + COLUMN_LEFT + " > ? AND " + COLUMN_RIGHT + " < ? ORDER BY " + COLUMN_LEFT;
        return query("findContainedIn", sql, left, right);
    }

    @Override
    public List<T> findContaining(long left, long right) {
        String sql = "SELECT " + columns("") + " FROM " + table
                + " WHERE " + COLUMN_LEFT + " < ? AND " + COLUMN_RIGHT + " > ? ORDER BY " + COLUMN_LEFT;
        return query("findContaining", sql, left, right);
    }

    /**
     * Resolves the sibling chain in one round trip. Bounds are inlined as numeric literals (they are longs)
     * because some drivers reject parameters inside recursive common table expressions.
     */
    @Override
    public List<T> findChildren(long parentLeft, long parentRight) {
        if (!recursiveChildrenQuery) {
            return TreeStore.super.findChildren(parentLeft, parentRight);
        }
        String sql = "WITH RECURSIVE siblings (id, lft, rgt) AS ("
                + " SELECT " + COLUMN_ID + ", " + COLUMN_LEFT + ", " + COLUMN_RIGHT + " FROM " + table
                + " WHERE " + COLUMN_LEFT + " = " + (parentLeft + 1) + " AND " + COLUMN_LEFT + " < " + parentRight
                + " UNION ALL"
                + " SELECT t." + COLUMN_ID + ", t." + COLUMN_LEFT + ", t." + COLUMN_RIGHT + " FROM " + table + " t"
                + " INNER JOIN siblings s ON t." + COLUMN_LEFT + " = s.rgt + 1"
                + " WHERE t." + COLUMN_LEFT + " < " + parentRight
                + ")"
                + " SELECT " + columns("n.") + " FROM " + table + " n"
                + " INNER JOIN siblings s ON n." + COLUMN_ID + " = s.id"
                + " ORDER BY n." + COLUMN_LEFT;
        return query("findChildren", sql);
    }

    @Override
    public int shift(IntervalField field, IntervalRange range, long delta) {
        String column = column(field);
        List<Long> bounds = new ArrayList<>(2);
        StringBuilder sql = new StringBuilder("UPDATE ").append(table)
                .append(" SET ").append(column).append(" = ").append(column).append(" + ? WHERE ");
        if (range.from() != null) {
            sql.append(column).append(" >= ?");
            bounds.add(range.from());
        }
        if (range.to() != null) {
            if (range.from() != null) {
                sql.append(" AND ");
            }
            sql.append(column).append(" < ?");
            bounds.add(range.to());
        }
        return withConnection("shift", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
                ps.setLong(1, delta);
                for (int i = 0; i < bounds.size(); i++) {
                    ps.setLong(i + 2, bounds.get(i));
                }
                int updated = ps.executeUpdate();
                log.debug("Tree store shift | {} | {} {} by {} | rows={}", table, column, range, delta, updated);
                return updated;
            }
        });
    }

    @Override
    public void insert(T node) {
        List<String> payload = mapper.payloadColumns();
        StringBuilder sql = new StringBuilder("INSERT INTO ").append(table)
                .append(" (").append(COLUMN_LEFT).append(", ").append(COLUMN_RIGHT);
        for (String column : payload) {
            sql.append(", ").append(column);
        }
        sql.append(") VALUES (?, ?");
        sql.append(", ?".repeat(payload.size()));
        sql.append(")");
        withConnection("insert", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql.toString(), Statement.RETURN_GENERATED_KEYS)) {
                ps.setLong(1, node.getLeft());
                ps.setLong(2, node.getRight());
                mapper.bindPayload(ps, 3, node);
                ps.executeUpdate();
                try (ResultSet keys = ps.getGeneratedKeys()) {
                    if (!keys.next()) {
                        throw new SQLException("No generated key returned for " + table);
                    }
                    mapper.setId(node, keys.getLong(1));
                }
            }
            log.debug("Tree store insert | {} | id={} [{}, {}]", table, mapper.getId(node), node.getLeft(), node.getRight());
            return null;
        });
    }

    @Override
    public Object keyOf(T node) {
        return mapper.getId(node);
    }

    @Override
    public OptionalLong min(IntervalField field) {
        return aggregate("min", "MIN(" + column(field) + ")");
    }

    @Override
    public OptionalLong max(IntervalField field) {
        return aggregate("max", "MAX(" + column(field) + ")");
    }

    @Override
    public <R> R inTransaction(Supplier<R> work) {
        if (transaction != null) {
            return work.get();
        }
        Connection c = begin();
        transaction = c;
        try {
            R result = work.get();
            c.commit();
            return result;
        } catch (SQLException e) {
            rollback(c, e);
            throw failure("commit", e);
        } catch (RuntimeException e) {
            rollback(c, e);
            throw e;
        } finally {
            transaction = null;
            close(c);
        }
    }

    private Connection begin() {
        Connection c = null;
        try {
            c = connectionProvider.getConnection();
            c.setAutoCommit(false);
            return c;
        } catch (SQLException e) {
            if (c != null) {
                close(c);
            }
            throw failure("begin", e);
        }
    }

    private void rollback(Connection c, Exception cause) {
        try {
            c.rollback();
            log.warn("Tree store transaction rolled back | {} | cause={}", table, cause.getMessage());
        } catch (SQLException e) {
            cause.addSuppressed(e);
            log.error("Tree store rollback failed | {} | error={} SQLState={}", table, e.getMessage(), e.getSQLState(), e);
        }
    }

    private void close(Connection c) {
        try {
            c.close();
        } catch (SQLException e) {
            log.warn("Tree store connection close failed | {} | error={}", table, e.getMessage());
        }
    }

    private OptionalLong aggregate(String operation, String expression) {
        String sql = "SELECT " + expression + " FROM " + table;
        return withConnection(operation, c -> {
            try (PreparedStatement ps = c.prepareStatement(sql); ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return OptionalLong.empty();
                }
                long value = rs.getLong(1);
                return rs.wasNull() ? OptionalLong.empty() : OptionalLong.of(value);
            }
        });
    }

    private List<T> query(String operation, String sql, long... params) {
        return withConnection(operation, c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                for (int i = 0; i < params.length; i++) {
                    ps.setLong(i + 1, params[i]);
                }
                List<T> rows = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        rows.add(readRow(rs));
                    }
                }
                return rows;
            }
        });
    }

    private T readRow(ResultSet rs) throws SQLException {
        T node = mapper.newNode(rs);
        mapper.setId(node, rs.getLong(COLUMN_ID));
        node.setLeft(rs.getLong(COLUMN_LEFT));
        node.setRight(rs.getLong(COLUMN_RIGHT));
        return node;
    }

    private <R> R withConnection(String operation, SqlWork<R> work) {
        if (transaction != null) {
            try {
                return work.apply(transaction);
            } catch (SQLException e) {
                throw failure(operation, e);
            }
        }
        try (Connection c = connectionProvider.getConnection()) {
            return work.apply(c);
        } catch (SQLException e) {
            throw failure(operation, e);
        }
    }

    private TreeStoreException failure(String operation, SQLException e) {
        log.error("Tree store {} failed | {} | error={} SQLState={}", operation, table, e.getMessage(), e.getSQLState(), e);
        return new TreeStoreException("Tree store " + operation + " failed on " + table, e.getSQLState(), e);
    }

    private String columns(String alias) {
        StringBuilder sb = new StringBuilder()
                .append(alias).append(COLUMN_ID).append(", ")
                .append(alias).append(COLUMN_LEFT).append(", ")
                .append(alias).append(COLUMN_RIGHT);
        for (String column : mapper.payloadColumns()) {
            sb.append(", ").append(alias).append(column);
        }
        return sb.toString();
    }

    private static String column(IntervalField field) {
        return field == IntervalField.LEFT ? COLUMN_LEFT : COLUMN_RIGHT;
    }

    @FunctionalInterface
    private interface SqlWork<R> {
        R apply(Connection c) throws SQLException;
    }
}
