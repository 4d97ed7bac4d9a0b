package com.arbor.config;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Configuration loaded from environment variables for Arbor tree stores.
 * <p>
 * DB: ARBOR_DB_HOST, ARBOR_DB_PORT, ARBOR_DB_NAME, ARBOR_DB_USER, ARBOR_DB_PASSWORD, or a full
 * ARBOR_JDBC_URL which takes precedence over the host/port/name triple.
 * <p>
 * Tree: ARBOR_TREE_TABLE (table holding the nodes), ARBOR_SHIFT_STRATEGY ({@code COST_AWARE} or
 * {@code FORWARD}), ARBOR_RECURSIVE_CHILDREN (answer child queries with a recursive CTE).
 */
public final class ArborConfig {

    private static final String ENV_DB_HOST = "ARBOR_DB_HOST";
    private static final String ENV_DB_PORT = "ARBOR_DB_PORT";
    private static final String ENV_DB_NAME = "ARBOR_DB_NAME";
    private static final String ENV_DB_USER = "ARBOR_DB_USER";
    private static final String ENV_DB_PASSWORD = "ARBOR_DB_PASSWORD";
    private static final String ENV_JDBC_URL = "ARBOR_JDBC_URL";
    private static final String ENV_TREE_TABLE = "ARBOR_TREE_TABLE";
    private static final String ENV_SHIFT_STRATEGY = "ARBOR_SHIFT_STRATEGY";
    private static final String ENV_RECURSIVE_CHILDREN = "ARBOR_RECURSIVE_CHILDREN";

    private static final String DEFAULT_DB_HOST = "localhost";
    private static final int DEFAULT_DB_PORT = 5432;
    private static final String DEFAULT_DB_NAME = "arbor";
    private static final String DEFAULT_DB_USER = "arbor";
    private static final String DEFAULT_TREE_TABLE = "arbor_tree_node";
    private static final ShiftStrategy DEFAULT_SHIFT_STRATEGY = ShiftStrategy.COST_AWARE;
    private static final boolean DEFAULT_RECURSIVE_CHILDREN = true;

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}(\\.[A-Za-z_][A-Za-z0-9_]{0,62})?");

    /**
     * How a gap is opened in the interval space when a node is inserted.
     */
    public enum ShiftStrategy {
        /** Shift whichever side of the insertion point holds fewer endpoints. */
        COST_AWARE,
        /** Always push everything at or after the insertion point forward; the tree stays anchored at 1. */
        FORWARD
    }

    private final String dbHost;
    private final int dbPort;
    private final String dbName;
    private final String dbUser;
    private final String dbPassword;
    private final String jdbcUrl;
    private final String treeTable;
    private final ShiftStrategy shiftStrategy;
    private final boolean recursiveChildrenQuery;

    private ArborConfig(Builder b) {
        this.dbHost = b.dbHost;
        this.dbPort = b.dbPort;
        this.dbName = b.dbName != null ? b.dbName : DEFAULT_DB_NAME;
        this.dbUser = b.dbUser != null ? b.dbUser : DEFAULT_DB_USER;
        this.dbPassword = b.dbPassword != null ? b.dbPassword : "";
        this.jdbcUrl = b.jdbcUrl;
        this.treeTable = b.treeTable;
        this.shiftStrategy = b.shiftStrategy;
        this.recursiveChildrenQuery = b.recursiveChildrenQuery;
    }

    public String getDbHost() {
        return dbHost;
    }

    public int getDbPort() {
        return dbPort;
    }

    /** Database name (ARBOR_DB_NAME). Default "arbor". */
    public String getDbName() {
        return dbName;
    }

    /** Database user (ARBOR_DB_USER). Default "arbor". */
    public String getDbUser() {
        return dbUser;
    }

    /** Database password (ARBOR_DB_PASSWORD). Default "". */
    public String getDbPassword() {
        return dbPassword;
    }

    /**
     * JDBC URL: ARBOR_JDBC_URL when set, otherwise {@code jdbc:postgresql://<host>:<port>/<name>}.
     */
    public String getJdbcUrl() {
        if (jdbcUrl != null) {
            return jdbcUrl;
        }
        return "jdbc:postgresql://" + dbHost + ":" + dbPort + "/" + dbName;
    }

    /** Table holding the tree nodes (ARBOR_TREE_TABLE). Default {@value #DEFAULT_TREE_TABLE}. */
    public String getTreeTable() {
        return treeTable;
    }

    public ShiftStrategy getShiftStrategy() {
        return shiftStrategy;
    }

    /** Whether the JDBC store resolves direct children with one recursive query instead of point lookups. */
    public boolean isRecursiveChildrenQuery() {
        return recursiveChildrenQuery;
    }

    public static ArborConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    /**
     * Same as {@link #fromEnvironment()} but reads from the given map (keys are the ARBOR_* variable names).
     */
    public static ArborConfig fromMap(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        String url = env.get(ENV_JDBC_URL);
        return builder()
                .dbHost(getEnv(env, ENV_DB_HOST, DEFAULT_DB_HOST))
                .dbPort(parseInt(env.get(ENV_DB_PORT), DEFAULT_DB_PORT))
                .dbName(getEnv(env, ENV_DB_NAME, DEFAULT_DB_NAME))
                .dbUser(getEnv(env, ENV_DB_USER, DEFAULT_DB_USER))
                .dbPassword(env.get(ENV_DB_PASSWORD) != null ? env.get(ENV_DB_PASSWORD) : "")
                .jdbcUrl(url != null && !url.isBlank() ? url.trim() : null)
                .treeTable(parseTable(env.get(ENV_TREE_TABLE)))
                .shiftStrategy(parseStrategy(env.get(ENV_SHIFT_STRATEGY)))
                .recursiveChildrenQuery(parseBoolean(env.get(ENV_RECURSIVE_CHILDREN), DEFAULT_RECURSIVE_CHILDREN))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    static boolean isValidTableName(String value) {
        return value != null && TABLE_NAME.matcher(value).matches();
    }

    private static String parseTable(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_TREE_TABLE;
        }
        String t = value.trim();
        return isValidTableName(t) ? t : DEFAULT_TREE_TABLE;
    }

    private static ShiftStrategy parseStrategy(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_SHIFT_STRATEGY;
        }
        try {
            return ShiftStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            return DEFAULT_SHIFT_STRATEGY;
        }
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private String dbHost = DEFAULT_DB_HOST;
        private int dbPort = DEFAULT_DB_PORT;
        private String dbName = DEFAULT_DB_NAME;
        private String dbUser = DEFAULT_DB_USER;
        private String dbPassword = "";
        private String jdbcUrl;
        private String treeTable = DEFAULT_TREE_TABLE;
        private ShiftStrategy shiftStrategy = DEFAULT_SHIFT_STRATEGY;
        private boolean recursiveChildrenQuery = DEFAULT_RECURSIVE_CHILDREN;

        public Builder dbHost(String dbHost) {
            this.dbHost = dbHost != null ? dbHost : DEFAULT_DB_HOST;
            return this;
        }

        public Builder dbPort(int dbPort) {
            this.dbPort = dbPort;
            return this;
        }

        public Builder dbName(String dbName) {
            this.dbName = dbName;
            return this;
        }

        public Builder dbUser(String dbUser) {
            this.dbUser = dbUser;
            return this;
        }

        public Builder dbPassword(String dbPassword) {
            this.dbPassword = dbPassword;
            return this;
        }

        public Builder jdbcUrl(String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the name is not a plain (optionally schema-qualified) SQL identifier
         */
        public Builder treeTable(String treeTable) {
            if (!isValidTableName(treeTable)) {
                throw new IllegalArgumentException("Invalid tree table name: " + treeTable);
            }
            this.treeTable = treeTable;
            return this;
        }

        public Builder shiftStrategy(ShiftStrategy shiftStrategy) {
            this.shiftStrategy = Objects.requireNonNull(shiftStrategy, "shiftStrategy");
            return this;
        }

        public Builder recursiveChildrenQuery(boolean recursiveChildrenQuery) {
            this.recursiveChildrenQuery = recursiveChildrenQuery;
            return this;
        }

        public ArborConfig build() {
            return new ArborConfig(this);
        }
    }
}
