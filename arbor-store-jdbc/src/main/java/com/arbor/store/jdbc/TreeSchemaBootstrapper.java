package com.arbor.store.jdbc;

import com.arbor.tree.store.TreeStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Creates the nested-set table of one {@link JdbcTreeStore}: renders {@code schema/arbor-tree.sql} for the
 * table name and payload columns, then runs each DDL statement. Runs at most once per instance unless a
 * previous attempt failed.
 */
public final class TreeSchemaBootstrapper {

    private static final String SCHEMA_RESOURCE = "schema/arbor-tree.sql";
    private static final Logger log = LoggerFactory.getLogger(TreeSchemaBootstrapper.class);

    private final String table;
    private final List<String> payloadColumnDefinitions;
    private final AtomicBoolean schemaInitialized = new AtomicBoolean(false);

    public TreeSchemaBootstrapper(String table, List<String> payloadColumnDefinitions) {
        this.table = table;
        this.payloadColumnDefinitions = List.copyOf(payloadColumnDefinitions);
    }

    /**
     * Creates the tree table and its lft/rgt indexes if they do not exist.
     *
     * @throws TreeStoreException if the script cannot be loaded or a statement fails
     */
    public void ensureSchema(ConnectionProvider connectionProvider) {
        if (!schemaInitialized.compareAndSet(false, true)) {
            log.debug("Tree table {} already ensured", table);
            return;
        }
        List<String> statements = statements(render(loadSchemaScript()));
        log.info("Ensuring tree table {} ({} DDL statement(s))", table, statements.size());
        try (Connection c = connectionProvider.getConnection(); Statement st = c.createStatement()) {
            for (String statement : statements) {
                log.debug("Tree DDL | {} | {}", table, statement);
                try {
                    st.execute(statement);
                } catch (SQLException e) {
                    schemaInitialized.set(false);
                    log.error("Tree DDL failed | {} | {} | error={} SQLState={}", table, statement, e.getMessage(), e.getSQLState(), e);
                    throw new TreeStoreException("Could not create tree table " + table, e.getSQLState(), e);
                }
            }
        } catch (SQLException e) {
            schemaInitialized.set(false);
            log.error("Tree DDL connection failed | {} | error={} SQLState={}", table, e.getMessage(), e.getSQLState(), e);
            throw new TreeStoreException("Could not connect to create tree table " + table, e.getSQLState(), e);
        }
        log.info("Tree table {} is ready", table);
    }

    String render(String script) {
        StringBuilder payload = new StringBuilder();
        for (String definition : payloadColumnDefinitions) {
            payload.append(",\n    ").append(definition);
        }
        return script
                .replace("${table}", table)
                .replace("${index_prefix}", table.replace('.', '_'))
                .replace("${payload_columns}", payload.toString());
    }

    /** Splits a script on {@code ;}, drops {@code --} comment lines and blank statements. */
    static List<String> statements(String script) {
        return Arrays.stream(script.split(";"))
                .map(raw -> raw.replaceAll("(?m)^\\s*--[^\n]*\n?", "").trim())
                .filter(statement -> !statement.isEmpty())
                .collect(Collectors.toList());
    }

    private String loadSchemaScript() {
        try (InputStream in = TreeSchemaBootstrapper.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IOException("classpath resource " + SCHEMA_RESOURCE + " is missing");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            schemaInitialized.set(false);
            log.error("Tree DDL script unreadable | {} | error={}", SCHEMA_RESOURCE, e.getMessage(), e);
            throw new TreeStoreException("Could not read tree DDL script " + SCHEMA_RESOURCE, e);
        }
    }
}
