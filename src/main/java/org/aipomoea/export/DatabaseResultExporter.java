package org.aipomoea.export;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.aipomoea.aggregation.ResultTable;
import org.aipomoea.config.ConfigurationException;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Upserts result rows into a pre-existing SQLite table keyed by the {@code image} column.
 * <p>
 * Missing result columns are added as nullable TEXT before the rows are written. Column changes and row writes share
 * one transaction: a failing row rolls the whole export back. The pool holds a single connection so exports are
 * serialized.
 */
public class DatabaseResultExporter implements ResultExporter, AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(DatabaseResultExporter.class.getName());

    static final String KEY_COLUMN = "image";
    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    private final DataSource dataSource;
    private final String tableName;
    private final HikariDataSource ownedPool;

    /**
     * Uses an externally managed data source. {@link #close()} leaves it open.
     */
    public DatabaseResultExporter(DataSource dataSource, String tableName) {
        this(dataSource, tableName, null);
    }

    private DatabaseResultExporter(DataSource dataSource, String tableName, HikariDataSource ownedPool) {
        if (tableName == null || !IDENTIFIER.matcher(tableName).matches())
            throw new IllegalArgumentException("Invalid table name: " + tableName);
        this.dataSource = dataSource;
        this.tableName = tableName;
        this.ownedPool = ownedPool;
    }

    /**
     * Opens a single-connection pool on the SQLite file at {@code dbPath}.
     *
     * @throws ConfigurationException {@code FDB3} when the file does not exist
     */
    public static DatabaseResultExporter open(Path dbPath, String tableName) throws ConfigurationException {
        if (!Files.isRegularFile(dbPath))
            throw new ConfigurationException("FDB3", "Database not found: " + dbPath);
        if (tableName == null || !IDENTIFIER.matcher(tableName).matches())
            throw new ConfigurationException("FDB2", "Invalid table name: " + tableName);

        final HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:sqlite:" + dbPath.toAbsolutePath());
        config.setMaximumPoolSize(1);
        config.setMinimumIdle(1);
        config.setPoolName("AipomoeaResultsPool");
        try {
            final HikariDataSource pool = new HikariDataSource(config);
            return new DatabaseResultExporter(pool, tableName, pool);
        } catch (RuntimeException e) {
            throw new ConfigurationException("FDB1", "Error while loading database " + dbPath + ": " + e.getMessage(), e);
        }
    }

    @Override
    public ExportFormat format() {
        return ExportFormat.CONNECTED_DATABASE;
    }

    /**
     * Checks that the target table exists.
     *
     * @throws ConfigurationException {@code FDB2} when it does not, {@code FDB1} when the database cannot be read
     */
    public void verifyTable() throws ConfigurationException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(
                     "SELECT name FROM sqlite_master WHERE type='table' AND name=?")) {
            stmt.setString(1, tableName);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next())
                    throw new ConfigurationException("FDB2", "Table not found: " + tableName);
            }
        } catch (SQLException e) {
            throw new ConfigurationException("FDB1", "Error while loading database: " + e.getMessage(), e);
        }
    }

    /**
     * @param name ignored, every group goes to the same table
     */
    @Override
    public void export(String name, ResultTable table) throws ExportException {
        if (table.isEmpty())
            throw new ExportException("No rows to export to " + tableName);

        final List<String> commands = table.commands();
        for (String command : commands) {
            if (!IDENTIFIER.matcher(command).matches())
                throw new ExportException("Invalid column name: " + command);
        }

        try (Connection conn = dataSource.getConnection()) {
            final boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                final Set<String> wanted = new LinkedHashSet<>();
                wanted.add(KEY_COLUMN);
                wanted.addAll(commands);
                ensureColumns(conn, wanted);

                int inserted = 0;
                for (String image : table.images()) {
                    if (upsert(conn, image, commands, table.row(image)))
                        inserted++;
                }
                conn.commit();
                LOGGER.log(Level.INFO, "Exported {0} rows to table {1} ({2} new).",
                        new Object[]{table.size(), tableName, inserted});
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new ExportException("FDB1 - Export to table " + tableName + " rolled back: " + e.getMessage(), e);
        }
    }

    List<String> existingColumns(Connection conn) throws SQLException {
        final List<String> columns = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("PRAGMA table_info(" + quote(tableName) + ")")) {
            while (rs.next())
                columns.add(rs.getString("name"));
        }
        return columns;
    }

    private void ensureColumns(Connection conn, Set<String> wanted) throws SQLException {
        final List<String> existing = existingColumns(conn);
        if (existing.isEmpty())
            throw new SQLException("Table not found: " + tableName);
        for (String column : wanted) {
            if (existing.stream().noneMatch(column::equalsIgnoreCase)) {
                try (Statement stmt = conn.createStatement()) {
                    stmt.executeUpdate("ALTER TABLE " + quote(tableName) + " ADD COLUMN " + quote(column) + " TEXT");
                }
                LOGGER.log(Level.INFO, "Added column {0} to table {1}", new Object[]{column, tableName});
            }
        }
    }

    /**
     * @return true when a new row was inserted, false when an existing one was updated
     */
    private boolean upsert(Connection conn, String image, List<String> commands, Map<String, String> row) throws SQLException {
        final boolean exists;
        try (PreparedStatement select = conn.prepareStatement(
                "SELECT 1 FROM " + quote(tableName) + " WHERE " + quote(KEY_COLUMN) + " = ?")) {
            select.setString(1, image);
            try (ResultSet rs = select.executeQuery()) {
                exists = rs.next();
            }
        }

        if (exists) {
            final StringBuilder sql = new StringBuilder("UPDATE ").append(quote(tableName)).append(" SET ");
            for (int i = 0; i < commands.size(); i++) {
                if (i > 0) sql.append(", ");
                sql.append(quote(commands.get(i))).append(" = ?");
            }
            sql.append(" WHERE ").append(quote(KEY_COLUMN)).append(" = ?");
            try (PreparedStatement update = conn.prepareStatement(sql.toString())) {
                int index = 1;
                for (String command : commands)
                    update.setString(index++, row.get(command));
                update.setString(index, image);
                update.executeUpdate();
            }
            return false;
        }

        final StringBuilder columns = new StringBuilder(quote(KEY_COLUMN));
        final StringBuilder placeholders = new StringBuilder("?");
        for (String command : commands) {
            columns.append(", ").append(quote(command));
            placeholders.append(", ?");
        }
        try (PreparedStatement insert = conn.prepareStatement(
                "INSERT INTO " + quote(tableName) + " (" + columns + ") VALUES (" + placeholders + ")")) {
            insert.setString(1, image);
            int index = 2;
            for (String command : commands)
                insert.setString(index++, row.get(command));
            insert.executeUpdate();
        }
        return true;
    }

    private static String quote(String identifier) {
        return "\"" + identifier + "\"";
    }

    public String tableName() {
        return tableName;
    }

    @Override
    public void close() {
        if (ownedPool != null && !ownedPool.isClosed())
            ownedPool.close();
    }
}
