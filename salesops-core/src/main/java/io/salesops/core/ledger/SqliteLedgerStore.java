package io.salesops.core.ledger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

public final class SqliteLedgerStore implements LedgerStore {
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String jdbcUrl;
    private final String table;

    public SqliteLedgerStore(Path dbPath, String table) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("invalid ledger table name: " + table);
        }
        Path parent = dbPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.table = table;
        init();
    }

    @Override
    public synchronized Optional<MemoryRecord> find(String path) throws IOException {
        String sql = "SELECT file_path, salesperson, last_hash, last_summary, updated_at FROM "
            + table + " WHERE file_path = ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, path);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(read(resultSet)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to read ledger record for " + path, e);
        }
    }

    @Override
    public synchronized void upsert(MemoryRecord record) throws IOException {
        String sql = "INSERT INTO " + table + " (file_path, salesperson, last_hash, last_summary, updated_at)\n"
            + "VALUES (?, ?, ?, ?, ?)\n"
            + "ON CONFLICT(file_path) DO UPDATE SET\n"
            + "    salesperson = excluded.salesperson,\n"
            + "    last_hash = excluded.last_hash,\n"
            + "    last_summary = excluded.last_summary,\n"
            + "    updated_at = excluded.updated_at";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            connection.setAutoCommit(false);
            statement.setString(1, record.path());
            statement.setString(2, record.owner());
            statement.setString(3, record.lastFingerprint());
            statement.setString(4, record.lastSummary());
            statement.setString(5, record.updatedAt() == null ? null : record.updatedAt().toString());
            statement.executeUpdate();
            connection.commit();
        } catch (SQLException e) {
            throw new IOException("Failed to upsert ledger record for " + record.path(), e);
        }
    }

    @Override
    public synchronized List<MemoryRecord> list() throws IOException {
        String sql = "SELECT file_path, salesperson, last_hash, last_summary, updated_at FROM "
            + table + " ORDER BY file_path ASC";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            List<MemoryRecord> records = new ArrayList<>();
            while (resultSet.next()) {
                records.add(read(resultSet));
            }
            return records;
        } catch (SQLException e) {
            throw new IOException("Failed to list ledger records", e);
        }
    }

    private MemoryRecord read(ResultSet resultSet) throws SQLException {
        String updatedAt = resultSet.getString("updated_at");
        return new MemoryRecord(
            resultSet.getString("file_path"),
            resultSet.getString("salesperson"),
            resultSet.getString("last_hash"),
            resultSet.getString("last_summary"),
            updatedAt == null ? null : Instant.parse(updatedAt)
        );
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
        }
        return connection;
    }

    private void init() throws IOException {
        String ddl = "CREATE TABLE IF NOT EXISTS " + table + " (\n"
            + "    file_path TEXT PRIMARY KEY,\n"
            + "    salesperson TEXT,\n"
            + "    last_hash TEXT,\n"
            + "    last_summary TEXT,\n"
            + "    updated_at TEXT\n"
            + ")";
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite ledger", e);
        }
    }
}
