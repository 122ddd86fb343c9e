package com.memorybox.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.memorybox.error.MetadataStoreException;

/**
 * Per-library SQLite table of item records. Rows are inserted and deleted, never updated; the
 * uuid is unique and is the only identifier shared with the vector store.
 * <p>
 * One connection is shared by the scan and by concurrent lookups, so every access is
 * synchronized.
 */
public class MetadataStore implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MetadataStore.class);

    public static final String DB_NAME = "library.db";

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS library_items (
                id        INTEGER PRIMARY KEY,
                timestamp INTEGER NOT NULL,
                uuid      TEXT,
                path      TEXT,
                filename  TEXT
            )
            """;
    private static final String CREATE_UUID_INDEX =
            "CREATE UNIQUE INDEX IF NOT EXISTS library_items_uuid ON library_items (uuid)";

    private final Path dbPath;
    private Connection conn;

    public MetadataStore(Path dataFolder) throws IOException {
        Files.createDirectories(dataFolder);
        this.dbPath = dataFolder.resolve(DB_NAME);
        try {
            conn = DriverManager.getConnection("jdbc:sqlite:" + dbPath.toAbsolutePath());
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(CREATE_TABLE);
                stmt.execute(CREATE_UUID_INDEX);
            }
        } catch (SQLException e) {
            throw new MetadataStoreException("Unable to open metadata store " + dbPath, e);
        }
        log.debug("Metadata store ready at {}", dbPath);
    }

    public synchronized ItemRecord insertRow(long timestamp, String uuid, String path, String filename) {
        try (PreparedStatement ps = connection().prepareStatement(
                "INSERT INTO library_items (timestamp, uuid, path, filename) VALUES (?, ?, ?, ?)")) {
            ps.setLong(1, timestamp);
            ps.setString(2, uuid);
            ps.setString(3, path);
            ps.setString(4, filename);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new MetadataStoreException("Unable to insert item " + uuid, e);
        }
        return new ItemRecord(lastInsertId(), timestamp, uuid, path, filename);
    }

    public synchronized Optional<ItemRecord> selectByUuid(String uuid) {
        List<ItemRecord> rows = select("SELECT * FROM library_items WHERE uuid = ?", uuid);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public synchronized List<ItemRecord> selectByPath(String path) {
        return select("SELECT * FROM library_items WHERE path = ? ORDER BY id", path);
    }

    public synchronized List<ItemRecord> selectByFilename(String filename) {
        return select("SELECT * FROM library_items WHERE filename = ? ORDER BY id", filename);
    }

    public synchronized List<ItemRecord> selectByPathAndFilename(String path, String filename) {
        return select("SELECT * FROM library_items WHERE path = ? AND filename = ? ORDER BY id", path, filename);
    }

    public synchronized boolean deleteByUuid(String uuid) {
        try (PreparedStatement ps = connection().prepareStatement("DELETE FROM library_items WHERE uuid = ?")) {
            ps.setString(1, uuid);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new MetadataStoreException("Unable to delete item " + uuid, e);
        }
    }

    public synchronized int rowCount() {
        try (Statement stmt = connection().createStatement();
                ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM library_items")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new MetadataStoreException("Unable to count items", e);
        }
    }

    public synchronized void cleanAllData() {
        try (Statement stmt = connection().createStatement()) {
            stmt.executeUpdate("DELETE FROM library_items");
        } catch (SQLException e) {
            throw new MetadataStoreException("Unable to clean metadata store", e);
        }
        log.info("Metadata store {} purged", dbPath);
    }

    @Override
    public synchronized void close() {
        if (conn == null) {
            return;
        }
        try {
            conn.close();
        } catch (SQLException e) {
            log.warn("Unable to close metadata store {}: {}", dbPath, e.getMessage());
        } finally {
            conn = null;
        }
    }

    private Connection connection() {
        if (conn == null) {
            throw new MetadataStoreException("Metadata store " + dbPath + " is closed", null);
        }
        return conn;
    }

    private long lastInsertId() {
        try (Statement stmt = connection().createStatement();
                ResultSet rs = stmt.executeQuery("SELECT last_insert_rowid()")) {
            return rs.next() ? rs.getLong(1) : -1L;
        } catch (SQLException e) {
            throw new MetadataStoreException("Unable to read generated item id", e);
        }
    }

    private List<ItemRecord> select(String sql, String... params) {
        List<ItemRecord> rows = new ArrayList<>();
        try (PreparedStatement ps = connection().prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                ps.setString(i + 1, params[i]);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(new ItemRecord(
                            rs.getLong("id"),
                            rs.getLong("timestamp"),
                            rs.getString("uuid"),
                            rs.getString("path"),
                            rs.getString("filename")));
                }
            }
        } catch (SQLException e) {
            throw new MetadataStoreException("Metadata query failed: " + sql.strip(), e);
        }
        return rows;
    }
}
