package com.memorybox.retrieval;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.memorybox.error.MetadataStoreException;

/**
 * Message history kept in a SQLite table per corpus. A raw export is one message per line,
 * optionally prefixed with {@code sender: }; blank lines are ignored. Ids start at 1 and follow
 * the line order of the import.
 */
public class MessageHistoryCorpus implements CorpusProvider {
    private static final Logger log = LoggerFactory.getLogger(MessageHistoryCorpus.class);
    public static final String DB_NAME = "corpora.db";

    private static final Pattern SENDER_PREFIX = Pattern.compile("^([^:\\s][^:]{0,63}):\\s+(.+)$");

    private final String corpusId;
    private final String table;
    private final Connection conn;

    private MessageHistoryCorpus(String corpusId, Connection conn) throws SQLException {
        this.corpusId = corpusId;
        this.table = "\"corpus_" + corpusId.replaceAll("[^A-Za-z0-9_]", "_") + "\"";
        this.conn = conn;
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE IF NOT EXISTS " + table + " ("
                    + "id INTEGER PRIMARY KEY, "
                    + "timestamp INTEGER NOT NULL, "
                    + "sender TEXT, "
                    + "message TEXT)");
        }
    }

    public static MessageHistoryCorpus open(Path dataFolder, String corpusId, Path rawSource) throws IOException {
        if (corpusId == null || corpusId.isBlank()) {
            throw new IllegalArgumentException("corpusId is required");
        }
        Files.createDirectories(dataFolder);
        MessageHistoryCorpus corpus;
        Connection conn = null;
        try {
            conn = DriverManager.getConnection("jdbc:sqlite:" + dataFolder.resolve(DB_NAME).toAbsolutePath());
            corpus = new MessageHistoryCorpus(corpusId, conn);
        } catch (SQLException e) {
            closeQuietly(conn, corpusId);
            throw new MetadataStoreException("Unable to open corpus " + corpusId, e);
        }
        if (rawSource != null) {
            try {
                corpus.importFrom(rawSource);
            } catch (IOException | RuntimeException e) {
                corpus.close();
                throw e;
            }
        }
        return corpus;
    }

    @Override
    public String corpusId() {
        return corpusId;
    }

    @Override
    public synchronized List<CorpusRecord> records() {
        List<CorpusRecord> records = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT * FROM " + table + " ORDER BY id")) {
            while (rs.next()) {
                records.add(toRecord(rs));
            }
        } catch (SQLException e) {
            throw new MetadataStoreException("Unable to read corpus " + corpusId, e);
        }
        return records;
    }

    @Override
    public synchronized Optional<CorpusRecord> find(long id) {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM " + table + " WHERE id = ?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(toRecord(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new MetadataStoreException("Unable to read record " + id + " of corpus " + corpusId, e);
        }
    }

    @Override
    public synchronized void close() {
        closeQuietly(conn, corpusId);
    }

    private static void closeQuietly(Connection conn, String corpusId) {
        if (conn == null) {
            return;
        }
        try {
            conn.close();
        } catch (SQLException e) {
            log.warn("Unable to close corpus {}: {}", corpusId, e.getMessage());
        }
    }

    private synchronized void importFrom(Path rawSource) throws IOException {
        long importedAt = System.currentTimeMillis();
        int count = 0;
        try (BufferedReader reader = Files.newBufferedReader(rawSource, StandardCharsets.UTF_8)) {
            conn.setAutoCommit(false);
            try (Statement clear = conn.createStatement();
                    PreparedStatement insert = conn.prepareStatement(
                            "INSERT INTO " + table + " (timestamp, sender, message) VALUES (?, ?, ?)")) {
                clear.executeUpdate("DELETE FROM " + table);
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.isBlank()) {
                        continue;
                    }
                    Matcher matcher = SENDER_PREFIX.matcher(line.strip());
                    insert.setLong(1, importedAt);
                    insert.setString(2, matcher.matches() ? matcher.group(1) : null);
                    insert.setString(3, matcher.matches() ? matcher.group(2) : line.strip());
                    insert.executeUpdate();
                    count++;
                }
                conn.commit();
            } catch (SQLException | IOException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new MetadataStoreException("Unable to import " + rawSource + " into corpus " + corpusId, e);
        }
        log.info("Imported {} messages from {} into corpus {}", count, rawSource, corpusId);
    }

    private static CorpusRecord toRecord(ResultSet rs) throws SQLException {
        return new CorpusRecord(rs.getLong("id"), rs.getLong("timestamp"), rs.getString("sender"), rs.getString("message"));
    }
}
