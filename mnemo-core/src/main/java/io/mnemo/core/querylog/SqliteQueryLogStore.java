package io.mnemo.core.querylog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mnemo.core.feedback.FeedbackType;
import io.mnemo.core.feedback.MemoryFeedback;
import io.mnemo.core.retrieval.MemoryQueryResult;
import io.mnemo.core.store.SqliteDatabase;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class SqliteQueryLogStore implements QueryLogStore {
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final SqliteDatabase database;
    private final ObjectMapper mapper;

    public SqliteQueryLogStore(SqliteDatabase database) throws IOException {
        this.database = database;
        this.mapper = new ObjectMapper();
        init();
    }

    @Override
    public MemoryQueryLog logQuery(MemoryQueryResult result, String projectId) throws IOException {
        MemoryQueryLog log = MemoryQueryLog.from(result, projectId, mapper.writeValueAsString(result.options()));
        String sql = """
            INSERT INTO memory_query_logs (
                id, session_id, project_id, query_text, options_json, result_atom_ids, latency_ms, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, log.id());
            statement.setString(2, log.sessionId());
            statement.setString(3, log.projectId());
            statement.setString(4, log.query());
            statement.setString(5, log.optionsJson());
            statement.setString(6, mapper.writeValueAsString(log.resultAtomIds()));
            statement.setLong(7, log.latencyMs());
            statement.setLong(8, log.createdAt());
            statement.executeUpdate();
            return log;
        } catch (SQLException e) {
            throw new IOException("Failed to log memory query " + log.id(), e);
        }
    }

    @Override
    public Optional<MemoryQueryLog> findQuery(String queryId) throws IOException {
        String sql = """
            SELECT id, session_id, project_id, query_text, options_json, result_atom_ids, latency_ms, created_at
            FROM memory_query_logs
            WHERE id = ?
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, queryId);
            List<MemoryQueryLog> logs = readLogs(statement);
            return logs.isEmpty() ? Optional.empty() : Optional.of(logs.get(0));
        } catch (SQLException e) {
            throw new IOException("Failed to read memory query " + queryId, e);
        }
    }

    @Override
    public List<MemoryQueryLog> listRecentBySession(String sessionId, int limit) throws IOException {
        String sql = """
            SELECT id, session_id, project_id, query_text, options_json, result_atom_ids, latency_ms, created_at
            FROM memory_query_logs
            WHERE session_id = ?
            ORDER BY created_at DESC
            LIMIT ?
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, sessionId);
            statement.setInt(2, Math.max(1, limit));
            return readLogs(statement);
        } catch (SQLException e) {
            throw new IOException("Failed to list memory queries for session " + sessionId, e);
        }
    }

    @Override
    public MemoryFeedback addFeedback(MemoryFeedback feedback) throws IOException {
        String sql = """
            INSERT INTO memory_feedback (id, session_id, query_id, atom_id, feedback_type, note, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, feedback.id());
            statement.setString(2, feedback.sessionId());
            statement.setString(3, feedback.queryId());
            statement.setString(4, feedback.atomId());
            statement.setString(5, feedback.feedback().wireValue());
            statement.setString(6, feedback.note());
            statement.setLong(7, feedback.createdAt());
            statement.executeUpdate();
            return feedback;
        } catch (SQLException e) {
            throw new IOException("Failed to record memory feedback " + feedback.id(), e);
        }
    }

    @Override
    public List<MemoryFeedback> listFeedbackForQuery(String queryId) throws IOException {
        String sql = """
            SELECT id, session_id, query_id, atom_id, feedback_type, note, created_at
            FROM memory_feedback
            WHERE query_id = ?
            ORDER BY created_at DESC
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, queryId);
            List<MemoryFeedback> entries = new ArrayList<>();
            try (ResultSet row = statement.executeQuery()) {
                while (row.next()) {
                    entries.add(new MemoryFeedback(
                        row.getString("id"),
                        row.getString("session_id"),
                        row.getString("query_id"),
                        row.getString("atom_id"),
                        FeedbackType.fromWire(row.getString("feedback_type")),
                        row.getString("note"),
                        row.getLong("created_at")
                    ));
                }
            }
            return entries;
        } catch (SQLException e) {
            throw new IOException("Failed to list feedback for query " + queryId, e);
        }
    }

    private List<MemoryQueryLog> readLogs(PreparedStatement statement) throws SQLException, IOException {
        List<MemoryQueryLog> logs = new ArrayList<>();
        try (ResultSet row = statement.executeQuery()) {
            while (row.next()) {
                logs.add(new MemoryQueryLog(
                    row.getString("id"),
                    row.getString("session_id"),
                    row.getString("project_id"),
                    row.getString("query_text"),
                    row.getString("options_json"),
                    mapper.readValue(row.getString("result_atom_ids"), STRING_LIST),
                    row.getLong("latency_ms"),
                    row.getLong("created_at")
                ));
            }
        }
        return logs;
    }

    private void init() throws IOException {
        database.execute(
            "SQLite memory query log",
            """
            CREATE TABLE IF NOT EXISTS memory_query_logs (
                id TEXT PRIMARY KEY,
                session_id TEXT,
                project_id TEXT NOT NULL DEFAULT 'default',
                query_text TEXT NOT NULL,
                options_json TEXT NOT NULL DEFAULT '{}',
                result_atom_ids TEXT NOT NULL DEFAULT '[]',
                latency_ms INTEGER,
                created_at INTEGER NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_memory_query_logs_session ON memory_query_logs(session_id)",
            """
            CREATE TABLE IF NOT EXISTS memory_feedback (
                id TEXT PRIMARY KEY,
                session_id TEXT,
                query_id TEXT NOT NULL,
                atom_id TEXT NOT NULL,
                feedback_type TEXT NOT NULL,
                note TEXT,
                created_at INTEGER NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_memory_feedback_query ON memory_feedback(query_id)",
            "CREATE INDEX IF NOT EXISTS idx_memory_feedback_atom ON memory_feedback(atom_id)"
        );
    }
}
