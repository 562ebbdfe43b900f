package io.mnemo.core.consolidation;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mnemo.core.store.SqliteDatabase;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

public final class SqliteConsolidationRunStore implements ConsolidationRunStore {
    private final SqliteDatabase database;
    private final ObjectMapper mapper;

    public SqliteConsolidationRunStore(SqliteDatabase database) throws IOException {
        this.database = database;
        this.mapper = new ObjectMapper();
        init();
    }

    @Override
    public ConsolidationRun begin(String runId, String projectId, long startedAt) throws IOException {
        String sql = """
            INSERT INTO memory_consolidation_runs (id, project_id, status, stats_json, started_at)
            VALUES (?, ?, ?, '{}', ?)
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, runId);
            statement.setString(2, projectId);
            statement.setString(3, ConsolidationRunStatus.RUNNING.wireValue());
            statement.setLong(4, startedAt);
            statement.executeUpdate();
            return new ConsolidationRun(runId, projectId, ConsolidationRunStatus.RUNNING, null, startedAt, null, null);
        } catch (SQLException e) {
            throw new IOException("Failed to record consolidation run " + runId, e);
        }
    }

    @Override
    public void complete(String runId, ConsolidationResult stats, long completedAt) throws IOException {
        finish(runId, ConsolidationRunStatus.COMPLETED, mapper.writeValueAsString(stats), completedAt, null);
    }

    @Override
    public void fail(String runId, String error, long completedAt) throws IOException {
        finish(runId, ConsolidationRunStatus.FAILED, "{}", completedAt, error);
    }

    @Override
    public List<ConsolidationRun> listRecent(String projectId, int limit) throws IOException {
        String sql = """
            SELECT id, project_id, status, stats_json, started_at, completed_at, error
            FROM memory_consolidation_runs
            WHERE project_id = ?
            ORDER BY started_at DESC
            LIMIT ?
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, projectId);
            statement.setInt(2, Math.max(1, limit));
            List<ConsolidationRun> runs = new ArrayList<>();
            try (ResultSet row = statement.executeQuery()) {
                while (row.next()) {
                    ConsolidationRunStatus status = ConsolidationRunStatus.fromWire(row.getString("status"));
                    long completedAt = row.getLong("completed_at");
                    Long completed = row.wasNull() ? null : completedAt;
                    ConsolidationResult stats = status == ConsolidationRunStatus.COMPLETED
                        ? mapper.readValue(row.getString("stats_json"), ConsolidationResult.class)
                        : null;
                    runs.add(new ConsolidationRun(
                        row.getString("id"),
                        row.getString("project_id"),
                        status,
                        stats,
                        row.getLong("started_at"),
                        completed,
                        row.getString("error")
                    ));
                }
            }
            return runs;
        } catch (SQLException e) {
            throw new IOException("Failed to list consolidation runs for project " + projectId, e);
        }
    }

    private void finish(String runId, ConsolidationRunStatus status, String statsJson, long completedAt, String error)
        throws IOException {
        String sql = """
            UPDATE memory_consolidation_runs
            SET status = ?, stats_json = ?, completed_at = ?, error = ?
            WHERE id = ?
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, status.wireValue());
            statement.setString(2, statsJson);
            statement.setLong(3, completedAt);
            statement.setString(4, error);
            statement.setString(5, runId);
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to update consolidation run " + runId, e);
        }
    }

    private void init() throws IOException {
        database.execute(
            "SQLite consolidation run log",
            """
            CREATE TABLE IF NOT EXISTS memory_consolidation_runs (
                id TEXT PRIMARY KEY,
                project_id TEXT NOT NULL,
                status TEXT NOT NULL,
                stats_json TEXT NOT NULL DEFAULT '{}',
                started_at INTEGER NOT NULL,
                completed_at INTEGER,
                error TEXT
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_memory_consolidation_runs_project "
                + "ON memory_consolidation_runs(project_id, started_at DESC)"
        );
    }
}
