package io.mnemo.core.atom;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mnemo.core.store.SqliteDatabase;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class SqliteAtomRepository implements AtomRepository {
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final String COLUMNS = """
        id, project_id, session_id, run_id, atom_type, content, summary, keywords, provenance,
        confidence, sensitivity, pinned, created_at, updated_at, expires_at
        """;

    private final SqliteDatabase database;
    private final ObjectMapper mapper;

    public SqliteAtomRepository(SqliteDatabase database) throws IOException {
        this.database = database;
        this.mapper = new ObjectMapper();
        init();
    }

    @Override
    public List<MemoryAtom> listByProject(String projectId, int limit, int offset) throws IOException {
        String sql = "SELECT " + COLUMNS + """
            FROM memory_atoms
            WHERE project_id = ?
            ORDER BY updated_at DESC, id
            LIMIT ? OFFSET ?
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, projectId);
            statement.setInt(2, Math.max(1, limit));
            statement.setInt(3, Math.max(0, offset));
            return readAll(statement);
        } catch (SQLException e) {
            throw new IOException("Failed to list memory atoms for project " + projectId, e);
        }
    }

    @Override
    public Optional<MemoryAtom> findById(String id) throws IOException {
        String sql = "SELECT " + COLUMNS + " FROM memory_atoms WHERE id = ?";
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, id);
            List<MemoryAtom> rows = readAll(statement);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        } catch (SQLException e) {
            throw new IOException("Failed to read memory atom " + id, e);
        }
    }

    @Override
    public void upsert(MemoryAtom atom) throws IOException {
        String sql = """
            INSERT INTO memory_atoms (
                id, project_id, session_id, run_id, atom_type, content, summary, keywords, provenance,
                confidence, sensitivity, pinned, created_at, updated_at, expires_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET
                project_id = excluded.project_id,
                session_id = excluded.session_id,
                run_id = excluded.run_id,
                atom_type = excluded.atom_type,
                content = excluded.content,
                summary = excluded.summary,
                keywords = excluded.keywords,
                provenance = excluded.provenance,
                confidence = excluded.confidence,
                sensitivity = excluded.sensitivity,
                pinned = excluded.pinned,
                updated_at = excluded.updated_at,
                expires_at = excluded.expires_at
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, atom.id());
            statement.setString(2, atom.projectId());
            statement.setString(3, atom.sessionId());
            statement.setString(4, atom.runId());
            statement.setString(5, atom.atomType().wireValue());
            statement.setString(6, atom.content());
            statement.setString(7, atom.summary());
            statement.setString(8, mapper.writeValueAsString(atom.keywords()));
            statement.setString(9, mapper.writeValueAsString(atom.provenance()));
            statement.setDouble(10, atom.confidence());
            statement.setString(11, atom.sensitivity().wireValue());
            statement.setInt(12, atom.pinned() ? 1 : 0);
            statement.setLong(13, atom.createdAt());
            statement.setLong(14, atom.updatedAt());
            if (atom.expiresAt() == null) {
                statement.setNull(15, Types.INTEGER);
            } else {
                statement.setLong(15, atom.expiresAt());
            }
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to upsert memory atom " + atom.id(), e);
        }
    }

    @Override
    public boolean delete(String id) throws IOException {
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement("DELETE FROM memory_atoms WHERE id = ?")) {
            statement.setString(1, id);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to delete memory atom " + id, e);
        }
    }

    @Override
    public List<MemoryAtom> search(String projectId, String query, int limit) throws IOException {
        String sql = "SELECT " + COLUMNS + """
            FROM memory_atoms
            WHERE project_id = ?
              AND (content LIKE ? ESCAPE '\\' OR summary LIKE ? ESCAPE '\\' OR keywords LIKE ? ESCAPE '\\')
            ORDER BY pinned DESC, updated_at DESC, id
            LIMIT ?
            """;
        String term = "%" + escapeLike(query == null ? "" : query.trim()) + "%";
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, projectId);
            statement.setString(2, term);
            statement.setString(3, term);
            statement.setString(4, term);
            statement.setInt(5, Math.max(1, limit));
            return readAll(statement);
        } catch (SQLException e) {
            throw new IOException("Failed to search memory atoms for project " + projectId, e);
        }
    }

    private List<MemoryAtom> readAll(PreparedStatement statement) throws SQLException, IOException {
        List<MemoryAtom> atoms = new ArrayList<>();
        try (ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                atoms.add(toAtom(resultSet));
            }
        }
        return atoms;
    }

    private MemoryAtom toAtom(ResultSet row) throws SQLException, IOException {
        long expires = row.getLong("expires_at");
        Long expiresAt = row.wasNull() ? null : expires;
        return new MemoryAtom(
            row.getString("id"),
            row.getString("project_id"),
            row.getString("session_id"),
            row.getString("run_id"),
            AtomType.fromWire(row.getString("atom_type")),
            row.getString("content"),
            row.getString("summary"),
            mapper.readValue(orDefault(row.getString("keywords"), "[]"), STRING_LIST),
            mapper.readValue(orDefault(row.getString("provenance"), "{}"), Provenance.class),
            row.getDouble("confidence"),
            Sensitivity.fromWire(row.getString("sensitivity")),
            row.getInt("pinned") == 1,
            row.getLong("created_at"),
            row.getLong("updated_at"),
            expiresAt
        );
    }

    private void init() throws IOException {
        database.execute(
            "SQLite memory atom store",
            """
            CREATE TABLE IF NOT EXISTS memory_atoms (
                id TEXT PRIMARY KEY,
                project_id TEXT NOT NULL DEFAULT 'default',
                session_id TEXT,
                run_id TEXT,
                atom_type TEXT NOT NULL DEFAULT 'semantic',
                content TEXT NOT NULL,
                summary TEXT,
                keywords TEXT NOT NULL DEFAULT '[]',
                provenance TEXT NOT NULL DEFAULT '{}',
                confidence REAL NOT NULL DEFAULT 0.5,
                sensitivity TEXT NOT NULL DEFAULT 'normal',
                pinned INTEGER NOT NULL DEFAULT 0,
                created_at INTEGER NOT NULL,
                updated_at INTEGER NOT NULL,
                expires_at INTEGER
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_memory_atoms_project ON memory_atoms(project_id)",
            "CREATE INDEX IF NOT EXISTS idx_memory_atoms_updated_at ON memory_atoms(updated_at DESC)"
        );
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
