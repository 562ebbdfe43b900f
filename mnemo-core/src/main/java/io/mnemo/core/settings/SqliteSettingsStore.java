package io.mnemo.core.settings;

import io.mnemo.core.store.SqliteDatabase;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Optional;

public final class SqliteSettingsStore implements SettingsStore {
    private final SqliteDatabase database;
    private final Clock clock;

    public SqliteSettingsStore(SqliteDatabase database, Clock clock) throws IOException {
        this.database = database;
        this.clock = clock;
        database.execute(
            "SQLite settings store",
            """
            CREATE TABLE IF NOT EXISTS settings (
                key TEXT PRIMARY KEY,
                value TEXT NOT NULL,
                updated_at INTEGER NOT NULL
            )
            """
        );
    }

    @Override
    public Optional<String> get(String key) throws IOException {
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement("SELECT value FROM settings WHERE key = ?")) {
            statement.setString(1, key);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.ofNullable(resultSet.getString("value")) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to read setting " + key, e);
        }
    }

    @Override
    public void set(String key, String value) throws IOException {
        String sql = """
            INSERT INTO settings (key, value, updated_at)
            VALUES (?, ?, ?)
            ON CONFLICT(key) DO UPDATE SET value = excluded.value, updated_at = excluded.updated_at
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, key);
            statement.setString(2, value == null ? "" : value);
            statement.setLong(3, clock.millis());
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to write setting " + key, e);
        }
    }
}
