package io.tagprofile.core.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.tagprofile.core.model.TimelineEvent;
import io.tagprofile.core.model.UserProfile;
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

/**
 * SQLite-backed store. A commit upserts the profile, appends the event and trims the
 * user's timeline inside a single transaction. Each call opens its own connection; concurrent
 * writers wait on the database lock.
 */
public final class SqliteProfileStore implements ProfileStore {
    private static final Logger LOG = LoggerFactory.getLogger(SqliteProfileStore.class);

    private final String jdbcUrl;
    private final ObjectMapper mapper;

    public SqliteProfileStore(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        init();
    }

    @Override
    public Optional<UserProfile> load(String userId) throws IOException {
        String sql = "SELECT profile_json FROM profiles WHERE user_id = ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, UserIds.requireValid(userId));
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                String json = resultSet.getString("profile_json");
                try {
                    return Optional.of(mapper.readValue(json, UserProfile.class));
                } catch (IOException e) {
                    LOG.warn("Unreadable profile for user {}, treating as absent: {}", userId, e.getMessage());
                    return Optional.empty();
                }
            }
        } catch (SQLException e) {
            throw new IOException("Failed to load profile for " + userId, e);
        }
    }

    @Override
    public List<TimelineEvent> timeline(String userId) throws IOException {
        String sql = """
            SELECT event_json
            FROM timeline_events
            WHERE user_id = ?
            ORDER BY id ASC
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, UserIds.requireValid(userId));
            List<TimelineEvent> events = new ArrayList<>();
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    try {
                        events.add(mapper.readValue(resultSet.getString("event_json"), TimelineEvent.class));
                    } catch (IOException e) {
                        LOG.warn("Skipping unreadable timeline event for user {}: {}", userId, e.getMessage());
                    }
                }
            }
            return events;
        } catch (SQLException e) {
            throw new IOException("Failed to list timeline for " + userId, e);
        }
    }

    @Override
    public void commit(String userId, UserProfile profile, TimelineEvent event, int timelineLimit) throws IOException {
        String id = UserIds.requireValid(userId);
        String profileJson = mapper.writeValueAsString(profile);
        String eventJson = mapper.writeValueAsString(event);
        String insertEvent = """
            INSERT INTO timeline_events (user_id, created_at, event_json)
            VALUES (?, ?, ?)
            """;
        String trimEvents = """
            DELETE FROM timeline_events
            WHERE user_id = ?
              AND id NOT IN (
                SELECT id FROM timeline_events WHERE user_id = ? ORDER BY id DESC LIMIT ?
              )
            """;
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try {
                upsertProfile(connection, id, profile, profileJson);
                try (PreparedStatement statement = connection.prepareStatement(insertEvent)) {
                    statement.setString(1, id);
                    statement.setString(2, event.timestamp().toString());
                    statement.setString(3, eventJson);
                    statement.executeUpdate();
                }
                try (PreparedStatement statement = connection.prepareStatement(trimEvents)) {
                    statement.setString(1, id);
                    statement.setString(2, id);
                    statement.setInt(3, Math.max(1, timelineLimit));
                    statement.executeUpdate();
                }
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to commit profile for " + userId, e);
        }
    }

    @Override
    public void replace(String userId, UserProfile profile) throws IOException {
        String id = UserIds.requireValid(userId);
        String profileJson = mapper.writeValueAsString(profile);
        try (Connection connection = openConnection()) {
            upsertProfile(connection, id, profile, profileJson);
        } catch (SQLException e) {
            throw new IOException("Failed to replace profile for " + userId, e);
        }
    }

    private void upsertProfile(Connection connection, String userId, UserProfile profile, String json) throws SQLException {
        String sql = """
            INSERT INTO profiles (user_id, profile_json, updated_at)
            VALUES (?, ?, ?)
            ON CONFLICT(user_id) DO UPDATE SET
                profile_json = excluded.profile_json,
                updated_at = excluded.updated_at
            """;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, userId);
            statement.setString(2, json);
            statement.setString(3, profile.lastUpdated().toString());
            statement.executeUpdate();
        }
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA busy_timeout=5000;");
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
        }
        return connection;
    }

    private void init() throws IOException {
        String profiles = """
            CREATE TABLE IF NOT EXISTS profiles (
                user_id TEXT PRIMARY KEY,
                profile_json TEXT NOT NULL,
                updated_at TEXT NOT NULL
            )
            """;
        String events = """
            CREATE TABLE IF NOT EXISTS timeline_events (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                user_id TEXT NOT NULL,
                created_at TEXT NOT NULL,
                event_json TEXT NOT NULL
            )
            """;
        String idx = """
            CREATE INDEX IF NOT EXISTS idx_timeline_events_user
            ON timeline_events(user_id, id)
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(profiles);
            statement.execute(events);
            statement.execute(idx);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite profile store", e);
        }
    }
}
