package com.taskforge.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link StateStore} backed by a single {@code taskforge_state} table.
 * <p>
 * Writes use update-then-insert so the same SQL works on PostgreSQL and H2.
 * The table is created by {@link #createTables()}.
 */
public class JdbcStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcStateStore.class);

    static final String TABLE_NAME = "taskforge_state";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                state_key  VARCHAR(255) NOT NULL PRIMARY KEY,
                state      TEXT NOT NULL,
                updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """.formatted(TABLE_NAME);

    private static final String SELECT_SQL = """
            SELECT state FROM %s WHERE state_key = ?
            """.formatted(TABLE_NAME);

    private static final String UPDATE_SQL = """
            UPDATE %s SET state = ?, updated_at = CURRENT_TIMESTAMP WHERE state_key = ?
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (state_key, state) VALUES (?, ?)
            """.formatted(TABLE_NAME);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE state_key = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcStateStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("State table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Optional<String> load(String key) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SQL)) {
            stmt.setString(1, key);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(rs.getString(1));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StateStoreException("Failed to load state '" + key + "'", e);
        }
    }

    @Override
    public void save(String key, String json) {
        try (Connection conn = dataSource.getConnection()) {
            int updated;
            try (PreparedStatement update = conn.prepareStatement(UPDATE_SQL)) {
                update.setString(1, json);
                update.setString(2, key);
                updated = update.executeUpdate();
            }
            if (updated == 0) {
                try (PreparedStatement insert = conn.prepareStatement(INSERT_SQL)) {
                    insert.setString(1, key);
                    insert.setString(2, json);
                    insert.executeUpdate();
                }
            }
            log.debug("Saved state '{}' ({} chars)", key, json.length());
        } catch (SQLException e) {
            throw new StateStoreException("Failed to save state '" + key + "'", e);
        }
    }

    @Override
    public void delete(String key) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_SQL)) {
            stmt.setString(1, key);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StateStoreException("Failed to delete state '" + key + "'", e);
        }
    }
}
