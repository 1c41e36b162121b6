package com.scoutmind.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link ReportStore} writing to the {@code research_reports} table.
 * <p>
 * The table is created by {@link #createTables()}. Saving an id that already
 * exists replaces the earlier row.
 */
public class JdbcReportStore implements ReportStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcReportStore.class);

    private static final String TABLE_NAME = "research_reports";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id         VARCHAR(255) PRIMARY KEY,
                query      TEXT NOT NULL,
                content    TEXT NOT NULL,
                created_at TIMESTAMP NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (id, query, content, created_at)
            VALUES (?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_RECENT_SQL = """
            SELECT id, query, content, created_at
            FROM %s
            ORDER BY created_at DESC, id ASC
            LIMIT ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_ID_SQL = """
            SELECT id, query, content, created_at
            FROM %s
            WHERE id = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final Clock clock;

    public JdbcReportStore(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    JdbcReportStore(DataSource dataSource, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.clock = clock;
    }

    /**
     * Creates the report table if it does not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Report table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void save(String reportId, String query, String content) {
        if (reportId == null || reportId.isBlank()) {
            throw new IllegalArgumentException("Report id must not be blank");
        }
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (PreparedStatement delete = conn.prepareStatement(DELETE_SQL);
                 PreparedStatement insert = conn.prepareStatement(INSERT_SQL)) {
                delete.setString(1, reportId);
                delete.executeUpdate();

                insert.setString(1, reportId);
                insert.setString(2, query != null ? query : "");
                insert.setString(3, content != null ? content : "");
                insert.setTimestamp(4, Timestamp.from(clock.instant()));
                insert.executeUpdate();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
            log.debug("Saved report '{}' ({} chars)", reportId, content != null ? content.length() : 0);
        } catch (SQLException e) {
            throw new ReportStoreException("Failed to save report '" + reportId + "'", e);
        }
    }

    @Override
    public List<StoredReport> findRecent(int limit) {
        List<StoredReport> reports = new ArrayList<>();
        if (limit <= 0) {
            return reports;
        }
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_RECENT_SQL)) {
            stmt.setInt(1, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    reports.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new ReportStoreException("Failed to list reports", e);
        }
        log.debug("Loaded {} recent report(s)", reports.size());
        return reports;
    }

    @Override
    public Optional<StoredReport> findById(String reportId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            stmt.setString(1, reportId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new ReportStoreException("Failed to load report '" + reportId + "'", e);
        }
        return Optional.empty();
    }

    private static StoredReport fromResultSet(ResultSet rs) throws SQLException {
        Timestamp createdAt = rs.getTimestamp("created_at");
        return new StoredReport(
                rs.getString("id"),
                rs.getString("query"),
                rs.getString("content"),
                createdAt != null ? createdAt.toInstant() : null);
    }
}
