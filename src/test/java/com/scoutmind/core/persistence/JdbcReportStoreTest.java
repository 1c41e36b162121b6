package com.scoutmind.core.persistence;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs {@link JdbcReportStore} against an in-memory H2 database in PostgreSQL mode.
 */
class JdbcReportStoreTest {

    private static final Instant START = Instant.parse("2026-01-15T10:00:00Z");

    private MutableClock clock;
    private JdbcReportStore store;

    @BeforeEach
    void setUp() throws SQLException {
        var dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:reports-" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        clock = new MutableClock(START);
        store = new JdbcReportStore(dataSource, clock);
        store.createTables();
    }

    @Test
    @DisplayName("createTables is idempotent")
    void createTablesTwice() {
        assertDoesNotThrow(() -> store.createTables());
    }

    @Test
    @DisplayName("saved report round-trips through the table")
    void saveAndFind() {
        store.save("run-1", "best headphones", "# Report\n\nBody");

        StoredReport report = store.findById("run-1").orElseThrow();
        assertEquals("run-1", report.id());
        assertEquals("best headphones", report.query());
        assertEquals("# Report\n\nBody", report.content());
        assertEquals(START, report.createdAt());
    }

    @Test
    @DisplayName("findRecent orders newest first and applies the limit")
    void findRecent() {
        store.save("run-1", "q1", "r1");
        clock.advance(Duration.ofMinutes(1));
        store.save("run-2", "q2", "r2");
        clock.advance(Duration.ofMinutes(1));
        store.save("run-3", "q3", "r3");

        assertEquals(List.of("run-3", "run-2", "run-1"),
                store.findRecent(10).stream().map(StoredReport::id).toList());
        assertEquals(List.of("run-3"),
                store.findRecent(1).stream().map(StoredReport::id).toList());
        assertTrue(store.findRecent(0).isEmpty());
    }

    @Test
    @DisplayName("saving an existing id replaces the row")
    void replace() {
        store.save("run-1", "q", "old");
        clock.advance(Duration.ofMinutes(1));
        store.save("run-1", "q", "new");

        assertEquals(1, store.findRecent(10).size());
        StoredReport report = store.findById("run-1").orElseThrow();
        assertEquals("new", report.content());
        assertEquals(START.plus(Duration.ofMinutes(1)), report.createdAt());
    }

    @Test
    @DisplayName("unknown id is not found")
    void missing() {
        assertTrue(store.findById("nope").isEmpty());
    }

    @Test
    @DisplayName("null query and content are stored as empty strings")
    void nullValues() {
        store.save("run-1", null, null);
        StoredReport report = store.findById("run-1").orElseThrow();
        assertEquals("", report.query());
        assertEquals("", report.content());
    }

    @Test
    @DisplayName("blank id is rejected")
    void blankId() {
        assertThrows(IllegalArgumentException.class, () -> store.save("", "q", "r"));
    }

    @Test
    @DisplayName("database failures surface as ReportStoreException")
    void failureWrapped() {
        var dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:missing-" + UUID.randomUUID());
        var unprepared = new JdbcReportStore(dataSource);

        assertThrows(ReportStoreException.class, () -> unprepared.findRecent(5));
    }
}
