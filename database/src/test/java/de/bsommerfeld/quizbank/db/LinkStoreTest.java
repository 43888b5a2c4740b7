package de.bsommerfeld.quizbank.db;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LinkStoreTest {

    @TempDir
    Path tempDir;

    private Connection conn;
    private final LinkStore store = new LinkStore();

    @BeforeEach
    void setUp() throws SQLException {
        conn = SqliteTestSupport.openInitialized(tempDir.resolve("links.db"));
    }

    @AfterEach
    void tearDown() throws SQLException {
        conn.close();
    }

    @Test
    void createLinks_shouldPreserveInputOrderNotIdOrder() throws SQLException {
        store.createLinks(conn, 1, List.of(30L, 10L, 20L));

        assertEquals(List.of(30L, 10L, 20L), store.readLinkedOptionIds(conn, 1));
    }

    @Test
    void createLinks_shouldUseZeroBasedPositions() throws SQLException {
        store.createLinks(conn, 1, List.of(5L, 6L));

        assertEquals(1, SqliteTestSupport.countWhere(conn,
                "SELECT COUNT(*) FROM questions WHERE option_id = ? AND option_order = 0", 5));
        assertEquals(1, SqliteTestSupport.countWhere(conn,
                "SELECT COUNT(*) FROM questions WHERE option_id = ? AND option_order = 1", 6));
    }

    @Test
    void createLinks_shouldAcceptEmptyList() throws SQLException {
        store.createLinks(conn, 1, List.of());
        assertEquals(0, SqliteTestSupport.count(conn, "questions"));
    }

    @Test
    void createLinks_shouldFailOnDuplicateOption() {
        assertThrows(SQLException.class, () -> store.createLinks(conn, 1, List.of(5L, 5L)));
    }

    @Test
    void readLinkedOptionIds_shouldBeScopedToQuestion() throws SQLException {
        store.createLinks(conn, 1, List.of(1L, 2L));
        store.createLinks(conn, 2, List.of(3L));

        assertEquals(List.of(1L, 2L), store.readLinkedOptionIds(conn, 1));
        assertEquals(List.of(3L), store.readLinkedOptionIds(conn, 2));
        assertTrue(store.readLinkedOptionIds(conn, 99).isEmpty());
    }

    @Test
    void deleteLinksForQuestion_shouldOnlyTouchThatQuestion() throws SQLException {
        store.createLinks(conn, 1, List.of(1L, 2L));
        store.createLinks(conn, 2, List.of(3L));

        assertEquals(2, store.deleteLinksForQuestion(conn, 1));
        assertTrue(store.readLinkedOptionIds(conn, 1).isEmpty());
        assertEquals(List.of(3L), store.readLinkedOptionIds(conn, 2));
    }

    @Test
    void deleteLinksForQuestion_shouldBeNoOpWithoutLinks() throws SQLException {
        assertEquals(0, store.deleteLinksForQuestion(conn, 42));
    }

    @Test
    void deleteLink_shouldRemoveSingleRow() throws SQLException {
        store.createLinks(conn, 1, List.of(1L, 2L, 3L));

        assertTrue(store.deleteLink(conn, 1, 2));
        assertFalse(store.deleteLink(conn, 1, 2));
        assertEquals(List.of(1L, 3L), store.readLinkedOptionIds(conn, 1));
    }
}
