package de.bsommerfeld.quizbank.db;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchemaManagerTest {

    @TempDir
    Path tempDir;

    private Connection conn;

    @BeforeEach
    void setUp() throws SQLException {
        conn = SqliteTestSupport.open(tempDir.resolve("schema.db"));
    }

    @AfterEach
    void tearDown() throws SQLException {
        conn.close();
    }

    @Test
    void initialize_shouldCreateAllThreeTables() throws SQLException {
        new SchemaManager().initialize(conn);

        assertEquals(List.of("options", "question_bodies", "questions"), tableNames());
    }

    @Test
    void initialize_shouldFailOnSecondRun() throws SQLException {
        SchemaManager schema = new SchemaManager();
        schema.initialize(conn);

        assertThrows(SQLException.class, () -> schema.initialize(conn));
        assertTrue(conn.getAutoCommit(), "auto-commit must be restored after the failed run");
    }

    @Test
    void initialize_shouldRollBackPartialSchema() throws SQLException {
        // Only the third table clashes; the first two must not survive the failed run
        SqliteTestSupport.execute(conn, "CREATE TABLE questions (x INTEGER)");

        assertThrows(SQLException.class, () -> new SchemaManager().initialize(conn));
        assertEquals(List.of("questions"), tableNames());
    }

    @Test
    void linkTable_shouldRejectSameOptionTwiceInOneQuestion() throws SQLException {
        new SchemaManager().initialize(conn);
        SqliteTestSupport.execute(conn,
                "INSERT INTO questions (question_id, option_id, option_order) VALUES (1, 1, 0)");

        assertThrows(SQLException.class, () -> SqliteTestSupport.execute(conn,
                "INSERT INTO questions (question_id, option_id, option_order) VALUES (1, 1, 1)"));
    }

    @Test
    void optionIds_shouldNotBeReusedAfterDelete() throws SQLException {
        new SchemaManager().initialize(conn);
        SqliteTestSupport.execute(conn, "INSERT INTO options (body, correct) VALUES ('a', 1)");
        SqliteTestSupport.execute(conn, "INSERT INTO options (body, correct) VALUES ('b', 0)");
        SqliteTestSupport.execute(conn, "DELETE FROM options WHERE id = 2");
        SqliteTestSupport.execute(conn, "INSERT INTO options (body, correct) VALUES ('c', 0)");

        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT MAX(id) FROM options")) {
            rs.next();
            assertEquals(3, rs.getLong(1));
        }
    }

    private List<String> tableNames() throws SQLException {
        List<String> names = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery(
                        "SELECT name FROM sqlite_master WHERE type = 'table' "
                                + "AND name NOT LIKE 'sqlite_%' ORDER BY name")) {
            while (rs.next())
                names.add(rs.getString(1));
        }
        return names;
    }
}
