package de.bsommerfeld.quizbank.db;

import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Creates the {@code options}, {@code question_bodies} and {@code questions}
 * tables from {@code schema.sql}.
 *
 * <p>
 * The DDL uses plain {@code CREATE TABLE}, so this runs exactly once per
 * database file; a second run fails on the existing tables. All three
 * statements execute in one transaction, a failure leaves no table behind.
 */
@Singleton
public class SchemaManager {

    static final String SCHEMA_RESOURCE = "schema.sql";

    private static final Logger LOG = LoggerFactory.getLogger(SchemaManager.class);

    public void initialize(Connection conn) throws SQLException {
        List<String> statements = SqlLoader.loadScript(SCHEMA_RESOURCE);
        Transactions.runInTransaction(conn, c -> {
            try (Statement stmt = c.createStatement()) {
                for (String sql : statements) {
                    stmt.execute(sql);
                }
            }
        });
        LOG.info("Database schema applied ({} statements).", statements.size());
    }
}
