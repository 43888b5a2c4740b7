package de.bsommerfeld.quizbank.db;

import com.google.inject.Singleton;
import de.bsommerfeld.quizbank.core.domain.Option;
import de.bsommerfeld.quizbank.core.error.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Row access for the {@code options} table. Writes expect the caller's
 * transaction; nothing here commits or rolls back.
 */
@Singleton
public class OptionStore {

    private static final Logger LOG = LoggerFactory.getLogger(OptionStore.class);

    /**
     * Inserts one option row.
     *
     * @return the generated option id
     */
    public long createOption(Connection conn, String body, boolean correct) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-option"))) {
            ps.setString(1, body);
            ps.setBoolean(2, correct);
            ps.executeUpdate();
        }
        long id = lastInsertId(conn);
        LOG.debug("[DB] Created option {}", id);
        return id;
    }

    /**
     * @throws NotFoundException if no option row has this id
     */
    public Option readOption(Connection conn, long id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-option"))) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new NotFoundException("Option", id);
                }
                return new Option(rs.getLong("id"), rs.getString("body"), rs.getBoolean("correct"));
            }
        }
    }

    /**
     * Deletes the option row with this id. Deleting an id that does not exist
     * is not an error.
     *
     * @return {@code true} if a row was removed
     */
    public boolean deleteOption(Connection conn, long id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-option"))) {
            ps.setLong(1, id);
            return ps.executeUpdate() > 0;
        }
    }

    /**
     * Row id of the last successful insert on this connection.
     */
    static long lastInsertId(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-last-insert-id"));
                ResultSet rs = ps.executeQuery()) {
            if (!rs.next() || rs.getLong(1) <= 0) {
                throw new SQLException("Insert produced no row id");
            }
            return rs.getLong(1);
        }
    }
}
