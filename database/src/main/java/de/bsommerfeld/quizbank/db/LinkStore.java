package de.bsommerfeld.quizbank.db;

import com.google.inject.Singleton;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Maintains the {@code questions} link table, the only place option order
 * is recorded. A row {@code (question_id, option_id, option_order)} says that
 * the option is at position {@code option_order} of the question.
 */
@Singleton
public class LinkStore {

    /**
     * Links the options to the question, using each id's index in
     * {@code orderedOptionIds} as its 0-based {@code option_order}. A failing
     * insert leaves earlier inserts for the caller's transaction to undo.
     */
    public void createLinks(Connection conn, long questionId, List<Long> orderedOptionIds) throws SQLException {
        if (orderedOptionIds.isEmpty())
            return;

        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-link"))) {
            for (int order = 0; order < orderedOptionIds.size(); order++) {
                ps.setLong(1, questionId);
                ps.setLong(2, orderedOptionIds.get(order));
                ps.setInt(3, order);
                ps.executeUpdate();
            }
        }
    }

    /**
     * @return the linked option ids sorted by {@code option_order}, empty if
     *         the question has no links
     */
    public List<Long> readLinkedOptionIds(Connection conn, long questionId) throws SQLException {
        List<Long> ids = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-linked-option-ids"))) {
            ps.setLong(1, questionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    ids.add(rs.getLong("option_id"));
            }
        }
        return ids;
    }

    /**
     * @return number of link rows removed
     */
    public int deleteLinksForQuestion(Connection conn, long questionId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-links-for-question"))) {
            ps.setLong(1, questionId);
            return ps.executeUpdate();
        }
    }

    public boolean deleteLink(Connection conn, long questionId, long optionId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-link"))) {
            ps.setLong(1, questionId);
            ps.setLong(2, optionId);
            return ps.executeUpdate() > 0;
        }
    }
}
