package de.bsommerfeld.quizbank.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Scoped transactions on a JDBC connection: the work commits if it returns
 * normally and rolls back if it throws, whatever it throws. Auto-commit is
 * restored afterwards so the connection can be handed back in the state it
 * was received.
 */
public final class Transactions {

    private static final Logger LOG = LoggerFactory.getLogger(Transactions.class);

    private Transactions() {
    }

    /**
     * Unit of work returning a value.
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T execute(Connection conn) throws SQLException;
    }

    /**
     * Unit of work without a result.
     */
    @FunctionalInterface
    public interface SqlAction {
        void execute(Connection conn) throws SQLException;
    }

    /**
     * Runs {@code work} in one transaction. Anything thrown by the work or by
     * the commit, errors included, rolls the transaction back. If the rollback
     * itself fails the connection is closed so the partial work can never be
     * committed by a later auto-commit switch.
     */
    public static <T> T inTransaction(Connection conn, SqlWork<T> work) throws SQLException {
        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        boolean settled = false;
        try {
            T result = work.execute(conn);
            conn.commit();
            settled = true;
            return result;
        } catch (Throwable t) {
            settled = rollback(conn, t);
            if (!settled) {
                discard(conn, t);
            }
            throw t;
        } finally {
            if (settled) {
                restoreAutoCommit(conn, autoCommit);
            }
        }
    }

    public static void runInTransaction(Connection conn, SqlAction action) throws SQLException {
        inTransaction(conn, c -> {
            action.execute(c);
            return null;
        });
    }

    /**
     * Rolls back and records a failing rollback on the original exception
     * instead of replacing it.
     *
     * @return {@code true} if the rollback went through
     */
    private static boolean rollback(Connection conn, Throwable cause) {
        try {
            conn.rollback();
            LOG.debug("Transaction rolled back: {}", cause.toString());
            return true;
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
            LOG.error("Rollback failed after: {}", cause.toString(), rollbackFailure);
            return false;
        }
    }

    private static void discard(Connection conn, Throwable cause) {
        try {
            conn.close();
            LOG.warn("Closed connection with an open transaction after failed rollback");
        } catch (SQLException closeFailure) {
            cause.addSuppressed(closeFailure);
        }
    }

    private static void restoreAutoCommit(Connection conn, boolean autoCommit) {
        try {
            if (!conn.isClosed()) {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            LOG.warn("Could not restore auto-commit={} on connection", autoCommit, e);
        }
    }
}
