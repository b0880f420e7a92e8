package org.stress;
import java.sql.*;

/**
 * Utility class for executing one SQL operation with retry on transient failures.
 * 
 * <p>Concurrent workers hitting the same keys can deadlock or fail serialization
 * checks. Such failures carry an SQLState in class {@code 40} (transaction
 * rollback). They are retried up to 3 times in total with a 50ms pause; when the
 * connection is not in auto-commit mode the transaction is rolled back first.
 * Any other {@code SQLException} is rethrown immediately.
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public class TransientRetry {
    /**
     * Functional interface for SQL operations that may throw SQLException.
     */
    @FunctionalInterface
    public interface SQLRunnable {
        void run() throws SQLException;
    }
    static final int MAX_ATTEMPTS = 3;
    static final int RETRY_DELAY_MS = 50;
    
    /**
     * Executes a SQL operation, retrying transient failures.
     * 
     * @param conn The connection the operation runs on (used for rollback)
     * @param sqlOperation The SQL operation to execute
     * @return The number of attempts it took
     * @throws SQLException If the operation fails with a non-transient error, or still fails after the last attempt
     */
    public static int executeWithRetry(Connection conn, SQLRunnable sqlOperation) throws SQLException {
        for (int attempt = 1; ; attempt++) {
            try {
                sqlOperation.run();
                return attempt;
            } catch (SQLException e) {
                if (!isTransient(e) || attempt >= MAX_ATTEMPTS) {
                    throw e;
                }
                if (!conn.getAutoCommit()) {
                    conn.rollback();
                }
                try {
                    Thread.sleep(RETRY_DELAY_MS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new SQLException("Retry interrupted", e);
                }
            }
        }
    }

    /**
     * @return true if the error is a deadlock or serialization failure (SQLState class 40)
     */
    public static boolean isTransient(SQLException e) {
        String sqlState = e.getSQLState();
        return sqlState != null && sqlState.startsWith("40");
    }
}
