package org.stress;

import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class TransientRetryTest {

    private static SQLException deadlock() {
        return new SQLException("Deadlock found when trying to get lock", "40001", 1213);
    }

    @Test
    void succeedsOnFirstAttempt() throws Exception {
        FakeJdbc jdbc = new FakeJdbc();

        assertEquals(1, TransientRetry.executeWithRetry(jdbc.connection(), () -> {}));
    }

    @Test
    void retriesDeadlockUntilItClears() throws Exception {
        FakeJdbc jdbc = new FakeJdbc();
        AtomicInteger calls = new AtomicInteger();

        int attempts = TransientRetry.executeWithRetry(jdbc.connection(), () -> {
            if (calls.incrementAndGet() < 3) throw deadlock();
        });

        assertEquals(3, attempts);
        assertEquals(0, jdbc.rollbacks.get());
    }

    @Test
    void givesUpAfterLastAttempt() {
        FakeJdbc jdbc = new FakeJdbc();
        AtomicInteger calls = new AtomicInteger();

        SQLException e = assertThrows(SQLException.class, () -> TransientRetry.executeWithRetry(jdbc.connection(), () -> {
            calls.incrementAndGet();
            throw deadlock();
        }));

        assertEquals("40001", e.getSQLState());
        assertEquals(TransientRetry.MAX_ATTEMPTS, calls.get());
    }

    @Test
    void otherErrorsAreNotRetried() {
        FakeJdbc jdbc = new FakeJdbc();
        AtomicInteger calls = new AtomicInteger();

        assertThrows(SQLException.class, () -> TransientRetry.executeWithRetry(jdbc.connection(), () -> {
            calls.incrementAndGet();
            throw new SQLException("Duplicate entry", "23000", 1062);
        }));

        assertEquals(1, calls.get());
    }

    @Test
    void rollsBackOpenTransactionBeforeRetrying() throws Exception {
        FakeJdbc jdbc = new FakeJdbc();
        jdbc.autoCommit = false;
        Connection conn = jdbc.connection();
        AtomicInteger calls = new AtomicInteger();

        TransientRetry.executeWithRetry(conn, () -> {
            if (calls.incrementAndGet() == 1) throw deadlock();
        });

        assertEquals(1, jdbc.rollbacks.get());
    }

    @Test
    void classifiesBySqlStateClass() {
        assertTrue(TransientRetry.isTransient(new SQLException("serialization", "40P01")));
        assertFalse(TransientRetry.isTransient(new SQLException("syntax", "42000")));
        assertFalse(TransientRetry.isTransient(new SQLException("no state")));
    }
}
