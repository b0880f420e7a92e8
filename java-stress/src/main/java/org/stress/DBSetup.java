package org.stress;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates and empties the {@code stress_kv} table before a run.
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public class DBSetup {
    public static void createTables(DataSource ds, DatabaseAdapter adapter, int keySize) throws SQLException {
        try (Connection c = ds.getConnection(); Statement s = c.createStatement()) {
            s.execute(adapter.getCreateTableSql(keySize));
        }
    }
    
    public static void clearTables(DataSource ds, DatabaseAdapter adapter) throws SQLException {
        try (Connection c = ds.getConnection(); Statement s = c.createStatement()) {
            try {
                s.execute(adapter.getTruncateSql());
            } catch (SQLException e) {
                // TRUNCATE needs extra privileges on some managed instances
                System.err.println("Warning: truncate failed, falling back to DELETE: " + e.getMessage());
                s.execute("DELETE FROM " + DatabaseAdapter.TABLE);
            }
        }
    }
}
