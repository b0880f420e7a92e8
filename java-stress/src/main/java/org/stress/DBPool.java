package org.stress;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import javax.sql.DataSource;

/**
 * Database connection pool manager using HikariCP.
 * 
 * <p>Every Workpool worker borrows one connection in its setup stage and keeps it
 * until teardown, so the pool is sized to the worker count plus a small margin
 * for table setup. JDBC drivers are runtime dependencies and are loaded
 * reflectively; a missing driver only matters if the URL needs it.
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public class DBPool {
    private static final long CONNECTION_TIMEOUT_MS = 10_000;
    private static HikariDataSource ds;
    
    static {
        for (DatabaseType type : DatabaseType.values()) {
            loadDriver(type.getDriverClass());
        }
    }

    private static void loadDriver(String className) {
        try {
            Class.forName(className);
        } catch (ClassNotFoundException e) {
            System.out.println("JDBC driver " + className + " not on classpath");
        }
    }

    /**
     * Gets or creates the shared connection pool.
     * 
     * <p>Workers hold their connection for a whole run, so the pool is fixed-size:
     * idle connections are kept at the maximum, and a worker that cannot get one
     * within {@value #CONNECTION_TIMEOUT_MS}ms fails its setup stage. A later call
     * asking for more connections grows the running pool.
     * 
     * @param poolSize The number of connections the caller needs at once
     * @return The shared {@code DataSource}
     */
    public static synchronized DataSource getDataSource(int poolSize) {
        if (ds == null) {
            HikariConfig cfg = new HikariConfig();
            cfg.setJdbcUrl(Config.DB_URL);
            cfg.setUsername(Config.DB_USER);
            cfg.setPassword(Config.DB_PASS);
            cfg.setMaximumPoolSize(poolSize);
            cfg.setMinimumIdle(poolSize);
            cfg.setConnectionTimeout(CONNECTION_TIMEOUT_MS);
            cfg.setPoolName("stress-db");
            Config.DB_ADAPTER.configureConnectionProperties(cfg);
            ds = new HikariDataSource(cfg);
        } else if (ds.getMaximumPoolSize() < poolSize) {
            System.out.println("Growing connection pool to " + poolSize);
            ds.getHikariConfigMXBean().setMaximumPoolSize(poolSize);
            ds.getHikariConfigMXBean().setMinimumIdle(poolSize);
        }
        return ds;
    }

    /**
     * Closes the database connection pool and releases all resources.
     */
    public static synchronized void close() {
        if (ds != null) {
            ds.close();
            ds = null;
        }
    }
}
