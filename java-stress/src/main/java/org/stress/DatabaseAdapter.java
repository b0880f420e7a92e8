package org.stress;

/**
 * Database adapter to handle SQL dialect differences between MySQL and PostgreSQL.
 * 
 * <p>The stress workloads all run against one key/value table, {@code stress_kv}.
 * The statements that touch it are plain parameterized SQL and read the same on
 * both systems; the dialects only differ in:
 * <ul>
 *   <li>Binary column types (VARBINARY/LONGBLOB vs BYTEA)</li>
 *   <li>Table engines (ENGINE=InnoDB vs none)</li>
 *   <li>Connection pool properties</li>
 * </ul>
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public class DatabaseAdapter {
    public static final String TABLE = "stress_kv";

    private final DatabaseType dbType;
    
    public DatabaseAdapter(DatabaseType dbType) {
        this.dbType = dbType;
    }
    
    /**
     * Creates a database adapter from a JDBC URL.
     * 
     * @param url The JDBC connection URL
     * @return A new {@code DatabaseAdapter} instance for the detected database type
     */
    public static DatabaseAdapter fromUrl(String url) {
        return new DatabaseAdapter(DatabaseType.fromUrl(url));
    }
    
    /**
     * Gets the CREATE TABLE statement for the key/value table.
     * 
     * <p>MySQL needs a declared length on an indexed binary column, so the key column is
     * sized to {@code keySize}; PostgreSQL's BYTEA is unbounded.
     * 
     * @param keySize Key length in bytes
     * @return The DDL statement
     */
    public String getCreateTableSql(int keySize) {
        switch (dbType) {
            case POSTGRESQL:
                return "CREATE TABLE IF NOT EXISTS " + TABLE + " (k BYTEA PRIMARY KEY, v BYTEA NOT NULL)";
            case MYSQL:
            default:
                return "CREATE TABLE IF NOT EXISTS " + TABLE + " (k VARBINARY(" + Math.max(1, keySize)
                        + ") PRIMARY KEY, v LONGBLOB NOT NULL) ENGINE=InnoDB";
        }
    }

    public String getTruncateSql() {
        return "TRUNCATE TABLE " + TABLE;
    }

    public String getInsertSql() {
        return "INSERT INTO " + TABLE + " (k, v) VALUES (?, ?)";
    }

    public String getSelectSql() {
        return "SELECT v FROM " + TABLE + " WHERE k = ?";
    }

    public String getUpdateSql() {
        return "UPDATE " + TABLE + " SET v = ? WHERE k = ?";
    }

    public String getDeleteSql() {
        return "DELETE FROM " + TABLE + " WHERE k = ?";
    }
    
    /**
     * Configures HikariCP connection pool properties based on the database type.
     * 
     * <p>Both drivers get prepared statement caching, since every worker reuses a
     * single statement for the whole run.
     * 
     * @param config The HikariCP configuration to modify
     */
    public void configureConnectionProperties(com.zaxxer.hikari.HikariConfig config) {
        switch (dbType) {
            case MYSQL:
                config.addDataSourceProperty("cachePrepStmts", "true");
                config.addDataSourceProperty("prepStmtCacheSize", "250");
                config.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");
                config.addDataSourceProperty("useServerPrepStmts", "true");
                break;
            case POSTGRESQL:
                config.addDataSourceProperty("preparedStatementCacheQueries", "250");
                config.addDataSourceProperty("preparedStatementCacheSizeMiB", "5");
                break;
        }
    }
    
    public DatabaseType getType() {
        return dbType;
    }
}
