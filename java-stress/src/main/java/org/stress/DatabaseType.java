package org.stress;

/**
 * Enumeration of database systems the stress tool can target.
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public enum DatabaseType {
    MYSQL("com.mysql.cj.jdbc.Driver"),
    POSTGRESQL("org.postgresql.Driver");

    private final String driverClass;

    DatabaseType(String driverClass) {
        this.driverClass = driverClass;
    }

    /** @return the JDBC driver class registered for this database */
    public String getDriverClass() {
        return driverClass;
    }
    
    /**
     * Determines the database type from a JDBC URL.
     * 
     * @param url The JDBC connection URL
     * @return The detected {@code DatabaseType}, defaults to {@code MYSQL} if URL is null or unrecognized
     */
    public static DatabaseType fromUrl(String url) {
        if (url == null) return MYSQL;
        url = url.toLowerCase();
        if (url.startsWith("jdbc:postgresql:") || url.contains("postgres")) {
            return POSTGRESQL;
        }
        return MYSQL;
    }
}
