package io.sqlbench.eval.commons;

import com.typesafe.config.Config;

import static io.sqlbench.eval.commons.config.ConfigConstants.*;

/**
 * Connection settings shared by every database of a run. Individual databases only differ by name.
 */
public record DatabaseConfig(String host,
                             int port,
                             String user,
                             String password,
                             int minConnections,
                             int maxConnections,
                             String maintenanceDatabase) {

    public static DatabaseConfig fromConfig(Config config) {
        var db = config.getConfig(DATABASE_PREFIX);
        return new DatabaseConfig(db.getString(HOST_KEY),
                db.getInt(PORT_KEY),
                db.getString(USER_KEY),
                db.getString(PASSWORD_KEY),
                db.getInt(MIN_CONNECTIONS_KEY),
                db.getInt(MAX_CONNECTIONS_KEY),
                db.getString(MAINTENANCE_DATABASE_KEY));
    }

    public String jdbcUrl(String database) {
        return "jdbc:postgresql://%s:%d/%s".formatted(host, port, database);
    }

    @Override
    public String toString() {
        return "DatabaseConfig[host=%s, port=%d, user=%s, minConnections=%d, maxConnections=%d]"
                .formatted(host, port, user, minConnections, maxConnections);
    }
}
