package io.sqlbench.eval.commons.admin;

import com.typesafe.config.Config;
import io.sqlbench.eval.commons.DatabaseConfig;

import java.time.Duration;
import java.util.List;

import static io.sqlbench.eval.commons.config.ConfigConstants.*;

/**
 * Server-level operations on whole databases. All methods throw {@link DatabaseAdminException}.
 */
public interface DatabaseAdmin {

    String TEMPLATE_SUFFIX = "_template";

    /**
     * Terminate every backend connected to {@code database} except the caller's own.
     */
    void terminateConnections(String database);

    void dropDatabase(String database, boolean ifExists);

    void createDatabase(String database, String template);

    static String templateName(String baseName) {
        return baseName + TEMPLATE_SUFFIX;
    }

    static DatabaseAdmin fromConfig(Config config) {
        var databaseConfig = DatabaseConfig.fromConfig(config);
        var admin = config.getConfig(ADMIN_PREFIX);
        var mode = admin.getString(ADMIN_MODE_KEY);
        var timeout = Duration.ofMillis(admin.getLong(COMMAND_TIMEOUT_MS_KEY));
        return switch (mode) {
            case ADMIN_MODE_SHELL -> new ShellDatabaseAdmin(databaseConfig,
                    List.of(admin.getString(PSQL_KEY)),
                    List.of(admin.getString(DROPDB_KEY)),
                    List.of(admin.getString(CREATEDB_KEY)),
                    timeout);
            case ADMIN_MODE_JDBC -> new JdbcDatabaseAdmin(databaseConfig);
            default -> throw new IllegalArgumentException("Unknown admin mode: " + mode);
        };
    }
}
