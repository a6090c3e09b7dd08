package io.sqlbench.eval.commons.config;

import com.typesafe.config.Config;

import java.time.Duration;

public class ConfigConstants {

    public static final String CONFIG_PATH = "sqlbench";

    // Database connection keys
    public static final String DATABASE_PREFIX = "database";
    public static final String HOST_KEY = "host";
    public static final String PORT_KEY = "port";
    public static final String USER_KEY = "user";
    public static final String PASSWORD_KEY = "password";
    public static final String MIN_CONNECTIONS_KEY = "min_connections";
    public static final String MAX_CONNECTIONS_KEY = "max_connections";
    public static final String MAINTENANCE_DATABASE_KEY = "maintenance_database";

    // Query execution keys
    public static final String QUERY_PREFIX = "query";
    public static final String STATEMENT_TIMEOUT_MS_KEY = "statement_timeout_ms";
    public static final String MAX_ROWS_KEY = "max_rows";
    public static final String SESSION_TIMEOUT_ENABLED_KEY = "session_timeout_enabled";

    // Worker keys
    public static final String THREADS_KEY = "threads";

    // Ephemeral pool keys
    public static final String POOL_PREFIX = "pool";
    public static final String COPIES_PER_DATABASE_KEY = "copies_per_database";
    public static final String ACQUIRE_TIMEOUT_MS_KEY = "acquire_timeout_ms";

    // Database administration keys
    public static final String ADMIN_PREFIX = "admin";
    public static final String ADMIN_MODE_KEY = "mode";
    public static final String COMMAND_TIMEOUT_MS_KEY = "command_timeout_ms";
    public static final String PSQL_KEY = "psql";
    public static final String DROPDB_KEY = "dropdb";
    public static final String CREATEDB_KEY = "createdb";
    public static final String ADMIN_MODE_SHELL = "shell";
    public static final String ADMIN_MODE_JDBC = "jdbc";

    // Predicate keys
    public static final String PREDICATE_PREFIX = "predicate";
    public static final String ISOLATION_KEY = "isolation";
    public static final String PREDICATE_TIMEOUT_MS_KEY = "timeout_ms";
    public static final String ISOLATION_PROCESS = "process";
    public static final String ISOLATION_THREAD = "thread";

    // Output keys
    public static final String OUTPUT_PREFIX = "output";
    public static final String OUTPUT_DIRECTORY_KEY = "directory";
    public static final String WRITE_STATUS_KEY = "write_status";
    public static final String PER_INSTANCE_LOGS_KEY = "per_instance_logs";

    public static int getThreads(Config config) {
        return config.getInt(THREADS_KEY);
    }

    public static int getCopiesPerDatabase(Config config) {
        int copies = config.getInt(POOL_PREFIX + "." + COPIES_PER_DATABASE_KEY);
        return copies > 0 ? copies : getThreads(config);
    }

    public static Duration getAcquireTimeout(Config config) {
        return Duration.ofMillis(config.getLong(POOL_PREFIX + "." + ACQUIRE_TIMEOUT_MS_KEY));
    }

    public static Duration getPredicateTimeout(Config config) {
        return Duration.ofMillis(config.getLong(PREDICATE_PREFIX + "." + PREDICATE_TIMEOUT_MS_KEY));
    }
}
