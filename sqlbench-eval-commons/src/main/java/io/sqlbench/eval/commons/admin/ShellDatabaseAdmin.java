package io.sqlbench.eval.commons.admin;

import io.sqlbench.eval.commons.DatabaseConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Administers databases through the PostgreSQL client binaries.
 */
public class ShellDatabaseAdmin implements DatabaseAdmin {
    private static final Logger logger = LoggerFactory.getLogger(ShellDatabaseAdmin.class);

    private static final String TERMINATE_SQL =
            "SELECT pg_terminate_backend(pid) FROM pg_stat_activity WHERE datname = '%s' AND pid <> pg_backend_pid();";

    private final DatabaseConfig config;
    private final List<String> psql;
    private final List<String> dropdb;
    private final List<String> createdb;
    private final Duration commandTimeout;

    /**
     * @param psql command prefix for psql, usually just the binary name
     */
    public ShellDatabaseAdmin(DatabaseConfig config,
                              List<String> psql,
                              List<String> dropdb,
                              List<String> createdb,
                              Duration commandTimeout) {
        this.config = config;
        this.psql = List.copyOf(psql);
        this.dropdb = List.copyOf(dropdb);
        this.createdb = List.copyOf(createdb);
        this.commandTimeout = commandTimeout;
    }

    @Override
    public void terminateConnections(String database) {
        var command = command(psql);
        command.add("-d");
        command.add(config.maintenanceDatabase());
        command.add("-c");
        command.add(TERMINATE_SQL.formatted(database.replace("'", "''")));
        run(command, "terminate connections to " + database);
    }

    @Override
    public void dropDatabase(String database, boolean ifExists) {
        var command = command(dropdb);
        if (ifExists) {
            command.add("--if-exists");
        }
        command.add(database);
        run(command, "drop " + database);
    }

    @Override
    public void createDatabase(String database, String template) {
        var command = command(createdb);
        command.add(database);
        command.add("--template");
        command.add(template);
        run(command, "create " + database + " from " + template);
    }

    private List<String> command(List<String> prefix) {
        var command = new ArrayList<>(prefix);
        command.add("-h");
        command.add(config.host());
        command.add("-p");
        command.add(String.valueOf(config.port()));
        command.add("-U");
        command.add(config.user());
        return command;
    }

    void run(List<String> command, String description) {
        File output = null;
        try {
            output = File.createTempFile("sqlbench-admin", ".log");
            var builder = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(output);
            builder.environment().put("PGPASSWORD", config.password());
            logger.debug("Running {}", command);
            var process = builder.start();
            if (!process.waitFor(commandTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new DatabaseAdminException("Timed out after %s trying to %s".formatted(commandTimeout, description));
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                var text = Files.readString(output.toPath(), StandardCharsets.UTF_8).strip();
                throw new DatabaseAdminException("Failed to %s (exit code %d): %s".formatted(description, exitCode, text));
            }
        } catch (IOException e) {
            throw new DatabaseAdminException("Failed to " + description, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DatabaseAdminException("Interrupted trying to " + description, e);
        } finally {
            if (output != null && !output.delete()) {
                output.deleteOnExit();
            }
        }
    }
}
