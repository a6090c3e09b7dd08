package io.sqlbench.eval.runtime.predicate;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.sqlbench.eval.commons.DatabaseConfig;
import io.sqlbench.eval.commons.QuerySettings;
import io.sqlbench.eval.runtime.model.PredicateSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs each predicate in a fresh JVM. A worker that outlives the budget is destroyed forcibly.
 */
public class ProcessPredicateExecutor implements PredicateExecutor {
    private static final Logger logger = LoggerFactory.getLogger(ProcessPredicateExecutor.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String WORKER_LOGBACK_CONFIG = "logback-worker.xml";

    private final DatabaseConfig databaseConfig;
    private final QuerySettings settings;
    private final Duration budget;
    private final List<String> javaCommand;

    public ProcessPredicateExecutor(DatabaseConfig databaseConfig, QuerySettings settings, Duration budget) {
        this(databaseConfig, settings, budget, defaultJavaCommand());
    }

    public ProcessPredicateExecutor(DatabaseConfig databaseConfig,
                                    QuerySettings settings,
                                    Duration budget,
                                    List<String> javaCommand) {
        this.databaseConfig = databaseConfig;
        this.settings = settings;
        this.budget = budget;
        this.javaCommand = List.copyOf(javaCommand);
    }

    public static List<String> defaultJavaCommand() {
        var java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        return List.of(java,
                "-cp", System.getProperty("java.class.path"),
                "-Dlogback.configurationFile=" + WORKER_LOGBACK_CONFIG);
    }

    @Override
    public PredicateStatus execute(PredicateSpec spec, PredicateInput input) {
        Path job = null;
        Path stdout = null;
        Path stderr = null;
        try {
            job = Files.createTempFile("sqlbench-predicate", ".json");
            stdout = Files.createTempFile("sqlbench-predicate", ".out");
            stderr = Files.createTempFile("sqlbench-predicate", ".err");
            var publicConfig = new DatabaseConfig(databaseConfig.host(), databaseConfig.port(), databaseConfig.user(),
                    "", databaseConfig.minConnections(), databaseConfig.maxConnections(),
                    databaseConfig.maintenanceDatabase());
            MAPPER.writeValue(job.toFile(), new PredicateJob(spec, input, publicConfig, settings));

            var command = new ArrayList<>(javaCommand);
            command.add(PredicateWorker.class.getName());
            var builder = new ProcessBuilder(command)
                    .redirectInput(job.toFile())
                    .redirectOutput(stdout.toFile())
                    .redirectError(stderr.toFile());
            builder.environment().put(PredicateWorker.PASSWORD_ENV, databaseConfig.password());
            var process = builder.start();
            if (!process.waitFor(budget.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
                logger.error("Predicate {} of instance {} timed out after {}", input.index(), input.instanceId(), budget);
                return PredicateStatus.TIMEOUT;
            }
            logOutput(input, stderr);
            var status = parseResult(Files.readAllLines(stdout, StandardCharsets.UTF_8));
            if (status != PredicateStatus.PASSED) {
                logger.info("Predicate {} of instance {} did not pass (exit code {})",
                        input.index(), input.instanceId(), process.exitValue());
            }
            return status;
        } catch (IOException e) {
            logger.atError().setCause(e).log("Unable to run predicate {} of instance {}", input.index(), input.instanceId());
            return PredicateStatus.FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PredicateStatus.FAILED;
        } finally {
            deleteQuietly(job);
            deleteQuietly(stdout);
            deleteQuietly(stderr);
        }
    }

    static PredicateStatus parseResult(List<String> lines) {
        for (String line : lines) {
            if (line.startsWith(PredicateWorker.RESULT_PREFIX)) {
                var value = line.substring(PredicateWorker.RESULT_PREFIX.length()).strip();
                return PredicateWorker.PASSED.equals(value) ? PredicateStatus.PASSED : PredicateStatus.FAILED;
            }
        }
        return PredicateStatus.FAILED;
    }

    private static void logOutput(PredicateInput input, Path stderr) throws IOException {
        var output = Files.readString(stderr, StandardCharsets.UTF_8).strip();
        if (!output.isEmpty()) {
            logger.info("Captured output from predicate {} of instance {}:\n{}", input.index(), input.instanceId(), output);
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Unable to delete {}: {}", path, e.getMessage());
        }
    }
}
