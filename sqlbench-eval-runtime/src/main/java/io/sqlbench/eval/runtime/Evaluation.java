package io.sqlbench.eval.runtime;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.typesafe.config.Config;
import io.sqlbench.eval.commons.ConnectionPool;
import io.sqlbench.eval.commons.DatabaseConfig;
import io.sqlbench.eval.commons.HikariConnectionPool;
import io.sqlbench.eval.commons.QueryExecutor;
import io.sqlbench.eval.commons.QuerySettings;
import io.sqlbench.eval.commons.admin.DatabaseAdmin;
import io.sqlbench.eval.commons.admin.DatabaseAdminException;
import io.sqlbench.eval.commons.config.ConfigConstants;
import io.sqlbench.eval.commons.pool.EphemeralDatabasePool;
import io.sqlbench.eval.runtime.logging.LogFileFilter;
import io.sqlbench.eval.runtime.logging.LogFiles;
import io.sqlbench.eval.runtime.model.BenchmarkInstance;
import io.sqlbench.eval.runtime.model.InstanceOutcome;
import io.sqlbench.eval.runtime.model.InstanceReader;
import io.sqlbench.eval.runtime.pipeline.EvaluationMetrics;
import io.sqlbench.eval.runtime.pipeline.InstancePipeline;
import io.sqlbench.eval.runtime.pipeline.RunStatistics;
import io.sqlbench.eval.runtime.predicate.ConnectionOpener;
import io.sqlbench.eval.runtime.predicate.PredicateExecutor;
import io.sqlbench.eval.runtime.predicate.ProcessPredicateExecutor;
import io.sqlbench.eval.runtime.predicate.ThreadPredicateExecutor;
import io.sqlbench.eval.runtime.report.ReportWriter;
import io.sqlbench.eval.runtime.report.RunReport;
import io.sqlbench.eval.runtime.report.StatusWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static io.sqlbench.eval.commons.config.ConfigConstants.*;

/**
 * One evaluation run: provisions clones, evaluates every instance on a fixed pool of workers and
 * writes the report. Closing releases connection pools, predicate workers and clones.
 */
public class Evaluation implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(Evaluation.class);

    public static final String RUN_LOG = "evaluation";

    private final EvaluationOptions options;
    private final ConnectionPool connectionPool;
    private final EphemeralDatabasePool databasePool;
    private final QueryExecutor executor;
    private final PredicateExecutor predicateExecutor;
    private final EvaluationMetrics metrics = new EvaluationMetrics();

    public Evaluation(EvaluationOptions options,
                      ConnectionPool connectionPool,
                      DatabaseAdmin admin,
                      QuerySettings querySettings,
                      PredicateExecutor predicateExecutor) {
        this.options = options;
        this.connectionPool = connectionPool;
        this.databasePool = new EphemeralDatabasePool(admin, connectionPool, options.acquireTimeout());
        this.executor = new QueryExecutor(connectionPool, querySettings);
        this.predicateExecutor = predicateExecutor;
    }

    public static Evaluation fromConfig(Config config) {
        var databaseConfig = DatabaseConfig.fromConfig(config);
        var querySettings = QuerySettings.fromConfig(config);
        logger.info("Evaluating against {}", databaseConfig);
        return new Evaluation(EvaluationOptions.fromConfig(config),
                new HikariConnectionPool(databaseConfig),
                DatabaseAdmin.fromConfig(config),
                querySettings,
                predicateExecutor(config, databaseConfig, querySettings));
    }

    static PredicateExecutor predicateExecutor(Config config, DatabaseConfig databaseConfig, QuerySettings querySettings) {
        var isolation = config.getString(PREDICATE_PREFIX + "." + ISOLATION_KEY);
        var budget = ConfigConstants.getPredicateTimeout(config);
        return switch (isolation) {
            case ISOLATION_PROCESS -> new ProcessPredicateExecutor(databaseConfig, querySettings, budget);
            case ISOLATION_THREAD -> new ThreadPredicateExecutor(ConnectionOpener.of(databaseConfig), querySettings, budget);
            default -> throw new IllegalArgumentException("Unknown predicate isolation: " + isolation);
        };
    }

    /**
     * @param records input records, in input order
     * @param outputDirectory where the report, status file, run log and instance logs go
     * @throws DatabaseAdminException when the clones cannot be provisioned
     */
    public RunReport run(List<ObjectNode> records, Path outputDirectory) throws IOException {
        Files.createDirectories(outputDirectory);
        var runLog = outputDirectory.resolve(RUN_LOG);
        var previousLog = LogFiles.route(runLog);
        try {
            return evaluate(records, outputDirectory, runLog);
        } finally {
            LogFiles.restore(previousLog);
        }
    }

    private RunReport evaluate(List<ObjectNode> records, Path outputDirectory, Path runLog) throws IOException {
        var instances = InstanceReader.parse(records);
        var baseNames = new LinkedHashSet<String>();
        for (BenchmarkInstance instance : instances) {
            if (instance.database() != null) {
                baseNames.add(instance.database());
            }
        }
        logger.info("=== Starting evaluation of {} instance(s) with {} thread(s) ===", instances.size(), options.threads());
        databasePool.provision(baseNames, options.copiesPerDatabase());

        var statistics = new RunStatistics();
        var pipeline = new InstancePipeline(databasePool, executor, predicateExecutor, statistics, metrics,
                options.perInstanceLogs() ? outputDirectory : null);
        var fatalErrors = new ArrayList<String>();
        var outcomes = new ArrayList<InstanceOutcome>(instances.size());

        ExecutorService workers = Executors.newFixedThreadPool(options.threads());
        try {
            var futures = new ArrayList<Future<InstanceOutcome>>(instances.size());
            for (BenchmarkInstance instance : instances) {
                futures.add(workers.submit(() -> {
                    MDC.put(LogFileFilter.LOG_FILE_KEY, runLog.toString());
                    try {
                        return pipeline.run(instance);
                    } finally {
                        MDC.remove(LogFileFilter.LOG_FILE_KEY);
                    }
                }));
            }
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(collect(futures.get(i), instances.get(i), statistics, fatalErrors));
            }
        } finally {
            workers.shutdownNow();
        }

        var report = RunReport.of(statistics.snapshot(), outcomes, records, LocalDateTime.now(),
                metrics.meanMillis(), fatalErrors);
        var reportPath = ReportWriter.write(report, outputDirectory);
        logger.info("Overall accuracy: {}%", String.format(Locale.ROOT, "%.2f", report.statistics().overallAccuracy()));
        logger.info("Report written to {}", reportPath);
        if (options.writeStatus()) {
            logger.info("Status written to {}", StatusWriter.write(report, outputDirectory));
        }
        return report;
    }

    private static InstanceOutcome collect(Future<InstanceOutcome> future,
                                           BenchmarkInstance instance,
                                           RunStatistics statistics,
                                           List<String> fatalErrors) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            var cause = e.getCause();
            String message;
            if (cause instanceof DatabaseAdminException) {
                message = "Database reset failed: " + cause.getMessage();
                fatalErrors.add("Instance %s: %s".formatted(instance.instanceId(), cause.getMessage()));
            } else {
                message = "Unexpected error: " + cause;
            }
            logger.atError().setCause(cause).log("Instance {} failed", instance.instanceId());
            var outcome = InstanceOutcome.executionFailure(instance, message);
            statistics.record(outcome);
            return outcome;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for instance " + instance.instanceId(), e);
        }
    }

    public EvaluationMetrics metrics() {
        return metrics;
    }

    @Override
    public void close() {
        closeQuietly(predicateExecutor, "predicate executor");
        closeQuietly(connectionPool, "connection pools");
        closeQuietly(databasePool, "ephemeral databases");
    }

    private static void closeQuietly(AutoCloseable closeable, String name) {
        if (closeable != null) {
            try {
                closeable.close();
                logger.info("{} closed", name);
            } catch (Exception e) {
                logger.error("Error closing {}", name, e);
            }
        }
    }
}
