package io.sqlbench.eval.runtime.pipeline;

import io.sqlbench.eval.commons.ExecutionResult;
import io.sqlbench.eval.commons.QueryExecutor;
import io.sqlbench.eval.commons.admin.DatabaseAdminException;
import io.sqlbench.eval.commons.pool.EphemeralDatabase;
import io.sqlbench.eval.commons.pool.EphemeralDatabasePool;
import io.sqlbench.eval.commons.pool.NoEphemeralDatabaseException;
import io.sqlbench.eval.runtime.model.BenchmarkInstance;
import io.sqlbench.eval.runtime.logging.LogFileFilter;
import io.sqlbench.eval.runtime.logging.LogFiles;
import io.sqlbench.eval.runtime.model.InstanceOutcome;
import io.sqlbench.eval.runtime.predicate.PredicateExecutor;
import io.sqlbench.eval.runtime.predicate.PredicateInput;
import io.sqlbench.eval.runtime.predicate.PredicateStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates one instance on a clone of its database:
 * acquire, preprocess, candidate, predicates, cleanup, reset, release.
 * Instance-level failures end up in the outcome. Only {@link DatabaseAdminException} escapes,
 * after the clone has been withdrawn from the pool.
 */
public class InstancePipeline {
    private static final Logger logger = LoggerFactory.getLogger(InstancePipeline.class);

    public static final String INSTANCE_LOG_PREFIX = "instance_";
    public static final String NO_DATABASE_MESSAGE = "No available ephemeral databases.";

    private final EphemeralDatabasePool databasePool;
    private final QueryExecutor executor;
    private final PredicateExecutor predicateExecutor;
    private final RunStatistics statistics;
    private final EvaluationMetrics metrics;
    private final Path instanceLogDirectory;

    /**
     * @param instanceLogDirectory directory for one log file per instance, {@code null} to log to the run log only
     */
    public InstancePipeline(EphemeralDatabasePool databasePool,
                            QueryExecutor executor,
                            PredicateExecutor predicateExecutor,
                            RunStatistics statistics,
                            EvaluationMetrics metrics,
                            Path instanceLogDirectory) {
        this.databasePool = databasePool;
        this.executor = executor;
        this.predicateExecutor = predicateExecutor;
        this.statistics = statistics;
        this.metrics = metrics;
        this.instanceLogDirectory = instanceLogDirectory;
    }

    public InstanceOutcome run(BenchmarkInstance instance) {
        var previousLog = MDC.get(LogFileFilter.LOG_FILE_KEY);
        if (instanceLogDirectory != null) {
            LogFiles.route(instanceLogDirectory.resolve(INSTANCE_LOG_PREFIX + logFileName(instance.instanceId())));
        }
        try {
            var outcome = evaluate(instance);
            statistics.record(outcome);
            metrics.recordOutcome(outcome.isSuccess());
            logger.info("Instance {} finished: {}", instance.instanceId(), outcome.status());
            return outcome;
        } finally {
            LogFiles.restore(previousLog);
        }
    }

    InstanceOutcome evaluate(BenchmarkInstance instance) {
        if (!instance.isValid()) {
            var message = "Missing fields: " + String.join(", ", instance.missingFields());
            logger.error("Instance {}: {}", instance.instanceId(), message);
            return InstanceOutcome.executionFailure(instance, message);
        }
        var predicates = instance.effectivePredicates();
        if (!instance.isQuery() && predicates.isEmpty()) {
            logger.warn("No test cases for instance {} with category {}", instance.instanceId(), instance.category());
        }

        EphemeralDatabase database;
        try {
            database = metrics.time(EvaluationMetrics.ACQUIRE, () -> databasePool.acquire(instance.database()));
        } catch (NoEphemeralDatabaseException e) {
            logger.error("Instance {}: {}", instance.instanceId(), e.getMessage());
            return InstanceOutcome.executionFailure(instance, NO_DATABASE_MESSAGE);
        }
        logger.info("Instance {} is using ephemeral database {}", instance.instanceId(), database.name());

        var state = new State(predicates.size());
        try {
            evaluateOn(instance, database.name(), state);
        } catch (RuntimeException e) {
            logger.atError().setCause(e).log("Error during evaluation of instance {}", instance.instanceId());
            state.errorMessage = e.getMessage() == null ? e.getClass().getName() : e.getMessage();
            if (!state.executionError && !state.timeoutError && !state.assertionError) {
                state.executionError = true;
            }
        } finally {
            resetAndRelease(database);
        }
        return InstanceOutcome.of(instance.instanceId(), state.executionError, state.timeoutError,
                state.assertionError, state.passed, state.total, state.failed, state.errorMessage,
                instance.efficiency());
    }

    private void evaluateOn(BenchmarkInstance instance, String database, State state) {
        Connection connection = executor.phaseConnection(database);
        ExecutionResult candidate;
        try {
            if (!instance.preprocessSql().isEmpty()) {
                var preprocess = metrics.time(EvaluationMetrics.PREPROCESS,
                        () -> executor.executeAll(instance.preprocessSql(), database, connection, "Preprocess SQL"));
                if (preprocess.failed()) {
                    logger.warn("Preprocessing of instance {} failed, continuing: {}",
                            instance.instanceId(), preprocess.errorMessage());
                }
            }
            candidate = metrics.time(EvaluationMetrics.CANDIDATE,
                    () -> executor.executeAll(instance.candidateSql(), database, connection, "Candidate SQL"));
        } finally {
            executor.release(database, connection);
        }
        state.executionError = candidate.executionError();
        state.timeoutError = candidate.timeoutError();

        if (!candidate.failed()) {
            var candidateRows = candidate.rows();
            metrics.run(EvaluationMetrics.PREDICATES, () -> runPredicates(instance, database, candidateRows, state));
        } else {
            logger.info("Skipping predicates of instance {} after candidate failure", instance.instanceId());
        }

        if (!instance.cleanupSql().isEmpty()) {
            metrics.run(EvaluationMetrics.CLEANUP, () -> {
                var cleanupConnection = executor.phaseConnection(database);
                try {
                    executor.executeAll(instance.cleanupSql(), database, cleanupConnection, "Clean Up SQL");
                } finally {
                    executor.release(database, cleanupConnection);
                }
            });
        }
    }

    private void runPredicates(BenchmarkInstance instance, String database, List<List<Object>> candidateRows, State state) {
        var predicates = instance.effectivePredicates();
        for (int i = 1; i <= predicates.size(); i++) {
            logger.info("Starting test case {}/{}", i, predicates.size());
            var status = predicateExecutor.execute(predicates.get(i - 1), PredicateInput.of(instance, database, candidateRows, i));
            if (status == PredicateStatus.PASSED) {
                state.passed++;
            } else {
                state.failed.add(InstanceOutcome.predicateId(i));
            }
        }
        if (!state.failed.isEmpty()) {
            state.assertionError = true;
        }
    }

    private void resetAndRelease(EphemeralDatabase database) {
        try {
            metrics.run(EvaluationMetrics.RESET, () -> databasePool.reset(database));
        } catch (DatabaseAdminException e) {
            databasePool.retire(database);
            throw e;
        } catch (RuntimeException e) {
            databasePool.retire(database);
            throw new DatabaseAdminException("Failed to reset " + database.name() + ": " + e.getMessage(), e);
        }
        databasePool.release(database);
        logger.info("Returned ephemeral database {}", database.name());
    }

    /**
     * Instance ids come from input data. Anything but letters, digits, {@code _}, {@code .} and
     * {@code -} is replaced so the name stays inside the log directory.
     */
    static String logFileName(String instanceId) {
        var name = instanceId.replaceAll("[^A-Za-z0-9_.-]", "_");
        return name.replace("..", "__");
    }

    private static final class State {
        final int total;
        final List<String> failed = new ArrayList<>();
        int passed;
        boolean executionError;
        boolean timeoutError;
        boolean assertionError;
        String errorMessage;

        State(int total) {
            this.total = total;
        }
    }
}
