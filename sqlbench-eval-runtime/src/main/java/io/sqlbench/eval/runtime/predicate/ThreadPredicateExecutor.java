package io.sqlbench.eval.runtime.predicate;

import io.sqlbench.eval.commons.QuerySettings;
import io.sqlbench.eval.runtime.model.PredicateSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs each predicate on its own daemon thread with its own connection. When the budget expires
 * the thread is interrupted and its connection aborted, and the caller moves on without waiting.
 */
public class ThreadPredicateExecutor implements PredicateExecutor {
    private static final Logger logger = LoggerFactory.getLogger(ThreadPredicateExecutor.class);

    private final ConnectionOpener opener;
    private final QuerySettings settings;
    private final Duration budget;

    public ThreadPredicateExecutor(ConnectionOpener opener, QuerySettings settings, Duration budget) {
        this.opener = opener;
        this.settings = settings;
        this.budget = budget;
    }

    @Override
    public PredicateStatus execute(PredicateSpec spec, PredicateInput input) {
        var connection = new AtomicReference<Connection>();
        var expired = new AtomicBoolean(false);
        var task = new FutureTask<>(() -> {
            var predicate = Predicates.create(spec);
            if (predicate.requiresConnection()) {
                connection.set(opener.open(input.database()));
            }
            try {
                // the budget may run out while connecting, before the connection could be aborted
                if (expired.get()) {
                    throw new CancellationException("Budget expired while connecting");
                }
                return Predicates.evaluate(predicate, spec, input, connection.get(), settings);
            } finally {
                closeQuietly(connection.get());
            }
        });
        var thread = new Thread(task, "predicate-%s-%d".formatted(input.instanceId(), input.index()));
        thread.setDaemon(true);
        thread.start();
        try {
            boolean passed = task.get(budget.toMillis(), TimeUnit.MILLISECONDS);
            return passed ? PredicateStatus.PASSED : PredicateStatus.FAILED;
        } catch (TimeoutException e) {
            logger.error("Predicate {} of instance {} timed out after {}", input.index(), input.instanceId(), budget);
            expired.set(true);
            task.cancel(true);
            abort(connection.get());
            return PredicateStatus.TIMEOUT;
        } catch (ExecutionException e) {
            var cause = e.getCause() == null ? e : e.getCause();
            logger.info("Predicate {} of instance {} failed: {}", input.index(), input.instanceId(), cause.toString());
            return PredicateStatus.FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            expired.set(true);
            task.cancel(true);
            abort(connection.get());
            return PredicateStatus.FAILED;
        }
    }

    private static void abort(Connection connection) {
        if (connection == null) {
            return;
        }
        try {
            connection.abort(Runnable::run);
        } catch (SQLException | UnsupportedOperationException e) {
            logger.debug("Abort not supported, closing instead: {}", e.getMessage());
            closeQuietly(connection);
        }
    }

    private static void closeQuietly(Connection connection) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            logger.warn("Error closing predicate connection: {}", e.getMessage());
        }
    }
}
