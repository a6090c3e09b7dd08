package io.sqlbench.eval.commons.pool;

import io.sqlbench.eval.commons.ConnectionPool;
import io.sqlbench.eval.commons.admin.DatabaseAdmin;
import io.sqlbench.eval.commons.admin.DatabaseAdminException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Bounded pools of clone databases, one queue per base database. A clone is either queued or
 * checked out by exactly one caller, and is reset from its template before it is queued again.
 */
public class EphemeralDatabasePool implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(EphemeralDatabasePool.class);

    public static final String CLONE_INFIX = "_process_";

    private final DatabaseAdmin admin;
    private final ConnectionPool connectionPool;
    private final Duration acquireTimeout;

    private final Map<String, BlockingQueue<EphemeralDatabase>> queues = new ConcurrentHashMap<>();
    private final Set<EphemeralDatabase> checkedOut = ConcurrentHashMap.newKeySet();
    private final Set<EphemeralDatabase> created = ConcurrentHashMap.newKeySet();
    private boolean closed = false;

    public EphemeralDatabasePool(DatabaseAdmin admin, ConnectionPool connectionPool, Duration acquireTimeout) {
        this.admin = admin;
        this.connectionPool = connectionPool;
        this.acquireTimeout = acquireTimeout;
    }

    public static String cloneName(String baseName, int index) {
        return baseName + CLONE_INFIX + index;
    }

    /**
     * Create {@code copies} clones of every base database from its template.
     *
     * @throws DatabaseAdminException when a clone cannot be created
     */
    public synchronized void provision(Collection<String> baseNames, int copies) {
        if (copies < 1) {
            throw new IllegalArgumentException("copies must be positive: " + copies);
        }
        for (String baseName : new LinkedHashSet<>(baseNames)) {
            if (queues.containsKey(baseName)) {
                continue;
            }
            var queue = new ArrayBlockingQueue<EphemeralDatabase>(copies);
            var template = DatabaseAdmin.templateName(baseName);
            for (int i = 1; i <= copies; i++) {
                var database = new EphemeralDatabase(cloneName(baseName, i), baseName);
                try {
                    admin.dropDatabase(database.name(), true);
                } catch (DatabaseAdminException e) {
                    logger.warn("Unable to drop stale clone {}: {}", database.name(), e.getMessage());
                }
                admin.createDatabase(database.name(), template);
                created.add(database);
                queue.add(database);
            }
            queues.put(baseName, queue);
            logger.info("Provisioned {} clone(s) of {}", copies, baseName);
        }
    }

    /**
     * @throws NoEphemeralDatabaseException when no clone frees up within the acquire timeout
     */
    public EphemeralDatabase acquire(String baseName) {
        var queue = baseName == null ? null : queues.get(baseName);
        if (queue == null) {
            throw new NoEphemeralDatabaseException("No ephemeral databases for " + baseName);
        }
        try {
            var database = queue.poll(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (database == null) {
                throw new NoEphemeralDatabaseException(
                        "Timed out after %s waiting for a clone of %s".formatted(acquireTimeout, baseName));
            }
            checkedOut.add(database);
            logger.debug("Acquired {}", database.name());
            return database;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NoEphemeralDatabaseException("Interrupted waiting for a clone of " + baseName);
        }
    }

    /**
     * Restore a checked out clone from its template. Its connection pool is closed first.
     */
    public void reset(EphemeralDatabase database) {
        requireCheckedOut(database);
        logger.debug("Resetting {}", database.name());
        connectionPool.close(database.name());
        admin.terminateConnections(database.name());
        admin.dropDatabase(database.name(), true);
        admin.createDatabase(database.name(), DatabaseAdmin.templateName(database.baseName()));
    }

    public void release(EphemeralDatabase database) {
        checkIn(database);
        var queue = queues.get(database.baseName());
        if (!queue.offer(database)) {
            throw new IllegalStateException("Pool for " + database.baseName() + " is already full");
        }
        logger.debug("Released {}", database.name());
    }

    /**
     * Withdraw a checked out clone that could not be reset. It is never handed out again.
     */
    public void retire(EphemeralDatabase database) {
        checkIn(database);
        logger.warn("Retired {} after a failed reset", database.name());
    }

    public int available(String baseName) {
        var queue = queues.get(baseName);
        return queue == null ? 0 : queue.size();
    }

    public Set<String> baseNames() {
        return Set.copyOf(queues.keySet());
    }

    /**
     * Drop every clone this pool created. Failures are logged.
     */
    public synchronized void teardown() {
        if (closed) {
            return;
        }
        closed = true;
        List<EphemeralDatabase> toDrop = new ArrayList<>(created);
        toDrop.sort((a, b) -> a.name().compareTo(b.name()));
        for (EphemeralDatabase database : toDrop) {
            try {
                connectionPool.close(database.name());
                admin.dropDatabase(database.name(), true);
            } catch (RuntimeException e) {
                logger.atError().setCause(e).log("Unable to drop clone {}", database.name());
            }
        }
        queues.clear();
        checkedOut.clear();
        created.clear();
    }

    @Override
    public void close() {
        teardown();
    }

    private void checkIn(EphemeralDatabase database) {
        if (!checkedOut.remove(database)) {
            throw new IllegalStateException(database.name() + " is not checked out from this pool");
        }
    }

    private void requireCheckedOut(EphemeralDatabase database) {
        if (!checkedOut.contains(database)) {
            throw new IllegalStateException(database.name() + " is not checked out from this pool");
        }
    }
}
