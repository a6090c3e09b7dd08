package io.sqlbench.eval.commons.pool;

/**
 * Handle to one clone of a base database. Owned by at most one worker at a time.
 */
public record EphemeralDatabase(String name, String baseName) {
}
