package io.sqlbench.eval.runtime.pipeline;

import io.sqlbench.eval.runtime.model.InstanceOutcome;

/**
 * Counters of one run. Updated once per finished instance.
 */
public class RunStatistics {

    private int executionErrors;
    private int timeouts;
    private int assertionErrors;
    private int passedInstances;
    private int totalInstances;

    public synchronized void record(InstanceOutcome outcome) {
        totalInstances++;
        if (outcome.executionError()) {
            executionErrors++;
        }
        if (outcome.timeoutError()) {
            timeouts++;
        }
        if (outcome.assertionError()) {
            assertionErrors++;
        }
        if (outcome.isSuccess()) {
            passedInstances++;
        }
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(totalInstances, executionErrors, timeouts, assertionErrors, passedInstances);
    }

    public record Snapshot(int totalInstances,
                           int executionErrors,
                           int timeouts,
                           int assertionErrors,
                           int passedInstances) {

        public int totalErrors() {
            return executionErrors + timeouts + assertionErrors;
        }

        /**
         * Percentage of instances without errors, 0 for an empty run. An instance with several
         * flags counts once per flag.
         */
        public double overallAccuracy() {
            if (totalInstances == 0) {
                return 0;
            }
            return (totalInstances - totalErrors()) * 100.0 / totalInstances;
        }
    }
}
