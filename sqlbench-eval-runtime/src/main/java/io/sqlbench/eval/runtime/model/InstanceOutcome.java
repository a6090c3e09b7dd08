package io.sqlbench.eval.runtime.model;

import java.util.List;

/**
 * Final result of one instance. {@code status} is {@link #FAILED} iff one of the error flags is set.
 *
 * @param failedPredicates identifiers {@code test_<n>} of the predicates that did not pass, 1-based
 */
public record InstanceOutcome(String instanceId,
                              String status,
                              boolean executionError,
                              boolean timeoutError,
                              boolean assertionError,
                              int passedPredicates,
                              int totalPredicates,
                              List<String> failedPredicates,
                              String errorMessage,
                              boolean efficiency) {

    public static final String SUCCESS = "success";
    public static final String FAILED = "failed";

    public InstanceOutcome {
        failedPredicates = List.copyOf(failedPredicates);
    }

    public static InstanceOutcome of(String instanceId,
                                     boolean executionError,
                                     boolean timeoutError,
                                     boolean assertionError,
                                     int passedPredicates,
                                     int totalPredicates,
                                     List<String> failedPredicates,
                                     String errorMessage,
                                     boolean efficiency) {
        var status = executionError || timeoutError || assertionError ? FAILED : SUCCESS;
        return new InstanceOutcome(instanceId, status, executionError, timeoutError, assertionError,
                passedPredicates, totalPredicates, failedPredicates, errorMessage, efficiency);
    }

    /**
     * An instance that never reached predicate evaluation.
     */
    public static InstanceOutcome executionFailure(BenchmarkInstance instance, String errorMessage) {
        return of(instance.instanceId(), true, false, false, 0,
                instance.effectivePredicates().size(), List.of(), errorMessage, instance.efficiency());
    }

    public static String predicateId(int index) {
        return "test_" + index;
    }

    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }
}
