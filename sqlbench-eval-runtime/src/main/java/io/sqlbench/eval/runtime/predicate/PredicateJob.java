package io.sqlbench.eval.runtime.predicate;

import io.sqlbench.eval.commons.DatabaseConfig;
import io.sqlbench.eval.commons.QuerySettings;
import io.sqlbench.eval.runtime.model.PredicateSpec;

/**
 * What a worker process receives on stdin. The password travels in the worker's environment, never in the job.
 */
public record PredicateJob(PredicateSpec spec,
                           PredicateInput input,
                           DatabaseConfig database,
                           QuerySettings settings) {
}
