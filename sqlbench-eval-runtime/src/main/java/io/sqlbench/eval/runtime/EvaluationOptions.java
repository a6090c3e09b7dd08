package io.sqlbench.eval.runtime;

import com.typesafe.config.Config;
import io.sqlbench.eval.commons.config.ConfigConstants;

import java.time.Duration;

import static io.sqlbench.eval.commons.config.ConfigConstants.*;

/**
 * @param copiesPerDatabase clones provisioned per base database
 * @param perInstanceLogs write one log file per instance next to the report
 */
public record EvaluationOptions(int threads,
                               int copiesPerDatabase,
                               Duration acquireTimeout,
                               boolean perInstanceLogs,
                               boolean writeStatus) {

    public static EvaluationOptions fromConfig(Config config) {
        var output = config.getConfig(OUTPUT_PREFIX);
        return new EvaluationOptions(ConfigConstants.getThreads(config),
                ConfigConstants.getCopiesPerDatabase(config),
                ConfigConstants.getAcquireTimeout(config),
                output.getBoolean(PER_INSTANCE_LOGS_KEY),
                output.getBoolean(WRITE_STATUS_KEY));
    }
}
