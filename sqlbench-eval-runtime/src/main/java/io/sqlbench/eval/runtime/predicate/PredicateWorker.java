package io.sqlbench.eval.runtime.predicate;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.sqlbench.eval.commons.DatabaseConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.PrintStream;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Entry point of a predicate worker process. Reads a {@link PredicateJob} from stdin and prints a
 * single result line on stdout. Everything else the predicate prints goes to stderr.
 */
public class PredicateWorker {
    private static final Logger logger = LoggerFactory.getLogger(PredicateWorker.class);

    public static final String RESULT_PREFIX = "SQLBENCH_PREDICATE_RESULT=";
    public static final String PASSED = "passed";
    public static final String FAILED = "failed";
    public static final String PASSWORD_ENV = "SQLBENCH_WORKER_PASSWORD";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static void main(String[] args) {
        var result = System.out;
        System.setOut(System.err);
        boolean passed = run(System.in, System.getenv(PASSWORD_ENV));
        report(result, passed);
        System.exit(passed ? 0 : 1);
    }

    static boolean run(InputStream in, String password) {
        try {
            var job = MAPPER.readValue(in, PredicateJob.class);
            var predicate = Predicates.create(job.spec());
            if (!predicate.requiresConnection()) {
                return Predicates.evaluate(predicate, job.spec(), job.input(), null, job.settings());
            }
            try (var connection = open(job, password)) {
                return Predicates.evaluate(predicate, job.spec(), job.input(), connection, job.settings());
            }
        } catch (Exception e) {
            logger.info("Predicate failed: {}", e.toString());
            return false;
        }
    }

    static void report(PrintStream out, boolean passed) {
        out.println(RESULT_PREFIX + (passed ? PASSED : FAILED));
        out.flush();
    }

    private static Connection open(PredicateJob job, String password) throws SQLException {
        var config = job.database();
        var withPassword = new DatabaseConfig(config.host(), config.port(), config.user(),
                password == null ? "" : password, config.minConnections(), config.maxConnections(),
                config.maintenanceDatabase());
        return ConnectionOpener.of(withPassword).open(job.input().database());
    }
}
