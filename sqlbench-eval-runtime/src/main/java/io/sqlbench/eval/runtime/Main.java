package io.sqlbench.eval.runtime;

import com.beust.jcommander.ParameterException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.sqlbench.eval.commons.admin.DatabaseAdminException;
import io.sqlbench.eval.runtime.model.InstanceReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

import static io.sqlbench.eval.commons.config.ConfigConstants.CONFIG_PATH;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_NO_INPUT = 1;
    public static final int EXIT_ADMIN_FAILURE = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String[] args) {
        CommandLine.Arguments arguments;
        try {
            arguments = CommandLine.parse(args);
        } catch (ParameterException e) {
            System.err.println(e.getMessage());
            CommandLine.usage();
            return EXIT_NO_INPUT;
        }
        var config = arguments.config().withFallback(ConfigFactory.load()).resolve().getConfig(CONFIG_PATH);

        List<ObjectNode> records;
        try {
            records = InstanceReader.read(arguments.input());
        } catch (IOException e) {
            logger.error("Unable to read {}: {}", arguments.input(), e.getMessage());
            return EXIT_NO_INPUT;
        }
        if (records.isEmpty()) {
            logger.error("No data found in {}", arguments.input());
            return EXIT_NO_INPUT;
        }
        if (arguments.limit() != null && arguments.limit() < records.size()) {
            records = records.subList(0, Math.max(arguments.limit(), 0));
        }
        return evaluate(config, records, arguments);
    }

    static int evaluate(Config config, List<ObjectNode> records, CommandLine.Arguments arguments) {
        var outputDirectory = arguments.experimentDirectory();
        try (var evaluation = Evaluation.fromConfig(config)) {
            var report = evaluation.run(records, outputDirectory);
            if (report.hasFatalErrors()) {
                logger.error("{} database administration error(s), see {}", report.fatalErrors().size(), outputDirectory);
                return EXIT_ADMIN_FAILURE;
            }
            return EXIT_OK;
        } catch (DatabaseAdminException e) {
            logger.atError().setCause(e).log("Unable to provision ephemeral databases");
            return EXIT_ADMIN_FAILURE;
        } catch (IOException e) {
            logger.atError().setCause(e).log("Unable to write results to {}", outputDirectory);
            return EXIT_NO_INPUT;
        }
    }
}
