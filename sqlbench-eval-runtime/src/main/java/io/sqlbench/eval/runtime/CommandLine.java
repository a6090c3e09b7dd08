package io.sqlbench.eval.runtime;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;

import java.nio.file.Path;
import java.util.List;

import static io.sqlbench.eval.commons.config.ConfigConstants.*;

/**
 * Command line arguments. {@code --conf key=value} entries use Typesafe Config syntax and override
 * every other configuration source.
 */
public final class CommandLine {

    public record Arguments(Config config, Path input, Integer limit, Path outputDirectory) {

        /**
         * Directory for this input's artifacts: {@code <output>/<input name without extension>}.
         */
        public Path experimentDirectory() {
            var base = outputDirectory != null ? outputDirectory : input.toAbsolutePath().getParent();
            var name = input.getFileName().toString();
            int dot = name.lastIndexOf('.');
            return base.resolve(dot > 0 ? name.substring(0, dot) : name);
        }
    }

    private CommandLine() {
    }

    /**
     * @throws com.beust.jcommander.ParameterException for unknown or missing arguments
     */
    public static Arguments parse(String[] args) {
        var argv = new Args();
        JCommander.newBuilder()
                .addObject(argv)
                .programName("sqlbench-eval")
                .build()
                .parse(args);
        var buffer = new StringBuilder();
        if (argv.configs != null) {
            argv.configs.forEach(c -> {
                buffer.append(c);
                buffer.append("\n");
            });
        }
        var config = ConfigFactory.parseString(buffer.toString());
        if (argv.threads != null) {
            config = config.withValue(CONFIG_PATH + "." + THREADS_KEY, ConfigValueFactory.fromAnyRef(argv.threads));
        }
        return new Arguments(config,
                Path.of(argv.input),
                argv.limit,
                argv.outputDirectory == null ? null : Path.of(argv.outputDirectory));
    }

    public static void usage() {
        JCommander.newBuilder().addObject(new Args()).programName("sqlbench-eval").build().usage();
    }

    static class Args {
        @Parameter(names = {"--input"}, description = "JSONL file with one benchmark instance per line", required = true)
        private String input;

        @Parameter(names = {"--limit"}, description = "Evaluate only the first n instances")
        private Integer limit;

        @Parameter(names = {"--threads"}, description = "Number of worker threads")
        private Integer threads;

        @Parameter(names = {"--output-dir"}, description = "Output directory, defaults to the input file's directory")
        private String outputDirectory;

        @Parameter(names = {"--conf"}, description = "Configurations")
        private List<String> configs;
    }
}
