package io.sqlbench.eval.runtime.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Routes the current thread's log events to a file through {@link LogFileFilter#LOG_FILE_KEY}.
 * File appenders append, so a file left by an earlier run is removed first.
 */
public final class LogFiles {
    private static final Logger logger = LoggerFactory.getLogger(LogFiles.class);

    public static final String EXTENSION = ".log";

    private LogFiles() {
    }

    /**
     * @param base log file path without {@link #EXTENSION}
     * @return the previous value, for {@link #restore}
     */
    public static String route(Path base) {
        var previous = MDC.get(LogFileFilter.LOG_FILE_KEY);
        try {
            Files.deleteIfExists(Path.of(base + EXTENSION));
        } catch (IOException e) {
            logger.warn("Unable to remove old log file {}{}: {}", base, EXTENSION, e.getMessage());
        }
        MDC.put(LogFileFilter.LOG_FILE_KEY, base.toString());
        return previous;
    }

    public static void restore(String previous) {
        if (previous == null) {
            MDC.remove(LogFileFilter.LOG_FILE_KEY);
        } else {
            MDC.put(LogFileFilter.LOG_FILE_KEY, previous);
        }
    }
}
