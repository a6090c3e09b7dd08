package io.sqlbench.eval.runtime.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;

/**
 * Lets an event through only when its MDC names a log file. Keeps a sifting appender from creating
 * a default file for events logged outside an evaluation.
 *
 * <p>Usage in logback.xml:</p>
 * <pre>{@code
 * <appender name="SIFT" class="ch.qos.logback.classic.sift.SiftingAppender">
 *     <filter class="io.sqlbench.eval.runtime.logging.LogFileFilter"/>
 *     ...
 * </appender>
 * }</pre>
 */
public class LogFileFilter extends Filter<ILoggingEvent> {

    public static final String LOG_FILE_KEY = "log_file";

    private String key = LOG_FILE_KEY;

    public void setKey(String key) {
        this.key = key;
    }

    @Override
    public FilterReply decide(ILoggingEvent event) {
        var mdc = event.getMDCPropertyMap();
        return mdc != null && mdc.containsKey(key) ? FilterReply.NEUTRAL : FilterReply.DENY;
    }
}
