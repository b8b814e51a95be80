package cn.leancloud.kafka.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The default {@link ErrorReporter} which logs the error with its stack trace.
 */
public final class LoggingErrorReporter implements ErrorReporter {
    private static final Logger defaultLogger = LoggerFactory.getLogger(LoggingErrorReporter.class);

    private final Logger logger;

    public LoggingErrorReporter() {
        this(defaultLogger);
    }

    /**
     * @param logger the logger to write errors to, usually the {@code logger} of a {@link ResolvedConfig}
     */
    public LoggingErrorReporter(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void report(Throwable error, String context) {
        logger.error(context, error);
    }
}
