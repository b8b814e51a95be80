package cn.leancloud.kafka.dispatch;

import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.RetriableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The default {@link ClientErrorHandler} which only logs the client errors.
 */
public final class LoggingClientErrorHandler implements ClientErrorHandler {
    private static final Logger logger = LoggerFactory.getLogger(LoggingClientErrorHandler.class);

    @Override
    public void onError(KafkaException error) {
        if (error instanceof RetriableException) {
            logger.warn("Kafka client got retriable error.", error);
        } else {
            logger.error("Kafka client got fatal error.", error);
        }
    }
}
