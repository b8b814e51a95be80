package cn.leancloud.kafka.dispatch;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.util.function.BooleanSupplier;

/**
 * Handles records from a retry topic. It holds a record until the time in its {@code RETRY_TIMESTAMP} header, then
 * passes it to the handler of the main topic.
 * <p>
 * The waiting happens on the polling thread, so the retry delays must stay within {@code max.poll.interval.ms}.
 * It is done in slices of {@link #WAIT_SLICE_MS} and is abandoned as soon as the consumer is closing.
 */
final class DelayedRetryHandler<K, V> implements TopicHandler<K, V> {
    private static final Logger logger = LoggerFactory.getLogger(DelayedRetryHandler.class);

    static final long WAIT_SLICE_MS = 100L;

    private final TopicHandler<K, V> mainHandler;
    private final Time time;
    private final BooleanSupplier closing;

    DelayedRetryHandler(TopicHandler<K, V> mainHandler, Time time, BooleanSupplier closing) {
        this.mainHandler = mainHandler;
        this.time = time;
        this.closing = closing;
    }

    /**
     * @throws WakeupException    if the consumer started closing before the record was due
     * @throws InterruptException if the polling thread was interrupted before the record was due
     */
    @Override
    public void consume(ConsumerRecord<K, V> record) throws Exception {
        final long dueTime = dueTime(record);
        long waitMillis = dueTime - time.milliseconds();
        if (waitMillis > 0) {
            logger.debug("Wait {}ms before handling retried record at offset {} of {}-{}",
                    waitMillis, record.offset(), record.topic(), record.partition());
        }

        while (waitMillis > 0) {
            if (closing.getAsBoolean()) {
                logger.debug("Consumer is closing, stop waiting for retried record at offset {} of {}-{}",
                        record.offset(), record.topic(), record.partition());
                throw new WakeupException();
            }
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptException("interrupted on waiting for retried record at offset " +
                        record.offset() + " of " + record.topic() + "-" + record.partition());
            }

            time.sleep(Math.min(waitMillis, WAIT_SLICE_MS));
            waitMillis = dueTime - time.milliseconds();
        }

        mainHandler.consume(record);
    }

    @Nullable
    @Override
    public RetryPolicy retryPolicy() {
        return mainHandler.retryPolicy();
    }

    @VisibleForTesting
    TopicHandler<K, V> mainHandler() {
        return mainHandler;
    }

    private static long dueTime(ConsumerRecord<?, ?> record) {
        final Header header = record.headers().lastHeader(RetryTopics.RETRY_TIMESTAMP_HEADER);
        if (header == null || header.value() == null) {
            return 0L;
        }

        try {
            return Long.parseLong(new String(header.value(), StandardCharsets.UTF_8));
        } catch (NumberFormatException ex) {
            logger.warn("Invalid {} header on record at offset {} of {}-{}, handle it immediately",
                    RetryTopics.RETRY_TIMESTAMP_HEADER, record.offset(), record.topic(), record.partition());
            return 0L;
        }
    }
}
