package cn.leancloud.kafka.dispatch;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.concurrent.ExecutionException;

import static cn.leancloud.kafka.dispatch.RetryTopics.RETRY_MESSAGE_HEADER;
import static cn.leancloud.kafka.dispatch.RetryTopics.RETRY_TIMESTAMP_HEADER;
import static cn.leancloud.kafka.dispatch.RetryTopics.header;

/**
 * Sends failed records to the retry topic of their next attempt.
 */
class RetryEscalator<K, V> {
    private static final Logger logger = LoggerFactory.getLogger(RetryEscalator.class);

    private final String groupId;
    private final Producer<K, V> producer;
    private final Time time;

    RetryEscalator(String groupId, Producer<K, V> producer, Time time) {
        this.groupId = groupId;
        this.producer = producer;
        this.time = time;
    }

    /**
     * Try to send a failed record to its retry topic.
     *
     * @param record the failed record
     * @param error  the error thrown on handling {@code record}
     * @param policy the retry policy of the record's topic, null when retry is disabled
     * @return true only when the record was sent to a retry topic successfully
     */
    boolean retry(ConsumerRecord<K, V> record, Exception error, @Nullable RetryPolicy policy) {
        if (policy == null) {
            return false;
        }

        final int attempt = RetryTopics.attemptOf(groupId, record.topic()) + 1;
        if (!policy.shouldRetry(error, attempt)) {
            logger.debug("Record at offset {} of {}-{} will not be retried, attempt: {}, policy: {}",
                    record.offset(), record.topic(), record.partition(), attempt, policy);
            return false;
        }

        final String mainTopic = RetryTopics.mainTopicOf(groupId, record.topic());
        final String retryTopic = RetryTopics.retryTopic(groupId, mainTopic, attempt);
        final long dueTime = dueTime(policy.delayFor(attempt));
        try {
            producer.send(RetryTopics.forward(record, retryTopic,
                    header(RETRY_MESSAGE_HEADER, RetryTopics.messageOf(error)),
                    header(RETRY_TIMESTAMP_HEADER, Long.toString(dueTime))))
                    .get();
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted on sending record at offset {} of {}-{} to retry topic {}",
                    record.offset(), record.topic(), record.partition(), retryTopic);
            return false;
        } catch (ExecutionException ex) {
            logger.warn("Send record at offset " + record.offset() + " of " + record.topic() + "-" + record.partition() +
                    " to retry topic " + retryTopic + " failed.", ex.getCause());
            return false;
        } catch (RuntimeException ex) {
            logger.warn("Send record at offset " + record.offset() + " of " + record.topic() + "-" + record.partition() +
                    " to retry topic " + retryTopic + " failed.", ex);
            return false;
        }
    }

    private long dueTime(Duration delay) {
        final long now = time.milliseconds();
        long delayMillis;
        try {
            delayMillis = delay.toMillis();
        } catch (ArithmeticException ex) {
            delayMillis = Long.MAX_VALUE;
        }
        return delayMillis > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + delayMillis;
    }
}
