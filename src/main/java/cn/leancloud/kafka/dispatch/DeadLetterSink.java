package cn.leancloud.kafka.dispatch;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.common.utils.Utils;

import java.util.concurrent.ExecutionException;

import static cn.leancloud.kafka.dispatch.RetryTopics.DEAD_LETTER_DETAIL_HEADER;
import static cn.leancloud.kafka.dispatch.RetryTopics.DEAD_LETTER_MESSAGE_HEADER;
import static cn.leancloud.kafka.dispatch.RetryTopics.header;

/**
 * Sends records which can not be handled or retried to the dead letter topic, with the error message and the
 * stack trace of the error in headers.
 */
class DeadLetterSink<K, V> {
    private final String groupId;
    private final Producer<K, V> producer;

    DeadLetterSink(String groupId, Producer<K, V> producer) {
        this.groupId = groupId;
        this.producer = producer;
    }

    /**
     * @param record the failed record
     * @param error  the last error thrown on handling {@code record}
     * @throws DeadLetterDispatchException if the record was not sent to the dead letter topic
     */
    void send(ConsumerRecord<K, V> record, Exception error) {
        final String deadLetterTopic = RetryTopics.deadLetterTopic(groupId, RetryTopics.mainTopicOf(groupId, record.topic()));
        try {
            producer.send(RetryTopics.forward(record, deadLetterTopic,
                    header(DEAD_LETTER_MESSAGE_HEADER, RetryTopics.messageOf(error)),
                    header(DEAD_LETTER_DETAIL_HEADER, Utils.stackTrace(error))))
                    .get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new DeadLetterDispatchException(record, "interrupted on sending record to " + deadLetterTopic, ex);
        } catch (ExecutionException ex) {
            throw new DeadLetterDispatchException(record, "send record to " + deadLetterTopic + " failed", ex.getCause());
        } catch (RuntimeException ex) {
            throw new DeadLetterDispatchException(record, "send record to " + deadLetterTopic + " failed", ex);
        }
    }
}
