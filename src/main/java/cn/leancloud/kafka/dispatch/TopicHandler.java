package cn.leancloud.kafka.dispatch;

import org.apache.kafka.clients.consumer.ConsumerRecord;

import javax.annotation.Nullable;

/**
 * A handler to handle all the records consumed from one Kafka topic.
 *
 * @param <K> the type of key for records consumed from Kafka
 * @param <V> the type of value for records consumed from Kafka
 */
public interface TopicHandler<K, V> {
    /**
     * Handle a {@link ConsumerRecord} consumed from the topic this handler registered with.
     * <p>
     * Any exception thrown from this method does not stop the {@link TopicConsumer}. The failed record is sent to
     * the retry topic when {@link #retryPolicy()} allows, otherwise to the dead letter topic.
     *
     * @param record the consumed {@link ConsumerRecord}
     * @throws Exception if the record can not be handled
     */
    void consume(ConsumerRecord<K, V> record) throws Exception;

    /**
     * @return the {@link RetryPolicy} for failed records, or null to send failed records to the dead letter topic
     * directly
     */
    @Nullable
    default RetryPolicy retryPolicy() {
        return null;
    }
}
