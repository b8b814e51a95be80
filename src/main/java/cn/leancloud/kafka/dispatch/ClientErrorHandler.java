package cn.leancloud.kafka.dispatch;

import org.apache.kafka.common.KafkaException;

/**
 * A callback to handle errors raised by the underlying Kafka client itself, like a broker connection failure
 * or a coordinator error. It is never called for errors thrown by {@link TopicHandler}s.
 * <p>
 * An instance is created once for each resolved configuration and saved under the {@code error_cb} key.
 */
public interface ClientErrorHandler {
    /**
     * Handle an error raised from polling the underlying Kafka consumer.
     *
     * @param error the error raised by the client
     */
    void onError(KafkaException error);
}
