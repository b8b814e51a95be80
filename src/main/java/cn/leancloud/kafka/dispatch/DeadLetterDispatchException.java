package cn.leancloud.kafka.dispatch;

import org.apache.kafka.clients.consumer.ConsumerRecord;

/**
 * Thrown when a failed record could not be sent to its dead letter topic. There's no way left to keep the record,
 * so this exception stops the {@link TopicConsumer}.
 */
public final class DeadLetterDispatchException extends RuntimeException {
    private final transient ConsumerRecord<?, ?> record;

    public DeadLetterDispatchException(ConsumerRecord<?, ?> record, String message, Throwable cause) {
        super(message, cause);
        this.record = record;
    }

    /**
     * @return the record failed to be sent to the dead letter topic
     */
    public ConsumerRecord<?, ?> record() {
        return record;
    }
}
