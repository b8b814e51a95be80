package cn.leancloud.kafka.dispatch;

/**
 * Thrown by {@link TopicRegistry#lookup(String)} when no {@link TopicHandler} was registered for a topic.
 */
public final class UnknownTopicException extends RuntimeException {
    private final String topic;

    public UnknownTopicException(String topic) {
        super("no handler registered for topic: " + topic);
        this.topic = topic;
    }

    public String topic() {
        return topic;
    }
}
