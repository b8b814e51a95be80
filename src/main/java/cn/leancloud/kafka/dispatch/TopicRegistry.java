package cn.leancloud.kafka.dispatch;

import org.apache.kafka.common.utils.Time;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

import static java.util.Objects.requireNonNull;

/**
 * Maps topic names to the {@link TopicHandler}s handling records from them. It is immutable after built.
 *
 * @param <K> the type of key for records consumed from Kafka
 * @param <V> the type of value for records consumed from Kafka
 */
public final class TopicRegistry<K, V> {
    /**
     * Create a {@code Builder} used to build {@link TopicRegistry}.
     *
     * @param <K> the type of key for records consumed from Kafka
     * @param <V> the type of value for records consumed from Kafka
     * @return a new {@code Builder}
     */
    public static <K, V> Builder<K, V> newBuilder() {
        return new Builder<>();
    }

    public static final class Builder<K, V> {
        private final Map<String, TopicHandler<K, V>> handlers = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Register a {@link TopicHandler} for a topic.
         *
         * @param topic   the topic name
         * @param handler the handler for records from {@code topic}
         * @return this
         * @throws NullPointerException     if {@code topic} or {@code handler} is null
         * @throws IllegalArgumentException if {@code topic} is empty or was registered
         */
        public Builder<K, V> register(String topic, TopicHandler<K, V> handler) {
            requireNonNull(topic, "topic");
            requireNonNull(handler, "handler");
            if (topic.trim().isEmpty()) {
                throw new IllegalArgumentException("topic to register cannot be empty");
            }
            if (handlers.containsKey(topic)) {
                throw new IllegalArgumentException("topic: " + topic + " has been registered");
            }
            handlers.put(topic, handler);
            return this;
        }

        public TopicRegistry<K, V> build() {
            return new TopicRegistry<>(handlers);
        }
    }

    private final Map<String, TopicHandler<K, V>> handlers;

    private TopicRegistry(Map<String, TopicHandler<K, V>> handlers) {
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
    }

    /**
     * @param topic the topic name
     * @return the handler registered for {@code topic}
     * @throws UnknownTopicException if no handler was registered for {@code topic}
     */
    public TopicHandler<K, V> lookup(String topic) {
        final TopicHandler<K, V> handler = handlers.get(topic);
        if (handler == null) {
            throw new UnknownTopicException(topic);
        }
        return handler;
    }

    /**
     * @return all the registered topic names in registration order
     */
    public List<String> names() {
        return Collections.unmodifiableList(new ArrayList<>(handlers.keySet()));
    }

    public boolean isEmpty() {
        return handlers.isEmpty();
    }

    /**
     * Create a new registry with all the handlers of this registry plus a {@link DelayedRetryHandler} for each
     * retry topic of the handlers with a {@link RetryPolicy}. So records retried by consumers in group
     * {@code groupId} are consumed by the same group again.
     *
     * @param groupId the consumer group
     * @param time    the time to schedule retried records
     * @param closing tells the retry handlers to stop waiting for a retried record
     * @return a new {@code TopicRegistry}
     */
    TopicRegistry<K, V> withRetryTopics(String groupId, Time time, BooleanSupplier closing) {
        final Map<String, TopicHandler<K, V>> expanded = new LinkedHashMap<>(handlers);
        for (Map.Entry<String, TopicHandler<K, V>> entry : handlers.entrySet()) {
            final RetryPolicy policy = entry.getValue().retryPolicy();
            if (policy == null) {
                continue;
            }

            final TopicHandler<K, V> delayed = new DelayedRetryHandler<>(entry.getValue(), time, closing);
            for (int attempt = 1; attempt <= policy.maxRetries(); ++attempt) {
                expanded.putIfAbsent(RetryTopics.retryTopic(groupId, entry.getKey(), attempt), delayed);
            }
        }
        return new TopicRegistry<>(expanded);
    }
}
