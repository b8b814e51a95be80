package cn.leancloud.kafka.dispatch;

import java.util.Map;

interface KafkaConfigs {
    String configName();

    /**
     * @return true when the config is consumed by {@link TopicConsumer} itself and must not be handed to the
     * underlying Kafka clients
     */
    boolean intercepted();

    default void set(Map<String, Object> configs, Object value) {
        configs.put(configName(), value);
    }

    default <T> T get(Map<String, Object> configs) {
        @SuppressWarnings("unchecked")
        T value = (T) configs.get(configName());
        return value;
    }
}
