package cn.leancloud.kafka.dispatch;

import org.apache.kafka.common.config.ConfigException;
import org.slf4j.Logger;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static cn.leancloud.kafka.dispatch.ConsumerConfigs.ENABLE_AUTO_OFFSET_STORE;
import static cn.leancloud.kafka.dispatch.ConsumerConfigs.ERROR_CB;
import static cn.leancloud.kafka.dispatch.ConsumerConfigs.GROUP_ID;
import static cn.leancloud.kafka.dispatch.ConsumerConfigs.LOGGER;

/**
 * The immutable configs of a {@link TopicConsumer}, produced by {@link ConfigResolver}.
 */
public final class ResolvedConfig {
    private final Map<String, Object> configs;

    ResolvedConfig(Map<String, Object> configs) {
        this.configs = Collections.unmodifiableMap(new LinkedHashMap<>(configs));
    }

    @Nullable
    public Object get(String key) {
        return configs.get(key);
    }

    public Map<String, Object> asMap() {
        return configs;
    }

    /**
     * @return the {@code group.id}
     * @throws ConfigException if {@code group.id} is absent or blank
     */
    public String groupId() {
        final Object groupId = GROUP_ID.get(configs);
        if (groupId == null || groupId.toString().trim().isEmpty()) {
            throw new ConfigException("expect \"" + GROUP_ID.configName() + "\" in kafka configs");
        }
        return groupId.toString();
    }

    /**
     * @return false only when {@code enable.auto.offset.store} was explicitly set to false
     */
    public boolean autoOffsetStore() {
        final Object autoOffsetStore = ENABLE_AUTO_OFFSET_STORE.get(configs);
        if (autoOffsetStore == null) {
            return true;
        }
        return !Boolean.FALSE.equals(autoOffsetStore) && !"false".equalsIgnoreCase(autoOffsetStore.toString());
    }

    public Logger logger() {
        return LOGGER.get(configs);
    }

    public ClientErrorHandler errorCallback() {
        return ERROR_CB.get(configs);
    }

    /**
     * @return a new mutable copy of the configs to create Kafka clients with, without the configs intercepted by
     * {@link TopicConsumer}
     */
    public Map<String, Object> clientConfigs() {
        final Map<String, Object> clientConfigs = new LinkedHashMap<>(configs);
        for (ConsumerConfigs config : ConsumerConfigs.values()) {
            if (config.intercepted()) {
                clientConfigs.remove(config.configName());
            }
        }
        return clientConfigs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return configs.equals(((ResolvedConfig) o).configs);
    }

    @Override
    public int hashCode() {
        return configs.hashCode();
    }

    @Override
    public String toString() {
        return "ResolvedConfig" + configs;
    }
}
