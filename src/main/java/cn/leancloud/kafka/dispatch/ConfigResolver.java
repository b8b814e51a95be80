package cn.leancloud.kafka.dispatch;

import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

import static cn.leancloud.kafka.dispatch.ConsumerConfigs.CLIENT_ID;
import static cn.leancloud.kafka.dispatch.ConsumerConfigs.ERROR_CB;
import static cn.leancloud.kafka.dispatch.ConsumerConfigs.LOGGER;
import static java.util.Objects.requireNonNull;

/**
 * Merges the config layers of a consumer into a {@link ResolvedConfig}. Layers are applied from the lowest
 * precedence to the highest, a later layer overwrites the same keys of the earlier ones:
 * <ol>
 *  <li>{@code client.id} from {@link ConsumerSettings#clientId()}</li>
 *  <li>{@link ConsumerSettings#globalConfig()}</li>
 *  <li>{@link ConsumerSettings#consumerConfig()}</li>
 *  <li>the configs declared for a specific consumer</li>
 *  <li>the computed {@code logger} and {@code error_cb}</li>
 * </ol>
 */
public final class ConfigResolver {
    private final ConsumerSettings settings;
    private final Map<String, Object> declaredConfig;

    public ConfigResolver(ConsumerSettings settings, Map<String, Object> declaredConfig) {
        requireNonNull(settings, "settings");
        requireNonNull(declaredConfig, "declaredConfig");
        this.settings = settings;
        this.declaredConfig = new LinkedHashMap<>(declaredConfig);
    }

    public ResolvedConfig buildConfig() {
        final Map<String, Object> configs = new LinkedHashMap<>();
        if (settings.clientId() != null) {
            CLIENT_ID.set(configs, settings.clientId());
        }
        configs.putAll(settings.globalConfig());
        configs.putAll(settings.consumerConfig());
        configs.putAll(declaredConfig);
        configs.putAll(computedLayer());
        return new ResolvedConfig(configs);
    }

    /**
     * Build the values computed at runtime. A new {@link ClientErrorHandler} is created on each call.
     *
     * @return the computed layer with {@code logger} and {@code error_cb}
     */
    Map<String, Object> computedLayer() {
        final Map<String, Object> computed = new LinkedHashMap<>();
        LOGGER.set(computed, LoggerFactory.getLogger(settings.loggerName()));
        ERROR_CB.set(computed, requireNonNull(settings.errorHandlerFactory().get(), "errorHandler"));
        return computed;
    }
}
