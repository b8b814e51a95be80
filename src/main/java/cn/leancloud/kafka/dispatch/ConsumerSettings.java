package cn.leancloud.kafka.dispatch;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Process wide settings shared by all the {@link TopicConsumer}s of an application. It is loaded once at process
 * start and is immutable afterwards.
 */
public final class ConsumerSettings {
    /**
     * Create a {@code Builder} used to build {@link ConsumerSettings}.
     *
     * @return a new {@code Builder}
     */
    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        @Nullable
        private String clientId;
        private Map<String, Object> globalConfig = new HashMap<>();
        private Map<String, Object> consumerConfig = new HashMap<>();
        private Duration pollTimeout = Duration.ofSeconds(1);
        private String loggerName = TopicConsumer.class.getName();
        private Supplier<? extends ClientErrorHandler> errorHandlerFactory = LoggingClientErrorHandler::new;

        private Builder() {
        }

        /**
         * The {@code client.id} every consumer starts with. Any config layer can override it.
         *
         * @param clientId the client id
         * @return this
         * @throws NullPointerException if {@code clientId} is null
         */
        public Builder clientId(String clientId) {
            requireNonNull(clientId, "clientId");
            this.clientId = clientId;
            return this;
        }

        /**
         * Kafka configs shared by all kinds of Kafka clients.
         *
         * @param globalConfig the global configs
         * @return this
         * @throws NullPointerException if {@code globalConfig} is null
         */
        public Builder globalConfig(Map<String, Object> globalConfig) {
            requireNonNull(globalConfig, "globalConfig");
            this.globalConfig = new HashMap<>(globalConfig);
            return this;
        }

        /**
         * Kafka configs shared by all the consumers. They override the same keys in global configs.
         *
         * @param consumerConfig the consumer configs
         * @return this
         * @throws NullPointerException if {@code consumerConfig} is null
         */
        public Builder consumerConfig(Map<String, Object> consumerConfig) {
            requireNonNull(consumerConfig, "consumerConfig");
            this.consumerConfig = new HashMap<>(consumerConfig);
            return this;
        }

        /**
         * The maximum time a consumer blocks in each poll when no record is available.
         * <p>
         * The default {@code pollTimeout} is 1 second.
         *
         * @param pollTimeout the poll timeout duration
         * @return this
         * @throws NullPointerException     if {@code pollTimeout} is null
         * @throws IllegalArgumentException if {@code pollTimeout} is a negative duration
         */
        public Builder pollTimeout(Duration pollTimeout) {
            requireNonNull(pollTimeout, "pollTimeout");
            if (pollTimeout.isNegative()) {
                throw new IllegalArgumentException("pollTimeout: " + pollTimeout + " (expect positive or zero duration)");
            }
            this.pollTimeout = pollTimeout;
            return this;
        }

        /**
         * The name of the logger saved in resolved configs under key {@code logger}.
         *
         * @param loggerName the logger name
         * @return this
         * @throws NullPointerException if {@code loggerName} is null
         */
        public Builder loggerName(String loggerName) {
            requireNonNull(loggerName, "loggerName");
            this.loggerName = loggerName;
            return this;
        }

        /**
         * The factory to create a {@link ClientErrorHandler} for each resolved configs. The default factory
         * creates {@link LoggingClientErrorHandler}.
         *
         * @param errorHandlerFactory the factory
         * @return this
         * @throws NullPointerException if {@code errorHandlerFactory} is null
         */
        public Builder errorHandlerFactory(Supplier<? extends ClientErrorHandler> errorHandlerFactory) {
            requireNonNull(errorHandlerFactory, "errorHandlerFactory");
            this.errorHandlerFactory = errorHandlerFactory;
            return this;
        }

        public ConsumerSettings build() {
            return new ConsumerSettings(this);
        }
    }

    @Nullable
    private final String clientId;
    private final Map<String, Object> globalConfig;
    private final Map<String, Object> consumerConfig;
    private final Duration pollTimeout;
    private final String loggerName;
    private final Supplier<? extends ClientErrorHandler> errorHandlerFactory;

    private ConsumerSettings(Builder builder) {
        this.clientId = builder.clientId;
        this.globalConfig = Collections.unmodifiableMap(new HashMap<>(builder.globalConfig));
        this.consumerConfig = Collections.unmodifiableMap(new HashMap<>(builder.consumerConfig));
        this.pollTimeout = builder.pollTimeout;
        this.loggerName = builder.loggerName;
        this.errorHandlerFactory = builder.errorHandlerFactory;
    }

    @Nullable
    public String clientId() {
        return clientId;
    }

    public Map<String, Object> globalConfig() {
        return globalConfig;
    }

    public Map<String, Object> consumerConfig() {
        return consumerConfig;
    }

    public Duration pollTimeout() {
        return pollTimeout;
    }

    public String loggerName() {
        return loggerName;
    }

    public Supplier<? extends ClientErrorHandler> errorHandlerFactory() {
        return errorHandlerFactory;
    }
}
