package cn.leancloud.kafka.dispatch;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.config.ConfigException;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.Deserializer;
import org.apache.kafka.common.serialization.Serializer;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import static cn.leancloud.kafka.dispatch.ConsumerConfigs.ENABLE_AUTO_COMMIT;
import static cn.leancloud.kafka.dispatch.ConsumerConfigs.MAX_POLL_INTERVAL_MS;
import static java.util.Objects.requireNonNull;

/**
 * A builder used to create a {@link TopicConsumer} which uses a {@link KafkaConsumer} to consume records
 * from Kafka broker and a {@link KafkaProducer} to send failed records to retry and dead letter topics.
 *
 * @param <K> the type of key for records consumed from Kafka
 * @param <V> the type of value for records consumed from Kafka
 */
public final class TopicConsumerBuilder<K, V> {
    private static final Logger logger = LoggerFactory.getLogger(TopicConsumerBuilder.class);
    // the default of "max.poll.interval.ms" in the Kafka consumer
    private static final long DEFAULT_MAX_POLL_INTERVAL_MS = 300_000L;

    /**
     * Create a {@code TopicConsumerBuilder} for records with raw bytes key and value.
     *
     * @param settings       the process wide {@link ConsumerSettings}
     * @param declaredConfig the kafka configs declared for this consumer. They override the same configs in
     *                       {@code settings}
     * @param registry       the handlers of all the topics to consume
     * @return a new {@code TopicConsumerBuilder}
     * @throws NullPointerException when any of the input argument is null
     */
    public static TopicConsumerBuilder<byte[], byte[]> newBuilder(ConsumerSettings settings,
                                                                  Map<String, Object> declaredConfig,
                                                                  TopicRegistry<byte[], byte[]> registry) {
        return newBuilder(settings, declaredConfig, registry,
                new ByteArrayDeserializer(), new ByteArrayDeserializer(),
                new ByteArraySerializer(), new ByteArraySerializer());
    }

    /**
     * Create a {@code TopicConsumerBuilder}. The serializers are used to send failed records to retry and dead
     * letter topics, they must write back what the deserializers read.
     *
     * @param settings          the process wide {@link ConsumerSettings}
     * @param declaredConfig    the kafka configs declared for this consumer. They override the same configs in
     *                          {@code settings}
     * @param registry          the handlers of all the topics to consume
     * @param keyDeserializer   the deserializer for key that implements {@link Deserializer}
     * @param valueDeserializer the deserializer for value that implements {@link Deserializer}
     * @param keySerializer     the serializer for key that implements {@link Serializer}
     * @param valueSerializer   the serializer for value that implements {@link Serializer}
     * @return a new {@code TopicConsumerBuilder}
     * @throws NullPointerException when any of the input argument is null
     */
    public static <K, V> TopicConsumerBuilder<K, V> newBuilder(ConsumerSettings settings,
                                                               Map<String, Object> declaredConfig,
                                                               TopicRegistry<K, V> registry,
                                                               Deserializer<K> keyDeserializer,
                                                               Deserializer<V> valueDeserializer,
                                                               Serializer<K> keySerializer,
                                                               Serializer<V> valueSerializer) {
        requireNonNull(settings, "settings");
        requireNonNull(declaredConfig, "declaredConfig");
        requireNonNull(registry, "registry");
        requireNonNull(keyDeserializer, "keyDeserializer");
        requireNonNull(valueDeserializer, "valueDeserializer");
        requireNonNull(keySerializer, "keySerializer");
        requireNonNull(valueSerializer, "valueSerializer");
        return new TopicConsumerBuilder<>(settings, declaredConfig, registry,
                keyDeserializer, valueDeserializer, keySerializer, valueSerializer);
    }

    /**
     * Ensures that the argument expression is true.
     */
    private static void requireArgument(boolean expression, String template, Object... args) {
        if (!expression) {
            throw new IllegalArgumentException(String.format(template, args));
        }
    }

    private final ConsumerSettings settings;
    private final Map<String, Object> declaredConfig;
    private final TopicRegistry<K, V> declaredRegistry;
    private final Deserializer<K> keyDeserializer;
    private final Deserializer<V> valueDeserializer;
    private final Serializer<K> keySerializer;
    private final Serializer<V> valueSerializer;
    private final AtomicBoolean closing = new AtomicBoolean();
    private Duration pollTimeout;
    private Duration syncCommitRetryInterval = Duration.ofSeconds(1);
    private int maxAttemptsForEachSyncCommit = 3;
    private Time time = Time.SYSTEM;
    @Nullable
    private ErrorReporter errorReporter;
    @Nullable
    private Consumer<K, V> consumer;
    @Nullable
    private Producer<K, V> producer;
    @Nullable
    private ResolvedConfig config;
    @Nullable
    private TopicRegistry<K, V> registry;
    @Nullable
    private CommitPolicy policy;
    @Nullable
    private OffsetStore offsetStore;
    @Nullable
    private RetryEscalator<K, V> retryEscalator;
    @Nullable
    private DeadLetterSink<K, V> deadLetterSink;

    private TopicConsumerBuilder(ConsumerSettings settings,
                                 Map<String, Object> declaredConfig,
                                 TopicRegistry<K, V> registry,
                                 Deserializer<K> keyDeserializer,
                                 Deserializer<V> valueDeserializer,
                                 Serializer<K> keySerializer,
                                 Serializer<V> valueSerializer) {
        this.settings = settings;
        this.declaredConfig = new LinkedHashMap<>(declaredConfig);
        this.declaredRegistry = registry;
        this.keyDeserializer = keyDeserializer;
        this.valueDeserializer = valueDeserializer;
        this.keySerializer = keySerializer;
        this.valueSerializer = valueSerializer;
        this.pollTimeout = settings.pollTimeout();
    }

    /**
     * The maximum time spent waiting in polling data from kafka broker if data is not available in the buffer.
     * <p>
     * The default {@code pollTimeout} is {@link ConsumerSettings#pollTimeout()}.
     *
     * @param pollTimeout the poll timeout duration
     * @return this
     * @throws NullPointerException     if {@code pollTimeout} is null
     * @throws IllegalArgumentException if {@code pollTimeout} is a negative duration
     */
    public TopicConsumerBuilder<K, V> pollTimeout(Duration pollTimeout) {
        requireNonNull(pollTimeout, "pollTimeout");
        requireArgument(!pollTimeout.isNegative(), "pollTimeout: %s (expect positive or zero duration)", pollTimeout);
        this.pollTimeout = pollTimeout;
        return this;
    }

    /**
     * The interval between two attempts of a synchronous commit failed with a retriable error. Only used when
     * {@code enable.auto.offset.store} is false.
     * <p>
     * The default {@code syncCommitRetryInterval} is 1 second.
     *
     * @param syncCommitRetryInterval the retry interval
     * @return this
     * @throws NullPointerException     if {@code syncCommitRetryInterval} is null
     * @throws IllegalArgumentException if {@code syncCommitRetryInterval} is a negative duration
     */
    public TopicConsumerBuilder<K, V> syncCommitRetryInterval(Duration syncCommitRetryInterval) {
        requireNonNull(syncCommitRetryInterval, "syncCommitRetryInterval");
        requireArgument(!syncCommitRetryInterval.isNegative(),
                "syncCommitRetryInterval: %s (expect positive or zero duration)", syncCommitRetryInterval);
        this.syncCommitRetryInterval = syncCommitRetryInterval;
        return this;
    }

    /**
     * The maximum attempts of a synchronous commit failed with retriable errors. Only used when
     * {@code enable.auto.offset.store} is false.
     * <p>
     * The default {@code maxAttemptsForEachSyncCommit} is 3.
     *
     * @param maxAttemptsForEachSyncCommit maximum attempts
     * @return this
     * @throws IllegalArgumentException if {@code maxAttemptsForEachSyncCommit} is a non-positive value
     */
    public TopicConsumerBuilder<K, V> maxAttemptsForEachSyncCommit(int maxAttemptsForEachSyncCommit) {
        requireArgument(maxAttemptsForEachSyncCommit > 0,
                "maxAttemptsForEachSyncCommit: %s (expect > 0)", maxAttemptsForEachSyncCommit);
        this.maxAttemptsForEachSyncCommit = maxAttemptsForEachSyncCommit;
        return this;
    }

    /**
     * The {@link ErrorReporter} receiving errors of records sent to the dead letter topic and records failed to be
     * fetched. The default reporter logs errors to the {@code logger} of the resolved configs.
     *
     * @param errorReporter the error reporter
     * @return this
     * @throws NullPointerException if {@code errorReporter} is null
     */
    public TopicConsumerBuilder<K, V> errorReporter(ErrorReporter errorReporter) {
        requireNonNull(errorReporter, "errorReporter");
        this.errorReporter = errorReporter;
        return this;
    }

    /**
     * Internal testing usage only.
     */
    TopicConsumerBuilder<K, V> time(Time time) {
        requireNonNull(time, "time");
        this.time = time;
        return this;
    }

    /**
     * Internal testing usage only.
     * <p>
     * Passing a {@link Consumer} as the underlying {@link Consumer}. Usually this would be a {@link MockConsumer}.
     *
     * @param mockedConsumer the injected consumer
     * @return this
     * @throws NullPointerException if {@code mockedConsumer} is null
     */
    TopicConsumerBuilder<K, V> mockKafkaConsumer(Consumer<K, V> mockedConsumer) {
        requireNonNull(mockedConsumer, "consumer");
        if (mockedConsumer instanceof KafkaConsumer) {
            throw new IllegalArgumentException("need a mocked Consumer");
        }
        this.consumer = mockedConsumer;
        return this;
    }

    /**
     * Internal testing usage only.
     * <p>
     * Passing a {@link Producer} as the producer for retry and dead letter topics. Usually this would be a
     * {@link MockProducer}.
     *
     * @param mockedProducer the injected producer
     * @return this
     * @throws NullPointerException if {@code mockedProducer} is null
     */
    TopicConsumerBuilder<K, V> mockKafkaProducer(Producer<K, V> mockedProducer) {
        requireNonNull(mockedProducer, "producer");
        if (mockedProducer instanceof KafkaProducer) {
            throw new IllegalArgumentException("need a mocked Producer");
        }
        this.producer = mockedProducer;
        return this;
    }

    /**
     * Build the {@link TopicConsumer}.
     *
     * @return the {@link TopicConsumer}
     * @throws org.apache.kafka.common.config.ConfigException if {@code group.id} is missing in the resolved configs
     * @throws IllegalArgumentException                       if no topic was registered, or if the longest retry
     *                                                        delay of a topic is not less than
     *                                                        {@code max.poll.interval.ms}
     */
    public TopicConsumer<K, V> build() {
        requireArgument(!declaredRegistry.isEmpty(), "no topic registered to consume");

        config = new ConfigResolver(settings, declaredConfig).buildConfig();
        final String groupId = config.groupId();
        checkRetryDelays(maxPollIntervalMs(config));
        registry = declaredRegistry.withRetryTopics(groupId, time, closing::get);
        offsetStore = new OffsetStore();

        final Map<String, Object> clientConfigs = config.clientConfigs();
        final Consumer<K, V> c = buildConsumer(clientConfigs);
        final Producer<K, V> p = buildProducer(clientConfigs);
        policy = config.autoOffsetStore() ? NoOpCommitPolicy.getInstance() :
                new StoredOffsetsCommitPolicy<>(c, syncCommitRetryInterval, maxAttemptsForEachSyncCommit);
        retryEscalator = new RetryEscalator<>(groupId, p, time);
        deadLetterSink = new DeadLetterSink<>(groupId, p);
        if (errorReporter == null) {
            errorReporter = new LoggingErrorReporter(config.logger());
        }

        return new TopicConsumer<>(this);
    }

    Consumer<K, V> getConsumer() {
        assert consumer != null;
        return consumer;
    }

    Producer<K, V> getProducer() {
        assert producer != null;
        return producer;
    }

    ResolvedConfig getConfig() {
        assert config != null;
        return config;
    }

    TopicRegistry<K, V> getRegistry() {
        assert registry != null;
        return registry;
    }

    AtomicBoolean getClosing() {
        return closing;
    }

    Duration getPollTimeout() {
        return pollTimeout;
    }

    CommitPolicy getPolicy() {
        assert policy != null;
        return policy;
    }

    OffsetStore getOffsetStore() {
        assert offsetStore != null;
        return offsetStore;
    }

    RetryEscalator<K, V> getRetryEscalator() {
        assert retryEscalator != null;
        return retryEscalator;
    }

    DeadLetterSink<K, V> getDeadLetterSink() {
        assert deadLetterSink != null;
        return deadLetterSink;
    }

    ErrorReporter getErrorReporter() {
        assert errorReporter != null;
        return errorReporter;
    }

    private static long maxPollIntervalMs(ResolvedConfig config) {
        final Object value = config.get(MAX_POLL_INTERVAL_MS.configName());
        if (value == null) {
            return DEFAULT_MAX_POLL_INTERVAL_MS;
        }

        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException ex) {
            throw new ConfigException(MAX_POLL_INTERVAL_MS.configName(), value, "expect an integer");
        }
    }

    /**
     * Records of retry topics are held on the polling thread until they are due, so the longest delay of each
     * {@link RetryPolicy} must let the consumer poll again within {@code max.poll.interval.ms}.
     */
    private void checkRetryDelays(long maxPollIntervalMs) {
        final Duration maxPollInterval = Duration.ofMillis(maxPollIntervalMs);
        for (String topic : declaredRegistry.names()) {
            final RetryPolicy retryPolicy = declaredRegistry.lookup(topic).retryPolicy();
            if (retryPolicy == null) {
                continue;
            }

            final Duration longestDelay = retryPolicy.delayFor(retryPolicy.maxRetries());
            requireArgument(longestDelay.compareTo(maxPollInterval) < 0,
                    "retry delay of topic: %s is %s (expect less than %s: %sms)",
                    topic, longestDelay, MAX_POLL_INTERVAL_MS.configName(), maxPollIntervalMs);
        }
    }

    private Consumer<K, V> buildConsumer(Map<String, Object> clientConfigs) {
        if (!getConfig().autoOffsetStore()) {
            final Object autoCommit = ENABLE_AUTO_COMMIT.get(clientConfigs);
            if (autoCommit == null || !"false".equalsIgnoreCase(autoCommit.toString())) {
                logger.info("Offsets are stored manually, set \"{}\" to false.", ENABLE_AUTO_COMMIT.configName());
            }
            ENABLE_AUTO_COMMIT.set(clientConfigs, "false");
        }

        if (consumer == null) {
            consumer = new KafkaConsumer<>(clientConfigs, keyDeserializer, valueDeserializer);
        }
        return consumer;
    }

    private Producer<K, V> buildProducer(Map<String, Object> clientConfigs) {
        if (producer == null) {
            final Set<String> producerConfigNames = ProducerConfig.configNames();
            final Map<String, Object> producerConfigs = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : clientConfigs.entrySet()) {
                if (producerConfigNames.contains(entry.getKey())) {
                    producerConfigs.put(entry.getKey(), entry.getValue());
                }
            }
            producer = new KafkaProducer<>(producerConfigs, keySerializer, valueSerializer);
        }
        return producer;
    }
}
