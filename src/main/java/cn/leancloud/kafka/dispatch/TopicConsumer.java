package cn.leancloud.kafka.dispatch;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.RecordDeserializationException;
import org.apache.kafka.common.errors.RetriableException;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.Closeable;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@code TopicConsumer} subscribes to the topics of a {@link TopicRegistry} and passes every consumed record to the
 * {@link TopicHandler} registered for the topic of the record.
 * <p>
 * A record failed to be handled does not stop the consumer. It is sent to a retry topic when the
 * {@link RetryPolicy} of its handler allows, otherwise to the dead letter topic. Either way the consumer moves on
 * and the offset of the record is committed. Only a failure on sending a record to the dead letter topic stops
 * the consumer.
 * <p>
 * Records are handled one by one on the polling thread in the order they were fetched. Only {@link #close()} is
 * safe to call from other threads.
 *
 * @param <K> the type of key for records consumed from Kafka
 * @param <V> the type of value for records consumed from Kafka
 */
public final class TopicConsumer<K, V> implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(TopicConsumer.class);
    private static final AtomicInteger lastConsumerThreadId = new AtomicInteger();

    enum State {
        INIT(0),
        RUNNING(1),
        CLOSED(2);

        private int code;

        State(int code) {
            this.code = code;
        }

        int code() {
            return code;
        }
    }

    private final Consumer<K, V> consumer;
    private final Producer<K, V> producer;
    private final ResolvedConfig config;
    private final TopicRegistry<K, V> registry;
    private final Duration pollTimeout;
    private final RetryEscalator<K, V> escalator;
    private final DeadLetterSink<K, V> deadLetterSink;
    private final ErrorReporter errorReporter;
    private final CommitPolicy policy;
    private final OffsetStore offsetStore;
    private final CountDownLatch stopped;
    private volatile State state;
    private final AtomicBoolean closed;
    @Nullable
    private volatile Thread pollingThread;

    TopicConsumer(TopicConsumerBuilder<K, V> builder) {
        this.state = State.INIT;
        this.consumer = builder.getConsumer();
        this.producer = builder.getProducer();
        this.config = builder.getConfig();
        this.registry = builder.getRegistry();
        this.pollTimeout = builder.getPollTimeout();
        this.escalator = builder.getRetryEscalator();
        this.deadLetterSink = builder.getDeadLetterSink();
        this.errorReporter = builder.getErrorReporter();
        this.policy = builder.getPolicy();
        this.offsetStore = builder.getOffsetStore();
        this.closed = builder.getClosing();
        this.stopped = new CountDownLatch(1);
    }

    /**
     * @return the consumer group of this consumer
     */
    public String groupId() {
        return config.groupId();
    }

    public ResolvedConfig config() {
        return config;
    }

    /**
     * Subscribe to all the topics in the {@link TopicRegistry} and consume records from them in the calling thread
     * until {@link #close()} is called or the calling thread is interrupted. The consumer is closed on return.
     *
     * @throws IllegalStateException       if this consumer has been closed or is running
     * @throws DeadLetterDispatchException if a failed record could not be sent to the dead letter topic
     * @throws KafkaException              if the underlying Kafka consumer failed with a non retriable error
     */
    public void run() {
        markRunning();
        doRun();
    }

    /**
     * Same as {@link #run()} but consume records in a new thread.
     *
     * @return a {@link CompletableFuture} which is completed when the consumer quit, exceptionally if it quit due to
     * an error
     * @throws IllegalStateException if this consumer has been closed or is running
     */
    public CompletableFuture<Void> start() {
        markRunning();
        final CompletableFuture<Void> future = new CompletableFuture<>();
        final Thread thread = new Thread(() -> {
            try {
                doRun();
                future.complete(null);
            } catch (Throwable ex) {
                future.completeExceptionally(ex);
            }
        }, "topic-consumer-for-" + config.groupId() + "-" + lastConsumerThreadId.incrementAndGet());
        pollingThread = thread;
        thread.start();
        return future;
    }

    /**
     * Stop consuming. When called from a thread other than the polling thread, it blocks until the polling thread
     * committed stored offsets and closed the underlying Kafka clients.
     */
    @Override
    public void close() {
        if (closed.get()) {
            return;
        }

        final State stateOnClose;
        synchronized (this) {
            if (closed.get()) {
                return;
            }
            closed.set(true);
            stateOnClose = state;
        }

        if (stateOnClose == State.INIT) {
            shutdown();
            return;
        }

        if (stateOnClose == State.CLOSED) {
            return;
        }

        consumer.wakeup();
        if (Thread.currentThread() != pollingThread) {
            try {
                stopped.await();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @VisibleForTesting
    boolean closed() {
        return state == State.CLOSED;
    }

    @VisibleForTesting
    TopicRegistry<K, V> registry() {
        return registry;
    }

    @VisibleForTesting
    OffsetStore offsetStore() {
        return offsetStore;
    }

    /**
     * Handle a record fetched from Kafka. Every record goes to {@link #commitOffset(ConsumerRecord)} after it was
     * handled, whether the handling succeeded or not.
     *
     * @throws DeadLetterDispatchException if the record failed and could not be sent to the dead letter topic
     * @throws WakeupException             if the consumer was closed before the record was handled
     * @throws InterruptException          if the polling thread was interrupted before the record was handled
     */
    void processRecord(ConsumerRecord<K, V> record) {
        try {
            registry.lookup(record.topic()).consume(record);
        } catch (WakeupException | InterruptException ex) {
            // the consumer is closing, leave the record unhandled
            throw ex;
        } catch (Exception ex) {
            if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            handleException(record, ex);
        }

        commitOffset(record);
    }

    void handleException(ConsumerRecord<K, V> record, Exception error) {
        if (escalator.retry(record, error, retryPolicyOf(record.topic()))) {
            logger.debug("Record at offset {} of {}-{} was sent to retry topic.",
                    record.offset(), record.topic(), record.partition());
            return;
        }

        deadLetterSink.send(record, error);
        errorReporter.report(error, "Handle record at offset " + record.offset() + " of " + record.topic() + "-" +
                record.partition() + " failed, it was sent to the dead letter topic.");
    }

    void commitOffset(ConsumerRecord<K, V> record) {
        if (!config.autoOffsetStore()) {
            offsetStore.store(record);
        }
    }

    private synchronized void markRunning() {
        if (state.code() > State.INIT.code() || closed.get()) {
            throw new IllegalStateException("consumer is closed or running");
        }
        state = State.RUNNING;
    }

    private void doRun() {
        pollingThread = Thread.currentThread();
        logger.debug("Consumer for group {} started.", config.groupId());
        try {
            consumer.subscribe(registry.names(), new RebalanceListener(policy, offsetStore));
            while (!closed.get()) {
                try {
                    pollOnce();
                } catch (WakeupException ex) {
                    // woken up by close(), the loop condition decides whether to go on
                } catch (InterruptException ex) {
                    logger.info("Consumer for group {} was interrupted.", config.groupId());
                    break;
                } catch (RecordDeserializationException ex) {
                    handleTransportError(ex);
                } catch (RetriableException ex) {
                    config.errorCallback().onError(ex);
                } catch (KafkaException ex) {
                    config.errorCallback().onError(ex);
                    throw ex;
                }
            }
        } catch (Throwable ex) {
            logger.error("Consumer for group " + config.groupId() + " quit with unexpected exception.", ex);
            throw ex;
        } finally {
            shutdown();
            logger.debug("Consumer for group {} exit.", config.groupId());
        }
    }

    private void pollOnce() {
        final ConsumerRecords<K, V> records = consumer.poll(pollTimeout);
        if (records.isEmpty()) {
            return;
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Fetched " + records.count() + " records from: " + records.partitions());
        }

        final Map<TopicPartition, Long> nextOffsets = new HashMap<>();
        for (TopicPartition partition : records.partitions()) {
            nextOffsets.put(partition, records.records(partition).get(0).offset());
        }

        try {
            for (ConsumerRecord<K, V> record : records) {
                processRecord(record);
                nextOffsets.put(new TopicPartition(record.topic(), record.partition()), record.offset() + 1);
            }
        } catch (RuntimeException ex) {
            rewind(nextOffsets);
            throw ex;
        }

        policy.tryCommit(offsetStore);
    }

    private void handleTransportError(RecordDeserializationException ex) {
        errorReporter.report(ex, "Fetch record at offset " + ex.offset() + " of " + ex.topicPartition() +
                " failed, skip it.");
        consumer.seek(ex.topicPartition(), ex.offset() + 1);
    }

    @Nullable
    private RetryPolicy retryPolicyOf(String topic) {
        try {
            return registry.lookup(topic).retryPolicy();
        } catch (UnknownTopicException ex) {
            return null;
        }
    }

    /**
     * Seek every partition of an aborted batch back to its first unhandled record, so neither a later poll nor an
     * automatic commit on close can skip it.
     */
    private void rewind(Map<TopicPartition, Long> nextOffsets) {
        for (Map.Entry<TopicPartition, Long> entry : nextOffsets.entrySet()) {
            try {
                consumer.seek(entry.getKey(), entry.getValue());
            } catch (IllegalStateException ex) {
                logger.warn("Can not seek back to offset {} on {}, the partition is not assigned any more.",
                        entry.getValue(), entry.getKey());
            }
        }
    }

    private void commitOnShutdown() {
        try {
            policy.commitSync(offsetStore);
        } catch (WakeupException ex) {
            // the wakeup from close() was not consumed by a poll, it is consumed by the failed commit
            policy.commitSync(offsetStore);
        }
    }

    private void shutdown() {
        try {
            commitOnShutdown();
        } catch (Exception ex) {
            logger.error("Commit stored offsets on shutdown got unexpected exception", ex);
        } finally {
            try {
                consumer.close();
            } finally {
                try {
                    producer.close();
                } finally {
                    state = State.CLOSED;
                    stopped.countDown();
                }
            }
        }
    }
}
