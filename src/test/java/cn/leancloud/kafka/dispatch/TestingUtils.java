package cn.leancloud.kafka.dispatch;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.header.Header;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.function.Function;

import static java.util.stream.Collectors.toMap;

class TestingUtils {
    static final String testingTopic = "TestingTopic";
    static final String testingGroup = "TestingGroup";
    static final byte[] defaultKey = "key".getBytes(StandardCharsets.UTF_8);
    static final byte[] defaultMsg = "msg".getBytes(StandardCharsets.UTF_8);

    static ConsumerRecord<byte[], byte[]> testingRecord(String topic, int partition, long offset) {
        return new ConsumerRecord<>(topic, partition, offset, defaultKey, defaultMsg);
    }

    static Map<String, Object> groupConfig(String groupId) {
        final Map<String, Object> configs = new HashMap<>();
        configs.put("group.id", groupId);
        return configs;
    }

    static void assignPartitions(MockConsumer<?, ?> consumer, Collection<TopicPartition> partitions, long offsets) {
        final Map<TopicPartition, Long> partitionOffset = partitions
                .stream()
                .collect(toMap(Function.identity(), (p) -> offsets));

        consumer.updateBeginningOffsets(partitionOffset);
        consumer.rebalance(partitionOffset.keySet());
    }

    static String headerValue(ProducerRecord<?, ?> record, String key) {
        final Header header = record.headers().lastHeader(key);
        return header == null ? null : new String(header.value(), StandardCharsets.UTF_8);
    }

    static Future<RecordMetadata> completedSend(ProducerRecord<?, ?> record) {
        return CompletableFuture.completedFuture(
                new RecordMetadata(new TopicPartition(record.topic(), 0), 0L, 0, 0L, 0, 0));
    }

    static Future<RecordMetadata> failedSend(Exception ex) {
        final CompletableFuture<RecordMetadata> future = new CompletableFuture<>();
        future.completeExceptionally(ex);
        return future;
    }

    /**
     * A {@link MockConsumer} remembers the offsets committed before it was closed, and the positions of its
     * assigned partitions at the moment it was closed.
     */
    static class CommitRecordingConsumer<K, V> extends MockConsumer<K, V> {
        private final Map<TopicPartition, OffsetAndMetadata> lastCommitted = new HashMap<>();
        private final Map<TopicPartition, Long> positionsOnClose = new HashMap<>();

        CommitRecordingConsumer() {
            super(OffsetResetStrategy.EARLIEST);
        }

        @Override
        public synchronized void commitSync(Map<TopicPartition, OffsetAndMetadata> offsets) {
            super.commitSync(offsets);
            lastCommitted.putAll(offsets);
        }

        @Override
        public synchronized void close() {
            recordPositions();
            super.close();
        }

        @Override
        public synchronized void close(Duration timeout) {
            recordPositions();
            super.close(timeout);
        }

        synchronized Map<TopicPartition, OffsetAndMetadata> lastCommitted() {
            return new HashMap<>(lastCommitted);
        }

        synchronized Map<TopicPartition, Long> positionsOnClose() {
            return new HashMap<>(positionsOnClose);
        }

        private void recordPositions() {
            if (closed()) {
                return;
            }
            for (TopicPartition partition : assignment()) {
                positionsOnClose.put(partition, position(partition));
            }
        }
    }
}
