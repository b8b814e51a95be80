package cn.leancloud.kafka.dispatch;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

import static java.util.Collections.emptyMap;

/**
 * Remembers the offsets {@link TopicConsumer} stored manually when {@code enable.auto.offset.store} is false, and
 * which of them have not been committed yet.
 */
class OffsetStore {
    private final Map<TopicPartition, OffsetAndMetadata> storedOffsets;

    OffsetStore() {
        this.storedOffsets = new HashMap<>();
    }

    /**
     * Mark a record as processed. The offset to commit for its partition becomes the offset next to the record.
     *
     * @param record the processed record
     */
    void store(ConsumerRecord<?, ?> record) {
        storedOffsets.merge(new TopicPartition(record.topic(), record.partition()),
                new OffsetAndMetadata(record.offset() + 1),
                (oldOffset, newOffset) -> newOffset.offset() > oldOffset.offset() ? newOffset : oldOffset);
    }

    boolean noOffsetsToCommit() {
        return storedOffsets.isEmpty();
    }

    Map<TopicPartition, OffsetAndMetadata> offsetsToCommit() {
        if (storedOffsets.isEmpty()) {
            return emptyMap();
        }
        return new HashMap<>(storedOffsets);
    }

    /**
     * Forget the offsets which have been committed. An offset stored after {@code committedOffsets} was taken is kept.
     *
     * @param committedOffsets the offsets committed successfully
     */
    void markCommitted(Map<TopicPartition, OffsetAndMetadata> committedOffsets) {
        for (Map.Entry<TopicPartition, OffsetAndMetadata> entry : committedOffsets.entrySet()) {
            storedOffsets.remove(entry.getKey(), entry.getValue());
        }
    }

    void clearFor(Collection<TopicPartition> partitions) {
        for (TopicPartition p : partitions) {
            storedOffsets.remove(p);
        }
    }
}
