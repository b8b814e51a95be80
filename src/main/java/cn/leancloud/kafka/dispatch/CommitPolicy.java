package cn.leancloud.kafka.dispatch;

import org.apache.kafka.clients.consumer.ConsumerRecord;

interface CommitPolicy {
    /**
     * Commit the offsets in {@link OffsetStore} based on the intrinsic policy of this {@link CommitPolicy}. It is
     * called after every batch of polled {@link ConsumerRecord}s was processed.
     *
     * @param store the offsets stored for processed records
     */
    void tryCommit(OffsetStore store);

    /**
     * Commit all the offsets in {@link OffsetStore} synchronously. Usually it is called when {@link TopicConsumer} is
     * about to shutdown or when some partitions was revoked.
     *
     * @param store the offsets stored for processed records
     */
    void commitSync(OffsetStore store);
}
