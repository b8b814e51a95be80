package cn.leancloud.kafka.dispatch;

import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

final class RebalanceListener implements ConsumerRebalanceListener {
    private static final Logger logger = LoggerFactory.getLogger(RebalanceListener.class);

    private final CommitPolicy policy;
    private final OffsetStore store;

    RebalanceListener(CommitPolicy policy, OffsetStore store) {
        this.policy = policy;
        this.store = store;
    }

    @Override
    public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
        logger.info("Partitions revoked: {}", partitions);
        try {
            policy.commitSync(store);
        } finally {
            // offsets of revoked partitions belong to their new owner now
            store.clearFor(partitions);
        }
    }

    @Override
    public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
        logger.info("Partitions assigned: {}", partitions);
    }
}
