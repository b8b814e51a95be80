package cn.leancloud.kafka.dispatch;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.RetriableException;

import java.time.Duration;
import java.util.Map;

/**
 * Commits the offsets stored manually with a synchronous commit, retrying on {@link RetriableException}.
 */
final class StoredOffsetsCommitPolicy<K, V> implements CommitPolicy {
    static SleepFunction sleepFunction = Thread::sleep;

    interface SleepFunction {
        void sleep(long timeout) throws InterruptedException;
    }

    private static class RetryContext {
        private final long retryInterval;
        private final int maxAttempts;
        private int numOfAttempts;

        private RetryContext(long retryInterval, int maxAttempts) {
            this.retryInterval = retryInterval;
            this.maxAttempts = maxAttempts;
            this.numOfAttempts = 0;
        }

        void onError(RetriableException e) {
            if (++numOfAttempts >= maxAttempts) {
                throw e;
            } else {
                try {
                    sleepFunction.sleep(retryInterval);
                } catch (InterruptedException ex) {
                    e.addSuppressed(ex);
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    private final Consumer<K, V> consumer;
    private final long syncCommitRetryIntervalMs;
    private final int maxAttemptsForEachSyncCommit;

    StoredOffsetsCommitPolicy(Consumer<K, V> consumer, Duration syncCommitRetryInterval, int maxAttemptsForEachSyncCommit) {
        this.consumer = consumer;
        this.syncCommitRetryIntervalMs = syncCommitRetryInterval.toMillis();
        this.maxAttemptsForEachSyncCommit = maxAttemptsForEachSyncCommit;
    }

    @Override
    public void tryCommit(OffsetStore store) {
        commitSync(store);
    }

    @Override
    public void commitSync(OffsetStore store) {
        if (store.noOffsetsToCommit()) {
            return;
        }

        final Map<TopicPartition, OffsetAndMetadata> offsetsToCommit = store.offsetsToCommit();
        final RetryContext context = new RetryContext(syncCommitRetryIntervalMs, maxAttemptsForEachSyncCommit);
        do {
            try {
                consumer.commitSync(offsetsToCommit);
                store.markCommitted(offsetsToCommit);
                return;
            } catch (RetriableException e) {
                context.onError(e);
            }
        } while (true);
    }
}
