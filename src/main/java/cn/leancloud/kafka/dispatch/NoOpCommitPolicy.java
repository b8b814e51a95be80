package cn.leancloud.kafka.dispatch;

/**
 * Used when {@code enable.auto.offset.store} is not false. Offsets are committed by the Kafka consumer itself.
 */
final class NoOpCommitPolicy implements CommitPolicy {
    private static final NoOpCommitPolicy INSTANCE = new NoOpCommitPolicy();

    static NoOpCommitPolicy getInstance() {
        return INSTANCE;
    }

    private NoOpCommitPolicy() {
    }

    @Override
    public void tryCommit(OffsetStore store) {

    }

    @Override
    public void commitSync(OffsetStore store) {

    }
}
