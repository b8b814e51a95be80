package cn.leancloud.kafka.dispatch;

/**
 * Receives the errors which {@link TopicConsumer} absorbed to keep on consuming: records failed to be delivered by
 * the client and records whose handling failed and were sent to the dead letter topic.
 * <p>
 * Implementations must not throw.
 */
public interface ErrorReporter {
    /**
     * Report an absorbed error.
     *
     * @param error   the error
     * @param context a description of where the error happened
     */
    void report(Throwable error, String context);
}
