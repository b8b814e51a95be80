package cn.leancloud.kafka.dispatch;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.apache.kafka.common.header.internals.RecordHeaders;

import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Names of the retry and dead letter topics. Both are scoped by consumer group and the main topic:
 * <ul>
 *  <li>retry topic: {@code <group>.<topic>.retry.<attempt>}</li>
 *  <li>dead letter topic: {@code <group>.<topic>.dlt}</li>
 * </ul>
 */
final class RetryTopics {
    static final String RETRY_MESSAGE_HEADER = "RETRY_MESSAGE";
    static final String RETRY_TIMESTAMP_HEADER = "RETRY_TIMESTAMP";
    static final String DEAD_LETTER_MESSAGE_HEADER = "DEAD_LETTER_MESSAGE";
    static final String DEAD_LETTER_DETAIL_HEADER = "DEAD_LETTER_DETAIL";

    private static final Pattern RETRY_SUFFIX = Pattern.compile("^(.+)\\.retry\\.([1-9][0-9]*)$");

    private RetryTopics() {
    }

    static String retryTopic(String groupId, String mainTopic, int attempt) {
        assert attempt > 0;
        return groupId + "." + mainTopic + ".retry." + attempt;
    }

    static String deadLetterTopic(String groupId, String mainTopic) {
        return groupId + "." + mainTopic + ".dlt";
    }

    /**
     * Copy a consumed record to {@code topic} with the key, value and headers of the record, plus {@code extraHeaders}.
     */
    static <K, V> ProducerRecord<K, V> forward(ConsumerRecord<K, V> record, String topic, Header... extraHeaders) {
        final RecordHeaders headers = new RecordHeaders();
        for (Header header : record.headers()) {
            headers.add(header);
        }
        for (Header header : extraHeaders) {
            headers.remove(header.key());
            headers.add(header);
        }
        return new ProducerRecord<>(topic, null, record.key(), record.value(), headers);
    }

    /**
     * @return the message of {@code error}, or an empty string when it has none
     */
    static String messageOf(Throwable error) {
        final String message = error.getMessage();
        return message == null ? "" : message;
    }

    static Header header(String key, String value) {
        return new RecordHeader(key, value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @return the retry attempt of the records in {@code topic}, or 0 when {@code topic} is not a retry topic of
     * {@code groupId}
     */
    static int attemptOf(String groupId, String topic) {
        final Matcher matcher = matchRetryTopic(groupId, topic);
        if (matcher == null) {
            return 0;
        }
        try {
            return Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException ex) {
            return 0;
        }
    }

    /**
     * @return the main topic of a retry topic, or {@code topic} itself when it is not a retry topic of {@code groupId}
     */
    static String mainTopicOf(String groupId, String topic) {
        final Matcher matcher = matchRetryTopic(groupId, topic);
        if (matcher == null) {
            return topic;
        }
        return matcher.group(1);
    }

    @Nullable
    private static Matcher matchRetryTopic(String groupId, String topic) {
        final String prefix = groupId + ".";
        if (!topic.startsWith(prefix)) {
            return null;
        }

        final Matcher matcher = RETRY_SUFFIX.matcher(topic.substring(prefix.length()));
        return matcher.matches() ? matcher : null;
    }
}
