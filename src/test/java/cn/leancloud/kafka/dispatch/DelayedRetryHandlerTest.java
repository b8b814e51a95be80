package cn.leancloud.kafka.dispatch;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.utils.Time;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static cn.leancloud.kafka.dispatch.TestingUtils.testingRecord;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

public class DelayedRetryHandlerTest {
    private final AtomicLong now = new AtomicLong(1000L);
    private final List<Long> sleeps = new ArrayList<>();
    private final AtomicBoolean closing = new AtomicBoolean();
    private TopicHandler<byte[], byte[]> mainHandler;
    private Time time;
    private DelayedRetryHandler<byte[], byte[]> handler;

    @Before
    public void setUp() {
        mainHandler = mock(TopicHandler.class);
        time = mock(Time.class);
        when(time.milliseconds()).thenAnswer(invocation -> now.get());
        doAnswer(invocation -> {
            final long millis = invocation.getArgument(0);
            sleeps.add(millis);
            now.addAndGet(millis);
            return null;
        }).when(time).sleep(anyLong());
        handler = new DelayedRetryHandler<>(mainHandler, time, closing::get);
    }

    @After
    public void tearDown() {
        Thread.interrupted();
    }

    @Test
    public void testWaitUntilDue() throws Exception {
        final ConsumerRecord<byte[], byte[]> record = retriedRecord("1250");

        handler.consume(record);

        assertThat(sleeps).containsExactly(100L, 100L, 50L);
        assertThat(now.get()).isEqualTo(1250L);
        verify(mainHandler, times(1)).consume(record);
    }

    @Test
    public void testHandleOverdueRecordImmediately() throws Exception {
        final ConsumerRecord<byte[], byte[]> record = retriedRecord("900");

        handler.consume(record);

        assertThat(sleeps).isEmpty();
        verify(mainHandler, times(1)).consume(record);
    }

    @Test
    public void testHandleRecordWithoutTimestampImmediately() throws Exception {
        final ConsumerRecord<byte[], byte[]> record = testingRecord("g1.orders.retry.1", 0, 1);

        handler.consume(record);

        assertThat(sleeps).isEmpty();
        verify(mainHandler, times(1)).consume(record);
    }

    @Test
    public void testHandleRecordWithInvalidTimestampImmediately() throws Exception {
        final ConsumerRecord<byte[], byte[]> record = retriedRecord("not-a-number");

        handler.consume(record);

        assertThat(sleeps).isEmpty();
        verify(mainHandler, times(1)).consume(record);
    }

    @Test
    public void testStopWaitingWhenClosing() throws Exception {
        final ConsumerRecord<byte[], byte[]> record = retriedRecord("61000");
        doAnswer(invocation -> {
            now.addAndGet(invocation.getArgument(0));
            closing.set(true);
            return null;
        }).when(time).sleep(anyLong());

        assertThatThrownBy(() -> handler.consume(record)).isInstanceOf(WakeupException.class);

        verify(time, times(1)).sleep(DelayedRetryHandler.WAIT_SLICE_MS);
        verify(mainHandler, never()).consume(any());
    }

    @Test
    public void testDoNotWaitWhenAlreadyClosing() throws Exception {
        closing.set(true);

        assertThatThrownBy(() -> handler.consume(retriedRecord("61000"))).isInstanceOf(WakeupException.class);

        assertThat(sleeps).isEmpty();
        verify(mainHandler, never()).consume(any());
    }

    @Test
    public void testStopWaitingWhenInterrupted() throws Exception {
        Thread.currentThread().interrupt();

        assertThatThrownBy(() -> handler.consume(retriedRecord("61000"))).isInstanceOf(InterruptException.class);

        assertThat(sleeps).isEmpty();
        verify(mainHandler, never()).consume(any());
    }

    @Test
    public void testPropagateErrorFromMainHandler() throws Exception {
        final Exception expectedEx = new RuntimeException("expected exception");
        final ConsumerRecord<byte[], byte[]> record = retriedRecord("900");
        doThrow(expectedEx).when(mainHandler).consume(record);

        assertThatThrownBy(() -> handler.consume(record)).isSameAs(expectedEx);
    }

    @Test
    public void testRetryPolicyOfMainHandler() {
        final RetryPolicy policy = RetryPolicy.newBuilder(1).build();
        when(mainHandler.retryPolicy()).thenReturn(policy);

        assertThat(handler.retryPolicy()).isSameAs(policy);
    }

    private static ConsumerRecord<byte[], byte[]> retriedRecord(String timestamp) {
        final ConsumerRecord<byte[], byte[]> record = testingRecord("g1.orders.retry.1", 0, 1);
        record.headers().add(RetryTopics.header(RetryTopics.RETRY_TIMESTAMP_HEADER, timestamp));
        return record;
    }
}
