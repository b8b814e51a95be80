package cn.leancloud.kafka.dispatch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Describes how the records failed on a topic are retried through retry topics.
 * <p>
 * A failed record is produced to the retry topic of its next attempt, and is handled again after
 * {@link #delayFor(int)}. After {@code maxRetries} attempts failed, the record goes to the dead letter topic.
 */
public final class RetryPolicy {
    /**
     * Create a {@code Builder} used to build {@link RetryPolicy}.
     *
     * @param maxRetries the maximum number of retry attempts
     * @return a new {@code Builder}
     * @throws IllegalArgumentException if {@code maxRetries} is a non-positive value
     */
    public static Builder newBuilder(int maxRetries) {
        if (maxRetries <= 0) {
            throw new IllegalArgumentException("maxRetries: " + maxRetries + " (expect > 0)");
        }
        return new Builder(maxRetries);
    }

    public static final class Builder {
        private final int maxRetries;
        private Duration delay = Duration.ofSeconds(60);
        private boolean backoff = false;
        private final List<Class<? extends Throwable>> include = new ArrayList<>();
        private final List<Class<? extends Throwable>> exclude = new ArrayList<>();

        private Builder(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        /**
         * The delay before a retried record is handled again. The default {@code delay} is 60 seconds.
         *
         * @param delay the delay duration
         * @return this
         * @throws NullPointerException     if {@code delay} is null
         * @throws IllegalArgumentException if {@code delay} is a negative duration
         */
        public Builder delay(Duration delay) {
            requireNonNull(delay, "delay");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay: " + delay + " (expect positive or zero duration)");
            }
            this.delay = delay;
            return this;
        }

        /**
         * Double the delay on each following attempt.
         *
         * @param backoff true to enable exponential backoff
         * @return this
         */
        public Builder backoff(boolean backoff) {
            this.backoff = backoff;
            return this;
        }

        /**
         * Only retry these exceptions and their subclasses.
         *
         * @param exceptions exceptions to retry
         * @return this
         */
        @SafeVarargs
        public final Builder include(Class<? extends Throwable>... exceptions) {
            include.addAll(Arrays.asList(exceptions));
            return this;
        }

        /**
         * Never retry these exceptions and their subclasses.
         *
         * @param exceptions exceptions not to retry
         * @return this
         */
        @SafeVarargs
        public final Builder exclude(Class<? extends Throwable>... exceptions) {
            exclude.addAll(Arrays.asList(exceptions));
            return this;
        }

        /**
         * @return the {@link RetryPolicy}
         * @throws IllegalArgumentException if both include and exclude exceptions were set
         */
        public RetryPolicy build() {
            if (!include.isEmpty() && !exclude.isEmpty()) {
                throw new IllegalArgumentException("can not set both include and exclude exceptions");
            }
            return new RetryPolicy(this);
        }
    }

    private final int maxRetries;
    private final Duration delay;
    private final boolean backoff;
    private final List<Class<? extends Throwable>> include;
    private final List<Class<? extends Throwable>> exclude;

    private RetryPolicy(Builder builder) {
        this.maxRetries = builder.maxRetries;
        this.delay = builder.delay;
        this.backoff = builder.backoff;
        this.include = Collections.unmodifiableList(new ArrayList<>(builder.include));
        this.exclude = Collections.unmodifiableList(new ArrayList<>(builder.exclude));
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Duration delay() {
        return delay;
    }

    public boolean backoff() {
        return backoff;
    }

    /**
     * @param error   the error thrown on handling a record
     * @param attempt the retry attempt about to start, starting from 1
     * @return true if the record failed with {@code error} can go to retry {@code attempt}
     */
    public boolean shouldRetry(Throwable error, int attempt) {
        if (attempt < 1 || attempt > maxRetries) {
            return false;
        }

        if (!include.isEmpty()) {
            return matches(include, error);
        }

        return !matches(exclude, error);
    }

    /**
     * @param attempt the retry attempt, starting from 1
     * @return the delay before the record of retry {@code attempt} is handled
     */
    public Duration delayFor(int attempt) {
        if (!backoff || attempt <= 1) {
            return delay;
        }

        try {
            return delay.multipliedBy(1L << Math.min(attempt - 1, 30));
        } catch (ArithmeticException ex) {
            return Duration.ofMillis(Long.MAX_VALUE);
        }
    }

    private static boolean matches(List<Class<? extends Throwable>> types, Throwable error) {
        for (Class<? extends Throwable> type : types) {
            if (type.isInstance(error)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "RetryPolicy{" +
                "maxRetries=" + maxRetries +
                ", delay=" + delay +
                ", backoff=" + backoff +
                ", include=" + include +
                ", exclude=" + exclude +
                '}';
    }
}
