package com.scoutengine.core.sink;

import com.scoutengine.core.model.Opportunity;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Decorates an {@link OpportunitySink} with a Resilience4j {@link Retry}.
 *
 * <p>
 * Only {@link SinkWriteException} is retried. The wait before attempt
 * {@code n + 1} is {@code initialBackoff * 2^(n-1)}, capped at
 * {@code maxBackoff}. When every attempt fails the last
 * {@code SinkWriteException} is rethrown; other exceptions propagate on the
 * first attempt.
 * </p>
 *
 * @since 1.0.0
 */
public class RetryingOpportunitySink implements OpportunitySink {

    private static final Logger LOG = LoggerFactory.getLogger(RetryingOpportunitySink.class);

    static final String RETRY_NAME = "opportunitySink";
    static final double BACKOFF_MULTIPLIER = 2.0;

    private final OpportunitySink delegate;
    private final Retry retry;

    public RetryingOpportunitySink(OpportunitySink delegate, int maxAttempts, Duration initialBackoff) {
        this(delegate, maxAttempts, initialBackoff, Duration.ofSeconds(30));
    }

    /**
     * @param delegate       sink to decorate; must not be {@code null}
     * @param maxAttempts    total attempts including the first, {@code >= 1}
     * @param initialBackoff wait after the first failure, at least 1 ms
     * @param maxBackoff     upper bound of any wait, {@code >= initialBackoff}
     * @throws IllegalArgumentException if a bound is out of range
     */
    public RetryingOpportunitySink(OpportunitySink delegate, int maxAttempts, Duration initialBackoff,
                                   Duration maxBackoff) {
        this(delegate, Retry.of(RETRY_NAME, config(maxAttempts, initialBackoff, maxBackoff)));
    }

    /**
     * Decorate with an externally configured retry, e.g. one taken from a
     * shared {@code RetryRegistry}.
     */
    public RetryingOpportunitySink(OpportunitySink delegate, Retry retry) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.retry = Objects.requireNonNull(retry, "retry must not be null");
        retry.getEventPublisher()
                .onRetry(e -> LOG.warn("Sink write attempt {} failed, retrying in {} ms: {}",
                        e.getNumberOfRetryAttempts(), e.getWaitInterval().toMillis(),
                        e.getLastThrowable().getMessage()))
                .onSuccess(e -> LOG.info("Sink write succeeded after {} retr(ies)", e.getNumberOfRetryAttempts()))
                .onError(e -> LOG.error("Sink write failed after {} attempt(s): {}",
                        e.getNumberOfRetryAttempts(), e.getLastThrowable().getMessage()));
    }

    static RetryConfig config(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
        Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
        if (initialBackoff.toMillis() < 1 || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("Require 1 ms <= initialBackoff <= maxBackoff");
        }
        return RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        initialBackoff, BACKOFF_MULTIPLIER, maxBackoff))
                .retryExceptions(SinkWriteException.class)
                .build();
    }

    public Retry getRetry() {
        return retry;
    }

    @Override
    public void write(List<Opportunity> opportunities) {
        Objects.requireNonNull(opportunities, "opportunities must not be null");
        retry.executeRunnable(() -> delegate.write(opportunities));
    }
}
