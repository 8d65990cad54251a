package com.vibeloop.core.handlers;

import com.vibeloop.core.metrics.LoopMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Bounded retry with exponential backoff around a single collaborator call.
 * <p>
 * The n-th retry waits {@code baseDelay * 2^(n-1)}, capped at {@code maxDelay}. Only failures
 * classified as transient by {@link CollaboratorFailures} are retried; anything else, and
 * exhaustion of {@code maxAttempts}, surfaces as {@link FatalCollaboratorException}.
 */
@Component
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final RetryProperties properties;
    private final LoopMetrics metrics;
    private final Sleeper sleeper;

    @Autowired
    public RetryPolicy(RetryProperties properties, LoopMetrics metrics) {
        this(properties, metrics, Sleeper.THREAD);
    }

    public RetryPolicy(RetryProperties properties, LoopMetrics metrics, Sleeper sleeper) {
        this.properties = properties;
        this.metrics = metrics;
        this.sleeper = sleeper;
    }

    /**
     * Runs {@code call}, retrying transient failures.
     *
     * @param where label of the call for logs, metrics and the resulting error event
     */
    public <T> T execute(String where, Callable<T> call) {
        int maxAttempts = Math.max(1, properties.getMaxAttempts());
        for (int attempt = 1; ; attempt++) {
            try {
                return call.call();
            } catch (FatalCollaboratorException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FatalCollaboratorException(where, where + " interrupted", e);
            } catch (Exception e) {
                if (!CollaboratorFailures.isTransient(e)) {
                    throw new FatalCollaboratorException(where, where + " failed: " + describe(e), e);
                }
                if (attempt >= maxAttempts) {
                    throw new FatalCollaboratorException(where,
                            where + " failed after " + attempt + " attempts: " + describe(e), e);
                }
                Duration delay = delayBeforeRetry(attempt);
                log.warn("{} failed transiently (attempt {}/{}), retrying in {}ms: {}",
                        where, attempt, maxAttempts, delay.toMillis(), describe(e));
                metrics.recordRetry(where);
                backOff(where, delay);
            }
        }
    }

    /**
     * Delay after the given failed attempt (1-based).
     */
    Duration delayBeforeRetry(int attempt) {
        long base = properties.getBaseDelay().toMillis();
        long max = properties.getMaxDelay().toMillis();
        int shift = Math.min(attempt - 1, 30);
        long delay = base << shift;
        if (delay < 0 || delay > max) {
            delay = max;
        }
        return Duration.ofMillis(delay);
    }

    private void backOff(String where, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FatalCollaboratorException(where, where + " interrupted during backoff", e);
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
