package com.rms.relay.core.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * =====================================================================
 * RetryExecutor
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Runs a fallible operation with bounded, exponentially spaced retries.
 * One instance per retried component (publisher sends, source reads,
 * tracking writes, NATS connect), each with its own budget and predicate.
 *
 * CONTRACT
 * --------
 * - Up to {@code maxRetries + 1} attempts in total
 *   ({@code maxRetries == 0} means a single attempt).
 * - A failure the predicate rejects propagates immediately and consumes
 *   no budget.
 * - After the budget is spent, the last failure propagates unchanged with
 *   a suppressed {@link RetryExhaustedException} carrying the attempt count.
 * - The wait after the k-th failed attempt (zero-based) is
 *   {@code backoff.backoff(k)}.
 *
 * SUSPENSION
 * ----------
 * {@link #execute} blocks the calling thread between attempts.
 * {@link #apply} waits with {@code Mono.delay}, so only the owning reactive
 * task is suspended and sibling tasks keep running.
 */
public final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final String operation;
    private final int maxRetries;
    private final BackoffPolicy backoff;
    private final Predicate<Throwable> retryable;
    private final Sleeper sleeper;

    public RetryExecutor(String operation, int maxRetries, BackoffPolicy backoff, Predicate<Throwable> retryable) {
        this(operation, maxRetries, backoff, retryable, Sleeper.THREAD);
    }

    public RetryExecutor(String operation, int maxRetries, BackoffPolicy backoff, Predicate<Throwable> retryable,
            Sleeper sleeper) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative, got " + maxRetries);
        }
        this.operation = Objects.requireNonNull(operation, "operation");
        this.maxRetries = maxRetries;
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.retryable = Objects.requireNonNull(retryable, "retryable");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Blocking variant.
     */
    public <T> T execute(Callable<T> action) throws Exception {
        int attempt = 0;
        while (true) {
            try {
                return action.call();
            } catch (Exception e) {
                Duration wait = onFailure(e, attempt);
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(ie);
                    throw e;
                }
                attempt++;
            }
        }
    }

    /**
     * Reactive variant. {@code source} is re-subscribed for every attempt, so it must be lazy
     * (e.g. built with {@code Mono.defer} or {@code Mono.fromCallable}).
     */
    public <T> Mono<T> apply(Mono<T> source) {
        return source.retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            int attempt = (int) signal.totalRetries();
            try {
                return Mono.delay(onFailure(failure, attempt));
            } catch (Throwable t) {
                return Mono.<Long>error(t);
            }
        })));
    }

    /**
     * Decides what to do with the failure of zero-based {@code attempt}: returns the wait before
     * the next attempt, or throws the failure when it must propagate.
     */
    private <E extends Throwable> Duration onFailure(E failure, int attempt) throws E {
        if (!retryable.test(failure)) {
            log.debug("{} failed with non-retryable error: {}", operation, failure.toString());
            throw failure;
        }
        if (attempt >= maxRetries) {
            int attempts = attempt + 1;
            log.error("{} failed after {} attempt(s): {}", operation, attempts, failure.toString());
            failure.addSuppressed(new RetryExhaustedException(operation, attempts));
            throw failure;
        }
        Duration wait = backoff.backoff(attempt);
        log.warn("{} failed (attempt {}/{}): {}. Retrying in {} ms", operation, attempt + 1, maxRetries + 1,
                failure.toString(), wait.toMillis());
        return wait;
    }
}
