package com.rms.relay.dispatch;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.rms.relay.config.RelayProperties;
import com.rms.relay.core.error.TrackingStoreWriteException;
import com.rms.relay.core.publisher.EventPublisher;
import com.rms.relay.core.tracking.RunTracker;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Drives {@link DispatchCycle} in a sequential loop.
 *
 * <ul>
 *   <li>Starts on {@link ApplicationReadyEvent}, after the stream bootstrap has run.</li>
 *   <li>Ensures the program's tracking row exists, retrying with the error pause while the
 *       tracking store is unreachable.</li>
 *   <li>After a SUCCESS or EMPTY cycle waits the poll interval; after PARTIAL, FAILED or a tracking
 *       failure waits the shorter error pause. The next cycle starts only after the previous one
 *       completed, so two cycles never overlap.</li>
 * </ul>
 *
 * Shutdown lets the in-flight cycle publish, reconcile and advance (bounded by the shutdown
 * timeout) before the loop is cancelled and the publisher closed.
 */
@Component
@ConditionalOnProperty(prefix = "relay.dispatcher", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DispatchScheduler implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(DispatchScheduler.class);

    private final DispatchCycle cycle;
    private final RunTracker tracker;
    private final EventPublisher publisher;
    private final Duration pollInterval;
    private final Duration errorPause;
    private final Duration shutdownTimeout;

    private final AtomicBoolean accepting = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    /** Guards the accepting check together with the in-flight handoff to {@link #destroy()}. */
    private final Object lifecycle = new Object();
    private volatile CompletableFuture<Void> inFlight = CompletableFuture.completedFuture(null);
    private volatile Disposable loop;

    public DispatchScheduler(DispatchCycle cycle, RunTracker tracker, EventPublisher publisher, RelayProperties props) {
        this.cycle = cycle;
        this.tracker = tracker;
        this.publisher = publisher;
        RelayProperties.Dispatcher d = props.getDispatcher();
        this.pollInterval = d.getPollInterval();
        this.errorPause = d.getErrorPause();
        this.shutdownTimeout = d.getShutdownTimeout();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (stopped.get() || !accepting.compareAndSet(false, true)) {
            return;
        }
        log.info("Dispatch loop starting for {} (pollInterval={}, errorPause={})",
                cycle.programName(), pollInterval, errorPause);

        Mono<Void> ensureProgram = tracker.ensureProgram(cycle.programName())
                .retryWhen(Retry.fixedDelay(Long.MAX_VALUE, errorPause)
                        .filter(e -> accepting.get())
                        .doBeforeRetry(s -> log.warn("Tracking row for {} not ready, retrying in {}: {}",
                                cycle.programName(), errorPause, s.failure().toString())));

        this.loop = ensureProgram
                .thenMany(Mono.defer(this::runGuarded)
                        .flatMap(Mono::delay)
                        .repeat(accepting::get))
                .subscribe(
                        ignored -> { },
                        e -> log.error("Dispatch loop for {} terminated", cycle.programName(), e),
                        () -> log.info("Dispatch loop for {} stopped", cycle.programName()));
    }

    /**
     * One cycle; always completes with the pause to apply before the next one.
     */
    Mono<Duration> runGuarded() {
        CompletableFuture<Void> done = new CompletableFuture<>();
        synchronized (lifecycle) {
            if (!accepting.get()) {
                return Mono.empty();
            }
            inFlight = done;
        }
        return cycle.run()
                .map(report -> report.status() == CycleStatus.SUCCESS || report.status() == CycleStatus.EMPTY
                        ? pollInterval
                        : errorPause)
                .onErrorResume(TrackingStoreWriteException.class, e -> {
                    log.error("Published but not tracked for {}: {}; events will be redelivered",
                            cycle.programName(), e.getMessage(), e);
                    return Mono.just(errorPause);
                })
                .onErrorResume(e -> {
                    log.error("Dispatch cycle for {} failed unexpectedly", cycle.programName(), e);
                    return Mono.just(errorPause);
                })
                .doFinally(signal -> done.complete(null));
    }

    @Override
    public void destroy() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        CompletableFuture<Void> pending;
        synchronized (lifecycle) {
            accepting.set(false);
            pending = inFlight;
        }

        try {
            pending.get(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Dispatch cycle still running after {}; cancelling", shutdownTimeout);
        } catch (ExecutionException e) {
            log.warn("Dispatch cycle ended with an error during shutdown: {}", e.getCause().toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the dispatch cycle");
        }

        Disposable l = loop;
        if (l != null && !l.isDisposed()) {
            l.dispose();
        }
        publisher.close();
        log.info("Dispatch scheduler for {} shut down", cycle.programName());
    }

    public boolean isAccepting() {
        return accepting.get();
    }
}
