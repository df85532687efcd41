package com.rms.relay.dispatch;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.rms.relay.config.RelayProperties;
import com.rms.relay.core.error.TrackingStoreWriteException;
import com.rms.relay.core.format.EventFormatter;
import com.rms.relay.core.model.DispatchEnvelope;
import com.rms.relay.core.model.EventRecord;
import com.rms.relay.core.model.PublishResult;
import com.rms.relay.core.model.RunUpdate;
import com.rms.relay.core.publisher.EventPublisher;
import com.rms.relay.core.source.EventSource;
import com.rms.relay.core.tracking.RunTracker;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * =====================================================================
 * DispatchCycle
 * =====================================================================
 *
 * PURPOSE
 * -------
 * One pass of the relay: read everything newer than the watermark,
 * publish it batch by batch, and move the watermark only as far as
 * what was durably acknowledged.
 *
 * FLOW
 * ----
 *   FETCHING      watermark (absent = epoch) → up to max-records-per-run records
 *   PUBLISHING    batches of batch-size, strictly one after another
 *   RECONCILING   a batch counts only if ALL its envelopes succeeded;
 *                 the first batch that does not stops the cycle
 *   ADVANCING     all batches succeeded → SUCCESS run record
 *   REPORTING_PARTIAL
 *                 watermark up to the last good batch, FAILED run record
 *                 naming the failed events
 *
 * WATERMARK RULES
 * ---------------
 * - Never moves backwards (also enforced by the tracking store).
 * - Never passes a batch with a non-SUCCEEDED outcome, so a failed event
 *   is always re-fetched by the next cycle. Events of the failing batch
 *   that did succeed are redelivered too; the bus drops them by Msg-Id.
 * - Stays strictly below the first timestamp that is not fully confirmed:
 *   the failing batch's first record, and on a page cut off by
 *   max-records-per-run the page's last timestamp (unseen rows may share
 *   it). The source query is {@code > watermark}, so ties would be lost.
 *
 * ERRORS
 * ------
 * - Failures before publishing (watermark read, source read, records out
 *   of order) produce a FAILED report with the watermark unchanged.
 * - A failed run-record write is NOT folded into the report: it surfaces
 *   as {@link TrackingStoreWriteException}, because the bus may already
 *   be ahead of the tracking store.
 *
 * Only one cycle runs at a time; a concurrent {@link #run()} fails fast.
 */
@Component
public class DispatchCycle {

    private static final Logger log = LoggerFactory.getLogger(DispatchCycle.class);

    /** Failed events listed by name in the run record error. */
    static final int MAX_LISTED_FAILURES = 10;

    private final EventSource source;
    private final RunTracker tracker;
    private final EventFormatter formatter;
    private final EventPublisher publisher;
    private final Clock clock;
    private final String programName;
    private final int batchSize;
    private final int maxRecordsPerRun;

    private final AtomicReference<CycleState> state = new AtomicReference<>(CycleState.IDLE);
    private volatile CycleReport lastReport;

    public DispatchCycle(EventSource source, RunTracker tracker, EventFormatter formatter, EventPublisher publisher,
            RelayProperties props, Clock clock) {
        this.source = Objects.requireNonNull(source, "source");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
        RelayProperties.Dispatcher d = props.getDispatcher();
        this.programName = d.getProgramName();
        this.batchSize = d.getBatchSize();
        this.maxRecordsPerRun = d.getMaxRecordsPerRun();
    }

    /**
     * Runs one cycle.
     *
     * @return the cycle report; errors only with {@link TrackingStoreWriteException} or
     *         {@link IllegalStateException} when a cycle is already running
     */
    public Mono<CycleReport> run() {
        return Mono.defer(() -> {
            if (!state.compareAndSet(CycleState.IDLE, CycleState.FETCHING)) {
                return Mono.error(new IllegalStateException("A dispatch cycle is already running (state=" + state.get() + ")"));
            }
            log.debug("Cycle for {}: FETCHING", programName);
            return fetch()
                    .flatMap(f -> {
                        if (f.error() != null) {
                            return abort(f.previous(), f.error());
                        }
                        if (f.records().isEmpty()) {
                            return completeEmpty(f.previous());
                        }
                        return publishAll(f);
                    })
                    .doOnNext(this::logReport)
                    .doOnNext(r -> lastReport = r)
                    .doFinally(signal -> state.set(CycleState.IDLE));
        });
    }

    // ---------------------------------------------------------------------
    // FETCHING
    // ---------------------------------------------------------------------

    private Mono<Fetched> fetch() {
        return tracker.findWatermark(programName)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(wm -> {
                    Instant previous = wm.orElse(null);
                    return source.fetchSince(previous, maxRecordsPerRun)
                            .collectList()
                            .map(records -> {
                                requireOrdered(previous, records);
                                boolean capped = records.size() >= maxRecordsPerRun;
                                if (capped) {
                                    requireProgress(records, maxRecordsPerRun);
                                }
                                return new Fetched(previous, records, capped, null);
                            })
                            .onErrorResume(e -> Mono.just(new Fetched(previous, List.of(), false, e)));
                })
                .onErrorResume(e -> Mono.just(new Fetched(null, List.of(), false, e)));
    }

    /**
     * Records must be strictly after the watermark and in non-decreasing timestamp order;
     * anything else would make the watermark skip events.
     */
    static void requireOrdered(Instant watermark, List<EventRecord> records) {
        Instant last = watermark;
        for (EventRecord r : records) {
            if (watermark != null && !r.timestamp().isAfter(watermark)) {
                throw new IllegalStateException("Record " + r.id() + " at " + r.timestamp()
                        + " is not after the watermark " + watermark);
            }
            if (last != null && r.timestamp().isBefore(last)) {
                throw new IllegalStateException("Records out of order: " + r.id() + " at " + r.timestamp()
                        + " follows " + last);
            }
            last = r.timestamp();
        }
    }

    /**
     * A full page whose records all share one timestamp can never advance the watermark
     * without skipping the rows cut off after it.
     */
    static void requireProgress(List<EventRecord> records, int limit) {
        Instant first = records.get(0).timestamp();
        Instant last = records.get(records.size() - 1).timestamp();
        if (first.equals(last)) {
            throw new IllegalStateException("All " + records.size() + " fetched record(s) share timestamp " + last
                    + " and more may follow; raise max-records-per-run above " + limit);
        }
    }

    private Mono<CycleReport> abort(Instant previous, Throwable error) {
        String message = "Fetch failed: " + describe(error);
        log.error("Cycle for {} aborted before publishing: {}", programName, message, error);
        return save(RunUpdate.failure(programName, null, 0, message))
                .thenReturn(report(CycleStatus.FAILED, previous, previous, 0, 0, 0, message));
    }

    private Mono<CycleReport> completeEmpty(Instant previous) {
        return save(RunUpdate.success(programName, null, 0))
                .thenReturn(report(CycleStatus.EMPTY, previous, previous, 0, 0, 0, null));
    }

    // ---------------------------------------------------------------------
    // PUBLISHING
    // ---------------------------------------------------------------------

    private Mono<CycleReport> publishAll(Fetched f) {
        state.set(CycleState.PUBLISHING);
        List<List<EventRecord>> batches = partition(f.records(), batchSize);
        log.debug("Cycle for {}: PUBLISHING {} record(s) in {} batch(es)", programName, f.records().size(), batches.size());

        Mono<List<BatchReport>> published = Flux.fromIterable(batches)
                .index()
                .concatMap(indexed -> Mono.defer(() -> {
                    int index = indexed.getT1().intValue();
                    List<DispatchEnvelope> envelopes = indexed.getT2().stream().map(formatter::format).toList();
                    return publisher.publishBatch(envelopes).flatMap(results -> results.size() == envelopes.size()
                            ? Mono.just(new BatchReport(index, results))
                            : Mono.error(new IllegalStateException("Publisher returned " + results.size()
                                    + " result(s) for " + envelopes.size() + " envelope(s) in batch " + (index + 1))));
                }))
                .takeUntil(batch -> !batch.succeeded())
                .collectList();

        return published.materialize().flatMap(signal -> signal.isOnError()
                ? abortPublishing(f, batches.size(), signal.getThrowable())
                : reconcile(f, batches.size(), signal.get()));
    }

    /** The publisher broke its contract and errored; nothing published is trusted. */
    private Mono<CycleReport> abortPublishing(Fetched f, int batchCount, Throwable error) {
        String message = "Publishing failed: " + describe(error);
        log.error("Cycle for {} failed while publishing: {}", programName, message, error);
        return save(RunUpdate.failure(programName, null, 0, message))
                .thenReturn(report(CycleStatus.FAILED, f.previous(), f.previous(), f.records().size(), 0, batchCount, message));
    }

    // ---------------------------------------------------------------------
    // RECONCILING
    // ---------------------------------------------------------------------

    private Mono<CycleReport> reconcile(Fetched f, int batchCount, List<BatchReport> reports) {
        state.set(CycleState.RECONCILING);

        int published = 0;
        BatchReport failed = null;
        List<BatchReport> confirmed = new ArrayList<>(reports.size());
        for (BatchReport batch : reports) {
            if (!batch.succeeded()) {
                failed = batch;
                break;
            }
            published += batch.size();
            confirmed.add(batch);
        }

        Instant bound = f.capped() ? f.records().get(f.records().size() - 1).timestamp() : null;
        if (failed != null && (bound == null || failed.firstTimestamp().isBefore(bound))) {
            bound = failed.firstTimestamp();
        }
        Instant candidate = safeWatermark(f.previous(), confirmed, bound);

        Instant advanceTo = Objects.equals(candidate, f.previous()) ? null : candidate;

        if (failed == null) {
            state.set(CycleState.ADVANCING);
            return save(RunUpdate.success(programName, advanceTo, published))
                    .thenReturn(report(CycleStatus.SUCCESS, f.previous(), candidate, f.records().size(), published,
                            reports.size(), null));
        }

        state.set(CycleState.REPORTING_PARTIAL);
        String message = describeFailure(failed, batchCount);
        CycleStatus status = published > 0 ? CycleStatus.PARTIAL : CycleStatus.FAILED;
        return save(RunUpdate.failure(programName, advanceTo, published, message))
                .thenReturn(report(status, f.previous(), candidate, f.records().size(), published, reports.size(), message));
    }

    /**
     * Latest confirmed timestamp strictly before {@code bound} ({@code null} = no bound),
     * or {@code previous} when there is none.
     */
    static Instant safeWatermark(Instant previous, List<BatchReport> confirmed, Instant bound) {
        Instant candidate = previous;
        for (BatchReport batch : confirmed) {
            for (PublishResult r : batch.results()) {
                Instant ts = r.envelope().record().timestamp();
                if ((bound == null || ts.isBefore(bound)) && (candidate == null || ts.isAfter(candidate))) {
                    candidate = ts;
                }
            }
        }
        return candidate;
    }

    static String describeFailure(BatchReport failed, int batchCount) {
        List<PublishResult> failures = failed.failures();
        String listed = failures.stream()
                .limit(MAX_LISTED_FAILURES)
                .map(r -> r.envelope().eventId() + " " + r.outcome().status() + ": " + r.outcome().reason())
                .collect(Collectors.joining("; "));
        if (failures.size() > MAX_LISTED_FAILURES) {
            listed += "; ... " + (failures.size() - MAX_LISTED_FAILURES) + " more";
        }
        return "Batch " + (failed.index() + 1) + "/" + batchCount + ": " + failures.size() + " of " + failed.size()
                + " event(s) not published [" + listed + "]";
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private Mono<Void> save(RunUpdate update) {
        return tracker.saveRun(update)
                .onErrorMap(e -> !(e instanceof TrackingStoreWriteException),
                        e -> new TrackingStoreWriteException("Failed to record run for " + programName, e));
    }

    private CycleReport report(CycleStatus status, Instant previous, Instant current, int fetched, int published,
            int batches, String error) {
        return new CycleReport(status, previous, current, fetched, published, batches, error, clock.instant());
    }

    private void logReport(CycleReport r) {
        switch (r.status()) {
            case SUCCESS -> log.info("Cycle for {}: published {}/{} record(s) in {} batch(es); watermark {} -> {}",
                    programName, r.published(), r.fetched(), r.batches(), r.previousWatermark(), r.newWatermark());
            case EMPTY -> log.info("Cycle for {}: no new records since {}", programName, r.previousWatermark());
            case PARTIAL -> log.warn("Cycle for {}: partial, published {}/{} record(s); watermark {} -> {}; {}",
                    programName, r.published(), r.fetched(), r.previousWatermark(), r.newWatermark(), r.error());
            case FAILED -> log.error("Cycle for {} failed; watermark kept at {}; {}",
                    programName, r.previousWatermark(), r.error());
        }
    }

    static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> out = new ArrayList<>((items.size() + size - 1) / size);
        for (int i = 0; i < items.size(); i += size) {
            out.add(items.subList(i, Math.min(items.size(), i + size)));
        }
        return out;
    }

    private static String describe(Throwable e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    public CycleState state() {
        return state.get();
    }

    /** Report of the last completed cycle, or {@code null} before the first one. */
    public CycleReport lastReport() {
        return lastReport;
    }

    public String programName() {
        return programName;
    }

    private record Fetched(Instant previous, List<EventRecord> records, boolean capped, Throwable error) {
    }
}
