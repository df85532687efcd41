package com.rms.relay.admin;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.rms.relay.core.tracking.RunTracker;
import com.rms.relay.dispatch.DispatchCycle;
import com.rms.relay.dispatch.DispatchScheduler;

import reactor.core.publisher.Mono;

/**
 * Read-only view of the relay for operators.
 *
 * <pre>
 * GET /api/dispatcher/status
 * {
 *   "programName": "M_INTIMECASEAGENT",
 *   "accepting": true,
 *   "cycleState": "IDLE",
 *   "lastCycle": { "status": "SUCCESS", ... },
 *   "runRecord": { "lastSuccessfulTime": ..., "status": "SUCCESS", ... }
 * }
 * </pre>
 * {@code accepting} is false when the loop is disabled or shutting down.
 */
@RestController
@RequestMapping(path = "/api/dispatcher", produces = MediaType.APPLICATION_JSON_VALUE)
public class DispatcherStatusController {

    private final DispatchCycle cycle;
    private final RunTracker tracker;
    private final ObjectProvider<DispatchScheduler> scheduler;

    public DispatcherStatusController(DispatchCycle cycle, RunTracker tracker,
            ObjectProvider<DispatchScheduler> scheduler) {
        this.cycle = cycle;
        this.tracker = tracker;
        this.scheduler = scheduler;
    }

    @GetMapping("/status")
    public Mono<Map<String, Object>> status() {
        return tracker.findProgram(cycle.programName())
                .map(record -> body(record))
                .switchIfEmpty(Mono.fromSupplier(() -> body(null)));
    }

    private Map<String, Object> body(Object runRecord) {
        DispatchScheduler s = scheduler.getIfAvailable();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("programName", cycle.programName());
        out.put("accepting", s != null && s.isAccepting());
        out.put("cycleState", cycle.state());
        out.put("lastCycle", cycle.lastReport());
        out.put("runRecord", runRecord);
        return out;
    }
}
