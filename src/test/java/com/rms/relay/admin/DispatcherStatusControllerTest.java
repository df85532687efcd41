package com.rms.relay.admin;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.rms.relay.config.JacksonConfig;
import com.rms.relay.config.RelayProperties;
import com.rms.relay.dispatch.DispatchCycle;
import com.rms.relay.dispatch.DispatchScheduler;
import com.rms.relay.support.Events;
import com.rms.relay.support.InMemoryEventSource;
import com.rms.relay.support.InMemoryRunTracker;
import com.rms.relay.support.ScriptedPublisher;

class DispatcherStatusControllerTest {

    private static final String PROGRAM = "M_INTIMECASEAGENT";

    private InMemoryEventSource source;
    private InMemoryRunTracker tracker;
    private DispatchCycle cycle;
    private DispatchScheduler scheduler;
    private WebTestClient client;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        source = new InMemoryEventSource();
        tracker = new InMemoryRunTracker();
        RelayProperties props = new RelayProperties();
        props.getDispatcher().setProgramName(PROGRAM);
        cycle = new DispatchCycle(source, tracker, Events.FORMATTER, new ScriptedPublisher(), props, Events.CLOCK);

        scheduler = mock(DispatchScheduler.class);
        ObjectProvider<DispatchScheduler> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenAnswer(inv -> scheduler);

        client = WebTestClient
                .bindToController(new DispatcherStatusController(cycle, tracker, provider))
                .httpMessageCodecs(codecs -> codecs.defaultCodecs()
                        .jackson2JsonEncoder(new Jackson2JsonEncoder(JacksonConfig.relayObjectMapper())))
                .build();
    }

    @Test
    void beforeTheFirstCycle() {
        scheduler = null;

        client.get().uri("/api/dispatcher/status").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.programName").isEqualTo(PROGRAM)
                .jsonPath("$.accepting").isEqualTo(false)
                .jsonPath("$.cycleState").isEqualTo("IDLE")
                .jsonPath("$.lastCycle").doesNotExist()
                .jsonPath("$.runRecord").doesNotExist();
    }

    @Test
    void afterASuccessfulCycle() {
        when(scheduler.isAccepting()).thenReturn(true);
        tracker.ensureProgram(PROGRAM).block();
        source.append(Events.records("r", Events.T0, 2));
        cycle.run().block();

        client.get().uri("/api/dispatcher/status").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.accepting").isEqualTo(true)
                .jsonPath("$.lastCycle.status").isEqualTo("SUCCESS")
                .jsonPath("$.lastCycle.published").isEqualTo(2)
                .jsonPath("$.lastCycle.newWatermark").isEqualTo("2024-05-01T10:00:02Z")
                .jsonPath("$.lastCycle.error").doesNotExist()
                .jsonPath("$.runRecord.status").isEqualTo("SUCCESS")
                .jsonPath("$.runRecord.lastSuccessfulTime").isEqualTo("2024-05-01T10:00:02Z")
                .jsonPath("$.runRecord.totalRecordsProcessed").isEqualTo(2);
    }
}
