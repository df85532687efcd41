package com.rms.relay.jetstream.config;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rms.relay.config.RelayProperties;
import com.rms.relay.core.publisher.EventPublisher;
import com.rms.relay.core.retry.RetryExecutor;
import com.rms.relay.jetstream.connection.NatsConnectionHandle;
import com.rms.relay.jetstream.publisher.EnvelopeSerializer;
import com.rms.relay.jetstream.publisher.JetStreamEventPublisher;

import io.nats.client.Nats;
import io.nats.client.Options;

/**
 * Spring configuration that wires up the single NATS connection of the relay and the publisher
 * that owns it.
 *
 * <h2>Purpose</h2>
 * <ul>
 *   <li>Translate {@link NatsProperties} into client {@link Options} (servers, auth, reconnect).</li>
 *   <li>Create the {@link NatsConnectionHandle} and connect it before any dependent bean starts.</li>
 *   <li>Expose the JetStream {@link EventPublisher} used by the dispatch cycle.</li>
 * </ul>
 *
 * <h2>Failure behavior</h2>
 * The initial connect is retried per {@code relay.nats.connect-retry}. When it still fails the bean
 * cannot be created and the application does not start.
 *
 * <h2>Security note</h2>
 * Secrets are passed to the client as char arrays and never logged. The user name is masked.
 */
@Configuration
@EnableConfigurationProperties(NatsProperties.class)
public class NatsJetStreamConfig {

    private static final Logger log = LoggerFactory.getLogger(NatsJetStreamConfig.class);

    @Bean
    public Options natsOptions(NatsProperties props) {
        Options.Builder builder = new Options.Builder()
                .servers(props.getServers().toArray(String[]::new))
                .connectionTimeout(props.getConnectTimeout())
                .maxReconnects(props.getMaxReconnects())
                .reconnectWait(props.getReconnectWait())
                .connectionListener((conn, event) -> log.info("NATS connection event: {}", event));

        if (hasText(props.getToken())) {
            builder.token(props.getToken().toCharArray());
        }
        if (hasText(props.getUser())) {
            String pass = props.getPassword() == null ? "" : props.getPassword();
            builder.userInfo(props.getUser().toCharArray(), pass.toCharArray());
        }
        if (hasText(props.getCreds())) {
            builder.authHandler(Nats.credentials(props.getCreds()));
        }

        log.info("NATS options (servers={}, user={}, token={}, creds={}, maxReconnects={})",
                props.getServers(),
                hasText(props.getUser()) ? mask(props.getUser()) : "",
                hasText(props.getToken()),
                hasText(props.getCreds()) ? props.getCreds() : "",
                props.getMaxReconnects());
        return builder.build();
    }

    /**
     * The connected handle. Closed by the publisher on shutdown; the container closes it again as a
     * no-op.
     */
    @Bean(destroyMethod = "close")
    public NatsConnectionHandle natsConnectionHandle(Options natsOptions, NatsProperties props,
            RelayProperties relay) {
        RetryExecutor retry = props.getConnectRetry()
                .toExecutor("nats-connect", t -> t instanceof IOException);
        NatsConnectionHandle handle =
                new NatsConnectionHandle(natsOptions, retry, relay.getPublisher().getDrainTimeout());
        handle.connect();
        return handle;
    }

    @Bean
    public EnvelopeSerializer envelopeSerializer(ObjectMapper objectMapper, RelayProperties relay) {
        return new EnvelopeSerializer(objectMapper, relay.getPublisher().getMaxPayloadBytes());
    }

    @Bean(destroyMethod = "close")
    public EventPublisher eventPublisher(NatsConnectionHandle natsConnectionHandle,
            EnvelopeSerializer envelopeSerializer, RelayProperties relay) {
        return new JetStreamEventPublisher(natsConnectionHandle, envelopeSerializer, relay.getPublisher());
    }

    private static boolean hasText(String v) {
        return v != null && !v.isBlank();
    }

    /** "admin" -> "a***n"; only meant to keep raw identifiers out of logs. */
    static String mask(String v) {
        if (v == null || v.isBlank()) return "";
        if (v.length() <= 2) return "**";
        return v.substring(0, 1) + "***" + v.substring(v.length() - 1);
    }
}
