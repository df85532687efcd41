package com.rms.relay.jetstream.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.rms.relay.config.RetryProperties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * NATS connectivity and the JetStream stream the relay publishes into.
 *
 * <h2>Binding</h2>
 * <pre>
 * relay:
 *   nats:
 *     servers: [nats://localhost:4222]
 *     user: ...
 *     password: ...
 *     token: ...
 *     creds: /path/to/user.creds
 *     connect-timeout: 10s
 *     max-reconnects: 60
 *     reconnect-wait: 2s
 *     connect-retry: { max-retries: 5, initial-backoff: 1s, max-backoff: 30s }
 *     stream:
 *       name: TXLOG_STREAM
 *       subjects: [txlog.events]
 * </pre>
 *
 * <h2>TLS</h2>
 * Use {@code tls://} server URLs; the client negotiates TLS with the JVM default SSL context.
 *
 * <h2>Security</h2>
 * Password and token are secrets: never logged, never committed. Prefer {@code RELAY_NATS_PASSWORD}
 * or a creds file mounted from a secrets manager.
 */
@Validated
@ConfigurationProperties(prefix = "relay.nats")
public class NatsProperties {

    // ---------------------------------------------------------------------
    // Connectivity
    // ---------------------------------------------------------------------

    /** One or more server URLs of the same cluster. */
    @NotEmpty
    private List<String> servers = new ArrayList<>(List.of("nats://localhost:4222"));

    /** Optional username for user/password authentication. */
    private String user;

    /** Optional password for user/password authentication. */
    private String password;

    /** Optional token for token-based authentication. */
    private String token;

    /** Optional path to a {@code .creds} file (NKey/JWT). */
    private String creds;

    /** Timeout of a single connect attempt. */
    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(10);

    /** Client-side reconnect attempts after an established connection drops. */
    private int maxReconnects = 60;

    @NotNull
    private Duration reconnectWait = Duration.ofSeconds(2);

    /** Retries of the initial connect; exhaustion fails startup. */
    @Valid
    private RetryProperties connectRetry = new RetryProperties();

    // ---------------------------------------------------------------------
    // Stream
    // ---------------------------------------------------------------------

    @Valid
    private Stream stream = new Stream();

    public List<String> getServers() { return servers; }
    public void setServers(List<String> servers) { this.servers = servers; }

    public String getUser() { return user; }
    public void setUser(String user) { this.user = user; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public String getToken() { return token; }
    public void setToken(String token) { this.token = token; }

    public String getCreds() { return creds; }
    public void setCreds(String creds) { this.creds = creds; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public int getMaxReconnects() { return maxReconnects; }
    public void setMaxReconnects(int maxReconnects) { this.maxReconnects = maxReconnects; }

    public Duration getReconnectWait() { return reconnectWait; }
    public void setReconnectWait(Duration reconnectWait) { this.reconnectWait = reconnectWait; }

    public RetryProperties getConnectRetry() { return connectRetry; }
    public void setConnectRetry(RetryProperties connectRetry) { this.connectRetry = connectRetry; }

    public Stream getStream() { return stream; }
    public void setStream(Stream stream) { this.stream = stream; }

    /**
     * Declarative definition of the target stream.
     *
     * <p>Defaults favour durability: file storage, limits retention (the relay's stream is read by
     * downstream consumers, not drained as a work queue), seven days max age.</p>
     */
    public static class Stream {

        /** Create the stream when missing and check an existing one for drift at startup. */
        private boolean bootstrap = true;

        /** Fail startup (instead of warning) when an existing stream differs from these settings. */
        private boolean failOnMismatch = false;

        @NotBlank
        private String name = "TXLOG_STREAM";

        @NotEmpty
        private List<String> subjects = new ArrayList<>(List.of("txlog.events"));

        /** limits | interest | workqueue */
        private String retentionPolicy = "limits";

        /** file | memory */
        private String storageType = "file";

        @NotNull
        private Duration maxAge = Duration.ofDays(7);

        @Positive
        private int replicas = 1;

        /** Server-side duplicate window for Msg-Id de-duplication. */
        @NotNull
        private Duration duplicateWindow = Duration.ofMinutes(2);

        public boolean isBootstrap() { return bootstrap; }
        public void setBootstrap(boolean bootstrap) { this.bootstrap = bootstrap; }

        public boolean isFailOnMismatch() { return failOnMismatch; }
        public void setFailOnMismatch(boolean failOnMismatch) { this.failOnMismatch = failOnMismatch; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public List<String> getSubjects() { return subjects; }
        public void setSubjects(List<String> subjects) { this.subjects = subjects; }

        public String getRetentionPolicy() { return retentionPolicy; }
        public void setRetentionPolicy(String retentionPolicy) { this.retentionPolicy = retentionPolicy; }

        public String getStorageType() { return storageType; }
        public void setStorageType(String storageType) { this.storageType = storageType; }

        public Duration getMaxAge() { return maxAge; }
        public void setMaxAge(Duration maxAge) { this.maxAge = maxAge; }

        public int getReplicas() { return replicas; }
        public void setReplicas(int replicas) { this.replicas = replicas; }

        public Duration getDuplicateWindow() { return duplicateWindow; }
        public void setDuplicateWindow(Duration duplicateWindow) { this.duplicateWindow = duplicateWindow; }
    }
}
