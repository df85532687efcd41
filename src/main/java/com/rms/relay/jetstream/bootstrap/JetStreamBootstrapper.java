package com.rms.relay.jetstream.bootstrap;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.rms.relay.config.RelayProperties;
import com.rms.relay.jetstream.config.NatsProperties;
import com.rms.relay.jetstream.connection.NatsConnectionHandle;

import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.RetentionPolicy;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;

/**
 * =====================================================================
 * JetStreamBootstrapper
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Makes sure the stream the relay publishes into exists, covers the
 * publish subject, and has not drifted from its declared configuration.
 *
 * WHEN THIS RUNS
 * --------------
 * - Once, as an ApplicationRunner
 * - AFTER the NATS connection handle is connected
 * - BEFORE the dispatch loop starts (that waits for ApplicationReadyEvent)
 *
 * DRIFT
 * -----
 * An existing stream is never updated. Differences are reported:
 *  - relay.nats.stream.fail-on-mismatch=true  → startup fails
 *  - otherwise                                 → WARN log
 *
 * A publish subject the stream does not capture is always fatal: every
 * send would be rejected with "no responders".
 */
@Component
@ConditionalOnProperty(
        prefix = "relay.nats.stream",
        name = "bootstrap",
        havingValue = "true",
        matchIfMissing = true
)
public class JetStreamBootstrapper implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(JetStreamBootstrapper.class);

    /** JetStream API error code for "stream not found". Message text is not relied upon. */
    static final int JS_STREAM_NOT_FOUND_ERR = 10059;

    private final NatsConnectionHandle handle;
    private final NatsProperties.Stream declared;
    private final String publishSubject;

    public JetStreamBootstrapper(NatsConnectionHandle handle, NatsProperties natsProps, RelayProperties relayProps) {
        this.handle = handle;
        this.declared = natsProps.getStream();
        this.publishSubject = relayProps.getPublisher().getSubject();
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        ensureStream();
    }

    /**
     * Creates the stream when missing, otherwise validates it.
     *
     * FAILURE MODEL
     * -------------
     * - Auth / connectivity errors → propagate (startup fails)
     * - Config drift → fail or warn depending on fail-on-mismatch
     */
    void ensureStream() throws Exception {
        StreamConfiguration desired = toStreamConfig(declared);
        requireSubjectCovered(desired.getSubjects(), publishSubject, desired.getName());

        JetStreamManagement jsm = handle.management();
        try {
            StreamInfo existing = jsm.getStreamInfo(desired.getName());
            validateExisting(desired, existing);
            return;
        } catch (JetStreamApiException e) {
            // Only a missing stream is created; permission or infrastructure failures propagate.
            if (e.getApiErrorCode() != JS_STREAM_NOT_FOUND_ERR) {
                throw e;
            }
        }

        jsm.addStream(desired);
        log.info("Created JetStream stream: {} (subjects={}, maxAge={}, retention={}, storage={}, replicas={}, duplicateWindow={})",
                desired.getName(),
                desired.getSubjects(),
                desired.getMaxAge(),
                desired.getRetentionPolicy(),
                desired.getStorageType(),
                desired.getReplicas(),
                desired.getDuplicateWindow());
    }

    private void validateExisting(StreamConfiguration desired, StreamInfo existing) {
        StreamConfiguration actual = existing.getConfiguration();
        List<String> diffs = new ArrayList<>();

        if (!Objects.equals(actual.getRetentionPolicy(), desired.getRetentionPolicy())) {
            diffs.add("retentionPolicy actual=" + actual.getRetentionPolicy() + " expected=" + desired.getRetentionPolicy());
        }
        if (!Objects.equals(actual.getStorageType(), desired.getStorageType())) {
            diffs.add("storageType actual=" + actual.getStorageType() + " expected=" + desired.getStorageType());
        }
        if (!Objects.equals(actual.getMaxAge(), desired.getMaxAge())) {
            diffs.add("maxAge actual=" + actual.getMaxAge() + " expected=" + desired.getMaxAge());
        }
        if (actual.getReplicas() != desired.getReplicas()) {
            diffs.add("replicas actual=" + actual.getReplicas() + " expected=" + desired.getReplicas());
        }
        if (!Objects.equals(actual.getDuplicateWindow(), desired.getDuplicateWindow())) {
            diffs.add("duplicateWindow actual=" + actual.getDuplicateWindow() + " expected=" + desired.getDuplicateWindow());
        }
        if (!setEquals(actual.getSubjects(), desired.getSubjects())) {
            diffs.add("subjects actual=" + actual.getSubjects() + " expected=" + desired.getSubjects());
        }

        // Drift in other fields is tolerable; a stream that cannot capture our subject is not.
        requireSubjectCovered(actual.getSubjects(), publishSubject, desired.getName());

        if (diffs.isEmpty()) {
            log.info("JetStream stream exists and matches config: {} (subjects={})",
                    desired.getName(), actual.getSubjects());
            return;
        }

        String msg = "JetStream stream exists but differs from expected: "
                + desired.getName() + " :: " + String.join("; ", diffs);
        if (declared.isFailOnMismatch()) {
            throw new IllegalStateException(msg);
        }
        log.warn(msg);
    }

    private static void requireSubjectCovered(List<String> streamSubjects, String subject, String streamName) {
        boolean covered = streamSubjects != null
                && streamSubjects.stream().anyMatch(filter -> subjectMatches(filter, subject));
        if (!covered) {
            throw new IllegalStateException("Publish subject " + subject + " is not captured by stream "
                    + streamName + " (subjects=" + streamSubjects + ")");
        }
    }

    /**
     * NATS subject filter match: {@code *} matches one token, a trailing {@code >} one or more.
     */
    static boolean subjectMatches(String filter, String subject) {
        String[] f = filter.split("\\.");
        String[] s = subject.split("\\.");
        for (int i = 0; i < f.length; i++) {
            if (f[i].equals(">")) {
                return i == f.length - 1 && s.length > i;
            }
            if (i >= s.length) {
                return false;
            }
            if (!f[i].equals("*") && !f[i].equals(s[i])) {
                return false;
            }
        }
        return f.length == s.length;
    }

    private static boolean setEquals(List<String> a, List<String> b) {
        Set<String> sa = new HashSet<>(a == null ? List.of() : a);
        Set<String> sb = new HashSet<>(b == null ? List.of() : b);
        return sa.equals(sb);
    }

    /**
     * Declarative stream properties → JetStream StreamConfiguration.
     */
    static StreamConfiguration toStreamConfig(NatsProperties.Stream declared) {
        String name = declared.getName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("stream name is required");
        }
        List<String> subjects = declared.getSubjects();
        if (subjects == null || subjects.isEmpty()) {
            throw new IllegalArgumentException("subjects is required for stream " + name);
        }

        return StreamConfiguration.builder()
                .name(name)
                .subjects(subjects.toArray(String[]::new))
                .retentionPolicy(parseRetentionPolicy(declared.getRetentionPolicy()))
                .storageType(parseStorageType(declared.getStorageType()))
                .maxAge(Objects.requireNonNull(declared.getMaxAge(), "maxAge is required for stream " + name))
                .replicas(declared.getReplicas())
                .duplicateWindow(declared.getDuplicateWindow())
                .build();
    }

    /** Default: Limits. The relay's stream is read by downstream consumers, not drained. */
    static RetentionPolicy parseRetentionPolicy(String value) {
        if (value == null || value.isBlank()) {
            return RetentionPolicy.Limits;
        }
        return switch (value.trim().toLowerCase()) {
            case "limits" -> RetentionPolicy.Limits;
            case "interest" -> RetentionPolicy.Interest;
            case "workqueue", "work_queue", "work-queue" -> RetentionPolicy.WorkQueue;
            default -> throw new IllegalArgumentException("Unsupported retentionPolicy: " + value);
        };
    }

    /** Default: File. */
    static StorageType parseStorageType(String value) {
        if (value == null || value.isBlank()) {
            return StorageType.File;
        }
        return switch (value.trim().toLowerCase()) {
            case "file" -> StorageType.File;
            case "memory" -> StorageType.Memory;
            default -> throw new IllegalArgumentException("Unsupported storageType: " + value);
        };
    }
}
