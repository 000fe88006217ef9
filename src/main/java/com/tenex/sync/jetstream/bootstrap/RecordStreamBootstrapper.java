package com.tenex.sync.jetstream.bootstrap;

import com.tenex.sync.jetstream.config.RecordStreamBootstrapProperties;
import com.tenex.sync.jetstream.config.RecordStreamProperties;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.Placement;
import io.nats.client.api.RetentionPolicy;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * =====================================================================
 * RecordStreamBootstrapper
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Ensures the record stream exists and conforms to
 * {@link RecordStreamProperties} before subscriptions start.
 *
 * WHEN THIS RUNS
 * --------------
 * - Once during Spring Boot startup
 * - AFTER the NATS connection is established
 * - BEFORE the sync session opens its subscriptions
 *
 * WHO SHOULD ENABLE THIS
 * ----------------------
 * ONLY the node that owns the stream. Read-only nodes keep
 * {@code tenex.sync.bootstrap.enabled=false}.
 *
 * DRIFT
 * -----
 * Retention, storage, max age, replicas, subjects and placement are compared.
 * On mismatch the bootstrapper fails or warns per
 * {@link RecordStreamBootstrapProperties#isFailOnMismatch()}. It never
 * modifies an existing stream.
 */
@Component
@ConditionalOnProperty(prefix = "tenex.sync.bootstrap", name = "enabled", havingValue = "true", matchIfMissing = false)
public class RecordStreamBootstrapper implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(RecordStreamBootstrapper.class);

    /**
     * JetStream API error code indicating "stream not found". Only the numeric code is trusted,
     * never the message text.
     */
    private static final int JS_STREAM_NOT_FOUND_ERR = 10059;

    private final JetStreamManagement jsm;
    private final RecordStreamProperties streamProps;
    private final RecordStreamBootstrapProperties bootstrapProps;
    private final ApplicationEventPublisher publisher;

    public RecordStreamBootstrapper(
            JetStreamManagement jsm,
            RecordStreamProperties streamProps,
            RecordStreamBootstrapProperties bootstrapProps,
            ApplicationEventPublisher publisher
    ) {
        this.jsm = jsm;
        this.streamProps = streamProps;
        this.bootstrapProps = bootstrapProps;
        this.publisher = publisher;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        ensureStream(toStreamConfig(streamProps));

        publisher.publishEvent(new RecordStreamReadyEvent(streamProps.getName()));
        log.info("Record stream bootstrap complete (published RecordStreamReadyEvent)");
    }

    /**
     * Creates the stream when missing, otherwise validates it. Auth and connectivity failures
     * propagate and fail startup.
     */
    void ensureStream(StreamConfiguration desired) throws Exception {
        try {
            StreamInfo existing = jsm.getStreamInfo(desired.getName());
            validateExisting(desired, existing);
            return;
        } catch (JetStreamApiException e) {
            if (e.getApiErrorCode() != JS_STREAM_NOT_FOUND_ERR) {
                throw e;
            }
        }

        jsm.addStream(desired);

        log.info("Created record stream: {} (subjects={}, maxAge={}, retention={}, storage={}, replicas={}, duplicateWindow={})",
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
        if (!setEquals(actual.getSubjects(), desired.getSubjects())) {
            diffs.add("subjects actual=" + actual.getSubjects() + " expected=" + desired.getSubjects());
        }
        String actualCluster = actual.getPlacement() == null ? null : actual.getPlacement().getCluster();
        String desiredCluster = desired.getPlacement() == null ? null : desired.getPlacement().getCluster();
        if (!Objects.equals(actualCluster, desiredCluster)) {
            diffs.add("placementCluster actual=" + actualCluster + " expected=" + desiredCluster);
        }
        List<String> actualTags = actual.getPlacement() == null ? List.of() : actual.getPlacement().getTags();
        List<String> desiredTags = desired.getPlacement() == null ? List.of() : desired.getPlacement().getTags();
        if (!setEquals(actualTags, desiredTags)) {
            diffs.add("placementTags actual=" + actualTags + " expected=" + desiredTags);
        }

        if (diffs.isEmpty()) {
            log.info("Record stream exists and matches config: {} (subjects={})", desired.getName(), actual.getSubjects());
            return;
        }

        String msg = "Record stream exists but differs from expected: " + desired.getName() + " :: " + String.join("; ", diffs);
        if (bootstrapProps.isFailOnMismatch()) {
            throw new IllegalStateException(msg);
        }
        log.warn(msg);
    }

    private static boolean setEquals(List<String> a, List<String> b) {
        Set<String> sa = new HashSet<>(a == null ? List.of() : a);
        Set<String> sb = new HashSet<>(b == null ? List.of() : b);
        return sa.equals(sb);
    }

    /**
     * Declarative properties to JetStream configuration. The only place the translation happens.
     */
    static StreamConfiguration toStreamConfig(RecordStreamProperties p) {
        if (p.getName() == null || p.getName().isBlank()) {
            throw new IllegalArgumentException("tenex.sync.stream.name is required");
        }
        Objects.requireNonNull(p.getMaxAge(), "tenex.sync.stream.max-age is required");

        StreamConfiguration.Builder b = StreamConfiguration.builder()
                .name(p.getName())
                .subjects(p.wildcardSubject())
                .retentionPolicy(parseRetentionPolicy(p.getRetentionPolicy()))
                .storageType(parseStorageType(p.getStorageType()))
                .maxAge(p.getMaxAge())
                .duplicateWindow(p.getDuplicateWindow())
                .replicas(p.getReplicas());

        b.placement(toPlacement(p));
        return b.build();
    }

    /**
     * JetStream placement always names a cluster; tags without one are ignored.
     */
    static Placement toPlacement(RecordStreamProperties p) {
        String cluster = p.getPlacementCluster();
        List<String> tags = p.getPlacementTags() == null ? List.of() : p.getPlacementTags();
        if (cluster == null || cluster.isBlank()) {
            if (!tags.isEmpty()) {
                log.warn("Ignoring tenex.sync.stream.placement-tags={} without placement-cluster", tags);
            }
            return null;
        }
        return Placement.builder().cluster(cluster.trim()).tags(tags.toArray(String[]::new)).build();
    }

    /**
     * Default: Limits. WorkQueue is rejected (records must stay replayable).
     */
    static RetentionPolicy parseRetentionPolicy(String value) {
        if (value == null || value.isBlank()) {
            return RetentionPolicy.Limits;
        }
        String v = value.trim().toLowerCase();
        return switch (v) {
            case "limits" -> RetentionPolicy.Limits;
            case "interest" -> RetentionPolicy.Interest;
            case "workqueue", "work_queue", "work-queue" -> throw new IllegalArgumentException(
                    "WorkQueue retention cannot back a replayable record stream");
            default -> throw new IllegalArgumentException("Unsupported retentionPolicy: " + value);
        };
    }

    static StorageType parseStorageType(String value) {
        if (value == null || value.isBlank()) {
            return StorageType.File;
        }
        String v = value.trim().toLowerCase();
        return switch (v) {
            case "file" -> StorageType.File;
            case "memory" -> StorageType.Memory;
            default -> throw new IllegalArgumentException("Unsupported storageType: " + value);
        };
    }
}
