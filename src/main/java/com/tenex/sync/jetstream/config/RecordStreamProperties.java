package com.tenex.sync.jetstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * =====================================================================
 * RecordStreamProperties
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Declarative definition of the JetStream stream that stores records, and of
 * how the transport reads it.
 *
 * SUBJECT LAYOUT (LOCKED)
 * -----------------------
 *   <subject-prefix>.<kind>      e.g. tenex.records.31933
 *
 * The stream captures {@code <subject-prefix>.>}. One subject per kind lets a
 * subscription bind server-side filters to exactly the kinds it needs.
 *
 * RETENTION
 * ---------
 * Limits. Records are replayed to every new subscription (cache policies
 * CACHE_ONLY and CACHE_THEN_NETWORK), so consumption must never delete them.
 *
 * CONFIGURATION PREFIX
 * --------------------
 * tenex.sync.stream.*
 */
@ConfigurationProperties(prefix = "tenex.sync.stream")
public class RecordStreamProperties {

    private String name = "TENEX_RECORDS";

    private String subjectPrefix = "tenex.records";

    /**
     * Maximum age of stored records. Ephemeral kinds are published like any other kind and age
     * out with the rest.
     */
    private Duration maxAge = Duration.ofDays(30);

    private String retentionPolicy = "Limits";

    private String storageType = "File";

    private int replicas = 1;

    /**
     * Server-side Msg-Id de-duplication window.
     */
    private Duration duplicateWindow = Duration.ofMinutes(2);

    /**
     * Cluster the stream is placed in. Placement tags only take effect together with a cluster.
     */
    private String placementCluster;

    private List<String> placementTags = new ArrayList<>();

    /**
     * Records requested per pull.
     */
    private int fetchBatch = 256;

    /**
     * Max time one pull waits for records before returning what it has.
     */
    private Duration fetchWait = Duration.ofMillis(500);

    public String subjectFor(int kind) {
        return subjectPrefix + "." + kind;
    }

    public String wildcardSubject() {
        return subjectPrefix + ".>";
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getSubjectPrefix() { return subjectPrefix; }
    public void setSubjectPrefix(String subjectPrefix) { this.subjectPrefix = subjectPrefix; }

    public Duration getMaxAge() { return maxAge; }
    public void setMaxAge(Duration maxAge) { this.maxAge = maxAge; }

    public String getRetentionPolicy() { return retentionPolicy; }
    public void setRetentionPolicy(String retentionPolicy) { this.retentionPolicy = retentionPolicy; }

    public String getStorageType() { return storageType; }
    public void setStorageType(String storageType) { this.storageType = storageType; }

    public int getReplicas() { return replicas; }
    public void setReplicas(int replicas) { this.replicas = replicas; }

    public Duration getDuplicateWindow() { return duplicateWindow; }
    public void setDuplicateWindow(Duration duplicateWindow) { this.duplicateWindow = duplicateWindow; }

    public String getPlacementCluster() { return placementCluster; }
    public void setPlacementCluster(String placementCluster) { this.placementCluster = placementCluster; }

    public List<String> getPlacementTags() { return placementTags; }
    public void setPlacementTags(List<String> placementTags) { this.placementTags = placementTags; }

    public int getFetchBatch() { return fetchBatch; }
    public void setFetchBatch(int fetchBatch) { this.fetchBatch = fetchBatch; }

    public Duration getFetchWait() { return fetchWait; }
    public void setFetchWait(Duration fetchWait) { this.fetchWait = fetchWait; }
}
