package com.tenex.sync.core.reduce;

import com.tenex.sync.core.entity.ProjectStatus;
import com.tenex.sync.core.merge.MergeStore;
import com.tenex.sync.core.merge.UpsertResult;
import com.tenex.sync.core.model.RecordKind;
import com.tenex.sync.core.model.SyncRecord;
import com.tenex.sync.core.parse.EntityParsers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * =====================================================================
 * ProjectStatusReducer
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Folds raw project-status records into the latest availability snapshot per
 * project. Each accepted record replaces the agent list wholesale.
 *
 * ONLINE POLICY
 * -------------
 * A project is online when its latest snapshot was observed less than
 * {@code freshness} ago. A zero freshness means "any status ever seen".
 *
 * Nothing is expired proactively; the policy is evaluated on read.
 */
public class ProjectStatusReducer {

    private static final Logger log = LoggerFactory.getLogger(ProjectStatusReducer.class);

    private final MergeStore<ProjectStatus> store;
    private final Duration freshness;

    public ProjectStatusReducer(MergeStore<ProjectStatus> store, Duration freshness) {
        this.store = store;
        this.freshness = freshness == null ? Duration.ZERO : freshness;
    }

    /**
     * Applies one record. Records of other kinds and records without a project reference are
     * dropped.
     *
     * @return the stored snapshot when the record changed it
     */
    public Optional<ProjectStatus> apply(SyncRecord record) {
        if (record.kind() != RecordKind.PROJECT_STATUS) {
            return Optional.empty();
        }
        ProjectStatus candidate = EntityParsers.projectStatus(record);
        if (candidate.projectIdentity().isEmpty()) {
            log.debug("Dropped status record without project reference id={}", record.id());
            return Optional.empty();
        }
        UpsertResult<ProjectStatus> r = store.upsert(candidate);
        return r.changed() ? Optional.of(r.entity()) : Optional.empty();
    }

    /**
     * Reduces a record stream into the stream of snapshots that actually changed state.
     */
    public Flux<ProjectStatus> reduce(Flux<SyncRecord> records) {
        return records.concatMapIterable(r -> apply(r).map(List::of).orElse(List.of()));
    }

    public Optional<ProjectStatus> latest(String projectIdentity) {
        return store.get(projectIdentity);
    }

    public List<ProjectStatus.AgentAvailability> availableAgents(String projectIdentity) {
        return store.get(projectIdentity)
                .map(ProjectStatus::availableAgents)
                .orElse(List.of());
    }

    public boolean isOnline(String projectIdentity, Instant now) {
        Optional<ProjectStatus> status = store.get(projectIdentity);
        if (status.isEmpty()) {
            return false;
        }
        if (freshness.isZero()) {
            return true;
        }
        return Duration.between(status.get().observedAt(), now).compareTo(freshness) < 0;
    }

    public Duration freshness() {
        return freshness;
    }
}
