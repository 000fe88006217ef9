package com.tenex.sync.service;

import com.tenex.sync.core.entity.AgentProfile;
import com.tenex.sync.core.entity.LlmConfigChange;
import com.tenex.sync.core.entity.Project;
import com.tenex.sync.core.model.RecordKind;
import com.tenex.sync.core.model.SyncRecord;
import com.tenex.sync.core.parse.EntityParsers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches one record to the parser and store of its kind.
 *
 * <p>Total: a record of an unknown kind, or one missing the reference its entity is keyed by, is
 * logged at DEBUG and dropped. Nothing here throws for malformed input.</p>
 */
public class RecordRouter {

    private static final Logger log = LoggerFactory.getLogger(RecordRouter.class);

    private final SyncStores stores;

    public RecordRouter(SyncStores stores) {
        this.stores = stores;
    }

    /**
     * @return true when the record changed entity state (or queued a new abort)
     */
    public boolean route(SyncRecord record) {
        return switch (record.kind()) {
            case RecordKind.PROJECT -> project(record);
            case RecordKind.CONVERSATION -> requireId(record)
                    && stores.conversations().upsert(EntityParsers.conversation(record)).changed();
            case RecordKind.TASK -> requireId(record)
                    && stores.tasks().upsert(EntityParsers.task(record)).changed();
            case RecordKind.AGENT_PROFILE -> agentProfile(record);
            case RecordKind.AGENT_LESSON -> requireId(record)
                    && stores.lessons().upsert(EntityParsers.lesson(record)).changed();
            case RecordKind.THREAD_REPLY -> stores.replies().apply(record).isPresent();
            case RecordKind.PROJECT_STATUS -> stores.statuses().apply(record).isPresent();
            case RecordKind.TYPING_START, RecordKind.TYPING_STOP -> stores.typing().apply(record).isPresent();
            case RecordKind.TASK_ABORT -> stores.aborts().offer(record);
            case RecordKind.LLM_CONFIG_CHANGE -> llmConfig(record);
            default -> {
                log.debug("Ignored record kind={} id={}", record.kind(), record.id());
                yield false;
            }
        };
    }

    private boolean project(SyncRecord record) {
        Project p = EntityParsers.project(record);
        if (p.slug().isEmpty()) {
            log.debug("Dropped project record without slug id={} creator={}", record.id(), record.creator());
            return false;
        }
        return stores.projects().upsert(p).changed();
    }

    private boolean agentProfile(SyncRecord record) {
        AgentProfile a = EntityParsers.agentProfile(record);
        if (a.id().isEmpty()) {
            log.debug("Dropped agent profile without id creator={}", record.creator());
            return false;
        }
        return stores.agents().upsert(a).changed();
    }

    private boolean llmConfig(SyncRecord record) {
        LlmConfigChange c = EntityParsers.llmConfigChange(record);
        if (c.projectIdentity().isEmpty()) {
            log.debug("Dropped LLM config change without project reference id={}", record.id());
            return false;
        }
        return stores.llmConfigs().upsert(c).changed();
    }

    private static boolean requireId(SyncRecord record) {
        if (record.id().isEmpty()) {
            log.debug("Dropped unsigned record kind={}", record.kind());
            return false;
        }
        return true;
    }
}
