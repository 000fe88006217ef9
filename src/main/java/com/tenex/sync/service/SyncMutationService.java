package com.tenex.sync.service;

import com.tenex.sync.core.build.AgentProfileIntent;
import com.tenex.sync.core.build.ConversationIntent;
import com.tenex.sync.core.build.ConversationTitleIntent;
import com.tenex.sync.core.build.EntityBuilders;
import com.tenex.sync.core.build.LessonIntent;
import com.tenex.sync.core.build.LlmConfigIntent;
import com.tenex.sync.core.build.ProjectControlIntent;
import com.tenex.sync.core.build.ProjectIntent;
import com.tenex.sync.core.build.ProjectStatusIntent;
import com.tenex.sync.core.build.TaskAbortIntent;
import com.tenex.sync.core.build.TaskIntent;
import com.tenex.sync.core.build.TaskUpdateIntent;
import com.tenex.sync.core.build.ThreadReplyIntent;
import com.tenex.sync.core.build.TypingIntent;
import com.tenex.sync.core.entity.AgentProfile;
import com.tenex.sync.core.entity.Conversation;
import com.tenex.sync.core.entity.Lesson;
import com.tenex.sync.core.entity.Project;
import com.tenex.sync.core.entity.Task;
import com.tenex.sync.core.entity.ThreadReply;
import com.tenex.sync.core.model.SyncRecord;
import com.tenex.sync.core.parse.EntityParsers;
import com.tenex.sync.core.transport.RecordSigner;
import com.tenex.sync.core.transport.RecordTransport;
import com.tenex.sync.core.transport.TransportNotConfiguredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Set;

/**
 * Outgoing direction: intent, then builder, then signer, then transport.
 *
 * <h2>Local state</h2>
 * <ul>
 *   <li>Most mutations are applied to the local stores only after the transport acknowledged the
 *       record, by routing the signed record like any incoming one.</li>
 *   <li>{@link #createConversation} is optimistic: the conversation is visible locally before the
 *       publish completes and is rolled back if the publish fails. Rollback only removes the
 *       optimistic version; anything newer that arrived meanwhile is kept.</li>
 * </ul>
 *
 * <h2>Errors</h2>
 * No signer or no transport bound: {@link TransportNotConfiguredException}. Publish failures
 * propagate unchanged to the caller.
 */
@Service
public class SyncMutationService {

    private static final Logger log = LoggerFactory.getLogger(SyncMutationService.class);

    private final RecordTransport transport;
    private final ObjectProvider<RecordSigner> signer;
    private final SyncStores stores;
    private final RecordRouter router;

    public SyncMutationService(
            RecordTransport transport,
            ObjectProvider<RecordSigner> signer,
            SyncStores stores,
            RecordRouter router
    ) {
        this.transport = transport;
        this.signer = signer;
        this.stores = stores;
        this.router = router;
    }

    public Mono<Project> createProject(ProjectIntent intent) {
        return publishAndApply(EntityBuilders.project(intent))
                .map(signed -> stores.projects().get(EntityParsers.project(signed).identity())
                        .orElseGet(() -> EntityParsers.project(signed)));
    }

    public Mono<AgentProfile> publishAgentProfile(AgentProfileIntent intent) {
        return publishAndApply(EntityBuilders.agentProfile(intent))
                .map(signed -> stores.agents().get(EntityParsers.agentProfile(signed).identity())
                        .orElseGet(() -> EntityParsers.agentProfile(signed)));
    }

    /**
     * Publishes a new conversation, showing it locally right away.
     */
    public Mono<Conversation> createConversation(ConversationIntent intent) {
        return sign(EntityBuilders.conversation(intent))
                .flatMap(signed -> {
                    Conversation optimistic = EntityParsers.conversation(signed);
                    boolean inserted = stores.conversations().upsert(optimistic).changed();
                    Instant version = optimistic.recordedAt();

                    return transport.publish(signed)
                            .doOnNext(acks -> log.info("Conversation published id={} acks={}", signed.id(), acks))
                            .map(acks -> stores.conversations().get(optimistic.id()).orElse(optimistic))
                            .onErrorResume(err -> {
                                if (inserted && stores.conversations().removeIfVersion(optimistic.id(), version)) {
                                    log.warn("Conversation publish failed; local copy rolled back id={} err={}",
                                            optimistic.id(), err.toString());
                                }
                                return Mono.error(err);
                            });
                });
    }

    public Mono<Conversation> retitleConversation(ConversationTitleIntent intent) {
        return publishAndApply(EntityBuilders.conversationTitle(intent))
                .map(signed -> stores.conversations().get(intent.conversationId())
                        .orElseGet(() -> EntityParsers.conversation(signed)));
    }

    public Mono<Task> createTask(TaskIntent intent) {
        return publishAndApply(EntityBuilders.task(intent))
                .map(signed -> stores.tasks().get(signed.id()).orElseGet(() -> EntityParsers.task(signed)));
    }

    public Mono<Task> updateTaskStatus(TaskUpdateIntent intent) {
        return publishAndApply(EntityBuilders.taskUpdate(intent))
                .map(signed -> stores.tasks().get(intent.taskId()).orElseGet(() -> EntityParsers.task(signed)));
    }

    public Mono<Set<String>> abortTask(TaskAbortIntent intent) {
        return publish(EntityBuilders.taskAbort(intent));
    }

    public Mono<Void> sendTyping(TypingIntent intent) {
        return publish(EntityBuilders.typing(intent)).then();
    }

    public Mono<Set<String>> publishProjectStatus(ProjectStatusIntent intent) {
        return publish(EntityBuilders.projectStatus(intent));
    }

    public Mono<Set<String>> publishLlmConfig(LlmConfigIntent intent) {
        return publish(EntityBuilders.llmConfig(intent));
    }

    public Mono<Set<String>> requestProjectControl(ProjectControlIntent intent) {
        return publish(EntityBuilders.projectControl(intent));
    }

    public Mono<Lesson> publishLesson(LessonIntent intent) {
        return publishAndApply(EntityBuilders.lesson(intent))
                .map(signed -> stores.lessons().get(signed.id()).orElseGet(() -> EntityParsers.lesson(signed)));
    }

    public Mono<ThreadReply> replyToThread(ThreadReplyIntent intent) {
        return publishAndApply(EntityBuilders.threadReply(intent))
                .map(signed -> stores.replyStore().get(signed.id()).orElseGet(() -> EntityParsers.threadReply(signed)));
    }

    /**
     * Signs and publishes; ephemeral records are not applied locally.
     */
    private Mono<Set<String>> publish(SyncRecord unsigned) {
        return sign(unsigned).flatMap(signed -> transport.publish(signed)
                .doOnNext(acks -> log.info("Record published id={} kind={} acks={}", signed.id(), signed.kind(), acks)));
    }

    /**
     * Signs, publishes, then applies the signed record to the local stores.
     */
    private Mono<SyncRecord> publishAndApply(SyncRecord unsigned) {
        return sign(unsigned).flatMap(signed -> transport.publish(signed)
                .doOnNext(acks -> log.info("Record published id={} kind={} acks={}", signed.id(), signed.kind(), acks))
                .map(acks -> {
                    router.route(signed);
                    return signed;
                }));
    }

    private Mono<SyncRecord> sign(SyncRecord unsigned) {
        if (!transport.isConfigured()) {
            return Mono.error(new TransportNotConfiguredException("No record transport bound"));
        }
        RecordSigner s = signer.getIfAvailable();
        if (s == null) {
            return Mono.error(new TransportNotConfiguredException("No record signer bound"));
        }
        return s.sign(unsigned);
    }
}
