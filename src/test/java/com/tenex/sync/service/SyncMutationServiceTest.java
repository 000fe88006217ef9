package com.tenex.sync.service;

import com.tenex.sync.core.build.ConversationIntent;
import com.tenex.sync.core.build.LessonIntent;
import com.tenex.sync.core.build.ProjectIntent;
import com.tenex.sync.core.build.TaskAbortIntent;
import com.tenex.sync.core.build.TaskIntent;
import com.tenex.sync.core.build.TaskUpdateIntent;
import com.tenex.sync.core.build.ThreadReplyIntent;
import com.tenex.sync.core.build.TypingIntent;
import com.tenex.sync.core.entity.Conversation;
import com.tenex.sync.core.entity.Project;
import com.tenex.sync.core.entity.Task;
import com.tenex.sync.core.merge.EntityChange;
import com.tenex.sync.core.model.RecordKind;
import com.tenex.sync.core.model.SyncRecord;
import com.tenex.sync.core.transport.RecordSigner;
import com.tenex.sync.core.transport.TransportNotConfiguredException;
import com.tenex.sync.core.transport.TransportUnavailableException;
import com.tenex.sync.support.InMemoryRecordTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SyncMutationServiceTest {

    private static final Instant T0 = Instant.ofEpochSecond(1_700_000_000);
    private static final String PROJECT = "31933:pk1:proj1";

    private final InMemoryRecordTransport transport = new InMemoryRecordTransport();
    private final SyncStores stores = new SyncStores(Duration.ofMinutes(5), Duration.ofSeconds(60), 16);
    private final RecordRouter router = new RecordRouter(stores);
    private final AtomicInteger signed = new AtomicInteger();

    private ObjectProvider<RecordSigner> signerProvider;
    private SyncMutationService service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        RecordSigner signer = unsigned -> Mono.just(
                unsigned.withSignature("sig" + signed.incrementAndGet(), unsigned.creator()));
        signerProvider = mock(ObjectProvider.class);
        when(signerProvider.getIfAvailable()).thenReturn(signer);
        service = new SyncMutationService(transport, signerProvider, stores, router);
    }

    private static ConversationIntent conversation() {
        return new ConversationIntent("pk1", PROJECT, "Build fix", "Please fix the build", List.of(), T0);
    }

    @Nested
    class OptimisticConversation {

        @Test
        void shouldPublishAndKeepConversation() {
            Conversation c = service.createConversation(conversation()).block();

            assertThat(c).isNotNull();
            assertThat(c.id()).isEqualTo("sig1");
            assertThat(stores.conversations().get("sig1")).isPresent();
            assertThat(transport.published()).extracting(SyncRecord::id).containsExactly("sig1");
        }

        @Test
        void shouldRollBackWhenPublishFails() {
            List<EntityChange.Type> changes = new CopyOnWriteArrayList<>();
            Disposable d = stores.conversations().changes().subscribe(ch -> changes.add(ch.type()));
            transport.failPublishes(new TransportUnavailableException("relay down"));

            assertThatThrownBy(() -> service.createConversation(conversation()).block())
                    .isInstanceOf(TransportUnavailableException.class)
                    .hasMessageContaining("relay down");
            d.dispose();

            assertThat(changes).containsExactly(EntityChange.Type.CREATED, EntityChange.Type.REMOVED);
            assertThat(stores.conversations().get("sig1")).isEmpty();
        }
    }

    @Test
    void shouldApplyAcknowledgedRecordsLocally() {
        Project p = service.createProject(new ProjectIntent("pk1", "proj1", "Alpha", null, null, null,
                List.of(), List.of(), List.of(), T0)).block();

        assertThat(p).isNotNull();
        assertThat(p.identity()).isEqualTo(PROJECT);
        assertThat(stores.projects().get(PROJECT)).isPresent();
    }

    @Test
    void shouldMergeTaskStatusUpdateIntoTask() {
        Task created = service.createTask(new TaskIntent("pk1", PROJECT, "Write docs", "Cover the API",
                "pending", List.of("agent1"), null, null, T0)).block();

        Task updated = service.updateTaskStatus(new TaskUpdateIntent("agent1", created.id(), PROJECT,
                "done", List.of(), null, T0.plusSeconds(10))).block();

        assertThat(updated.id()).isEqualTo(created.id());
        assertThat(updated.title()).isEqualTo("Write docs");
        assertThat(updated.status()).isEqualTo("done");
        assertThat(stores.tasks().size()).isEqualTo(1);
    }

    @Test
    void shouldPublishEphemeralRecordsWithoutStoringThem() {
        Set<String> acks = service.abortTask(new TaskAbortIntent("pk1", "task1", T0)).block();
        service.sendTyping(new TypingIntent("pk1", "c1", PROJECT, "typing", null, true, T0)).block();

        assertThat(acks).containsExactly("memory");
        assertThat(transport.published()).extracting(SyncRecord::kind)
                .containsExactly(RecordKind.TASK_ABORT, RecordKind.TYPING_START);
        assertThat(stores.aborts().hasPending("task1")).isFalse();
    }

    @Test
    void shouldPublishLessonAndComment() {
        var lesson = service.publishLesson(new LessonIntent("agent1", PROJECT, "Tests first", "Run them",
                "planner", null, T0)).block();
        var reply = service.replyToThread(new ThreadReplyIntent("pk1", lesson.id(), null, PROJECT,
                "Agreed", T0.plusSeconds(1))).block();

        assertThat(lesson.title()).isEqualTo("Tests first");
        assertThat(reply.rootId()).isEqualTo(lesson.id());
        assertThat(stores.replies().repliesTo(lesson.id())).hasSize(1);
    }

    @Nested
    class Unbound {

        @Test
        void shouldFailWithoutSigner() {
            when(signerProvider.getIfAvailable()).thenReturn(null);

            assertThatThrownBy(() -> service.createConversation(conversation()).block())
                    .isInstanceOf(TransportNotConfiguredException.class);
            assertThat(transport.published()).isEmpty();
            assertThat(stores.conversations().size()).isZero();
        }

        @Test
        void shouldFailWithoutTransport() {
            transport.setConfigured(false);

            assertThatThrownBy(() -> service.abortTask(new TaskAbortIntent("pk1", "task1", T0)).block())
                    .isInstanceOf(TransportNotConfiguredException.class);
        }
    }
}
