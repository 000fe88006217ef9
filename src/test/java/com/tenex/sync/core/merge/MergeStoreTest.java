package com.tenex.sync.core.merge;

import com.tenex.sync.core.entity.Conversation;
import com.tenex.sync.core.entity.Project;
import com.tenex.sync.core.entity.ProjectStatus;
import com.tenex.sync.core.entity.ProjectStatus.AgentAvailability;
import com.tenex.sync.core.entity.Task;
import com.tenex.sync.core.model.RecordKind;
import com.tenex.sync.core.parse.EntityParsers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.tenex.sync.support.TestRecords.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MergeStoreTest {

    private static Project project(String id, long at, String title) {
        return EntityParsers.project(record(id, "pk1", RecordKind.PROJECT, at)
                .tag("d", "proj1")
                .tag("title", title)
                .build());
    }

    private static ProjectStatus status(long at, String... agents) {
        var r = record("st" + at, "backend", RecordKind.PROJECT_STATUS, at).tag("a", "31933:pk1:proj1");
        for (String a : agents) {
            r.tag("agent", "pk-" + a, a);
        }
        return EntityParsers.projectStatus(r.build());
    }

    @Nested
    @DisplayName("recency")
    class Recency {

        @Test
        void shouldKeepNewerTitleRegardlessOfArrivalOrder() {
            MergeStore<Project> inOrder = new MergeStore<>("a");
            inOrder.upsert(project("e1", 100, "Alpha"));
            inOrder.upsert(project("e2", 200, "Beta"));

            MergeStore<Project> reversed = new MergeStore<>("b");
            reversed.upsert(project("e2", 200, "Beta"));
            UpsertResult<Project> late = reversed.upsert(project("e1", 100, "Alpha"));

            assertThat(late.changed()).isFalse();
            assertThat(inOrder.get("31933:pk1:proj1")).get().extracting(Project::title).isEqualTo("Beta");
            assertThat(reversed.get("31933:pk1:proj1")).get().extracting(Project::title).isEqualTo("Beta");
            assertThat(inOrder.size()).isEqualTo(1);
        }

        @Test
        void shouldReportRedeliveryAsUnchanged() {
            MergeStore<Project> store = new MergeStore<>("projects");
            Project p = project("e1", 100, "Alpha");

            assertThat(store.upsert(p).changed()).isTrue();
            for (int i = 0; i < 3; i++) {
                UpsertResult<Project> again = store.upsert(p);
                assertThat(again.changed()).isFalse();
                assertThat(again.entity()).isEqualTo(p);
            }
        }

        @Test
        void shouldDiscardEqualTimestamp() {
            MergeStore<Project> store = new MergeStore<>("projects");
            store.upsert(project("e1", 100, "Alpha"));

            UpsertResult<Project> tie = store.upsert(project("e2", 100, "Other"));

            assertThat(tie.changed()).isFalse();
            assertThat(tie.entity().title()).isEqualTo("Alpha");
        }

        @Test
        @DisplayName("31933 Alpha@100 then Beta@200 yields Beta under the canonical identity")
        void shouldResolveProjectScenario() {
            MergeStore<Project> store = new MergeStore<>("projects");

            store.upsert(EntityParsers.project(record("e1", "pk1", 31933, 100)
                    .tag("d", "proj1").tag("title", "Alpha").build()));
            store.upsert(EntityParsers.project(record("e2", "pk1", 31933, 200)
                    .tag("d", "proj1").tag("title", "Beta").build()));

            assertThat(store.snapshot()).singleElement().satisfies(p -> {
                assertThat(p.identity()).isEqualTo("31933:pk1:proj1");
                assertThat(p.title()).isEqualTo("Beta");
            });
        }
    }

    @Nested
    @DisplayName("field-update policy")
    class FieldPolicy {

        private Task task(String recordId, long at, String... tags) {
            var r = record(recordId, "pk1", RecordKind.TASK, at);
            for (int i = 0; i + 1 < tags.length; i += 2) {
                r.tag(tags[i], tags[i + 1]);
            }
            return EntityParsers.task(r.build());
        }

        @Test
        void shouldNotEraseTitleWithEmptyValue() {
            MergeStore<Task> store = new MergeStore<>("tasks");
            store.upsert(task("t1", 10, "title", "A", "status", "pending"));

            store.upsert(EntityParsers.task(record("u1", "pk1", RecordKind.TASK, 20)
                    .tag("e", "t1", "", "task")
                    .tag("title", "")
                    .tag("status", "done")
                    .build()));

            Task t = store.get("t1").orElseThrow();
            assertThat(t.title()).isEqualTo("A");
            assertThat(t.status()).isEqualTo("done");
        }

        @Test
        void shouldOverwriteTitleWithNonEmptyValue() {
            MergeStore<Task> store = new MergeStore<>("tasks");
            store.upsert(task("t1", 10, "title", "A"));

            store.upsert(EntityParsers.task(record("u1", "pk1", RecordKind.TASK, 20)
                    .tag("e", "t1", "", "task")
                    .tag("title", "B")
                    .build()));

            assertThat(store.get("t1")).get().extracting(Task::title).isEqualTo("B");
        }

        @Test
        void shouldReplaceStatusAgentsWholesale() {
            MergeStore<ProjectStatus> store = new MergeStore<>("status");
            store.upsert(status(10, "X", "Y"));

            store.upsert(status(20, "Z"));

            assertThat(store.get("31933:pk1:proj1").orElseThrow().availableAgents())
                    .extracting(AgentAvailability::slug)
                    .containsExactly("Z");
        }

        @Test
        void shouldDiscardOlderStatusArrivingLate() {
            MergeStore<ProjectStatus> store = new MergeStore<>("status");
            store.upsert(status(60, "X", "Y"));

            UpsertResult<ProjectStatus> late = store.upsert(status(50, "Z"));

            assertThat(late.changed()).isFalse();
            assertThat(store.get("31933:pk1:proj1").orElseThrow().availableAgents())
                    .extracting(AgentAvailability::slug)
                    .containsExactly("X", "Y");
            assertThat(store.versionOf("31933:pk1:proj1")).contains(Instant.ofEpochSecond(60));
        }
    }

    @Nested
    @DisplayName("late originals")
    class LateOriginals {

        private final Task original = EntityParsers.task(record("t1", "pk1", RecordKind.TASK, 100)
                .tag("title", "Write docs")
                .tag("e", "c9")
                .content("Cover the API")
                .build());

        private Task update(String recordId, long at, String... tags) {
            var r = record(recordId, "pk2", RecordKind.TASK, at).tag("e", "t1", "", "task");
            for (int i = 0; i + 1 < tags.length; i += 2) {
                r.tag(tags[i], tags[i + 1]);
            }
            return EntityParsers.task(r.build());
        }

        private Task resolve(Task... arrivals) {
            MergeStore<Task> store = new MergeStore<>("tasks");
            for (Task t : arrivals) {
                store.upsert(t);
            }
            return store.get("t1").orElseThrow();
        }

        @Test
        void shouldConvergeTaskInEitherArrivalOrder() {
            Task progress = update("u1", 101, "status", "in_progress");

            Task inOrder = resolve(original, progress);
            Task reversed = resolve(progress, original);

            assertThat(reversed).isEqualTo(inOrder);
            assertThat(reversed.title()).isEqualTo("Write docs");
            assertThat(reversed.content()).isEqualTo("Cover the API");
            assertThat(reversed.status()).isEqualTo("in_progress");
            assertThat(reversed.authorId()).isEqualTo("pk1");
            assertThat(reversed.relatedConversationId()).isEqualTo("c9");
            assertThat(reversed.recordedAt()).isEqualTo(Instant.ofEpochSecond(101));
        }

        @Test
        void shouldNeverLetOlderRecordOverrideNewerField() {
            Task renamed = update("u1", 101, "title", "Renamed");
            Task done = update("u2", 102, "status", "done");

            List<Task> outcomes = List.of(
                    resolve(original, renamed, done),
                    resolve(done, original, renamed),
                    resolve(done, renamed, original),
                    resolve(renamed, done, original));

            assertThat(outcomes).allSatisfy(t -> {
                assertThat(t.title()).isEqualTo("Renamed");
                assertThat(t.content()).isEqualTo("Cover the API");
                assertThat(t.status()).isEqualTo("done");
            });
        }

        @Test
        void shouldReportLateOriginalAsChange() {
            MergeStore<Task> store = new MergeStore<>("tasks");
            List<EntityChange<Task>> seen = new ArrayList<>();
            store.changes().subscribe(seen::add);
            store.upsert(update("u1", 101, "status", "in_progress"));

            assertThat(store.upsert(original).changed()).isTrue();
            assertThat(store.upsert(original).changed()).isFalse();

            assertThat(seen).extracting(EntityChange::type)
                    .containsExactly(EntityChange.Type.CREATED, EntityChange.Type.UPDATED);
            assertThat(seen.get(1).entity().title()).isEqualTo("Write docs");
            assertThat(store.versionOf("t1")).contains(Instant.ofEpochSecond(101));
        }

        @Test
        void shouldBackfillConversationTitleInEitherOrder() {
            Conversation root = EntityParsers.conversation(record("c1", "pk1", RecordKind.CONVERSATION, 100)
                    .tag("a", "31933:pk1:proj1")
                    .content("Kickoff notes")
                    .build());
            Conversation titled = EntityParsers.conversation(record("x1", "pk2", RecordKind.CONVERSATION, 150)
                    .tag("e", "c1", "", "conversation")
                    .tag("title", "Kickoff")
                    .build());

            MergeStore<Conversation> inOrder = new MergeStore<>("a");
            inOrder.upsert(root);
            inOrder.upsert(titled);
            MergeStore<Conversation> reversed = new MergeStore<>("b");
            reversed.upsert(titled);
            reversed.upsert(root);

            assertThat(reversed.get("c1")).isEqualTo(inOrder.get("c1"));
            assertThat(reversed.get("c1")).get().satisfies(c -> {
                assertThat(c.title()).isEqualTo("Kickoff");
                assertThat(c.content()).isEqualTo("Kickoff notes");
                assertThat(c.projectIdentity()).isEqualTo("31933:pk1:proj1");
                assertThat(c.createdAt()).isEqualTo(Instant.ofEpochSecond(100));
            });
        }
    }

    @Nested
    @DisplayName("change notifications")
    class Changes {

        @Test
        void shouldEmitOnlyOnChange() {
            MergeStore<Project> store = new MergeStore<>("projects");
            List<EntityChange<Project>> seen = new ArrayList<>();
            Disposable d = store.changes().subscribe(seen::add);

            store.upsert(project("e1", 100, "Alpha"));
            store.upsert(project("e1", 100, "Alpha"));
            store.upsert(project("e0", 50, "Old"));
            store.upsert(project("e2", 200, "Beta"));
            d.dispose();

            assertThat(seen).extracting(EntityChange::type)
                    .containsExactly(EntityChange.Type.CREATED, EntityChange.Type.UPDATED);
            assertThat(seen.get(1).entity().title()).isEqualTo("Beta");
        }

        @Test
        void shouldNotFailWritersWhileListenerIsSlow() throws Exception {
            MergeStore<Project> store = new MergeStore<>("projects");
            CountDownLatch inListener = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            List<String> delivered = new CopyOnWriteArrayList<>();
            store.changes().subscribe(c -> {
                if (c.identity().endsWith(":one")) {
                    inListener.countDown();
                    awaitQuietly(release);
                }
                delivered.add(c.identity());
            });

            ExecutorService writer = Executors.newSingleThreadExecutor();
            try {
                Future<UpsertResult<Project>> first =
                        writer.submit(() -> store.upsert("31933:pk1:one", project("e1", 100, "One")));
                assertThat(inListener.await(5, TimeUnit.SECONDS)).isTrue();

                UpsertResult<Project> second = store.upsert("31933:pk1:two", project("e2", 100, "Two"));

                assertThat(second.changed()).isTrue();
                assertThat(store.get("31933:pk1:two")).isPresent();
                release.countDown();
                assertThat(first.get(5, TimeUnit.SECONDS).changed()).isTrue();
            } finally {
                release.countDown();
                writer.shutdownNow();
            }
            assertThat(delivered).containsExactly("31933:pk1:one", "31933:pk1:two");
        }

        @Test
        void shouldRollBackOnlyMatchingVersion() {
            MergeStore<Project> store = new MergeStore<>("projects");
            List<EntityChange<Project>> seen = new ArrayList<>();
            store.changes().subscribe(seen::add);
            store.upsert(project("e1", 100, "Alpha"));

            assertThat(store.removeIfVersion("31933:pk1:proj1", Instant.ofEpochSecond(99))).isFalse();
            assertThat(store.removeIfVersion("31933:pk1:proj1", Instant.ofEpochSecond(100))).isTrue();
            assertThat(store.get("31933:pk1:proj1")).isEmpty();
            assertThat(seen).extracting(EntityChange::type).endsWith(EntityChange.Type.REMOVED);

            assertThat(store.upsert(project("e1", 100, "Alpha")).changed()).isTrue();
        }
    }

    @Test
    void shouldRejectBlankIdentity() {
        MergeStore<Project> store = new MergeStore<>("projects");

        assertThatThrownBy(() -> store.upsert(" ", project("e1", 1, "A")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldConvergeUnderConcurrentWriters() throws Exception {
        MergeStore<Project> store = new MergeStore<>("projects");
        int writers = 8;
        int perWriter = 200;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int w = 0; w < writers; w++) {
                int offset = w;
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perWriter; i++) {
                        long at = (long) i * writers + offset + 1;
                        store.upsert(project("e" + at, at, "T" + at));
                    }
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        long newest = (long) writers * perWriter;
        assertThat(store.get("31933:pk1:proj1")).get().extracting(Project::title).isEqualTo("T" + newest);
        assertThat(store.versionOf("31933:pk1:proj1")).contains(Instant.ofEpochSecond(newest));
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
