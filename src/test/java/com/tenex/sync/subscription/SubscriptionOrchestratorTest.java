package com.tenex.sync.subscription;

import com.tenex.sync.core.model.RecordKind;
import com.tenex.sync.core.model.SyncRecord;
import com.tenex.sync.core.transport.CachePolicy;
import com.tenex.sync.core.transport.RecordFilter;
import com.tenex.sync.core.transport.TransportNotConfiguredException;
import com.tenex.sync.support.InMemoryRecordTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.tenex.sync.support.TestRecords.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubscriptionOrchestratorTest {

    private final InMemoryRecordTransport transport = new InMemoryRecordTransport();
    private final SubscriptionOrchestrator orchestrator =
            new SubscriptionOrchestrator(transport, CachePolicy.CACHE_THEN_NETWORK);

    private static final RecordFilter STATUS_P1 =
            RecordFilter.ofKinds(RecordKind.PROJECT_STATUS).withTag("a", "31933:pk1:p1");
    private static final RecordFilter STATUS_P2 =
            RecordFilter.ofKinds(RecordKind.PROJECT_STATUS).withTag("a", "31933:pk1:p2");

    private static SyncRecord status(String id, String project, long at) {
        return record(id, "backend", RecordKind.PROJECT_STATUS, at).tag("a", "31933:pk1:" + project).build();
    }

    private static List<String> ids(List<SyncRecord> records) {
        return records.stream().map(SyncRecord::id).toList();
    }

    @AfterEach
    void tearDown() {
        orchestrator.destroy();
    }

    @Nested
    @DisplayName("sharing")
    class Sharing {

        @Test
        void shouldShareOneTransportSubscriptionForEquivalentFilters() {
            List<SyncRecord> a = new CopyOnWriteArrayList<>();
            List<SyncRecord> b = new CopyOnWriteArrayList<>();

            orchestrator.watch(STATUS_P1, a::add);
            orchestrator.watch(RecordFilter.ofKinds(RecordKind.PROJECT_STATUS).withTag("a", "31933:pk1:p1"), b::add);
            transport.emit(status("s1", "p1", 10));

            assertThat(transport.openSubscriptions()).isEqualTo(1);
            assertThat(ids(a)).containsExactly("s1");
            assertThat(ids(b)).containsExactly("s1");
            assertThat(orchestrator.activeSubscriptions()).singleElement()
                    .satisfies(info -> assertThat(info.consumers()).isEqualTo(2));
        }

        @Test
        void shouldBackfillLateJoiner() {
            transport.store(status("s0", "p1", 5));
            List<SyncRecord> early = new CopyOnWriteArrayList<>();
            List<SyncRecord> late = new CopyOnWriteArrayList<>();

            orchestrator.watch(STATUS_P1, early::add);
            transport.emit(status("s1", "p1", 10));
            orchestrator.watch(STATUS_P1, late::add);
            transport.emit(status("s2", "p1", 20));

            assertThat(ids(early)).containsExactly("s0", "s1", "s2");
            assertThat(ids(late)).containsExactly("s0", "s1", "s2");
        }

        @Test
        void shouldNotBackfillNetworkOnlyJoiner() {
            transport.store(status("s0", "p1", 5));
            List<SyncRecord> late = new CopyOnWriteArrayList<>();

            orchestrator.watch(STATUS_P1, CachePolicy.NETWORK_ONLY, r -> { });
            orchestrator.watch(STATUS_P1, CachePolicy.NETWORK_ONLY, late::add);
            transport.emit(status("s1", "p1", 10));

            assertThat(ids(late)).containsExactly("s1");
        }

        @Test
        void shouldCompleteCacheOnlySubscriptionAndAllowReopen() {
            transport.store(status("s0", "p1", 5));
            List<SyncRecord> seen = new CopyOnWriteArrayList<>();

            SubscriptionHandle first = orchestrator.watch(STATUS_P1, CachePolicy.CACHE_ONLY, seen::add);

            assertThat(first.state()).isEqualTo(SubscriptionState.COMPLETED);
            assertThat(orchestrator.activeSubscriptions()).isEmpty();

            orchestrator.watch(STATUS_P1, CachePolicy.CACHE_ONLY, seen::add);
            assertThat(ids(seen)).containsExactly("s0", "s0");
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        void shouldStopDeliveryImmediatelyAndBeIdempotent() {
            List<SyncRecord> seen = new CopyOnWriteArrayList<>();
            SubscriptionHandle h = orchestrator.watch(STATUS_P1, seen::add);
            transport.emit(status("s1", "p1", 10));

            h.cancel();
            h.cancel();
            transport.emit(status("s2", "p1", 20));

            assertThat(ids(seen)).containsExactly("s1");
            assertThat(h.isCancelled()).isTrue();
            assertThat(transport.openSubscriptions()).isZero();
            assertThat(orchestrator.activeSubscriptions()).isEmpty();
        }

        @Test
        void shouldKeepSharedSubscriptionWhileOtherConsumersRemain() {
            List<SyncRecord> kept = new CopyOnWriteArrayList<>();
            SubscriptionHandle gone = orchestrator.watch(STATUS_P1, r -> { });
            orchestrator.watch(STATUS_P1, kept::add);

            gone.cancel();
            transport.emit(status("s1", "p1", 10));

            assertThat(ids(kept)).containsExactly("s1");
            assertThat(transport.openSubscriptions()).isEqualTo(1);
        }

        @Test
        void shouldStopDeliveryWhenHandlerCancelsItself() {
            List<SyncRecord> seen = new CopyOnWriteArrayList<>();
            SubscriptionHandle[] self = new SubscriptionHandle[1];
            self[0] = orchestrator.watch(STATUS_P1, r -> {
                seen.add(r);
                self[0].cancel();
            });

            transport.emit(status("s1", "p1", 10));
            transport.emit(status("s2", "p1", 20));

            assertThat(ids(seen)).containsExactly("s1");
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        void shouldIsolateFailedSubscription() {
            List<SyncRecord> p1 = new CopyOnWriteArrayList<>();
            List<SyncRecord> p2 = new CopyOnWriteArrayList<>();
            SubscriptionHandle h1 = orchestrator.watch(STATUS_P1, p1::add);
            SubscriptionHandle h2 = orchestrator.watch(STATUS_P2, p2::add);

            transport.fail(STATUS_P1::equals, "stream gone");
            transport.emit(status("s1", "p1", 10));
            transport.emit(status("s2", "p2", 10));

            assertThat(h1.state()).isEqualTo(SubscriptionState.FAILED);
            assertThat(h2.state()).isEqualTo(SubscriptionState.ACTIVE);
            assertThat(p1).isEmpty();
            assertThat(ids(p2)).containsExactly("s2");
            assertThat(orchestrator.activeSubscriptions())
                    .filteredOn(i -> i.state() == SubscriptionState.FAILED)
                    .singleElement()
                    .satisfies(i -> assertThat(i.lastError()).contains("stream gone"));
        }

        @Test
        void shouldResumeAfterRetry() {
            List<SyncRecord> seen = new CopyOnWriteArrayList<>();
            SubscriptionHandle h = orchestrator.watch(STATUS_P1, seen::add);
            transport.fail(STATUS_P1::equals, "stream gone");
            transport.store(status("s1", "p1", 10));

            assertThat(orchestrator.retry(h.signature())).isTrue();
            transport.emit(status("s2", "p1", 20));

            assertThat(h.state()).isEqualTo(SubscriptionState.ACTIVE);
            assertThat(ids(seen)).containsExactly("s1", "s2");
            assertThat(orchestrator.retry(h.signature())).isFalse();
        }

        @Test
        void shouldSkipRecordWhenHandlerThrows() {
            List<SyncRecord> seen = new CopyOnWriteArrayList<>();
            orchestrator.watch(STATUS_P1, r -> {
                if (r.id().equals("bad")) {
                    throw new IllegalStateException("boom");
                }
                seen.add(r);
            });
            List<SyncRecord> sibling = new CopyOnWriteArrayList<>();
            orchestrator.watch(STATUS_P1, sibling::add);

            transport.emit(status("bad", "p1", 10));
            transport.emit(status("good", "p1", 20));

            assertThat(ids(seen)).containsExactly("good");
            assertThat(ids(sibling)).containsExactly("bad", "good");
        }

        @Test
        void shouldRefuseToWatchWithoutTransport() {
            transport.setConfigured(false);

            assertThatThrownBy(() -> orchestrator.watch(STATUS_P1, r -> { }))
                    .isInstanceOf(TransportNotConfiguredException.class);
            assertThat(orchestrator.activeSubscriptions()).isEmpty();
        }
    }

    @Test
    void shouldCancelEverythingOnDestroy() {
        SubscriptionHandle h1 = orchestrator.watch(STATUS_P1, r -> { });
        SubscriptionHandle h2 = orchestrator.watch(STATUS_P2, r -> { });

        orchestrator.destroy();

        assertThat(h1.isCancelled()).isTrue();
        assertThat(h2.isCancelled()).isTrue();
        assertThat(transport.openSubscriptions()).isZero();
    }
}
