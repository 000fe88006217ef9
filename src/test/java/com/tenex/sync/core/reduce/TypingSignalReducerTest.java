package com.tenex.sync.core.reduce;

import com.tenex.sync.core.entity.TypingSignal;
import com.tenex.sync.core.merge.MergeStore;
import com.tenex.sync.core.model.RecordKind;
import com.tenex.sync.core.model.SyncRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.tenex.sync.support.TestRecords.record;
import static org.assertj.core.api.Assertions.assertThat;

class TypingSignalReducerTest {

    private final TypingSignalReducer reducer = new TypingSignalReducer(new MergeStore<>("typing"));

    private static SyncRecord typing(String id, String agent, int kind, long at) {
        return record(id, agent, kind, at)
                .content("thinking")
                .tag("e", "conv1")
                .tag("a", "31933:pk1:proj1")
                .build();
    }

    @Test
    void shouldExpireSignalAfterSixtySeconds() {
        reducer.apply(typing("t1", "agentA", RecordKind.TYPING_START, 1_000));

        assertThat(reducer.activeTyping("conv1", Instant.ofEpochSecond(1_059))).hasSize(1);
        assertThat(reducer.activeTyping("conv1", Instant.ofEpochSecond(1_061))).isEmpty();
    }

    @Test
    void shouldBoundValidityOfSingleSignal() {
        TypingSignal s = reducer.apply(typing("t1", "agentA", RecordKind.TYPING_START, 1_000)).orElseThrow();

        assertThat(s.isValid(Instant.ofEpochSecond(1_059))).isTrue();
        assertThat(s.isValid(Instant.ofEpochSecond(1_060))).isFalse();
    }

    @Test
    void shouldLetStopReplaceStart() {
        reducer.apply(typing("t1", "agentA", RecordKind.TYPING_START, 1_000));
        reducer.apply(typing("t2", "agentA", RecordKind.TYPING_STOP, 1_005));

        assertThat(reducer.activeTyping("conv1", Instant.ofEpochSecond(1_006))).isEmpty();
    }

    @Test
    void shouldIgnoreStartOlderThanStop() {
        reducer.apply(typing("t2", "agentA", RecordKind.TYPING_STOP, 1_005));

        assertThat(reducer.apply(typing("t1", "agentA", RecordKind.TYPING_START, 1_000))).isEmpty();
        assertThat(reducer.activeTyping("conv1", Instant.ofEpochSecond(1_006))).isEmpty();
    }

    @Test
    void shouldKeepOneSignalPerAgentOrderedByTime() {
        reducer.apply(typing("t1", "agentB", RecordKind.TYPING_START, 1_010));
        reducer.apply(typing("t2", "agentA", RecordKind.TYPING_START, 1_000));
        reducer.apply(typing("t3", "agentA", RecordKind.TYPING_START, 1_020));

        assertThat(reducer.activeTyping("conv1", Instant.ofEpochSecond(1_030)))
                .extracting(TypingSignal::agentId)
                .containsExactly("agentB", "agentA");
        assertThat(reducer.activeTyping("conv2", Instant.ofEpochSecond(1_030))).isEmpty();
    }

    @Test
    void shouldDropSignalsWithoutConversation() {
        SyncRecord orphan = record("t1", "agentA", RecordKind.TYPING_START, 1_000).build();

        assertThat(reducer.apply(orphan)).isEmpty();
    }
}
