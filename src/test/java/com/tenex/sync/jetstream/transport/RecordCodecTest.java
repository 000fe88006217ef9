package com.tenex.sync.jetstream.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenex.sync.config.JacksonConfig;
import com.tenex.sync.core.model.SyncRecord;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static com.tenex.sync.support.TestRecords.record;
import static org.assertj.core.api.Assertions.assertThat;

class RecordCodecTest {

    private final ObjectMapper mapper = new JacksonConfig().objectMapper();
    private final RecordCodec codec = new RecordCodec(mapper);

    @Test
    void shouldWriteCreatedAtAsEpochSeconds() throws Exception {
        SyncRecord r = record("e1", "pk1", 31933, 1_700_000_000).content("desc").tag("d", "proj1").build();

        var tree = mapper.readTree(codec.encode(r));

        assertThat(tree.get("created_at").asLong()).isEqualTo(1_700_000_000L);
        assertThat(tree.get("pubkey").asText()).isEqualTo("pk1");
        assertThat(tree.get("tags").get(0).get(1).asText()).isEqualTo("proj1");
    }

    @Test
    void shouldDecodeWithUnknownFields() {
        String json = "{\"id\":\"e1\",\"pubkey\":\"pk1\",\"kind\":11,\"created_at\":1700000000,"
                + "\"content\":\"hi\",\"tags\":[[\"a\",\"31933:pk1:proj1\"]],\"sig\":\"abcd\",\"relay\":\"x\"}";

        SyncRecord r = codec.decode(json.getBytes(StandardCharsets.UTF_8)).orElseThrow();

        assertThat(r.id()).isEqualTo("e1");
        assertThat(r.creator()).isEqualTo("pk1");
        assertThat(r.kind()).isEqualTo(11);
        assertThat(r.createdAt()).isEqualTo(Instant.ofEpochSecond(1_700_000_000));
        assertThat(r.tags()).containsExactly(List.of("a", "31933:pk1:proj1"));
    }

    @Test
    void shouldDefaultMissingContentAndTags() {
        String json = "{\"id\":\"e1\",\"pubkey\":\"pk1\",\"kind\":24133,\"created_at\":5}";

        SyncRecord r = codec.decode(json.getBytes(StandardCharsets.UTF_8)).orElseThrow();

        assertThat(r.content()).isEmpty();
        assertThat(r.tags()).isEmpty();
    }

    @Test
    void shouldSkipGarbagePayloads() {
        assertThat(codec.decode("not json".getBytes(StandardCharsets.UTF_8))).isEmpty();
        assertThat(codec.decode(new byte[0])).isEmpty();
        assertThat(codec.decode(null)).isEmpty();
    }
}
