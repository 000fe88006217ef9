package com.tenex.sync.jetstream.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenex.sync.core.model.SyncRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Wire form of a record on the JetStream subjects.
 *
 * <h2>Format (LOCKED)</h2>
 * <pre>
 * {"id": "...", "pubkey": "...", "kind": 31933, "created_at": 1700000000,
 *  "content": "...", "tags": [["d", "proj1"], ["title", "Alpha"]]}
 * </pre>
 * {@code created_at} is epoch seconds, the precision records are signed with. Unknown fields are
 * ignored so signatures and relay metadata may ride along.
 *
 * <p>Decoding never throws: a payload that is not a record is logged at DEBUG and skipped.</p>
 */
@Component
public class RecordCodec {

    private static final Logger log = LoggerFactory.getLogger(RecordCodec.class);

    private final ObjectMapper mapper;

    public RecordCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public byte[] encode(SyncRecord record) {
        WireRecord wire = new WireRecord(record.id(), record.creator(), record.kind(),
                record.createdAt().getEpochSecond(), record.content(), record.tags());
        try {
            return mapper.writeValueAsBytes(wire);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Record not encodable: id=" + record.id(), e);
        }
    }

    public Optional<SyncRecord> decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            return Optional.empty();
        }
        try {
            WireRecord w = mapper.readValue(payload, WireRecord.class);
            return Optional.of(new SyncRecord(w.id(), w.pubkey(), w.kind(),
                    Instant.ofEpochSecond(w.createdAt()), w.content(), w.tags()));
        } catch (IOException e) {
            log.debug("Skipped undecodable record payload bytes={} err={}", payload.length, e.toString());
            return Optional.empty();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record WireRecord(
            String id,
            String pubkey,
            int kind,
            @JsonProperty("created_at") long createdAt,
            String content,
            List<List<String>> tags
    ) {}
}
