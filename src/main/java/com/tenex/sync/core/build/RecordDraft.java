package com.tenex.sync.core.build;

import com.tenex.sync.core.model.SyncRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Fluent builder for an outgoing, not yet signed {@link SyncRecord}.
 *
 * <p>Forces the fields every record needs (kind, author, timestamp) and appends tags in call
 * order. Tags whose value is null or blank are skipped, so optional fields can be passed through
 * unconditionally.</p>
 *
 * <pre>
 * SyncRecord r = RecordDraft.kind(RecordKind.CONVERSATION)
 *         .author(pubkey)
 *         .createdAt(now)
 *         .content("hello")
 *         .tag("a", projectIdentity)
 *         .build();
 * </pre>
 */
public final class RecordDraft {

    private final int kind;
    private String author;
    private Instant createdAt;
    private String content = "";
    private final List<List<String>> tags = new ArrayList<>();

    private RecordDraft(int kind) {
        this.kind = kind;
    }

    public static RecordDraft kind(int kind) {
        return new RecordDraft(kind);
    }

    public RecordDraft author(String author) {
        this.author = author;
        return this;
    }

    public RecordDraft createdAt(Instant createdAt) {
        this.createdAt = createdAt;
        return this;
    }

    public RecordDraft content(String content) {
        this.content = content == null ? "" : content;
        return this;
    }

    /**
     * Appends {@code [key, value]} unless {@code value} is null or blank.
     */
    public RecordDraft tag(String key, String value) {
        if (value != null && !value.isBlank()) {
            tags.add(List.of(key, value));
        }
        return this;
    }

    /**
     * Appends {@code [key, values...]} verbatim. Used for marked references and multi-valued groups.
     */
    public RecordDraft group(String key, String... values) {
        List<String> g = new ArrayList<>(values.length + 1);
        g.add(key);
        g.addAll(Arrays.asList(values));
        tags.add(g);
        return this;
    }

    /**
     * Appends one {@code [key, value]} group per non-blank value, in order.
     */
    public RecordDraft each(String key, List<String> values) {
        if (values != null) {
            for (String v : values) {
                tag(key, v);
            }
        }
        return this;
    }

    public SyncRecord build() {
        Objects.requireNonNull(author, "author");
        Objects.requireNonNull(createdAt, "createdAt");
        return new SyncRecord("", author, kind, createdAt, content, tags);
    }
}
