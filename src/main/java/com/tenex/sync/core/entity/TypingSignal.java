package com.tenex.sync.core.entity;

import com.tenex.sync.core.merge.Mergeable;

import java.time.Duration;
import java.time.Instant;

/**
 * Ephemeral "agent is typing" signal for a conversation.
 *
 * <p>A signal expires {@link #VALIDITY_WINDOW} after {@code observedAt} whether or not a stop
 * record arrives. Validity is evaluated on every read and never cached. {@code active} is false
 * for a signal parsed from a stop record. {@code phase} is nullable.</p>
 */
public record TypingSignal(
        String conversationId,
        String projectIdentity,
        String agentId,
        String message,
        String phase,
        boolean active,
        Instant observedAt
) implements Mergeable<TypingSignal> {

    public static final Duration VALIDITY_WINDOW = Duration.ofSeconds(60);

    /**
     * One slot per agent per conversation.
     */
    @Override
    public String identity() {
        return conversationId + ":" + agentId;
    }

    @Override
    public Instant recordedAt() {
        return observedAt;
    }

    public boolean isValid(Instant now) {
        return isValid(now, VALIDITY_WINDOW);
    }

    public boolean isValid(Instant now, Duration window) {
        return Duration.between(observedAt, now).compareTo(window) < 0;
    }

    @Override
    public TypingSignal mergeNewer(TypingSignal newer) {
        return newer;
    }
}
