package com.tenex.sync.core.merge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keyed table mapping identity to the live value of one entity type, applying last-writer-wins
 * merge as records arrive.
 *
 * <h2>Upsert algorithm</h2>
 * <ol>
 *   <li>No entry for the identity: store the candidate, report {@code changed = true}.</li>
 *   <li>Candidate not strictly newer than the stored version ({@code recordedAt <= version}):
 *       discard it, report the stored value with {@code changed = false}.</li>
 *   <li>Otherwise apply the entity's field-update policy ({@link Mergeable#mergeNewer}), store the
 *       result under the candidate's timestamp, report {@code changed = true}.</li>
 * </ol>
 * Entities that {@linkplain Mergeable#foldsHistory() fold their history} keep one value per
 * record timestamp instead; the stored value is always the oldest-first fold of that history, so
 * an older record arriving late fills the fields newer partial updates left empty and never
 * overrides a field a newer record set. A second value at an already known timestamp is discarded.
 * <p>Either way the rule is commutative and idempotent: any arrival order and any number of
 * duplicates converge on the same value.</p>
 *
 * <h2>Concurrency</h2>
 * <ul>
 *   <li>Single writer per identity: every mutation of a slot happens while holding that slot's
 *       monitor. Different identities never contend.</li>
 *   <li>Reads are lock-free and return immutable snapshots, so a reader never observes a
 *       half-updated entity.</li>
 *   <li>Change notifications are queued inside the slot lock, so one identity's changes are
 *       delivered in version order, and are delivered through a {@link SerializedEmitter} after the
 *       lock is released. A slow or failing listener never fails an upsert.</li>
 * </ul>
 *
 * @param <T> entity type
 */
public class MergeStore<T extends Mergeable<T>> {

    private static final Logger log = LoggerFactory.getLogger(MergeStore.class);

    private final String name;

    private final Map<String, Slot<T>> slots = new ConcurrentHashMap<>();

    private final SerializedEmitter<EntityChange<T>> changes;

    public MergeStore(String name) {
        this.name = name;
        this.changes = new SerializedEmitter<>(name);
    }

    public String name() {
        return name;
    }

    /**
     * Upserts under the candidate's own identity.
     */
    public UpsertResult<T> upsert(T candidate) {
        return upsert(candidate.identity(), candidate);
    }

    public UpsertResult<T> upsert(String identity, T candidate) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity is required");
        }
        UpsertResult<T> result = null;
        while (result == null) {
            Slot<T> slot = slots.computeIfAbsent(identity, k -> new Slot<>());
            synchronized (slot) {
                if (!slot.retired) {
                    result = candidate.foldsHistory()
                            ? fold(slot, identity, candidate)
                            : apply(slot, identity, candidate);
                }
            }
        }
        changes.drain();
        return result;
    }

    // caller holds the slot monitor
    private UpsertResult<T> apply(Slot<T> slot, String identity, T candidate) {
        Entry<T> current = slot.entry;
        if (current == null) {
            slot.entry = new Entry<>(candidate, candidate.recordedAt());
            changes.enqueue(new EntityChange<>(EntityChange.Type.CREATED, identity, candidate));
            return new UpsertResult<>(candidate, true);
        }
        if (!candidate.recordedAt().isAfter(current.version())) {
            log.debug("Discarded stale value store={} identity={} candidate={} stored={}",
                    name, identity, candidate.recordedAt(), current.version());
            return new UpsertResult<>(current.entity(), false);
        }
        T merged = current.entity().mergeNewer(candidate);
        slot.entry = new Entry<>(merged, candidate.recordedAt());
        changes.enqueue(new EntityChange<>(EntityChange.Type.UPDATED, identity, merged));
        return new UpsertResult<>(merged, true);
    }

    // caller holds the slot monitor
    private UpsertResult<T> fold(Slot<T> slot, String identity, T candidate) {
        Entry<T> current = slot.entry;
        if (current == null) {
            slot.history = new TreeMap<>();
            slot.history.put(candidate.recordedAt(), candidate);
            slot.entry = new Entry<>(candidate, candidate.recordedAt());
            changes.enqueue(new EntityChange<>(EntityChange.Type.CREATED, identity, candidate));
            return new UpsertResult<>(candidate, true);
        }
        if (slot.history.putIfAbsent(candidate.recordedAt(), candidate) != null) {
            log.debug("Discarded known version store={} identity={} version={}",
                    name, identity, candidate.recordedAt());
            return new UpsertResult<>(current.entity(), false);
        }
        T folded;
        if (candidate.recordedAt().isAfter(current.version())) {
            folded = current.entity().mergeNewer(candidate);
        } else {
            log.debug("Refolding late value store={} identity={} candidate={} stored={}",
                    name, identity, candidate.recordedAt(), current.version());
            Iterator<T> it = slot.history.values().iterator();
            folded = it.next();
            while (it.hasNext()) {
                folded = folded.mergeNewer(it.next());
            }
        }
        slot.entry = new Entry<>(folded, slot.history.lastKey());
        if (folded.equals(current.entity())) {
            return new UpsertResult<>(folded, false);
        }
        changes.enqueue(new EntityChange<>(EntityChange.Type.UPDATED, identity, folded));
        return new UpsertResult<>(folded, true);
    }

    /**
     * Removes the entry for {@code identity} only if it is still at {@code version}. Used to roll
     * back an optimistic local value after a failed publish; a newer value is left untouched.
     *
     * @return true when the entry was removed
     */
    public boolean removeIfVersion(String identity, Instant version) {
        Slot<T> slot = slots.get(identity);
        if (slot == null) {
            return false;
        }
        synchronized (slot) {
            Entry<T> current = slot.entry;
            if (current == null || !current.version().equals(version)) {
                return false;
            }
            slot.entry = null;
            slot.history = null;
            slot.retired = true;
            slots.remove(identity, slot);
            changes.enqueue(new EntityChange<>(EntityChange.Type.REMOVED, identity, current.entity()));
        }
        changes.drain();
        return true;
    }

    public Optional<T> get(String identity) {
        Slot<T> slot = slots.get(identity);
        if (slot == null) {
            return Optional.empty();
        }
        Entry<T> e = slot.entry;
        return e == null ? Optional.empty() : Optional.of(e.entity());
    }

    /**
     * Version (newest record timestamp) of the stored value.
     */
    public Optional<Instant> versionOf(String identity) {
        Slot<T> slot = slots.get(identity);
        if (slot == null) {
            return Optional.empty();
        }
        Entry<T> e = slot.entry;
        return e == null ? Optional.empty() : Optional.of(e.version());
    }

    /**
     * Point-in-time copy of every stored value.
     */
    public List<T> snapshot() {
        List<T> out = new ArrayList<>(slots.size());
        for (Slot<T> slot : slots.values()) {
            Entry<T> e = slot.entry;
            if (e != null) {
                out.add(e.entity());
            }
        }
        return List.copyOf(out);
    }

    public int size() {
        int n = 0;
        for (Slot<T> slot : slots.values()) {
            if (slot.entry != null) {
                n++;
            }
        }
        return n;
    }

    /**
     * Hot stream of changes. Late subscribers only see changes made after they subscribed; combine
     * with {@link #snapshot()} for the current state.
     */
    public Flux<EntityChange<T>> changes() {
        return changes.asFlux();
    }

    private static final class Slot<T> {
        private volatile Entry<T> entry;
        // every version seen, for entities that fold their history; guarded by the slot monitor
        private NavigableMap<Instant, T> history;
        // set once the slot has been unlinked from the map; writers must re-resolve
        private boolean retired;
    }

    private record Entry<T>(T entity, Instant version) {}
}
