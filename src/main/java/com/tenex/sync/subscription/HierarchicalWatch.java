package com.tenex.sync.subscription;

import com.tenex.sync.core.model.SyncRecord;
import com.tenex.sync.core.transport.CachePolicy;
import com.tenex.sync.core.transport.RecordFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Parent watch that drives one child monitor per parent identity, e.g. one status monitor per
 * project.
 *
 * <h2>Monitor rules</h2>
 * <ul>
 *   <li>A monitor is started the moment its parent identity first appears, without waiting for the
 *       rest of the parent stream.</li>
 *   <li>At most one monitor per parent identity. Monitors are created and replaced atomically per
 *       identity, so duplicate parent records never start a second one.</li>
 *   <li>A strictly newer parent record backed by a different underlying record restarts the
 *       monitor. Older records and redeliveries of the current record change nothing.</li>
 *   <li>{@link #cancel()} cancels the parent subscription and every monitor. No monitor is started
 *       after that.</li>
 * </ul>
 */
public class HierarchicalWatch {

    private static final Logger log = LoggerFactory.getLogger(HierarchicalWatch.class);

    private final SubscriptionOrchestrator orchestrator;
    private final Function<SyncRecord, ParentKey> parentKey;
    private final Function<String, RecordFilter> childFilter;
    private final CachePolicy childPolicy;
    private final BiConsumer<String, SyncRecord> childHandler;

    private final Map<String, Monitor> monitors = new ConcurrentHashMap<>();

    private volatile SubscriptionHandle parent;
    private volatile boolean closed;

    HierarchicalWatch(
            SubscriptionOrchestrator orchestrator,
            Function<SyncRecord, ParentKey> parentKey,
            Function<String, RecordFilter> childFilter,
            CachePolicy childPolicy,
            BiConsumer<String, SyncRecord> childHandler
    ) {
        this.orchestrator = orchestrator;
        this.parentKey = parentKey;
        this.childFilter = childFilter;
        this.childPolicy = childPolicy;
        this.childHandler = childHandler;
    }

    void attachParent(SubscriptionHandle handle) {
        this.parent = handle;
        if (closed) {
            handle.cancel();
        }
    }

    void onParent(SyncRecord record) {
        ParentKey key = parentKey.apply(record);
        if (key == null || closed) {
            return;
        }
        monitors.compute(key.identity(), (identity, current) -> {
            if (closed) {
                return current;
            }
            if (current == null) {
                log.info("Monitor started parent={} record={}", identity, key.recordId());
                return start(key);
            }
            if (!key.version().isAfter(current.key().version())
                    || key.recordId().equals(current.key().recordId())) {
                return current;
            }
            log.info("Monitor restarted parent={} previousRecord={} record={}",
                    identity, current.key().recordId(), key.recordId());
            current.handle().cancel();
            return start(key);
        });
        if (closed) {
            release(key.identity());
        }
    }

    private Monitor start(ParentKey key) {
        String identity = key.identity();
        SubscriptionHandle handle = orchestrator.watch(childFilter.apply(identity), childPolicy,
                record -> childHandler.accept(identity, record));
        return new Monitor(key, handle);
    }

    /**
     * Stops the monitor of one parent. The next record of that parent starts a fresh one.
     *
     * @return true when a monitor was running
     */
    public boolean release(String parentIdentity) {
        Monitor m = monitors.remove(parentIdentity);
        if (m == null) {
            return false;
        }
        m.handle().cancel();
        log.info("Monitor cancelled parent={}", parentIdentity);
        return true;
    }

    public void cancel() {
        closed = true;
        SubscriptionHandle p = parent;
        if (p != null) {
            p.cancel();
        }
        while (!monitors.isEmpty()) {
            for (String identity : List.copyOf(monitors.keySet())) {
                release(identity);
            }
        }
    }

    public boolean isCancelled() {
        return closed;
    }

    public Set<String> activeMonitors() {
        return new TreeSet<>(monitors.keySet());
    }

    public Optional<SubscriptionHandle> monitorOf(String parentIdentity) {
        Monitor m = monitors.get(parentIdentity);
        return m == null ? Optional.empty() : Optional.of(m.handle());
    }

    public Optional<ParentKey> parentOf(String parentIdentity) {
        Monitor m = monitors.get(parentIdentity);
        return m == null ? Optional.empty() : Optional.of(m.key());
    }

    public SubscriptionState parentState() {
        SubscriptionHandle p = parent;
        return p == null ? SubscriptionState.ACTIVE : p.state();
    }

    private record Monitor(ParentKey key, SubscriptionHandle handle) {}
}
