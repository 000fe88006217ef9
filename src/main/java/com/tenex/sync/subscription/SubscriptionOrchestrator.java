package com.tenex.sync.subscription;

import com.tenex.sync.core.model.SyncRecord;
import com.tenex.sync.core.transport.CachePolicy;
import com.tenex.sync.core.transport.RecordFilter;
import com.tenex.sync.core.transport.RecordTransport;
import com.tenex.sync.core.transport.TransportNotConfiguredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import reactor.core.Disposable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * =====================================================================
 * SubscriptionOrchestrator
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Opens and maintains one transport subscription per logical interest and
 * fans the records out to every consumer that registered for it.
 *
 *   [ RecordTransport ] ──► [ shared subscription (per FilterSignature) ]
 *                                   │            │            │
 *                                   ▼            ▼            ▼
 *                              handler A    handler B    handler C
 *
 * REGISTRY
 * --------
 * - Keyed by {@link FilterSignature} (authors, kinds, tag constraints, cache
 *   policy); equivalent filters share one transport subscription
 * - Registry mutations are atomic per key (ConcurrentHashMap.compute)
 * - The transport subscription is started outside the registry lock; start
 *   is idempotent
 * - A consumer joining a running subscription that replays stored records
 *   gets its own cache-only backfill, so it does not miss what was replayed
 *   before it joined
 *
 * FAILURE SEMANTICS
 * -----------------
 * - No transport bound: {@link #watch} throws
 *   {@link TransportNotConfiguredException}
 * - Mid-stream transport error: only that subscription is marked
 *   {@link SubscriptionState#FAILED}; siblings keep running. It restarts on
 *   {@link #retry(FilterSignature)} or when a new consumer watches it
 * - A throwing handler is logged and skipped; it never terminates the stream
 *
 * CANCELLATION
 * ------------
 * Cancelling a handle stops delivery to that handler immediately and disposes
 * the transport subscription when its last consumer leaves. Idempotent and
 * callable from any thread.
 */
public class SubscriptionOrchestrator implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionOrchestrator.class);

    private final RecordTransport transport;
    private final CachePolicy defaultPolicy;

    private final Map<FilterSignature, SharedSubscription> registry = new ConcurrentHashMap<>();

    public SubscriptionOrchestrator(RecordTransport transport, CachePolicy defaultPolicy) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.defaultPolicy = Objects.requireNonNull(defaultPolicy, "defaultPolicy");
    }

    public SubscriptionHandle watch(RecordFilter filter, Consumer<SyncRecord> handler) {
        return watch(filter, defaultPolicy, handler);
    }

    /**
     * Registers {@code handler} for every record matching {@code filter}.
     *
     * @throws TransportNotConfiguredException when no transport client is bound
     */
    public SubscriptionHandle watch(RecordFilter filter, CachePolicy cachePolicy, Consumer<SyncRecord> handler) {
        Objects.requireNonNull(handler, "handler");
        if (!transport.isConfigured()) {
            throw new TransportNotConfiguredException("Cannot watch " + filter + ": no record transport bound");
        }
        FilterSignature signature = FilterSignature.of(filter, cachePolicy);
        AtomicBoolean joinedRunning = new AtomicBoolean(false);
        AtomicReference<Registration> created = new AtomicReference<>();

        SharedSubscription shared = registry.compute(signature, (key, existing) -> {
            SharedSubscription s = existing;
            if (s == null || s.state == SubscriptionState.COMPLETED) {
                s = new SharedSubscription(key);
            } else if (s.state == SubscriptionState.ACTIVE && s.started.get()) {
                joinedRunning.set(true);
            }
            Registration reg = new Registration(s, handler);
            s.registrations.add(reg);
            created.set(reg);
            return s;
        });

        Registration reg = created.get();
        shared.ensureRunning();
        if (joinedRunning.get() && cachePolicy.replaysStored()) {
            reg.backfill();
        }
        return reg;
    }

    /**
     * Restarts a failed subscription.
     *
     * @return true when a failed subscription was found and restarted
     */
    public boolean retry(FilterSignature signature) {
        SharedSubscription shared = registry.get(signature);
        if (shared == null || shared.state != SubscriptionState.FAILED) {
            return false;
        }
        log.info("Retrying subscription signature={}", signature);
        shared.ensureRunning();
        return true;
    }

    /**
     * Parent/child watch: every parent record matching {@code parentFilter} goes to
     * {@code parentHandler}, and each distinct parent identity gets one child monitor over
     * {@code childFilter.apply(parentIdentity)}. Cancelling the returned watch cancels every
     * child monitor.
     *
     * @param parentKey resolves a parent record to its key, or null to ignore the record
     */
    public HierarchicalWatch watchChildren(
            RecordFilter parentFilter,
            CachePolicy parentPolicy,
            Consumer<SyncRecord> parentHandler,
            Function<SyncRecord, ParentKey> parentKey,
            Function<String, RecordFilter> childFilter,
            CachePolicy childPolicy,
            BiConsumer<String, SyncRecord> childHandler
    ) {
        HierarchicalWatch watch = new HierarchicalWatch(this, parentKey, childFilter, childPolicy, childHandler);
        SubscriptionHandle parent = watch(parentFilter, parentPolicy, record -> {
            parentHandler.accept(record);
            watch.onParent(record);
        });
        watch.attachParent(parent);
        return watch;
    }

    public List<SubscriptionInfo> activeSubscriptions() {
        List<SubscriptionInfo> out = new ArrayList<>();
        for (SharedSubscription s : registry.values()) {
            out.add(s.info());
        }
        out.sort(Comparator.comparing(SubscriptionInfo::signature));
        return out;
    }

    public SubscriptionState stateOf(FilterSignature signature) {
        SharedSubscription s = registry.get(signature);
        return s == null ? null : s.state;
    }

    /**
     * Cancels every subscription. Called during Spring shutdown.
     */
    @Override
    public void destroy() {
        for (FilterSignature key : List.copyOf(registry.keySet())) {
            SharedSubscription s = registry.remove(key);
            if (s != null) {
                s.registrations.forEach(Registration::markCancelled);
                s.stop();
            }
        }
    }

    private void release(Registration reg) {
        AtomicReference<SharedSubscription> orphaned = new AtomicReference<>();
        registry.computeIfPresent(reg.shared.signature, (key, s) -> {
            if (s != reg.shared) {
                return s;
            }
            s.registrations.remove(reg);
            if (s.registrations.isEmpty()) {
                orphaned.set(s);
                return null;
            }
            return s;
        });
        SharedSubscription s = orphaned.get();
        if (s != null) {
            s.stop();
            log.info("Subscription closed signature={} delivered={}", s.signature, s.delivered.get());
        }
    }

    private void onCompleted(SharedSubscription s) {
        s.state = SubscriptionState.COMPLETED;
        registry.remove(s.signature, s);
        log.info("Subscription completed signature={} delivered={}", s.signature, s.delivered.get());
    }

    /**
     * One transport subscription and the consumers sharing it.
     */
    private final class SharedSubscription {

        private final FilterSignature signature;
        private final List<Registration> registrations = new CopyOnWriteArrayList<>();
        private final AtomicReference<Disposable> running = new AtomicReference<>();
        private final AtomicBoolean started = new AtomicBoolean(false);
        private final AtomicLong delivered = new AtomicLong();

        private volatile SubscriptionState state = SubscriptionState.ACTIVE;
        private volatile String lastError;

        private SharedSubscription(FilterSignature signature) {
            this.signature = signature;
        }

        /**
         * Starts the transport subscription unless it is already running.
         */
        private synchronized void ensureRunning() {
            if (started.get() && state == SubscriptionState.ACTIVE) {
                return;
            }
            if (state == SubscriptionState.CANCELLED) {
                return;
            }
            state = SubscriptionState.ACTIVE;
            lastError = null;
            started.set(true);

            Disposable d = transport.subscribe(signature.filter(), signature.cachePolicy())
                    .subscribe(
                            this::dispatch,
                            this::fail,
                            () -> onCompleted(this)
                    );
            Disposable previous = running.getAndSet(d);
            if (previous != null && !previous.isDisposed()) {
                previous.dispose();
            }
            log.info("Subscription started signature={} consumers={}", signature, registrations.size());
        }

        private void dispatch(SyncRecord record) {
            delivered.incrementAndGet();
            for (Registration reg : registrations) {
                reg.deliver(record);
            }
        }

        private void fail(Throwable err) {
            state = SubscriptionState.FAILED;
            lastError = err.toString();
            started.set(false);
            log.warn("Subscription failed; no live updates until retried. signature={} err={}",
                    signature, err.toString());
        }

        private synchronized void stop() {
            state = SubscriptionState.CANCELLED;
            Disposable d = running.getAndSet(null);
            if (d != null && !d.isDisposed()) {
                d.dispose();
            }
        }

        private SubscriptionInfo info() {
            return new SubscriptionInfo(signature.value(), signature.cachePolicy(), state,
                    registrations.size(), delivered.get(), lastError);
        }
    }

    /**
     * One consumer of a shared subscription.
     */
    private final class Registration implements SubscriptionHandle {

        private final SharedSubscription shared;
        private final Consumer<SyncRecord> handler;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private final AtomicReference<Disposable> backfill = new AtomicReference<>();

        private Registration(SharedSubscription shared, Consumer<SyncRecord> handler) {
            this.shared = shared;
            this.handler = handler;
        }

        private void deliver(SyncRecord record) {
            if (cancelled.get()) {
                return;
            }
            try {
                handler.accept(record);
            } catch (RuntimeException e) {
                log.warn("Handler failed; record skipped. signature={} recordId={} err={}",
                        shared.signature, record.id(), e.toString(), e);
            }
        }

        private void backfill() {
            Disposable d = transport.subscribe(shared.signature.filter(), CachePolicy.CACHE_ONLY)
                    .subscribe(
                            this::deliver,
                            err -> log.warn("Backfill failed signature={} err={}", shared.signature, err.toString())
                    );
            backfill.set(d);
            if (cancelled.get()) {
                d.dispose();
            }
        }

        private void markCancelled() {
            cancelled.set(true);
            Disposable d = backfill.getAndSet(null);
            if (d != null && !d.isDisposed()) {
                d.dispose();
            }
        }

        @Override
        public FilterSignature signature() {
            return shared.signature;
        }

        @Override
        public SubscriptionState state() {
            return cancelled.get() ? SubscriptionState.CANCELLED : shared.state;
        }

        @Override
        public void cancel() {
            if (!cancelled.compareAndSet(false, true)) {
                return;
            }
            markCancelled();
            release(this);
        }
    }
}
