package com.tenex.sync.service;

import com.tenex.sync.core.entity.Conversation;
import com.tenex.sync.core.entity.Lesson;
import com.tenex.sync.core.entity.Project;
import com.tenex.sync.core.entity.ProjectStatus;
import com.tenex.sync.core.entity.Task;
import com.tenex.sync.core.entity.ThreadReply;
import com.tenex.sync.core.entity.TypingSignal;
import com.tenex.sync.core.model.RecordKind;
import com.tenex.sync.core.model.SyncRecord;
import com.tenex.sync.core.parse.TagKeys;
import com.tenex.sync.core.transport.CachePolicy;
import com.tenex.sync.core.transport.RecordFilter;
import com.tenex.sync.core.transport.RecordTransport;
import com.tenex.sync.core.transport.TransportNotConfiguredException;
import com.tenex.sync.jetstream.bootstrap.RecordStreamReadyEvent;
import com.tenex.sync.jetstream.config.TenexSyncProperties;
import com.tenex.sync.subscription.FilterSignature;
import com.tenex.sync.subscription.HierarchicalWatch;
import com.tenex.sync.subscription.ParentKey;
import com.tenex.sync.subscription.SubscriptionHandle;
import com.tenex.sync.subscription.SubscriptionOrchestrator;
import com.tenex.sync.subscription.SubscriptionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * =====================================================================
 * ProjectSyncService
 * =====================================================================
 *
 * PURPOSE
 * -------
 * The composed synchronization session of one user:
 *
 *   projects authored by the user          (one shared subscription)
 *        │
 *        ├── presence monitor, project A   (status, typing, LLM config)
 *        ├── presence monitor, project B
 *        └── ...
 *
 * Every record lands in {@link SyncStores} through {@link RecordRouter}.
 * Monitors start the moment their project first appears.
 *
 * LIFECYCLE
 * ---------
 * - Starts on ApplicationReadyEvent (and again, idempotently, on
 *   RecordStreamReadyEvent) when {@code tenex.sync.monitor.enabled=true} and a
 *   user pubkey is configured
 * - {@link #start(String)} / {@link #stop()} may also be driven explicitly
 * - Stopped on shutdown
 *
 * One-shot queries ({@code fetch*}) use the bounded collect operation and
 * merge what they find into the same stores.
 */
@Service
public class ProjectSyncService implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(ProjectSyncService.class);

    /**
     * Kinds followed per project by its presence monitor.
     */
    static final Integer[] PRESENCE_KINDS = {
            RecordKind.PROJECT_STATUS,
            RecordKind.TYPING_START,
            RecordKind.TYPING_STOP,
            RecordKind.LLM_CONFIG_CHANGE
    };

    private final SubscriptionOrchestrator orchestrator;
    private final RecordTransport transport;
    private final SyncStores stores;
    private final RecordRouter router;
    private final TenexSyncProperties props;
    private final Clock clock;
    private final boolean autoStart;

    private final AtomicReference<HierarchicalWatch> session = new AtomicReference<>();

    public ProjectSyncService(
            SubscriptionOrchestrator orchestrator,
            RecordTransport transport,
            SyncStores stores,
            RecordRouter router,
            TenexSyncProperties props,
            Clock clock,
            @Value("${tenex.sync.monitor.enabled:false}") boolean autoStart
    ) {
        this.orchestrator = orchestrator;
        this.transport = transport;
        this.stores = stores;
        this.router = router;
        this.props = props;
        this.clock = clock;
        this.autoStart = autoStart;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onAppReady() {
        startIfEnabled();
    }

    @EventListener(RecordStreamReadyEvent.class)
    public void onRecordStreamReady() {
        startIfEnabled();
    }

    private void startIfEnabled() {
        if (!autoStart) {
            return;
        }
        String user = props.getUserPubkey();
        if (user == null || user.isBlank()) {
            log.warn("Sync session not started: tenex.sync.user-pubkey is empty");
            return;
        }
        try {
            start(user);
        } catch (TransportNotConfiguredException e) {
            log.warn("Sync session not started: {}", e.getMessage());
        }
    }

    /**
     * Starts the session for {@code userPubkey}. Idempotent while a session is running.
     *
     * @throws TransportNotConfiguredException when no transport is bound
     */
    public synchronized HierarchicalWatch start(String userPubkey) {
        HierarchicalWatch current = session.get();
        if (current != null && !current.isCancelled()) {
            return current;
        }
        RecordFilter projectsOfUser = RecordFilter.ofKinds(RecordKind.PROJECT).withAuthors(userPubkey);

        HierarchicalWatch watch = orchestrator.watchChildren(
                projectsOfUser,
                props.getCachePolicy(),
                router::route,
                ParentKey::addressable,
                ProjectSyncService::presenceFilter,
                props.getCachePolicy(),
                (projectIdentity, record) -> router.route(record));

        session.set(watch);
        log.info("Sync session started user={}", userPubkey);
        return watch;
    }

    public synchronized void stop() {
        HierarchicalWatch watch = session.getAndSet(null);
        if (watch != null) {
            watch.cancel();
            log.info("Sync session stopped");
        }
    }

    public Optional<HierarchicalWatch> session() {
        return Optional.ofNullable(session.get());
    }

    static RecordFilter presenceFilter(String projectIdentity) {
        return RecordFilter.ofKinds(PRESENCE_KINDS).withTag(TagKeys.ADDRESS, projectIdentity);
    }

    // ---------------------------------------------------------------------
    // Live state
    // ---------------------------------------------------------------------

    public List<Project> projects() {
        return stores.projects().snapshot().stream()
                .sorted(Comparator.comparing(Project::title).thenComparing(Project::identity))
                .toList();
    }

    public Optional<Project> project(String identity) {
        return stores.projects().get(identity);
    }

    public Optional<ProjectStatus> status(String projectIdentity) {
        return stores.statuses().latest(projectIdentity);
    }

    public List<ProjectStatus.AgentAvailability> availableAgents(String projectIdentity) {
        return stores.statuses().availableAgents(projectIdentity);
    }

    public boolean isOnline(String projectIdentity) {
        return stores.statuses().isOnline(projectIdentity, clock.instant());
    }

    public List<TypingSignal> activeTyping(String conversationId) {
        return stores.typing().activeTyping(conversationId, clock.instant());
    }

    /**
     * Follows abort instructions for one task. Signals arrive through
     * {@code stores.aborts()}; cancel the handle once the task is finished,
     * which also drops any abort still queued for it.
     */
    public SubscriptionHandle watchTaskAborts(String taskId) {
        RecordFilter f = RecordFilter.ofKinds(RecordKind.TASK_ABORT).withTag(TagKeys.EVENT, taskId);
        SubscriptionHandle watch = orchestrator.watch(f, CachePolicy.NETWORK_ONLY, router::route);
        return new SubscriptionHandle() {
            @Override
            public FilterSignature signature() {
                return watch.signature();
            }

            @Override
            public SubscriptionState state() {
                return watch.state();
            }

            @Override
            public void cancel() {
                watch.cancel();
                int dropped = stores.aborts().discard(taskId);
                if (dropped > 0) {
                    log.debug("Dropped unconsumed aborts taskId={} count={}", taskId, dropped);
                }
            }
        };
    }

    // ---------------------------------------------------------------------
    // One-shot queries
    // ---------------------------------------------------------------------

    public Mono<List<Conversation>> fetchConversations(String projectIdentity) {
        RecordFilter f = RecordFilter.ofKinds(RecordKind.CONVERSATION).withTag(TagKeys.ADDRESS, projectIdentity);
        return collect(f).map(x -> conversations(c -> c.projectIdentity().equals(projectIdentity)));
    }

    public Mono<List<Conversation>> fetchConversationsByAuthor(String author) {
        RecordFilter f = RecordFilter.ofKinds(RecordKind.CONVERSATION).withAuthors(author);
        return collect(f).map(x -> conversations(c -> c.authorId().equals(author)));
    }

    public Mono<List<Task>> fetchTasks(String projectIdentity) {
        RecordFilter f = RecordFilter.ofKinds(RecordKind.TASK).withTag(TagKeys.ADDRESS, projectIdentity);
        return collect(f).map(x -> stores.tasks().snapshot().stream()
                .filter(t -> t.projectIdentity().equals(projectIdentity))
                .sorted(Comparator.comparing(Task::recordedAt).thenComparing(Task::id))
                .toList());
    }

    public Mono<List<Lesson>> fetchLessons(String agentId) {
        RecordFilter f = RecordFilter.ofKinds(RecordKind.AGENT_LESSON).withAuthors(agentId);
        return collect(f).map(x -> stores.lessons().snapshot().stream()
                .filter(l -> l.agentId().equals(agentId))
                .sorted(Comparator.comparing(Lesson::createdAt).reversed())
                .toList());
    }

    public Mono<List<ThreadReply>> fetchReplies(String rootId) {
        RecordFilter f = RecordFilter.ofKinds(RecordKind.THREAD_REPLY).withTag(TagKeys.ROOT, rootId);
        return collect(f).map(x -> stores.replies().repliesTo(rootId));
    }

    private Mono<Integer> collect(RecordFilter filter) {
        Duration timeout = props.getCollectTimeout();
        return transport.collectOnce(filter, timeout)
                .map(records -> {
                    int changed = 0;
                    for (SyncRecord r : records) {
                        if (router.route(r)) {
                            changed++;
                        }
                    }
                    log.debug("Collected filter={} records={} changed={}", filter, records.size(), changed);
                    return changed;
                });
    }

    private List<Conversation> conversations(Predicate<Conversation> p) {
        return stores.conversations().snapshot().stream()
                .filter(p)
                .sorted(Comparator.comparing(Conversation::createdAt).thenComparing(Conversation::id))
                .toList();
    }

    @Override
    public void destroy() {
        stop();
    }
}
