package com.tenex.sync.core.reduce;

import com.tenex.sync.core.entity.TaskAbortSignal;
import com.tenex.sync.core.merge.SerializedEmitter;
import com.tenex.sync.core.model.RecordKind;
import com.tenex.sync.core.model.SyncRecord;
import com.tenex.sync.core.parse.EntityParsers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * =====================================================================
 * TaskAbortInbox
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Delivers task-abort instructions exactly once to whoever drives the task.
 * Abort signals are never entity state: they are queued per task until taken.
 *
 * DEDUP
 * -----
 * Signals are deduplicated by record id over a bounded window of recently
 * seen ids, so a redelivered abort is not queued twice.
 *
 * CONSUMPTION
 * -----------
 * - Pull: {@link #take(String)} removes and returns the oldest pending signal
 * - Push: {@link #abortsFor(String)} streams the signals already queued for
 *   one task, then new ones as they arrive
 *
 * Either way a signal is removed from the queue when it is handed out, so it
 * reaches exactly one consumer. A task with nothing pending holds no queue.
 */
public class TaskAbortInbox {

    private static final Logger log = LoggerFactory.getLogger(TaskAbortInbox.class);

    public static final int DEFAULT_DEDUP_WINDOW = 4096;

    private final Map<String, Boolean> seen;

    private final Map<String, Deque<TaskAbortSignal>> pending = new ConcurrentHashMap<>();

    private final SerializedEmitter<TaskAbortSignal> signals = new SerializedEmitter<>("task-aborts");

    public TaskAbortInbox() {
        this(DEFAULT_DEDUP_WINDOW);
    }

    public TaskAbortInbox(int dedupWindow) {
        this.seen = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > dedupWindow;
            }
        };
    }

    /**
     * Queues the abort carried by {@code record}.
     *
     * @return true when the signal was new and queued
     */
    public boolean offer(SyncRecord record) {
        if (record.kind() != RecordKind.TASK_ABORT) {
            return false;
        }
        TaskAbortSignal signal = EntityParsers.taskAbort(record);
        if (signal.taskId().isEmpty()) {
            log.debug("Dropped abort record without task reference id={}", record.id());
            return false;
        }
        synchronized (seen) {
            if (!signal.recordId().isEmpty() && seen.putIfAbsent(signal.recordId(), Boolean.TRUE) != null) {
                return false;
            }
        }
        pending.compute(signal.taskId(), (taskId, queue) -> {
            Deque<TaskAbortSignal> q = queue == null ? new ArrayDeque<>() : queue;
            q.addLast(signal);
            return q;
        });
        log.info("Abort queued taskId={} requester={}", signal.taskId(), signal.requesterId());
        signals.emit(signal);
        return true;
    }

    /**
     * Consumes the oldest pending abort for {@code taskId}.
     */
    public Optional<TaskAbortSignal> take(String taskId) {
        AtomicReference<TaskAbortSignal> taken = new AtomicReference<>();
        pending.computeIfPresent(taskId, (k, queue) -> {
            taken.set(queue.pollFirst());
            return queue.isEmpty() ? null : queue;
        });
        return Optional.ofNullable(taken.get());
    }

    public boolean hasPending(String taskId) {
        return pending.containsKey(taskId);
    }

    /**
     * Drops everything still queued for {@code taskId}.
     *
     * @return number of signals dropped
     */
    public int discard(String taskId) {
        Deque<TaskAbortSignal> queue = pending.remove(taskId);
        return queue == null ? 0 : queue.size();
    }

    /**
     * Number of tasks with at least one pending abort.
     */
    public int pendingTasks() {
        return pending.size();
    }

    /**
     * Streams the aborts for {@code taskId}: those already queued first, then live ones. Each
     * emitted signal is claimed from the queue.
     */
    public Flux<TaskAbortSignal> abortsFor(String taskId) {
        Flux<TaskAbortSignal> live = signals.asFlux().filter(s -> s.taskId().equals(taskId));
        Flux<TaskAbortSignal> backlog = Flux.defer(() -> Flux.fromIterable(queued(taskId)));
        return Flux.merge(live, backlog).filter(this::claim);
    }

    private List<TaskAbortSignal> queued(String taskId) {
        List<TaskAbortSignal> copy = new ArrayList<>();
        pending.computeIfPresent(taskId, (k, queue) -> {
            copy.addAll(queue);
            return queue;
        });
        return copy;
    }

    // true when this caller removed the signal; a signal already handed out is not claimed twice
    private boolean claim(TaskAbortSignal signal) {
        AtomicBoolean removed = new AtomicBoolean();
        pending.computeIfPresent(signal.taskId(), (k, queue) -> {
            removed.set(queue.remove(signal));
            return queue.isEmpty() ? null : queue;
        });
        return removed.get();
    }
}
