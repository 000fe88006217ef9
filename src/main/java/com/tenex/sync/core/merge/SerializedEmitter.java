package com.tenex.sync.core.merge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Multicast notification sink that any number of threads may feed without ever failing.
 *
 * <p>Values are appended to a queue and delivered by whichever thread wins the drain; every other
 * caller returns immediately. The sink therefore never sees concurrent emission, a slow listener
 * delays delivery instead of failing a producer, and values queued by one thread are delivered in
 * the order they were queued. A listener that emits from its own callback has its value queued
 * and delivered after the current one.</p>
 *
 * @param <T> notification type
 */
public class SerializedEmitter<T> {

    private static final Logger log = LoggerFactory.getLogger(SerializedEmitter.class);

    private final String name;

    private final Sinks.Many<T> sink = Sinks.many().multicast().directBestEffort();

    private final Queue<T> queued = new ConcurrentLinkedQueue<>();

    private final AtomicInteger wip = new AtomicInteger();

    public SerializedEmitter(String name) {
        this.name = name;
    }

    /**
     * Queues {@code value} and delivers everything pending.
     */
    public void emit(T value) {
        enqueue(value);
        drain();
    }

    /**
     * Queues {@code value} without delivering it. Callers holding a lock queue under it and call
     * {@link #drain()} once released.
     */
    public void enqueue(T value) {
        queued.add(value);
    }

    public void drain() {
        if (wip.getAndIncrement() != 0) {
            return;
        }
        int missed = 1;
        do {
            T value;
            while ((value = queued.poll()) != null) {
                deliver(value);
            }
            missed = wip.addAndGet(-missed);
        } while (missed != 0);
    }

    public Flux<T> asFlux() {
        return sink.asFlux();
    }

    private void deliver(T value) {
        try {
            Sinks.EmitResult result = sink.tryEmitNext(value);
            if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
                log.warn("Dropped notification emitter={} result={} value={}", name, result, value);
            }
        } catch (RuntimeException e) {
            log.warn("Listener failed emitter={} value={}", name, value, e);
        }
    }
}
