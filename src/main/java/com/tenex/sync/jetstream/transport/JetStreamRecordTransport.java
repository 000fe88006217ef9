package com.tenex.sync.jetstream.transport;

import com.tenex.sync.core.model.SyncRecord;
import com.tenex.sync.core.transport.CachePolicy;
import com.tenex.sync.core.transport.RecordFilter;
import com.tenex.sync.core.transport.RecordTransport;
import com.tenex.sync.core.transport.SyncTransportException;
import com.tenex.sync.core.transport.TransportUnavailableException;
import com.tenex.sync.jetstream.config.RecordStreamProperties;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PublishOptions;
import io.nats.client.PullSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.DeliverPolicy;
import io.nats.client.api.PublishAck;
import io.nats.client.api.ReplayPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * =====================================================================
 * JetStreamRecordTransport
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Reference {@link RecordTransport} binding over NATS JetStream.
 *
 * SUBJECTS
 * --------
 *   <prefix>.<kind>   one subject per record kind
 *
 * A subscription opens one ephemeral pull consumer per requested kind (or a
 * single wildcard consumer when the filter names no kinds) and merges them.
 * Author and tag constraints are applied client-side.
 *
 * CACHE POLICY MAPPING
 * --------------------
 *   CACHE_ONLY          DeliverPolicy.All, completes on the first empty pull
 *   NETWORK_ONLY        DeliverPolicy.New, never completes
 *   CACHE_THEN_NETWORK  DeliverPolicy.All, never completes
 *
 * Consumers are ephemeral with AckPolicy.None: the stream is a replay log and
 * nothing is removed by reading it.
 *
 * DE-DUPLICATION RULE (LOCKED)
 * ----------------------------
 *   Msg-Id == record id
 *
 * FAILURE MODEL
 * -------------
 * Every NATS failure surfaces as {@link TransportUnavailableException} on the
 * one stream or publish that hit it.
 *
 * THREADING
 * ---------
 * All NATS calls block and run on {@link Schedulers#boundedElastic()}.
 */
@Component
@ConditionalOnProperty(prefix = "tenex.sync.transport", name = "enabled", havingValue = "true", matchIfMissing = false)
public class JetStreamRecordTransport implements RecordTransport {

    private static final Logger log = LoggerFactory.getLogger(JetStreamRecordTransport.class);

    /**
     * JetStream API error code for "stream not found".
     */
    private static final int JS_STREAM_NOT_FOUND_ERR = 10059;

    private final JetStream js;
    private final RecordCodec codec;
    private final RecordStreamProperties stream;

    public JetStreamRecordTransport(JetStream js, RecordCodec codec, RecordStreamProperties stream) {
        this.js = js;
        this.codec = codec;
        this.stream = stream;
    }

    @Override
    public Flux<SyncRecord> subscribe(RecordFilter filter, CachePolicy cachePolicy) {
        List<Flux<SyncRecord>> perSubject = new ArrayList<>();
        for (String subject : subjectsFor(filter)) {
            perSubject.add(pull(subject, cachePolicy));
        }
        return Flux.merge(perSubject).filter(filter::matches);
    }

    @Override
    public Mono<List<SyncRecord>> collectOnce(RecordFilter filter, Duration timeout) {
        return subscribe(filter, CachePolicy.CACHE_ONLY)
                .take(timeout)
                .collectList();
    }

    @Override
    public Mono<Set<String>> publish(SyncRecord record) {
        if (!record.isSigned()) {
            return Mono.error(new IllegalArgumentException("Only signed records can be published"));
        }
        String subject = stream.subjectFor(record.kind());
        return Mono.fromCallable(() -> {
                    PublishOptions opts = PublishOptions.builder()
                            .messageId(record.id())
                            .expectedStream(stream.getName())
                            .build();

                    PublishAck ack = js.publish(subject, codec.encode(record), opts);

                    log.info("Published record id={} kind={} stream={} seq={} duplicate={}",
                            record.id(), record.kind(), ack.getStream(), ack.getSeqno(), ack.isDuplicate());
                    return Set.of(ack.getStream());
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> !(e instanceof SyncTransportException),
                        e -> new TransportUnavailableException("Publish failed subject=" + subject + ": " + e.getMessage(), e));
    }

    private List<String> subjectsFor(RecordFilter filter) {
        if (filter.kinds().isEmpty()) {
            return List.of(stream.wildcardSubject());
        }
        List<String> out = new ArrayList<>();
        for (Integer kind : new TreeSet<>(filter.kinds())) {
            out.add(stream.subjectFor(kind));
        }
        return out;
    }

    /**
     * One ephemeral pull consumer on {@code subject}, released when the stream terminates or is
     * cancelled.
     */
    private Flux<SyncRecord> pull(String subject, CachePolicy cachePolicy) {
        return Flux.using(
                        () -> open(subject, cachePolicy),
                        sub -> drain(sub, cachePolicy),
                        sub -> close(sub, subject))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> !(e instanceof SyncTransportException),
                        e -> new TransportUnavailableException("Subscription failed subject=" + subject + ": " + e.getMessage(), e));
    }

    private JetStreamSubscription open(String subject, CachePolicy cachePolicy) throws Exception {
        ConsumerConfiguration cc = ConsumerConfiguration.builder()
                .deliverPolicy(cachePolicy.replaysStored() ? DeliverPolicy.All : DeliverPolicy.New)
                .replayPolicy(ReplayPolicy.Instant)
                .ackPolicy(AckPolicy.None)
                .filterSubject(subject)
                .build();

        PullSubscribeOptions pso = PullSubscribeOptions.builder()
                .stream(stream.getName())
                .configuration(cc)
                .build();
        try {
            JetStreamSubscription sub = js.subscribe(subject, pso);
            log.debug("Pull consumer opened stream={} subject={} policy={}", stream.getName(), subject, cachePolicy);
            return sub;
        } catch (JetStreamApiException jse) {
            if (jse.getApiErrorCode() == JS_STREAM_NOT_FOUND_ERR) {
                throw new TransportUnavailableException("Record stream not found: " + stream.getName(), jse);
            }
            throw jse;
        }
    }

    private Flux<SyncRecord> drain(JetStreamSubscription sub, CachePolicy cachePolicy) {
        int batch = stream.getFetchBatch();
        Duration maxWait = stream.getFetchWait();
        return Flux.<List<Message>>generate(sink -> {
                    try {
                        List<Message> messages = sub.fetch(batch, maxWait);
                        if (messages.isEmpty() && !cachePolicy.isLive()) {
                            sink.complete();
                        } else {
                            sink.next(messages);
                        }
                    } catch (Exception e) {
                        sink.error(e);
                    }
                })
                .concatMapIterable(messages -> messages)
                .concatMapIterable(msg -> decode(msg).map(List::of).orElse(List.of()));
    }

    private Optional<SyncRecord> decode(Message msg) {
        return codec.decode(msg.getData());
    }

    private void close(JetStreamSubscription sub, String subject) {
        try {
            sub.unsubscribe();
            log.debug("Pull consumer closed subject={}", subject);
        } catch (Exception e) {
            log.debug("Unsubscribe failed (ignored): subject={} err={}", subject, e.toString());
        }
    }
}
