package com.tenex.sync.config;

import com.tenex.sync.core.transport.RecordTransport;
import com.tenex.sync.core.transport.UnboundRecordTransport;
import com.tenex.sync.jetstream.config.RecordStreamBootstrapProperties;
import com.tenex.sync.jetstream.config.RecordStreamProperties;
import com.tenex.sync.jetstream.config.TenexSyncProperties;
import com.tenex.sync.service.RecordRouter;
import com.tenex.sync.service.SyncStores;
import com.tenex.sync.subscription.SubscriptionOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the transport-neutral synchronization core:
 * <ul>
 *   <li>entity stores and presence reducers</li>
 *   <li>the record router</li>
 *   <li>the subscription orchestrator</li>
 *   <li>an unbound transport when {@code tenex.sync.transport.enabled} is not true</li>
 * </ul>
 */
@Configuration
@EnableConfigurationProperties({
        TenexSyncProperties.class,             // Identity, NATS connectivity, presence policy
        RecordStreamProperties.class,          // Record stream layout and pull tuning
        RecordStreamBootstrapProperties.class  // Stream bootstrap toggles
})
public class SyncCoreConfig {

    private static final Logger log = LoggerFactory.getLogger(SyncCoreConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SyncStores syncStores(TenexSyncProperties props) {
        return new SyncStores(props.getStatusFreshness(), props.getTypingValidity(), props.getAbortDedupWindow());
    }

    @Bean
    public RecordRouter recordRouter(SyncStores stores) {
        return new RecordRouter(stores);
    }

    @Bean
    public SubscriptionOrchestrator subscriptionOrchestrator(RecordTransport transport, TenexSyncProperties props) {
        return new SubscriptionOrchestrator(transport, props.getCachePolicy());
    }

    @Bean
    @ConditionalOnProperty(prefix = "tenex.sync.transport", name = "enabled", havingValue = "false", matchIfMissing = true)
    public RecordTransport unboundRecordTransport() {
        log.warn("No record transport bound (tenex.sync.transport.enabled=false); subscriptions and publishes will fail");
        return new UnboundRecordTransport();
    }
}
