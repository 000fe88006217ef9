package com.tenex.sync.jetstream.config;

import com.tenex.sync.core.transport.CachePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Core settings of the synchronization service, bound from {@code tenex.sync.*}.
 *
 * <p>Covers the local identity, NATS connectivity, subscription defaults and presence policy.
 * The record stream itself is described by {@link RecordStreamProperties}.</p>
 */
@ConfigurationProperties(prefix = "tenex.sync")
public class TenexSyncProperties {

    // ---------------------------------------------------------------------
    // Local identity
    // ---------------------------------------------------------------------

    /**
     * Public key of the local user. Projects authored by this key are synchronized on startup.
     * Empty disables the automatic session.
     */
    private String userPubkey = "";

    // ---------------------------------------------------------------------
    // NATS connectivity
    // ---------------------------------------------------------------------

    /**
     * NATS server URL. Used only when {@code tenex.sync.transport.enabled=true}.
     */
    private String natsUrl = "nats://localhost:4222";

    private String natsUser;

    private String natsPassword;

    private String natsToken;

    /**
     * Path to a NATS credentials (JWT + NKey) file.
     */
    private String natsCreds;

    private boolean natsTls = false;

    // ---------------------------------------------------------------------
    // Subscription defaults
    // ---------------------------------------------------------------------

    /**
     * Cache policy for watches that do not name one.
     */
    private CachePolicy cachePolicy = CachePolicy.CACHE_THEN_NETWORK;

    /**
     * Upper bound of one-shot collection queries.
     */
    private Duration collectTimeout = Duration.ofSeconds(5);

    // ---------------------------------------------------------------------
    // Presence policy
    // ---------------------------------------------------------------------

    /**
     * How long a typing signal stays valid after it was observed.
     */
    private Duration typingValidity = Duration.ofSeconds(60);

    /**
     * A project counts as online while its latest status is younger than this. Zero treats any
     * status ever received as online.
     */
    private Duration statusFreshness = Duration.ofMinutes(5);

    /**
     * Number of recently seen abort record ids remembered for de-duplication.
     */
    private int abortDedupWindow = 4096;

    // ---------------------------------------------------------------------
    // Getters / setters for Spring Boot binding
    // ---------------------------------------------------------------------

    public String getUserPubkey() { return userPubkey; }
    public void setUserPubkey(String userPubkey) { this.userPubkey = userPubkey; }

    public String getNatsUrl() { return natsUrl; }
    public void setNatsUrl(String natsUrl) { this.natsUrl = natsUrl; }

    public String getNatsUser() { return natsUser; }
    public void setNatsUser(String natsUser) { this.natsUser = natsUser; }

    public String getNatsPassword() { return natsPassword; }
    public void setNatsPassword(String natsPassword) { this.natsPassword = natsPassword; }

    public String getNatsToken() { return natsToken; }
    public void setNatsToken(String natsToken) { this.natsToken = natsToken; }

    public String getNatsCreds() { return natsCreds; }
    public void setNatsCreds(String natsCreds) { this.natsCreds = natsCreds; }

    public boolean isNatsTls() { return natsTls; }
    public void setNatsTls(boolean natsTls) { this.natsTls = natsTls; }

    public CachePolicy getCachePolicy() { return cachePolicy; }
    public void setCachePolicy(CachePolicy cachePolicy) { this.cachePolicy = cachePolicy; }

    public Duration getCollectTimeout() { return collectTimeout; }
    public void setCollectTimeout(Duration collectTimeout) { this.collectTimeout = collectTimeout; }

    public Duration getTypingValidity() { return typingValidity; }
    public void setTypingValidity(Duration typingValidity) { this.typingValidity = typingValidity; }

    public Duration getStatusFreshness() { return statusFreshness; }
    public void setStatusFreshness(Duration statusFreshness) { this.statusFreshness = statusFreshness; }

    public int getAbortDedupWindow() { return abortDedupWindow; }
    public void setAbortDedupWindow(int abortDedupWindow) { this.abortDedupWindow = abortDedupWindow; }
}
