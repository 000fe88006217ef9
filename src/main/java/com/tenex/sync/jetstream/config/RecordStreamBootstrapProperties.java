package com.tenex.sync.jetstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * =====================================================================
 * RecordStreamBootstrapProperties
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Controls how strictly the record stream is validated at startup.
 *
 * WHEN failOnMismatch IS TRUE
 * ---------------------------
 * Startup fails if the existing stream differs from
 * {@link RecordStreamProperties}. Recommended wherever the stream is shared.
 *
 * WHEN FALSE
 * ----------
 * A warning is logged and startup continues. Never modifies or migrates an
 * existing stream: this flag controls reaction, not repair.
 *
 * CONFIGURATION PREFIX
 * --------------------
 * tenex.sync.bootstrap.*
 */
@ConfigurationProperties(prefix = "tenex.sync.bootstrap")
public class RecordStreamBootstrapProperties {

    private boolean enabled = false;

    private boolean failOnMismatch = false;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public boolean isFailOnMismatch() { return failOnMismatch; }
    public void setFailOnMismatch(boolean failOnMismatch) { this.failOnMismatch = failOnMismatch; }
}
