package com.tenex.sync.jetstream.config;

import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamManagement;
import io.nats.client.Nats;
import io.nats.client.Options;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration that wires up:
 * - the NATS {@link Connection}
 * - JetStream client APIs ({@link JetStream} and {@link JetStreamManagement})
 *
 * <h2>Activation</h2>
 * Only when {@code tenex.sync.transport.enabled=true}. Without it the application runs with an
 * unbound transport and every transport operation fails with a configuration error.
 *
 * <h2>Authentication</h2>
 * <ul>
 *   <li>No auth/TLS configured: plain {@code Nats.connect(url)}.</li>
 *   <li>Otherwise an {@link Options} is built with token, user/password, credentials file and TLS
 *       as configured.</li>
 * </ul>
 * Secrets are never logged.
 */
@Configuration
@ConditionalOnProperty(prefix = "tenex.sync.transport", name = "enabled", havingValue = "true", matchIfMissing = false)
public class NatsJetStreamConfig {

    private static final Logger log = LoggerFactory.getLogger(NatsJetStreamConfig.class);

    @Bean(destroyMethod = "close")
    public Connection natsConnection(TenexSyncProperties props) throws Exception {
        String url = props.getNatsUrl();

        boolean wantsOptions = notBlank(props.getNatsUser())
                || notBlank(props.getNatsPassword())
                || notBlank(props.getNatsToken())
                || notBlank(props.getNatsCreds())
                || props.isNatsTls();

        if (!wantsOptions) {
            Connection c = Nats.connect(url);
            log.info("Connected to NATS (url={})", url);
            return c;
        }

        Options.Builder builder = new Options.Builder().server(url);
        if (props.isNatsTls()) {
            builder.secure();
        }
        if (notBlank(props.getNatsToken())) {
            builder.token(props.getNatsToken().toCharArray());
        }
        if (notBlank(props.getNatsUser())) {
            String pass = props.getNatsPassword() == null ? "" : props.getNatsPassword();
            builder.userInfo(props.getNatsUser(), pass);
        }
        if (notBlank(props.getNatsCreds())) {
            builder.authHandler(Nats.credentials(props.getNatsCreds()));
        }

        Connection c = Nats.connect(builder.build());
        log.info("Connected to NATS (url={}, tls={}, user={}, creds={})",
                url,
                props.isNatsTls(),
                props.getNatsUser() == null ? "" : mask(props.getNatsUser()),
                props.getNatsCreds() == null ? "" : props.getNatsCreds());
        return c;
    }

    @Bean
    public JetStream jetStream(Connection connection) throws Exception {
        return connection.jetStream();
    }

    @Bean
    public JetStreamManagement jetStreamManagement(Connection connection) throws Exception {
        return connection.jetStreamManagement();
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }

    /**
     * Keeps the first and last character of an identifier for log correlation.
     */
    private static String mask(String s) {
        if (s.length() <= 2) {
            return "**";
        }
        return s.charAt(0) + "***" + s.charAt(s.length() - 1);
    }
}
