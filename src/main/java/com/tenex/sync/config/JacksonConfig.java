package com.tenex.sync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenex.sync.core.parse.JsonContent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Central Jackson configuration.
 *
 * <h2>Used by</h2>
 * <ul>
 *   <li>the record wire codec (JetStream payloads)</li>
 *   <li>WebFlux JSON responses of the admin endpoints</li>
 * </ul>
 * The settings live in {@link JsonContent#newMapper()}, which also backs record content parsing.
 *
 * <p><b>Key settings</b></p>
 * <ul>
 *   <li>{@code JavaTimeModule}: support for {@code java.time.*} types.</li>
 *   <li>{@code WRITE_DATES_AS_TIMESTAMPS = false}: instants serialize as ISO-8601 strings.</li>
 *   <li>{@code FAIL_ON_UNKNOWN_PROPERTIES = false}: records written by newer clients still decode.</li>
 * </ul>
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return JsonContent.newMapper();
    }
}
