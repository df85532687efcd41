package com.rms.relay.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Central Jackson configuration.
 *
 * <h2>Purpose</h2>
 * <ul>
 *   <li>Serialize {@code java.time} values in envelopes and status responses as ISO-8601 strings.</li>
 *   <li>Provide the single {@link ObjectMapper} used for both the wire format and the admin API, so
 *       the two never disagree on how a timestamp looks.</li>
 * </ul>
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return relayObjectMapper();
    }

    /**
     * Same mapper outside a Spring context (tests, tools).
     */
    public static ObjectMapper relayObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
