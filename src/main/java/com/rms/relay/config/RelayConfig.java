package com.rms.relay.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.rms.relay.core.format.EventFormatter;

/**
 * Core beans that do not belong to a transport or a store.
 */
@Configuration
@EnableConfigurationProperties(RelayProperties.class)
public class RelayConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EventFormatter eventFormatter(RelayProperties props, Clock clock) {
        return new EventFormatter(props.getPublisher().getDataType(), clock);
    }
}
