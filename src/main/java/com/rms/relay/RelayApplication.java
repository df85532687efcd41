package com.rms.relay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.r2dbc.R2dbcDataAutoConfiguration;
import org.springframework.boot.autoconfigure.data.r2dbc.R2dbcRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.r2dbc.R2dbcAutoConfiguration;

/**
 * Transaction-log relay: polls the source table for new events, publishes them to JetStream and
 * advances a watermark in the tracking store.
 *
 * <p>Both databases are configured explicitly (see {@code R2dbcConfig}), so the single-datasource
 * R2DBC auto-configuration is excluded.</p>
 */
@SpringBootApplication(
        scanBasePackages = "com.rms.relay",
        exclude = {
                R2dbcAutoConfiguration.class,
                R2dbcDataAutoConfiguration.class,
                R2dbcRepositoriesAutoConfiguration.class
        })
public class RelayApplication {
    public static void main(String[] args) {
        SpringApplication.run(RelayApplication.class, args);
    }
}
