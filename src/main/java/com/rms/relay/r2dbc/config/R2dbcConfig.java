package com.rms.relay.r2dbc.config;

import static io.r2dbc.spi.ConnectionFactoryOptions.PASSWORD;
import static io.r2dbc.spi.ConnectionFactoryOptions.USER;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;

import com.rms.relay.config.RelayProperties;

import io.r2dbc.pool.ConnectionPool;
import io.r2dbc.pool.ConnectionPoolConfiguration;
import io.r2dbc.spi.ConnectionFactories;
import io.r2dbc.spi.ConnectionFactoryOptions;

/**
 * Two independent R2DBC pools: the event source (read-only) and the tracking store.
 *
 * <h2>Why not auto-configuration</h2>
 * Boot configures one {@code spring.r2dbc} connection factory. The relay reads events from one
 * database and tracks progress in another, so each gets its own pool, {@link DatabaseClient} and
 * qualifier. The R2DBC auto-configurations are excluded on the application class.
 *
 * <h2>Lifecycle</h2>
 * Pools are disposed on context shutdown, after the dispatch scheduler and publisher (which
 * depend on them) have been destroyed.
 */
@Configuration
public class R2dbcConfig {

    private static final Logger log = LoggerFactory.getLogger(R2dbcConfig.class);

    public static final String SOURCE = "sourceDatabaseClient";
    public static final String TRACKING = "trackingDatabaseClient";

    @Bean(destroyMethod = "dispose")
    public ConnectionPool sourceConnectionPool(RelayProperties props) {
        return pool("source", props.getSource());
    }

    @Bean(destroyMethod = "dispose")
    public ConnectionPool trackingConnectionPool(RelayProperties props) {
        return pool("tracking", props.getTracking());
    }

    @Bean(SOURCE)
    public DatabaseClient sourceDatabaseClient(@Qualifier("sourceConnectionPool") ConnectionPool pool) {
        return DatabaseClient.create(pool);
    }

    @Bean(TRACKING)
    public DatabaseClient trackingDatabaseClient(@Qualifier("trackingConnectionPool") ConnectionPool pool) {
        return DatabaseClient.create(pool);
    }

    /** Groups the tracking store's run update and watermark update into one transaction. */
    @Bean
    public TransactionalOperator trackingTransactionalOperator(
            @Qualifier("trackingConnectionPool") ConnectionPool pool) {
        return TransactionalOperator.create(new R2dbcTransactionManager(pool));
    }

    static ConnectionPool pool(String name, RelayProperties.Database db) {
        ConnectionFactoryOptions.Builder options = ConnectionFactoryOptions.parse(db.getUrl()).mutate();
        if (db.getUsername() != null && !db.getUsername().isBlank()) {
            options.option(USER, db.getUsername());
        }
        if (db.getPassword() != null && !db.getPassword().isEmpty()) {
            options.option(PASSWORD, db.getPassword());
        }

        ConnectionPoolConfiguration config = ConnectionPoolConfiguration
                .builder(ConnectionFactories.get(options.build()))
                .name(name)
                .maxSize(db.getPoolMaxSize())
                .initialSize(1)
                .build();

        log.info("R2DBC pool '{}' (table={}, zone={}, maxSize={})",
                name, db.getTable(), db.getZoneId(), db.getPoolMaxSize());
        return new ConnectionPool(config);
    }
}
