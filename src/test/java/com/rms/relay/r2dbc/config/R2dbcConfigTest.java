package com.rms.relay.r2dbc.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.springframework.r2dbc.core.DatabaseClient;

import com.rms.relay.config.RelayProperties;

import io.r2dbc.pool.ConnectionPool;

class R2dbcConfigTest {

    @Test
    void poolConnectsWithConfiguredCredentials() {
        RelayProperties.Database db = new RelayProperties.Database("ETL_PRMREC");
        db.setUrl("r2dbc:h2:mem:///pool-" + UUID.randomUUID() + "?options=DB_CLOSE_DELAY=-1");
        db.setUsername("sa");
        db.setPassword("");
        db.setPoolMaxSize(2);

        ConnectionPool pool = R2dbcConfig.pool("tracking", db);
        try {
            Integer one = DatabaseClient.create(pool).sql("SELECT 1 AS ONE")
                    .map((row, meta) -> row.get("ONE", Integer.class))
                    .one()
                    .block();

            assertThat(one).isEqualTo(1);
        } finally {
            pool.dispose();
        }
    }
}
