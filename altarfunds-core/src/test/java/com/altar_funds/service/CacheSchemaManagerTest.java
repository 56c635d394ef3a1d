package com.altar_funds.service;

import io.r2dbc.spi.Connection;
import io.r2dbc.spi.ConnectionFactory;
import io.r2dbc.spi.ConnectionFactoryMetadata;
import io.r2dbc.spi.R2dbcNonTransientResourceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.reactivestreams.Publisher;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicInteger;

@DisplayName("CacheSchemaManager")
class CacheSchemaManagerTest {

    private DatabaseClient db;

    @BeforeEach
    void setUp() {
        // the first connection attempt fails, as when the file database is briefly locked
        db = DatabaseClient.create(new FailingFirstConnectionFactory(TestDatabase.create().connectionFactory, 1));
    }

    @Test
    @DisplayName("a failed first migration is retried by the next caller")
    void migrationRecoversAfterFailure() {
        CacheSchemaManager schema = new CacheSchemaManager(db, 1);

        StepVerifier.create(schema.ready()).expectError().verify();
        StepVerifier.create(schema.ready()).verifyComplete();

        StepVerifier.create(db.sql("SELECT schema_version FROM cache_meta WHERE id = 1")
                        .map((row, meta) -> row.get(0, Integer.class))
                        .one())
                .expectNext(1)
                .verifyComplete();
    }

    @Test
    @DisplayName("preferences fall back to defaults while the database is unreachable and recover after")
    void preferencesSurviveFailedMigration() {
        PreferenceStore preferences = new PreferenceStore(db, new CacheSchemaManager(db, 1));

        StepVerifier.create(preferences.getInt("church_id", 1)).expectNext(1).verifyComplete();

        preferences.putInt("church_id", 5).block();

        StepVerifier.create(preferences.getInt("church_id", 1)).expectNext(5).verifyComplete();
        StepVerifier.create(preferences.getString("auth_token", "")).expectNext("").verifyComplete();
    }

    private static final class FailingFirstConnectionFactory implements ConnectionFactory {

        private final ConnectionFactory delegate;
        private final AtomicInteger failuresLeft;

        FailingFirstConnectionFactory(ConnectionFactory delegate, int failures) {
            this.delegate = delegate;
            this.failuresLeft = new AtomicInteger(failures);
        }

        @Override
        public Publisher<? extends Connection> create() {
            if (failuresLeft.getAndDecrement() > 0) {
                return Mono.<Connection>error(new R2dbcNonTransientResourceException("Database may be already in use"));
            }
            return delegate.create();
        }

        @Override
        public ConnectionFactoryMetadata getMetadata() {
            return delegate.getMetadata();
        }
    }
}
