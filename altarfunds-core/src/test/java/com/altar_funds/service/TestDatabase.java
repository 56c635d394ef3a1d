package com.altar_funds.service;

import io.r2dbc.spi.ConnectionFactories;
import io.r2dbc.spi.ConnectionFactory;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.transaction.reactive.TransactionalOperator;

import java.util.UUID;

/**
 * A private in-memory H2 database per test, wired the way the application wires the cache.
 */
final class TestDatabase {

    final ConnectionFactory connectionFactory;
    final R2dbcEntityTemplate template;
    final TransactionalOperator tx;

    private TestDatabase() {
        this.connectionFactory = ConnectionFactories.get(
                "r2dbc:h2:mem:///cache-" + UUID.randomUUID() + "?options=DB_CLOSE_DELAY=-1");
        this.template = new R2dbcEntityTemplate(connectionFactory);
        this.tx = TransactionalOperator.create(new R2dbcTransactionManager(connectionFactory));
    }

    static TestDatabase create() {
        return new TestDatabase();
    }

    CacheSchemaManager schema(int version) {
        return new CacheSchemaManager(template.getDatabaseClient(), version);
    }

    LocalCacheStore store(CacheSchemaManager schema) {
        return new LocalCacheStore(template, tx, schema);
    }

    PreferenceStore preferences(CacheSchemaManager schema) {
        return new PreferenceStore(template.getDatabaseClient(), schema);
    }
}
