package com.altar_funds.service;

import com.altar_funds.config.AltarFundsProperties;
import com.altar_funds.model.CacheKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Owns the offline cache schema. The schema is versioned in {@code cache_meta}; when the stored
 * version differs from the configured one, every cache table is dropped and recreated and the
 * cached rows are lost. Preferences are kept across versions.
 */
@Service
@Slf4j
public class CacheSchemaManager {

    private static final List<String> CACHE_TABLES = List.of(
            """
            CREATE TABLE IF NOT EXISTS cached_transactions (
                id            VARCHAR(64) PRIMARY KEY,
                category_name VARCHAR(255),
                amount        DECIMAL(19, 2),
                txn_date      VARCHAR(64),
                status        VARCHAR(16) NOT NULL,
                write_seq     BIGINT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS cached_categories (
                id          VARCHAR(64) PRIMARY KEY,
                name        VARCHAR(255),
                description VARCHAR(1024),
                is_active   BOOLEAN,
                write_seq   BIGINT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS cached_churches (
                id        VARCHAR(64) PRIMARY KEY,
                name      VARCHAR(255),
                city      VARCHAR(255),
                logo_url  VARCHAR(1024),
                write_seq BIGINT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS cached_notifications (
                id         VARCHAR(64) PRIMARY KEY,
                title      VARCHAR(255),
                message    VARCHAR(4096),
                created_at VARCHAR(64),
                is_read    BOOLEAN,
                write_seq  BIGINT NOT NULL
            )
            """
    );

    private static final List<String> SUPPORT_TABLES = List.of(
            "CREATE TABLE IF NOT EXISTS cache_meta (id INT PRIMARY KEY, schema_version INT NOT NULL)",
            "CREATE TABLE IF NOT EXISTS preferences (pref_key VARCHAR(128) PRIMARY KEY, pref_value VARCHAR(4096))",
            "CREATE SEQUENCE IF NOT EXISTS cache_write_seq"
    );

    private static final Duration FOREVER = Duration.ofMillis(Long.MAX_VALUE);

    private final DatabaseClient db;
    private final int schemaVersion;
    private final Mono<Void> ready;

    @Autowired
    public CacheSchemaManager(DatabaseClient db, AltarFundsProperties props) {
        this(db, props.getCache().getSchemaVersion());
    }

    CacheSchemaManager(DatabaseClient db, int schemaVersion) {
        this.db = db;
        this.schemaVersion = schemaVersion;
        // a failed migration is not remembered, the next caller tries again
        this.ready = Mono.defer(this::migrate)
                .cache(ok -> FOREVER, err -> Duration.ZERO, () -> FOREVER);
    }

    /**
     * Completes once the schema is usable. The migration runs on first subscription and is retried
     * by later subscribers until it succeeds once.
     */
    public Mono<Void> ready() {
        return ready;
    }

    Mono<Void> migrate() {
        return execute(SUPPORT_TABLES)
                .then(storedVersion().map(Optional::of).defaultIfEmpty(Optional.empty()))
                .flatMap(stored -> {
                    if (stored.isEmpty()) {
                        log.info("Creating offline cache schema version {}", schemaVersion);
                        return execute(CACHE_TABLES).then(writeVersion());
                    }
                    if (stored.get() == schemaVersion) {
                        return execute(CACHE_TABLES);
                    }
                    log.warn("Cache schema version changed from {} to {}, discarding cached data",
                            stored.get(), schemaVersion);
                    return dropCacheTables()
                            .then(execute(CACHE_TABLES))
                            .then(writeVersion());
                });
    }

    private Mono<Integer> storedVersion() {
        return db.sql("SELECT schema_version FROM cache_meta WHERE id = 1")
                .map((row, meta) -> row.get(0, Integer.class))
                .one();
    }

    private Mono<Void> writeVersion() {
        return db.sql("MERGE INTO cache_meta (id, schema_version) KEY (id) VALUES (1, :version)")
                .bind("version", schemaVersion)
                .then();
    }

    private Mono<Void> dropCacheTables() {
        return execute(Arrays.stream(CacheKind.values())
                .map(kind -> "DROP TABLE IF EXISTS " + kind.table())
                .toList());
    }

    private Mono<Void> execute(List<String> statements) {
        return Flux.fromIterable(statements)
                .concatMap(sql -> db.sql(sql).then())
                .then();
    }
}
