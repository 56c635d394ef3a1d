package com.altar_funds.service;

import com.altar_funds.model.CacheKind;
import com.altar_funds.model.CachedEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.relational.core.query.Query;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.springframework.data.relational.core.query.Criteria.where;
import static org.springframework.data.relational.core.query.Query.query;

/**
 * Offline replica of backend data, one table per {@link CacheKind}. Writes are last-write-wins by
 * id; reads return rows in the order they were last written.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LocalCacheStore {

    private final R2dbcEntityTemplate template;
    private final TransactionalOperator tx;
    private final CacheSchemaManager schema;

    /**
     * Stores {@code entity}, replacing every column of any existing row with the same id.
     */
    public Mono<Void> put(CachedEntity entity) {
        return schema.ready()
                .then(write(entity))
                .as(tx::transactional)
                .then();
    }

    /**
     * Atomically discards every cached row of {@code kind} and stores {@code entities} in order.
     */
    public Mono<Void> replaceAll(CacheKind kind, List<? extends CachedEntity> entities) {
        for (CachedEntity entity : entities) {
            if (entity.kind() != kind) {
                return Mono.error(new IllegalArgumentException(
                        "Cannot store " + entity.kind() + " entity " + entity.getId() + " as " + kind));
            }
        }
        return schema.ready()
                .then(template.delete(Query.empty(), kind.entityType()))
                .thenMany(Flux.fromIterable(entities).concatMap(this::write))
                .then()
                .as(tx::transactional)
                .doOnSuccess(done -> log.debug("Replaced cached {} rows with {} entries", kind, entities.size()));
    }

    public Flux<CachedEntity> getAll(CacheKind kind) {
        return schema.ready()
                .thenMany(template.select(Query.empty().sort(Sort.by("writeSeq")), kind.entityType()))
                .cast(CachedEntity.class);
    }

    public <T extends CachedEntity> Flux<T> getAll(CacheKind kind, Class<T> type) {
        if (!type.equals(kind.entityType())) {
            return Flux.error(new IllegalArgumentException(kind + " rows are not " + type.getSimpleName()));
        }
        return getAll(kind).cast(type);
    }

    private Mono<CachedEntity> write(CachedEntity entity) {
        Class<? extends CachedEntity> type = entity.getClass();
        return nextWriteSeq()
                .map(entity::withWriteSeq)
                .flatMap(stamped -> template.exists(query(where("id").is(stamped.getId())), type)
                        // the id is assigned by the backend, so insert and update must be chosen explicitly
                        .flatMap(exists -> exists ? template.update(stamped) : template.insert(stamped)));
    }

    private Mono<Long> nextWriteSeq() {
        return template.getDatabaseClient()
                .sql("SELECT NEXT VALUE FOR cache_write_seq")
                .map((row, meta) -> row.get(0, Long.class))
                .one();
    }
}
