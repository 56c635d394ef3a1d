package com.altar_funds.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Small key-value store for device settings such as the selected church and the session token.
 * Reads never fail: a missing, malformed or unreadable value yields the caller's default.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PreferenceStore {

    private final DatabaseClient db;
    private final CacheSchemaManager schema;

    public Mono<String> getString(String key, String defaultValue) {
        return read(key)
                .defaultIfEmpty(defaultValue)
                .onErrorResume(err -> fallback(key, defaultValue, err));
    }

    public Mono<Integer> getInt(String key, int defaultValue) {
        return read(key)
                .map(raw -> {
                    try {
                        return Integer.parseInt(raw.trim());
                    } catch (NumberFormatException e) {
                        log.warn("Preference {} holds non-numeric value '{}', using {}", key, raw, defaultValue);
                        return defaultValue;
                    }
                })
                .defaultIfEmpty(defaultValue)
                .onErrorResume(err -> fallback(key, defaultValue, err));
    }

    public Mono<Void> putString(String key, String value) {
        if (value == null) {
            return remove(key);
        }
        return schema.ready()
                .then(db.sql("MERGE INTO preferences (pref_key, pref_value) KEY (pref_key) VALUES (:key, :value)")
                        .bind("key", key)
                        .bind("value", value)
                        .then());
    }

    public Mono<Void> putInt(String key, int value) {
        return putString(key, Integer.toString(value));
    }

    public Mono<Void> remove(String key) {
        return schema.ready()
                .then(db.sql("DELETE FROM preferences WHERE pref_key = :key")
                        .bind("key", key)
                        .then());
    }

    private static <T> Mono<T> fallback(String key, T defaultValue, Throwable err) {
        log.warn("Preference {} unreadable, using {}: {}", key, defaultValue, err.getMessage());
        return Mono.just(defaultValue);
    }

    private Mono<String> read(String key) {
        return schema.ready()
                .then(db.sql("SELECT pref_value FROM preferences WHERE pref_key = :key")
                        .bind("key", key)
                        .map((row, meta) -> row.get(0, String.class))
                        .one());
    }
}
