package com.altar_funds.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Items served from the backend, or from the offline cache when the backend could not be reached.
 */
public record CachedRead<T>(
        @JsonProperty("items") List<T> items,
        @JsonProperty("stale") boolean stale
) {
    public static <T> CachedRead<T> fromBackend(List<T> items) {
        return new CachedRead<>(List.copyOf(items), false);
    }

    public static <T> CachedRead<T> fromCache(List<T> items) {
        return new CachedRead<>(List.copyOf(items), true);
    }
}
