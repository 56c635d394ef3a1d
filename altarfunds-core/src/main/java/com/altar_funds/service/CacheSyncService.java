package com.altar_funds.service;

import com.altar_funds.api.AltarFundsApiClient;
import com.altar_funds.config.AltarFundsProperties;
import com.altar_funds.dto.CachedRead;
import com.altar_funds.exception.NetworkException;
import com.altar_funds.model.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Reads that keep working offline. A successful fetch supersedes the cached rows of its kind
 * wholesale; when the backend cannot be reached the last cached rows are served, marked stale.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CacheSyncService {

    public static final int DEFAULT_HISTORY_LIMIT = 50;

    private final AltarFundsApiClient apiClient;
    private final LocalCacheStore cacheStore;
    private final PreferenceStore preferences;
    private final AltarFundsProperties props;

    public Mono<CachedRead<GivingTransaction>> givingHistory(int limit) {
        return sync(CacheKind.TRANSACTION, CachedTransaction.class,
                apiClient.getGivingHistory(limit)
                        .map(list -> list.stream().map(CachedTransaction::from).toList()))
                .map(read -> new CachedRead<>(
                        read.items().stream().map(GivingTransaction::from).toList(),
                        read.stale()));
    }

    public Mono<CachedRead<CachedCategory>> categories() {
        return sync(CacheKind.CATEGORY, CachedCategory.class,
                apiClient.getCategories()
                        .map(list -> list.stream().map(CachedCategory::from).toList()));
    }

    /**
     * Metadata of the church selected on this device, falling back to the default church.
     */
    public Mono<CachedRead<CachedChurch>> church() {
        return preferences.getInt(PaymentSessionManager.CHURCH_ID_KEY, props.getPayment().getDefaultChurchId())
                .flatMap(churchId -> sync(CacheKind.CHURCH, CachedChurch.class,
                        apiClient.getChurch(churchId)
                                .map(church -> List.of(CachedChurch.from(church)))
                                .defaultIfEmpty(List.of())));
    }

    public Mono<CachedRead<CachedNotification>> notifications() {
        return sync(CacheKind.NOTIFICATION, CachedNotification.class,
                apiClient.getNotifications()
                        .map(list -> list.stream().map(CachedNotification::from).toList()));
    }

    private <T extends CachedEntity> Mono<CachedRead<T>> sync(CacheKind kind, Class<T> type, Mono<List<T>> remote) {
        return remote
                .flatMap(fresh -> cacheStore.replaceAll(kind, fresh)
                        .thenReturn(CachedRead.fromBackend(fresh)))
                .onErrorResume(NetworkException.class, err -> {
                    log.warn("Serving cached {} rows, backend unreachable: {}", kind, err.getMessage());
                    return cacheStore.getAll(kind, type)
                            .collectList()
                            .map(CachedRead::fromCache);
                });
    }
}
