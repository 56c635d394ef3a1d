package com.altar_funds.service;

import com.altar_funds.api.AltarFundsApiClient;
import com.altar_funds.api.dto.RemoteCategory;
import com.altar_funds.api.dto.RemoteChurch;
import com.altar_funds.api.dto.RemoteTransaction;
import com.altar_funds.config.AltarFundsProperties;
import com.altar_funds.dto.CachedRead;
import com.altar_funds.exception.NetworkException;
import com.altar_funds.model.CachedCategory;
import com.altar_funds.model.CachedChurch;
import com.altar_funds.model.GivingTransaction;
import com.altar_funds.model.TransactionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CacheSyncService")
class CacheSyncServiceTest {

    @Mock
    private AltarFundsApiClient apiClient;

    private PreferenceStore preferences;
    private CacheSyncService sync;

    @BeforeEach
    void setUp() {
        TestDatabase database = TestDatabase.create();
        CacheSchemaManager schema = database.schema(1);
        preferences = database.preferences(schema);
        AltarFundsProperties props = new AltarFundsProperties();
        props.setBaseUrl("http://backend.test/api");
        sync = new CacheSyncService(apiClient, database.store(schema), preferences, props);
    }

    @Test
    @DisplayName("a successful fetch is served fresh and replaces the cache")
    void freshHistoryReplacesCache() {
        when(apiClient.getGivingHistory(50)).thenReturn(
                Mono.just(List.of(remote("t1", "completed"), remote("t2", "pending"))),
                Mono.just(List.of(remote("t3", "failed"))),
                Mono.error(new NetworkException("Giving history fetch failed: timeout")));

        CachedRead<GivingTransaction> first = sync.givingHistory(50).block();
        assertThat(first.stale()).isFalse();
        assertThat(first.items()).extracting(GivingTransaction::id).containsExactly("t1", "t2");

        sync.givingHistory(50).block();
        CachedRead<GivingTransaction> offline = sync.givingHistory(50).block();

        assertThat(offline.stale()).isTrue();
        assertThat(offline.items()).singleElement().satisfies(tx -> {
            assertThat(tx.id()).isEqualTo("t3");
            assertThat(tx.status()).isEqualTo(TransactionStatus.FAILED);
            assertThat(tx.amount()).isEqualByComparingTo("250");
        });
    }

    @Test
    @DisplayName("an unreachable backend with an empty cache yields an empty stale read")
    void offlineWithNothingCached() {
        when(apiClient.getCategories()).thenReturn(Mono.error(new NetworkException("Category fetch failed")));

        CachedRead<CachedCategory> read = sync.categories().block();

        assertThat(read.stale()).isTrue();
        assertThat(read.items()).isEmpty();
    }

    @Test
    @DisplayName("categories survive going offline")
    void categoriesOffline() {
        when(apiClient.getCategories()).thenReturn(
                Mono.just(List.of(new RemoteCategory("1", "Tithe", "Ten percent", null))),
                Mono.error(new NetworkException("Category fetch failed")));

        sync.categories().block();
        CachedRead<CachedCategory> read = sync.categories().block();

        assertThat(read.stale()).isTrue();
        assertThat(read.items()).singleElement().satisfies(category -> {
            assertThat(category.getName()).isEqualTo("Tithe");
            assertThat(category.getActive()).isTrue();
        });
    }

    @Test
    @DisplayName("the church fetched is the one stored on the device")
    void churchFromPreferences() {
        preferences.putInt("church_id", 4).block();
        when(apiClient.getChurch(4)).thenReturn(Mono.just(new RemoteChurch("4", "All Saints", "Nairobi", null)));

        CachedRead<CachedChurch> read = sync.church().block();

        assertThat(read.stale()).isFalse();
        assertThat(read.items()).extracting(CachedChurch::getName).containsExactly("All Saints");
    }

    @Test
    @DisplayName("errors other than network failures are not masked by the cache")
    void otherErrorsPropagate() {
        when(apiClient.getNotifications()).thenReturn(Mono.error(new IllegalStateException("bug")));

        assertThatThrownBy(() -> sync.notifications().block())
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("bug");
    }

    private static RemoteTransaction remote(String id, String status) {
        return new RemoteTransaction(id, "Tithe", new BigDecimal("250"), "2024-03-01", status, "mpesa");
    }
}
