package com.altar_funds.model;

public enum CacheKind {
    TRANSACTION("cached_transactions", CachedTransaction.class),
    CATEGORY("cached_categories", CachedCategory.class),
    CHURCH("cached_churches", CachedChurch.class),
    NOTIFICATION("cached_notifications", CachedNotification.class);

    private final String table;
    private final Class<? extends CachedEntity> entityType;

    CacheKind(String table, Class<? extends CachedEntity> entityType) {
        this.table = table;
        this.entityType = entityType;
    }

    public String table() {
        return table;
    }

    public Class<? extends CachedEntity> entityType() {
        return entityType;
    }
}
