package com.altar_funds.model;

/**
 * A row in one of the offline cache tables. {@code writeSeq} is assigned by the store on every
 * write and defines read order.
 */
public interface CachedEntity {

    String getId();

    Long getWriteSeq();

    CachedEntity withWriteSeq(Long writeSeq);

    CacheKind kind();
}
