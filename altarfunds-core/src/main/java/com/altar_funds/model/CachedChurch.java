package com.altar_funds.model;

import com.altar_funds.api.dto.RemoteChurch;
import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("cached_churches")
public class CachedChurch implements CachedEntity {

    @Id
    private String id;

    @Column("name")
    private String name;

    @Column("city")
    private String city;

    @Column("logo_url")
    private String logoUrl;

    @With
    @Column("write_seq")
    private Long writeSeq;

    @Override
    public CacheKind kind() {
        return CacheKind.CHURCH;
    }

    public static CachedChurch from(RemoteChurch remote) {
        return CachedChurch.builder()
                .id(remote.id())
                .name(remote.name())
                .city(remote.city())
                .logoUrl(remote.logoUrl())
                .build();
    }
}
