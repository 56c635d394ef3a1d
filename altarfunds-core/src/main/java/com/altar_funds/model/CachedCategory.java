package com.altar_funds.model;

import com.altar_funds.api.dto.RemoteCategory;
import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("cached_categories")
public class CachedCategory implements CachedEntity {

    @Id
    private String id;

    @Column("name")
    private String name;

    @Column("description")
    private String description;

    @Column("is_active")
    private Boolean active;

    @With
    @Column("write_seq")
    private Long writeSeq;

    @Override
    public CacheKind kind() {
        return CacheKind.CATEGORY;
    }

    public static CachedCategory from(RemoteCategory remote) {
        return CachedCategory.builder()
                .id(remote.id())
                .name(remote.name())
                .description(remote.description())
                .active(remote.active() == null || remote.active())
                .build();
    }
}
