package com.altar_funds.model;

import com.altar_funds.api.dto.RemoteNotification;
import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("cached_notifications")
public class CachedNotification implements CachedEntity {

    @Id
    private String id;

    @Column("title")
    private String title;

    @Column("message")
    private String message;

    @Column("created_at")
    private String createdAt;

    @Column("is_read")
    private Boolean read;

    @With
    @Column("write_seq")
    private Long writeSeq;

    @Override
    public CacheKind kind() {
        return CacheKind.NOTIFICATION;
    }

    public static CachedNotification from(RemoteNotification remote) {
        return CachedNotification.builder()
                .id(remote.id())
                .title(remote.title())
                .message(remote.message())
                .createdAt(remote.createdAt())
                .read(Boolean.TRUE.equals(remote.read()))
                .build();
    }
}
