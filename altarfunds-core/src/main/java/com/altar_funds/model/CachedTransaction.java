package com.altar_funds.model;

import com.altar_funds.api.dto.RemoteTransaction;
import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("cached_transactions")
public class CachedTransaction implements CachedEntity {

    @Id
    private String id;

    @Column("category_name")
    private String categoryName;

    @Column("amount")
    private BigDecimal amount;

    @Column("txn_date")
    private String date; // raw backend value

    @Column("status")
    private String status; // TransactionStatus name

    @With
    @Column("write_seq")
    private Long writeSeq;

    @Override
    public CacheKind kind() {
        return CacheKind.TRANSACTION;
    }

    public static CachedTransaction from(GivingTransaction txn) {
        return CachedTransaction.builder()
                .id(txn.id())
                .categoryName(txn.categoryName())
                .amount(txn.amount())
                .date(txn.date())
                .status(txn.status().name())
                .build();
    }

    public static CachedTransaction from(RemoteTransaction remote) {
        return from(GivingTransaction.from(remote));
    }
}
