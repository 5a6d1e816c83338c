package com.flagship.wallet_ledger.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA read model for ledger entries, used for history queries.
 *
 * Entries are append-only, so the entity is immutable and has no setters.
 * Writes go through {@link LedgerStore}.
 */
@Entity
@Immutable
@Table(
    name = "ledger_entries",
    indexes = {
        @Index(name = "idx_ledger_entries_wallet_created", columnList = "wallet_id, created_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LedgerEntryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "external_id", nullable = false, unique = true)
    private String externalId;

    @Column(name = "wallet_id", nullable = false)
    private UUID walletId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TransactionKind kind;

    @Column(nullable = false, precision = 20, scale = 4)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "reference_amount", nullable = false, precision = 20, scale = 2)
    private BigDecimal referenceAmount;

    @Column(name = "applied_amount", nullable = false, precision = 20, scale = 2)
    private BigDecimal appliedAmount;

    @Column(columnDefinition = "TEXT")
    private String metadata;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public LedgerEntry toDomain(MetadataCodec metadataCodec) {
        return new LedgerEntry(
            id,
            externalId,
            walletId,
            kind,
            amount,
            currency,
            referenceAmount,
            appliedAmount,
            metadataCodec.read(metadata),
            createdAt
        );
    }
}
