package com.flagship.wallet_ledger.wallet;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA read model for the wallets table.
 *
 * Mapped as immutable: wallets are created and mutated through
 * {@link com.flagship.wallet_ledger.ledger.LedgerStore} only, where every balance
 * change is a version-checked compare-and-swap. Hibernate never writes this row.
 */
@Entity
@Immutable
@Table(name = "wallets")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WalletEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, precision = 20, scale = 2)
    private BigDecimal balance;

    @Column(name = "opening_balance", nullable = false, precision = 20, scale = 2)
    private BigDecimal openingBalance;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public Wallet toDomain() {
        return new Wallet(id, balance, openingBalance, currency, version, createdAt, updatedAt);
    }

    public WalletBalance toBalance() {
        return new WalletBalance(id, balance, currency, updatedAt);
    }
}
