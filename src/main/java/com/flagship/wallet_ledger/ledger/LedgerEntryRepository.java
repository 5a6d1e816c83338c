package com.flagship.wallet_ledger.ledger;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Read-side repository for ledger entries.
 */
@Repository
public interface LedgerEntryRepository extends JpaRepository<LedgerEntryEntity, UUID> {

    /**
     * Entries of a wallet, newest first.
     */
    List<LedgerEntryEntity> findByWalletIdOrderByCreatedAtDescIdDesc(UUID walletId, Pageable pageable);
}
