package com.flagship.wallet_ledger.wallet;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Read-side repository for wallets.
 */
@Repository
public interface WalletRepository extends JpaRepository<WalletEntity, UUID> {
}
