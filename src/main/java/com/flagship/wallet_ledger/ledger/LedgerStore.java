package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.wallet.Wallet;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable storage for wallets and ledger entries.
 *
 * Implementations must guarantee:
 * 1. The entry insert and the wallet update in
 *    {@link #insertEntryAndUpdateWalletAtomic} commit together or not at all
 * 2. {@code externalId} is unique across all entries
 * 3. A wallet update only succeeds when the stored version still equals the expected one
 */
public interface LedgerStore {

    Optional<LedgerEntry> findEntryByExternalId(String externalId);

    Optional<LedgerEntry> findEntryById(UUID entryId);

    Optional<Wallet> findWalletById(UUID walletId);

    /**
     * Appends an entry and compare-and-swaps the wallet row in one atomic unit.
     *
     * @param entry the new ledger entry
     * @param updatedWallet wallet state to write, with its version already advanced
     * @param expectedVersion version read when the wallet was loaded
     * @throws OptimisticConflictException if the wallet version changed since it was loaded
     * @throws DuplicateExternalIdException if an entry with the same external id already exists
     */
    void insertEntryAndUpdateWalletAtomic(LedgerEntry entry, Wallet updatedWallet, long expectedVersion);

    /**
     * Sum of {@code appliedAmount} over all entries of the wallet, zero if there are none.
     */
    BigDecimal sumAppliedAmountsForWallet(UUID walletId);

    Wallet insertWallet(Wallet wallet);
}
