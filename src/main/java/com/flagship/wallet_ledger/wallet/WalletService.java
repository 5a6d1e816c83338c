package com.flagship.wallet_ledger.wallet;

import com.flagship.wallet_ledger.currency.CurrencyNormalizer;
import com.flagship.wallet_ledger.ledger.LedgerEntry;
import com.flagship.wallet_ledger.ledger.LedgerEntryEntity;
import com.flagship.wallet_ledger.ledger.LedgerEntryRepository;
import com.flagship.wallet_ledger.ledger.LedgerStore;
import com.flagship.wallet_ledger.ledger.MetadataCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

/**
 * Wallet lifecycle and read-side queries.
 *
 * Creation goes through the ledger store; balance snapshots and history are read
 * through JPA in read-only transactions. Balances are only ever changed by the
 * transaction engine.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletService {

    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int MAX_PAGE_SIZE = 200;

    private final LedgerStore ledgerStore;
    private final WalletRepository walletRepository;
    private final LedgerEntryRepository ledgerEntryRepository;
    private final CurrencyNormalizer currencyNormalizer;
    private final MetadataCodec metadataCodec;

    /**
     * Creates a wallet with an opening balance.
     *
     * @param initialBalance opening balance, null means zero; rounded half-up to 2 places
     * @param currency display currency, null means the reference currency
     * @return the persisted wallet at version 0
     * @throws IllegalArgumentException if the initial balance is negative
     */
    public Wallet createWallet(BigDecimal initialBalance, String currency) {
        if (initialBalance != null && initialBalance.signum() < 0) {
            throw new IllegalArgumentException("Initial balance must be zero or positive");
        }
        BigDecimal opening = initialBalance == null
            ? BigDecimal.ZERO.setScale(CurrencyNormalizer.REFERENCE_SCALE)
            : initialBalance.setScale(CurrencyNormalizer.REFERENCE_SCALE, RoundingMode.HALF_UP);

        Wallet wallet = Wallet.open(
            UUID.randomUUID(),
            opening,
            currencyNormalizer.resolveCurrency(currency),
            Instant.now().truncatedTo(ChronoUnit.MICROS)
        );

        Wallet saved = ledgerStore.insertWallet(wallet);
        log.info("Wallet created: walletId={}, openingBalance={}, currency={}",
                saved.getId(), saved.getOpeningBalance().toPlainString(), saved.getCurrency());
        return saved;
    }

    @Transactional(readOnly = true)
    public WalletBalance getBalance(UUID walletId) {
        return walletRepository.findById(walletId)
            .map(WalletEntity::toBalance)
            .orElseThrow(() -> new WalletNotFoundException(walletId));
    }

    /**
     * Entries of a wallet, newest first.
     *
     * @param page zero-based page index
     * @param size page size, capped at {@value #MAX_PAGE_SIZE}
     */
    @Transactional(readOnly = true)
    public List<LedgerEntry> getTransactionHistory(UUID walletId, int page, int size) {
        if (page < 0) {
            throw new IllegalArgumentException("Page index must not be negative");
        }
        if (size < 1) {
            throw new IllegalArgumentException("Page size must be at least 1");
        }
        if (!walletRepository.existsById(walletId)) {
            throw new WalletNotFoundException(walletId);
        }

        int pageSize = Math.min(size, MAX_PAGE_SIZE);
        List<LedgerEntryEntity> entries = ledgerEntryRepository
            .findByWalletIdOrderByCreatedAtDescIdDesc(walletId, PageRequest.of(page, pageSize));

        return entries.stream()
            .map(entity -> entity.toDomain(metadataCodec))
            .toList();
    }
}
