package com.flagship.wallet_ledger.reconciliation;

import com.flagship.wallet_ledger.ledger.LedgerStore;
import com.flagship.wallet_ledger.observability.LedgerMetrics;
import com.flagship.wallet_ledger.wallet.Wallet;
import com.flagship.wallet_ledger.wallet.WalletNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Verifies a wallet's stored balance against the append-only ledger.
 *
 * The ledger total is aggregated in the database. Wallet row and aggregate are read
 * in one repeatable-read transaction so both come from the same snapshot.
 * Read-only: never repairs drift, only reports it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConsistencyChecker {

    static final BigDecimal TOLERANCE = new BigDecimal("0.01");

    private final LedgerStore ledgerStore;
    private final LedgerMetrics ledgerMetrics;

    /**
     * @return true if the stored balance matches the ledger within 0.01
     * @throws WalletNotFoundException if the wallet does not exist
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public boolean checkConsistency(UUID walletId) {
        return reconcile(walletId).isConsistent();
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public ReconciliationResult reconcile(UUID walletId) {
        Wallet wallet = ledgerStore.findWalletById(walletId)
            .orElseThrow(() -> new WalletNotFoundException(walletId));

        BigDecimal ledgerTotal = ledgerStore.sumAppliedAmountsForWallet(walletId);
        BigDecimal expectedBalance = wallet.getOpeningBalance().add(ledgerTotal);
        BigDecimal difference = wallet.getBalance().subtract(expectedBalance);
        boolean consistent = difference.abs().compareTo(TOLERANCE) < 0;

        ledgerMetrics.recordReconciliation(consistent);
        if (consistent) {
            log.debug("Wallet {} is consistent: balance={}", walletId, wallet.getBalance().toPlainString());
        } else {
            log.error("Balance inconsistency detected for wallet {}: stored={}, calculated={}, difference={}",
                    walletId, wallet.getBalance().toPlainString(), expectedBalance.toPlainString(),
                    difference.toPlainString());
        }

        return new ReconciliationResult(
            walletId,
            wallet.getBalance(),
            wallet.getOpeningBalance(),
            ledgerTotal,
            expectedBalance,
            difference,
            consistent
        );
    }
}
