package com.flagship.wallet_ledger.reconciliation;

import com.flagship.wallet_ledger.ledger.InMemoryLedgerStore;
import com.flagship.wallet_ledger.ledger.LedgerEntry;
import com.flagship.wallet_ledger.ledger.TransactionKind;
import com.flagship.wallet_ledger.observability.LedgerMetrics;
import com.flagship.wallet_ledger.wallet.Wallet;
import com.flagship.wallet_ledger.wallet.WalletNotFoundException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ConsistencyCheckerTest {

    private InMemoryLedgerStore ledgerStore;
    private SimpleMeterRegistry meterRegistry;
    private ConsistencyChecker checker;
    private Wallet wallet;

    @BeforeEach
    void setUp() {
        ledgerStore = new InMemoryLedgerStore();
        meterRegistry = new SimpleMeterRegistry();
        checker = new ConsistencyChecker(ledgerStore, new LedgerMetrics(meterRegistry));
        wallet = ledgerStore.insertWallet(
            Wallet.open(UUID.randomUUID(), new BigDecimal("100.00"), "EGP", Instant.now()));
    }

    private void apply(String externalId, TransactionKind kind, String referenceAmount) {
        Wallet current = ledgerStore.findWalletById(wallet.getId()).orElseThrow();
        LedgerEntry entry = LedgerEntry.create(externalId, current.getId(), kind, new BigDecimal(referenceAmount),
            "EGP", new BigDecimal(referenceAmount), null, Instant.now());
        ledgerStore.insertEntryAndUpdateWalletAtomic(entry,
            current.withBalance(current.getBalance().add(entry.getAppliedAmount()), Instant.now()),
            current.getVersion());
    }

    @Test
    @DisplayName("A fresh wallet matches its opening balance")
    void freshWalletIsConsistent() {
        ReconciliationResult result = checker.reconcile(wallet.getId());

        assertTrue(result.isConsistent());
        assertEquals(0, result.getLedgerTotal().signum());
        assertEquals(new BigDecimal("100.00"), result.getExpectedBalance());
    }

    @Test
    @DisplayName("Opening balance plus applied entries equals the stored balance")
    void appliedEntriesAreConsistent() {
        apply("a", TransactionKind.DEPOSIT, "49.00");
        apply("b", TransactionKind.WITHDRAWAL, "30.50");
        apply("c", TransactionKind.DEPOSIT, "0.01");

        ReconciliationResult result = checker.reconcile(wallet.getId());

        assertTrue(checker.checkConsistency(wallet.getId()));
        assertEquals(new BigDecimal("118.51"), result.getStoredBalance());
        assertEquals(new BigDecimal("18.51"), result.getLedgerTotal());
        assertEquals(0, result.getDifference().signum());
    }

    @Test
    @DisplayName("A balance changed without an entry is reported as drift")
    void driftIsDetected() {
        apply("a", TransactionKind.DEPOSIT, "10.00");
        ledgerStore.corruptBalance(wallet.getId(), new BigDecimal("150.00"));

        ReconciliationResult result = checker.reconcile(wallet.getId());

        assertFalse(result.isConsistent());
        assertEquals(new BigDecimal("110.00"), result.getExpectedBalance());
        assertEquals(new BigDecimal("40.00"), result.getDifference());
        assertEquals(1.0, meterRegistry.get("ledger.reconciliation").tag("result", "drift").counter().count());
    }

    @Test
    @DisplayName("Differences below one cent are tolerated, one cent is not")
    void toleranceBoundary() {
        ledgerStore.corruptBalance(wallet.getId(), new BigDecimal("100.009"));
        assertTrue(checker.checkConsistency(wallet.getId()));

        ledgerStore.corruptBalance(wallet.getId(), new BigDecimal("99.99"));
        assertFalse(checker.checkConsistency(wallet.getId()));
    }

    @Test
    void unknownWalletIsRejected() {
        assertThrows(WalletNotFoundException.class, () -> checker.checkConsistency(UUID.randomUUID()));
    }
}
