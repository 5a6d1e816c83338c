package com.flagship.wallet_ledger.transaction;

import com.flagship.wallet_ledger.common.exception.WalletLedgerException;
import com.flagship.wallet_ledger.currency.CurrencyNormalizer;
import com.flagship.wallet_ledger.ledger.DuplicateExternalIdException;
import com.flagship.wallet_ledger.ledger.LedgerEntry;
import com.flagship.wallet_ledger.ledger.LedgerStore;
import com.flagship.wallet_ledger.ledger.OptimisticConflictException;
import com.flagship.wallet_ledger.observability.CorrelationContext;
import com.flagship.wallet_ledger.observability.LedgerMetrics;
import com.flagship.wallet_ledger.wallet.Wallet;
import com.flagship.wallet_ledger.wallet.WalletNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies deposits and withdrawals to wallet balances exactly once.
 *
 * For each request:
 * 1. Resolve idempotency: an existing entry for the external id is returned unchanged
 * 2. Load the wallet, normalize the amount to the reference currency, compute the
 *    prospective balance and reject it if negative
 * 3. Insert the entry and compare-and-swap the wallet row in one atomic store call
 * 4. On a version conflict, discard the attempt, back off and retry from step 2 with
 *    a fresh wallet, up to the configured number of attempts
 *
 * The engine holds no locks and keeps no state between calls; it is safe to call from
 * any number of threads against the same wallet. It must not run inside an outer
 * transaction, since every attempt commits or rolls back on its own.
 */
@Service
@Slf4j
public class TransactionEngine {

    // wallets.balance is NUMERIC(20, 2)
    private static final int MAX_BALANCE_INTEGER_DIGITS = 18;

    private final LedgerStore ledgerStore;
    private final CurrencyNormalizer currencyNormalizer;
    private final RetryPolicy retryPolicy;
    private final BackoffSleeper backoffSleeper;
    private final Optional<IdempotencyCache> idempotencyCache;
    private final LedgerMetrics ledgerMetrics;

    public TransactionEngine(LedgerStore ledgerStore,
                             CurrencyNormalizer currencyNormalizer,
                             RetryPolicy retryPolicy,
                             BackoffSleeper backoffSleeper,
                             Optional<IdempotencyCache> idempotencyCache,
                             LedgerMetrics ledgerMetrics) {
        this.ledgerStore = ledgerStore;
        this.currencyNormalizer = currencyNormalizer;
        this.retryPolicy = retryPolicy;
        this.backoffSleeper = backoffSleeper;
        this.idempotencyCache = idempotencyCache;
        this.ledgerMetrics = ledgerMetrics;
    }

    /**
     * Applies a transaction and returns the stored entry.
     *
     * @throws WalletNotFoundException if the wallet does not exist
     * @throws com.flagship.wallet_ledger.currency.UnsupportedCurrencyException if the currency has no rate
     * @throws InsufficientFundsException if the balance would become negative
     * @throws AmountOutOfRangeException if the converted amount rounds to zero or the balance would overflow
     * @throws ConcurrencyExhaustedException if every attempt lost its version check
     */
    public LedgerEntry applyTransaction(ApplyTransactionCommand command) {
        return apply(command).getEntry();
    }

    /**
     * Same as {@link #applyTransaction} but also reports whether the entry already existed.
     */
    public TransactionResult apply(ApplyTransactionCommand command) {
        Objects.requireNonNull(command, "Transaction command cannot be null");
        long startTime = System.currentTimeMillis();

        MDC.put(CorrelationContext.WALLET_ID_MDC_KEY, command.getWalletId().toString());
        MDC.put(CorrelationContext.EXTERNAL_ID_MDC_KEY, command.getExternalId());
        try {
            Optional<LedgerEntry> existing = findExisting(command.getExternalId());
            if (existing.isPresent()) {
                ledgerMetrics.recordIdempotencyHit();
                logReplay(command, existing.get());
                return TransactionResult.replayed(existing.get());
            }
            ledgerMetrics.recordIdempotencyMiss();

            TransactionResult result = applyWithRetry(command);

            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordTransactionDuration(duration);
            return result;

        } catch (WalletLedgerException e) {
            ledgerMetrics.recordTransactionRejected(e.getErrorCode());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.WALLET_ID_MDC_KEY);
            MDC.remove(CorrelationContext.EXTERNAL_ID_MDC_KEY);
        }
    }

    private TransactionResult applyWithRetry(ApplyTransactionCommand command) {
        int maxAttempts = retryPolicy.getMaxAttempts();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                // The writer that beat us may have been a duplicate of this request
                Optional<LedgerEntry> winner = ledgerStore.findEntryByExternalId(command.getExternalId());
                if (winner.isPresent()) {
                    ledgerMetrics.recordIdempotencyRace();
                    logReplay(command, winner.get());
                    return TransactionResult.replayed(winner.get());
                }
            }

            try {
                LedgerEntry entry = attemptOnce(command);
                idempotencyCache.ifPresent(cache -> cache.remember(entry.getExternalId(), entry.getId()));
                ledgerMetrics.recordTransactionApplied(entry.getKind().name(), entry.getCurrency());
                log.info("Transaction applied: {} {} {} ({} {}), entryId={}, attempt={}",
                        entry.getKind(), entry.getAmount().toPlainString(), entry.getCurrency(),
                        entry.getReferenceAmount().toPlainString(), currencyNormalizer.getReferenceCurrency(),
                        entry.getId(), attempt);
                return TransactionResult.created(entry);

            } catch (OptimisticConflictException e) {
                ledgerMetrics.recordOptimisticConflict();
                if (attempt == maxAttempts) {
                    break;
                }
                Duration delay = retryPolicy.backoffAfter(attempt);
                log.warn("Optimistic lock conflict on attempt {}/{}, retrying in {}ms",
                        attempt, maxAttempts, delay.toMillis());
                pause(command, attempt, delay);

            } catch (DuplicateExternalIdException e) {
                ledgerMetrics.recordIdempotencyRace();
                LedgerEntry winner = ledgerStore.findEntryByExternalId(command.getExternalId())
                    .orElseThrow(() -> new IllegalStateException(
                        "Unique violation on external id " + command.getExternalId()
                            + " but no entry could be read back", e));
                logReplay(command, winner);
                return TransactionResult.replayed(winner);
            }
        }

        ledgerMetrics.recordRetryExhausted();
        log.error("Transaction failed after {} attempts due to concurrent updates", maxAttempts);
        throw new ConcurrencyExhaustedException(command.getExternalId(), command.getWalletId(), maxAttempts);
    }

    /**
     * One optimistic attempt. Reads the latest wallet state every time, so the
     * funds check never uses a balance from before a conflict.
     */
    private LedgerEntry attemptOnce(ApplyTransactionCommand command) {
        Wallet wallet = ledgerStore.findWalletById(command.getWalletId())
            .orElseThrow(() -> new WalletNotFoundException(command.getWalletId()));

        String currency = currencyNormalizer.resolveCurrency(command.getCurrency());
        BigDecimal referenceAmount = currencyNormalizer.normalize(command.getAmount(), currency);
        if (referenceAmount.signum() == 0) {
            throw new AmountOutOfRangeException(wallet.getId(), command.getAmount(), currency, referenceAmount,
                "converts to zero in " + currencyNormalizer.getReferenceCurrency());
        }
        BigDecimal appliedAmount = command.getKind().signed(referenceAmount);
        BigDecimal prospectiveBalance = wallet.getBalance().add(appliedAmount);
        if (prospectiveBalance.precision() - prospectiveBalance.scale() > MAX_BALANCE_INTEGER_DIGITS) {
            throw new AmountOutOfRangeException(wallet.getId(), command.getAmount(), currency, referenceAmount,
                "resulting balance exceeds " + MAX_BALANCE_INTEGER_DIGITS + " integer digits");
        }

        if (prospectiveBalance.signum() < 0) {
            log.warn("Insufficient funds: balance={}, requested={}",
                    wallet.getBalance().toPlainString(), referenceAmount.toPlainString());
            throw new InsufficientFundsException(wallet.getId(), wallet.getBalance(), referenceAmount);
        }

        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        LedgerEntry entry = LedgerEntry.create(
            command.getExternalId(),
            wallet.getId(),
            command.getKind(),
            command.getAmount(),
            currency,
            referenceAmount,
            command.getMetadata(),
            now
        );

        ledgerStore.insertEntryAndUpdateWalletAtomic(entry, wallet.withBalance(prospectiveBalance, now),
                wallet.getVersion());
        return entry;
    }

    private Optional<LedgerEntry> findExisting(String externalId) {
        if (idempotencyCache.isPresent()) {
            Optional<UUID> cachedId = idempotencyCache.get().lookup(externalId);
            if (cachedId.isPresent()) {
                Optional<LedgerEntry> cached = ledgerStore.findEntryById(cachedId.get());
                if (cached.isPresent()) {
                    return cached;
                }
                log.warn("Cached idempotency key points at a missing entry, evicting: {}", externalId);
                idempotencyCache.get().evict(externalId);
            }
        }
        Optional<LedgerEntry> stored = ledgerStore.findEntryByExternalId(externalId);
        stored.ifPresent(entry -> idempotencyCache.ifPresent(cache -> cache.remember(externalId, entry.getId())));
        return stored;
    }

    private void pause(ApplyTransactionCommand command, int attempt, Duration delay) {
        try {
            backoffSleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrencyExhaustedException(command.getExternalId(), command.getWalletId(), attempt, e);
        }
    }

    private void logReplay(ApplyTransactionCommand command, LedgerEntry entry) {
        if (!entry.getWalletId().equals(command.getWalletId())) {
            log.warn("External id reused for a different wallet, returning original entry: entryWallet={}",
                    entry.getWalletId());
        }
        log.info("Transaction already applied, returning existing entry: entryId={}", entry.getId());
    }
}
