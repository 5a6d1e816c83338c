package com.flagship.wallet_ledger.api;

import com.flagship.wallet_ledger.api.dto.BalanceResponse;
import com.flagship.wallet_ledger.api.dto.ConsistencyResponse;
import com.flagship.wallet_ledger.api.dto.CreateTransactionRequest;
import com.flagship.wallet_ledger.api.dto.CreateWalletRequest;
import com.flagship.wallet_ledger.api.dto.TransactionResponse;
import com.flagship.wallet_ledger.api.dto.WalletResponse;
import com.flagship.wallet_ledger.reconciliation.ConsistencyChecker;
import com.flagship.wallet_ledger.transaction.ApplyTransactionCommand;
import com.flagship.wallet_ledger.transaction.TransactionEngine;
import com.flagship.wallet_ledger.transaction.TransactionResult;
import com.flagship.wallet_ledger.wallet.Wallet;
import com.flagship.wallet_ledger.wallet.WalletService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for wallets and their transactions.
 *
 * Transaction creation is idempotent on external_id: a resubmission returns the
 * original entry with 200 instead of 201 and changes nothing.
 *
 * Handlers must not be transactional: the engine commits each attempt itself.
 */
@RestController
@RequestMapping("/api/wallets")
@RequiredArgsConstructor
@Slf4j
public class WalletController {

    private final WalletService walletService;
    private final TransactionEngine transactionEngine;
    private final ConsistencyChecker consistencyChecker;

    @PostMapping
    public ResponseEntity<WalletResponse> createWallet(
            @Valid @RequestBody(required = false) CreateWalletRequest request) {
        CreateWalletRequest body = request != null ? request : new CreateWalletRequest();
        Wallet wallet = walletService.createWallet(body.getInitialBalance(), body.getCurrency());
        return ResponseEntity.status(HttpStatus.CREATED).body(WalletResponse.from(wallet));
    }

    @PostMapping("/transactions")
    public ResponseEntity<TransactionResponse> createTransaction(
            @Valid @RequestBody CreateTransactionRequest request) {

        log.info("Received transaction request: externalId={}, walletId={}, type={}, amount={}, currency={}",
                request.getExternalId(), request.getWalletId(), request.getType(),
                request.getAmount(), request.getCurrency());

        TransactionResult result = transactionEngine.apply(ApplyTransactionCommand.of(
            request.getExternalId(),
            request.getWalletId(),
            request.getType(),
            request.getAmount(),
            request.getCurrency(),
            request.getMetadata()
        ));

        HttpStatus status = result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(TransactionResponse.from(result.getEntry()));
    }

    @GetMapping("/{walletId}/balance")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable("walletId") UUID walletId) {
        return ResponseEntity.ok(BalanceResponse.from(walletService.getBalance(walletId)));
    }

    @GetMapping("/{walletId}/transactions")
    public ResponseEntity<List<TransactionResponse>> getTransactionHistory(
            @PathVariable("walletId") UUID walletId,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "" + WalletService.DEFAULT_PAGE_SIZE) int size) {
        List<TransactionResponse> entries = walletService.getTransactionHistory(walletId, page, size).stream()
            .map(TransactionResponse::from)
            .toList();
        return ResponseEntity.ok(entries);
    }

    @GetMapping("/{walletId}/consistency")
    public ResponseEntity<ConsistencyResponse> checkConsistency(@PathVariable("walletId") UUID walletId) {
        return ResponseEntity.ok(ConsistencyResponse.from(consistencyChecker.reconcile(walletId)));
    }
}
