package com.flagship.wallet_ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wallet_ledger.ledger.LedgerEntry;
import com.flagship.wallet_ledger.reconciliation.ConsistencyChecker;
import com.flagship.wallet_ledger.transaction.ApplyTransactionCommand;
import com.flagship.wallet_ledger.transaction.InsufficientFundsException;
import com.flagship.wallet_ledger.transaction.TransactionEngine;
import com.flagship.wallet_ledger.transaction.TransactionResult;
import com.flagship.wallet_ledger.wallet.Wallet;
import com.flagship.wallet_ledger.wallet.WalletService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end tests against PostgreSQL: try to break the wallet ledger.
 *
 * These tests verify:
 * - Conversion, idempotent replay and error mapping through the HTTP API
 * - Concurrent writers never lose an update or overdraw a wallet
 * - Stored balances always reconcile with the ledger
 */
@SpringBootTest(properties = {
    "ledger.transaction.max-attempts=25",
    "ledger.transaction.initial-backoff-ms=1",
    "ledger.transaction.backoff-jitter=1.0"
})
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class WalletLedgerIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("wallet_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TransactionEngine transactionEngine;

    @Autowired
    private WalletService walletService;

    @Autowired
    private ConsistencyChecker consistencyChecker;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private BigDecimal storedBalance(UUID walletId) {
        return jdbcTemplate.queryForObject("SELECT balance FROM wallets WHERE id = ?", BigDecimal.class, walletId);
    }

    private int entryCount(UUID walletId) {
        return jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_entries WHERE wallet_id = ?", Integer.class, walletId);
    }

    private MvcResult postTransaction(Map<String, Object> body, int expectedStatus) throws Exception {
        return mockMvc.perform(post("/api/wallets/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)))
            .andExpect(status().is(expectedStatus))
            .andReturn();
    }

    @Test
    @DisplayName("Foreign deposit is converted once and replays return the same entry")
    void depositAndReplayOverHttp() throws Exception {
        printTestHeader("Deposit 10 USD twice with the same external id");

        MvcResult created = mockMvc.perform(post("/api/wallets")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"initial_balance\": \"100.00\"}"))
            .andExpect(status().isCreated())
            .andReturn();
        UUID walletId = UUID.fromString(
            objectMapper.readTree(created.getResponse().getContentAsString()).get("id").asText());
        printInput("Wallet", walletId);

        Map<String, Object> body = Map.of(
            "external_id", "it-deposit-" + walletId,
            "wallet_id", walletId.toString(),
            "type", "DEPOSIT",
            "amount", "10",
            "currency", "USD",
            "metadata", Map.of("source", "integration-test")
        );

        JsonNode first = objectMapper.readTree(postTransaction(body, 201).getResponse().getContentAsString());
        JsonNode second = objectMapper.readTree(postTransaction(body, 200).getResponse().getContentAsString());
        printOutput("First entry", first.get("id").asText());
        printOutput("Replayed entry", second.get("id").asText());

        assertEquals(first.get("id").asText(), second.get("id").asText());
        assertEquals(first.get("amount"), second.get("amount"));
        assertEquals(0, new BigDecimal("490.00").compareTo(first.get("reference_amount").decimalValue()));
        assertEquals("integration-test", second.get("metadata").get("source").asText());
        assertEquals(0, new BigDecimal("590.00").compareTo(storedBalance(walletId)));
        assertEquals(1, entryCount(walletId));

        mockMvc.perform(get("/api/wallets/{walletId}/consistency", walletId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.consistent").value(true));

        printSuccess("Deposit applied once, balance 590.00");
    }

    @Test
    @DisplayName("Errors map to the documented status codes")
    void errorMappingOverHttp() throws Exception {
        printTestHeader("Overdraft, unknown wallet and unknown currency");
        Wallet wallet = walletService.createWallet(new BigDecimal("5.00"), "EGP");

        postTransaction(Map.of("external_id", "it-overdraft-" + wallet.getId(), "wallet_id", wallet.getId().toString(),
            "type", "WITHDRAWAL", "amount", "6"), 400);
        postTransaction(Map.of("external_id", "it-missing-" + wallet.getId(), "wallet_id", UUID.randomUUID().toString(),
            "type", "DEPOSIT", "amount", "1"), 404);
        postTransaction(Map.of("external_id", "it-jpy-" + wallet.getId(), "wallet_id", wallet.getId().toString(),
            "type", "DEPOSIT", "amount", "1", "currency", "JPY"), 400);

        assertEquals(0, new BigDecimal("5.00").compareTo(storedBalance(wallet.getId())));
        assertEquals(0, entryCount(wallet.getId()));
        printSuccess("Rejected requests left no trace");
    }

    @Test
    @DisplayName("Concurrent deposits to one wallet are all applied")
    void concurrentDeposits() throws Exception {
        printTestHeader("10 concurrent deposits of 5.00");
        Wallet wallet = walletService.createWallet(BigDecimal.ZERO, "EGP");
        int threads = 10;

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startGate = new CountDownLatch(1);
        List<Future<LedgerEntry>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            String externalId = "it-conc-" + wallet.getId() + "-" + i;
            futures.add(executor.submit(() -> {
                startGate.await();
                return transactionEngine.applyTransaction(
                    ApplyTransactionCommand.deposit(externalId, wallet.getId(), new BigDecimal("5"), "EGP"));
            }));
        }
        startGate.countDown();
        for (Future<LedgerEntry> future : futures) {
            future.get(60, TimeUnit.SECONDS);
        }
        executor.shutdown();

        printOutput("Balance", storedBalance(wallet.getId()));
        assertEquals(0, new BigDecimal("50.00").compareTo(storedBalance(wallet.getId())));
        assertEquals(threads, entryCount(wallet.getId()));
        assertTrue(consistencyChecker.checkConsistency(wallet.getId()));
        printSuccess("No lost updates");
    }

    @Test
    @DisplayName("Concurrent submissions of one external id are applied once")
    void concurrentDuplicates() throws Exception {
        printTestHeader("10 concurrent submissions of the same request");
        Wallet wallet = walletService.createWallet(BigDecimal.ZERO, "EGP");
        String externalId = "it-dup-" + wallet.getId();
        int threads = 10;

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startGate = new CountDownLatch(1);
        List<Future<TransactionResult>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(executor.submit(() -> {
                startGate.await();
                return transactionEngine.apply(
                    ApplyTransactionCommand.deposit(externalId, wallet.getId(), new BigDecimal("42"), "EGP"));
            }));
        }
        startGate.countDown();

        List<TransactionResult> results = new ArrayList<>();
        for (Future<TransactionResult> future : futures) {
            results.add(future.get(60, TimeUnit.SECONDS));
        }
        executor.shutdown();

        Set<UUID> entryIds = results.stream().map(r -> r.getEntry().getId()).collect(Collectors.toSet());
        printOutput("Distinct entries", entryIds.size());

        assertEquals(1, entryIds.size());
        assertEquals(1, entryCount(wallet.getId()));
        assertEquals(0, new BigDecimal("42.00").compareTo(storedBalance(wallet.getId())));
        printSuccess("Idempotency held under contention");
    }

    @Test
    @DisplayName("Concurrent withdrawals never overdraw the wallet")
    void concurrentWithdrawals() throws Exception {
        printTestHeader("10 concurrent withdrawals of 15.00 from 100.00");
        Wallet wallet = walletService.createWallet(new BigDecimal("100.00"), "EGP");
        int threads = 10;

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startGate = new CountDownLatch(1);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            String externalId = "it-wd-" + wallet.getId() + "-" + i;
            futures.add(executor.submit(() -> {
                startGate.await();
                try {
                    transactionEngine.applyTransaction(
                        ApplyTransactionCommand.withdrawal(externalId, wallet.getId(), new BigDecimal("15"), "EGP"));
                    succeeded.incrementAndGet();
                } catch (InsufficientFundsException e) {
                    rejected.incrementAndGet();
                }
                return null;
            }));
        }
        startGate.countDown();
        for (Future<?> future : futures) {
            future.get(60, TimeUnit.SECONDS);
        }
        executor.shutdown();

        printOutput("Succeeded", succeeded.get());
        printOutput("Rejected", rejected.get());

        assertEquals(6, succeeded.get());
        assertEquals(4, rejected.get());
        assertEquals(0, new BigDecimal("10.00").compareTo(storedBalance(wallet.getId())));
        assertTrue(consistencyChecker.checkConsistency(wallet.getId()));
        printSuccess("Balance never went negative");
    }
}
