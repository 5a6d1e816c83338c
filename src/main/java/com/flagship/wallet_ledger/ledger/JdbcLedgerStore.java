package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.wallet.Wallet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of the ledger store.
 *
 * This class enforces the store-side invariants:
 * 1. Entry insert and wallet compare-and-swap share one database transaction
 * 2. The unique constraint on external_id decides idempotency races
 * 3. A wallet row is only written when its version is unchanged since load
 *
 * Plain JDBC keeps the version check explicit in the UPDATE statement instead of
 * relying on an ORM persistence context.
 */
@Repository
@Slf4j
public class JdbcLedgerStore implements LedgerStore {

    private static final String ENTRY_COLUMNS =
        "id, external_id, wallet_id, kind, amount, currency, reference_amount, applied_amount, metadata, created_at";

    private static final String WALLET_COLUMNS =
        "id, balance, opening_balance, currency, version, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;
    private final MetadataCodec metadataCodec;

    public JdbcLedgerStore(JdbcTemplate jdbcTemplate, MetadataCodec metadataCodec) {
        this.jdbcTemplate = jdbcTemplate;
        this.metadataCodec = metadataCodec;
    }

    @Override
    public Optional<LedgerEntry> findEntryByExternalId(String externalId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE external_id = ?",
            ledgerEntryRowMapper(),
            externalId
        ).stream().findFirst();
    }

    @Override
    public Optional<LedgerEntry> findEntryById(UUID entryId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE id = ?",
            ledgerEntryRowMapper(),
            entryId
        ).stream().findFirst();
    }

    @Override
    public Optional<Wallet> findWalletById(UUID walletId) {
        return jdbcTemplate.query(
            "SELECT " + WALLET_COLUMNS + " FROM wallets WHERE id = ?",
            walletRowMapper(),
            walletId
        ).stream().findFirst();
    }

    @Override
    @Transactional
    public void insertEntryAndUpdateWalletAtomic(LedgerEntry entry, Wallet updatedWallet, long expectedVersion) {
        if (!entry.getWalletId().equals(updatedWallet.getId())) {
            throw new IllegalArgumentException(
                String.format("Entry wallet %s does not match updated wallet %s",
                    entry.getWalletId(), updatedWallet.getId()));
        }

        // Entry first: a concurrent duplicate fails on the unique index before touching the wallet row
        try {
            jdbcTemplate.update(
                "INSERT INTO ledger_entries (" + ENTRY_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                entry.getId(),
                entry.getExternalId(),
                entry.getWalletId(),
                entry.getKind().name(),
                entry.getAmount(),
                entry.getCurrency(),
                entry.getReferenceAmount(),
                entry.getAppliedAmount(),
                metadataCodec.write(entry.getMetadata()),
                Timestamp.from(entry.getCreatedAt())
            );
        } catch (DuplicateKeyException e) {
            log.debug("Unique violation on insert: externalId={}", entry.getExternalId());
            throw new DuplicateExternalIdException(entry.getExternalId(), e);
        }

        int updated = jdbcTemplate.update(
            "UPDATE wallets SET balance = ?, version = ?, updated_at = ? WHERE id = ? AND version = ?",
            updatedWallet.getBalance(),
            updatedWallet.getVersion(),
            Timestamp.from(updatedWallet.getUpdatedAt()),
            updatedWallet.getId(),
            expectedVersion
        );

        if (updated == 0) {
            // Rolls back the entry insert above
            throw new OptimisticConflictException(updatedWallet.getId(), expectedVersion);
        }
    }

    @Override
    public BigDecimal sumAppliedAmountsForWallet(UUID walletId) {
        BigDecimal sum = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(applied_amount), 0) FROM ledger_entries WHERE wallet_id = ?",
            BigDecimal.class,
            walletId
        );
        return sum != null ? sum : BigDecimal.ZERO;
    }

    @Override
    @Transactional
    public Wallet insertWallet(Wallet wallet) {
        jdbcTemplate.update(
            "INSERT INTO wallets (" + WALLET_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?)",
            wallet.getId(),
            wallet.getBalance(),
            wallet.getOpeningBalance(),
            wallet.getCurrency(),
            wallet.getVersion(),
            Timestamp.from(wallet.getCreatedAt()),
            Timestamp.from(wallet.getUpdatedAt())
        );
        return wallet;
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            UUID.fromString(rs.getString("id")),
            rs.getString("external_id"),
            UUID.fromString(rs.getString("wallet_id")),
            TransactionKind.valueOf(rs.getString("kind")),
            rs.getBigDecimal("amount"),
            rs.getString("currency"),
            rs.getBigDecimal("reference_amount"),
            rs.getBigDecimal("applied_amount"),
            metadataCodec.read(rs.getString("metadata")),
            rs.getTimestamp("created_at").toInstant()
        );
    }

    private RowMapper<Wallet> walletRowMapper() {
        return (rs, rowNum) -> new Wallet(
            UUID.fromString(rs.getString("id")),
            rs.getBigDecimal("balance"),
            rs.getBigDecimal("opening_balance"),
            rs.getString("currency"),
            rs.getLong("version"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getTimestamp("updated_at").toInstant()
        );
    }
}
