package com.flagship.bookkeeping.account;

import com.flagship.bookkeeping.exception.AccountNotFoundException;
import com.flagship.bookkeeping.exception.HasDependentsException;
import com.flagship.bookkeeping.money.Money;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to General and Detail accounts.
 *
 * The store owns every balance column. Engine-facing mutations are relative
 * deltas ({@code SET col = col + ?}) so concurrent writers never lose an update;
 * the only absolute writes are {@link #overwriteAccumulation} for the period net
 * result and {@link #overwriteBalances} for General roll-ups, both of which store
 * a computed snapshot.
 *
 * Mutating methods run with {@link Propagation#MANDATORY}: a balance change
 * outside the transaction that moves the matching ledger or journal rows is a bug.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class AccountStore {

    private static final String GENERAL_COLUMNS =
        "g.id, g.account_number, g.tombstone_suffix, g.account_name, g.account_category, g.report_type, " +
        "g.normal_side, NULL::uuid AS general_account_id, NULL AS general_account_number, " +
        "g.amount_credit, g.amount_debit, g.accumulation_amount_credit, g.accumulation_amount_debit, " +
        "g.initial_amount_credit, g.initial_amount_debit, " +
        "g.created_by, g.updated_by, g.created_at, g.updated_at, g.deleted_at " +
        "FROM general_accounts g ";

    private static final String DETAIL_COLUMNS =
        "d.id, d.account_number, d.tombstone_suffix, d.account_name, d.account_category, d.report_type, " +
        "d.normal_side, d.general_account_id, g.account_number AS general_account_number, " +
        "d.amount_credit, d.amount_debit, d.accumulation_amount_credit, d.accumulation_amount_debit, " +
        "d.initial_amount_credit, d.initial_amount_debit, " +
        "d.created_by, d.updated_by, d.created_at, d.updated_at, d.deleted_at " +
        "FROM detail_accounts d JOIN general_accounts g ON g.id = d.general_account_id ";

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;
    private final Clock clock;

    // ==================== Reads ====================

    public Optional<Account> findActiveByNumber(AccountKind kind, String accountNumber) {
        String sql = kind == AccountKind.GENERAL
            ? "SELECT " + GENERAL_COLUMNS + "WHERE g.account_number = ? AND g.deleted_at IS NULL"
            : "SELECT " + DETAIL_COLUMNS + "WHERE d.account_number = ? AND d.deleted_at IS NULL";
        return jdbcTemplate.query(sql, accountRowMapper(kind), accountNumber).stream().findFirst();
    }

    public Optional<Account> findActiveById(AccountKind kind, UUID id) {
        String sql = kind == AccountKind.GENERAL
            ? "SELECT " + GENERAL_COLUMNS + "WHERE g.id = ? AND g.deleted_at IS NULL"
            : "SELECT " + DETAIL_COLUMNS + "WHERE d.id = ? AND d.deleted_at IS NULL";
        return jdbcTemplate.query(sql, accountRowMapper(kind), id).stream().findFirst();
    }

    /**
     * Resolves many numbers in one round trip. Numbers without an active account
     * are simply absent from the result.
     */
    public Map<String, Account> findActiveByNumbers(AccountKind kind, Collection<String> accountNumbers) {
        Map<String, Account> result = new LinkedHashMap<>();
        if (accountNumbers.isEmpty()) {
            return result;
        }
        String sql = kind == AccountKind.GENERAL
            ? "SELECT " + GENERAL_COLUMNS + "WHERE g.account_number IN (:numbers) AND g.deleted_at IS NULL"
            : "SELECT " + DETAIL_COLUMNS + "WHERE d.account_number IN (:numbers) AND d.deleted_at IS NULL";
        namedJdbcTemplate.query(sql, new MapSqlParameterSource("numbers", accountNumbers), accountRowMapper(kind))
            .forEach(account -> result.put(account.getNumber(), account));
        return result;
    }

    public List<Account> findActiveDetailsByReportType(ReportType reportType) {
        return jdbcTemplate.query(
            "SELECT " + DETAIL_COLUMNS + "WHERE d.report_type = ? AND d.deleted_at IS NULL ORDER BY d.account_number",
            accountRowMapper(AccountKind.DETAIL),
            reportType.name()
        );
    }

    public List<Account> findActiveDetails() {
        return jdbcTemplate.query(
            "SELECT " + DETAIL_COLUMNS + "WHERE d.deleted_at IS NULL ORDER BY d.account_number",
            accountRowMapper(AccountKind.DETAIL)
        );
    }

    public List<Account> findActiveGenerals() {
        return jdbcTemplate.query(
            "SELECT " + GENERAL_COLUMNS + "WHERE g.deleted_at IS NULL ORDER BY g.account_number",
            accountRowMapper(AccountKind.GENERAL)
        );
    }

    // ==================== Creation ====================

    /**
     * Inserts an account. Opening amounts seed the cumulative and accumulation
     * pairs as well as the initial pair.
     *
     * @param parentId required for {@link AccountKind#DETAIL}, ignored otherwise
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Account insert(AccountKind kind, NewAccountRequest request, UUID parentId, String actorId) {
        AccountNumber number = AccountNumber.active(request.getAccountNumber());
        Money initialCredit = Money.of(request.getInitialAmountCredit());
        Money initialDebit = Money.of(request.getInitialAmountDebit());
        if (initialCredit.isNegative() || initialDebit.isNegative()) {
            throw new IllegalArgumentException("Initial amounts must not be negative");
        }

        UUID id = UUID.randomUUID();
        String parentColumn = kind == AccountKind.DETAIL ? "general_account_id, " : "";
        String parentPlaceholder = kind == AccountKind.DETAIL ? "?, " : "";

        String sql = "INSERT INTO " + kind.tableName() + " (id, account_number, account_name, account_category, " +
            "report_type, normal_side, " + parentColumn +
            "amount_credit, amount_debit, accumulation_amount_credit, accumulation_amount_debit, " +
            "initial_amount_credit, initial_amount_debit, created_by, updated_by, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, " + parentPlaceholder + "?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)";

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql);
            int i = 1;
            ps.setObject(i++, id);
            ps.setString(i++, number.getNumber());
            ps.setString(i++, request.getAccountName());
            ps.setString(i++, request.getCategory().name());
            ps.setString(i++, request.effectiveReportType().name());
            ps.setString(i++, request.effectiveNormalSide().name());
            if (kind == AccountKind.DETAIL) {
                ps.setObject(i++, parentId);
            }
            ps.setBigDecimal(i++, initialCredit.toBigDecimal());
            ps.setBigDecimal(i++, initialDebit.toBigDecimal());
            ps.setBigDecimal(i++, initialCredit.toBigDecimal());
            ps.setBigDecimal(i++, initialDebit.toBigDecimal());
            ps.setBigDecimal(i++, initialCredit.toBigDecimal());
            ps.setBigDecimal(i++, initialDebit.toBigDecimal());
            ps.setString(i++, actorId);
            ps.setString(i, actorId);
            return ps;
        });

        return findActiveById(kind, id)
            .orElseThrow(() -> new IllegalStateException("Inserted account " + id + " not readable"));
    }

    // ==================== Balance deltas ====================

    @Transactional(propagation = Propagation.MANDATORY)
    public void incrementBalances(AccountRef ref, Money creditDelta, Money debitDelta, String actorId) {
        requireNonNegative(creditDelta, debitDelta);
        int rows = jdbcTemplate.update(
            "UPDATE " + ref.getKind().tableName() + " SET amount_credit = amount_credit + ?, " +
            "amount_debit = amount_debit + ?, updated_by = ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND deleted_at IS NULL",
            creditDelta.toBigDecimal(), debitDelta.toBigDecimal(), actorId, ref.getId()
        );
        if (rows == 0) {
            throw new AccountNotFoundException(ref.getKind().label(), ref.getId().toString());
        }
    }

    /**
     * Inverse of {@link #incrementBalances}. Refuses to take a cumulative amount
     * below zero, which would mean reverting something that was never applied.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void decrementBalances(AccountRef ref, Money creditDelta, Money debitDelta, String actorId) {
        requireNonNegative(creditDelta, debitDelta);
        int rows = jdbcTemplate.update(
            "UPDATE " + ref.getKind().tableName() + " SET amount_credit = amount_credit - ?, " +
            "amount_debit = amount_debit - ?, updated_by = ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND deleted_at IS NULL AND amount_credit >= ? AND amount_debit >= ?",
            creditDelta.toBigDecimal(), debitDelta.toBigDecimal(), actorId, ref.getId(),
            creditDelta.toBigDecimal(), debitDelta.toBigDecimal()
        );
        if (rows == 0) {
            Account account = findActiveById(ref.getKind(), ref.getId())
                .orElseThrow(() -> new AccountNotFoundException(ref.getKind().label(), ref.getId().toString()));
            throw new IllegalStateException(String.format(
                "Reverting credit=%s, debit=%s would take account %s below zero (credit=%s, debit=%s)",
                creditDelta, debitDelta, account.getNumber(), account.getAmountCredit(), account.getAmountDebit()));
        }
    }

    // ==================== Snapshot overwrites ====================

    @Transactional(propagation = Propagation.MANDATORY)
    public void overwriteAccumulation(AccountRef ref, Money credit, Money debit, String actorId) {
        requireNonNegative(credit, debit);
        int rows = jdbcTemplate.update(
            "UPDATE " + ref.getKind().tableName() + " SET accumulation_amount_credit = ?, " +
            "accumulation_amount_debit = ?, updated_by = ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND deleted_at IS NULL",
            credit.toBigDecimal(), debit.toBigDecimal(), actorId, ref.getId()
        );
        if (rows == 0) {
            throw new AccountNotFoundException(ref.getKind().label(), ref.getId().toString());
        }
    }

    /**
     * Absolute write of the cumulative pair. Only General accounts, whose balance
     * is derived from their children; Detail balances stay delta-only.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void overwriteBalances(AccountRef ref, Money credit, Money debit, String actorId) {
        if (ref.getKind() != AccountKind.GENERAL) {
            throw new IllegalArgumentException("Only General account balances can be overwritten");
        }
        requireNonNegative(credit, debit);
        int rows = jdbcTemplate.update(
            "UPDATE general_accounts SET amount_credit = ?, amount_debit = ?, updated_by = ?, " +
            "updated_at = CURRENT_TIMESTAMP WHERE id = ? AND deleted_at IS NULL",
            credit.toBigDecimal(), debit.toBigDecimal(), actorId, ref.getId()
        );
        if (rows == 0) {
            throw new AccountNotFoundException(ref.getKind().label(), ref.getId().toString());
        }
    }

    // ==================== Soft delete ====================

    /**
     * Tombstones the account number and stamps the delete time.
     *
     * @throws HasDependentsException if any active ledger line references the
     *         account, or (for a General account) any active Detail child exists
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Account softDelete(AccountRef ref, String actorId) {
        Account account = lockActive(ref);

        String ledgerColumn = ref.getKind() == AccountKind.GENERAL ? "general_account_id" : "detail_account_id";
        Long ledgerEntries = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_entries WHERE " + ledgerColumn + " = ? AND deleted_at IS NULL",
            Long.class, ref.getId());
        long children = 0;
        if (ref.getKind() == AccountKind.GENERAL) {
            Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM detail_accounts WHERE general_account_id = ? AND deleted_at IS NULL",
                Long.class, ref.getId());
            children = count != null ? count : 0;
        }
        long ledgers = ledgerEntries != null ? ledgerEntries : 0;
        if (ledgers > 0 || children > 0) {
            throw new HasDependentsException(ref.getKind().label(), account.getNumber(), ledgers, children);
        }

        Instant deletedAt = Instant.now(clock);
        AccountNumber tombstoned = account.getAccountNumber().tombstone("deleted-" + deletedAt.toEpochMilli());
        jdbcTemplate.update(
            "UPDATE " + ref.getKind().tableName() + " SET tombstone_suffix = ?, deleted_at = ?, " +
            "updated_by = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            tombstoned.getTombstoneSuffix(), Timestamp.from(deletedAt), actorId, ref.getId()
        );

        log.info("Soft-deleted {} account {} as {}", ref.getKind().label(), account.getNumber(), tombstoned);
        return account.toBuilder()
            .accountNumber(tombstoned)
            .deletedAt(deletedAt)
            .updatedBy(actorId)
            .build();
    }

    private Account lockActive(AccountRef ref) {
        String table = ref.getKind().tableName();
        List<UUID> locked = jdbcTemplate.query(
            "SELECT id FROM " + table + " WHERE id = ? AND deleted_at IS NULL FOR UPDATE",
            (rs, rowNum) -> rs.getObject("id", UUID.class),
            ref.getId());
        if (locked.isEmpty()) {
            throw new AccountNotFoundException(ref.getKind().label(), ref.getId().toString());
        }
        return findActiveById(ref.getKind(), ref.getId())
            .orElseThrow(() -> new AccountNotFoundException(ref.getKind().label(), ref.getId().toString()));
    }

    private static void requireNonNegative(Money credit, Money debit) {
        if (credit.isNegative() || debit.isNegative()) {
            throw new IllegalArgumentException(
                String.format("Balance deltas must not be negative: credit=%s, debit=%s", credit, debit));
        }
    }

    private RowMapper<Account> accountRowMapper(AccountKind kind) {
        return (rs, rowNum) -> Account.builder()
            .id(rs.getObject("id", UUID.class))
            .kind(kind)
            .accountNumber(AccountNumber.of(rs.getString("account_number"), rs.getString("tombstone_suffix")))
            .accountName(rs.getString("account_name"))
            .category(AccountCategory.valueOf(rs.getString("account_category")))
            .reportType(ReportType.valueOf(rs.getString("report_type")))
            .normalSide(NormalSide.valueOf(rs.getString("normal_side")))
            .generalAccountId(rs.getObject("general_account_id", UUID.class))
            .generalAccountNumber(rs.getString("general_account_number"))
            .amountCredit(Money.of(rs.getBigDecimal("amount_credit")))
            .amountDebit(Money.of(rs.getBigDecimal("amount_debit")))
            .accumulationAmountCredit(Money.of(rs.getBigDecimal("accumulation_amount_credit")))
            .accumulationAmountDebit(Money.of(rs.getBigDecimal("accumulation_amount_debit")))
            .initialAmountCredit(Money.of(rs.getBigDecimal("initial_amount_credit")))
            .initialAmountDebit(Money.of(rs.getBigDecimal("initial_amount_debit")))
            .createdBy(rs.getString("created_by"))
            .updatedBy(rs.getString("updated_by"))
            .createdAt(toInstant(rs, "created_at"))
            .updatedAt(toInstant(rs, "updated_at"))
            .deletedAt(toInstant(rs, "deleted_at"))
            .build();
    }

    static Instant toInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }
}
