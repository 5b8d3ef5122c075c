package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.account.Account;
import com.flagship.bookkeeping.exception.ReferenceCollisionException;
import com.flagship.bookkeeping.money.Money;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to ledger batches and their lines.
 *
 * Lines reference accounts by surrogate id (real foreign keys); reads join the
 * account tables to return numbers as well. The database rejects any batch
 * whose debit and credit sums differ at commit time (deferred constraint
 * trigger), on top of the check done by the intake service.
 */
@Repository
@RequiredArgsConstructor
public class LedgerEntryStore {

    private static final String ENTRY_COLUMNS =
        "SELECT e.id, e.reference_number, e.line_number, e.amount, e.description, " +
        "e.detail_account_id, d.account_number AS detail_account_number, " +
        "e.general_account_id, g.account_number AS general_account_number, " +
        "e.entry_type, e.ledger_date, e.posting_status, e.posted_at, " +
        "e.created_by, e.updated_by, e.created_at, e.updated_at " +
        "FROM ledger_entries e " +
        "JOIN detail_accounts d ON d.id = e.detail_account_id " +
        "JOIN general_accounts g ON g.id = e.general_account_id ";

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;

    /**
     * Line whose account references are already resolved.
     */
    @lombok.Value
    public static class ResolvedLine {
        BatchLine line;
        Account detailAccount;
        Account generalAccount;
    }

    // ==================== Batches ====================

    /**
     * Writes the batch header and all its lines as PENDING.
     *
     * @throws ReferenceCollisionException if the reference is already taken
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void insertBatch(String referenceNumber, List<ResolvedLine> lines,
                            Money debitTotal, Money creditTotal, String actorId) {
        try {
            jdbcTemplate.update(
                "INSERT INTO ledger_batches (id, reference_number, line_count, debit_total, credit_total, " +
                "created_by, created_at) VALUES (?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
                UUID.randomUUID(), referenceNumber, lines.size(),
                debitTotal.toBigDecimal(), creditTotal.toBigDecimal(), actorId
            );
        } catch (DuplicateKeyException e) {
            throw new ReferenceCollisionException(referenceNumber);
        }

        List<Object[]> rows = new ArrayList<>(lines.size());
        int lineNumber = 1;
        for (ResolvedLine resolved : lines) {
            BatchLine line = resolved.getLine();
            rows.add(new Object[] {
                UUID.randomUUID(),
                referenceNumber,
                lineNumber++,
                line.getAmount().toBigDecimal(),
                line.getDescription(),
                resolved.getDetailAccount().getId(),
                resolved.getGeneralAccount().getId(),
                line.getEntryType().name(),
                Timestamp.valueOf(line.getLedgerDate()),
                actorId,
                actorId
            });
        }
        jdbcTemplate.batchUpdate(
            "INSERT INTO ledger_entries (id, reference_number, line_number, amount, description, " +
            "detail_account_id, general_account_id, entry_type, ledger_date, posting_status, " +
            "created_by, updated_by, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, 'PENDING', ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)",
            rows
        );
    }

    public boolean referenceExists(String referenceNumber) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_batches WHERE reference_number = ?",
            Integer.class, referenceNumber);
        return count != null && count > 0;
    }

    public Optional<LedgerBatch> findBatch(String referenceNumber) {
        List<LedgerBatch> headers = jdbcTemplate.query(
            "SELECT reference_number, debit_total, credit_total, created_by, created_at " +
            "FROM ledger_batches WHERE reference_number = ?",
            (rs, rowNum) -> new LedgerBatch(
                rs.getString("reference_number"),
                Money.of(rs.getBigDecimal("debit_total")),
                Money.of(rs.getBigDecimal("credit_total")),
                rs.getString("created_by"),
                toInstant(rs, "created_at"),
                List.of()
            ),
            referenceNumber);
        if (headers.isEmpty()) {
            return Optional.empty();
        }
        LedgerBatch header = headers.get(0);
        List<LedgerEntry> lines = findByReference(referenceNumber);
        return Optional.of(new LedgerBatch(header.getReferenceNumber(), header.getDebitTotal(),
                header.getCreditTotal(), header.getCreatedBy(), header.getCreatedAt(), lines));
    }

    /**
     * Locks the batch header and its lines so posting cannot pick them up while
     * the batch is being deleted.
     *
     * @return false if the batch does not exist
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean lockBatch(String referenceNumber) {
        List<String> header = jdbcTemplate.query(
            "SELECT reference_number FROM ledger_batches WHERE reference_number = ? FOR UPDATE",
            (rs, rowNum) -> rs.getString(1), referenceNumber);
        if (header.isEmpty()) {
            return false;
        }
        jdbcTemplate.query(
            "SELECT id FROM ledger_entries WHERE reference_number = ? FOR UPDATE",
            (rs, rowNum) -> rs.getObject(1, UUID.class), referenceNumber);
        return true;
    }

    public int countPostedLines(String referenceNumber) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_entries WHERE reference_number = ? AND posting_status = 'POSTED'",
            Integer.class, referenceNumber);
        return count != null ? count : 0;
    }

    /**
     * Hard-deletes the batch; its lines go with it (ON DELETE CASCADE).
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int deleteBatch(String referenceNumber) {
        Integer lines = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_entries WHERE reference_number = ?",
            Integer.class, referenceNumber);
        jdbcTemplate.update("DELETE FROM ledger_batches WHERE reference_number = ?", referenceNumber);
        return lines != null ? lines : 0;
    }

    // ==================== Lines ====================

    public List<LedgerEntry> findByReference(String referenceNumber) {
        return jdbcTemplate.query(
            ENTRY_COLUMNS + "WHERE e.reference_number = ? AND e.deleted_at IS NULL ORDER BY e.line_number",
            ledgerEntryRowMapper(),
            referenceNumber
        );
    }

    public List<LedgerEntry> findByDay(DayBounds day) {
        return jdbcTemplate.query(
            ENTRY_COLUMNS + "WHERE e.ledger_date >= ? AND e.ledger_date < ? AND e.deleted_at IS NULL " +
            "ORDER BY e.reference_number, e.line_number",
            ledgerEntryRowMapper(),
            Timestamp.valueOf(day.getStartInclusive()), Timestamp.valueOf(day.getEndExclusive())
        );
    }

    /**
     * Loads and row-locks every active line of the day in the given status.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<LedgerEntry> lockByDayAndStatus(DayBounds day, PostingStatus status) {
        return jdbcTemplate.query(
            ENTRY_COLUMNS + "WHERE e.ledger_date >= ? AND e.ledger_date < ? AND e.posting_status = ? " +
            "AND e.deleted_at IS NULL ORDER BY e.reference_number, e.line_number FOR UPDATE OF e",
            ledgerEntryRowMapper(),
            Timestamp.valueOf(day.getStartInclusive()), Timestamp.valueOf(day.getEndExclusive()), status.name()
        );
    }

    public boolean existsPostedOnDay(DayBounds day) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_entries WHERE ledger_date >= ? AND ledger_date < ? " +
            "AND posting_status = 'POSTED' AND deleted_at IS NULL",
            Integer.class,
            Timestamp.valueOf(day.getStartInclusive()), Timestamp.valueOf(day.getEndExclusive()));
        return count != null && count > 0;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public int markPosted(Collection<UUID> ids, Instant postedAt, String actorId) {
        if (ids.isEmpty()) {
            return 0;
        }
        return namedJdbcTemplate.update(
            "UPDATE ledger_entries SET posting_status = 'POSTED', posted_at = :postedAt, " +
            "updated_by = :actor, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id IN (:ids) AND posting_status = 'PENDING'",
            new MapSqlParameterSource()
                .addValue("postedAt", Timestamp.from(postedAt))
                .addValue("actor", actorId)
                .addValue("ids", ids)
        );
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public int markPending(Collection<UUID> ids, String actorId) {
        if (ids.isEmpty()) {
            return 0;
        }
        return namedJdbcTemplate.update(
            "UPDATE ledger_entries SET posting_status = 'PENDING', posted_at = NULL, " +
            "updated_by = :actor, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id IN (:ids) AND posting_status = 'POSTED'",
            new MapSqlParameterSource()
                .addValue("actor", actorId)
                .addValue("ids", ids)
        );
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> LedgerEntry.builder()
            .id(rs.getObject("id", UUID.class))
            .referenceNumber(rs.getString("reference_number"))
            .lineNumber(rs.getInt("line_number"))
            .amount(Money.of(rs.getBigDecimal("amount")))
            .description(rs.getString("description"))
            .detailAccountId(rs.getObject("detail_account_id", UUID.class))
            .detailAccountNumber(rs.getString("detail_account_number"))
            .generalAccountId(rs.getObject("general_account_id", UUID.class))
            .generalAccountNumber(rs.getString("general_account_number"))
            .entryType(EntryType.valueOf(rs.getString("entry_type")))
            .ledgerDate(toLocalDateTime(rs, "ledger_date"))
            .postingStatus(PostingStatus.valueOf(rs.getString("posting_status")))
            .postedAt(toInstant(rs, "posted_at"))
            .createdBy(rs.getString("created_by"))
            .updatedBy(rs.getString("updated_by"))
            .createdAt(toInstant(rs, "created_at"))
            .updatedAt(toInstant(rs, "updated_at"))
            .build();
    }

    private static Instant toInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }

    private static LocalDateTime toLocalDateTime(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toLocalDateTime() : null;
    }
}
