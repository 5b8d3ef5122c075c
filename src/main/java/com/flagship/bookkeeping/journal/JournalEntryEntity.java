package com.flagship.bookkeeping.journal;

import com.flagship.bookkeeping.ledger.PostingStatus;
import com.flagship.bookkeeping.money.Money;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for journal entries.
 *
 * Accounts are referenced by number, not by id, and the database does not
 * enforce that they exist: every reader resolves the number explicitly.
 *
 * No setters. Entities are created through {@link #create} and change state only
 * through {@link #markPosted} and {@link #markPending}.
 */
@Entity
@Table(name = "journal_entries")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class JournalEntryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "detail_account_number", nullable = false, updatable = false, length = 50)
    private String detailAccountNumber;

    @Column(name = "general_account_number", nullable = false, updatable = false, length = 50)
    private String generalAccountNumber;

    @Column(name = "ledger_date", nullable = false, updatable = false)
    private LocalDate ledgerDate;

    @Column(name = "amount_debit", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amountDebit;

    @Column(name = "amount_credit", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amountCredit;

    @Column(name = "line_count", nullable = false, updatable = false)
    private int lineCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "posting_status", nullable = false, length = 10)
    private PostingStatus postingStatus;

    @Column(name = "posted_at")
    private Instant postedAt;

    @Column(name = "posting_run_at", nullable = false, updatable = false)
    private Instant postingRunAt;

    @Column(name = "created_by", nullable = false, updatable = false, length = 100)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_by", nullable = false, length = 100)
    private String updatedBy;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * New PENDING journal entry for one account's movements on one day.
     */
    public static JournalEntryEntity create(String detailAccountNumber, String generalAccountNumber,
                                            LocalDate ledgerDate, Money debit, Money credit, int lineCount,
                                            Instant postingRunAt, String actorId) {
        return new JournalEntryEntity(
            UUID.randomUUID(),
            detailAccountNumber,
            generalAccountNumber,
            ledgerDate,
            debit.toBigDecimal(),
            credit.toBigDecimal(),
            lineCount,
            PostingStatus.PENDING,
            null,
            postingRunAt,
            actorId,
            null, // createdAt - set by @PrePersist
            actorId,
            null  // updatedAt - set by @PrePersist
        );
    }

    /**
     * Balances for this entry have been applied to the account store.
     */
    public void markPosted(Instant postedAt, String actorId) {
        if (this.postingStatus == PostingStatus.POSTED) {
            throw new IllegalStateException("Journal entry " + id + " is already POSTED");
        }
        this.postingStatus = PostingStatus.POSTED;
        this.postedAt = postedAt;
        this.updatedBy = actorId;
    }

    /**
     * Balances for this entry have been reverted.
     */
    public void markPending(String actorId) {
        if (this.postingStatus != PostingStatus.POSTED) {
            throw new IllegalStateException("Journal entry " + id + " is not POSTED");
        }
        this.postingStatus = PostingStatus.PENDING;
        this.postedAt = null;
        this.updatedBy = actorId;
    }

    public Money debit() {
        return Money.of(amountDebit);
    }

    public Money credit() {
        return Money.of(amountCredit);
    }

    public JournalEntry toDomain() {
        return new JournalEntry(
            id,
            detailAccountNumber,
            generalAccountNumber,
            ledgerDate,
            debit(),
            credit(),
            lineCount,
            postingStatus,
            postedAt,
            postingRunAt
        );
    }
}
