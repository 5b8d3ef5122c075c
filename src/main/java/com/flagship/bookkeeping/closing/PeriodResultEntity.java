package com.flagship.bookkeeping.closing;

import com.flagship.bookkeeping.money.Money;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One net-result row per year.
 *
 * The closed flag is one-way: once set, {@link #recalculate} and {@link #close}
 * refuse to run. The version column turns concurrent updates into an
 * optimistic locking failure instead of a lost write.
 */
@Entity
@Table(name = "period_results")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PeriodResultEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "period_year", nullable = false, updatable = false)
    private int periodYear;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "total_revenue", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalRevenue;

    @Column(name = "total_expense", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalExpense;

    @Column(name = "equity_account_id", nullable = false)
    private UUID equityAccountId;

    @Column(name = "equity_account_number", nullable = false, length = 50)
    private String equityAccountNumber;

    @Column(name = "general_account_number", nullable = false, length = 50)
    private String generalAccountNumber;

    @Column(nullable = false)
    private boolean closed;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "closed_by", length = 100)
    private String closedBy;

    @Column(name = "created_by", nullable = false, updatable = false, length = 100)
    private String createdBy;

    @Column(name = "updated_by", nullable = false, length = 100)
    private String updatedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(nullable = false)
    private long version;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static PeriodResultEntity create(int year, NetResult result, UUID equityAccountId,
                                     String equityAccountNumber, String generalAccountNumber, String actorId) {
        return new PeriodResultEntity(
            UUID.randomUUID(),
            year,
            result.getNetResult().toBigDecimal(),
            result.getTotalRevenue().toBigDecimal(),
            result.getTotalExpense().toBigDecimal(),
            equityAccountId,
            equityAccountNumber,
            generalAccountNumber,
            false,
            null,
            null,
            actorId,
            actorId,
            null, // createdAt - set by @PrePersist
            null, // updatedAt - set by @PrePersist
            0L
        );
    }

    void recalculate(NetResult result, UUID equityAccountId, String equityAccountNumber,
                     String generalAccountNumber, String actorId) {
        requireOpen();
        this.amount = result.getNetResult().toBigDecimal();
        this.totalRevenue = result.getTotalRevenue().toBigDecimal();
        this.totalExpense = result.getTotalExpense().toBigDecimal();
        this.equityAccountId = equityAccountId;
        this.equityAccountNumber = equityAccountNumber;
        this.generalAccountNumber = generalAccountNumber;
        this.updatedBy = actorId;
    }

    void close(Instant closedAt, String actorId) {
        requireOpen();
        this.closed = true;
        this.closedAt = closedAt;
        this.closedBy = actorId;
        this.updatedBy = actorId;
    }

    private void requireOpen() {
        if (closed) {
            throw new IllegalStateException("Period result " + periodYear + " is closed");
        }
    }

    public PeriodResult toDomain() {
        return new PeriodResult(
            id,
            periodYear,
            Money.of(amount),
            Money.of(totalRevenue),
            Money.of(totalExpense),
            equityAccountNumber,
            generalAccountNumber,
            closed,
            closedAt,
            closedBy,
            createdAt,
            updatedAt
        );
    }
}
