package com.flagship.bookkeeping.journal;

import com.flagship.bookkeeping.ledger.PostingStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Repository
public interface JournalEntryRepository extends JpaRepository<JournalEntryEntity, UUID>,
        JpaSpecificationExecutor<JournalEntryEntity> {

    boolean existsByLedgerDate(LocalDate ledgerDate);

    boolean existsByPostingStatusAndLedgerDateGreaterThanEqual(PostingStatus postingStatus, LocalDate ledgerDate);

    long countByLedgerDateAndPostingStatus(LocalDate ledgerDate, PostingStatus postingStatus);

    List<JournalEntryEntity> findByLedgerDateOrderByDetailAccountNumberAsc(LocalDate ledgerDate);

    /**
     * PENDING entries on or before the date, locked for balance application.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
        SELECT j FROM JournalEntryEntity j
        WHERE j.postingStatus = :status AND j.ledgerDate <= :date
        ORDER BY j.ledgerDate ASC, j.detailAccountNumber ASC
        """)
    List<JournalEntryEntity> lockByStatusUpTo(@Param("status") PostingStatus status, @Param("date") LocalDate date);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
        SELECT j FROM JournalEntryEntity j
        WHERE j.postingStatus = :status AND j.ledgerDate = :date
        ORDER BY j.detailAccountNumber ASC
        """)
    List<JournalEntryEntity> lockByStatusOn(@Param("status") PostingStatus status, @Param("date") LocalDate date);

    /**
     * Every journal entry of the day, locked so balance application and
     * unposting of that day serialize.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM JournalEntryEntity j WHERE j.ledgerDate = :date ORDER BY j.detailAccountNumber ASC")
    List<JournalEntryEntity> lockByDate(@Param("date") LocalDate date);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM JournalEntryEntity j WHERE j.ledgerDate = :date AND j.postingStatus = :status")
    int deleteByDateAndStatus(@Param("date") LocalDate date, @Param("status") PostingStatus status);
}
