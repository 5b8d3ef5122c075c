package com.flagship.bookkeeping.closing;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface PeriodResultRepository extends JpaRepository<PeriodResultEntity, UUID> {

    Optional<PeriodResultEntity> findByPeriodYear(int periodYear);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PeriodResultEntity p WHERE p.periodYear = :year")
    Optional<PeriodResultEntity> lockByPeriodYear(@Param("year") int year);

    boolean existsByPeriodYearAndClosedTrue(int periodYear);
}
