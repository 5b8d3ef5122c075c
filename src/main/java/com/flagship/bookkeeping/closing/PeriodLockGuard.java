package com.flagship.bookkeeping.closing;

import com.flagship.bookkeeping.exception.PeriodClosedException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Read-side check used by every engine that would change figures of a year.
 */
@Component
@RequiredArgsConstructor
public class PeriodLockGuard {

    private final PeriodResultRepository periodResultRepository;

    public boolean isClosed(int year) {
        return periodResultRepository.existsByPeriodYearAndClosedTrue(year);
    }

    public void assertYearOpen(int year) {
        if (isClosed(year)) {
            throw new PeriodClosedException(year);
        }
    }
}
