package com.flagship.bookkeeping.journal;

import com.flagship.bookkeeping.exception.JournalEntryNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Read side of the journal: what posting runs produced and what balance
 * application has realized. Newest days first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalQueryService {

    static final int MAX_PAGE_SIZE = 200;

    private static final Sort NEWEST_FIRST = Sort.by(
        Sort.Order.desc("ledgerDate"),
        Sort.Order.asc("detailAccountNumber"));

    private final JournalEntryRepository journalEntryRepository;

    @Transactional(readOnly = true)
    public Page<JournalEntry> findJournalEntries(JournalEntryFilter filter, int page, int size) {
        if (filter.getFromDate() != null && filter.getToDate() != null
                && filter.getFromDate().isAfter(filter.getToDate())) {
            throw new IllegalArgumentException(
                "from_date " + filter.getFromDate() + " is after to_date " + filter.getToDate());
        }
        if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException(
                "page must be >= 0 and size between 1 and " + MAX_PAGE_SIZE);
        }

        Page<JournalEntry> result = journalEntryRepository
            .findAll(JournalEntrySpecifications.matching(filter), PageRequest.of(page, size, NEWEST_FIRST))
            .map(JournalEntryEntity::toDomain);
        log.debug("Journal query {} matched {} entries", filter, result.getTotalElements());
        return result;
    }

    @Transactional(readOnly = true)
    public JournalEntry findJournalEntry(UUID id) {
        return journalEntryRepository.findById(id)
            .map(JournalEntryEntity::toDomain)
            .orElseThrow(() -> new JournalEntryNotFoundException(id));
    }
}
