package com.flagship.bookkeeping.journal;

import com.flagship.bookkeeping.ledger.PostingStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.UUID;

@RestController
@RequestMapping("/api/journal-entries")
@RequiredArgsConstructor
public class JournalEntryController {

    private final JournalQueryService journalQueryService;

    @GetMapping
    public JournalEntryPageResponse listJournalEntries(
            @RequestParam(name = "from_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate fromDate,
            @RequestParam(name = "to_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate toDate,
            @RequestParam(name = "status", required = false) PostingStatus status,
            @RequestParam(name = "detail_account_number", required = false) String detailAccountNumber,
            @RequestParam(name = "general_account_number", required = false) String generalAccountNumber,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "50") int size) {
        JournalEntryFilter filter = JournalEntryFilter.builder()
            .fromDate(fromDate)
            .toDate(toDate)
            .postingStatus(status)
            .detailAccountNumber(detailAccountNumber)
            .generalAccountNumber(generalAccountNumber)
            .build();
        return JournalEntryPageResponse.from(journalQueryService.findJournalEntries(filter, page, size));
    }

    @GetMapping("/{id}")
    public JournalEntryResponse getJournalEntry(@PathVariable("id") UUID id) {
        return JournalEntryResponse.from(journalQueryService.findJournalEntry(id));
    }
}
