package com.flagship.bookkeeping.journal;

import com.flagship.bookkeeping.account.AccountCategory;
import com.flagship.bookkeeping.balance.BalanceApplicationService;
import com.flagship.bookkeeping.exception.JournalEntryNotFoundException;
import com.flagship.bookkeeping.ledger.BatchLine;
import com.flagship.bookkeeping.ledger.PostingStatus;
import com.flagship.bookkeeping.money.Money;
import com.flagship.bookkeeping.posting.PostingService;
import com.flagship.bookkeeping.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.domain.Page;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = IntegrationTestSupport.TEST_PROPERTIES)
class JournalQueryServiceTest extends IntegrationTestSupport {

    private static final LocalDate DAY_ONE = LocalDate.of(2025, 5, 5);
    private static final LocalDate DAY_TWO = LocalDate.of(2025, 5, 6);

    @Autowired
    private JournalQueryService journalQueryService;

    @Autowired
    private PostingService postingService;

    @Autowired
    private BalanceApplicationService balanceApplicationService;

    @BeforeEach
    void setUp() {
        resetDatabase();
        createGeneral("11", AccountCategory.ASSET);
        createGeneral("41", AccountCategory.REVENUE);
        createDetail("1101", "11", AccountCategory.ASSET);
        createDetail("4101", "41", AccountCategory.REVENUE);

        submit(
                BatchLine.debit("1101", "11", "70.00", DAY_ONE.atTime(9, 0)),
                BatchLine.credit("4101", "41", "70.00", DAY_ONE.atTime(9, 0)));
        submit(
                BatchLine.debit("1101", "11", "25.00", DAY_TWO.atTime(14, 0)),
                BatchLine.credit("4101", "41", "25.00", DAY_TWO.atTime(14, 0)));
        postingService.postForDate(DAY_ONE, ACTOR);
        postingService.postForDate(DAY_TWO, ACTOR);
        balanceApplicationService.applyBalancesUpTo(DAY_ONE, ACTOR);
    }

    private JournalEntryFilter.JournalEntryFilterBuilder filter() {
        return JournalEntryFilter.builder();
    }

    @Test
    @DisplayName("Without criteria every journal entry is listed, newest day first")
    void testListAll() {
        printTestHeader("List All Journal Entries");

        Page<JournalEntry> page = journalQueryService.findJournalEntries(filter().build(), 0, 50);

        printOutput("Entries", page.getContent());
        assertEquals(4, page.getTotalElements());
        List<JournalEntry> entries = page.getContent();
        assertEquals(DAY_TWO, entries.get(0).getLedgerDate());
        assertEquals("1101", entries.get(0).getDetailAccountNumber());
        assertEquals(DAY_ONE, entries.get(3).getLedgerDate());
        assertEquals("4101", entries.get(3).getDetailAccountNumber());
    }

    @Test
    @DisplayName("Status filter separates applied days from pending ones")
    void testFilterByStatus() {
        printTestHeader("Filter By Status");

        Page<JournalEntry> posted = journalQueryService.findJournalEntries(
                filter().postingStatus(PostingStatus.POSTED).build(), 0, 50);
        Page<JournalEntry> pending = journalQueryService.findJournalEntries(
                filter().postingStatus(PostingStatus.PENDING).build(), 0, 50);

        printOutput("Posted", posted.getContent());
        printOutput("Pending", pending.getContent());
        assertEquals(2, posted.getTotalElements());
        assertTrue(posted.getContent().stream().allMatch(e -> e.getLedgerDate().equals(DAY_ONE)));
        assertTrue(posted.getContent().stream().allMatch(e -> e.getPostedAt() != null));
        assertEquals(2, pending.getTotalElements());
        assertTrue(pending.getContent().stream().allMatch(e -> e.getLedgerDate().equals(DAY_TWO)));
    }

    @Test
    @DisplayName("Date range and account filters combine")
    void testFilterByDateRangeAndAccount() {
        printTestHeader("Filter By Date Range And Account");

        Page<JournalEntry> page = journalQueryService.findJournalEntries(
                filter().fromDate(DAY_TWO).toDate(DAY_TWO).detailAccountNumber("4101").build(), 0, 50);

        printOutput("Entries", page.getContent());
        assertEquals(1, page.getTotalElements());
        JournalEntry entry = page.getContent().get(0);
        assertEquals("41", entry.getGeneralAccountNumber());
        assertEquals(Money.of("25.00"), entry.getAmountCredit());
        assertTrue(entry.getAmountDebit().isZero());
        assertEquals(1, entry.getLineCount());

        Page<JournalEntry> byGeneral = journalQueryService.findJournalEntries(
                filter().generalAccountNumber("11").build(), 0, 50);
        assertEquals(2, byGeneral.getTotalElements());
    }

    @Test
    @DisplayName("Pages are cut from the same ordering")
    void testPaging() {
        printTestHeader("Paging");

        Page<JournalEntry> second = journalQueryService.findJournalEntries(filter().build(), 1, 3);

        printOutput("Second page", second.getContent());
        assertEquals(4, second.getTotalElements());
        assertEquals(1, second.getContent().size());
        assertEquals(DAY_ONE, second.getContent().get(0).getLedgerDate());
    }

    @Test
    @DisplayName("Inverted date range and oversized pages are rejected")
    void testInvalidCriteria() {
        printTestHeader("Invalid Criteria");

        assertThrows(IllegalArgumentException.class, () -> journalQueryService.findJournalEntries(
                filter().fromDate(DAY_TWO).toDate(DAY_ONE).build(), 0, 50));
        assertThrows(IllegalArgumentException.class, () -> journalQueryService.findJournalEntries(
                filter().build(), 0, JournalQueryService.MAX_PAGE_SIZE + 1));
        printExpectedException("IllegalArgumentException", "bad query criteria");
    }

    @Test
    @DisplayName("A single entry is found by id; an unknown id is NOT_FOUND")
    void testFindById() {
        printTestHeader("Find Journal Entry By Id");
        JournalEntry any = journalQueryService.findJournalEntries(filter().build(), 0, 1).getContent().get(0);

        JournalEntry found = journalQueryService.findJournalEntry(any.getId());

        assertEquals(any, found);
        assertThrows(JournalEntryNotFoundException.class,
                () -> journalQueryService.findJournalEntry(UUID.randomUUID()));
        printSuccess("Lookup by id");
    }
}
