package com.flagship.bookkeeping.balance;

import com.flagship.bookkeeping.account.Account;
import com.flagship.bookkeeping.account.AccountCategory;
import com.flagship.bookkeeping.account.AccountKind;
import com.flagship.bookkeeping.account.NewAccountRequest;
import com.flagship.bookkeeping.closing.PeriodClosingService;
import com.flagship.bookkeeping.exception.AccountDetailNotFoundException;
import com.flagship.bookkeeping.exception.NothingToPostException;
import com.flagship.bookkeeping.exception.NothingToUnpostException;
import com.flagship.bookkeeping.exception.PeriodClosedException;
import com.flagship.bookkeeping.journal.JournalEntryEntity;
import com.flagship.bookkeeping.journal.JournalEntryRepository;
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

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = IntegrationTestSupport.TEST_PROPERTIES)
class BalanceApplicationServiceTest extends IntegrationTestSupport {

    private static final LocalDate DAY = LocalDate.of(2025, 4, 1);

    @Autowired
    private BalanceApplicationService balanceApplicationService;

    @Autowired
    private GeneralBalanceRollupService rollupService;

    @Autowired
    private PostingService postingService;

    @Autowired
    private PeriodClosingService periodClosingService;

    @Autowired
    private JournalEntryRepository journalEntryRepository;

    @BeforeEach
    void setUp() {
        resetDatabase();
        createGeneral("11", AccountCategory.ASSET);
        createGeneral("32", AccountCategory.EQUITY);
        createGeneral("41", AccountCategory.REVENUE);
        createDetail("1101", "11", AccountCategory.ASSET);
        createDetail("3203", "32", AccountCategory.EQUITY);
        createDetail("4101", "41", AccountCategory.REVENUE, "100.00", "0.00");
    }

    private void postSale(LocalDate date, String amount) {
        submit(
                BatchLine.debit("1101", "11", amount, date.atTime(11, 0)),
                BatchLine.credit("4101", "41", amount, date.atTime(11, 0)));
        postingService.postForDate(date, ACTOR);
    }

    private Account detail(String number) {
        return accountService.findAccount(AccountKind.DETAIL, number);
    }

    @Test
    @DisplayName("Applying adds journal totals to each detail account and marks the journals POSTED")
    void testApplyAddsDeltas() {
        printTestHeader("Apply Balances");
        postSale(DAY, "250.00");

        BalanceApplicationResult result = balanceApplicationService.applyBalancesUpTo(DAY, ACTOR);

        printOutput("Result", result);
        assertEquals(2, result.getJournalEntries());
        assertEquals(2, result.getAccounts().size());

        Account cash = detail("1101");
        Account sales = detail("4101");
        assertEquals(Money.of("250.00"), cash.getAmountDebit());
        assertTrue(cash.getAmountCredit().isZero());
        // opening credit of 100.00 plus the sale
        assertEquals(Money.of("350.00"), sales.getAmountCredit());

        AccountBalanceChange salesChange = result.getAccounts().stream()
                .filter(c -> c.getAccountNumber().equals("4101"))
                .findFirst()
                .orElseThrow();
        assertEquals(Money.of("250.00"), salesChange.getCreditDelta());
        assertEquals(Money.of("350.00"), salesChange.getAmountCredit());

        List<JournalEntryEntity> journals = journalEntryRepository.findByLedgerDateOrderByDetailAccountNumberAsc(DAY);
        assertTrue(journals.stream().allMatch(j -> j.getPostingStatus() == PostingStatus.POSTED));
        assertTrue(journals.stream().allMatch(j -> j.getPostedAt() != null));
        printSuccess("Balances applied");
    }

    @Test
    @DisplayName("Applying up to a date picks up every earlier pending day")
    void testApplyCoversEarlierDays() {
        postSale(DAY, "10.00");
        postSale(DAY.plusDays(1), "20.00");
        postSale(DAY.plusDays(3), "40.00");

        BalanceApplicationResult result = balanceApplicationService.applyBalancesUpTo(DAY.plusDays(1), ACTOR);

        assertEquals(4, result.getJournalEntries());
        assertEquals(Money.of("30.00"), detail("1101").getAmountDebit());
        assertEquals(2, journalEntryRepository.countByLedgerDateAndPostingStatus(DAY.plusDays(3), PostingStatus.PENDING));
    }

    @Test
    @DisplayName("Applying twice is refused; there is nothing pending the second time")
    void testApplyTwiceRefused() {
        postSale(DAY, "10.00");
        balanceApplicationService.applyBalancesUpTo(DAY, ACTOR);

        assertThrows(NothingToPostException.class, () -> balanceApplicationService.applyBalancesUpTo(DAY, ACTOR));
        assertEquals(Money.of("10.00"), detail("1101").getAmountDebit());
    }

    @Test
    @DisplayName("Reverting takes the day's totals back out")
    void testRevertRestoresBalances() {
        printTestHeader("Revert Balances");
        postSale(DAY, "75.50");
        balanceApplicationService.applyBalancesUpTo(DAY, ACTOR);

        BalanceApplicationResult result = balanceApplicationService.revertBalancesFor(DAY, ACTOR);

        printOutput("Result", result);
        assertEquals(2, result.getJournalEntries());
        assertTrue(detail("1101").getAmountDebit().isZero());
        assertEquals(Money.of("100.00"), detail("4101").getAmountCredit());
        assertEquals(2, journalEntryRepository.countByLedgerDateAndPostingStatus(DAY, PostingStatus.PENDING));
    }

    @Test
    @DisplayName("Nothing applied on the day means nothing to revert")
    void testRevertNothing() {
        postSale(DAY, "10.00");

        assertThrows(NothingToUnpostException.class, () -> balanceApplicationService.revertBalancesFor(DAY, ACTOR));
    }

    @Test
    @DisplayName("A journal naming a missing account aborts the whole pass")
    void testMissingAccountAbortsPass() {
        printTestHeader("Missing Journal Account");
        postSale(DAY, "10.00");
        jdbcTemplate.update("INSERT INTO journal_entries (id, detail_account_number, general_account_number, " +
                "ledger_date, amount_debit, amount_credit, line_count, posting_status, posting_run_at, " +
                "created_by, updated_by) VALUES (?, '7777', '77', ?, 5.00, 0.00, 1, 'PENDING', now(), 'raw', 'raw')",
                UUID.randomUUID(), java.sql.Date.valueOf(DAY));

        AccountDetailNotFoundException e = assertThrows(AccountDetailNotFoundException.class,
                () -> balanceApplicationService.applyBalancesUpTo(DAY, ACTOR));

        printExpectedException("AccountDetailNotFoundException", e.getMessage());
        assertTrue(detail("1101").getAmountDebit().isZero());
        assertEquals(3, journalEntryRepository.countByLedgerDateAndPostingStatus(DAY, PostingStatus.PENDING));
    }

    @Test
    @DisplayName("A closed year accepts neither application nor reversal")
    void testClosedYearRefused() {
        printTestHeader("Closed Year");
        postSale(DAY, "10.00");
        balanceApplicationService.applyBalancesUpTo(DAY, ACTOR);
        postSale(DAY.plusDays(1), "20.00");
        periodClosingService.closePeriod(2025, ACTOR);
        periodClosingService.lockPeriod(2025, ACTOR);

        assertThrows(PeriodClosedException.class,
                () -> balanceApplicationService.applyBalancesUpTo(DAY.plusDays(1), ACTOR));
        assertThrows(PeriodClosedException.class,
                () -> balanceApplicationService.revertBalancesFor(DAY, ACTOR));
        assertEquals(Money.of("10.00"), detail("1101").getAmountDebit());
        printSuccess("Closed year left untouched");
    }

    @Test
    @DisplayName("General accounts are rolled up from their active children")
    void testGeneralRollup() {
        printTestHeader("General Roll-up");
        createDetail("1102", "11", AccountCategory.ASSET, "0.00", "40.00");
        postSale(DAY, "60.00");
        balanceApplicationService.applyBalancesUpTo(DAY, ACTOR);

        List<GeneralAccountRollup> rollups = rollupService.rollUpGeneralBalances(ACTOR);

        printOutput("Rollups", rollups);
        GeneralAccountRollup assets = rollups.stream()
                .filter(r -> r.getGeneralAccountNumber().equals("11"))
                .findFirst()
                .orElseThrow();
        assertEquals(2, assets.getDetailAccounts());
        assertEquals(Money.of("100.00"), assets.getAmountDebit());

        Account general = accountService.findAccount(AccountKind.GENERAL, "11");
        assertEquals(Money.of("100.00"), general.getAmountDebit());
        assertTrue(general.getAmountCredit().isZero());
        assertEquals(Money.of("160.00"), accountService.findAccount(AccountKind.GENERAL, "41").getAmountCredit());
        // detail balances untouched
        assertEquals(Money.of("60.00"), detail("1101").getAmountDebit());
    }

    @Test
    @DisplayName("Roll-up leaves a General account without active children at its opening figures")
    void testGeneralRollupSkipsChildlessGeneral() {
        printTestHeader("General Roll-up Skips Childless General");
        accountService.createGeneralAccount(
                new NewAccountRequest("51", "General 51", AccountCategory.EXPENSE, null, null, null,
                        BigDecimal.ZERO, new BigDecimal("500.00")),
                ACTOR);
        printInput("General 51 opening debit", "500.00");

        List<GeneralAccountRollup> rollups = rollupService.rollUpGeneralBalances(ACTOR);

        printOutput("Rollups", rollups);
        assertTrue(rollups.stream().noneMatch(r -> r.getGeneralAccountNumber().equals("51")));
        assertTrue(rollups.stream().anyMatch(r -> r.getGeneralAccountNumber().equals("11")));

        Account untouched = accountService.findAccount(AccountKind.GENERAL, "51");
        assertEquals(Money.of("500.00"), untouched.getAmountDebit());
        assertTrue(untouched.getAmountCredit().isZero());
        printSuccess("Opening debit kept on childless general account");
    }
}
