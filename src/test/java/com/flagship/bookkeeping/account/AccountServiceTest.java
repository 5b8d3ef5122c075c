package com.flagship.bookkeeping.account;

import com.flagship.bookkeeping.audit.AuditAggregate;
import com.flagship.bookkeeping.audit.AuditEvent;
import com.flagship.bookkeeping.audit.AuditEventType;
import com.flagship.bookkeeping.audit.AuditTrailService;
import com.flagship.bookkeeping.exception.AccountExistsException;
import com.flagship.bookkeeping.exception.AccountNotFoundException;
import com.flagship.bookkeeping.exception.HasDependentsException;
import com.flagship.bookkeeping.ledger.BatchLine;
import com.flagship.bookkeeping.money.Money;
import com.flagship.bookkeeping.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = IntegrationTestSupport.TEST_PROPERTIES)
class AccountServiceTest extends IntegrationTestSupport {

    @Autowired
    private AuditTrailService auditTrailService;

    @BeforeEach
    void setUp() {
        resetDatabase();
        createGeneral("11", AccountCategory.ASSET);
    }

    @Test
    @DisplayName("Report type and normal side default from the category")
    void testCategoryDefaults() {
        printTestHeader("Category Defaults");
        createGeneral("41", AccountCategory.REVENUE);

        Account sales = createDetail("4101", "41", AccountCategory.REVENUE);

        printOutput("Account", sales);
        assertEquals(AccountKind.DETAIL, sales.getKind());
        assertEquals(ReportType.INCOME_STATEMENT, sales.getReportType());
        assertEquals(NormalSide.CREDIT, sales.getNormalSide());
        assertEquals("41", sales.getGeneralAccountNumber());
        assertTrue(sales.getAmountCredit().isZero());
        assertTrue(sales.isActive());

        List<AuditEvent> events = auditTrailService.eventsFor(AuditAggregate.ACCOUNT, sales.getId().toString());
        assertEquals(1, events.size());
        assertEquals(AuditEventType.ACCOUNT_CREATED.getEventName(), events.get(0).getEventType());
    }

    @Test
    @DisplayName("Opening amounts seed the cumulative, accumulation and initial pairs")
    void testOpeningAmounts() {
        Account cash = accountService.createDetailAccount(new NewAccountRequest("1101", "Cash",
                AccountCategory.ASSET, null, null, "11", null, new BigDecimal("1500.005")), ACTOR);

        assertEquals(Money.of("1500.01"), cash.getAmountDebit());
        assertEquals(Money.of("1500.01"), cash.getAccumulationAmountDebit());
        assertEquals(Money.of("1500.01"), cash.getInitialAmountDebit());
        assertTrue(cash.getAmountCredit().isZero());
    }

    @Test
    @DisplayName("Explicit report type and normal side override the defaults")
    void testExplicitClassification() {
        Account contra = accountService.createDetailAccount(new NewAccountRequest("1190", "Depreciation",
                AccountCategory.ASSET, ReportType.BALANCE_SHEET, NormalSide.CREDIT, "11", null, null), ACTOR);

        assertEquals(NormalSide.CREDIT, contra.getNormalSide());
    }

    @Test
    @DisplayName("Two active accounts of a kind cannot share a number")
    void testDuplicateNumberRejected() {
        printTestHeader("Duplicate Number");
        createDetail("1101", "11", AccountCategory.ASSET);

        AccountExistsException e = assertThrows(AccountExistsException.class,
                () -> createDetail("1101", "11", AccountCategory.ASSET));

        printExpectedException("AccountExistsException", e.getMessage());
        assertThrows(AccountExistsException.class, () -> createGeneral("11", AccountCategory.ASSET));
    }

    @Test
    @DisplayName("A detail account needs an active parent")
    void testParentRequired() {
        assertThrows(AccountNotFoundException.class, () -> createDetail("9901", "99", AccountCategory.ASSET));
        assertThrows(IllegalArgumentException.class, () -> accountService.createDetailAccount(
                new NewAccountRequest("9902", "Orphan", AccountCategory.ASSET, null, null, null, null, null), ACTOR));

        createGeneral("12", AccountCategory.ASSET);
        accountService.deleteAccount(AccountKind.GENERAL, "12", ACTOR);
        assertThrows(AccountNotFoundException.class, () -> createDetail("1201", "12", AccountCategory.ASSET));
    }

    @Test
    @DisplayName("Soft delete tombstones the number and frees it for a new account")
    void testSoftDeleteFreesNumber() {
        printTestHeader("Soft Delete");
        Account original = createDetail("1101", "11", AccountCategory.ASSET);

        Account deleted = accountService.deleteAccount(AccountKind.DETAIL, "1101", ACTOR);

        printOutput("Deleted", deleted.getAccountNumber());
        assertFalse(deleted.isActive());
        assertFalse(deleted.getAccountNumber().isActive());
        assertTrue(deleted.getAccountNumber().toString().startsWith("1101~deleted-"));
        assertThrows(AccountNotFoundException.class, () -> accountService.findAccount(AccountKind.DETAIL, "1101"));

        Account replacement = createDetail("1101", "11", AccountCategory.ASSET);
        assertNotEquals(original.getId(), replacement.getId());
        assertEquals(2, jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM detail_accounts WHERE account_number = '1101'", Integer.class));
        printSuccess("Number reused after delete");
    }

    @Test
    @DisplayName("Accounts with ledger lines or active children cannot be deleted")
    void testDeleteWithDependentsRefused() {
        printTestHeader("Delete With Dependents");
        createGeneral("41", AccountCategory.REVENUE);
        createDetail("1101", "11", AccountCategory.ASSET);
        createDetail("4101", "41", AccountCategory.REVENUE);
        submit(
                BatchLine.debit("1101", "11", "5.00", LocalDateTime.of(2025, 5, 5, 12, 0)),
                BatchLine.credit("4101", "41", "5.00", LocalDateTime.of(2025, 5, 5, 12, 0)));

        HasDependentsException e = assertThrows(HasDependentsException.class,
                () -> accountService.deleteAccount(AccountKind.DETAIL, "1101", ACTOR));
        printExpectedException("HasDependentsException", e.getMessage());

        assertThrows(HasDependentsException.class,
                () -> accountService.deleteAccount(AccountKind.GENERAL, "11", ACTOR));
        assertTrue(accountService.findAccount(AccountKind.DETAIL, "1101").isActive());
    }

    @Test
    @DisplayName("Deleting an unknown number is reported as not found")
    void testDeleteUnknown() {
        assertThrows(AccountNotFoundException.class,
                () -> accountService.deleteAccount(AccountKind.DETAIL, "0000", ACTOR));
    }
}
