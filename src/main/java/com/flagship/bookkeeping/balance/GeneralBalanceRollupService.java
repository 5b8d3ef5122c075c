package com.flagship.bookkeeping.balance;

import com.flagship.bookkeeping.account.Account;
import com.flagship.bookkeeping.account.AccountStore;
import com.flagship.bookkeeping.audit.AuditEventType;
import com.flagship.bookkeeping.audit.AuditTrailService;
import com.flagship.bookkeeping.money.Money;
import com.flagship.bookkeeping.observability.BookkeepingMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Recomputes each active General account's cumulative pair as the sum of its
 * active Detail children. Detail balances are read, never written. Generals
 * without active children keep their stored figures.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GeneralBalanceRollupService {

    private final AccountStore accountStore;
    private final AuditTrailService auditTrailService;
    private final BookkeepingMetrics metrics;

    @Transactional
    public List<GeneralAccountRollup> rollUpGeneralBalances(String actorId) {
        long startTime = System.currentTimeMillis();

        Map<UUID, List<Account>> childrenByParent = accountStore.findActiveDetails().stream()
            .collect(Collectors.groupingBy(Account::getGeneralAccountId));

        List<GeneralAccountRollup> rollups = new ArrayList<>();
        for (Account general : accountStore.findActiveGenerals()) {
            List<Account> children = childrenByParent.get(general.getId());
            if (children == null) {
                continue;
            }
            Money debit = Money.ZERO;
            Money credit = Money.ZERO;
            for (Account child : children) {
                debit = debit.add(child.getAmountDebit());
                credit = credit.add(child.getAmountCredit());
            }
            accountStore.overwriteBalances(general.toRef(), credit, debit, actorId);
            rollups.add(new GeneralAccountRollup(general.getNumber(), children.size(), debit, credit));
        }

        auditTrailService.record(AuditEventType.GENERAL_BALANCES_ROLLED_UP, "general-accounts", actorId,
                Map.of("generalAccounts", rollups.size()));

        long duration = System.currentTimeMillis() - startTime;
        metrics.recordOperation("rollup_general", BookkeepingMetrics.OUTCOME_SUCCESS, duration);
        log.info("Rolled up {} general accounts in {}ms", rollups.size(), duration);
        return rollups;
    }
}
