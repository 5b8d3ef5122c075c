package com.flagship.bookkeeping.posting;

import com.flagship.bookkeeping.ledger.EntryType;
import com.flagship.bookkeeping.ledger.LedgerEntry;
import com.flagship.bookkeeping.money.Money;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Groups a day's ledger lines by Detail account. Groups come out in order of
 * first appearance; the sum of all group totals equals the sum of the input
 * amounts per side.
 */
public final class LedgerAggregation {

    private LedgerAggregation() {
    }

    public static List<JournalGroup> groupByDetailAccount(List<LedgerEntry> entries, LocalDate ledgerDate) {
        Map<UUID, Accumulator> groups = new LinkedHashMap<>();
        for (LedgerEntry entry : entries) {
            groups.computeIfAbsent(entry.getDetailAccountId(), id -> new Accumulator(entry)).add(entry);
        }

        List<JournalGroup> result = new ArrayList<>(groups.size());
        for (Accumulator acc : groups.values()) {
            result.add(new JournalGroup(
                acc.detailAccountId,
                acc.detailAccountNumber,
                acc.generalAccountNumber,
                ledgerDate,
                acc.debit,
                acc.credit,
                List.copyOf(acc.ids)
            ));
        }
        return result;
    }

    public static Money total(List<JournalGroup> groups, EntryType side) {
        Money sum = Money.ZERO;
        for (JournalGroup group : groups) {
            sum = sum.add(side == EntryType.DEBIT ? group.getDebitTotal() : group.getCreditTotal());
        }
        return sum;
    }

    private static final class Accumulator {
        private final UUID detailAccountId;
        private final String detailAccountNumber;
        private final String generalAccountNumber;
        private final List<UUID> ids = new ArrayList<>();
        private Money debit = Money.ZERO;
        private Money credit = Money.ZERO;

        private Accumulator(LedgerEntry first) {
            this.detailAccountId = first.getDetailAccountId();
            this.detailAccountNumber = first.getDetailAccountNumber();
            this.generalAccountNumber = first.getGeneralAccountNumber();
        }

        private void add(LedgerEntry entry) {
            ids.add(entry.getId());
            if (entry.getEntryType() == EntryType.DEBIT) {
                debit = debit.add(entry.getAmount());
            } else {
                credit = credit.add(entry.getAmount());
            }
        }
    }
}
