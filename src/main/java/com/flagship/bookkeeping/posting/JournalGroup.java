package com.flagship.bookkeeping.posting;

import com.flagship.bookkeeping.money.Money;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * The PENDING lines of one Detail account on one day, summed per side.
 */
@Value
public class JournalGroup {
    UUID detailAccountId;
    String detailAccountNumber;
    String generalAccountNumber;
    LocalDate ledgerDate;
    Money debitTotal;
    Money creditTotal;
    List<UUID> ledgerEntryIds;

    public int getLineCount() {
        return ledgerEntryIds.size();
    }
}
