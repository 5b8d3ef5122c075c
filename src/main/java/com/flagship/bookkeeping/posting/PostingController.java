package com.flagship.bookkeeping.posting;

import com.flagship.bookkeeping.balance.BalanceApplicationResult;
import com.flagship.bookkeeping.balance.BalanceApplicationService;
import com.flagship.bookkeeping.balance.GeneralAccountRollup;
import com.flagship.bookkeeping.balance.GeneralBalanceRollupService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

/**
 * Day-level posting passes. Ledger posting moves a day's lines into journals;
 * balance application moves posted journals into account balances.
 */
@RestController
@RequestMapping("/api/posting")
@RequiredArgsConstructor
public class PostingController {

    private static final String ACTOR_HEADER = "X-Actor-Id";

    private final PostingService postingService;
    private final BalanceApplicationService balanceApplicationService;
    private final GeneralBalanceRollupService rollupService;

    @PostMapping("/ledgers/{date}")
    public PostingSummary postLedgers(@PathVariable("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                      @RequestHeader(ACTOR_HEADER) String actorId) {
        return postingService.postForDate(date, actorId);
    }

    @DeleteMapping("/ledgers/{date}")
    public UnpostingSummary unpostLedgers(@PathVariable("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                          @RequestHeader(ACTOR_HEADER) String actorId) {
        return postingService.unpostForDate(date, actorId);
    }

    @PostMapping("/balances/{date}")
    public BalanceApplicationResult applyBalances(@PathVariable("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                                  @RequestHeader(ACTOR_HEADER) String actorId) {
        return balanceApplicationService.applyBalancesUpTo(date, actorId);
    }

    @DeleteMapping("/balances/{date}")
    public BalanceApplicationResult revertBalances(@PathVariable("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                                   @RequestHeader(ACTOR_HEADER) String actorId) {
        return balanceApplicationService.revertBalancesFor(date, actorId);
    }

    @PostMapping("/general-balances")
    public List<GeneralAccountRollup> rollUpGeneralBalances(@RequestHeader(ACTOR_HEADER) String actorId) {
        return rollupService.rollUpGeneralBalances(actorId);
    }
}
