package com.flagship.bookkeeping.closing;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/periods/{year}")
@RequiredArgsConstructor
public class PeriodClosingController {

    private static final String ACTOR_HEADER = "X-Actor-Id";

    private final PeriodClosingService closingService;

    /** Preview only: the figures a close would save, plus the row already saved for the year. */
    @GetMapping("/result")
    public PeriodResultCalculation previewResult(@PathVariable("year") int year) {
        return closingService.calculatePeriodResult(year);
    }

    @GetMapping("/result/saved")
    public PeriodResult getSavedResult(@PathVariable("year") int year) {
        return closingService.findPeriodResult(year);
    }

    @PostMapping("/result")
    public PeriodCloseResult closePeriod(@PathVariable("year") int year,
                                         @RequestHeader(ACTOR_HEADER) String actorId) {
        return closingService.closePeriod(year, actorId);
    }

    @PostMapping("/lock")
    public PeriodResult lockPeriod(@PathVariable("year") int year,
                                   @RequestHeader(ACTOR_HEADER) String actorId) {
        return closingService.lockPeriod(year, actorId);
    }
}
