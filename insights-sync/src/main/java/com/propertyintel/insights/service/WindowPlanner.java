package com.propertyintel.insights.service;

import com.propertyintel.insights.config.InsightsSyncProperties;
import com.propertyintel.insights.model.SyncState;
import com.propertyintel.insights.model.SyncWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

/**
 * Computes the inclusive date range polled by one run.
 *
 * Both ends sit on week boundaries: the start is a week-start day, the end is
 * the last day of a week. First runs backfill {@code lookback-weeks}, clamped to
 * the upstream's {@code max-lookback-days} ceiling; later runs re-fetch the last
 * complete week. The end always reaches {@code lookahead-weeks} past the current
 * week so forward bookings are captured.
 *
 * Pure: no clock, no I/O. The caller supplies "today".
 */
@Component
@Slf4j
public class WindowPlanner {

    private final DayOfWeek weekStart;
    private final int lookbackWeeks;
    private final int incrementalLookbackWeeks;
    private final int lookaheadWeeks;
    private final int maxLookbackDays;

    public WindowPlanner(InsightsSyncProperties properties) {
        InsightsSyncProperties.Window window = properties.getWindow();
        this.weekStart = window.getWeekStart();
        this.lookbackWeeks = window.getLookbackWeeks();
        this.incrementalLookbackWeeks = window.getIncrementalLookbackWeeks();
        this.lookaheadWeeks = window.getLookaheadWeeks();
        this.maxLookbackDays = window.getMaxLookbackDays();
        validate(window);
    }

    public SyncWindow plan(SyncState state, LocalDate today) {
        return plan(state.isFirstRun(), today);
    }

    public SyncWindow plan(boolean firstRun, LocalDate today) {
        LocalDate boundary = previousWeekBoundary(today);

        LocalDate start;
        if (firstRun) {
            start = boundary.minusWeeks(lookbackWeeks);
            LocalDate limit = today.minusDays(maxLookbackDays);
            if (start.isBefore(limit)) {
                start = limit.with(TemporalAdjusters.nextOrSame(weekStart));
            }
        } else {
            start = boundary.minusWeeks(incrementalLookbackWeeks);
        }

        LocalDate end = boundary.plusDays(6).plusWeeks(lookaheadWeeks);
        return new SyncWindow(start, end);
    }

    /** Week-start day on or before {@code today}. */
    public LocalDate previousWeekBoundary(LocalDate today) {
        return today.with(TemporalAdjusters.previousOrSame(weekStart));
    }

    private static void validate(InsightsSyncProperties.Window window) {
        // worst case: today is the week start, so the end sits 6 + 7 * lookahead days out
        int furthestEndOffset = 6 + 7 * window.getLookaheadWeeks();
        if (window.getLookaheadWeeks() < 0 || furthestEndOffset > window.getMaxLookaheadDays()) {
            throw new IllegalStateException("insights-sync.window.lookahead-weeks=" + window.getLookaheadWeeks()
                    + " reaches " + furthestEndOffset + " days ahead; upstream ceiling is "
                    + window.getMaxLookaheadDays());
        }
        // worst case: today is the last day of the week, so the start sits 6 + 7 * lookback days back
        int furthestIncrementalOffset = 6 + 7 * window.getIncrementalLookbackWeeks();
        if (window.getIncrementalLookbackWeeks() < 0 || furthestIncrementalOffset > window.getMaxLookbackDays()) {
            throw new IllegalStateException("insights-sync.window.incremental-lookback-weeks="
                    + window.getIncrementalLookbackWeeks() + " reaches " + furthestIncrementalOffset
                    + " days back; upstream ceiling is " + window.getMaxLookbackDays());
        }
        if (window.getLookbackWeeks() < window.getIncrementalLookbackWeeks()) {
            throw new IllegalStateException("insights-sync.window.lookback-weeks must be at least incremental-lookback-weeks");
        }
    }
}
