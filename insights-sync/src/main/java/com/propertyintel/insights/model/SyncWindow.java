package com.propertyintel.insights.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Inclusive date range requested from the upstream API for one run.
 */
public record SyncWindow(LocalDate startDate, LocalDate endDate) {

    public SyncWindow {
        Objects.requireNonNull(startDate, "startDate");
        Objects.requireNonNull(endDate, "endDate");
        if (!endDate.isAfter(startDate)) {
            throw new IllegalArgumentException("Window end " + endDate + " must be after start " + startDate);
        }
    }

    /** Inclusive day count. */
    public long days() {
        return ChronoUnit.DAYS.between(startDate, endDate) + 1;
    }

    /**
     * Split into consecutive chunks of at most {@code chunkDays} days.
     * The last chunk is cut at the window end.
     */
    public List<DateRange> chunks(int chunkDays) {
        if (chunkDays < 1) {
            throw new IllegalArgumentException("chunkDays must be positive: " + chunkDays);
        }
        List<DateRange> out = new ArrayList<>();
        LocalDate current = startDate;
        while (!current.isAfter(endDate)) {
            LocalDate chunkEnd = current.plusDays(chunkDays - 1L);
            if (chunkEnd.isAfter(endDate)) chunkEnd = endDate;
            out.add(new DateRange(current, chunkEnd));
            current = chunkEnd.plusDays(1);
        }
        return out;
    }

    @Override
    public String toString() {
        return startDate + "_to_" + endDate;
    }

    public record DateRange(LocalDate start, LocalDate end) {

        public long days() {
            return ChronoUnit.DAYS.between(start, end) + 1;
        }

        @Override
        public String toString() {
            return start + "_to_" + end;
        }
    }
}
