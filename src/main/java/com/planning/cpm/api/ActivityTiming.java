package com.planning.cpm.api;

import java.time.LocalDate;

/**
 * One output row of a computed schedule.
 *
 * <p>
 * {@code startDate}/{@code endDate} are null unless a calendar anchor was
 * configured or the activity carried supplied dates in supplied-date mode.
 */
public record ActivityTiming(
        String id,
        String name,
        int duration,
        int earlyStart,
        int earlyFinish,
        int lateStart,
        int lateFinish,
        int totalFloat,
        boolean critical,
        LocalDate startDate,
        LocalDate endDate) {
}
