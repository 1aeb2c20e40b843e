package com.taxidispatch.dispatch.model;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Closed-day report: the day's tracked trip sample, totals over that sample, and the
 * whole-fleet settlement. {@code trackedAverageRating} is 0 when nothing was tracked.
 */
public record DailyReport(
        int day,
        List<TripRecord> trackedTrips,
        int trackedCount,
        BigDecimal trackedFares,
        double trackedAverageRating,
        SettlementReport settlement,
        @JsonFormat(shape = JsonFormat.Shape.STRING) Instant closedAt) {
}
