package com.taxidispatch.dispatch.model;

import java.math.BigDecimal;

/**
 * End-of-run figures for one vehicle: totals across every closed day.
 */
public record VehicleSummary(
        long vehicleId,
        String driverName,
        String plate,
        int trips,
        double averageRating,
        BigDecimal totalEarnings,
        BigDecimal commission,
        BigDecimal net,
        BigDecimal averageFare) {
}
