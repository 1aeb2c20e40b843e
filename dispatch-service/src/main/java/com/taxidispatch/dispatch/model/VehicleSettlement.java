package com.taxidispatch.dispatch.model;

import java.math.BigDecimal;

/**
 * One vehicle's line in a day-close settlement.
 */
public record VehicleSettlement(
        long vehicleId,
        String driverName,
        String plate,
        int tripsToDate,
        double averageRating,
        BigDecimal gross,
        BigDecimal commission,
        BigDecimal net) {
}
