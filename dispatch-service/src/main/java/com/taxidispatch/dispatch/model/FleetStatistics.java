package com.taxidispatch.dispatch.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Whole-run statistics produced when the simulation finishes.
 * The busiest and top-earning entries are null when no vehicle is affiliated; the best-rated
 * entry only considers vehicles with at least one trip.
 */
@Builder
public record FleetStatistics(
        int daysClosed,
        int totalTrips,
        Map<Integer, Long> tripsPerDay,
        BigDecimal totalFares,
        BigDecimal averageFare,
        BigDecimal operatorTotal,
        VehicleSummary bestRated,
        VehicleSummary mostTrips,
        VehicleSummary topEarner,
        int activeVehicles,
        int idleVehicles,
        int ridersServed,
        List<VehicleSummary> vehicles,
        @JsonFormat(shape = JsonFormat.Shape.STRING) Instant generatedAt) {
}
