package com.taxidispatch.dispatch.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.taxidispatch.shared.enums.DayPhase;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of the fleet for the visualization front end.
 * Riders appear only while they are in a trip.
 */
public record LiveSnapshot(
        int day,
        DayPhase phase,
        List<VehicleView> vehicles,
        List<RiderView> riders,
        @JsonFormat(shape = JsonFormat.Shape.STRING) Instant generatedAt) {

    public record VehicleView(
            long id,
            String driverName,
            String plate,
            String make,
            String model,
            double lat,
            double lng,
            boolean available,
            String currentRiderId,
            double averageRating,
            int trips,
            BigDecimal periodEarnings,
            BigDecimal totalEarnings) {
    }

    public record RiderView(
            String id,
            String name,
            double lat,
            double lng,
            double destinationLat,
            double destinationLng,
            Long assignedVehicleId) {
    }
}
