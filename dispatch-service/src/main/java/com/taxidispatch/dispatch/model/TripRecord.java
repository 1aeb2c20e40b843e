package com.taxidispatch.dispatch.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.taxidispatch.dispatch.entity.Trip;
import com.taxidispatch.shared.geo.GeoPoint;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Read-only view of a trip as exported to the ledger file and the HTTP API.
 */
@Builder
public record TripRecord(
        long id,
        long vehicleId,
        String riderId,
        GeoPoint origin,
        GeoPoint destination,
        double distanceKm,
        BigDecimal fare,
        BigDecimal commission,
        BigDecimal driverShare,
        int rating,
        int day,
        boolean completed,
        boolean tracked,
        @JsonFormat(shape = JsonFormat.Shape.STRING) Instant startedAt,
        @JsonFormat(shape = JsonFormat.Shape.STRING) Instant completedAt) {

    public static TripRecord of(Trip trip, BigDecimal commission, BigDecimal driverShare) {
        return TripRecord.builder()
                .id(trip.getId())
                .vehicleId(trip.getVehicleId())
                .riderId(trip.getRiderId())
                .origin(trip.getOrigin())
                .destination(trip.getDestination())
                .distanceKm(trip.getDistanceKm())
                .fare(trip.getFare())
                .commission(commission)
                .driverShare(driverShare)
                .rating(trip.getRating())
                .day(trip.getDay())
                .completed(trip.isCompleted())
                .tracked(trip.isTracked())
                .startedAt(trip.getStartedAt())
                .completedAt(trip.getCompletedAt())
                .build();
    }
}
