package com.taxidispatch.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Published once a reserved vehicle leaves with its rider, before transit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TripStartedEvent {

    private long tripId;
    private long vehicleId;
    private String riderId;
    private int day;
    private double distanceKm;
    private BigDecimal fareAmount;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant startedAt;
}
