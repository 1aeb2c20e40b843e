package com.taxidispatch.dispatch.entity;

import com.taxidispatch.shared.geo.GeoPoint;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One executed (or executing) trip. Append-only: once {@code completed} is set the
 * record never changes again.
 */
@Getter
@ToString
@EqualsAndHashCode(of = "id")
public class Trip {

    private final long id;
    private final long vehicleId;
    private final String riderId;
    private final GeoPoint origin;
    private final GeoPoint destination;
    private final double distanceKm;
    private final BigDecimal fare;
    private final int day;
    private final Instant startedAt;

    private int rating;
    private boolean completed;
    private boolean tracked;
    private Instant completedAt;

    @Builder
    public Trip(long id, long vehicleId, String riderId, GeoPoint origin, GeoPoint destination,
                double distanceKm, BigDecimal fare, int day, Instant startedAt) {
        this.id = id;
        this.vehicleId = vehicleId;
        this.riderId = riderId;
        this.origin = origin;
        this.destination = destination;
        this.distanceKm = distanceKm;
        this.fare = fare;
        this.day = day;
        this.startedAt = startedAt;
    }

    public void markTracked() {
        requireOpen();
        tracked = true;
    }

    public void complete(int rating, Instant completedAt) {
        requireOpen();
        this.rating = rating;
        this.completedAt = completedAt;
        this.completed = true;
    }

    private void requireOpen() {
        if (completed) {
            throw new IllegalStateException("Trip " + id + " is already completed");
        }
    }
}
