package com.taxidispatch.dispatch.entity;

import com.taxidispatch.shared.geo.GeoPoint;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A taxi affiliated to the operator.
 *
 * Mutable state is only touched under the store's vehicle lock: reservation by the
 * matching engine, completion and release by the trip pipeline, period close by settlement.
 * {@code available == false} exactly when {@code currentRiderId != null}.
 */
@Getter
@ToString(of = {"id", "plate", "firstName", "lastName", "available"})
@EqualsAndHashCode(of = "id")
public class Vehicle {

    private final long id;
    private final String driverIdentity;
    private final String firstName;
    private final String lastName;
    private final String plate;
    private final String make;
    private final String model;
    private final int speedKmh;
    private final Instant registeredAt;

    private GeoPoint location;
    private boolean available = true;
    private String currentRiderId;
    private long ratingTotal;
    private int tripCount;
    private BigDecimal periodEarnings = BigDecimal.ZERO;
    private BigDecimal totalEarnings = BigDecimal.ZERO;

    @Builder
    public Vehicle(long id, String driverIdentity, String firstName, String lastName, String plate,
                   String make, String model, int speedKmh, GeoPoint location, Instant registeredAt) {
        this.id = id;
        this.driverIdentity = driverIdentity;
        this.firstName = firstName;
        this.lastName = lastName;
        this.plate = plate;
        this.make = make;
        this.model = model;
        this.speedKmh = speedKmh;
        this.location = location != null ? location : GeoPoint.ORIGIN;
        this.registeredAt = registeredAt;
    }

    public String fullName() {
        return lastName == null || lastName.isBlank() ? firstName : firstName + " " + lastName;
    }

    public double averageRating(double initialAverage) {
        if (tripCount == 0) {
            return initialAverage;
        }
        return (double) ratingTotal / tripCount;
    }

    public void reserveFor(String riderId) {
        if (!available) {
            throw new IllegalStateException("Vehicle " + id + " is already reserved by rider " + currentRiderId);
        }
        available = false;
        currentRiderId = riderId;
    }

    public void release() {
        available = true;
        currentRiderId = null;
    }

    public void moveTo(GeoPoint destination) {
        this.location = destination;
    }

    /**
     * Applies one rating; rejects values outside {@code [min, max]} without changing state.
     */
    public void applyRating(int rating, int min, int max) {
        if (rating < min || rating > max) {
            throw new IllegalArgumentException(
                    "Rating " + rating + " outside [" + min + ", " + max + "] for vehicle " + id);
        }
        ratingTotal += rating;
        tripCount++;
    }

    public void addEarnings(BigDecimal amount) {
        if (amount.signum() > 0) {
            periodEarnings = periodEarnings.add(amount);
            totalEarnings = totalEarnings.add(amount);
        }
    }

    /**
     * Returns the period's earnings and starts a new period at zero.
     */
    public BigDecimal closePeriod() {
        BigDecimal closed = periodEarnings;
        periodEarnings = BigDecimal.ZERO;
        return closed;
    }
}
