package com.taxidispatch.dispatch.entity;

import com.taxidispatch.shared.geo.GeoPoint;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * A rider affiliated to the operator. {@code inTrip} is true exactly when
 * {@code assignedVehicleId} is set; both change together under the store's rider lock.
 */
@Getter
@ToString(of = {"id", "firstName", "lastName", "inTrip"})
@EqualsAndHashCode(of = "id")
public class Rider {

    private final String id;
    private final String firstName;
    private final String lastName;
    private final String card;
    private final Instant registeredAt;

    private GeoPoint location = GeoPoint.ORIGIN;
    private GeoPoint destination = GeoPoint.ORIGIN;
    private Long assignedVehicleId;
    private boolean inTrip;

    @Builder
    public Rider(String id, String firstName, String lastName, String card, Instant registeredAt) {
        this.id = id;
        this.firstName = firstName;
        this.lastName = lastName;
        this.card = card;
        this.registeredAt = registeredAt;
    }

    public String fullName() {
        return lastName == null || lastName.isBlank() ? firstName : firstName + " " + lastName;
    }

    public String maskedCard() {
        return "**** **** **** " + card.substring(card.length() - 4);
    }

    public void relocate(GeoPoint origin, GeoPoint target) {
        this.location = origin;
        this.destination = target;
    }

    public void board(long vehicleId) {
        if (inTrip) {
            throw new IllegalStateException("Rider " + id + " is already in trip with vehicle " + assignedVehicleId);
        }
        assignedVehicleId = vehicleId;
        inTrip = true;
    }

    public void alight() {
        assignedVehicleId = null;
        inTrip = false;
    }
}
