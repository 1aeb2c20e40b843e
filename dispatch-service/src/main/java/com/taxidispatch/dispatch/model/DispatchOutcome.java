package com.taxidispatch.dispatch.model;

/**
 * What happened to a single trip request.
 */
public record DispatchOutcome(Result result, Long vehicleId, TripOutcome tripOutcome) {

    public enum Result {
        /** A vehicle was reserved and the trip ran to completion. */
        COMPLETED,
        /** A vehicle was reserved but the trip failed; the reservation was released. */
        FAILED,
        /** No available vehicle inside the search radius. */
        NO_VEHICLE
    }

    public static DispatchOutcome noVehicle() {
        return new DispatchOutcome(Result.NO_VEHICLE, null, null);
    }

    public static DispatchOutcome of(long vehicleId, TripOutcome outcome) {
        return new DispatchOutcome(outcome.isCompleted() ? Result.COMPLETED : Result.FAILED, vehicleId, outcome);
    }
}
