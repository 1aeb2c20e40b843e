package com.taxidispatch.dispatch.model;

import com.taxidispatch.dispatch.entity.Trip;
import com.taxidispatch.shared.enums.TripOutcomeStatus;

/**
 * Result of executing one trip. {@code trip} is null only when the pipeline failed
 * before a trip record was created.
 */
public record TripOutcome(TripOutcomeStatus status, Trip trip, String failureReason) {

    public static TripOutcome completed(Trip trip) {
        return new TripOutcome(TripOutcomeStatus.COMPLETED, trip, null);
    }

    public static TripOutcome failed(Trip trip, String reason) {
        return new TripOutcome(TripOutcomeStatus.FAILED, trip, reason);
    }

    public boolean isCompleted() {
        return status == TripOutcomeStatus.COMPLETED;
    }
}
