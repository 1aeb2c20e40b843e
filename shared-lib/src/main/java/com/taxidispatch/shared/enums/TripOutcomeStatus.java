package com.taxidispatch.shared.enums;

public enum TripOutcomeStatus {
    COMPLETED,
    FAILED
}
