package com.taxidispatch.dispatch.model;

import com.taxidispatch.shared.enums.DayPhase;

public record LifecycleStatus(DayPhase phase, int currentDay, int activeTrips) {
}
