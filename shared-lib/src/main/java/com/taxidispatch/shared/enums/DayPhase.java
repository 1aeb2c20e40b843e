package com.taxidispatch.shared.enums;

public enum DayPhase {
    IDLE,
    OPEN,
    DRAINING,
    CLOSED,
    FINISHED
}
