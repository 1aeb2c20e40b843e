package com.taxidispatch.dispatch.model;

import java.util.List;

public record SimulationResult(List<DayCloseResult> days, FleetStatistics statistics) {
}
