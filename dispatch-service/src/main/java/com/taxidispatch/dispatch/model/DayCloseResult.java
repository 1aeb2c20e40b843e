package com.taxidispatch.dispatch.model;

public record DayCloseResult(int day, DailyReport report, SettlementReport settlement) {
}
