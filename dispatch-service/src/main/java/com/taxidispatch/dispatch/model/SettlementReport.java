package com.taxidispatch.dispatch.model;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record SettlementReport(
        int day,
        List<VehicleSettlement> vehicles,
        BigDecimal gross,
        BigDecimal commission,
        BigDecimal net,
        BigDecimal operatorTotal,
        @JsonFormat(shape = JsonFormat.Shape.STRING) Instant settledAt) {
}
