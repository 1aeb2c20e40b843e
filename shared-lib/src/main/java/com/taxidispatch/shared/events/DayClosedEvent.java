package com.taxidispatch.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DayClosedEvent {

    private int day;
    private int trackedTrips;
    private BigDecimal operatorCommission;
    private BigDecimal operatorTotal;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant closedAt;
}
