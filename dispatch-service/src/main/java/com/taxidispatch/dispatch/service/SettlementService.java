package com.taxidispatch.dispatch.service;

import com.taxidispatch.dispatch.config.DispatchProperties;
import com.taxidispatch.dispatch.entity.Vehicle;
import com.taxidispatch.dispatch.metrics.DispatchMetrics;
import com.taxidispatch.dispatch.model.SettlementReport;
import com.taxidispatch.dispatch.model.VehicleSettlement;
import com.taxidispatch.dispatch.repository.EntityStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Day-close commission split.
 *
 * For every vehicle: commission = periodEarnings * commissionFraction (cents, half-up),
 * net = periodEarnings - commission. Period earnings restart at zero afterwards; the
 * commission is added to the operator's running total.
 *
 * Only called by the lifecycle controller once the day has drained.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettlementService {

    private final EntityStore store;
    private final DispatchProperties properties;
    private final DispatchMetrics metrics;
    private final Clock clock;

    private final AtomicReference<BigDecimal> operatorTotal = new AtomicReference<>(BigDecimal.ZERO);

    public SettlementReport settle(int day) {
        double initialRating = properties.getRating().getInitial();

        List<VehicleSettlement> lines = store.withVehicles(vehicles -> {
            List<VehicleSettlement> result = new ArrayList<>(vehicles.size());
            for (Vehicle vehicle : vehicles) {
                BigDecimal gross = vehicle.closePeriod();
                result.add(new VehicleSettlement(
                        vehicle.getId(),
                        vehicle.fullName(),
                        vehicle.getPlate(),
                        vehicle.getTripCount(),
                        vehicle.averageRating(initialRating),
                        gross,
                        commissionOf(gross),
                        netOf(gross)));
            }
            return result;
        });

        BigDecimal gross = BigDecimal.ZERO;
        BigDecimal commission = BigDecimal.ZERO;
        for (VehicleSettlement line : lines) {
            gross = gross.add(line.gross());
            commission = commission.add(line.commission());
            if (line.gross().signum() > 0) {
                log.info("Settlement day {}: vehicle {} ({}) gross={} commission={} net={}",
                        day, line.vehicleId(), line.driverName(), line.gross(), line.commission(), line.net());
            }
        }
        BigDecimal total = operatorTotal.accumulateAndGet(commission, BigDecimal::add);
        metrics.updateOperatorTotal(total);

        log.info("Settlement day {} done: vehicles={} gross={} commission={} operatorTotal={}",
                day, lines.size(), gross, commission, total);
        return new SettlementReport(day, List.copyOf(lines), gross, commission,
                gross.subtract(commission), total, Instant.now(clock));
    }

    public BigDecimal commissionOf(BigDecimal amount) {
        return amount.multiply(properties.getCommissionFraction()).setScale(2, RoundingMode.HALF_UP);
    }

    public BigDecimal netOf(BigDecimal amount) {
        return amount.subtract(commissionOf(amount));
    }

    public BigDecimal operatorTotal() {
        return operatorTotal.get();
    }
}
