package com.taxidispatch.dispatch.service;

import com.taxidispatch.dispatch.entity.Rider;
import com.taxidispatch.dispatch.entity.Vehicle;
import com.taxidispatch.dispatch.metrics.DispatchMetrics;
import com.taxidispatch.dispatch.model.DispatchOutcome;
import com.taxidispatch.dispatch.model.TripOutcome;
import com.taxidispatch.dispatch.repository.EntityStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for one trip request.
 *
 * Dispatch flow:
 *  1. Find and reserve the nearest available vehicle (timed)
 *  2. No vehicle -> NO_VEHICLE, nothing else changes
 *  3. Board the rider onto the reserved vehicle
 *  4. Execute the trip; the pipeline releases vehicle and rider when it returns
 *
 * Callers are expected to hold an admission from {@code DayLifecycleController.activateTrip()}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DispatchService {

    private final MatchingEngine matchingEngine;
    private final TripExecutionPipeline pipeline;
    private final EntityStore store;
    private final DispatchMetrics metrics;

    public DispatchOutcome requestTrip(Rider rider) {
        long matchStart = System.nanoTime();
        Optional<Vehicle> reserved = matchingEngine.findAndReserve(rider.getLocation(), rider.getId());
        metrics.getMatchLatencyTimer().record(System.nanoTime() - matchStart, TimeUnit.NANOSECONDS);

        if (reserved.isEmpty()) {
            metrics.recordNoVehicle();
            log.debug("No vehicle available for rider {} at {}", rider.getId(), rider.getLocation());
            return DispatchOutcome.noVehicle();
        }

        Vehicle vehicle = reserved.get();
        metrics.recordMatched();
        try {
            store.boardRider(rider, vehicle.getId());
        } catch (RuntimeException e) {
            store.releaseVehicle(vehicle);
            throw e;
        }

        TripOutcome outcome = pipeline.execute(rider, vehicle);
        return DispatchOutcome.of(vehicle.getId(), outcome);
    }
}
