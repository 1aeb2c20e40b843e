package com.taxidispatch.dispatch.simulation;

import com.taxidispatch.dispatch.config.DispatchProperties;
import com.taxidispatch.dispatch.entity.Rider;
import com.taxidispatch.dispatch.model.DispatchOutcome;
import com.taxidispatch.dispatch.repository.EntityStore;
import com.taxidispatch.dispatch.service.DayLifecycleController;
import com.taxidispatch.dispatch.service.DispatchService;
import com.taxidispatch.dispatch.service.RandomSource;
import com.taxidispatch.dispatch.service.TransitPacer;
import com.taxidispatch.shared.geo.GeoPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * One rider's activity for one day: a handful of sequential trip requests with random
 * pauses in between. Stops early as soon as the day stops admitting trips.
 *
 * Every admitted request is matched by exactly one {@code deactivateTrip()}.
 * The result is the number of trips completed.
 */
@Slf4j
@RequiredArgsConstructor
public class RiderActor implements Callable<Integer> {

    private final Rider rider;
    private final DispatchService dispatchService;
    private final DayLifecycleController lifecycle;
    private final EntityStore store;
    private final RandomSource random;
    private final TransitPacer pacer;
    private final DispatchProperties.Simulation settings;

    @Override
    public Integer call() {
        int requests = random.nextInt(settings.getMinRequestsPerRider(), settings.getMaxRequestsPerRider());
        int completed = 0;

        for (int i = 0; i < requests; i++) {
            if (!lifecycle.activateTrip()) {
                log.debug("Rider {} stops after {} request(s): day is closing", rider.getId(), i);
                break;
            }
            try {
                store.relocateRider(rider, randomPoint(), randomPoint());
                DispatchOutcome outcome = dispatchService.requestTrip(rider);
                if (outcome.result() == DispatchOutcome.Result.COMPLETED) {
                    completed++;
                }
            } catch (RuntimeException e) {
                log.error("Request by rider {} failed: {}", rider.getId(), e.getMessage(), e);
            } finally {
                lifecycle.deactivateTrip();
            }

            try {
                pacer.pause(Duration.ofMillis(random.nextInt(settings.getMinDelayMs(), settings.getMaxDelayMs())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Rider {} interrupted", rider.getId());
                break;
            }
        }
        return completed;
    }

    private GeoPoint randomPoint() {
        DispatchProperties.Area area = settings.getArea();
        return GeoPoint.of(
                random.nextDouble(area.getMinLat(), area.getMaxLat()),
                random.nextDouble(area.getMinLng(), area.getMaxLng()));
    }
}
