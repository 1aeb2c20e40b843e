package com.taxidispatch.dispatch.service;

import com.taxidispatch.dispatch.config.DispatchProperties;
import com.taxidispatch.dispatch.entity.Rider;
import com.taxidispatch.dispatch.entity.Trip;
import com.taxidispatch.dispatch.entity.Vehicle;
import com.taxidispatch.dispatch.metrics.DispatchMetrics;
import com.taxidispatch.dispatch.model.TripOutcome;
import com.taxidispatch.dispatch.repository.EntityStore;
import com.taxidispatch.shared.events.TripCompletedEvent;
import com.taxidispatch.shared.events.TripStartedEvent;
import com.taxidispatch.shared.geo.GeoPoint;
import com.taxidispatch.shared.util.PlanarDistance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Runs one reserved trip from pickup to drop-off.
 *
 * Flow:
 *  1. Planar distance between the rider's location and destination
 *  2. Fare from the pricing policy
 *  3. Trip record with a fresh id, stamped with the current day; TripStartedEvent published
 *  4. Transit pause (distance / speed, scaled down by the acceleration factor)
 *  5. Rating draw; vehicle moves to the destination and accrues the fare
 *  6. Tracking sample slot, if the day still has room
 *  7. Trip completed, appended to the ledger, TripCompletedEvent published
 *
 * The reservation is always released, whatever happens in between.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TripExecutionPipeline {

    private static final double NANOS_PER_HOUR = 3_600_000_000_000.0;

    private final EntityStore store;
    private final FareCalculatorService fareCalculator;
    private final DayLifecycleController lifecycle;
    private final DispatchProperties properties;
    private final RandomSource random;
    private final TransitPacer pacer;
    private final ApplicationEventPublisher eventPublisher;
    private final DispatchMetrics metrics;
    private final Clock clock;

    public TripOutcome execute(Rider rider, Vehicle vehicle) {
        Trip trip = null;
        try {
            GeoPoint origin = rider.getLocation();
            GeoPoint destination = rider.getDestination();
            double distanceKm = PlanarDistance.between(origin, destination);
            BigDecimal fare = fareCalculator.calculate(distanceKm);

            trip = Trip.builder()
                    .id(store.nextTripId())
                    .vehicleId(vehicle.getId())
                    .riderId(rider.getId())
                    .origin(origin)
                    .destination(destination)
                    .distanceKm(distanceKm)
                    .fare(fare)
                    .day(lifecycle.currentDay())
                    .startedAt(Instant.now(clock))
                    .build();
            log.debug("Trip {} started: vehicle={} rider={} {} -> {} ({}km, {} simulated min)",
                    trip.getId(), vehicle.getId(), rider.getId(), origin, destination, distanceKm,
                    PlanarDistance.travelMinutes(distanceKm, vehicle.getSpeedKmh()));
            eventPublisher.publishEvent(TripStartedEvent.builder()
                    .tripId(trip.getId())
                    .vehicleId(trip.getVehicleId())
                    .riderId(trip.getRiderId())
                    .day(trip.getDay())
                    .distanceKm(distanceKm)
                    .fareAmount(fare)
                    .startedAt(trip.getStartedAt())
                    .build());

            pacer.pause(transitDuration(distanceKm, vehicle.getSpeedKmh()));

            DispatchProperties.TripRating range = properties.getTripRating();
            int rating = random.nextInt(range.getMin(), range.getMax());
            store.recordCompletion(vehicle, destination, rating, fare);
            store.claimTrackingSlot(trip);
            trip.complete(rating, Instant.now(clock));
            store.appendCompleted(trip);

            eventPublisher.publishEvent(TripCompletedEvent.builder()
                    .tripId(trip.getId())
                    .vehicleId(trip.getVehicleId())
                    .riderId(trip.getRiderId())
                    .day(trip.getDay())
                    .distanceKm(distanceKm)
                    .fareAmount(fare)
                    .rating(rating)
                    .tracked(trip.isTracked())
                    .completedAt(trip.getCompletedAt())
                    .build());

            metrics.recordTripCompleted();
            log.info("Trip {} completed: vehicle={} rider={} fare={} rating={}{}",
                    trip.getId(), vehicle.getId(), rider.getId(), fare, rating, trip.isTracked() ? " [tracked]" : "");
            return TripOutcome.completed(trip);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.recordTripFailed();
            log.warn("Trip {} interrupted in transit: vehicle={} rider={}",
                    trip != null ? trip.getId() : "-", vehicle.getId(), rider.getId());
            return TripOutcome.failed(trip, "Interrupted in transit");

        } catch (RuntimeException e) {
            metrics.recordTripFailed();
            log.error("Trip {} failed: vehicle={} rider={}: {}",
                    trip != null ? trip.getId() : "-", vehicle.getId(), rider.getId(), e.getMessage(), e);
            return TripOutcome.failed(trip, e.getMessage());

        } finally {
            store.release(vehicle, rider);
        }
    }

    /**
     * Real time spent in transit: travel hours at the vehicle's speed, divided by the acceleration factor.
     */
    Duration transitDuration(double distanceKm, int speedKmh) {
        if (speedKmh <= 0 || distanceKm <= 0) {
            return Duration.ZERO;
        }
        double nanos = distanceKm * NANOS_PER_HOUR / speedKmh / properties.getTransitAcceleration();
        return Duration.ofNanos(Math.round(nanos));
    }
}
