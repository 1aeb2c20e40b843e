package com.taxidispatch.dispatch.service;

import com.taxidispatch.dispatch.config.DispatchProperties;
import com.taxidispatch.dispatch.entity.Vehicle;
import com.taxidispatch.dispatch.repository.EntityStore;
import com.taxidispatch.shared.geo.GeoPoint;
import com.taxidispatch.shared.util.PlanarDistance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Nearest-available-vehicle search with atomic reservation.
 *
 * Selection: the available vehicle with the smallest planar distance strictly below the
 * search radius; on an exact distance tie the higher average rating wins, otherwise the
 * first one scanned is kept.
 *
 * Lock order: match lock, then the store's vehicle lock. The scan and the reservation
 * happen in one critical section, so two riders can never reserve the same vehicle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MatchingEngine {

    private final EntityStore store;
    private final DispatchProperties properties;
    private final ReentrantLock matchLock = new ReentrantLock();

    public Optional<Vehicle> findAndReserve(GeoPoint origin, String riderId) {
        return findAndReserve(origin, properties.getSearchRadiusKm(), riderId);
    }

    public Optional<Vehicle> findAndReserve(GeoPoint origin, double searchRadiusKm, String riderId) {
        matchLock.lock();
        try {
            return store.withVehicles(vehicles -> {
                Vehicle best = selectNearest(vehicles, origin, searchRadiusKm);
                if (best == null) {
                    log.debug("No vehicle within {}km of {} for rider {}", searchRadiusKm, origin, riderId);
                    return Optional.<Vehicle>empty();
                }
                best.reserveFor(riderId);
                log.info("Vehicle {} ({}) reserved for rider {} at {}",
                        best.getId(), best.getPlate(), riderId, best.getLocation());
                return Optional.of(best);
            });
        } finally {
            matchLock.unlock();
        }
    }

    private Vehicle selectNearest(Collection<Vehicle> vehicles, GeoPoint origin, double searchRadiusKm) {
        double initialRating = properties.getRating().getInitial();
        Vehicle best = null;
        double bestDistance = searchRadiusKm;

        for (Vehicle vehicle : vehicles) {
            if (!vehicle.isAvailable()) {
                continue;
            }
            double distance = PlanarDistance.between(origin, vehicle.getLocation());
            if (distance < bestDistance) {
                best = vehicle;
                bestDistance = distance;
            } else if (best != null && distance == bestDistance
                    && vehicle.averageRating(initialRating) > best.averageRating(initialRating)) {
                best = vehicle;
            }
        }
        return best;
    }
}
