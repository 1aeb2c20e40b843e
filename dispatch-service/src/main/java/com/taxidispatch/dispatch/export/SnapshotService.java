package com.taxidispatch.dispatch.export;

import com.taxidispatch.dispatch.config.DispatchProperties;
import com.taxidispatch.dispatch.entity.Rider;
import com.taxidispatch.dispatch.entity.Vehicle;
import com.taxidispatch.dispatch.model.LiveSnapshot;
import com.taxidispatch.dispatch.repository.EntityStore;
import com.taxidispatch.dispatch.service.DayLifecycleController;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@link LiveSnapshot}s from copies taken under the store's locks.
 * Two snapshots with no state change in between differ only in {@code generatedAt}.
 */
@Service
@RequiredArgsConstructor
public class SnapshotService {

    private final EntityStore store;
    private final DayLifecycleController lifecycle;
    private final DispatchProperties properties;
    private final Clock clock;

    public LiveSnapshot snapshot() {
        double initialRating = properties.getRating().getInitial();

        List<LiveSnapshot.VehicleView> vehicles = store.withVehicles(all -> {
            List<LiveSnapshot.VehicleView> views = new ArrayList<>(all.size());
            for (Vehicle v : all) {
                views.add(new LiveSnapshot.VehicleView(
                        v.getId(), v.fullName(), v.getPlate(), v.getMake(), v.getModel(),
                        v.getLocation().lat(), v.getLocation().lng(),
                        v.isAvailable(), v.getCurrentRiderId(),
                        v.averageRating(initialRating), v.getTripCount(),
                        v.getPeriodEarnings(), v.getTotalEarnings()));
            }
            return views;
        });

        List<LiveSnapshot.RiderView> riders = store.withRiders(all -> {
            List<LiveSnapshot.RiderView> views = new ArrayList<>();
            for (Rider r : all) {
                if (!r.isInTrip()) {
                    continue;
                }
                views.add(new LiveSnapshot.RiderView(
                        r.getId(), r.fullName(),
                        r.getLocation().lat(), r.getLocation().lng(),
                        r.getDestination().lat(), r.getDestination().lng(),
                        r.getAssignedVehicleId()));
            }
            return views;
        });

        return new LiveSnapshot(lifecycle.currentDay(), lifecycle.phase(),
                List.copyOf(vehicles), List.copyOf(riders), Instant.now(clock));
    }
}
