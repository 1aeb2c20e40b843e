package com.taxidispatch.dispatch.service;

import com.taxidispatch.dispatch.config.DispatchProperties;
import com.taxidispatch.dispatch.entity.Trip;
import com.taxidispatch.dispatch.entity.Vehicle;
import com.taxidispatch.dispatch.model.DailyReport;
import com.taxidispatch.dispatch.model.FleetStatistics;
import com.taxidispatch.dispatch.model.SettlementReport;
import com.taxidispatch.dispatch.model.TripRecord;
import com.taxidispatch.dispatch.model.VehicleSummary;
import com.taxidispatch.dispatch.repository.EntityStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Daily tracked-sample reports and end-of-run fleet statistics.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportService {

    private final EntityStore store;
    private final SettlementService settlementService;
    private final DispatchProperties properties;
    private final Clock clock;

    private final List<DailyReport> history = new CopyOnWriteArrayList<>();

    public DailyReport recordDay(int day, List<Trip> trackedSample, SettlementReport settlement) {
        List<TripRecord> tracked = trackedSample.stream()
                .sorted(Comparator.comparingLong(Trip::getId))
                .map(this::toRecord)
                .toList();

        for (TripRecord trip : tracked) {
            log.info("Day {} tracked trip {}: vehicle={} rider={} {} -> {} fare={} rating={}",
                    day, trip.id(), trip.vehicleId(), trip.riderId(), trip.origin(), trip.destination(),
                    trip.fare(), trip.rating());
        }

        BigDecimal trackedFares = tracked.stream().map(TripRecord::fare).reduce(BigDecimal.ZERO, BigDecimal::add);
        double averageRating = tracked.stream().mapToInt(TripRecord::rating).average().orElse(0.0);
        log.info("Day {} tracked sample: trips={} fares={} avgRating={}",
                day, tracked.size(), trackedFares, averageRating);

        DailyReport report = new DailyReport(day, tracked, tracked.size(), trackedFares, averageRating,
                settlement, Instant.now(clock));
        history.add(report);
        return report;
    }

    public List<DailyReport> history() {
        return List.copyOf(history);
    }

    public List<TripRecord> ledger() {
        return store.completedTrips().stream().map(this::toRecord).toList();
    }

    public TripRecord toRecord(Trip trip) {
        return TripRecord.of(trip,
                settlementService.commissionOf(trip.getFare()),
                settlementService.netOf(trip.getFare()));
    }

    public FleetStatistics finalStatistics() {
        List<Trip> trips = store.completedTrips();
        double initialRating = properties.getRating().getInitial();

        List<VehicleSummary> vehicles = store.withVehicles(all -> {
            List<VehicleSummary> summaries = new ArrayList<>(all.size());
            for (Vehicle vehicle : all) {
                summaries.add(summarize(vehicle, initialRating));
            }
            return summaries;
        });

        Map<Integer, Long> tripsPerDay = trips.stream()
                .collect(Collectors.groupingBy(Trip::getDay, TreeMap::new, Collectors.counting()));
        BigDecimal totalFares = trips.stream().map(Trip::getFare).reduce(BigDecimal.ZERO, BigDecimal::add);
        int activeVehicles = (int) vehicles.stream().filter(v -> v.trips() > 0).count();
        int ridersServed = (int) trips.stream().map(Trip::getRiderId).distinct().count();

        FleetStatistics statistics = FleetStatistics.builder()
                .daysClosed(history.size())
                .totalTrips(trips.size())
                .tripsPerDay(tripsPerDay)
                .totalFares(totalFares)
                .averageFare(average(totalFares, trips.size()))
                .operatorTotal(settlementService.operatorTotal())
                .bestRated(best(vehicles.stream().filter(v -> v.trips() > 0).toList(), VehicleSummary::averageRating))
                .mostTrips(best(vehicles, VehicleSummary::trips))
                .topEarner(best(vehicles, VehicleSummary::totalEarnings))
                .activeVehicles(activeVehicles)
                .idleVehicles(vehicles.size() - activeVehicles)
                .ridersServed(ridersServed)
                .vehicles(List.copyOf(vehicles))
                .generatedAt(Instant.now(clock))
                .build();

        log.info("Fleet statistics: days={} trips={} fares={} avgFare={} operatorTotal={} active={} idle={} riders={}",
                statistics.daysClosed(), statistics.totalTrips(), totalFares, statistics.averageFare(),
                statistics.operatorTotal(), activeVehicles, statistics.idleVehicles(), ridersServed);
        return statistics;
    }

    private VehicleSummary summarize(Vehicle vehicle, double initialRating) {
        BigDecimal earnings = vehicle.getTotalEarnings();
        return new VehicleSummary(
                vehicle.getId(),
                vehicle.fullName(),
                vehicle.getPlate(),
                vehicle.getTripCount(),
                vehicle.averageRating(initialRating),
                earnings,
                settlementService.commissionOf(earnings),
                settlementService.netOf(earnings),
                average(earnings, vehicle.getTripCount()));
    }

    private static BigDecimal average(BigDecimal total, int count) {
        if (count == 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return total.divide(BigDecimal.valueOf(count), 2, RoundingMode.HALF_UP);
    }

    /** First vehicle with the highest key; ties keep the lower vehicle id. */
    private static <K extends Comparable<? super K>> VehicleSummary best(
            List<VehicleSummary> vehicles, Function<VehicleSummary, K> key) {
        VehicleSummary best = null;
        for (VehicleSummary vehicle : vehicles) {
            if (best == null || key.apply(vehicle).compareTo(key.apply(best)) > 0) {
                best = vehicle;
            }
        }
        return best;
    }
}
