package com.taxidispatch.dispatch.repository;

import com.taxidispatch.dispatch.config.DispatchProperties;
import com.taxidispatch.dispatch.config.FleetProperties;
import com.taxidispatch.dispatch.entity.Rider;
import com.taxidispatch.dispatch.entity.Trip;
import com.taxidispatch.dispatch.entity.Vehicle;
import com.taxidispatch.dispatch.metrics.DispatchMetrics;
import com.taxidispatch.dispatch.model.AffiliationResult;
import com.taxidispatch.dispatch.model.RiderRegistration;
import com.taxidispatch.dispatch.model.VehicleRegistration;
import com.taxidispatch.dispatch.service.RandomSource;
import com.taxidispatch.shared.geo.GeoPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * In-memory owner of vehicles, riders, the completed-trip ledger and the daily tracking sample.
 *
 * Every collection has its own lock:
 *  - vehicleLock   vehicle map and all vehicle mutation (reserve, complete, release, settle)
 *  - riderLock     rider map and boarding / relocation / release
 *  - ledgerLock    completed trips
 *  - trackingLock  the current day's tracked sample
 *  - tripIdLock    trip id sequence
 *
 * No method holds two of these at once. The only nested acquisition in the system is the
 * matching engine's match lock taken around {@link #withVehicles}.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class EntityStore {

    private static final Pattern IDENTITY_CHARS = Pattern.compile("[A-Za-z0-9-]+");
    private static final Pattern CARD_SEPARATORS = Pattern.compile("[\\s-]");

    private final DispatchProperties properties;
    private final FleetProperties fleet;
    private final RandomSource random;
    private final Clock clock;
    private final DispatchMetrics metrics;

    private final ReentrantLock vehicleLock = new ReentrantLock();
    private final ReentrantLock riderLock = new ReentrantLock();
    private final ReentrantLock ledgerLock = new ReentrantLock();
    private final ReentrantLock trackingLock = new ReentrantLock();
    private final ReentrantLock tripIdLock = new ReentrantLock();

    private final Map<Long, Vehicle> vehicles = new LinkedHashMap<>();
    private final Map<String, Rider> riders = new LinkedHashMap<>();
    private final List<Trip> completedTrips = new ArrayList<>();
    private final List<Trip> trackingSample = new ArrayList<>();
    private long lastTripId;

    // ── Affiliation ─────────────────────────────────────────────────────────

    public AffiliationResult affiliateVehicle(VehicleRegistration reg) {
        DispatchProperties.Validation rules = properties.getValidation();

        String nameError = checkName(reg.getFirstName(), reg.getLastName());
        if (nameError != null) {
            return reject("vehicle", nameError);
        }
        String identity = trim(reg.getDriverIdentity());
        String identityError = checkIdentity(identity);
        if (identityError != null) {
            return reject("vehicle", identityError);
        }
        String plate = trim(reg.getPlate()).toUpperCase();
        if (plate.length() < rules.getPlateMinChars()) {
            return reject("vehicle", "Plate must have at least " + rules.getPlateMinChars() + " characters");
        }
        int speed = reg.getSpeedKmh() != null ? reg.getSpeedKmh() : properties.getDefaultSpeedKmh();
        if (speed <= 0) {
            return reject("vehicle", "Speed must be greater than 0 km/h");
        }
        GeoPoint location = reg.getLat() != null && reg.getLng() != null
                ? GeoPoint.of(reg.getLat(), reg.getLng())
                : drawStartingPoint();

        Vehicle vehicle;
        vehicleLock.lock();
        try {
            for (Vehicle existing : vehicles.values()) {
                if (existing.getPlate().equals(plate)) {
                    return reject("vehicle", "Plate " + plate + " is already registered");
                }
                if (existing.getDriverIdentity().equalsIgnoreCase(identity)) {
                    return reject("vehicle", "Driver " + identity + " is already registered");
                }
            }
            vehicle = Vehicle.builder()
                    .id(vehicles.size() + 1L)
                    .driverIdentity(identity)
                    .firstName(trim(reg.getFirstName()))
                    .lastName(trim(reg.getLastName()))
                    .plate(plate)
                    .make(reg.getMake())
                    .model(reg.getModel())
                    .speedKmh(speed)
                    .location(location)
                    .registeredAt(Instant.now(clock))
                    .build();
            vehicles.put(vehicle.getId(), vehicle);
        } finally {
            vehicleLock.unlock();
        }

        metrics.recordAffiliationAccepted();
        log.info("Vehicle {} affiliated: driver={} plate={} speed={}km/h at {}",
                vehicle.getId(), vehicle.fullName(), plate, speed, location);
        return AffiliationResult.accepted(String.valueOf(vehicle.getId()));
    }

    public AffiliationResult affiliateRider(RiderRegistration reg) {
        String nameError = checkName(reg.getFirstName(), reg.getLastName());
        if (nameError != null) {
            return reject("rider", nameError);
        }
        String identity = trim(reg.getIdentity());
        String identityError = checkIdentity(identity);
        if (identityError != null) {
            return reject("rider", identityError);
        }
        String card = CARD_SEPARATORS.matcher(trim(reg.getCard())).replaceAll("");
        int cardDigits = properties.getValidation().getCardDigits();
        if (card.length() != cardDigits || !card.chars().allMatch(Character::isDigit)) {
            return reject("rider", "Card must contain exactly " + cardDigits + " digits");
        }

        Rider rider = Rider.builder()
                .id(identity)
                .firstName(trim(reg.getFirstName()))
                .lastName(trim(reg.getLastName()))
                .card(card)
                .registeredAt(Instant.now(clock))
                .build();

        riderLock.lock();
        try {
            if (riders.containsKey(identity)) {
                return reject("rider", "Rider " + identity + " is already registered");
            }
            riders.put(identity, rider);
        } finally {
            riderLock.unlock();
        }

        metrics.recordAffiliationAccepted();
        log.info("Rider {} affiliated: {} card={}", identity, rider.fullName(), rider.maskedCard());
        return AffiliationResult.accepted(identity);
    }

    private String checkName(String firstName, String lastName) {
        String fullName = (trim(firstName) + " " + trim(lastName)).trim();
        if (trim(firstName).isEmpty() || fullName.length() < properties.getValidation().getNameMinChars()) {
            return "Name must have at least " + properties.getValidation().getNameMinChars() + " characters";
        }
        return null;
    }

    private String checkIdentity(String identity) {
        int min = properties.getValidation().getIdentityMinChars();
        if (identity.length() < min || !IDENTITY_CHARS.matcher(identity).matches()) {
            return "Identity must have at least " + min + " letters, digits or dashes";
        }
        return null;
    }

    private AffiliationResult reject(String kind, String reason) {
        metrics.recordAffiliationRejected();
        log.warn("Rejected {} affiliation: {}", kind, reason);
        return AffiliationResult.rejected(reason);
    }

    private GeoPoint drawStartingPoint() {
        List<FleetProperties.StartingPoint> points = fleet.getStartingPoints();
        if (points.isEmpty()) {
            return GeoPoint.ORIGIN;
        }
        return points.get(random.nextInt(0, points.size() - 1)).toGeoPoint();
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }

    // ── Vehicle access ──────────────────────────────────────────────────────

    /**
     * Runs {@code action} over the vehicle collection while holding the vehicle lock.
     * The collection view must not escape the callback.
     */
    public <T> T withVehicles(Function<Collection<Vehicle>, T> action) {
        vehicleLock.lock();
        try {
            return action.apply(Collections.unmodifiableCollection(vehicles.values()));
        } finally {
            vehicleLock.unlock();
        }
    }

    public Optional<Vehicle> findVehicle(long vehicleId) {
        vehicleLock.lock();
        try {
            return Optional.ofNullable(vehicles.get(vehicleId));
        } finally {
            vehicleLock.unlock();
        }
    }

    public int vehicleCount() {
        vehicleLock.lock();
        try {
            return vehicles.size();
        } finally {
            vehicleLock.unlock();
        }
    }

    /**
     * Applies a finished trip to its vehicle: rating (rejected outside the configured bounds,
     * leaving the vehicle untouched), new location, and earnings.
     */
    public void recordCompletion(Vehicle vehicle, GeoPoint destination, int rating, BigDecimal fare) {
        DispatchProperties.Rating bounds = properties.getRating();
        vehicleLock.lock();
        try {
            vehicle.applyRating(rating, bounds.getMin(), bounds.getMax());
            vehicle.moveTo(destination);
            vehicle.addEarnings(fare);
        } finally {
            vehicleLock.unlock();
        }
    }

    /**
     * Ends a reservation: vehicle available again, rider no longer in trip.
     * Locks are taken one after the other, never nested.
     */
    public void release(Vehicle vehicle, Rider rider) {
        releaseVehicle(vehicle);
        riderLock.lock();
        try {
            rider.alight();
        } finally {
            riderLock.unlock();
        }
    }

    public void releaseVehicle(Vehicle vehicle) {
        vehicleLock.lock();
        try {
            vehicle.release();
        } finally {
            vehicleLock.unlock();
        }
    }

    // ── Rider access ────────────────────────────────────────────────────────

    public <T> T withRiders(Function<Collection<Rider>, T> action) {
        riderLock.lock();
        try {
            return action.apply(Collections.unmodifiableCollection(riders.values()));
        } finally {
            riderLock.unlock();
        }
    }

    public Optional<Rider> findRider(String riderId) {
        riderLock.lock();
        try {
            return Optional.ofNullable(riders.get(riderId));
        } finally {
            riderLock.unlock();
        }
    }

    public List<Rider> riders() {
        return withRiders(ArrayList::new);
    }

    public void relocateRider(Rider rider, GeoPoint origin, GeoPoint destination) {
        riderLock.lock();
        try {
            rider.relocate(origin, destination);
        } finally {
            riderLock.unlock();
        }
    }

    public void boardRider(Rider rider, long vehicleId) {
        riderLock.lock();
        try {
            rider.board(vehicleId);
        } finally {
            riderLock.unlock();
        }
    }

    // ── Trips ───────────────────────────────────────────────────────────────

    public long nextTripId() {
        tripIdLock.lock();
        try {
            return ++lastTripId;
        } finally {
            tripIdLock.unlock();
        }
    }

    /**
     * Marks the trip tracked and adds it to the day's sample if there is room left.
     */
    public boolean claimTrackingSlot(Trip trip) {
        trackingLock.lock();
        try {
            if (trackingSample.size() >= properties.getTrackingSampleSize()) {
                return false;
            }
            trip.markTracked();
            trackingSample.add(trip);
            return true;
        } finally {
            trackingLock.unlock();
        }
    }

    public List<Trip> trackingSample() {
        trackingLock.lock();
        try {
            return new ArrayList<>(trackingSample);
        } finally {
            trackingLock.unlock();
        }
    }

    /**
     * Returns the day's sample and empties it for the next day.
     */
    public List<Trip> drainTrackingSample() {
        trackingLock.lock();
        try {
            List<Trip> sample = new ArrayList<>(trackingSample);
            trackingSample.clear();
            return sample;
        } finally {
            trackingLock.unlock();
        }
    }

    public void appendCompleted(Trip trip) {
        ledgerLock.lock();
        try {
            completedTrips.add(trip);
        } finally {
            ledgerLock.unlock();
        }
    }

    public List<Trip> completedTrips() {
        ledgerLock.lock();
        try {
            return new ArrayList<>(completedTrips);
        } finally {
            ledgerLock.unlock();
        }
    }
}
