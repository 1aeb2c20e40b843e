package com.taxidispatch.dispatch.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntSupplier;

/**
 * Custom Micrometer metrics for the dispatch core.
 *
 * Metrics exposed at /actuator/prometheus:
 *
 *   dispatch_trip_requests_total{outcome="matched|no_vehicle"}
 *   dispatch_trips_total{status="completed|failed"}
 *   dispatch_affiliations_total{result="accepted|rejected"}
 *   dispatch_match_latency_seconds                       time spent in scan-and-reserve
 *   dispatch_trips_active                                trips admitted but not yet deactivated
 *   dispatch_settlement_operator_total                   cumulative operator commission
 */
@Component
public class DispatchMetrics {

    private final MeterRegistry registry;
    private final Counter matchedCounter;
    private final Counter noVehicleCounter;
    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Counter affiliationAcceptedCounter;
    private final Counter affiliationRejectedCounter;
    private final Timer   matchLatencyTimer;
    private final AtomicReference<BigDecimal> operatorTotal = new AtomicReference<>(BigDecimal.ZERO);

    public DispatchMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.matchedCounter = Counter.builder("dispatch.trip.requests")
                .tag("outcome", "matched")
                .description("Trip requests that reserved a vehicle")
                .register(registry);

        this.noVehicleCounter = Counter.builder("dispatch.trip.requests")
                .tag("outcome", "no_vehicle")
                .description("Trip requests with no available vehicle inside the search radius")
                .register(registry);

        this.completedCounter = Counter.builder("dispatch.trips")
                .tag("status", "completed")
                .description("Trips executed to completion")
                .register(registry);

        this.failedCounter = Counter.builder("dispatch.trips")
                .tag("status", "failed")
                .description("Trips aborted by a pipeline fault or interruption")
                .register(registry);

        this.affiliationAcceptedCounter = Counter.builder("dispatch.affiliations")
                .tag("result", "accepted")
                .description("Vehicle and rider affiliations accepted")
                .register(registry);

        this.affiliationRejectedCounter = Counter.builder("dispatch.affiliations")
                .tag("result", "rejected")
                .description("Vehicle and rider affiliations rejected by validation")
                .register(registry);

        this.matchLatencyTimer = Timer.builder("dispatch.match.latency")
                .description("Time spent scanning and reserving a vehicle")
                .publishPercentiles(0.5, 0.95, 0.99)
                .minimumExpectedValue(Duration.ofNanos(1_000))
                .maximumExpectedValue(Duration.ofMillis(100))
                .register(registry);

        Gauge.builder("dispatch.settlement.operator_total", operatorTotal, ref -> ref.get().doubleValue())
                .description("Cumulative commission retained by the operator")
                .register(registry);
    }

    /**
     * Binds the active-trip gauge to the lifecycle counter; called once by the lifecycle controller.
     */
    public void bindActiveTrips(IntSupplier activeTrips) {
        Gauge.builder("dispatch.trips.active", activeTrips, IntSupplier::getAsInt)
                .description("Trips admitted for the current day and not yet finished")
                .register(registry);
    }

    public void recordMatched()               { matchedCounter.increment(); }
    public void recordNoVehicle()             { noVehicleCounter.increment(); }
    public void recordTripCompleted()         { completedCounter.increment(); }
    public void recordTripFailed()            { failedCounter.increment(); }
    public void recordAffiliationAccepted()   { affiliationAcceptedCounter.increment(); }
    public void recordAffiliationRejected()   { affiliationRejectedCounter.increment(); }
    public void updateOperatorTotal(BigDecimal total) { operatorTotal.set(total); }
    public Timer getMatchLatencyTimer()       { return matchLatencyTimer; }
}
