package com.taxidispatch.dispatch.service;

import com.taxidispatch.dispatch.entity.Rider;
import com.taxidispatch.dispatch.entity.Vehicle;
import com.taxidispatch.dispatch.metrics.DispatchMetrics;
import com.taxidispatch.dispatch.model.DispatchOutcome;
import com.taxidispatch.dispatch.model.TripOutcome;
import com.taxidispatch.dispatch.repository.EntityStore;
import com.taxidispatch.shared.geo.GeoPoint;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DispatchServiceTest {

    @Mock private MatchingEngine matchingEngine;
    @Mock private TripExecutionPipeline pipeline;
    @Mock private EntityStore store;

    private SimpleMeterRegistry registry;
    private DispatchService service;
    private Rider rider;
    private Vehicle vehicle;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        service = new DispatchService(matchingEngine, pipeline, store, new DispatchMetrics(registry));
        rider = Rider.builder().id("CLI-00001").firstName("Juan").lastName("Perez").card("4532123456789012").build();
        rider.relocate(GeoPoint.of(40.41, -3.70), GeoPoint.of(40.42, -3.69));
        vehicle = Vehicle.builder().id(7).driverIdentity("DRV-00007").firstName("Luis").lastName("Navarro")
                .plate("3456CDE").speedKmh(65).location(GeoPoint.of(40.41, -3.70)).build();
    }

    @Test
    @DisplayName("No vehicle: NO_VEHICLE outcome, no boarding, no execution, counted")
    void noVehicle() {
        when(matchingEngine.findAndReserve(rider.getLocation(), "CLI-00001")).thenReturn(Optional.empty());

        DispatchOutcome outcome = service.requestTrip(rider);

        assertThat(outcome.result()).isEqualTo(DispatchOutcome.Result.NO_VEHICLE);
        assertThat(outcome.vehicleId()).isNull();
        verify(store, never()).boardRider(any(), anyLong());
        verify(pipeline, never()).execute(any(), any());
        assertThat(registry.get("dispatch.trip.requests").tag("outcome", "no_vehicle").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("dispatch.match.latency").timer().count()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Matched: rider boards the reserved vehicle and the pipeline outcome is returned")
    void matchedAndExecuted() {
        when(matchingEngine.findAndReserve(rider.getLocation(), "CLI-00001")).thenReturn(Optional.of(vehicle));
        when(pipeline.execute(rider, vehicle)).thenReturn(TripOutcome.completed(null));

        DispatchOutcome outcome = service.requestTrip(rider);

        assertThat(outcome.result()).isEqualTo(DispatchOutcome.Result.COMPLETED);
        assertThat(outcome.vehicleId()).isEqualTo(7L);
        verify(store).boardRider(rider, 7L);
        assertThat(registry.get("dispatch.trip.requests").tag("outcome", "matched").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Failed pipeline outcome maps to FAILED")
    void pipelineFailure() {
        when(matchingEngine.findAndReserve(rider.getLocation(), "CLI-00001")).thenReturn(Optional.of(vehicle));
        when(pipeline.execute(rider, vehicle)).thenReturn(TripOutcome.failed(null, "boom"));

        assertThat(service.requestTrip(rider).result()).isEqualTo(DispatchOutcome.Result.FAILED);
    }

    @Test
    @DisplayName("Boarding failure releases the reserved vehicle and propagates")
    void boardingFailureReleasesVehicle() {
        when(matchingEngine.findAndReserve(rider.getLocation(), "CLI-00001")).thenReturn(Optional.of(vehicle));
        doThrow(new IllegalStateException("already in trip")).when(store).boardRider(eq(rider), anyLong());

        assertThatThrownBy(() -> service.requestTrip(rider)).isInstanceOf(IllegalStateException.class);

        verify(store).releaseVehicle(vehicle);
        verify(pipeline, never()).execute(any(), any());
    }
}
