package com.taxidispatch.dispatch.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.taxidispatch.dispatch.DispatchFixture;
import com.taxidispatch.dispatch.entity.Rider;
import com.taxidispatch.dispatch.config.DispatchProperties;
import com.taxidispatch.dispatch.service.TransitPacer;
import com.taxidispatch.shared.events.TripCompletedEvent;
import com.taxidispatch.shared.events.TripStartedEvent;
import com.taxidispatch.shared.geo.GeoPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class SnapshotExporterTest {

    @TempDir
    Path exportDir;

    private DispatchFixture fixture;
    private SnapshotExporter exporter;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        fixture = new DispatchFixture();
        exporter = exporterFor(fixture);
    }

    private SnapshotExporter exporterFor(DispatchFixture fixture) {
        fixture.properties.getExport().setEnabled(true);
        fixture.properties.getExport().setDirectory(exportDir.toString());
        SnapshotService snapshots = new SnapshotService(fixture.store, fixture.lifecycle, fixture.properties,
                DispatchFixture.CLOCK);
        fixture.addVehicle("DRV-00001", "1111AAA", 0.0, 0.0);
        fixture.addRider("CLI-00001");
        return new SnapshotExporter(snapshots, fixture.reports, fixture.properties, objectMapper);
    }

    private void completeOneTrip() throws Exception {
        fixture.lifecycle.openDay();
        Rider rider = fixture.store.findRider("CLI-00001").orElseThrow();
        fixture.store.relocateRider(rider, GeoPoint.ORIGIN, GeoPoint.of(3.0, 4.0));
        fixture.lifecycle.activateTrip();
        fixture.dispatch.requestTrip(rider);
        fixture.lifecycle.deactivateTrip();
        fixture.lifecycle.closeDay();
    }

    @Test
    @DisplayName("exportAll writes ledger, snapshot and daily reports as JSON")
    void exportAllWritesFiles() throws Exception {
        completeOneTrip();

        assertThat(exporter.exportAll()).isTrue();

        JsonNode trips = objectMapper.readTree(exportDir.resolve(SnapshotExporter.TRIPS_FILE).toFile());
        assertThat(trips).hasSize(1);
        assertThat(trips.get(0).get("fare").decimalValue()).isEqualByComparingTo("12.50");
        assertThat(trips.get(0).get("commission").decimalValue()).isEqualByComparingTo("2.50");
        assertThat(trips.get(0).get("driverShare").decimalValue()).isEqualByComparingTo("10.00");
        assertThat(trips.get(0).get("completedAt").asText()).isEqualTo("2024-05-01T08:00:00Z");

        JsonNode snapshot = objectMapper.readTree(exportDir.resolve(SnapshotExporter.SNAPSHOT_FILE).toFile());
        assertThat(snapshot.get("vehicles")).hasSize(1);
        assertThat(snapshot.get("vehicles").get(0).get("lat").asDouble()).isEqualTo(3.0);
        assertThat(snapshot.get("riders")).isEmpty();

        JsonNode reports = objectMapper.readTree(exportDir.resolve(SnapshotExporter.REPORTS_FILE).toFile());
        assertThat(reports).hasSize(1);
        assertThat(reports.get(0).get("trackedTrips")).hasSize(1);
        assertThat(Files.list(exportDir)).noneMatch(p -> p.toString().endsWith(".tmp"));
    }

    @Test
    @DisplayName("Scheduled flush writes only after an event marked the export dirty")
    void flushOnlyWhenDirty() {
        exporter.flush();
        assertThat(exportDir.resolve(SnapshotExporter.SNAPSHOT_FILE)).doesNotExist();

        exporter.onTripCompleted(TripCompletedEvent.builder().tripId(1).build());
        assertThat(exporter.isDirty()).isTrue();
        exporter.flush();

        assertThat(exportDir.resolve(SnapshotExporter.SNAPSHOT_FILE)).exists();
        assertThat(exporter.isDirty()).isFalse();
    }

    @Test
    @DisplayName("A trip in transit marks the export dirty and the flushed snapshot shows the reservation")
    void tripInTransitRefreshesSnapshot() throws Exception {
        AtomicReference<SnapshotExporter> inTransit = new AtomicReference<>();
        AtomicReference<Boolean> dirtyDuringTransit = new AtomicReference<>();
        AtomicReference<DispatchFixture> holder = new AtomicReference<>();
        TransitPacer pacer = duration -> {
            SnapshotExporter listener = inTransit.get();
            for (Object event : holder.get().events) {
                if (event instanceof TripStartedEvent) {
                    listener.onTripStarted((TripStartedEvent) event);
                }
            }
            dirtyDuringTransit.set(listener.isDirty());
            listener.flush();
        };
        DispatchFixture transitFixture = new DispatchFixture(new DispatchProperties(), pacer);
        holder.set(transitFixture);
        inTransit.set(exporterFor(transitFixture));

        transitFixture.lifecycle.openDay();
        Rider rider = transitFixture.store.findRider("CLI-00001").orElseThrow();
        transitFixture.store.relocateRider(rider, GeoPoint.ORIGIN, GeoPoint.of(3.0, 4.0));
        transitFixture.lifecycle.activateTrip();
        transitFixture.dispatch.requestTrip(rider);
        transitFixture.lifecycle.deactivateTrip();

        assertThat(dirtyDuringTransit.get()).isTrue();
        JsonNode snapshot = objectMapper.readTree(exportDir.resolve(SnapshotExporter.SNAPSHOT_FILE).toFile());
        assertThat(snapshot.get("vehicles").get(0).get("available").asBoolean()).isFalse();
        assertThat(snapshot.get("vehicles").get(0).get("currentRiderId").asText()).isEqualTo("CLI-00001");
        assertThat(snapshot.get("riders")).hasSize(1);
        assertThat(snapshot.get("riders").get(0).get("assignedVehicleId").asLong()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Export disabled: nothing is written")
    void disabledExportWritesNothing() {
        fixture.properties.getExport().setEnabled(false);

        assertThat(exporter.exportAll()).isFalse();
        assertThat(exportDir.resolve(SnapshotExporter.TRIPS_FILE)).doesNotExist();
    }
}
