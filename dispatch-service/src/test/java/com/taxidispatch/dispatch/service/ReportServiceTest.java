package com.taxidispatch.dispatch.service;

import com.taxidispatch.dispatch.DispatchFixture;
import com.taxidispatch.dispatch.entity.Rider;
import com.taxidispatch.dispatch.model.DailyReport;
import com.taxidispatch.dispatch.model.FleetStatistics;
import com.taxidispatch.dispatch.model.TripRecord;
import com.taxidispatch.shared.geo.GeoPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReportServiceTest {

    private DispatchFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new DispatchFixture();
    }

    private void ride(String riderId, GeoPoint from, GeoPoint to, int rating) {
        Rider rider = fixture.store.findRider(riderId).orElseThrow();
        fixture.store.relocateRider(rider, from, to);
        fixture.random.thenInts(rating);
        assertThat(fixture.lifecycle.activateTrip()).isTrue();
        try {
            fixture.dispatch.requestTrip(rider);
        } finally {
            fixture.lifecycle.deactivateTrip();
        }
    }

    @Test
    @DisplayName("Ledger records carry commission and driver share")
    void ledgerCarriesSplit() {
        fixture.addVehicle("DRV-00001", "1111AAA", 0, 0);
        fixture.addRider("CLI-00001");
        fixture.lifecycle.openDay();
        ride("CLI-00001", GeoPoint.ORIGIN, GeoPoint.of(3.0, 4.0), 5);

        TripRecord record = fixture.reports.ledger().get(0);

        assertThat(record.fare()).isEqualByComparingTo("12.50");
        assertThat(record.commission()).isEqualByComparingTo("2.50");
        assertThat(record.driverShare()).isEqualByComparingTo("10.00");
        assertThat(record.completed()).isTrue();
        assertThat(record.tracked()).isTrue();
    }

    @Test
    @DisplayName("Daily report totals fares, count and average rating over the tracked sample only")
    void dailyReportAggregatesTrackedSample() {
        fixture.properties.setTrackingSampleSize(2);
        fixture.addVehicle("DRV-00001", "1111AAA", 0, 0);
        fixture.addRider("CLI-00001");
        fixture.lifecycle.openDay();
        ride("CLI-00001", GeoPoint.ORIGIN, GeoPoint.of(3.0, 4.0), 3);
        ride("CLI-00001", GeoPoint.of(3.0, 4.0), GeoPoint.of(3.0, 5.0), 4);
        ride("CLI-00001", GeoPoint.of(3.0, 5.0), GeoPoint.of(3.0, 9.0), 5);

        DailyReport report = fixture.reports.recordDay(1, fixture.store.drainTrackingSample(),
                fixture.settlement.settle(1));

        assertThat(report.trackedCount()).isEqualTo(2);
        assertThat(report.trackedFares()).isEqualByComparingTo("15.00");
        assertThat(report.trackedAverageRating()).isEqualTo(3.5);
        assertThat(report.settlement().gross()).isEqualByComparingTo("25.00");
    }

    @Test
    @DisplayName("Empty tracked sample: zero totals")
    void emptyDailyReport() {
        fixture.addVehicle("DRV-00001", "1111AAA", 0, 0);

        DailyReport report = fixture.reports.recordDay(1, List.of(), fixture.settlement.settle(1));

        assertThat(report.trackedCount()).isZero();
        assertThat(report.trackedFares()).isEqualByComparingTo("0");
        assertThat(report.trackedAverageRating()).isZero();
    }

    @Test
    @DisplayName("Final statistics: trips per day, average fare, best rated, busiest, top earner, idle vehicles")
    void finalStatistics() throws Exception {
        long first = fixture.addVehicle("DRV-00001", "1111AAA", 0.0, 0.0);
        long second = fixture.addVehicle("DRV-00002", "2222BBB", 1.5, 0.0);
        fixture.addVehicle("DRV-00003", "3333CCC", 50.0, 50.0);
        fixture.addRider("CLI-00001");
        fixture.addRider("CLI-00002");

        fixture.lifecycle.openDay();
        // vehicle 1: (0,0) -> (0,1), fare 2.50, rating 3
        ride("CLI-00001", GeoPoint.ORIGIN, GeoPoint.of(0.0, 1.0), 3);
        // vehicle 2 is nearest to (1.5, 0.1): fare 5.00, rating 5
        ride("CLI-00002", GeoPoint.of(1.5, 0.1), GeoPoint.of(1.5, 2.1), 5);
        fixture.lifecycle.closeDay();

        fixture.lifecycle.openDay();
        // vehicle 1 sits at (0,1): fare 2.50, rating 4
        ride("CLI-00001", GeoPoint.of(0.0, 1.0), GeoPoint.of(0.0, 2.0), 4);
        fixture.lifecycle.closeDay();

        FleetStatistics stats = fixture.lifecycle.finish();

        assertThat(stats.daysClosed()).isEqualTo(2);
        assertThat(stats.totalTrips()).isEqualTo(3);
        assertThat(stats.tripsPerDay()).containsEntry(1, 2L).containsEntry(2, 1L);
        assertThat(stats.totalFares()).isEqualByComparingTo("10.00");
        assertThat(stats.averageFare()).isEqualByComparingTo("3.33");
        assertThat(stats.operatorTotal()).isEqualByComparingTo("2.00");
        assertThat(stats.bestRated().vehicleId()).isEqualTo(second);
        assertThat(stats.mostTrips().vehicleId()).isEqualTo(first);
        assertThat(stats.topEarner().vehicleId()).isEqualTo(first);
        assertThat(stats.activeVehicles()).isEqualTo(2);
        assertThat(stats.idleVehicles()).isEqualTo(1);
        assertThat(stats.ridersServed()).isEqualTo(2);
        assertThat(stats.vehicles()).hasSize(3);
        assertThat(stats.vehicles().get(0).averageFare()).isEqualByComparingTo("2.50");
        assertThat(stats.vehicles().get(0).commission()).isEqualByComparingTo("1.00");
        assertThat(stats.vehicles().get(0).net()).isEqualByComparingTo("4.00");
    }
}
