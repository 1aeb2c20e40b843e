package com.taxidispatch.dispatch.entity;

import com.taxidispatch.shared.geo.GeoPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VehicleTest {

    private static final int MIN = 1;
    private static final int MAX = 5;

    private Vehicle vehicle;

    @BeforeEach
    void setUp() {
        vehicle = Vehicle.builder()
                .id(1).driverIdentity("DRV-00001").firstName("Ana").lastName("Martin")
                .plate("1234ABC").make("Seat").model("Leon").speedKmh(55)
                .location(GeoPoint.of(40.41, -3.70))
                .build();
    }

    @Test
    @DisplayName("Average is the configured initial value before the first trip")
    void initialAverageWithoutTrips() {
        assertThat(vehicle.averageRating(5.0)).isEqualTo(5.0);
        assertThat(vehicle.getTripCount()).isZero();
    }

    @Test
    @DisplayName("Average stays within [min, max] for any sequence of in-range ratings")
    void averageAlwaysWithinBounds() {
        Random random = new Random(42);
        for (int i = 0; i < 1_000; i++) {
            vehicle.applyRating(MIN + random.nextInt(MAX - MIN + 1), MIN, MAX);
            assertThat(vehicle.averageRating(5.0)).isBetween((double) MIN, (double) MAX);
        }
        assertThat(vehicle.getTripCount()).isEqualTo(1_000);
    }

    @Test
    @DisplayName("Ratings 3 and 4 average to 3.5")
    void averageOfTwoRatings() {
        vehicle.applyRating(3, MIN, MAX);
        vehicle.applyRating(4, MIN, MAX);
        assertThat(vehicle.averageRating(5.0)).isEqualTo(3.5);
    }

    @Test
    @DisplayName("Out-of-range rating is rejected without changing the totals")
    void outOfRangeRatingRejected() {
        assertThatThrownBy(() -> vehicle.applyRating(0, MIN, MAX)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> vehicle.applyRating(6, MIN, MAX)).isInstanceOf(IllegalArgumentException.class);
        assertThat(vehicle.getTripCount()).isZero();
        assertThat(vehicle.getRatingTotal()).isZero();
    }

    @Test
    @DisplayName("Availability is false exactly while a rider is set")
    void reservationInvariant() {
        vehicle.reserveFor("CLI-00001");
        assertThat(vehicle.isAvailable()).isFalse();
        assertThat(vehicle.getCurrentRiderId()).isEqualTo("CLI-00001");
        assertThatThrownBy(() -> vehicle.reserveFor("CLI-00002")).isInstanceOf(IllegalStateException.class);

        vehicle.release();
        assertThat(vehicle.isAvailable()).isTrue();
        assertThat(vehicle.getCurrentRiderId()).isNull();
    }

    @Test
    @DisplayName("closePeriod returns the period earnings and resets them; cumulative earnings keep growing")
    void closePeriodResetsPeriodOnly() {
        vehicle.addEarnings(new BigDecimal("12.50"));
        vehicle.addEarnings(new BigDecimal("7.50"));

        assertThat(vehicle.closePeriod()).isEqualByComparingTo("20.00");
        assertThat(vehicle.getPeriodEarnings()).isEqualByComparingTo("0");
        assertThat(vehicle.getTotalEarnings()).isEqualByComparingTo("20.00");

        vehicle.addEarnings(new BigDecimal("5.00"));
        assertThat(vehicle.getTotalEarnings()).isEqualByComparingTo("25.00");
        assertThat(vehicle.closePeriod()).isEqualByComparingTo("5.00");
    }
}
