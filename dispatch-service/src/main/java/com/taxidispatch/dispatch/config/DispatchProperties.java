package com.taxidispatch.dispatch.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Operator configuration bound from {@code dispatch.*}.
 *
 * Pricing: when {@code farePerMeter} is set it takes priority over {@code farePerKm}
 * for every trip. Ratings drawn for completed trips come from {@code tripRating};
 * any rating applied to a vehicle must lie within {@code rating.min..rating.max}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "dispatch")
public class DispatchProperties {

    @DecimalMin(value = "0.0", inclusive = false)
    private double searchRadiusKm = 2.0;

    @DecimalMin(value = "0.0", inclusive = false)
    private BigDecimal farePerKm = new BigDecimal("2.50");

    /** Optional; null means per-kilometre pricing. */
    @DecimalMin("0.0")
    private BigDecimal farePerMeter;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private BigDecimal commissionFraction = new BigDecimal("0.20");

    @Min(0)
    private int trackingSampleSize = 5;

    @Min(1)
    private int daysToSimulate = 2;

    @Min(1)
    private int defaultSpeedKmh = 60;

    /** Simulated seconds per real second during transit. */
    @DecimalMin(value = "0.0", inclusive = false)
    private double transitAcceleration = 1000.0;

    @Valid
    private Rating rating = new Rating();

    @Valid
    private TripRating tripRating = new TripRating();

    @Valid
    private Validation validation = new Validation();

    @Valid
    private Simulation simulation = new Simulation();

    @Valid
    private Export export = new Export();

    @AssertTrue(message = "trip-rating range must lie within the rating bounds")
    public boolean isTripRatingWithinBounds() {
        return tripRating.getMin() <= tripRating.getMax()
                && tripRating.getMin() >= rating.getMin()
                && tripRating.getMax() <= rating.getMax();
    }

    @Data
    public static class Rating {
        private int min = 1;
        private int max = 5;
        private double initial = 5.0;

        @AssertTrue(message = "rating bounds must satisfy min <= initial <= max")
        public boolean isConsistent() {
            return min <= max && initial >= min && initial <= max;
        }
    }

    @Data
    public static class TripRating {
        private int min = 3;
        private int max = 5;
    }

    @Data
    public static class Validation {
        @Min(1)
        private int nameMinChars = 3;
        @Min(1)
        private int identityMinChars = 5;
        @Min(1)
        private int cardDigits = 16;
        @Min(1)
        private int plateMinChars = 5;
    }

    @Data
    public static class Simulation {
        private boolean autoStart = false;
        @Min(1)
        private int maxActiveRiders = 20;
        @Min(1)
        private int workerPoolSize = 8;
        @Min(1)
        private int minRequestsPerRider = 1;
        @Min(1)
        private int maxRequestsPerRider = 3;
        @Min(0)
        private int minDelayMs = 50;
        @Min(0)
        private int maxDelayMs = 200;
        @Min(0)
        private long dayDurationMs = 6000;
        @Valid
        private Area area = new Area();

        @AssertTrue(message = "request and delay ranges must satisfy min <= max")
        public boolean isRangesConsistent() {
            return minRequestsPerRider <= maxRequestsPerRider && minDelayMs <= maxDelayMs;
        }
    }

    /** Bounding box riders are placed in when they request a trip. */
    @Data
    public static class Area {
        private double minLat = 40.39;
        private double maxLat = 40.45;
        private double minLng = -3.75;
        private double maxLng = -3.65;
    }

    @Data
    public static class Export {
        private boolean enabled = false;
        @NotBlank
        private String directory = "data";
        @Min(1)
        private long flushIntervalMs = 500;
    }
}
