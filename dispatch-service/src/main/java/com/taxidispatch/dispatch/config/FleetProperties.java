package com.taxidispatch.dispatch.config;

import com.taxidispatch.dispatch.model.RiderRegistration;
import com.taxidispatch.dispatch.model.VehicleRegistration;
import com.taxidispatch.shared.geo.GeoPoint;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Startup fleet bound from {@code dispatch.fleet.*}: named starting points new vehicles are
 * placed at, plus the vehicles and riders affiliated when the application starts.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "dispatch.fleet")
public class FleetProperties {

    @Valid
    private List<StartingPoint> startingPoints = new ArrayList<>();

    @Valid
    private List<VehicleRegistration> vehicles = new ArrayList<>();

    @Valid
    private List<RiderRegistration> riders = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StartingPoint {
        @NotBlank
        private String name;
        private double lat;
        private double lng;

        public GeoPoint toGeoPoint() {
            return GeoPoint.of(lat, lng);
        }
    }
}
