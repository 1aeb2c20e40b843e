package com.taxidispatch.dispatch.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Vehicle affiliation input. Format rules (identity, plate length, speed) are enforced by
 * {@link com.taxidispatch.dispatch.repository.EntityStore#affiliateVehicle}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VehicleRegistration {

    @NotBlank
    private String driverIdentity;

    @NotBlank
    private String firstName;

    private String lastName;

    @NotBlank
    private String plate;

    @Builder.Default
    private String make = "Toyota";

    @Builder.Default
    private String model = "Corolla";

    /** km/h; null means the configured default speed. */
    private Integer speedKmh;

    /** Optional explicit starting position; otherwise a configured starting point is drawn. */
    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double lat;

    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double lng;
}
