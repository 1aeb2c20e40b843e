package com.taxidispatch.dispatch.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiderRegistration {

    @NotBlank
    private String identity;

    @NotBlank
    private String firstName;

    private String lastName;

    /** Payment card; spaces and dashes are ignored. */
    @NotBlank
    private String card;
}
