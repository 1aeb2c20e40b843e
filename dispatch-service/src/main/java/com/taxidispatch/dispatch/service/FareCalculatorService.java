package com.taxidispatch.dispatch.service;

import com.taxidispatch.dispatch.config.DispatchProperties;
import com.taxidispatch.shared.util.PlanarDistance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fare calculation on planar distance.
 *
 * Formula:
 *   fare = distanceKm * 1000 * farePerMeter     when a per-metre rate is configured
 *   fare = distanceKm * farePerKm               otherwise
 * rounded half-up to cents.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FareCalculatorService {

    private final DispatchProperties properties;

    public BigDecimal calculate(double distanceKm) {
        BigDecimal fare;
        BigDecimal perMeter = properties.getFarePerMeter();
        if (perMeter != null) {
            fare = BigDecimal.valueOf(PlanarDistance.toMeters(distanceKm)).multiply(perMeter);
        } else {
            fare = BigDecimal.valueOf(distanceKm).multiply(properties.getFarePerKm());
        }
        fare = fare.setScale(2, RoundingMode.HALF_UP);

        log.debug("Fare calc: dist={}km perMeter={} perKm={} -> {}",
                distanceKm, perMeter, properties.getFarePerKm(), fare);
        return fare;
    }
}
