package com.taxidispatch.dispatch.config;

import com.taxidispatch.dispatch.model.AffiliationResult;
import com.taxidispatch.dispatch.repository.EntityStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;

/**
 * Affiliates the startup fleet from {@code dispatch.fleet.vehicles} and {@code dispatch.fleet.riders}.
 * Rejected entries are logged by the store and skipped.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class FleetInitializer {

    private final FleetProperties fleet;
    private final EntityStore store;

    @Bean
    @Order(Ordered.HIGHEST_PRECEDENCE)
    public ApplicationRunner affiliateStartupFleet() {
        return args -> {
            long vehicles = fleet.getVehicles().stream()
                    .map(store::affiliateVehicle)
                    .filter(AffiliationResult::isAccepted)
                    .count();
            long riders = fleet.getRiders().stream()
                    .map(store::affiliateRider)
                    .filter(AffiliationResult::isAccepted)
                    .count();
            log.info("Startup fleet affiliated: vehicles={}/{} riders={}/{}",
                    vehicles, fleet.getVehicles().size(), riders, fleet.getRiders().size());
        };
    }
}
