package com.taxidispatch.dispatch.simulation;

import com.taxidispatch.dispatch.model.SimulationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Runs the simulation once the startup fleet is affiliated, when
 * {@code dispatch.simulation.auto-start=true}.
 */
@Slf4j
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "dispatch.simulation", name = "auto-start", havingValue = "true")
public class SimulationRunner implements ApplicationRunner {

    private final SimulationDriver driver;

    @Override
    public void run(ApplicationArguments args) {
        try {
            SimulationResult result = driver.run();
            log.info("Simulation complete: days={} trips={} operatorTotal={}",
                    result.days().size(), result.statistics().totalTrips(), result.statistics().operatorTotal());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Simulation interrupted");
        }
    }
}
