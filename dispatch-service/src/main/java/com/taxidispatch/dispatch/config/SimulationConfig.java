package com.taxidispatch.dispatch.config;

import com.taxidispatch.dispatch.service.RandomSource;
import com.taxidispatch.dispatch.service.SleepingTransitPacer;
import com.taxidispatch.dispatch.service.ThreadLocalRandomSource;
import com.taxidispatch.dispatch.service.TransitPacer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Time, randomness and threading seams of the dispatch core. Tests replace them with
 * fixed clocks, scripted random sources and no-op pacers.
 */
@Configuration
public class SimulationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RandomSource randomSource() {
        return new ThreadLocalRandomSource();
    }

    @Bean
    public TransitPacer transitPacer() {
        return new SleepingTransitPacer();
    }

    /** Bounded pool the rider actors run on. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService simulationExecutor(DispatchProperties properties) {
        AtomicInteger sequence = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "rider-actor-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(properties.getSimulation().getWorkerPoolSize(), threadFactory);
    }
}
