package com.taxidispatch.dispatch.simulation;

import com.taxidispatch.dispatch.config.DispatchProperties;
import com.taxidispatch.dispatch.entity.Rider;
import com.taxidispatch.dispatch.export.SnapshotExporter;
import com.taxidispatch.dispatch.model.DayCloseResult;
import com.taxidispatch.dispatch.model.FleetStatistics;
import com.taxidispatch.dispatch.model.SimulationResult;
import com.taxidispatch.dispatch.repository.EntityStore;
import com.taxidispatch.dispatch.service.DayLifecycleController;
import com.taxidispatch.dispatch.service.DispatchService;
import com.taxidispatch.dispatch.service.RandomSource;
import com.taxidispatch.dispatch.service.TransitPacer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Drives the configured number of operating days.
 *
 * Per day: open, submit one {@link RiderActor} per active rider to the worker pool, let the
 * day run, close it (blocking until in-flight trips drain), then join that day's actors so
 * no actor survives into the next day. After the last day: finish and export.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SimulationDriver {

    private final DispatchProperties properties;
    private final EntityStore store;
    private final DayLifecycleController lifecycle;
    private final DispatchService dispatchService;
    private final RandomSource random;
    private final TransitPacer pacer;
    private final ExecutorService simulationExecutor;
    private final SnapshotExporter exporter;

    public SimulationResult run() throws InterruptedException {
        DispatchProperties.Simulation settings = properties.getSimulation();
        log.info("Simulation starting: days={} vehicles={} riders={} pool={}",
                properties.getDaysToSimulate(), store.vehicleCount(), store.riders().size(),
                settings.getWorkerPoolSize());

        List<DayCloseResult> days = new ArrayList<>();
        for (int d = 0; d < properties.getDaysToSimulate(); d++) {
            lifecycle.openDay();

            List<Rider> active = pickActiveRiders(settings.getMaxActiveRiders());
            List<Future<Integer>> actors = new ArrayList<>(active.size());
            for (Rider rider : active) {
                actors.add(simulationExecutor.submit(
                        new RiderActor(rider, dispatchService, lifecycle, store, random, pacer, settings)));
            }
            log.info("Day {}: {} rider actor(s) started", lifecycle.currentDay(), actors.size());

            pacer.pause(Duration.ofMillis(settings.getDayDurationMs()));
            DayCloseResult closed = lifecycle.closeDay();
            int completed = join(actors);
            log.info("Day {}: actors finished with {} completed trip(s)", closed.day(), completed);
            days.add(closed);
        }

        FleetStatistics statistics = lifecycle.finish();
        exporter.exportAll();
        return new SimulationResult(List.copyOf(days), statistics);
    }

    /**
     * Random subset of the affiliated riders, at most {@code limit} of them.
     */
    private List<Rider> pickActiveRiders(int limit) {
        List<Rider> riders = store.riders();
        for (int i = riders.size() - 1; i > 0; i--) {
            Collections.swap(riders, i, random.nextInt(0, i));
        }
        return riders.subList(0, Math.min(limit, riders.size()));
    }

    private int join(List<Future<Integer>> actors) throws InterruptedException {
        int completed = 0;
        for (Future<Integer> actor : actors) {
            try {
                completed += actor.get();
            } catch (ExecutionException e) {
                log.error("Rider actor terminated abnormally: {}", e.getCause().getMessage(), e.getCause());
            }
        }
        return completed;
    }
}
