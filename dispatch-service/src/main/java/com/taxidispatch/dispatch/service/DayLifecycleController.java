package com.taxidispatch.dispatch.service;

import com.taxidispatch.dispatch.entity.Trip;
import com.taxidispatch.dispatch.exception.DispatchException;
import com.taxidispatch.dispatch.metrics.DispatchMetrics;
import com.taxidispatch.dispatch.model.DailyReport;
import com.taxidispatch.dispatch.model.DayCloseResult;
import com.taxidispatch.dispatch.model.FleetStatistics;
import com.taxidispatch.dispatch.model.LifecycleStatus;
import com.taxidispatch.dispatch.model.SettlementReport;
import com.taxidispatch.dispatch.repository.EntityStore;
import com.taxidispatch.shared.enums.DayPhase;
import com.taxidispatch.shared.events.DayClosedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Operating-day state machine and quiescence barrier.
 *
 * Phases: IDLE -> OPEN -> DRAINING -> CLOSED, then OPEN -> DRAINING -> CLOSED for every
 * further day, and FINISHED at the end.
 *
 * Every trip request is bracketed by {@link #activateTrip()} / {@link #deactivateTrip()}.
 * Once {@link #closeDay()} sets the day-ending flag no new trip is admitted, and the close
 * waits on {@code quiescent} until the active count drops to zero. Settlement and the daily
 * report therefore never observe a trip in flight. They run after the day lock is released;
 * the day-ending flag keeps admission closed until the next {@link #openDay()}.
 */
@Slf4j
@Service
public class DayLifecycleController {

    private final EntityStore store;
    private final SettlementService settlementService;
    private final ReportService reportService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final ReentrantLock dayLock = new ReentrantLock();
    private final Condition quiescent = dayLock.newCondition();

    private boolean dayEnding = true;
    private int activeTrips;
    private int currentDay = 1;
    private DayPhase phase = DayPhase.IDLE;

    public DayLifecycleController(EntityStore store,
                                  SettlementService settlementService,
                                  ReportService reportService,
                                  ApplicationEventPublisher eventPublisher,
                                  DispatchMetrics metrics,
                                  Clock clock) {
        this.store = store;
        this.settlementService = settlementService;
        this.reportService = reportService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        metrics.bindActiveTrips(this::activeTrips);
    }

    public void openDay() {
        dayLock.lock();
        try {
            if (phase == DayPhase.OPEN || phase == DayPhase.DRAINING || phase == DayPhase.FINISHED) {
                throw new DispatchException(DispatchException.INVALID_STATE,
                        "Cannot open day " + currentDay + " while " + phase);
            }
            dayEnding = false;
            phase = DayPhase.OPEN;
            log.info("Day {} opened", currentDay);
        } finally {
            dayLock.unlock();
        }
    }

    /**
     * Admits one trip request for the current day.
     *
     * @return false when the day is closing (or not open yet); the caller must not dispatch
     */
    public boolean activateTrip() {
        dayLock.lock();
        try {
            if (dayEnding) {
                return false;
            }
            activeTrips++;
            return true;
        } finally {
            dayLock.unlock();
        }
    }

    public void deactivateTrip() {
        dayLock.lock();
        try {
            if (activeTrips == 0) {
                log.warn("deactivateTrip called with no active trips on day {} ({})", currentDay, phase);
                return;
            }
            activeTrips--;
            if (activeTrips == 0 && dayEnding) {
                quiescent.signalAll();
            }
        } finally {
            dayLock.unlock();
        }
    }

    /**
     * Stops admission, waits for every active trip to finish, then reports and settles the day.
     * Blocks for as long as trips are in flight.
     *
     * @throws InterruptedException if interrupted while draining; the day is reopened
     */
    public DayCloseResult closeDay() throws InterruptedException {
        int day;
        dayLock.lock();
        try {
            if (phase != DayPhase.OPEN) {
                throw new DispatchException(DispatchException.INVALID_STATE,
                        "Cannot close day " + currentDay + " while " + phase);
            }
            dayEnding = true;
            phase = DayPhase.DRAINING;
            day = currentDay;
            log.info("Day {} closing: draining {} active trip(s)", day, activeTrips);
            try {
                while (activeTrips > 0) {
                    quiescent.await();
                }
            } catch (InterruptedException e) {
                dayEnding = false;
                phase = DayPhase.OPEN;
                log.warn("Day {} close interrupted with {} active trip(s); day stays open", day, activeTrips);
                throw e;
            }
        } finally {
            dayLock.unlock();
        }

        List<Trip> sample = store.drainTrackingSample();
        SettlementReport settlement = settlementService.settle(day);
        DailyReport report = reportService.recordDay(day, sample, settlement);

        dayLock.lock();
        try {
            currentDay = day + 1;
            phase = DayPhase.CLOSED;
        } finally {
            dayLock.unlock();
        }

        log.info("Day {} closed: tracked={} commission={} operatorTotal={}",
                day, sample.size(), settlement.commission(), settlement.operatorTotal());
        eventPublisher.publishEvent(DayClosedEvent.builder()
                .day(day)
                .trackedTrips(sample.size())
                .operatorCommission(settlement.commission())
                .operatorTotal(settlement.operatorTotal())
                .closedAt(Instant.now(clock))
                .build());
        return new DayCloseResult(day, report, settlement);
    }

    public FleetStatistics finish() {
        dayLock.lock();
        try {
            if (phase != DayPhase.IDLE && phase != DayPhase.CLOSED) {
                throw new DispatchException(DispatchException.INVALID_STATE, "Cannot finish while " + phase);
            }
            dayEnding = true;
            phase = DayPhase.FINISHED;
        } finally {
            dayLock.unlock();
        }
        log.info("Simulation finished after {} day(s)", reportService.history().size());
        return reportService.finalStatistics();
    }

    public int activeTrips() {
        dayLock.lock();
        try {
            return activeTrips;
        } finally {
            dayLock.unlock();
        }
    }

    public int currentDay() {
        dayLock.lock();
        try {
            return currentDay;
        } finally {
            dayLock.unlock();
        }
    }

    public DayPhase phase() {
        dayLock.lock();
        try {
            return phase;
        } finally {
            dayLock.unlock();
        }
    }

    public LifecycleStatus status() {
        dayLock.lock();
        try {
            return new LifecycleStatus(phase, currentDay, activeTrips);
        } finally {
            dayLock.unlock();
        }
    }
}
