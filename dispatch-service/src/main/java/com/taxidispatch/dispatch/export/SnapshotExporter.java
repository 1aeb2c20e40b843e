package com.taxidispatch.dispatch.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taxidispatch.dispatch.config.DispatchProperties;
import com.taxidispatch.dispatch.service.ReportService;
import com.taxidispatch.shared.events.DayClosedEvent;
import com.taxidispatch.shared.events.TripCompletedEvent;
import com.taxidispatch.shared.events.TripStartedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Writes the completed-trip ledger, the live snapshot and the closed-day reports as JSON
 * files for the persistence and visualization collaborators.
 *
 * Trip start, trip completion and day close events only mark the export dirty; files are
 * written by the scheduled flush on the scheduler thread, from copies, so no core lock is
 * ever held during file I/O.
 * Each file is written to a temp file first and moved into place.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SnapshotExporter {

    static final String TRIPS_FILE = "trips.json";
    static final String SNAPSHOT_FILE = "snapshot.json";
    static final String REPORTS_FILE = "daily-reports.json";

    private final SnapshotService snapshotService;
    private final ReportService reportService;
    private final DispatchProperties properties;
    private final ObjectMapper objectMapper;

    private final AtomicBoolean dirty = new AtomicBoolean(false);

    @EventListener
    public void onTripStarted(TripStartedEvent event) {
        dirty.set(true);
    }

    @EventListener
    public void onTripCompleted(TripCompletedEvent event) {
        dirty.set(true);
    }

    @EventListener
    public void onDayClosed(DayClosedEvent event) {
        dirty.set(true);
    }

    public boolean isDirty() {
        return dirty.get();
    }

    @Scheduled(fixedDelayString = "${dispatch.export.flush-interval-ms:500}")
    public void flush() {
        if (!properties.getExport().isEnabled() || !dirty.getAndSet(false)) {
            return;
        }
        if (!exportAll()) {
            dirty.set(true);
        }
    }

    /**
     * Writes every export file now.
     *
     * @return true when all files were written; false when export is disabled or a write failed
     */
    public boolean exportAll() {
        if (!properties.getExport().isEnabled()) {
            return false;
        }
        Path directory = Path.of(properties.getExport().getDirectory());
        try {
            Files.createDirectories(directory);
            write(directory.resolve(TRIPS_FILE), reportService.ledger());
            write(directory.resolve(SNAPSHOT_FILE), snapshotService.snapshot());
            write(directory.resolve(REPORTS_FILE), reportService.history());
            log.debug("Exported ledger, snapshot and reports to {}", directory.toAbsolutePath());
            return true;
        } catch (IOException e) {
            log.error("Export to {} failed: {}", directory.toAbsolutePath(), e.getMessage(), e);
            return false;
        }
    }

    private void write(Path target, Object payload) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), payload);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
