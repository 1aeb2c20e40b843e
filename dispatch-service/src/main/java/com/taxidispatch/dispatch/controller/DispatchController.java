package com.taxidispatch.dispatch.controller;

import com.taxidispatch.dispatch.exception.DispatchException;
import com.taxidispatch.dispatch.export.SnapshotService;
import com.taxidispatch.dispatch.model.AffiliationResult;
import com.taxidispatch.dispatch.model.DailyReport;
import com.taxidispatch.dispatch.model.FleetStatistics;
import com.taxidispatch.dispatch.model.LifecycleStatus;
import com.taxidispatch.dispatch.model.LiveSnapshot;
import com.taxidispatch.dispatch.model.RiderRegistration;
import com.taxidispatch.dispatch.model.TripRecord;
import com.taxidispatch.dispatch.model.VehicleRegistration;
import com.taxidispatch.dispatch.repository.EntityStore;
import com.taxidispatch.dispatch.service.DayLifecycleController;
import com.taxidispatch.dispatch.service.ReportService;
import com.taxidispatch.shared.dto.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Read-only views for the visualization front end plus the affiliation endpoints
 * used by the registration front end.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class DispatchController {

    private final EntityStore store;
    private final SnapshotService snapshotService;
    private final ReportService reportService;
    private final DayLifecycleController lifecycle;

    @GetMapping("/fleet/snapshot")
    public ResponseEntity<ApiResponse<LiveSnapshot>> snapshot() {
        return ResponseEntity.ok(ApiResponse.ok(snapshotService.snapshot()));
    }

    @GetMapping("/trips")
    public ResponseEntity<ApiResponse<List<TripRecord>>> trips() {
        return ResponseEntity.ok(ApiResponse.ok(reportService.ledger()));
    }

    @GetMapping("/reports/daily")
    public ResponseEntity<ApiResponse<List<DailyReport>>> dailyReports() {
        return ResponseEntity.ok(ApiResponse.ok(reportService.history()));
    }

    @GetMapping("/reports/statistics")
    public ResponseEntity<ApiResponse<FleetStatistics>> statistics() {
        return ResponseEntity.ok(ApiResponse.ok(reportService.finalStatistics()));
    }

    @GetMapping("/lifecycle")
    public ResponseEntity<ApiResponse<LifecycleStatus>> lifecycle() {
        return ResponseEntity.ok(ApiResponse.ok(lifecycle.status()));
    }

    @PostMapping("/vehicles")
    public ResponseEntity<ApiResponse<AffiliationResult>> affiliateVehicle(
            @Valid @RequestBody VehicleRegistration registration) {
        return affiliationResponse(store.affiliateVehicle(registration));
    }

    @PostMapping("/riders")
    public ResponseEntity<ApiResponse<AffiliationResult>> affiliateRider(
            @Valid @RequestBody RiderRegistration registration) {
        return affiliationResponse(store.affiliateRider(registration));
    }

    private ResponseEntity<ApiResponse<AffiliationResult>> affiliationResponse(AffiliationResult result) {
        if (!result.isAccepted()) {
            return ResponseEntity.badRequest().body(ApiResponse.error("AFFILIATION_REJECTED", result.getReason()));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(result));
    }

    @ExceptionHandler(DispatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleDispatchException(DispatchException ex) {
        log.warn("Dispatch error [{}]: {}", ex.getCode(), ex.getMessage());
        return ResponseEntity.badRequest().body(ApiResponse.error(ex.getCode(), ex.getMessage()));
    }
}
