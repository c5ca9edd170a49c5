package com.bms.maintenancebackend.controller;

import com.bms.maintenancebackend.dto.AssetReliabilityMetrics;
import com.bms.maintenancebackend.dto.RecordMaintenanceRequest;
import com.bms.maintenancebackend.maintenance.MaintenanceHistoryService;
import com.bms.maintenancebackend.model.MaintenanceHistory;
import com.bms.maintenancebackend.service.AssetReliabilityService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Asset Maintenance", description = "Asset maintenance history and reliability metrics")
@Slf4j
@RestController
@RequestMapping("/api/assets/{assetId}")
public class AssetMaintenanceController {

    @Autowired
    private MaintenanceHistoryService historyService;

    @Autowired
    private AssetReliabilityService reliabilityService;

    @Operation(summary = "Record maintenance", description = "Appends a history entry and updates the asset's schedule dates")
    @ApiResponse(responseCode = "201", description = "History entry recorded")
    @ApiResponse(responseCode = "400", description = "Invalid dates or missing description")
    @ApiResponse(responseCode = "404", description = "Asset not found")
    @PostMapping("/maintenance-history")
    public ResponseEntity<MaintenanceHistory> recordMaintenance(@PathVariable String assetId,
                                                                @Valid @RequestBody RecordMaintenanceRequest request) {
        request.setAssetId(assetId);
        return ResponseEntity.status(HttpStatus.CREATED).body(historyService.recordCompletedMaintenance(request));
    }

    @Operation(summary = "Get maintenance history", description = "Most recent entries first")
    @GetMapping("/maintenance-history")
    public ResponseEntity<List<MaintenanceHistory>> getHistory(@PathVariable String assetId,
                                                               @RequestParam String organizationId,
                                                               @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(historyService.getHistory(assetId, organizationId, limit));
    }

    @Operation(summary = "Get reliability metrics", description = "Frequency, downtime and cost over the trailing period")
    @GetMapping("/reliability")
    public ResponseEntity<AssetReliabilityMetrics> getReliability(@PathVariable String assetId,
                                                                  @RequestParam String organizationId,
                                                                  @RequestParam(defaultValue = "12") int periodMonths) {
        return ResponseEntity.ok(reliabilityService.calculateAssetReliability(assetId, organizationId, periodMonths));
    }
}
