package com.bms.maintenancebackend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * Reliability indicators for one asset over a trailing period, derived from its maintenance history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssetReliabilityMetrics implements Serializable {
    private static final long serialVersionUID = 1L;

    private String assetId;
    private int periodMonths;

    private int maintenanceFrequency;
    private Double averageDaysBetweenMaintenance;

    private double totalDowntimeHours;
    private Double averageDowntimeHours;

    private double totalMaintenanceCost;
    private Double averageCostPerMaintenance;

    private LocalDateTime lastMaintenanceDate;
    private Long daysSinceLastMaintenance;
    private LocalDateTime nextMaintenanceDue;
    private Long daysUntilNextMaintenance;

    private int preventiveCount;
    private int correctiveCount;
    private int emergencyCount;
}
