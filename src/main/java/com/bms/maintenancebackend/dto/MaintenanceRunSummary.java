package com.bms.maintenancebackend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MaintenanceRunSummary {
    private String organizationId;
    private boolean skipped;
    private TaskGenerationResult taskGeneration;
    private DueTaskProcessingResult dueProcessing;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;

    public static MaintenanceRunSummary skipped(String organizationId, LocalDateTime at) {
        return new MaintenanceRunSummary(organizationId, true, null, null, at, at);
    }
}
