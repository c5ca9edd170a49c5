package com.bms.maintenancebackend.dto;

import com.bms.maintenancebackend.model.MaintenanceHistory;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordMaintenanceRequest {

    @NotBlank
    private String organizationId;

    private String assetId;
    private String workOrderId;

    @NotNull
    private MaintenanceHistory.MaintenanceType maintenanceType;

    private String performedBy;

    @NotNull
    private LocalDateTime performedDate;

    private String description;
    private Double cost;
    private Double downtimeHours;
    private String notes;
    private LocalDateTime nextMaintenanceDue;
}
