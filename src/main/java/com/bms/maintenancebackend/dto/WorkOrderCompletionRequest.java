package com.bms.maintenancebackend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WorkOrderCompletionRequest {
    private Double actualCost;
    private String notes;
    private String performedBy;
}
