package com.bms.maintenancebackend.dto;

import com.bms.maintenancebackend.model.WorkOrderStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WorkOrderStatusRequest {
    @NotNull
    private WorkOrderStatus status;
    private String assignedTo;
}
