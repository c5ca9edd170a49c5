package com.bms.maintenancebackend.dto;

import com.bms.maintenancebackend.model.TimeWindow;
import com.bms.maintenancebackend.model.WorkOrderCategory;
import com.bms.maintenancebackend.model.WorkOrderPriority;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Optional overrides supplied by staff when converting a complaint into a work order.
 * Every field may be null; null means "derive from the complaint".
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ComplaintConversionRequest {
    private String buildingId;
    private WorkOrderPriority priority;
    private WorkOrderCategory category;
    private String assignedTo;
    private LocalDateTime scheduledDate;
    private TimeWindow scheduledTimeWindow;
}
