package com.bms.maintenancebackend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counters returned after converting an organization's due tasks into work orders.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DueTaskProcessingResult {
    private int processed;
    private int workOrdersCreated;
    private int errors;
}
