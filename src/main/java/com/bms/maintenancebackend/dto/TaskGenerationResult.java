package com.bms.maintenancebackend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counters returned by one task materialization pass over an organization's assets.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaskGenerationResult {
    private int created;
    private int updated;
    private int errors;
}
