package com.bms.maintenancebackend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * Schedule metadata owned by an {@link Asset}.
 * <p>
 * {@code frequency} is a free-text label such as "monthly" or "quarterly inspection".
 * When both dates are present {@code nextMaintenanceDate} is never before {@code lastMaintenanceDate}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MaintenanceSchedule implements Serializable {
    private static final long serialVersionUID = 1L;

    private String frequency;
    private LocalDateTime lastMaintenanceDate;
    private LocalDateTime nextMaintenanceDate;
}
