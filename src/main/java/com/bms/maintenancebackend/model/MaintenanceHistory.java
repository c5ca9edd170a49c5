package com.bms.maintenancebackend.model;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * Append-only record of a completed maintenance event.
 */
@Data
@Document(collection = "maintenance_history")
@CompoundIndexes({
    @CompoundIndex(name = "org_asset_idx", def = "{'organizationId': 1, 'assetId': 1}"),
    @CompoundIndex(name = "asset_performed_idx", def = "{'assetId': 1, 'performedDate': -1}")
})
public class MaintenanceHistory implements Serializable {
    private static final long serialVersionUID = 1L;

    public enum MaintenanceType {
        PREVENTIVE,
        CORRECTIVE,
        EMERGENCY
    }

    @Id
    private String id;

    private String organizationId;

    @Indexed
    private String assetId;

    // At most one history row per work order
    @Indexed(unique = true, sparse = true)
    private String workOrderId;

    @Indexed
    private MaintenanceType maintenanceType;

    private String performedBy;
    private LocalDateTime performedDate;

    private String description;
    private Double cost;
    private Double downtimeHours;
    private String notes;

    private LocalDateTime nextMaintenanceDue;

    private LocalDateTime createdAt;
}
