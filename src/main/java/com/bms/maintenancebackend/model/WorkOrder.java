package com.bms.maintenancebackend.model;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.io.Serializable;
import java.time.LocalDateTime;

@Data
@Document(collection = "work_orders")
@CompoundIndexes({
    @CompoundIndex(name = "org_building_status_idx", def = "{'organizationId': 1, 'buildingId': 1, 'status': 1}"),
    @CompoundIndex(name = "org_assigned_status_idx", def = "{'organizationId': 1, 'assignedTo': 1, 'status': 1}")
})
public class WorkOrder implements Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    private String id;

    private String organizationId;
    private String buildingId;
    private String unitId;

    @Indexed(sparse = true)
    private String assetId;

    @Indexed(sparse = true)
    private String complaintId;

    @Indexed(sparse = true)
    private String maintenanceTaskId;

    private String title;
    private String description;

    private WorkOrderCategory category;
    private WorkOrderPriority priority = WorkOrderPriority.MEDIUM;

    @Indexed
    private WorkOrderStatus status = WorkOrderStatus.OPEN;

    private String assignedTo;

    private Double estimatedCost;
    private Double actualCost;

    private LocalDateTime scheduledDate;
    private TimeWindow scheduledTimeWindow;

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    private String notes;
    private String createdBy;

    // "task:<id>" or "complaint:<id>" while the work order is active
    @Indexed(unique = true, sparse = true)
    private String sourceKey;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
