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
@Document(collection = "maintenance_tasks")
@CompoundIndexes({
    @CompoundIndex(name = "org_status_idx", def = "{'organizationId': 1, 'status': 1}"),
    @CompoundIndex(name = "org_next_due_idx", def = "{'organizationId': 1, 'nextDueDate': 1}")
})
public class MaintenanceTask implements Serializable {
    private static final long serialVersionUID = 1L;

    public enum ScheduleType {
        TIME_BASED
    }

    @Id
    private String id;

    private String organizationId;

    @Indexed
    private String assetId;

    @Indexed
    private String buildingId;

    private String taskName;
    private String description;

    private ScheduleType scheduleType = ScheduleType.TIME_BASED;
    private MaintenanceFrequency frequency;

    private LocalDateTime nextDueDate;
    private LocalDateTime lastPerformed;

    @Indexed
    private MaintenanceTaskStatus status = MaintenanceTaskStatus.SCHEDULED;

    private boolean autoGenerateWorkOrder;

    @Indexed(sparse = true)
    private String assignedTo;

    private Double estimatedCost;
    private Integer estimatedDurationMinutes;

    // Live work order generated from this task; cleared when it completes or is cancelled
    private String linkedWorkOrderId;

    // Equals assetId while the task is live, absent otherwise. One live task per asset.
    @Indexed(unique = true, sparse = true)
    private String activeAssetKey;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public boolean isLive() {
        return status == null || !status.isClosed();
    }
}
