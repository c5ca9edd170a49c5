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
@Document(collection = "complaints")
@CompoundIndexes({
    @CompoundIndex(name = "org_status_priority_idx", def = "{'organizationId': 1, 'status': 1, 'priority': 1}")
})
public class Complaint implements Serializable {
    private static final long serialVersionUID = 1L;

    public enum ComplaintCategory {
        MAINTENANCE,
        NOISE,
        SECURITY,
        CLEANLINESS,
        OTHER
    }

    public enum ComplaintPriority {
        LOW,
        MEDIUM,
        HIGH,
        URGENT
    }

    public enum ComplaintStatus {
        OPEN,
        ASSIGNED,
        IN_PROGRESS,
        RESOLVED,
        CLOSED
    }

    // Set on maintenance requests only
    public enum MaintenanceCategory {
        PLUMBING,
        ELECTRICAL,
        HVAC,
        APPLIANCE,
        STRUCTURAL,
        OTHER
    }

    public enum Urgency {
        LOW,
        MEDIUM,
        HIGH,
        EMERGENCY
    }

    @Id
    private String id;

    private String organizationId;
    private String tenantId;
    private String unitId;

    private ComplaintCategory category;
    private String title;
    private String description;

    private ComplaintPriority priority;

    @Indexed
    private ComplaintStatus status = ComplaintStatus.OPEN;

    private MaintenanceCategory maintenanceCategory;
    private Urgency urgency;
    private TimeWindow preferredTimeWindow;

    @Indexed(sparse = true)
    private String linkedWorkOrderId;

    private String assignedTo;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
