package com.bms.maintenancebackend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.io.Serializable;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "assets")
@CompoundIndexes({
    @CompoundIndex(name = "org_status_idx", def = "{'organizationId': 1, 'status': 1}")
})
public class Asset implements Serializable {
    private static final long serialVersionUID = 1L;

    public enum AssetType {
        EQUIPMENT,
        FURNITURE,
        INFRASTRUCTURE,
        VEHICLE,
        APPLIANCE,
        OTHER
    }

    public enum AssetStatus {
        ACTIVE,
        MAINTENANCE,    // Temporarily out of service
        RETIRED,
        DISPOSED
    }

    @Id
    private String id;

    @Indexed
    private String organizationId;

    @Indexed
    private String buildingId;

    private String unitId;

    private String name;
    private String description;

    @Indexed
    private AssetType assetType;

    private AssetStatus status = AssetStatus.ACTIVE;

    private String serialNumber;
    private String location;

    // Absent for assets that are never scheduled
    private MaintenanceSchedule maintenanceSchedule;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
