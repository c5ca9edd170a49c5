package com.bms.maintenancebackend.config;

import com.bms.maintenancebackend.model.Asset;
import com.bms.maintenancebackend.model.WorkOrderCategory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "maintenance")
public class MaintenanceProperties {

    private Scheduler scheduler = new Scheduler();

    /**
     * How long past its due date a task stays DUE before it becomes OVERDUE.
     * Zero means any positive delay is overdue.
     */
    private Duration overdueGrace = Duration.ZERO;

    /** Recorded as {@code createdBy} on work orders the batch creates. */
    private String systemUser = "system";

    /** Asset type to work-order category. Types missing here fall back to OTHER. */
    private Map<Asset.AssetType, WorkOrderCategory> categoryMapping = defaultCategoryMapping();

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private String cron = "0 0 2 * * *";
    }

    public WorkOrderCategory categoryFor(Asset.AssetType assetType) {
        if (assetType == null) {
            return WorkOrderCategory.OTHER;
        }
        return categoryMapping.getOrDefault(assetType, WorkOrderCategory.OTHER);
    }

    private static Map<Asset.AssetType, WorkOrderCategory> defaultCategoryMapping() {
        Map<Asset.AssetType, WorkOrderCategory> mapping = new EnumMap<>(Asset.AssetType.class);
        mapping.put(Asset.AssetType.EQUIPMENT, WorkOrderCategory.HVAC);
        mapping.put(Asset.AssetType.APPLIANCE, WorkOrderCategory.HVAC);
        mapping.put(Asset.AssetType.INFRASTRUCTURE, WorkOrderCategory.PLUMBING);
        mapping.put(Asset.AssetType.VEHICLE, WorkOrderCategory.OTHER);
        return mapping;
    }
}
