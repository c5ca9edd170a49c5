package com.bms.maintenancebackend.maintenance;

import com.bms.maintenancebackend.dto.TaskGenerationResult;
import com.bms.maintenancebackend.exception.StoreException;
import com.bms.maintenancebackend.model.Asset;
import com.bms.maintenancebackend.model.MaintenanceFrequency;
import com.bms.maintenancebackend.model.MaintenanceSchedule;
import com.bms.maintenancebackend.model.MaintenanceTask;
import com.bms.maintenancebackend.model.MaintenanceTaskStatus;
import com.bms.maintenancebackend.repository.AssetRepository;
import com.bms.maintenancebackend.repository.MaintenanceTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Materializes one live maintenance task per active, scheduled asset.
 * Running it repeatedly never creates a second live task for the same asset.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MaintenanceTaskGenerator {

    private final AssetRepository assetRepository;
    private final MaintenanceTaskRepository taskRepository;
    private final ScheduleResolver scheduleResolver;
    private final Clock clock;

    public TaskGenerationResult generateMaintenanceTasks(String organizationId) {
        List<Asset> assets;
        try {
            assets = assetRepository.findByOrganizationIdAndStatus(organizationId, Asset.AssetStatus.ACTIVE);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to list active assets for organization " + organizationId, e);
        }

        log.info("🛠️ Generating maintenance tasks for {} active assets in organization {}", assets.size(), organizationId);

        TaskGenerationResult result = new TaskGenerationResult();
        for (Asset asset : assets) {
            if (!hasSchedule(asset)) {
                continue;
            }
            try {
                if (hasExistingTask(organizationId, asset.getId())) {
                    // Existing tasks are counted only; their dates follow completion events
                    log.debug("Asset {} already has a maintenance task, leaving it as is", asset.getId());
                    result.setUpdated(result.getUpdated() + 1);
                } else {
                    taskRepository.save(buildTask(asset));
                    result.setCreated(result.getCreated() + 1);
                }
            } catch (Exception e) {
                log.error("❌ Failed to generate maintenance task for asset {}: {}", asset.getId(), e.getMessage(), e);
                result.setErrors(result.getErrors() + 1);
            }
        }

        log.info("✅ Task generation for organization {}: {} created, {} existing, {} errors",
                organizationId, result.getCreated(), result.getUpdated(), result.getErrors());
        return result;
    }

    private boolean hasSchedule(Asset asset) {
        MaintenanceSchedule schedule = asset.getMaintenanceSchedule();
        return schedule != null && StringUtils.hasText(schedule.getFrequency());
    }

    private boolean hasExistingTask(String organizationId, String assetId) {
        return !taskRepository
                .findByOrganizationIdAndAssetIdAndStatusNot(organizationId, assetId, MaintenanceTaskStatus.CANCELLED)
                .isEmpty();
    }

    private MaintenanceTask buildTask(Asset asset) {
        LocalDateTime now = LocalDateTime.now(clock);
        MaintenanceSchedule schedule = asset.getMaintenanceSchedule();
        MaintenanceFrequency frequency = scheduleResolver.resolveFrequency(schedule.getFrequency());

        MaintenanceTask task = new MaintenanceTask();
        task.setOrganizationId(asset.getOrganizationId());
        task.setAssetId(asset.getId());
        task.setBuildingId(asset.getBuildingId());
        task.setTaskName("Maintenance for " + asset.getName());
        task.setDescription("Scheduled maintenance for " + asset.getName() + " (" + typeLabel(asset) + ")");
        task.setScheduleType(MaintenanceTask.ScheduleType.TIME_BASED);
        task.setFrequency(frequency);
        task.setNextDueDate(scheduleResolver.computeNextDue(schedule, now));
        task.setLastPerformed(schedule.getLastMaintenanceDate());
        task.setStatus(MaintenanceTaskStatus.SCHEDULED);
        task.setAutoGenerateWorkOrder(true);
        task.setActiveAssetKey(asset.getId());
        task.setCreatedAt(now);
        task.setUpdatedAt(now);
        return task;
    }

    private String typeLabel(Asset asset) {
        return asset.getAssetType() == null ? "other" : asset.getAssetType().name().toLowerCase();
    }
}
