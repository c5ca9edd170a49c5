package com.bms.maintenancebackend.maintenance;

import com.bms.maintenancebackend.config.MaintenanceProperties;
import com.bms.maintenancebackend.dto.DueTaskProcessingResult;
import com.bms.maintenancebackend.exception.InvalidStateException;
import com.bms.maintenancebackend.exception.NotFoundException;
import com.bms.maintenancebackend.model.Asset;
import com.bms.maintenancebackend.model.MaintenanceTask;
import com.bms.maintenancebackend.model.MaintenanceTaskStatus;
import com.bms.maintenancebackend.model.WorkOrder;
import com.bms.maintenancebackend.model.WorkOrderPriority;
import com.bms.maintenancebackend.model.WorkOrderStatus;
import com.bms.maintenancebackend.repository.AssetRepository;
import com.bms.maintenancebackend.repository.MaintenanceTaskRepository;
import com.bms.maintenancebackend.service.WorkOrderService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Turns maintenance tasks into work orders, one at a time or for every due task of an organization.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WorkOrderGenerator {

    private final MaintenanceTaskRepository taskRepository;
    private final AssetRepository assetRepository;
    private final WorkOrderService workOrderService;
    private final DueTaskClassifier dueTaskClassifier;
    private final MaintenanceProperties properties;
    private final Clock clock;

    /**
     * Creates a work order for the task and links it back to the task.
     *
     * @return id of the new work order
     */
    public String createWorkOrderFromTask(String taskId, String organizationId, String createdBy) {
        MaintenanceTask task = taskRepository.findByIdAndOrganizationId(taskId, organizationId)
                .orElseThrow(() -> new NotFoundException("Maintenance task", taskId));

        if (!task.isLive()) {
            throw new InvalidStateException("Maintenance task " + taskId + " is " + task.getStatus());
        }
        if (task.getLinkedWorkOrderId() != null) {
            throw new InvalidStateException("Maintenance task " + taskId
                    + " already has work order " + task.getLinkedWorkOrderId());
        }

        Asset asset = assetRepository.findByIdAndOrganizationId(task.getAssetId(), organizationId)
                .orElseThrow(() -> new NotFoundException("Asset", task.getAssetId()));

        // The stored status may predate the last refresh
        LocalDateTime now = LocalDateTime.now(clock);
        task.setStatus(dueTaskClassifier.classify(task, now));

        WorkOrder workOrder = new WorkOrder();
        workOrder.setOrganizationId(organizationId);
        workOrder.setBuildingId(task.getBuildingId());
        workOrder.setUnitId(asset.getUnitId());
        workOrder.setAssetId(task.getAssetId());
        workOrder.setMaintenanceTaskId(task.getId());
        workOrder.setTitle(task.getTaskName());
        workOrder.setDescription(task.getDescription());
        workOrder.setCategory(properties.categoryFor(asset.getAssetType()));
        workOrder.setPriority(priorityFor(task.getStatus()));
        workOrder.setEstimatedCost(task.getEstimatedCost());
        workOrder.setAssignedTo(task.getAssignedTo());
        workOrder.setStatus(StringUtils.hasText(task.getAssignedTo()) ? WorkOrderStatus.ASSIGNED : WorkOrderStatus.OPEN);
        workOrder.setCreatedBy(StringUtils.hasText(createdBy) ? createdBy : properties.getSystemUser());
        workOrder.setSourceKey("task:" + task.getId());

        WorkOrder saved = workOrderService.createWorkOrder(workOrder);

        task.setLinkedWorkOrderId(saved.getId());
        task.setUpdatedAt(now);
        taskRepository.save(task);

        log.info("🔧 Work order {} generated from maintenance task {} ({})", saved.getId(), task.getId(), task.getStatus());
        return saved.getId();
    }

    public DueTaskProcessingResult processDueMaintenanceTasks(String organizationId) {
        dueTaskClassifier.refreshStatuses(organizationId);
        List<MaintenanceTask> dueTasks = dueTaskClassifier.findDueMaintenanceTasks(organizationId, true);

        log.info("📅 {} maintenance tasks due in organization {}", dueTasks.size(), organizationId);

        DueTaskProcessingResult result = new DueTaskProcessingResult();
        for (MaintenanceTask task : dueTasks) {
            if (!task.isAutoGenerateWorkOrder()) {
                result.setProcessed(result.getProcessed() + 1);
                continue;
            }
            try {
                createWorkOrderFromTask(task.getId(), organizationId, properties.getSystemUser());
                result.setWorkOrdersCreated(result.getWorkOrdersCreated() + 1);
                result.setProcessed(result.getProcessed() + 1);
            } catch (Exception e) {
                log.error("❌ Failed to create work order for maintenance task {}: {}", task.getId(), e.getMessage(), e);
                result.setErrors(result.getErrors() + 1);
            }
        }

        log.info("✅ Due processing for organization {}: {} processed, {} work orders, {} errors",
                organizationId, result.getProcessed(), result.getWorkOrdersCreated(), result.getErrors());
        return result;
    }

    static WorkOrderPriority priorityFor(MaintenanceTaskStatus status) {
        if (status == MaintenanceTaskStatus.OVERDUE) {
            return WorkOrderPriority.HIGH;
        }
        if (status == MaintenanceTaskStatus.DUE) {
            return WorkOrderPriority.MEDIUM;
        }
        return WorkOrderPriority.LOW;
    }
}
