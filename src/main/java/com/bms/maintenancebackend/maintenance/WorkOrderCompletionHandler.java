package com.bms.maintenancebackend.maintenance;

import com.bms.maintenancebackend.dto.RecordMaintenanceRequest;
import com.bms.maintenancebackend.exception.InvalidStateException;
import com.bms.maintenancebackend.exception.NotFoundException;
import com.bms.maintenancebackend.model.Asset;
import com.bms.maintenancebackend.model.MaintenanceHistory;
import com.bms.maintenancebackend.model.MaintenanceSchedule;
import com.bms.maintenancebackend.model.MaintenanceTask;
import com.bms.maintenancebackend.model.WorkOrder;
import com.bms.maintenancebackend.model.WorkOrderPriority;
import com.bms.maintenancebackend.model.WorkOrderStatus;
import com.bms.maintenancebackend.repository.AssetRepository;
import com.bms.maintenancebackend.repository.MaintenanceTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;

/**
 * Closes the loop when a work order completes: records the asset's maintenance history
 * and rolls the originating task forward to its next occurrence.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WorkOrderCompletionHandler {

    private final MaintenanceHistoryService historyService;
    private final AssetRepository assetRepository;
    private final MaintenanceTaskRepository taskRepository;
    private final ScheduleResolver scheduleResolver;
    private final DueTaskClassifier dueTaskClassifier;
    private final Clock clock;

    public Optional<MaintenanceHistory> handleWorkOrderCompletion(WorkOrder workOrder, String performedBy) {
        if (workOrder.getStatus() != WorkOrderStatus.COMPLETED) {
            throw new InvalidStateException("Work order " + workOrder.getId() + " is not completed");
        }
        if (workOrder.getAssetId() == null) {
            return Optional.empty();
        }

        String organizationId = workOrder.getOrganizationId();
        Asset asset = assetRepository.findByIdAndOrganizationId(workOrder.getAssetId(), organizationId)
                .orElseThrow(() -> new NotFoundException("Asset", workOrder.getAssetId()));

        LocalDateTime performedDate = workOrder.getCompletedAt() != null
                ? workOrder.getCompletedAt()
                : LocalDateTime.now(clock);

        MaintenanceHistory history = null;
        if (historyService.hasHistoryForWorkOrder(workOrder.getId())) {
            log.debug("History already recorded for work order {}", workOrder.getId());
        } else {
            MaintenanceHistory.MaintenanceType type = determineMaintenanceType(workOrder);
            LocalDateTime nextDue = type == MaintenanceHistory.MaintenanceType.PREVENTIVE
                    ? scheduleResolver.advance(performedDate, scheduleResolver.resolveFrequency(frequencyLabel(asset)))
                    : null;

            RecordMaintenanceRequest request = RecordMaintenanceRequest.builder()
                    .organizationId(organizationId)
                    .assetId(asset.getId())
                    .workOrderId(workOrder.getId())
                    .maintenanceType(type)
                    .performedBy(performedBy)
                    .performedDate(performedDate)
                    .description(StringUtils.hasText(workOrder.getDescription()) ? workOrder.getDescription() : workOrder.getTitle())
                    .cost(workOrder.getActualCost())
                    .downtimeHours(downtimeHours(workOrder))
                    .notes(workOrder.getNotes())
                    .nextMaintenanceDue(nextDue)
                    .build();
            history = historyService.recordCompletedMaintenance(request);
        }

        rollTaskForward(workOrder, performedDate);
        return Optional.ofNullable(history);
    }

    static MaintenanceHistory.MaintenanceType determineMaintenanceType(WorkOrder workOrder) {
        String description = workOrder.getDescription() == null
                ? ""
                : workOrder.getDescription().toLowerCase(Locale.ROOT);

        if (workOrder.getMaintenanceTaskId() != null
                || description.contains("preventive")
                || description.contains("scheduled")) {
            return MaintenanceHistory.MaintenanceType.PREVENTIVE;
        }
        if (workOrder.getPriority() == WorkOrderPriority.URGENT || description.contains("emergency")) {
            return MaintenanceHistory.MaintenanceType.EMERGENCY;
        }
        return MaintenanceHistory.MaintenanceType.CORRECTIVE;
    }

    static Double downtimeHours(WorkOrder workOrder) {
        if (workOrder.getStartedAt() == null || workOrder.getCompletedAt() == null) {
            return null;
        }
        return Duration.between(workOrder.getStartedAt(), workOrder.getCompletedAt()).toMinutes() / 60.0;
    }

    private void rollTaskForward(WorkOrder workOrder, LocalDateTime performedDate) {
        if (workOrder.getMaintenanceTaskId() == null) {
            return;
        }
        Optional<MaintenanceTask> found = taskRepository.findByIdAndOrganizationId(
                workOrder.getMaintenanceTaskId(), workOrder.getOrganizationId());
        if (found.isEmpty()) {
            log.warn("⚠️ Maintenance task {} of work order {} no longer exists",
                    workOrder.getMaintenanceTaskId(), workOrder.getId());
            return;
        }

        MaintenanceTask task = found.get();
        if (!task.isLive()) {
            return;
        }

        // Re-read the asset: recording history has just moved its schedule
        MaintenanceSchedule schedule = assetRepository
                .findByIdAndOrganizationId(task.getAssetId(), task.getOrganizationId())
                .map(Asset::getMaintenanceSchedule)
                .orElse(null);

        LocalDateTime now = LocalDateTime.now(clock);
        task.setLastPerformed(performedDate);
        if (workOrder.getId().equals(task.getLinkedWorkOrderId())) {
            task.setLinkedWorkOrderId(null);
        }
        task.setNextDueDate(scheduleResolver.computeNextDue(schedule, now));
        task.setStatus(dueTaskClassifier.classify(task, now));
        task.setUpdatedAt(now);
        taskRepository.save(task);

        log.info("⏭️ Maintenance task {} rolled forward to {} ({})", task.getId(), task.getNextDueDate(), task.getStatus());
    }

    private String frequencyLabel(Asset asset) {
        return asset.getMaintenanceSchedule() == null ? null : asset.getMaintenanceSchedule().getFrequency();
    }
}
