package com.bms.maintenancebackend.service;

import com.bms.maintenancebackend.exception.InvalidStateException;
import com.bms.maintenancebackend.exception.NotFoundException;
import com.bms.maintenancebackend.model.MaintenanceTask;
import com.bms.maintenancebackend.model.MaintenanceTaskStatus;
import com.bms.maintenancebackend.repository.MaintenanceTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class MaintenanceTaskService {

    private final MaintenanceTaskRepository taskRepository;
    private final Clock clock;

    public List<MaintenanceTask> getTasks(String organizationId, MaintenanceTaskStatus status, String assetId) {
        if (assetId != null) {
            return taskRepository.findByOrganizationIdAndAssetIdOrderByNextDueDateAsc(organizationId, assetId)
                    .stream()
                    .filter(task -> status == null || task.getStatus() == status)
                    .collect(Collectors.toList());
        }
        if (status != null) {
            return taskRepository.findByOrganizationIdAndStatusOrderByNextDueDateAsc(organizationId, status);
        }
        return taskRepository.findByOrganizationIdOrderByNextDueDateAsc(organizationId);
    }

    public MaintenanceTask getTask(String taskId, String organizationId) {
        return taskRepository.findByIdAndOrganizationId(taskId, organizationId)
                .orElseThrow(() -> new NotFoundException("Maintenance task", taskId));
    }

    /**
     * Cancels a live task. The asset becomes eligible for a fresh task on the next materialization.
     */
    public MaintenanceTask cancelTask(String taskId, String organizationId) {
        MaintenanceTask task = getTask(taskId, organizationId);
        if (!task.isLive()) {
            throw new InvalidStateException("Maintenance task " + taskId + " is already " + task.getStatus());
        }

        task.setStatus(MaintenanceTaskStatus.CANCELLED);
        task.setActiveAssetKey(null);
        task.setUpdatedAt(LocalDateTime.now(clock));
        MaintenanceTask saved = taskRepository.save(task);

        log.info("🚫 Maintenance task {} cancelled", taskId);
        return saved;
    }
}
