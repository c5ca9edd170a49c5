package com.bms.maintenancebackend.maintenance;

import com.bms.maintenancebackend.config.MaintenanceProperties;
import com.bms.maintenancebackend.exception.StoreException;
import com.bms.maintenancebackend.model.MaintenanceTask;
import com.bms.maintenancebackend.model.MaintenanceTaskStatus;
import com.bms.maintenancebackend.repository.MaintenanceTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Labels live tasks SCHEDULED, DUE or OVERDUE from their due date and selects the ones
 * ready for work-order generation.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DueTaskClassifier {

    static final Set<MaintenanceTaskStatus> CLOSED_STATUSES =
            EnumSet.of(MaintenanceTaskStatus.COMPLETED, MaintenanceTaskStatus.CANCELLED);

    private final MaintenanceTaskRepository taskRepository;
    private final MaintenanceProperties properties;
    private final Clock clock;

    /**
     * Closed tasks keep their status. Live tasks are SCHEDULED until their due date,
     * DUE within the configured grace period after it and OVERDUE beyond that.
     */
    public MaintenanceTaskStatus classify(MaintenanceTask task, LocalDateTime now) {
        if (task.getStatus() != null && task.getStatus().isClosed()) {
            return task.getStatus();
        }
        LocalDateTime dueDate = task.getNextDueDate();
        if (dueDate == null || dueDate.isAfter(now)) {
            return MaintenanceTaskStatus.SCHEDULED;
        }
        Duration elapsed = Duration.between(dueDate, now);
        if (elapsed.compareTo(properties.getOverdueGrace()) <= 0) {
            return MaintenanceTaskStatus.DUE;
        }
        return MaintenanceTaskStatus.OVERDUE;
    }

    /**
     * Live tasks whose due date has passed and that have no work order in flight, earliest first.
     * With {@code includeOverdue} false only the tasks still within the grace period are returned.
     */
    public List<MaintenanceTask> findDueMaintenanceTasks(String organizationId, boolean includeOverdue) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<MaintenanceTask> candidates;
        try {
            candidates = taskRepository
                    .findByOrganizationIdAndStatusNotInAndNextDueDateLessThanEqualAndLinkedWorkOrderIdIsNullOrderByNextDueDateAsc(
                            organizationId, CLOSED_STATUSES, now);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to query due maintenance tasks for organization " + organizationId, e);
        }

        if (includeOverdue) {
            return candidates;
        }
        return candidates.stream()
                .filter(task -> classify(task, now) == MaintenanceTaskStatus.DUE)
                .collect(Collectors.toList());
    }

    /**
     * Persists the current label of every live task in the organization.
     *
     * @return number of tasks whose status changed
     */
    public int refreshStatuses(String organizationId) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<MaintenanceTask> liveTasks;
        try {
            liveTasks = taskRepository.findByOrganizationIdAndStatusNotInOrderByNextDueDateAsc(organizationId, CLOSED_STATUSES);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to list live maintenance tasks for organization " + organizationId, e);
        }

        int changed = 0;
        for (MaintenanceTask task : liveTasks) {
            MaintenanceTaskStatus label = classify(task, now);
            if (label == task.getStatus()) {
                continue;
            }
            try {
                task.setStatus(label);
                task.setUpdatedAt(now);
                taskRepository.save(task);
                changed++;
            } catch (DataAccessException e) {
                log.error("❌ Failed to relabel maintenance task {} as {}: {}", task.getId(), label, e.getMessage(), e);
            }
        }

        if (changed > 0) {
            log.info("🏷️ Relabelled {} maintenance tasks for organization {}", changed, organizationId);
        }
        return changed;
    }
}
