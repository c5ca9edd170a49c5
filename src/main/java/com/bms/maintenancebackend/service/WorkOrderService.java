package com.bms.maintenancebackend.service;

import com.bms.maintenancebackend.dto.WorkOrderCompletionRequest;
import com.bms.maintenancebackend.exception.InvalidStateException;
import com.bms.maintenancebackend.exception.MaintenanceException;
import com.bms.maintenancebackend.exception.NotFoundException;
import com.bms.maintenancebackend.exception.StoreException;
import com.bms.maintenancebackend.exception.ValidationException;
import com.bms.maintenancebackend.maintenance.WorkOrderCompletionHandler;
import com.bms.maintenancebackend.model.WorkOrder;
import com.bms.maintenancebackend.model.WorkOrderStatus;
import com.bms.maintenancebackend.repository.MaintenanceTaskRepository;
import com.bms.maintenancebackend.repository.WorkOrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Work-order persistence and lifecycle.
 * <p>
 * Status changes follow {@link WorkOrderStatus#allowedTransitions()}. Reaching a terminal
 * status releases the work order's {@code sourceKey} so its origin can produce a new one.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WorkOrderService {

    private final WorkOrderRepository workOrderRepository;
    private final MaintenanceTaskRepository taskRepository;
    private final WorkOrderCompletionHandler completionHandler;
    private final MaintenanceUpdatePublisher updatePublisher;
    private final Clock clock;

    public WorkOrder createWorkOrder(WorkOrder workOrder) {
        validate(workOrder);

        LocalDateTime now = LocalDateTime.now(clock);
        if (workOrder.getStatus() == null) {
            workOrder.setStatus(WorkOrderStatus.OPEN);
        }
        workOrder.setCreatedAt(now);
        workOrder.setUpdatedAt(now);

        WorkOrder saved;
        try {
            saved = workOrderRepository.save(workOrder);
        } catch (DuplicateKeyException e) {
            throw new InvalidStateException("An active work order already exists for " + workOrder.getSourceKey());
        } catch (DataAccessException e) {
            throw new StoreException("Failed to save work order: " + workOrder.getTitle(), e);
        }

        log.info("📋 Work order {} created ({}, {}) by {}",
                saved.getId(), saved.getCategory(), saved.getPriority(), saved.getCreatedBy());
        updatePublisher.publishWorkOrderUpdate(saved);
        return saved;
    }

    public WorkOrder getWorkOrder(String id, String organizationId) {
        return workOrderRepository.findByIdAndOrganizationId(id, organizationId)
                .orElseThrow(() -> new NotFoundException("Work order", id));
    }

    public List<WorkOrder> getWorkOrdersByStatus(String organizationId, WorkOrderStatus status) {
        return workOrderRepository.findByOrganizationIdAndStatusOrderByCreatedAtDesc(organizationId, status);
    }

    /**
     * Moves a work order to {@code target}. An assignee supplied with an OPEN work order
     * promotes it to ASSIGNED. Asking for the current status only applies the assignee.
     */
    public WorkOrder updateStatus(String id, String organizationId, WorkOrderStatus target, String assignedTo) {
        WorkOrder workOrder = getWorkOrder(id, organizationId);

        WorkOrderStatus effectiveTarget = target;
        if (StringUtils.hasText(assignedTo)) {
            workOrder.setAssignedTo(assignedTo);
            if (target == WorkOrderStatus.OPEN && workOrder.getStatus() == WorkOrderStatus.OPEN) {
                effectiveTarget = WorkOrderStatus.ASSIGNED;
            }
        }

        if (workOrder.getStatus() == effectiveTarget) {
            if (StringUtils.hasText(assignedTo)) {
                return save(workOrder);
            }
            return workOrder;
        }

        if (effectiveTarget == WorkOrderStatus.COMPLETED) {
            return complete(workOrder, null);
        }
        checkTransition(workOrder, effectiveTarget);
        return applyTransition(workOrder, effectiveTarget);
    }

    /**
     * Completes an in-progress work order and feeds the result back into the asset's
     * maintenance history and its originating task.
     */
    public WorkOrder completeWorkOrder(String id, String organizationId, WorkOrderCompletionRequest request) {
        WorkOrder workOrder = getWorkOrder(id, organizationId);
        if (request != null) {
            if (request.getActualCost() != null) {
                workOrder.setActualCost(request.getActualCost());
            }
            if (StringUtils.hasText(request.getNotes())) {
                workOrder.setNotes(request.getNotes().trim());
            }
        }
        return complete(workOrder, request == null ? null : request.getPerformedBy());
    }

    private WorkOrder complete(WorkOrder workOrder, String performedBy) {
        checkTransition(workOrder, WorkOrderStatus.COMPLETED);
        WorkOrder saved = applyTransition(workOrder, WorkOrderStatus.COMPLETED);

        String completedBy = StringUtils.hasText(performedBy) ? performedBy : saved.getAssignedTo();
        try {
            completionHandler.handleWorkOrderCompletion(saved, completedBy);
        } catch (MaintenanceException | DataAccessException e) {
            // The completion itself stands; history can be recorded manually
            log.error("❌ Work order {} completed but maintenance feedback failed: {}",
                    saved.getId(), e.getMessage(), e);
        } finally {
            // A task linked to a closed work order would never be selected again
            releaseTask(saved);
        }
        return saved;
    }

    private void checkTransition(WorkOrder workOrder, WorkOrderStatus target) {
        WorkOrderStatus current = workOrder.getStatus();
        if (!current.canTransitionTo(target)) {
            String allowed = current.allowedTransitions().stream()
                    .map(Enum::name)
                    .collect(Collectors.joining(", "));
            throw new InvalidStateException("Invalid status transition: cannot change from " + current
                    + " to " + target + ". Allowed: " + (allowed.isEmpty() ? "none" : allowed));
        }
    }

    private WorkOrder applyTransition(WorkOrder workOrder, WorkOrderStatus target) {
        LocalDateTime now = LocalDateTime.now(clock);
        workOrder.setStatus(target);

        if (target == WorkOrderStatus.IN_PROGRESS && workOrder.getStartedAt() == null) {
            workOrder.setStartedAt(now);
        }
        if (target == WorkOrderStatus.COMPLETED) {
            workOrder.setCompletedAt(now);
        }
        if (target.isTerminal()) {
            workOrder.setSourceKey(null);
        }

        WorkOrder saved = save(workOrder);
        log.info("🔄 Work order {} is now {}", saved.getId(), target);

        if (target == WorkOrderStatus.CANCELLED) {
            releaseTask(saved);
        }
        return saved;
    }

    private void releaseTask(WorkOrder workOrder) {
        if (workOrder.getMaintenanceTaskId() == null) {
            return;
        }
        taskRepository.findByIdAndOrganizationId(workOrder.getMaintenanceTaskId(), workOrder.getOrganizationId())
                .filter(task -> workOrder.getId().equals(task.getLinkedWorkOrderId()))
                .ifPresent(task -> {
                    task.setLinkedWorkOrderId(null);
                    task.setUpdatedAt(LocalDateTime.now(clock));
                    taskRepository.save(task);
                    log.info("🔓 Maintenance task {} released after work order {} was {}",
                            task.getId(), workOrder.getId(), workOrder.getStatus());
                });
    }

    private WorkOrder save(WorkOrder workOrder) {
        workOrder.setUpdatedAt(LocalDateTime.now(clock));
        try {
            WorkOrder saved = workOrderRepository.save(workOrder);
            updatePublisher.publishWorkOrderUpdate(saved);
            return saved;
        } catch (DataAccessException e) {
            throw new StoreException("Failed to update work order " + workOrder.getId(), e);
        }
    }

    private void validate(WorkOrder workOrder) {
        if (!StringUtils.hasText(workOrder.getOrganizationId())) {
            throw new ValidationException("organizationId", "Organization is required");
        }
        if (!StringUtils.hasText(workOrder.getTitle())) {
            throw new ValidationException("title", "Title is required");
        }
        if (!StringUtils.hasText(workOrder.getDescription())) {
            throw new ValidationException("description", "Description is required");
        }
        if (workOrder.getCategory() == null) {
            throw new ValidationException("category", "Category is required");
        }
        if (workOrder.getPriority() == null) {
            throw new ValidationException("priority", "Priority is required");
        }
    }
}
