package com.bms.maintenancebackend.maintenance;

import com.bms.maintenancebackend.config.MaintenanceProperties;
import com.bms.maintenancebackend.dto.ComplaintConversionRequest;
import com.bms.maintenancebackend.exception.InvalidStateException;
import com.bms.maintenancebackend.exception.NotFoundException;
import com.bms.maintenancebackend.model.Complaint;
import com.bms.maintenancebackend.model.Unit;
import com.bms.maintenancebackend.model.WorkOrder;
import com.bms.maintenancebackend.model.WorkOrderCategory;
import com.bms.maintenancebackend.model.WorkOrderPriority;
import com.bms.maintenancebackend.model.WorkOrderStatus;
import com.bms.maintenancebackend.repository.ComplaintRepository;
import com.bms.maintenancebackend.repository.UnitRepository;
import com.bms.maintenancebackend.service.WorkOrderService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Converts a tenant complaint into a work order. Every check runs before anything is
 * written, so a rejected conversion leaves the complaint untouched.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ComplaintConversionService {

    private final ComplaintRepository complaintRepository;
    private final UnitRepository unitRepository;
    private final WorkOrderService workOrderService;
    private final MaintenanceProperties properties;
    private final Clock clock;

    public WorkOrder convertComplaintToWorkOrder(String complaintId,
                                                 String organizationId,
                                                 ComplaintConversionRequest overrides,
                                                 String createdBy) {
        ComplaintConversionRequest request = overrides != null ? overrides : new ComplaintConversionRequest();

        Complaint complaint = complaintRepository.findByIdAndOrganizationId(complaintId, organizationId)
                .orElseThrow(() -> new NotFoundException("Complaint", complaintId));

        if (complaint.getLinkedWorkOrderId() != null) {
            throw new InvalidStateException("Complaint " + complaintId
                    + " is already linked to work order " + complaint.getLinkedWorkOrderId());
        }
        if (complaint.getStatus() == Complaint.ComplaintStatus.CLOSED
                || complaint.getStatus() == Complaint.ComplaintStatus.RESOLVED) {
            throw new InvalidStateException("Cannot convert a " + complaint.getStatus() + " complaint to a work order");
        }
        if (!StringUtils.hasText(complaint.getUnitId())) {
            throw new InvalidStateException("Complaint " + complaintId + " has no unit");
        }

        Unit unit = unitRepository.findByIdAndOrganizationId(complaint.getUnitId(), organizationId)
                .orElseThrow(() -> new NotFoundException("Unit", complaint.getUnitId()));

        String buildingId = StringUtils.hasText(request.getBuildingId()) ? request.getBuildingId() : unit.getBuildingId();
        if (!StringUtils.hasText(buildingId)) {
            throw new InvalidStateException("Unit " + unit.getId() + " of complaint " + complaintId + " has no building");
        }

        boolean assigned = StringUtils.hasText(request.getAssignedTo());

        WorkOrder workOrder = new WorkOrder();
        workOrder.setOrganizationId(organizationId);
        workOrder.setBuildingId(buildingId);
        workOrder.setUnitId(complaint.getUnitId());
        workOrder.setComplaintId(complaint.getId());
        workOrder.setTitle(complaint.getTitle());
        workOrder.setDescription(complaint.getDescription());
        workOrder.setCategory(request.getCategory() != null ? request.getCategory() : categoryFor(complaint));
        workOrder.setPriority(request.getPriority() != null ? request.getPriority() : priorityFor(complaint));
        workOrder.setAssignedTo(assigned ? request.getAssignedTo() : null);
        workOrder.setStatus(assigned ? WorkOrderStatus.ASSIGNED : WorkOrderStatus.OPEN);
        workOrder.setScheduledDate(request.getScheduledDate());
        workOrder.setScheduledTimeWindow(request.getScheduledTimeWindow() != null
                ? request.getScheduledTimeWindow()
                : complaint.getPreferredTimeWindow());
        workOrder.setCreatedBy(StringUtils.hasText(createdBy) ? createdBy : properties.getSystemUser());
        workOrder.setSourceKey("complaint:" + complaint.getId());

        WorkOrder saved = workOrderService.createWorkOrder(workOrder);

        complaint.setLinkedWorkOrderId(saved.getId());
        complaint.setStatus(assigned ? Complaint.ComplaintStatus.ASSIGNED : Complaint.ComplaintStatus.IN_PROGRESS);
        if (assigned) {
            complaint.setAssignedTo(request.getAssignedTo());
        }
        complaint.setUpdatedAt(LocalDateTime.now(clock));
        complaintRepository.save(complaint);

        log.info("📨 Complaint {} converted to work order {} ({}, {})",
                complaint.getId(), saved.getId(), saved.getCategory(), saved.getPriority());
        return saved;
    }

    static WorkOrderCategory categoryFor(Complaint complaint) {
        if (complaint.getMaintenanceCategory() != null) {
            switch (complaint.getMaintenanceCategory()) {
                case PLUMBING:
                    return WorkOrderCategory.PLUMBING;
                case ELECTRICAL:
                    return WorkOrderCategory.ELECTRICAL;
                case HVAC:
                    return WorkOrderCategory.HVAC;
                default:
                    return WorkOrderCategory.OTHER;
            }
        }
        if (complaint.getCategory() == null) {
            return WorkOrderCategory.OTHER;
        }
        switch (complaint.getCategory()) {
            case SECURITY:
                return WorkOrderCategory.SECURITY;
            case CLEANLINESS:
                return WorkOrderCategory.CLEANING;
            default:
                return WorkOrderCategory.OTHER;
        }
    }

    static WorkOrderPriority priorityFor(Complaint complaint) {
        if (complaint.getUrgency() != null) {
            switch (complaint.getUrgency()) {
                case LOW:
                    return WorkOrderPriority.LOW;
                case MEDIUM:
                    return WorkOrderPriority.MEDIUM;
                case HIGH:
                    return WorkOrderPriority.HIGH;
                default:
                    return WorkOrderPriority.URGENT;
            }
        }
        if (complaint.getPriority() == null) {
            return WorkOrderPriority.MEDIUM;
        }
        return WorkOrderPriority.valueOf(complaint.getPriority().name());
    }
}
