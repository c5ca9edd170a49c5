package com.bms.maintenancebackend.maintenance;

import com.bms.maintenancebackend.config.MaintenanceProperties;
import com.bms.maintenancebackend.dto.ComplaintConversionRequest;
import com.bms.maintenancebackend.exception.InvalidStateException;
import com.bms.maintenancebackend.exception.NotFoundException;
import com.bms.maintenancebackend.model.Complaint;
import com.bms.maintenancebackend.model.TimeWindow;
import com.bms.maintenancebackend.model.Unit;
import com.bms.maintenancebackend.model.WorkOrder;
import com.bms.maintenancebackend.model.WorkOrderCategory;
import com.bms.maintenancebackend.model.WorkOrderPriority;
import com.bms.maintenancebackend.model.WorkOrderStatus;
import com.bms.maintenancebackend.repository.ComplaintRepository;
import com.bms.maintenancebackend.repository.UnitRepository;
import com.bms.maintenancebackend.service.WorkOrderService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ComplaintConversionServiceTest {

    @Mock
    private ComplaintRepository complaintRepository;

    @Mock
    private UnitRepository unitRepository;

    @Mock
    private WorkOrderService workOrderService;

    private ComplaintConversionService conversionService;
    private Complaint complaint;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T10:00:00Z"), ZoneOffset.UTC);
        conversionService = new ComplaintConversionService(complaintRepository, unitRepository, workOrderService,
                new MaintenanceProperties(), clock);

        complaint = new Complaint();
        complaint.setId("C1");
        complaint.setOrganizationId("org1");
        complaint.setTenantId("tenant-1");
        complaint.setUnitId("U1");
        complaint.setCategory(Complaint.ComplaintCategory.MAINTENANCE);
        complaint.setMaintenanceCategory(Complaint.MaintenanceCategory.PLUMBING);
        complaint.setPriority(Complaint.ComplaintPriority.MEDIUM);
        complaint.setStatus(Complaint.ComplaintStatus.OPEN);
        complaint.setTitle("Leaking sink");
        complaint.setDescription("Kitchen sink leaks under the cabinet");
    }

    private void stubHappyPath() {
        when(complaintRepository.findByIdAndOrganizationId("C1", "org1")).thenReturn(Optional.of(complaint));
        when(unitRepository.findByIdAndOrganizationId("U1", "org1")).thenReturn(Optional.of(new Unit("U1", "org1", "B1", "101")));
        when(workOrderService.createWorkOrder(any(WorkOrder.class))).thenAnswer(invocation -> {
            WorkOrder workOrder = invocation.getArgument(0);
            workOrder.setId("wo1");
            return workOrder;
        });
    }

    @Test
    void testConvert_plumbingComplaintWithoutAssignee() {
        stubHappyPath();

        WorkOrder workOrder = conversionService.convertComplaintToWorkOrder("C1", "org1", null, "manager-1");

        assertEquals(WorkOrderCategory.PLUMBING, workOrder.getCategory());
        assertEquals(WorkOrderPriority.MEDIUM, workOrder.getPriority());
        assertEquals(WorkOrderStatus.OPEN, workOrder.getStatus());
        assertEquals("B1", workOrder.getBuildingId());
        assertEquals("U1", workOrder.getUnitId());
        assertEquals("C1", workOrder.getComplaintId());
        assertEquals("Leaking sink", workOrder.getTitle());
        assertEquals("manager-1", workOrder.getCreatedBy());
        assertEquals("complaint:C1", workOrder.getSourceKey());
        assertNull(workOrder.getAssignedTo());

        assertEquals("wo1", complaint.getLinkedWorkOrderId());
        assertEquals(Complaint.ComplaintStatus.IN_PROGRESS, complaint.getStatus());
        verify(complaintRepository).save(complaint);
    }

    @Test
    void testConvert_withAssigneeMarksComplaintAssigned() {
        stubHappyPath();
        ComplaintConversionRequest overrides = new ComplaintConversionRequest();
        overrides.setAssignedTo("tech-9");

        WorkOrder workOrder = conversionService.convertComplaintToWorkOrder("C1", "org1", overrides, null);

        assertEquals(WorkOrderStatus.ASSIGNED, workOrder.getStatus());
        assertEquals("tech-9", workOrder.getAssignedTo());
        assertEquals("system", workOrder.getCreatedBy());
        assertEquals(Complaint.ComplaintStatus.ASSIGNED, complaint.getStatus());
        assertEquals("tech-9", complaint.getAssignedTo());
    }

    @Test
    void testConvert_urgencyOverridesPriority() {
        complaint.setPriority(Complaint.ComplaintPriority.LOW);
        complaint.setUrgency(Complaint.Urgency.EMERGENCY);
        stubHappyPath();

        WorkOrder workOrder = conversionService.convertComplaintToWorkOrder("C1", "org1", null, null);

        assertEquals(WorkOrderPriority.URGENT, workOrder.getPriority());
    }

    @Test
    void testConvert_explicitOverridesWin() {
        stubHappyPath();
        TimeWindow window = new TimeWindow(LocalDateTime.of(2024, 6, 3, 9, 0), LocalDateTime.of(2024, 6, 3, 12, 0));
        complaint.setPreferredTimeWindow(new TimeWindow(LocalDateTime.of(2024, 6, 2, 14, 0), LocalDateTime.of(2024, 6, 2, 16, 0)));
        ComplaintConversionRequest overrides = new ComplaintConversionRequest(
                "B9", WorkOrderPriority.HIGH, WorkOrderCategory.ELECTRICAL, null,
                LocalDateTime.of(2024, 6, 3, 9, 0), window);

        WorkOrder workOrder = conversionService.convertComplaintToWorkOrder("C1", "org1", overrides, null);

        assertEquals("B9", workOrder.getBuildingId());
        assertEquals(WorkOrderPriority.HIGH, workOrder.getPriority());
        assertEquals(WorkOrderCategory.ELECTRICAL, workOrder.getCategory());
        assertEquals(window, workOrder.getScheduledTimeWindow());
        assertEquals(LocalDateTime.of(2024, 6, 3, 9, 0), workOrder.getScheduledDate());
    }

    @Test
    void testConvert_preferredWindowIsFallback() {
        TimeWindow preferred = new TimeWindow(LocalDateTime.of(2024, 6, 2, 14, 0), LocalDateTime.of(2024, 6, 2, 16, 0));
        complaint.setPreferredTimeWindow(preferred);
        stubHappyPath();

        WorkOrder workOrder = conversionService.convertComplaintToWorkOrder("C1", "org1", null, null);

        assertEquals(preferred, workOrder.getScheduledTimeWindow());
    }

    @ParameterizedTest
    @EnumSource(value = Complaint.ComplaintStatus.class, names = {"CLOSED", "RESOLVED"})
    void testConvert_rejectsFinishedComplaints(Complaint.ComplaintStatus status) {
        complaint.setStatus(status);
        when(complaintRepository.findByIdAndOrganizationId("C1", "org1")).thenReturn(Optional.of(complaint));

        assertThrows(InvalidStateException.class,
                () -> conversionService.convertComplaintToWorkOrder("C1", "org1", null, null));

        assertEquals(status, complaint.getStatus());
        assertNull(complaint.getLinkedWorkOrderId());
        verifyNoInteractions(workOrderService);
        verify(complaintRepository, never()).save(any());
    }

    @Test
    void testConvert_rejectsAlreadyLinkedComplaint() {
        complaint.setLinkedWorkOrderId("wo-old");
        when(complaintRepository.findByIdAndOrganizationId("C1", "org1")).thenReturn(Optional.of(complaint));

        assertThrows(InvalidStateException.class,
                () -> conversionService.convertComplaintToWorkOrder("C1", "org1", null, null));

        assertEquals("wo-old", complaint.getLinkedWorkOrderId());
        verifyNoInteractions(workOrderService);
        verify(complaintRepository, never()).save(any());
    }

    @Test
    void testConvert_rejectsComplaintWithoutUnit() {
        complaint.setUnitId(null);
        when(complaintRepository.findByIdAndOrganizationId("C1", "org1")).thenReturn(Optional.of(complaint));

        assertThrows(InvalidStateException.class,
                () -> conversionService.convertComplaintToWorkOrder("C1", "org1", null, null));

        verifyNoInteractions(unitRepository, workOrderService);
        verify(complaintRepository, never()).save(any());
    }

    @Test
    void testConvert_rejectsUnitWithoutBuilding() {
        when(complaintRepository.findByIdAndOrganizationId("C1", "org1")).thenReturn(Optional.of(complaint));
        when(unitRepository.findByIdAndOrganizationId("U1", "org1")).thenReturn(Optional.of(new Unit("U1", "org1", null, "101")));

        assertThrows(InvalidStateException.class,
                () -> conversionService.convertComplaintToWorkOrder("C1", "org1", null, null));

        verifyNoInteractions(workOrderService);
        verify(complaintRepository, never()).save(any());
        assertNull(complaint.getLinkedWorkOrderId());
    }

    @Test
    void testConvert_complaintNotFound() {
        when(complaintRepository.findByIdAndOrganizationId("C404", "org1")).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class,
                () -> conversionService.convertComplaintToWorkOrder("C404", "org1", null, null));
    }

    @Test
    void testConvert_unitNotFound() {
        when(complaintRepository.findByIdAndOrganizationId("C1", "org1")).thenReturn(Optional.of(complaint));
        when(unitRepository.findByIdAndOrganizationId("U1", "org1")).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class,
                () -> conversionService.convertComplaintToWorkOrder("C1", "org1", null, null));
        verifyNoInteractions(workOrderService);
    }

    @Test
    void testCategoryFor() {
        Complaint sample = new Complaint();
        sample.setCategory(Complaint.ComplaintCategory.CLEANLINESS);
        assertEquals(WorkOrderCategory.CLEANING, ComplaintConversionService.categoryFor(sample));

        sample.setCategory(Complaint.ComplaintCategory.SECURITY);
        assertEquals(WorkOrderCategory.SECURITY, ComplaintConversionService.categoryFor(sample));

        sample.setCategory(Complaint.ComplaintCategory.MAINTENANCE);
        assertEquals(WorkOrderCategory.OTHER, ComplaintConversionService.categoryFor(sample));

        sample.setMaintenanceCategory(Complaint.MaintenanceCategory.STRUCTURAL);
        assertEquals(WorkOrderCategory.OTHER, ComplaintConversionService.categoryFor(sample));

        sample.setMaintenanceCategory(Complaint.MaintenanceCategory.HVAC);
        assertEquals(WorkOrderCategory.HVAC, ComplaintConversionService.categoryFor(sample));
    }
}
