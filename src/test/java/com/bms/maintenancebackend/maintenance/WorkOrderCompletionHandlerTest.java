package com.bms.maintenancebackend.maintenance;

import com.bms.maintenancebackend.config.MaintenanceProperties;
import com.bms.maintenancebackend.dto.RecordMaintenanceRequest;
import com.bms.maintenancebackend.exception.InvalidStateException;
import com.bms.maintenancebackend.model.Asset;
import com.bms.maintenancebackend.model.MaintenanceHistory;
import com.bms.maintenancebackend.model.MaintenanceSchedule;
import com.bms.maintenancebackend.model.MaintenanceTask;
import com.bms.maintenancebackend.model.MaintenanceTaskStatus;
import com.bms.maintenancebackend.model.WorkOrder;
import com.bms.maintenancebackend.model.WorkOrderPriority;
import com.bms.maintenancebackend.model.WorkOrderStatus;
import com.bms.maintenancebackend.repository.AssetRepository;
import com.bms.maintenancebackend.repository.MaintenanceTaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
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
class WorkOrderCompletionHandlerTest {

    private static final LocalDateTime COMPLETED_AT = LocalDateTime.of(2024, 6, 1, 9, 0);

    @Mock
    private MaintenanceHistoryService historyService;

    @Mock
    private AssetRepository assetRepository;

    @Mock
    private MaintenanceTaskRepository taskRepository;

    private WorkOrderCompletionHandler handler;
    private Asset asset;
    private MaintenanceTask task;
    private WorkOrder workOrder;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T10:00:00Z"), ZoneOffset.UTC);
        DueTaskClassifier classifier = new DueTaskClassifier(taskRepository, new MaintenanceProperties(), clock);
        handler = new WorkOrderCompletionHandler(historyService, assetRepository, taskRepository,
                new ScheduleResolver(), classifier, clock);

        asset = new Asset();
        asset.setId("A1");
        asset.setOrganizationId("org1");
        asset.setMaintenanceSchedule(new MaintenanceSchedule("quarterly", LocalDateTime.of(2024, 2, 1, 0, 0), null));

        task = new MaintenanceTask();
        task.setId("t1");
        task.setOrganizationId("org1");
        task.setAssetId("A1");
        task.setStatus(MaintenanceTaskStatus.OVERDUE);
        task.setNextDueDate(LocalDateTime.of(2024, 5, 1, 0, 0));
        task.setLinkedWorkOrderId("wo1");
        task.setActiveAssetKey("A1");

        workOrder = new WorkOrder();
        workOrder.setId("wo1");
        workOrder.setOrganizationId("org1");
        workOrder.setAssetId("A1");
        workOrder.setMaintenanceTaskId("t1");
        workOrder.setTitle("Maintenance for Boiler");
        workOrder.setDescription("Scheduled maintenance for Boiler (equipment)");
        workOrder.setPriority(WorkOrderPriority.HIGH);
        workOrder.setStatus(WorkOrderStatus.COMPLETED);
        workOrder.setStartedAt(COMPLETED_AT.minusHours(3));
        workOrder.setCompletedAt(COMPLETED_AT);
        workOrder.setActualCost(180.0);
    }

    @Test
    void testHandleCompletion_recordsPreventiveHistoryAndRollsTaskForward() {
        when(assetRepository.findByIdAndOrganizationId("A1", "org1")).thenReturn(Optional.of(asset));
        when(historyService.hasHistoryForWorkOrder("wo1")).thenReturn(false);
        when(historyService.recordCompletedMaintenance(any(RecordMaintenanceRequest.class))).thenAnswer(invocation -> {
            RecordMaintenanceRequest request = invocation.getArgument(0);
            // What the real writer does to the asset
            asset.getMaintenanceSchedule().setLastMaintenanceDate(request.getPerformedDate());
            asset.getMaintenanceSchedule().setNextMaintenanceDate(request.getNextMaintenanceDue());
            MaintenanceHistory history = new MaintenanceHistory();
            history.setWorkOrderId(request.getWorkOrderId());
            history.setMaintenanceType(request.getMaintenanceType());
            return history;
        });
        when(taskRepository.findByIdAndOrganizationId("t1", "org1")).thenReturn(Optional.of(task));

        Optional<MaintenanceHistory> history = handler.handleWorkOrderCompletion(workOrder, "tech-9");

        assertTrue(history.isPresent());
        ArgumentCaptor<RecordMaintenanceRequest> captor = ArgumentCaptor.forClass(RecordMaintenanceRequest.class);
        verify(historyService).recordCompletedMaintenance(captor.capture());
        RecordMaintenanceRequest request = captor.getValue();
        assertEquals(MaintenanceHistory.MaintenanceType.PREVENTIVE, request.getMaintenanceType());
        assertEquals(COMPLETED_AT, request.getPerformedDate());
        assertEquals(COMPLETED_AT.plusMonths(3), request.getNextMaintenanceDue());
        assertEquals(3.0, request.getDowntimeHours());
        assertEquals(180.0, request.getCost());
        assertEquals("tech-9", request.getPerformedBy());
        assertEquals("wo1", request.getWorkOrderId());

        assertNull(task.getLinkedWorkOrderId());
        assertEquals(COMPLETED_AT, task.getLastPerformed());
        assertEquals(COMPLETED_AT.plusMonths(3), task.getNextDueDate());
        assertEquals(MaintenanceTaskStatus.SCHEDULED, task.getStatus());
        assertEquals("A1", task.getActiveAssetKey());
        verify(taskRepository).save(task);
    }

    @Test
    void testHandleCompletion_skipsHistoryAlreadyRecorded() {
        when(assetRepository.findByIdAndOrganizationId("A1", "org1")).thenReturn(Optional.of(asset));
        when(historyService.hasHistoryForWorkOrder("wo1")).thenReturn(true);
        when(taskRepository.findByIdAndOrganizationId("t1", "org1")).thenReturn(Optional.of(task));

        Optional<MaintenanceHistory> history = handler.handleWorkOrderCompletion(workOrder, "tech-9");

        assertTrue(history.isEmpty());
        verify(historyService, never()).recordCompletedMaintenance(any());
        assertNull(task.getLinkedWorkOrderId());
    }

    @Test
    void testHandleCompletion_complaintWorkOrderWithoutAssetDoesNothing() {
        workOrder.setAssetId(null);
        workOrder.setMaintenanceTaskId(null);

        assertTrue(handler.handleWorkOrderCompletion(workOrder, null).isEmpty());
        verifyNoInteractions(historyService, assetRepository, taskRepository);
    }

    @Test
    void testHandleCompletion_rejectsOpenWorkOrder() {
        workOrder.setStatus(WorkOrderStatus.IN_PROGRESS);

        assertThrows(InvalidStateException.class, () -> handler.handleWorkOrderCompletion(workOrder, null));
        verifyNoInteractions(historyService);
    }

    @Test
    void testDetermineMaintenanceType() {
        WorkOrder corrective = new WorkOrder();
        corrective.setDescription("Door hinge broken");
        corrective.setPriority(WorkOrderPriority.MEDIUM);
        assertEquals(MaintenanceHistory.MaintenanceType.CORRECTIVE, WorkOrderCompletionHandler.determineMaintenanceType(corrective));

        corrective.setPriority(WorkOrderPriority.URGENT);
        assertEquals(MaintenanceHistory.MaintenanceType.EMERGENCY, WorkOrderCompletionHandler.determineMaintenanceType(corrective));

        WorkOrder emergency = new WorkOrder();
        emergency.setDescription("Emergency shutoff after flooding");
        assertEquals(MaintenanceHistory.MaintenanceType.EMERGENCY, WorkOrderCompletionHandler.determineMaintenanceType(emergency));

        assertEquals(MaintenanceHistory.MaintenanceType.PREVENTIVE, WorkOrderCompletionHandler.determineMaintenanceType(workOrder));
    }

    @Test
    void testDowntimeHours_requiresBothTimestamps() {
        workOrder.setStartedAt(null);

        assertNull(WorkOrderCompletionHandler.downtimeHours(workOrder));
    }
}
