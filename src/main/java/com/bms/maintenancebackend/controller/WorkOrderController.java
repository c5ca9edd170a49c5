package com.bms.maintenancebackend.controller;

import com.bms.maintenancebackend.dto.WorkOrderCompletionRequest;
import com.bms.maintenancebackend.dto.WorkOrderStatusRequest;
import com.bms.maintenancebackend.model.WorkOrder;
import com.bms.maintenancebackend.model.WorkOrderStatus;
import com.bms.maintenancebackend.service.WorkOrderService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Work Orders", description = "Work-order lookup and lifecycle")
@Slf4j
@RestController
@RequestMapping("/api/work-orders")
public class WorkOrderController {

    @Autowired
    private WorkOrderService workOrderService;

    @Operation(summary = "List work orders by status", description = "Newest first")
    @GetMapping
    public ResponseEntity<List<WorkOrder>> getWorkOrders(@RequestParam String organizationId,
                                                         @RequestParam WorkOrderStatus status) {
        return ResponseEntity.ok(workOrderService.getWorkOrdersByStatus(organizationId, status));
    }

    @Operation(summary = "Get work order")
    @ApiResponse(responseCode = "200", description = "Work order found")
    @ApiResponse(responseCode = "404", description = "Work order not found")
    @GetMapping("/{id}")
    public ResponseEntity<WorkOrder> getWorkOrder(@PathVariable String id, @RequestParam String organizationId) {
        return ResponseEntity.ok(workOrderService.getWorkOrder(id, organizationId));
    }

    @Operation(summary = "Update work order status", description = "Applies a status transition, optionally assigning the work order")
    @ApiResponse(responseCode = "200", description = "Status updated")
    @ApiResponse(responseCode = "400", description = "Transition not allowed")
    @PatchMapping("/{id}/status")
    public ResponseEntity<WorkOrder> updateStatus(@PathVariable String id,
                                                  @RequestParam String organizationId,
                                                  @Valid @RequestBody WorkOrderStatusRequest request) {
        log.info("🔄 Status change for work order {} to {}", id, request.getStatus());
        return ResponseEntity.ok(workOrderService.updateStatus(id, organizationId, request.getStatus(), request.getAssignedTo()));
    }

    @Operation(summary = "Complete work order", description = "Completes an in-progress work order and records the asset's maintenance history")
    @ApiResponse(responseCode = "200", description = "Work order completed")
    @ApiResponse(responseCode = "400", description = "Work order is not in progress")
    @PostMapping("/{id}/complete")
    public ResponseEntity<WorkOrder> complete(@PathVariable String id,
                                              @RequestParam String organizationId,
                                              @RequestBody(required = false) WorkOrderCompletionRequest request) {
        return ResponseEntity.ok(workOrderService.completeWorkOrder(id, organizationId, request));
    }
}
