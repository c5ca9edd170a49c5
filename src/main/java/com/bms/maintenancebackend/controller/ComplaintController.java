package com.bms.maintenancebackend.controller;

import com.bms.maintenancebackend.dto.ComplaintConversionRequest;
import com.bms.maintenancebackend.maintenance.ComplaintConversionService;
import com.bms.maintenancebackend.model.WorkOrder;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;

@Tag(name = "Complaints", description = "Complaint to work-order conversion")
@Slf4j
@RestController
@RequestMapping("/api/complaints")
public class ComplaintController {

    @Autowired
    private ComplaintConversionService conversionService;

    @Operation(summary = "Convert complaint to work order",
            description = "Creates a work order from a complaint. Body fields override values derived from the complaint")
    @ApiResponse(responseCode = "201", description = "Work order created and linked to the complaint")
    @ApiResponse(responseCode = "400", description = "Complaint already linked, closed, resolved or without a unit")
    @ApiResponse(responseCode = "404", description = "Complaint or unit not found")
    @PostMapping("/{id}/convert-to-work-order")
    public ResponseEntity<WorkOrder> convertToWorkOrder(@PathVariable String id,
                                                        @RequestParam String organizationId,
                                                        @RequestBody(required = false) ComplaintConversionRequest request,
                                                        Principal principal) {
        log.info("📨 Converting complaint {} to a work order", id);
        WorkOrder workOrder = conversionService.convertComplaintToWorkOrder(
                id, organizationId, request, principal != null ? principal.getName() : null);
        return ResponseEntity.status(HttpStatus.CREATED).body(workOrder);
    }
}
