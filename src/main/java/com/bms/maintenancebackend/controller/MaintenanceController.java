package com.bms.maintenancebackend.controller;

import com.bms.maintenancebackend.dto.DueTaskProcessingResult;
import com.bms.maintenancebackend.dto.MaintenanceRunSummary;
import com.bms.maintenancebackend.dto.TaskGenerationResult;
import com.bms.maintenancebackend.maintenance.DueTaskClassifier;
import com.bms.maintenancebackend.maintenance.MaintenanceRunScheduler;
import com.bms.maintenancebackend.maintenance.WorkOrderGenerator;
import com.bms.maintenancebackend.model.MaintenanceTask;
import com.bms.maintenancebackend.model.MaintenanceTaskStatus;
import com.bms.maintenancebackend.service.MaintenanceTaskService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.List;
import java.util.Map;

@Tag(name = "Maintenance", description = "Preventive maintenance task generation and processing")
@Slf4j
@RestController
@RequestMapping("/api/maintenance")
public class MaintenanceController {

    @Autowired
    private MaintenanceRunScheduler runScheduler;

    @Autowired
    private DueTaskClassifier dueTaskClassifier;

    @Autowired
    private WorkOrderGenerator workOrderGenerator;

    @Autowired
    private MaintenanceTaskService taskService;

    @Operation(summary = "Generate maintenance tasks", description = "Creates a task for every active asset with a maintenance schedule and no task yet")
    @ApiResponse(responseCode = "200", description = "Generation counters")
    @PostMapping("/organizations/{orgId}/tasks/generate")
    public ResponseEntity<TaskGenerationResult> generateTasks(@PathVariable String orgId) {
        log.info("🛠️ Task generation requested for organization {}", orgId);
        return ResponseEntity.ok(runScheduler.generateTasks(orgId));
    }

    @Operation(summary = "Process due tasks", description = "Creates work orders for due and overdue tasks")
    @ApiResponse(responseCode = "200", description = "Processing counters")
    @PostMapping("/organizations/{orgId}/tasks/process-due")
    public ResponseEntity<DueTaskProcessingResult> processDueTasks(@PathVariable String orgId) {
        log.info("📅 Due-task processing requested for organization {}", orgId);
        return ResponseEntity.ok(runScheduler.processDueTasks(orgId));
    }

    @Operation(summary = "Run maintenance pass", description = "Generates tasks then processes due tasks, as the nightly run does")
    @ApiResponse(responseCode = "200", description = "Run summary, flagged as skipped when a run is already in progress")
    @PostMapping("/organizations/{orgId}/run")
    public ResponseEntity<MaintenanceRunSummary> run(@PathVariable String orgId) {
        return ResponseEntity.ok(runScheduler.runForOrganization(orgId));
    }

    @Operation(summary = "Get due tasks", description = "Tasks past their due date with no work order yet, earliest first")
    @GetMapping("/organizations/{orgId}/tasks/due")
    public ResponseEntity<List<MaintenanceTask>> getDueTasks(@PathVariable String orgId,
                                                             @RequestParam(defaultValue = "true") boolean includeOverdue) {
        return ResponseEntity.ok(dueTaskClassifier.findDueMaintenanceTasks(orgId, includeOverdue));
    }

    @Operation(summary = "List tasks", description = "Lists tasks of an organization, optionally filtered by status or asset")
    @GetMapping("/organizations/{orgId}/tasks")
    public ResponseEntity<List<MaintenanceTask>> getTasks(@PathVariable String orgId,
                                                          @RequestParam(required = false) MaintenanceTaskStatus status,
                                                          @RequestParam(required = false) String assetId) {
        return ResponseEntity.ok(taskService.getTasks(orgId, status, assetId));
    }

    @Operation(summary = "Create work order from task")
    @ApiResponse(responseCode = "201", description = "Work order created")
    @ApiResponse(responseCode = "400", description = "Task closed or already linked to a work order")
    @ApiResponse(responseCode = "404", description = "Task or asset not found")
    @PostMapping("/tasks/{taskId}/work-order")
    public ResponseEntity<Map<String, String>> createWorkOrder(@PathVariable String taskId,
                                                               @RequestParam String organizationId,
                                                               Principal principal) {
        String workOrderId = workOrderGenerator.createWorkOrderFromTask(
                taskId, organizationId, principal != null ? principal.getName() : null);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("workOrderId", workOrderId));
    }

    @Operation(summary = "Cancel task")
    @ApiResponse(responseCode = "200", description = "Task cancelled")
    @PostMapping("/tasks/{taskId}/cancel")
    public ResponseEntity<MaintenanceTask> cancelTask(@PathVariable String taskId, @RequestParam String organizationId) {
        return ResponseEntity.ok(taskService.cancelTask(taskId, organizationId));
    }
}
