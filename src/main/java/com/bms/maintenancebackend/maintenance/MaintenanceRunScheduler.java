package com.bms.maintenancebackend.maintenance;

import com.bms.maintenancebackend.dto.DueTaskProcessingResult;
import com.bms.maintenancebackend.dto.MaintenanceRunSummary;
import com.bms.maintenancebackend.dto.TaskGenerationResult;
import com.bms.maintenancebackend.exception.InvalidStateException;
import com.bms.maintenancebackend.model.Asset;
import com.bms.maintenancebackend.service.MaintenanceUpdatePublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.function.Supplier;

/**
 * Periodic maintenance pass: materialize tasks, then turn due tasks into work orders,
 * for every organization that owns assets.
 * <p>
 * Passes for one organization never overlap within a process. The nightly run skips a
 * busy organization; on-demand calls are rejected.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MaintenanceRunScheduler {

    private final MaintenanceTaskGenerator taskGenerator;
    private final WorkOrderGenerator workOrderGenerator;
    private final OrganizationRunLock runLock;
    private final MongoTemplate mongoTemplate;
    private final MaintenanceUpdatePublisher updatePublisher;
    private final Clock clock;

    @Value("${maintenance.scheduler.enabled:true}")
    private boolean schedulerEnabled;

    @Scheduled(cron = "${maintenance.scheduler.cron:0 0 2 * * *}")
    public void runForAllOrganizations() {
        if (!schedulerEnabled) {
            return;
        }

        List<String> organizationIds = mongoTemplate.findDistinct(new Query(), "organizationId", Asset.class, String.class);
        log.info("⏰ Nightly maintenance run for {} organizations", organizationIds.size());

        for (String organizationId : organizationIds) {
            if (organizationId == null) {
                continue;
            }
            try {
                runForOrganization(organizationId);
            } catch (Exception e) {
                log.error("❌ Maintenance run failed for organization {}: {}", organizationId, e.getMessage(), e);
            }
        }
    }

    public MaintenanceRunSummary runForOrganization(String organizationId) {
        LocalDateTime startedAt = LocalDateTime.now(clock);

        MaintenanceRunSummary summary = runLock.runExclusive(organizationId, () -> {
            TaskGenerationResult generation = taskGenerator.generateMaintenanceTasks(organizationId);
            DueTaskProcessingResult processing = workOrderGenerator.processDueMaintenanceTasks(organizationId);
            return new MaintenanceRunSummary(organizationId, false, generation, processing,
                    startedAt, LocalDateTime.now(clock));
        }).orElseGet(() -> {
            log.warn("⚠️ Maintenance run already in progress for organization {}, skipping", organizationId);
            return MaintenanceRunSummary.skipped(organizationId, startedAt);
        });

        updatePublisher.publishRunSummary(summary);
        return summary;
    }

    public TaskGenerationResult generateTasks(String organizationId) {
        return exclusive(organizationId, () -> taskGenerator.generateMaintenanceTasks(organizationId));
    }

    public DueTaskProcessingResult processDueTasks(String organizationId) {
        return exclusive(organizationId, () -> workOrderGenerator.processDueMaintenanceTasks(organizationId));
    }

    private <T> T exclusive(String organizationId, Supplier<T> work) {
        return runLock.runExclusive(organizationId, work)
                .orElseThrow(() -> new InvalidStateException(
                        "A maintenance run is already in progress for organization " + organizationId));
    }
}
