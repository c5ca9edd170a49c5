package com.bms.maintenancebackend.repository;

import com.bms.maintenancebackend.model.MaintenanceTask;
import com.bms.maintenancebackend.model.MaintenanceTaskStatus;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface MaintenanceTaskRepository extends MongoRepository<MaintenanceTask, String> {

    Optional<MaintenanceTask> findByIdAndOrganizationId(String id, String organizationId);

    List<MaintenanceTask> findByOrganizationIdAndAssetIdAndStatusNot(
            String organizationId,
            String assetId,
            MaintenanceTaskStatus status
    );

    List<MaintenanceTask> findByOrganizationIdAndStatusNotInOrderByNextDueDateAsc(
            String organizationId,
            Collection<MaintenanceTaskStatus> statuses
    );

    List<MaintenanceTask> findByOrganizationIdAndStatusOrderByNextDueDateAsc(
            String organizationId,
            MaintenanceTaskStatus status
    );

    List<MaintenanceTask> findByOrganizationIdAndAssetIdOrderByNextDueDateAsc(String organizationId, String assetId);

    List<MaintenanceTask> findByOrganizationIdOrderByNextDueDateAsc(String organizationId);

    // Due selection: reached its due date, still live, no work order in flight
    List<MaintenanceTask> findByOrganizationIdAndStatusNotInAndNextDueDateLessThanEqualAndLinkedWorkOrderIdIsNullOrderByNextDueDateAsc(
            String organizationId,
            Collection<MaintenanceTaskStatus> closedStatuses,
            LocalDateTime now
    );
}
