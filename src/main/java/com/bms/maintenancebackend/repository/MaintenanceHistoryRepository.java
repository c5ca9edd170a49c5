package com.bms.maintenancebackend.repository;

import com.bms.maintenancebackend.model.MaintenanceHistory;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface MaintenanceHistoryRepository extends MongoRepository<MaintenanceHistory, String> {

    List<MaintenanceHistory> findByOrganizationIdAndAssetIdOrderByPerformedDateDesc(
            String organizationId,
            String assetId,
            Pageable pageable
    );

    List<MaintenanceHistory> findByOrganizationIdAndAssetIdAndPerformedDateBetweenOrderByPerformedDateDesc(
            String organizationId,
            String assetId,
            LocalDateTime start,
            LocalDateTime end
    );

    boolean existsByWorkOrderId(String workOrderId);
}
