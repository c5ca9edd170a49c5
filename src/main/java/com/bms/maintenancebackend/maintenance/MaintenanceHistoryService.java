package com.bms.maintenancebackend.maintenance;

import com.bms.maintenancebackend.config.RedisConfig;
import com.bms.maintenancebackend.dto.RecordMaintenanceRequest;
import com.bms.maintenancebackend.exception.InvalidStateException;
import com.bms.maintenancebackend.exception.NotFoundException;
import com.bms.maintenancebackend.exception.StoreException;
import com.bms.maintenancebackend.exception.ValidationException;
import com.bms.maintenancebackend.model.Asset;
import com.bms.maintenancebackend.model.MaintenanceHistory;
import com.bms.maintenancebackend.model.MaintenanceSchedule;
import com.bms.maintenancebackend.repository.AssetRepository;
import com.bms.maintenancebackend.repository.MaintenanceHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Appends completed maintenance to an asset's history and writes the dates back onto the
 * asset's schedule, which the next task materialization reads.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MaintenanceHistoryService {

    static final int DEFAULT_HISTORY_LIMIT = 50;

    private final MaintenanceHistoryRepository historyRepository;
    private final AssetRepository assetRepository;
    private final Clock clock;

    @CacheEvict(value = RedisConfig.ASSET_RELIABILITY_CACHE, allEntries = true)
    public MaintenanceHistory recordCompletedMaintenance(RecordMaintenanceRequest request) {
        if (!StringUtils.hasText(request.getAssetId())) {
            throw new ValidationException("assetId", "Asset is required");
        }
        Asset asset = assetRepository.findByIdAndOrganizationId(request.getAssetId(), request.getOrganizationId())
                .orElseThrow(() -> new NotFoundException("Asset", request.getAssetId()));

        if (!StringUtils.hasText(request.getDescription())) {
            throw new ValidationException("description", "Description is required");
        }
        if (request.getPerformedDate() == null) {
            throw new ValidationException("performedDate", "Performed date is required");
        }
        if (request.getNextMaintenanceDue() != null
                && request.getNextMaintenanceDue().isBefore(request.getPerformedDate())) {
            throw new ValidationException("nextMaintenanceDue", "Next maintenance due cannot be before the performed date");
        }

        LocalDateTime now = LocalDateTime.now(clock);

        MaintenanceHistory history = new MaintenanceHistory();
        history.setOrganizationId(request.getOrganizationId());
        history.setAssetId(asset.getId());
        history.setWorkOrderId(request.getWorkOrderId());
        history.setMaintenanceType(request.getMaintenanceType());
        history.setPerformedBy(request.getPerformedBy());
        history.setPerformedDate(request.getPerformedDate());
        history.setDescription(request.getDescription().trim());
        history.setCost(request.getCost());
        history.setDowntimeHours(request.getDowntimeHours());
        history.setNotes(StringUtils.hasText(request.getNotes()) ? request.getNotes().trim() : null);
        history.setNextMaintenanceDue(request.getNextMaintenanceDue());
        history.setCreatedAt(now);

        MaintenanceHistory saved;
        try {
            saved = historyRepository.save(history);
        } catch (DuplicateKeyException e) {
            throw new InvalidStateException("Maintenance history already recorded for work order " + request.getWorkOrderId());
        } catch (DataAccessException e) {
            throw new StoreException("Failed to record maintenance history for asset " + asset.getId(), e);
        }

        updateAssetSchedule(asset, request.getPerformedDate(), request.getNextMaintenanceDue(), now);

        log.info("📝 {} maintenance recorded for asset {} on {}",
                saved.getMaintenanceType(), asset.getId(), saved.getPerformedDate());
        return saved;
    }

    public List<MaintenanceHistory> getHistory(String assetId, String organizationId, Integer limit) {
        int size = limit == null || limit <= 0 ? DEFAULT_HISTORY_LIMIT : limit;
        return historyRepository.findByOrganizationIdAndAssetIdOrderByPerformedDateDesc(
                organizationId, assetId, PageRequest.of(0, size));
    }

    public boolean hasHistoryForWorkOrder(String workOrderId) {
        return historyRepository.existsByWorkOrderId(workOrderId);
    }

    private void updateAssetSchedule(Asset asset, LocalDateTime performedDate, LocalDateTime nextDue, LocalDateTime now) {
        MaintenanceSchedule schedule = asset.getMaintenanceSchedule();
        if (schedule == null) {
            schedule = new MaintenanceSchedule();
            asset.setMaintenanceSchedule(schedule);
        }

        schedule.setLastMaintenanceDate(performedDate);
        if (nextDue != null) {
            schedule.setNextMaintenanceDate(nextDue);
        } else if (schedule.getNextMaintenanceDate() != null
                && schedule.getNextMaintenanceDate().isBefore(performedDate)) {
            schedule.setNextMaintenanceDate(null);
        }
        asset.setUpdatedAt(now);

        try {
            assetRepository.save(asset);
        } catch (DataAccessException e) {
            throw new StoreException("History recorded but failed to update schedule of asset " + asset.getId(), e);
        }
    }
}
