package com.bms.maintenancebackend.service;

import com.bms.maintenancebackend.config.RedisConfig;
import com.bms.maintenancebackend.dto.AssetReliabilityMetrics;
import com.bms.maintenancebackend.exception.NotFoundException;
import com.bms.maintenancebackend.exception.ValidationException;
import com.bms.maintenancebackend.model.Asset;
import com.bms.maintenancebackend.model.MaintenanceHistory;
import com.bms.maintenancebackend.model.MaintenanceSchedule;
import com.bms.maintenancebackend.repository.AssetRepository;
import com.bms.maintenancebackend.repository.MaintenanceHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;

/**
 * Reliability indicators computed from an asset's maintenance history over a trailing window.
 * Results are cached per asset and period; recording new history evicts them.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AssetReliabilityService {

    public static final int DEFAULT_PERIOD_MONTHS = 12;

    private final AssetRepository assetRepository;
    private final MaintenanceHistoryRepository historyRepository;
    private final Clock clock;

    @Cacheable(value = RedisConfig.ASSET_RELIABILITY_CACHE,
            key = "#organizationId + ':' + #assetId + ':' + #periodMonths")
    public AssetReliabilityMetrics calculateAssetReliability(String assetId, String organizationId, int periodMonths) {
        if (periodMonths <= 0) {
            throw new ValidationException("periodMonths", "Period must be at least one month");
        }
        Asset asset = assetRepository.findByIdAndOrganizationId(assetId, organizationId)
                .orElseThrow(() -> new NotFoundException("Asset", assetId));

        LocalDateTime end = LocalDateTime.now(clock);
        LocalDateTime start = end.minusMonths(periodMonths);
        // Newest first
        List<MaintenanceHistory> history = historyRepository
                .findByOrganizationIdAndAssetIdAndPerformedDateBetweenOrderByPerformedDateDesc(organizationId, assetId, start, end);

        log.debug("📊 Computing reliability for asset {} from {} history entries", assetId, history.size());

        int count = history.size();
        double totalDowntime = history.stream()
                .map(MaintenanceHistory::getDowntimeHours)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .sum();
        double totalCost = history.stream()
                .map(MaintenanceHistory::getCost)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .sum();

        Double averageDaysBetween = null;
        if (count > 1) {
            long spanDays = ChronoUnit.DAYS.between(history.get(count - 1).getPerformedDate(), history.get(0).getPerformedDate());
            averageDaysBetween = (double) spanDays / (count - 1);
        }

        MaintenanceSchedule schedule = asset.getMaintenanceSchedule();
        LocalDateTime lastMaintenance = count > 0
                ? history.get(0).getPerformedDate()
                : (schedule == null ? null : schedule.getLastMaintenanceDate());
        LocalDateTime nextDue = count > 0 && history.get(0).getNextMaintenanceDue() != null
                ? history.get(0).getNextMaintenanceDue()
                : (schedule == null ? null : schedule.getNextMaintenanceDate());

        return AssetReliabilityMetrics.builder()
                .assetId(assetId)
                .periodMonths(periodMonths)
                .maintenanceFrequency(count)
                .averageDaysBetweenMaintenance(averageDaysBetween)
                .totalDowntimeHours(totalDowntime)
                .averageDowntimeHours(count > 0 ? totalDowntime / count : null)
                .totalMaintenanceCost(totalCost)
                .averageCostPerMaintenance(count > 0 ? totalCost / count : null)
                .lastMaintenanceDate(lastMaintenance)
                .daysSinceLastMaintenance(lastMaintenance == null ? null : ChronoUnit.DAYS.between(lastMaintenance, end))
                .nextMaintenanceDue(nextDue)
                .daysUntilNextMaintenance(nextDue == null ? null : ChronoUnit.DAYS.between(end, nextDue))
                .preventiveCount(countOf(history, MaintenanceHistory.MaintenanceType.PREVENTIVE))
                .correctiveCount(countOf(history, MaintenanceHistory.MaintenanceType.CORRECTIVE))
                .emergencyCount(countOf(history, MaintenanceHistory.MaintenanceType.EMERGENCY))
                .build();
    }

    private int countOf(List<MaintenanceHistory> history, MaintenanceHistory.MaintenanceType type) {
        return (int) history.stream().filter(h -> h.getMaintenanceType() == type).count();
    }
}
