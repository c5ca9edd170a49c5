package com.bms.maintenancebackend.maintenance;

import com.bms.maintenancebackend.model.FrequencyUnit;
import com.bms.maintenancebackend.model.MaintenanceFrequency;

import java.util.Locale;

/**
 * Recognized maintenance frequency labels.
 * <p>
 * Asset schedules carry a free-text label ("monthly", "quarterly maintenance", "annual check").
 * {@link #parse(String)} maps any label onto one of these constants by case-insensitive keyword
 * match and never fails: labels that match nothing are {@link #MONTHLY}.
 */
public enum FrequencyLabel {
    DAILY(1, FrequencyUnit.DAYS),
    WEEKLY(1, FrequencyUnit.WEEKS),
    MONTHLY(1, FrequencyUnit.MONTHS),
    QUARTERLY(3, FrequencyUnit.MONTHS),
    ANNUAL(12, FrequencyUnit.MONTHS);

    public static final FrequencyLabel DEFAULT = MONTHLY;

    private final int interval;
    private final FrequencyUnit unit;

    FrequencyLabel(int interval, FrequencyUnit unit) {
        this.interval = interval;
        this.unit = unit;
    }

    public static FrequencyLabel parse(String label) {
        if (label == null || label.isBlank()) {
            return DEFAULT;
        }
        String normalized = label.toLowerCase(Locale.ROOT);

        // "month" wins over the other keywords: "every 3 months (quarterly)" is quarterly, not daily
        if (normalized.contains("month")) {
            if (normalized.contains("quarter")) {
                return QUARTERLY;
            }
            if (isAnnual(normalized)) {
                return ANNUAL;
            }
            return MONTHLY;
        }
        if (normalized.contains("week")) {
            return WEEKLY;
        }
        if (normalized.contains("day") || normalized.contains("daily")) {
            return DAILY;
        }
        if (normalized.contains("quarter")) {
            return QUARTERLY;
        }
        if (isAnnual(normalized)) {
            return ANNUAL;
        }
        return DEFAULT;
    }

    private static boolean isAnnual(String normalized) {
        return normalized.contains("annual") || normalized.contains("year");
    }

    public int getInterval() {
        return interval;
    }

    public FrequencyUnit getUnit() {
        return unit;
    }

    public MaintenanceFrequency toFrequency() {
        return new MaintenanceFrequency(interval, unit);
    }
}
