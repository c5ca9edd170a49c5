package com.bms.maintenancebackend.model;

public enum FrequencyUnit {
    DAYS,
    WEEKS,
    MONTHS
}
