package com.bms.maintenancebackend.model;

public enum WorkOrderCategory {
    PLUMBING,
    ELECTRICAL,
    HVAC,
    CLEANING,
    SECURITY,
    OTHER
}
