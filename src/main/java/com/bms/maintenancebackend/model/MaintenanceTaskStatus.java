package com.bms.maintenancebackend.model;

public enum MaintenanceTaskStatus {
    SCHEDULED,
    DUE,
    OVERDUE,
    COMPLETED,
    CANCELLED;

    public boolean isClosed() {
        return this == COMPLETED || this == CANCELLED;
    }
}
