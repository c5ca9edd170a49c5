package com.bms.maintenancebackend.model;

public enum WorkOrderPriority {
    LOW,
    MEDIUM,
    HIGH,
    URGENT
}
