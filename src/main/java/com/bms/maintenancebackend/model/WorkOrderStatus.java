package com.bms.maintenancebackend.model;

import java.util.EnumSet;
import java.util.Set;

public enum WorkOrderStatus {
    OPEN,
    ASSIGNED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    public Set<WorkOrderStatus> allowedTransitions() {
        switch (this) {
            case OPEN:
                return EnumSet.of(ASSIGNED, IN_PROGRESS, CANCELLED);
            case ASSIGNED:
                return EnumSet.of(IN_PROGRESS, CANCELLED);
            case IN_PROGRESS:
                return EnumSet.of(COMPLETED, CANCELLED);
            default:
                return EnumSet.noneOf(WorkOrderStatus.class);
        }
    }

    public boolean canTransitionTo(WorkOrderStatus target) {
        return allowedTransitions().contains(target);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
