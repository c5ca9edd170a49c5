package com.bms.maintenancebackend.maintenance;

import com.bms.maintenancebackend.model.MaintenanceFrequency;
import com.bms.maintenancebackend.model.MaintenanceSchedule;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Turns asset schedule metadata into a structured frequency and a next due date.
 * Stateless; every method is a pure function of its arguments.
 */
@Component
public class ScheduleResolver {

    public MaintenanceFrequency resolveFrequency(String label) {
        return FrequencyLabel.parse(label).toFrequency();
    }

    /**
     * Next due date for an asset schedule. Precedence:
     * <ol>
     *     <li>{@code nextMaintenanceDate}, verbatim, when set</li>
     *     <li>{@code lastMaintenanceDate} plus the resolved interval</li>
     *     <li>{@code now} plus the resolved interval</li>
     * </ol>
     */
    public LocalDateTime computeNextDue(MaintenanceSchedule schedule, LocalDateTime now) {
        if (schedule == null) {
            return advance(now, resolveFrequency(null));
        }
        if (schedule.getNextMaintenanceDate() != null) {
            return schedule.getNextMaintenanceDate();
        }
        MaintenanceFrequency frequency = resolveFrequency(schedule.getFrequency());
        if (schedule.getLastMaintenanceDate() != null) {
            return advance(schedule.getLastMaintenanceDate(), frequency);
        }
        return advance(now, frequency);
    }

    public LocalDateTime advance(LocalDateTime from, MaintenanceFrequency frequency) {
        int interval = frequency.getInterval();
        switch (frequency.getUnit()) {
            case DAYS:
                return from.plusDays(interval);
            case WEEKS:
                return from.plusWeeks(interval);
            case MONTHS:
            default:
                return from.plusMonths(interval);
        }
    }
}
