package com.bms.maintenancebackend.maintenance;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * At most one maintenance pass per organization at a time within this process.
 * A caller that finds the organization busy gets an empty result instead of waiting.
 */
@Component
public class OrganizationRunLock {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> Optional<T> runExclusive(String organizationId, Supplier<T> work) {
        ReentrantLock lock = locks.computeIfAbsent(organizationId, id -> new ReentrantLock());
        if (!lock.tryLock()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(work.get());
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning(String organizationId) {
        ReentrantLock lock = locks.get(organizationId);
        return lock != null && lock.isLocked();
    }
}
