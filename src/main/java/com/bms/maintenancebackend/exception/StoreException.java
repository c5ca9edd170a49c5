package com.bms.maintenancebackend.exception;

/**
 * Persistence failure that the engine cannot classify further.
 */
public class StoreException extends MaintenanceException {

    public StoreException(String message, Throwable cause) {
        super("STORE_ERROR", message, cause);
    }
}
