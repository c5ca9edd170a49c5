package com.bms.maintenancebackend.exception;

/**
 * Base type for errors raised by the maintenance engine.
 */
public class MaintenanceException extends RuntimeException {

    private final String errorCode;

    public MaintenanceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public MaintenanceException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
