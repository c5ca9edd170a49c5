package com.bms.maintenancebackend.exception;

public class InvalidStateException extends MaintenanceException {

    public InvalidStateException(String message) {
        super("INVALID_STATE", message);
    }
}
