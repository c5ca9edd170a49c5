package com.bms.maintenancebackend.exception;

public class ValidationException extends MaintenanceException {

    private final String field;

    public ValidationException(String field, String message) {
        super("VALIDATION_ERROR", message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
