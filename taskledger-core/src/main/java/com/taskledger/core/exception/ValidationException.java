package com.taskledger.core.exception;

/**
 * Thrown when a command carries malformed input.
 * Raised before any event is written.
 */
public class ValidationException extends TaskLedgerException {
    
    public static final String ERROR_CODE = "VALIDATION_FAILED";
    
    public ValidationException(String message) {
        super(ERROR_CODE, message);
    }
    
    public ValidationException(String field, String reason) {
        super(ERROR_CODE, String.format("Invalid %s: %s", field, reason));
    }
}
