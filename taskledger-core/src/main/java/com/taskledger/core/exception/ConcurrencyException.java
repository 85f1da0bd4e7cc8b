package com.taskledger.core.exception;

/**
 * Thrown when a write could not be serialized within its bound.
 * Callers may retry.
 */
public class ConcurrencyException extends TaskLedgerException {
    
    public static final String ERROR_CODE = "CONCURRENCY_CONFLICT";
    
    public ConcurrencyException(String message) {
        super(ERROR_CODE, message);
    }
    
    public ConcurrencyException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
