package com.taskledger.core.exception;

/**
 * Base exception for all task ledger errors.
 */
public class TaskLedgerException extends RuntimeException {
    
    private final String errorCode;
    
    public TaskLedgerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public TaskLedgerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
